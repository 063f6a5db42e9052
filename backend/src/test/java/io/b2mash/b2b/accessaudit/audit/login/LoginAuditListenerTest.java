package io.b2mash.b2b.accessaudit.audit.login;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import io.b2mash.b2b.accessaudit.audit.AuditLogWriter;
import io.b2mash.b2b.accessaudit.context.RequestContext;
import io.b2mash.b2b.accessaudit.context.UserRef;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.support.StaticMessageSource;

@ExtendWith(MockitoExtension.class)
class LoginAuditListenerTest {

  @Mock private AuditLogWriter writer;
  @Mock private UnusualLoginChecker unusualLoginChecker;
  @Captor private ArgumentCaptor<UserLoginLog> logCaptor;

  private LoginAuditListener listener;
  private UserRef alice;

  @BeforeEach
  void setUp() {
    var messages = new StaticMessageSource();
    messages.addMessage("auth.backend.password", Locale.ENGLISH, "Password");
    messages.addMessage("user.source.ldap", Locale.ENGLISH, "LDAP/AD");
    listener =
        new LoginAuditListener(
            writer, AuthBackendLabelMapping.create(messages, Locale.ENGLISH), unusualLoginChecker);
    alice = new UserRef(UUID.randomUUID(), "alice", "Alice", true);
  }

  @Test
  void onAuthSuccess_writesSuccessfulWebLogin() {
    var request =
        RequestContext.of(
            "10.0.0.1", Map.of("X-Forwarded-For", "203.0.113.7", "User-Agent", "Mozilla/5.0"));
    request.session().setAttribute("auth_backend", "password");

    listener.onAuthSuccess(new AuthSucceededEvent(alice, true, request, null));

    verify(writer).writeLoginLog(logCaptor.capture());
    var log = logCaptor.getValue();
    assertThat(log.getUsername()).isEqualTo("alice");
    assertThat(log.getIp()).isEqualTo("203.0.113.7");
    assertThat(log.getType()).isEqualTo(LoginType.WEB);
    assertThat(log.getUserAgent()).isEqualTo("Mozilla/5.0");
    assertThat(log.getBackend()).isEqualTo("Password");
    assertThat(log.getMfa()).isEqualTo(MfaStatus.ENABLED);
    assertThat(log.isStatus()).isTrue();
    assertThat(log.getReason()).isEmpty();
  }

  @Test
  void onAuthSuccess_checksUnusualLocationBeforeWriting() {
    var request = RequestContext.of("198.51.100.4", Map.of());

    listener.onAuthSuccess(new AuthSucceededEvent(alice, false, request, LoginType.WEB));

    var order = inOrder(unusualLoginChecker, writer);
    order.verify(unusualLoginChecker).checkUnusualLocation(alice, "198.51.100.4");
    order.verify(writer).writeLoginLog(any(UserLoginLog.class));
  }

  @Test
  void onAuthSuccess_checkerFailureDoesNotBlockLogin() {
    doThrow(new IllegalStateException("geo lookup down"))
        .when(unusualLoginChecker)
        .checkUnusualLocation(any(), anyString());

    listener.onAuthSuccess(
        new AuthSucceededEvent(alice, false, RequestContext.of("10.0.0.1", Map.of()), null));

    verify(writer).writeLoginLog(logCaptor.capture());
    assertThat(logCaptor.getValue().isStatus()).isTrue();
    assertThat(logCaptor.getValue().getMfa()).isEqualTo(MfaStatus.DISABLED);
  }

  @Test
  void onAuthSuccess_storesLoginTimeInSession() {
    var request = RequestContext.of("10.0.0.1", Map.of());

    listener.onAuthSuccess(new AuthSucceededEvent(alice, false, request, null));

    assertThat(request.session().getAttribute("login_time"))
        .asString()
        .matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}");
  }

  @Test
  void onAuthSuccess_apiRequestReadsLoginTypeHeader() {
    var request = RequestContext.api("10.0.0.1", Map.of("X-JMS-LOGIN-TYPE", "T"));

    listener.onAuthSuccess(new AuthSucceededEvent(alice, false, request, null));

    verify(writer).writeLoginLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getType()).isEqualTo(LoginType.TERMINAL);
  }

  @Test
  void onAuthSuccess_apiRequestWithoutHeaderIsUnknown() {
    var request = RequestContext.api("10.0.0.1", Map.of());

    listener.onAuthSuccess(new AuthSucceededEvent(alice, false, request, null));

    verify(writer).writeLoginLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getType()).isEqualTo(LoginType.UNKNOWN);
  }

  @Test
  void onAuthSuccess_explicitLoginTypeWins() {
    var request = RequestContext.api("10.0.0.1", Map.of("X-JMS-LOGIN-TYPE", "W"));

    listener.onAuthSuccess(new AuthSucceededEvent(alice, false, request, LoginType.TERMINAL));

    verify(writer).writeLoginLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getType()).isEqualTo(LoginType.TERMINAL);
  }

  @Test
  void onAuthSuccess_withoutAddressUsesPlaceholderIp() {
    listener.onAuthSuccess(new AuthSucceededEvent(alice, false, null, null));

    verify(writer).writeLoginLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getIp()).isEqualTo("0.0.0.0");
    assertThat(logCaptor.getValue().getBackend()).isEmpty();
  }

  @Test
  void onAuthFailed_writesFailedAttemptWithTruncatedReason() {
    var request = RequestContext.of("10.0.0.1", Map.of("User-Agent", "curl/8.0"));
    request.session().setAttribute("_auth_user_backend", "ldap");

    listener.onAuthFailed(new AuthFailedEvent("mallory", request, "x".repeat(300)));

    verify(writer).writeLoginLog(logCaptor.capture());
    var log = logCaptor.getValue();
    assertThat(log.getUsername()).isEqualTo("mallory");
    assertThat(log.isStatus()).isFalse();
    assertThat(log.getReason()).isEqualTo("x".repeat(128));
    assertThat(log.getMfa()).isEqualTo(MfaStatus.UNKNOWN);
    assertThat(log.getBackend()).isEqualTo("LDAP/AD");
    verifyNoInteractions(unusualLoginChecker);
  }

  @Test
  void onAuthFailed_typedUsernameAndForwardedAddressAreCutToColumnWidth() {
    var request = RequestContext.of("10.0.0.1", Map.of("X-Forwarded-For", "5".repeat(300)));

    listener.onAuthFailed(new AuthFailedEvent("m".repeat(500), request, "bad password"));

    verify(writer).writeLoginLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getUsername()).isEqualTo("m".repeat(128));
    assertThat(logCaptor.getValue().getIp()).hasSize(128);
  }

  @Test
  void onAuthFailed_nullReasonBecomesEmpty() {
    listener.onAuthFailed(
        new AuthFailedEvent("mallory", RequestContext.of("10.0.0.1", Map.of()), null));

    verify(writer).writeLoginLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getReason()).isEmpty();
  }

  @Test
  void onAuthFailed_unknownBackendHasEmptyLabel() {
    var request = RequestContext.of("10.0.0.1", Map.of());
    request.session().setAttribute("auth_backend", "kerberos");

    listener.onAuthFailed(new AuthFailedEvent("mallory", request, "bad password"));

    verify(writer).writeLoginLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getBackend()).isEmpty();
  }

  @Test
  void onAuthSuccess_longUserAgentIsCappedAt255() {
    var request = RequestContext.of("10.0.0.1", Map.of("User-Agent", "a".repeat(400)));

    listener.onAuthSuccess(new AuthSucceededEvent(alice, false, request, null));

    verify(writer).writeLoginLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getUserAgent()).hasSize(255);
  }
}
