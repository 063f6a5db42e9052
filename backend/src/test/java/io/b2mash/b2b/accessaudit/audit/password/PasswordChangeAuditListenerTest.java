package io.b2mash.b2b.accessaudit.audit.password;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.accessaudit.audit.AuditLogWriter;
import io.b2mash.b2b.accessaudit.audit.PasswordChangeLog;
import io.b2mash.b2b.accessaudit.config.AuditProperties;
import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.context.ContextResolver;
import io.b2mash.b2b.accessaudit.context.RequestContext;
import io.b2mash.b2b.accessaudit.context.UserRef;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class PasswordChangeAuditListenerTest {

  private static final String DEFAULT_TENANT = "default-tenant";

  @Mock private AuditLogWriter writer;
  @Captor private ArgumentCaptor<PasswordChangeLog> logCaptor;

  private PasswordChangeAuditListener listener;
  private UserRef alice;

  @BeforeEach
  void setUp() {
    listener =
        new PasswordChangeAuditListener(
            writer, new ContextResolver(), new AuditProperties(DEFAULT_TENANT, null, null));
    alice = new UserRef(UUID.randomUUID(), "alice", "Alice", true);
  }

  @Test
  void onPasswordChanged_withoutContextIsAttributedToSystem() {
    listener.onPasswordChanged(new PasswordChangedEvent(alice, AuditContext.empty()));

    verify(writer).writePasswordChangeLog(logCaptor.capture());
    var log = logCaptor.getValue();
    assertThat(log.getUser()).isEqualTo("Alice(alice)");
    assertThat(log.getChangeBy()).isEqualTo("System");
    assertThat(log.getRemoteAddr()).isEqualTo("127.0.0.1");
    assertThat(log.getTenantId()).isEqualTo(DEFAULT_TENANT);
  }

  @Test
  void onPasswordChanged_backgroundTenantIsKept() {
    listener.onPasswordChanged(new PasswordChangedEvent(alice, AuditContext.background("t-7")));

    verify(writer).writePasswordChangeLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getChangeBy()).isEqualTo("System");
    assertThat(logCaptor.getValue().getTenantId()).isEqualTo("t-7");
  }

  @Test
  void onPasswordChanged_adminChangeIsAttributedToAdmin() {
    var admin = new UserRef(UUID.randomUUID(), "admin", "Administrator", true);
    var context =
        AuditContext.of(
            admin, "tenant-1", RequestContext.of("10.0.0.1", Map.of("X-Real-IP", "192.0.2.44")));

    listener.onPasswordChanged(new PasswordChangedEvent(alice, context));

    verify(writer).writePasswordChangeLog(logCaptor.capture());
    var log = logCaptor.getValue();
    assertThat(log.getUser()).isEqualTo("Alice(alice)");
    assertThat(log.getChangeBy()).isEqualTo("Administrator(admin)");
    assertThat(log.getRemoteAddr()).isEqualTo("192.0.2.44");
    assertThat(log.getTenantId()).isEqualTo("tenant-1");
  }

  @Test
  void onPasswordChanged_adminChangeWithoutRequestUsesLoopbackAddress() {
    var admin = new UserRef(UUID.randomUUID(), "admin", "Administrator", true);

    listener.onPasswordChanged(
        new PasswordChangedEvent(alice, AuditContext.of(admin, "tenant-1", null)));

    verify(writer).writePasswordChangeLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getChangeBy()).isEqualTo("Administrator(admin)");
    assertThat(logCaptor.getValue().getRemoteAddr()).isEqualTo("127.0.0.1");
  }

  @Test
  void onPasswordChanged_longNamesAreCutToColumnWidth() {
    var longAdmin = new UserRef(UUID.randomUUID(), "a".repeat(128), "N".repeat(128), true);
    var context =
        AuditContext.of(
            longAdmin,
            "tenant-1",
            RequestContext.of("10.0.0.1", Map.of("X-Forwarded-For", "9".repeat(300))));

    listener.onPasswordChanged(new PasswordChangedEvent(alice, context));

    verify(writer).writePasswordChangeLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getChangeBy()).hasSize(128).startsWith("NNN");
    assertThat(logCaptor.getValue().getRemoteAddr()).hasSize(128);
  }

  @Test
  void onPasswordChanged_resetWithoutLoginIsAttributedToSubject() {
    var context =
        AuditContext.of(
            UserRef.anonymous("anonymousUser"), null, RequestContext.of("10.0.0.1", Map.of()));

    listener.onPasswordChanged(new PasswordChangedEvent(alice, context));

    verify(writer).writePasswordChangeLog(logCaptor.capture());
    assertThat(logCaptor.getValue().getChangeBy()).isEqualTo("Alice(alice)");
    assertThat(logCaptor.getValue().getRemoteAddr()).isEqualTo("10.0.0.1");
    assertThat(logCaptor.getValue().getTenantId()).isEqualTo(DEFAULT_TENANT);
  }

  @Test
  void onPasswordChanged_writeFailurePropagates() {
    when(writer.writePasswordChangeLog(any()))
        .thenThrow(new DataIntegrityViolationException("constraint"));

    assertThatThrownBy(
            () ->
                listener.onPasswordChanged(new PasswordChangedEvent(alice, AuditContext.empty())))
        .isInstanceOf(DataIntegrityViolationException.class);
  }
}
