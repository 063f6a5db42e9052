package io.b2mash.b2b.accessaudit.audit.login;

import io.b2mash.b2b.accessaudit.audit.AuditLogWriter;
import io.b2mash.b2b.accessaudit.context.ClientIpResolver;
import io.b2mash.b2b.accessaudit.context.RequestContext;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Records every authentication attempt as a {@link UserLoginLog}. */
@Component
public class LoginAuditListener {

  private static final Logger log = LoggerFactory.getLogger(LoginAuditListener.class);

  static final String LOGIN_TYPE_HEADER = "X-JMS-LOGIN-TYPE";
  static final String LOGIN_TIME_ATTRIBUTE = "login_time";
  static final String BACKEND_ATTRIBUTE = "auth_backend";
  static final String FALLBACK_BACKEND_ATTRIBUTE = "_auth_user_backend";
  static final String UNKNOWN_IP = "0.0.0.0";

  static final DateTimeFormatter LOGIN_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  private final AuditLogWriter writer;
  private final AuthBackendLabelMapping backendLabels;
  private final UnusualLoginChecker unusualLoginChecker;

  public LoginAuditListener(
      AuditLogWriter writer,
      AuthBackendLabelMapping backendLabels,
      UnusualLoginChecker unusualLoginChecker) {
    this.writer = writer;
    this.backendLabels = backendLabels;
    this.unusualLoginChecker = unusualLoginChecker;
  }

  @EventListener
  public void onAuthSuccess(AuthSucceededEvent event) {
    var request = event.request();
    String ip = clientIp(request);
    try {
      unusualLoginChecker.checkUnusualLocation(event.user(), ip);
    } catch (RuntimeException e) {
      log.warn("Unusual login check failed for username={}", event.user().username(), e);
    }

    Instant now = Instant.now();
    if (request != null) {
      request.session().setAttribute(LOGIN_TIME_ATTRIBUTE, LOGIN_TIME_FORMAT.format(now));
    }
    writer.writeLoginLog(
        new UserLoginLog(
            event.user().username(),
            ip,
            loginType(event.loginType(), request),
            userAgent(request),
            now,
            backendLabel(request),
            MfaStatus.of(event.mfaEnabled()),
            true,
            ""));
  }

  @EventListener
  public void onAuthFailed(AuthFailedEvent event) {
    var request = event.request();
    writer.writeLoginLog(
        new UserLoginLog(
            event.username(),
            clientIp(request),
            loginType(null, request),
            userAgent(request),
            Instant.now(),
            backendLabel(request),
            MfaStatus.UNKNOWN,
            false,
            event.reason() != null ? event.reason() : ""));
  }

  /** Explicit type wins; API requests read the header (default unknown); otherwise web. */
  static LoginType loginType(LoginType explicit, RequestContext request) {
    if (explicit != null) {
      return explicit;
    }
    if (request != null && request.apiRequest()) {
      return LoginType.fromCode(request.header(LOGIN_TYPE_HEADER));
    }
    return LoginType.WEB;
  }

  private String backendLabel(RequestContext request) {
    if (request == null) {
      return "";
    }
    var session = request.session();
    String backend =
        session.getString(
            BACKEND_ATTRIBUTE, session.getString(FALLBACK_BACKEND_ATTRIBUTE, null));
    return backendLabels.labelFor(backend);
  }

  private static String clientIp(RequestContext request) {
    String ip = ClientIpResolver.resolve(request);
    return ip == null || ip.isEmpty() ? UNKNOWN_IP : ip;
  }

  private static String userAgent(RequestContext request) {
    if (request == null) {
      return "";
    }
    String agent = request.header("User-Agent");
    return agent != null ? agent : "";
  }
}
