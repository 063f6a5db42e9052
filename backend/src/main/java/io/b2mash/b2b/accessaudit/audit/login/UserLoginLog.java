package io.b2mash.b2b.accessaudit.audit.login;

import io.b2mash.b2b.accessaudit.audit.AuditText;
import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogCategory;
import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogMirrorListener;
import io.b2mash.b2b.accessaudit.audit.mirror.MirroredRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One authentication attempt, successful or not. Not tenant-scoped: authentication happens before
 * a tenant is selected.
 */
@Entity
@Table(name = "user_login_logs")
@EntityListeners(AuditLogMirrorListener.class)
public class UserLoginLog implements MirroredRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "username", nullable = false, length = 128, updatable = false)
  private String username;

  @Column(name = "ip", nullable = false, length = 128, updatable = false)
  private String ip;

  @Convert(converter = LoginTypeConverter.class)
  @Column(name = "type", nullable = false, length = 2, updatable = false)
  private LoginType type;

  @Column(name = "user_agent", length = 255, updatable = false)
  private String userAgent;

  @Column(name = "datetime", nullable = false, updatable = false)
  private Instant datetime;

  @Column(name = "backend", length = 32, updatable = false)
  private String backend;

  @Convert(converter = MfaStatusConverter.class)
  @Column(name = "mfa", nullable = false, updatable = false)
  private MfaStatus mfa;

  @Column(name = "status", nullable = false, updatable = false)
  private boolean status;

  @Column(name = "reason", length = 128, updatable = false)
  private String reason;

  protected UserLoginLog() {}

  public UserLoginLog(
      String username,
      String ip,
      LoginType type,
      String userAgent,
      Instant datetime,
      String backend,
      MfaStatus mfa,
      boolean status,
      String reason) {
    this.username = AuditText.truncate(username, AuditText.USER_MAX_LENGTH);
    this.ip = AuditText.truncate(ip, AuditText.REMOTE_ADDR_MAX_LENGTH);
    this.type = type;
    this.userAgent = AuditText.truncate(userAgent, AuditText.USER_AGENT_MAX_LENGTH);
    this.datetime = datetime;
    this.backend = backend;
    this.mfa = mfa;
    this.status = status;
    this.reason = AuditText.truncate(reason, AuditText.REASON_MAX_LENGTH);
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public AuditLogCategory mirrorCategory() {
    return AuditLogCategory.LOGIN_LOG;
  }

  public String getUsername() {
    return username;
  }

  public String getIp() {
    return ip;
  }

  public LoginType getType() {
    return type;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Instant getDatetime() {
    return datetime;
  }

  public String getBackend() {
    return backend;
  }

  public MfaStatus getMfa() {
    return mfa;
  }

  public boolean isStatus() {
    return status;
  }

  public String getReason() {
    return reason;
  }
}
