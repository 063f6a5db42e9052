package io.b2mash.b2b.accessaudit.terminal;

import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogCategory;
import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogMirrorListener;
import io.b2mash.b2b.accessaudit.audit.mirror.MirroredRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A command typed during a {@link TerminalSession}. Immutable. */
@Entity
@Table(name = "session_commands")
@EntityListeners(AuditLogMirrorListener.class)
public class SessionCommand implements MirroredRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "username", nullable = false, length = 128, updatable = false)
  private String user;

  @Column(name = "asset", nullable = false, length = 128, updatable = false)
  private String asset;

  @Column(name = "account", nullable = false, length = 128, updatable = false)
  private String account;

  @Column(name = "input", nullable = false, length = 128, updatable = false)
  private String input;

  @Column(name = "risk_level", nullable = false, updatable = false)
  private int riskLevel;

  @Column(name = "session_id", nullable = false, updatable = false)
  private UUID sessionId;

  @Column(name = "timestamp", nullable = false, updatable = false)
  private Instant timestamp;

  @Column(name = "org_id", nullable = false, length = 64, updatable = false)
  private String tenantId;

  protected SessionCommand() {}

  public SessionCommand(
      TerminalSession session, String input, int riskLevel, Instant timestamp) {
    this.user = session.getUser();
    this.asset = session.getAsset();
    this.account = session.getAccount();
    this.input = input;
    this.riskLevel = riskLevel;
    this.sessionId = session.getId();
    this.timestamp = timestamp;
    this.tenantId = session.getTenantId();
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public AuditLogCategory mirrorCategory() {
    return AuditLogCategory.SESSION_COMMAND_LOG;
  }

  public String getUser() {
    return user;
  }

  public String getAsset() {
    return asset;
  }

  public String getAccount() {
    return account;
  }

  public String getInput() {
    return input;
  }

  public int getRiskLevel() {
    return riskLevel;
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public String getTenantId() {
    return tenantId;
  }
}
