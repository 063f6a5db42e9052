package io.b2mash.b2b.accessaudit.audit;

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

/** One password change: whose password, who changed it, and from where. Immutable. */
@Entity
@Table(name = "password_change_logs")
@EntityListeners(AuditLogMirrorListener.class)
public class PasswordChangeLog implements MirroredRecord {

  /** {@code changeBy} value for changes made without a request. */
  public static final String SYSTEM_ACTOR = "System";

  /** {@code remoteAddr} value for changes made without a request. */
  public static final String LOCAL_ADDRESS = "127.0.0.1";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "username", nullable = false, length = 128, updatable = false)
  private String user;

  @Column(name = "change_by", nullable = false, length = 128, updatable = false)
  private String changeBy;

  @Column(name = "remote_addr", length = 128, updatable = false)
  private String remoteAddr;

  @Column(name = "org_id", nullable = false, length = 64, updatable = false)
  private String tenantId;

  @Column(name = "datetime", nullable = false, updatable = false)
  private Instant datetime;

  protected PasswordChangeLog() {}

  /** Builds a record stamped with the current instant; long text is truncated to its column. */
  public PasswordChangeLog(String user, String changeBy, String remoteAddr, String tenantId) {
    this.user = AuditText.truncate(user, AuditText.USER_MAX_LENGTH);
    this.changeBy = AuditText.truncate(changeBy, AuditText.USER_MAX_LENGTH);
    this.remoteAddr = AuditText.truncate(remoteAddr, AuditText.REMOTE_ADDR_MAX_LENGTH);
    this.tenantId = tenantId;
    this.datetime = Instant.now();
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public AuditLogCategory mirrorCategory() {
    return AuditLogCategory.PASSWORD_CHANGE_LOG;
  }

  public String getUser() {
    return user;
  }

  public String getChangeBy() {
    return changeBy;
  }

  public String getRemoteAddr() {
    return remoteAddr;
  }

  public String getTenantId() {
    return tenantId;
  }

  public Instant getDatetime() {
    return datetime;
  }
}
