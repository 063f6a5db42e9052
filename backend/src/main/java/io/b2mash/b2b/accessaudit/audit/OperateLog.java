package io.b2mash.b2b.accessaudit.audit;

import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogCategory;
import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogMirrorListener;
import io.b2mash.b2b.accessaudit.audit.mirror.MirroredRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One create/update/delete performed by an authenticated user, including relation membership
 * changes. Immutable once created: no setters, every column {@code updatable = false}.
 */
@Entity
@Table(
    name = "operate_logs",
    indexes = @Index(name = "idx_operate_logs_tenant_datetime", columnList = "org_id, datetime"))
@EntityListeners(AuditLogMirrorListener.class)
public class OperateLog implements MirroredRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "username", nullable = false, length = 128, updatable = false)
  private String user;

  @Enumerated(EnumType.STRING)
  @Column(name = "action", nullable = false, length = 16, updatable = false)
  private ActionType action;

  @Column(name = "resource_type", nullable = false, length = 64, updatable = false)
  private String resourceType;

  @Column(name = "resource", nullable = false, length = 128, updatable = false)
  private String resource;

  @Column(name = "remote_addr", length = 128, updatable = false)
  private String remoteAddr;

  @Column(name = "org_id", nullable = false, length = 64, updatable = false)
  private String tenantId;

  @Column(name = "datetime", nullable = false, updatable = false)
  private Instant datetime;

  protected OperateLog() {}

  /** Builds a record stamped with the current instant; long text is truncated to its column. */
  public OperateLog(
      String user,
      ActionType action,
      String resourceType,
      String resource,
      String remoteAddr,
      String tenantId) {
    this.user = AuditText.truncate(user, AuditText.USER_MAX_LENGTH);
    this.action = action;
    this.resourceType = AuditText.truncate(resourceType, AuditText.RESOURCE_TYPE_MAX_LENGTH);
    this.resource = AuditText.truncate(resource, AuditText.RESOURCE_MAX_LENGTH);
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
    return AuditLogCategory.OPERATION_LOG;
  }

  public String getUser() {
    return user;
  }

  public ActionType getAction() {
    return action;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResource() {
    return resource;
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
