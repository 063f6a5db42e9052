package io.b2mash.b2b.accessaudit.identity;

import io.b2mash.b2b.accessaudit.store.AuditableEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "user_groups")
public class UserGroup implements AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Column(name = "comment", length = 1000)
  private String comment;

  @Column(name = "tenant_id", nullable = false, length = 64)
  private String tenantId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected UserGroup() {}

  public UserGroup(String name, String comment, String tenantId) {
    this.name = name;
    this.comment = comment;
    this.tenantId = tenantId;
    this.createdAt = Instant.now();
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public String getDisplayName() {
    return name;
  }

  public String getName() {
    return name;
  }

  public String getComment() {
    return comment;
  }

  public String getTenantId() {
    return tenantId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
