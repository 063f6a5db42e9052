package io.b2mash.b2b.accessaudit.asset;

import io.b2mash.b2b.accessaudit.store.AuditableEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

/**
 * Node of the asset tree. {@code key} encodes the position ({@code 1:3:2}), {@code value} is the
 * label shown to users.
 */
@Entity
@Table(name = "nodes")
public class Node implements AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "node_key", nullable = false, length = 64)
  private String key;

  @Column(name = "value", nullable = false, length = 128)
  private String value;

  @Column(name = "tenant_id", nullable = false, length = 64)
  private String tenantId;

  protected Node() {}

  public Node(String key, String value, String tenantId) {
    this.key = key;
    this.value = value;
    this.tenantId = tenantId;
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public String getDisplayName() {
    return value;
  }

  public String getKey() {
    return key;
  }

  public String getValue() {
    return value;
  }

  public String getTenantId() {
    return tenantId;
  }
}
