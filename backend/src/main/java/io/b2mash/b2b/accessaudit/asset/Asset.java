package io.b2mash.b2b.accessaudit.asset;

import io.b2mash.b2b.accessaudit.store.AuditableEntity;
import io.b2mash.b2b.accessaudit.store.RelationDescriptor;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Inheritance;
import jakarta.persistence.InheritanceType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Managed asset. Concrete kinds ({@link Host}) extend it; relations and audit records always refer
 * to the base type.
 */
@Entity
@Table(name = "assets")
@Inheritance(strategy = InheritanceType.JOINED)
public class Asset implements AuditableEntity {

  public static final RelationDescriptor<Asset, Node> NODES =
      new RelationDescriptor<>("Asset.nodes", Asset.class, Node.class, Asset::getNodes);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Column(name = "address", nullable = false, length = 767)
  private String address;

  @Column(name = "is_active", nullable = false)
  private boolean active = true;

  @Column(name = "tenant_id", nullable = false, length = 64)
  private String tenantId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @ManyToMany
  @JoinTable(
      name = "assets_nodes",
      joinColumns = @JoinColumn(name = "asset_id"),
      inverseJoinColumns = @JoinColumn(name = "node_id"))
  private Set<Node> nodes = new HashSet<>();

  protected Asset() {}

  public Asset(String name, String address, String tenantId) {
    this.name = name;
    this.address = address;
    this.tenantId = tenantId;
    this.createdAt = Instant.now();
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public String getDisplayName() {
    return name + "(" + address + ")";
  }

  public String getName() {
    return name;
  }

  public String getAddress() {
    return address;
  }

  public boolean isActive() {
    return active;
  }

  public String getTenantId() {
    return tenantId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Set<Node> getNodes() {
    return nodes;
  }

  public void changeAddress(String address) {
    this.address = address;
  }
}
