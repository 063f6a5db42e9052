package io.b2mash.b2b.accessaudit.permission;

import io.b2mash.b2b.accessaudit.asset.Asset;
import io.b2mash.b2b.accessaudit.asset.Node;
import io.b2mash.b2b.accessaudit.identity.User;
import io.b2mash.b2b.accessaudit.identity.UserGroup;
import io.b2mash.b2b.accessaudit.store.AuditableEntity;
import io.b2mash.b2b.accessaudit.store.RelationDescriptor;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Grants users and user groups access to assets, directly or through asset tree nodes. Each of the
 * four memberships is an audited relation.
 */
@Entity
@Table(name = "asset_permissions")
public class AssetPermission implements AuditableEntity {

  public static final RelationDescriptor<AssetPermission, User> USERS =
      new RelationDescriptor<>(
          "AssetPermission.users", AssetPermission.class, User.class, AssetPermission::getUsers);

  public static final RelationDescriptor<AssetPermission, UserGroup> USER_GROUPS =
      new RelationDescriptor<>(
          "AssetPermission.userGroups",
          AssetPermission.class,
          UserGroup.class,
          AssetPermission::getUserGroups);

  public static final RelationDescriptor<AssetPermission, Asset> ASSETS =
      new RelationDescriptor<>(
          "AssetPermission.assets", AssetPermission.class, Asset.class, AssetPermission::getAssets);

  public static final RelationDescriptor<AssetPermission, Node> NODES =
      new RelationDescriptor<>(
          "AssetPermission.nodes", AssetPermission.class, Node.class, AssetPermission::getNodes);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Column(name = "is_active", nullable = false)
  private boolean active = true;

  @Column(name = "date_expired")
  private Instant expiresAt;

  @Column(name = "tenant_id", nullable = false, length = 64)
  private String tenantId;

  @ManyToMany
  @JoinTable(
      name = "asset_permissions_users",
      joinColumns = @JoinColumn(name = "assetpermission_id"),
      inverseJoinColumns = @JoinColumn(name = "user_id"))
  private Set<User> users = new HashSet<>();

  @ManyToMany
  @JoinTable(
      name = "asset_permissions_user_groups",
      joinColumns = @JoinColumn(name = "assetpermission_id"),
      inverseJoinColumns = @JoinColumn(name = "usergroup_id"))
  private Set<UserGroup> userGroups = new HashSet<>();

  @ManyToMany
  @JoinTable(
      name = "asset_permissions_assets",
      joinColumns = @JoinColumn(name = "assetpermission_id"),
      inverseJoinColumns = @JoinColumn(name = "asset_id"))
  private Set<Asset> assets = new HashSet<>();

  @ManyToMany
  @JoinTable(
      name = "asset_permissions_nodes",
      joinColumns = @JoinColumn(name = "assetpermission_id"),
      inverseJoinColumns = @JoinColumn(name = "node_id"))
  private Set<Node> nodes = new HashSet<>();

  protected AssetPermission() {}

  public AssetPermission(String name, Instant expiresAt, String tenantId) {
    this.name = name;
    this.expiresAt = expiresAt;
    this.tenantId = tenantId;
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

  public boolean isActive() {
    return active;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public String getTenantId() {
    return tenantId;
  }

  public Set<User> getUsers() {
    return users;
  }

  public Set<UserGroup> getUserGroups() {
    return userGroups;
  }

  public Set<Asset> getAssets() {
    return assets;
  }

  public Set<Node> getNodes() {
    return nodes;
  }

  public void extendUntil(Instant expiresAt) {
    this.expiresAt = expiresAt;
  }
}
