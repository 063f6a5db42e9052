package io.b2mash.b2b.accessaudit.identity;

import io.b2mash.b2b.accessaudit.store.AuditableEntity;
import io.b2mash.b2b.accessaudit.store.RelationDescriptor;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

/** Platform user. Users are global; group memberships scope them into tenants. */
@Entity
@Table(name = "users")
public class User implements AuditableEntity {

  /** Field name reported when only the last-login timestamp is touched. */
  public static final String LAST_LOGIN_FIELD = "lastLogin";

  public static final RelationDescriptor<User, UserGroup> GROUPS =
      new RelationDescriptor<>("User.groups", User.class, UserGroup.class, User::getGroups);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "username", nullable = false, unique = true, length = 128)
  private String username;

  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "password_hash", length = 255)
  private String passwordHash;

  @Column(name = "mfa_enabled", nullable = false)
  private boolean mfaEnabled;

  @Enumerated(EnumType.STRING)
  @Column(name = "source", nullable = false, length = 20)
  private UserSource source;

  @Column(name = "is_active", nullable = false)
  private boolean active = true;

  @Column(name = "last_login")
  private Instant lastLogin;

  @Column(name = "date_password_last_updated")
  private Instant passwordUpdatedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @ManyToMany
  @JoinTable(
      name = "users_groups",
      joinColumns = @JoinColumn(name = "user_id"),
      inverseJoinColumns = @JoinColumn(name = "usergroup_id"))
  private Set<UserGroup> groups = new HashSet<>();

  protected User() {}

  public User(String username, String name, String email, UserSource source) {
    this.username = username;
    this.name = name;
    this.email = email;
    this.source = source;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Display form shared by users and user references: {@code name(username)}. */
  public static String displayName(String name, String username) {
    return name + "(" + username + ")";
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public String getDisplayName() {
    return displayName(name, username);
  }

  public String getUsername() {
    return username;
  }

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public String getPasswordHash() {
    return passwordHash;
  }

  public boolean isMfaEnabled() {
    return mfaEnabled;
  }

  public UserSource getSource() {
    return source;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getLastLogin() {
    return lastLogin;
  }

  public Instant getPasswordUpdatedAt() {
    return passwordUpdatedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Set<UserGroup> getGroups() {
    return groups;
  }

  public void updateProfile(String name, String email, boolean mfaEnabled) {
    this.name = name;
    this.email = email;
    this.mfaEnabled = mfaEnabled;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public void changePasswordHash(String passwordHash) {
    this.passwordHash = passwordHash;
    this.passwordUpdatedAt = Instant.now();
    this.updatedAt = this.passwordUpdatedAt;
  }

  /** Touches only {@code lastLogin}; {@code updatedAt} is left alone. */
  public void markLoggedIn(Instant at) {
    this.lastLogin = at;
  }
}
