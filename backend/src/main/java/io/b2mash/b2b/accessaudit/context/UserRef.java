package io.b2mash.b2b.accessaudit.context;

import io.b2mash.b2b.accessaudit.identity.User;
import java.util.UUID;

/**
 * Lightweight reference to the acting user carried inside an {@link AuditContext}. Never a JPA
 * entity, so it stays valid after the persistence context that produced it is closed.
 *
 * @param id user id; null for principals not backed by a {@link User} row
 * @param username login name
 * @param name human-readable name
 * @param authenticated false for anonymous principals
 */
public record UserRef(UUID id, String username, String name, boolean authenticated) {

  public static UserRef of(User user) {
    return new UserRef(user.getId(), user.getUsername(), user.getName(), true);
  }

  public static UserRef anonymous(String username) {
    return new UserRef(null, username, username, false);
  }

  /** Display form stored in audit records, e.g. {@code Alice(alice)}. */
  public String display() {
    return User.displayName(name, username);
  }
}
