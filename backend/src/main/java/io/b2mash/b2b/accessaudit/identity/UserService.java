package io.b2mash.b2b.accessaudit.identity;

import io.b2mash.b2b.accessaudit.audit.password.PasswordChangedEvent;
import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.context.UserRef;
import io.b2mash.b2b.accessaudit.exception.InvalidStateException;
import io.b2mash.b2b.accessaudit.exception.ResourceNotFoundException;
import io.b2mash.b2b.accessaudit.store.AuditedEntityStore;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;
  private final UserGroupRepository userGroupRepository;
  private final AuditedEntityStore store;
  private final PasswordEncoder passwordEncoder;
  private final ApplicationEventPublisher eventPublisher;

  public UserService(
      UserRepository userRepository,
      UserGroupRepository userGroupRepository,
      AuditedEntityStore store,
      PasswordEncoder passwordEncoder,
      ApplicationEventPublisher eventPublisher) {
    this.userRepository = userRepository;
    this.userGroupRepository = userGroupRepository;
    this.store = store;
    this.passwordEncoder = passwordEncoder;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public User createUser(
      AuditContext context, String username, String name, String email, UserSource source) {
    if (userRepository.existsByUsername(username)) {
      throw new InvalidStateException(
          "Username already taken", "A user with username " + username + " already exists");
    }
    var user = store.save(context, new User(username, name, email, source));
    log.info("Created user {} from source {}", username, source);
    return user;
  }

  @Transactional
  public User updateProfile(
      AuditContext context, UUID userId, String name, String email, boolean mfaEnabled) {
    var user = requireUser(userId);
    user.updateProfile(name, email, mfaEnabled);
    return store.save(context, user, Set.of("name", "email", "mfaEnabled", "updatedAt"));
  }

  /** Stamps the last-login time. Produces no operation log. */
  @Transactional
  public User recordLogin(AuditContext context, UUID userId) {
    var user = requireUser(userId);
    user.markLoggedIn(Instant.now());
    return store.save(context, user, Set.of(User.LAST_LOGIN_FIELD));
  }

  /**
   * Encodes and stores a new password, then publishes {@link PasswordChangedEvent}. The password
   * change log is written by the event listener inside this transaction.
   */
  @Transactional
  public User changePassword(AuditContext context, UUID userId, String rawPassword) {
    var user = requireUser(userId);
    user.changePasswordHash(passwordEncoder.encode(rawPassword));
    var saved =
        store.save(context, user, Set.of("passwordHash", "passwordUpdatedAt", "updatedAt"));
    eventPublisher.publishEvent(new PasswordChangedEvent(UserRef.of(saved), context));
    return saved;
  }

  @Transactional
  public User joinGroups(AuditContext context, UUID userId, Collection<UUID> groupIds) {
    var user = requireUser(userId);
    return store.addRelated(context, User.GROUPS, user, userGroupRepository.findAllById(groupIds));
  }

  @Transactional
  public User leaveGroups(AuditContext context, UUID userId, Collection<UUID> groupIds) {
    var user = requireUser(userId);
    return store.removeRelated(
        context, User.GROUPS, user, userGroupRepository.findAllById(groupIds));
  }

  @Transactional
  public User deactivateUser(AuditContext context, UUID userId) {
    var user = requireUser(userId);
    user.deactivate();
    var saved = store.save(context, user, Set.of("active", "updatedAt"));
    log.info("Deactivated user {}", user.getUsername());
    return saved;
  }

  @Transactional
  public void deleteUser(AuditContext context, UUID userId) {
    var user = requireUser(userId);
    store.delete(context, user);
    log.info("Deleted user {}", user.getUsername());
  }

  private User requireUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }
}
