package io.b2mash.b2b.accessaudit.audit.login;

import io.b2mash.b2b.accessaudit.context.UserRef;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link UnusualLoginChecker}: logs a warning when a user logs in from an address that
 * has no successful login for that user within the lookback window. Users without any successful
 * login in the window are not flagged.
 */
public class RecentLoginLocationChecker implements UnusualLoginChecker {

  private static final Logger log = LoggerFactory.getLogger(RecentLoginLocationChecker.class);

  static final Duration LOOKBACK = Duration.ofDays(30);

  private final UserLoginLogRepository loginLogRepository;

  public RecentLoginLocationChecker(UserLoginLogRepository loginLogRepository) {
    this.loginLogRepository = loginLogRepository;
  }

  @Override
  public void checkUnusualLocation(UserRef user, String ip) {
    Instant since = Instant.now().minus(LOOKBACK);
    if (loginLogRepository.countByUsernameAndStatusAndDatetimeAfter(user.username(), true, since)
        == 0) {
      return;
    }
    if (loginLogRepository.existsByUsernameAndIpAndStatusTrueAndDatetimeAfter(
        user.username(), ip, since)) {
      return;
    }
    log.warn("Login from unfamiliar address: username={}, ip={}", user.username(), ip);
  }
}
