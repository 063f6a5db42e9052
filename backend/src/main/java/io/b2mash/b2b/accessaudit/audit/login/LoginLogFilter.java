package io.b2mash.b2b.accessaudit.audit.login;

import java.time.Instant;

/**
 * Query filter for login logs. All fields are nullable.
 *
 * @param status true for successful attempts, false for failures
 */
public record LoginLogFilter(
    String username, String ip, Boolean status, Instant from, Instant to) {}
