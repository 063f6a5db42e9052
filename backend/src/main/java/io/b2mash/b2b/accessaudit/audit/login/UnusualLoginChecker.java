package io.b2mash.b2b.accessaudit.audit.login;

import io.b2mash.b2b.accessaudit.context.UserRef;

/**
 * Hook run before a successful login is recorded, e.g. to notify a user about a login from an
 * unfamiliar place. Exceptions are logged by the caller and never fail the login.
 */
public interface UnusualLoginChecker {

  void checkUnusualLocation(UserRef user, String ip);
}
