package io.b2mash.b2b.accessaudit.audit.password;

import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.context.UserRef;

/**
 * Published after a user's password has been changed.
 *
 * @param user the user whose password changed
 * @param context context of the change; {@link AuditContext#empty()} for system-initiated changes
 */
public record PasswordChangedEvent(UserRef user, AuditContext context) {}
