package io.b2mash.b2b.accessaudit.audit.login;

import io.b2mash.b2b.accessaudit.context.RequestContext;
import io.b2mash.b2b.accessaudit.context.UserRef;

/**
 * Published by the authentication layer after a successful login.
 *
 * @param user the authenticated user
 * @param mfaEnabled whether the user has MFA turned on
 * @param request the login request
 * @param loginType explicit channel, or null to derive it from the request
 */
public record AuthSucceededEvent(
    UserRef user, boolean mfaEnabled, RequestContext request, LoginType loginType) {}
