package io.b2mash.b2b.accessaudit.audit.login;

import io.b2mash.b2b.accessaudit.context.RequestContext;

/**
 * Published by the authentication layer after a rejected login.
 *
 * @param username the username that was tried
 * @param request the login request
 * @param reason why the attempt failed; may be null
 */
public record AuthFailedEvent(String username, RequestContext request, String reason) {}
