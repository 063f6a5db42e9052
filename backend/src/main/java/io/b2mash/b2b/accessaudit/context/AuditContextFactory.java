package io.b2mash.b2b.accessaudit.context;

import io.b2mash.b2b.accessaudit.identity.User;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.AuthenticationTrustResolver;
import org.springframework.security.authentication.AuthenticationTrustResolverImpl;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * Builds an {@link AuditContext} at the web edge from the servlet request and the Spring Security
 * authentication of the caller. Anonymous tokens produce an unauthenticated {@link UserRef}.
 */
@Component
public class AuditContextFactory {

  static final String API_PATH_PREFIX = "/api/";

  private final AuthenticationTrustResolver trustResolver = new AuthenticationTrustResolverImpl();

  public AuditContext fromRequest(
      HttpServletRequest request, Authentication authentication, String tenantId) {
    boolean apiRequest =
        request.getRequestURI() != null && request.getRequestURI().startsWith(API_PATH_PREFIX);
    var requestContext = RequestContext.fromServletRequest(request, apiRequest);
    return AuditContext.of(toUserRef(authentication), tenantId, requestContext);
  }

  UserRef toUserRef(Authentication authentication) {
    if (authentication == null) {
      return null;
    }
    if (trustResolver.isAnonymous(authentication) || !authentication.isAuthenticated()) {
      return UserRef.anonymous(authentication.getName());
    }
    if (authentication.getPrincipal() instanceof User user) {
      return UserRef.of(user);
    }
    return new UserRef(null, authentication.getName(), authentication.getName(), true);
  }
}
