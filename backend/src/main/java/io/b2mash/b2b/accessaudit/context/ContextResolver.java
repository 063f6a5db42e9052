package io.b2mash.b2b.accessaudit.context;

import org.springframework.stereotype.Component;

/**
 * Extracts the acting user, tenant and client address from an {@link AuditContext}. Callers that
 * need an actor must treat a missing one as "do not audit".
 */
@Component
public class ContextResolver {

  public ResolvedContext resolve(AuditContext context) {
    if (context == null) {
      return new ResolvedContext(null, null, "");
    }
    UserRef user = context.user();
    UserRef actor = user != null && user.authenticated() ? user : null;
    return new ResolvedContext(
        actor, context.tenantId(), ClientIpResolver.resolve(context.request()));
  }
}
