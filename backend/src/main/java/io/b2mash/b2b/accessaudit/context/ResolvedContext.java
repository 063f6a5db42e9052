package io.b2mash.b2b.accessaudit.context;

/**
 * Result of {@link ContextResolver#resolve(AuditContext)}.
 *
 * @param actor authenticated acting user, or null if there is none
 * @param tenantId tenant of the operation, or null if none was selected
 * @param remoteAddr client address, empty string when unknown
 */
public record ResolvedContext(UserRef actor, String tenantId, String remoteAddr) {

  public boolean hasActor() {
    return actor != null;
  }

  public String tenantIdOr(String fallback) {
    return tenantId != null ? tenantId : fallback;
  }
}
