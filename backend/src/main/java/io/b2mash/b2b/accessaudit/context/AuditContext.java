package io.b2mash.b2b.accessaudit.context;

/**
 * Explicit per-operation context handed to every audit entry point: who is acting, in which
 * tenant, and through which request. Populated at the edge (web filter, job runner) and read-only
 * from the audit pipeline's point of view.
 *
 * @param user acting user; null for system-initiated operations
 * @param tenantId organization the operation runs in; null when none was selected
 * @param request originating request; null for background work
 */
public record AuditContext(UserRef user, String tenantId, RequestContext request) {

  private static final AuditContext EMPTY = new AuditContext(null, null, null);

  /** Context of system-initiated work with no user, tenant or request. */
  public static AuditContext empty() {
    return EMPTY;
  }

  public static AuditContext of(UserRef user, String tenantId, RequestContext request) {
    return new AuditContext(user, tenantId, request);
  }

  /** Background work scoped to a tenant but without a user or request. */
  public static AuditContext background(String tenantId) {
    return new AuditContext(null, tenantId, null);
  }

  public boolean isEmpty() {
    return user == null && request == null;
  }

  public boolean hasRequest() {
    return request != null;
  }
}
