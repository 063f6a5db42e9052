package io.b2mash.b2b.accessaudit.audit;

import java.time.Instant;

/**
 * Query filter for {@link AuditLogQueryService#findOperateLogs}. All fields except {@code tenantId}
 * are nullable; null means "no filter on this field".
 *
 * @param tenantId tenant whose records are searched
 * @param user actor display form, exact match
 * @param action mutation kind
 * @param resourceType category label, exact match
 * @param resource substring of the resource description
 * @param from start of time range (inclusive)
 * @param to end of time range (exclusive)
 */
public record OperateLogFilter(
    String tenantId,
    String user,
    ActionType action,
    String resourceType,
    String resource,
    Instant from,
    Instant to) {

  public static OperateLogFilter forTenant(String tenantId) {
    return new OperateLogFilter(tenantId, null, null, null, null, null, null);
  }
}
