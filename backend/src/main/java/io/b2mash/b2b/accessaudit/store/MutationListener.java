package io.b2mash.b2b.accessaudit.store;

import io.b2mash.b2b.accessaudit.context.AuditContext;
import java.util.Set;

/**
 * Contract the storage layer calls around every mutating operation. {@link AuditedEntityStore}
 * invokes all registered listeners synchronously on the calling thread, inside the caller's
 * transaction; an exception thrown by a listener fails the mutation.
 */
public interface MutationListener {

  /**
   * Called after an entity was inserted or updated.
   *
   * @param changedFields names of the fields the caller changed, or null when unknown
   */
  void onSaved(
      AuditContext context,
      Class<? extends AuditableEntity> entityType,
      AuditableEntity instance,
      boolean created,
      Set<String> changedFields);

  /** Called before an entity is removed, while its state is still readable. */
  void onDeleting(
      AuditContext context, Class<? extends AuditableEntity> entityType, AuditableEntity instance);

  /** Called before and after each many-to-many relation change. */
  void onRelationChanged(AuditContext context, RelationChange change);
}
