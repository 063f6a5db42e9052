package io.b2mash.b2b.accessaudit.store;

import java.util.Set;
import java.util.UUID;

/**
 * A change to a many-to-many relation as reported to {@link MutationListener}s.
 *
 * @param relation relation name, e.g. {@code AssetPermission.users}
 * @param action phase and kind of the change
 * @param ownerType declared owner type of the relation
 * @param owner owning instance
 * @param relatedType declared related type
 * @param relatedIds primary keys whose membership changed; for {@code CLEAR} all former members
 */
public record RelationChange(
    String relation,
    RelationAction action,
    Class<? extends AuditableEntity> ownerType,
    AuditableEntity owner,
    Class<? extends AuditableEntity> relatedType,
    Set<UUID> relatedIds) {

  public RelationChange {
    relatedIds = Set.copyOf(relatedIds);
  }
}
