package io.b2mash.b2b.accessaudit.store;

import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.exception.ResourceNotFoundException;
import jakarta.persistence.EntityManager;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.hibernate.Hibernate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Write path for auditable domain entities. Every mutating call notifies all registered {@link
 * MutationListener}s synchronously, inside the same transaction:
 *
 * <ul>
 *   <li>{@code save}: after the insert/merge, with {@code created} and the changed fields
 *   <li>{@code delete}: before the removal
 *   <li>relation operations: {@code PRE_*} before and the post action after the join rows change,
 *       reporting only the keys whose membership actually changed
 * </ul>
 *
 * <p>Audit records themselves are written through their own repositories, never through this
 * store.
 */
@Component
public class AuditedEntityStore {

  private static final Logger log = LoggerFactory.getLogger(AuditedEntityStore.class);

  private final EntityManager entityManager;
  private final List<MutationListener> listeners;

  public AuditedEntityStore(EntityManager entityManager, List<MutationListener> listeners) {
    this.entityManager = entityManager;
    this.listeners = List.copyOf(listeners);
  }

  @Transactional
  public <T extends AuditableEntity> T save(AuditContext context, T entity) {
    return save(context, entity, null);
  }

  /**
   * Inserts a new entity (null id) or merges an existing one.
   *
   * @param changedFields fields changed by the caller, or null when the whole entity is written
   */
  @Transactional
  public <T extends AuditableEntity> T save(
      AuditContext context, T entity, Set<String> changedFields) {
    boolean created = entity.getId() == null;
    T saved;
    if (created) {
      entityManager.persist(entity);
      saved = entity;
    } else {
      saved = entityManager.merge(entity);
    }
    var type = entityType(saved);
    for (var listener : listeners) {
      listener.onSaved(context, type, saved, created, changedFields);
    }
    return saved;
  }

  @Transactional
  public <T extends AuditableEntity> void delete(AuditContext context, T entity) {
    T managed = entityManager.contains(entity) ? entity : entityManager.merge(entity);
    var type = entityType(managed);
    for (var listener : listeners) {
      listener.onDeleting(context, type, managed);
    }
    entityManager.remove(managed);
    log.debug("Deleted {} id={}", type.getSimpleName(), managed.getId());
  }

  @Transactional
  public <O extends AuditableEntity, R extends AuditableEntity> O addRelated(
      AuditContext context,
      RelationDescriptor<O, R> relation,
      O owner,
      Collection<? extends R> related) {
    O managed = attachOwner(relation, owner);
    Set<R> members = relation.accessor().apply(managed);
    Set<UUID> current = idsOf(members);

    var added = new LinkedHashSet<UUID>();
    for (R item : related) {
      UUID id = requireId(item);
      if (!current.contains(id)) {
        added.add(id);
      }
    }

    notifyRelation(context, relation, RelationAction.PRE_ADD, managed, added);
    for (UUID id : added) {
      members.add(entityManager.getReference(relation.relatedType(), id));
    }
    entityManager.flush();
    notifyRelation(context, relation, RelationAction.ADD, managed, added);
    return managed;
  }

  @Transactional
  public <O extends AuditableEntity, R extends AuditableEntity> O removeRelated(
      AuditContext context,
      RelationDescriptor<O, R> relation,
      O owner,
      Collection<? extends R> related) {
    O managed = attachOwner(relation, owner);
    Set<R> members = relation.accessor().apply(managed);
    Set<UUID> current = idsOf(members);

    var removed = new LinkedHashSet<UUID>();
    for (R item : related) {
      UUID id = requireId(item);
      if (current.contains(id)) {
        removed.add(id);
      }
    }

    notifyRelation(context, relation, RelationAction.PRE_REMOVE, managed, removed);
    members.removeIf(member -> removed.contains(member.getId()));
    entityManager.flush();
    notifyRelation(context, relation, RelationAction.REMOVE, managed, removed);
    return managed;
  }

  @Transactional
  public <O extends AuditableEntity, R extends AuditableEntity> O clearRelated(
      AuditContext context, RelationDescriptor<O, R> relation, O owner) {
    O managed = attachOwner(relation, owner);
    Set<R> members = relation.accessor().apply(managed);
    Set<UUID> former = idsOf(members);

    notifyRelation(context, relation, RelationAction.PRE_CLEAR, managed, former);
    members.clear();
    entityManager.flush();
    notifyRelation(context, relation, RelationAction.CLEAR, managed, former);
    return managed;
  }

  private void notifyRelation(
      AuditContext context,
      RelationDescriptor<?, ?> relation,
      RelationAction action,
      AuditableEntity owner,
      Set<UUID> relatedIds) {
    var change =
        new RelationChange(
            relation.name(),
            action,
            relation.ownerType(),
            owner,
            relation.relatedType(),
            relatedIds);
    for (var listener : listeners) {
      listener.onRelationChanged(context, change);
    }
  }

  private <O extends AuditableEntity> O attachOwner(RelationDescriptor<O, ?> relation, O owner) {
    if (entityManager.contains(owner)) {
      return owner;
    }
    UUID id = requireId(owner);
    O managed = entityManager.find(relation.ownerType(), id);
    if (managed == null) {
      throw new ResourceNotFoundException(relation.ownerType().getSimpleName(), id);
    }
    return managed;
  }

  private static UUID requireId(AuditableEntity entity) {
    if (entity.getId() == null) {
      throw new IllegalArgumentException(
          "Entity must be saved before it can take part in a relation: "
              + entity.getClass().getSimpleName());
    }
    return entity.getId();
  }

  private static Set<UUID> idsOf(Set<? extends AuditableEntity> members) {
    return members.stream().map(AuditableEntity::getId).collect(Collectors.toSet());
  }

  @SuppressWarnings("unchecked")
  private static Class<? extends AuditableEntity> entityType(AuditableEntity entity) {
    return (Class<? extends AuditableEntity>) Hibernate.getClass(entity);
  }
}
