package io.b2mash.b2b.accessaudit.store;

import jakarta.persistence.EntityManager;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Loads entities of an arbitrary mapped type by primary key. */
@Component
public class EntityLookup {

  private final EntityManager entityManager;

  public EntityLookup(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  public <T extends AuditableEntity> List<T> findAllById(Class<T> type, Collection<UUID> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }
    var cb = entityManager.getCriteriaBuilder();
    var query = cb.createQuery(type);
    var root = query.from(type);
    query.select(root).where(root.get("id").in(ids));
    return entityManager.createQuery(query).getResultList();
  }
}
