package io.b2mash.b2b.accessaudit.store;

import java.util.UUID;

/**
 * Entity written through {@link AuditedEntityStore}. The display name is what audit records show
 * for the instance.
 */
public interface AuditableEntity {

  UUID getId();

  String getDisplayName();
}
