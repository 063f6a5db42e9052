package io.b2mash.b2b.accessaudit.store;

import java.util.Set;
import java.util.function.Function;

/**
 * Describes a many-to-many relation from its owning side.
 *
 * @param name relation name used as the audit registry key, e.g. {@code User.groups}
 * @param ownerType declared owner type; subclasses of it report under this type
 * @param relatedType declared type of the related side
 * @param accessor returns the live (mutable) collection on a managed owner
 */
public record RelationDescriptor<O extends AuditableEntity, R extends AuditableEntity>(
    String name, Class<O> ownerType, Class<R> relatedType, Function<O, Set<R>> accessor) {}
