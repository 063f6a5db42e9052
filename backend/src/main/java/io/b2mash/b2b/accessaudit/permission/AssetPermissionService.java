package io.b2mash.b2b.accessaudit.permission;

import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.exception.InvalidStateException;
import io.b2mash.b2b.accessaudit.exception.ResourceNotFoundException;
import io.b2mash.b2b.accessaudit.store.AuditableEntity;
import io.b2mash.b2b.accessaudit.store.AuditedEntityStore;
import io.b2mash.b2b.accessaudit.store.EntityLookup;
import io.b2mash.b2b.accessaudit.store.RelationDescriptor;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Manages asset permissions. Membership changes go through {@link AuditedEntityStore} with one of
 * the {@link AssetPermission} relation descriptors, so every grant and revoke is audited.
 */
@Service
public class AssetPermissionService {

  private static final Logger log = LoggerFactory.getLogger(AssetPermissionService.class);

  private final AssetPermissionRepository permissionRepository;
  private final EntityLookup entityLookup;
  private final AuditedEntityStore store;

  public AssetPermissionService(
      AssetPermissionRepository permissionRepository,
      EntityLookup entityLookup,
      AuditedEntityStore store) {
    this.permissionRepository = permissionRepository;
    this.entityLookup = entityLookup;
    this.store = store;
  }

  @Transactional
  public AssetPermission createPermission(AuditContext context, String name, Instant expiresAt) {
    if (expiresAt != null && expiresAt.isBefore(Instant.now())) {
      throw new InvalidStateException(
          "Invalid expiry", "Permission " + name + " would already be expired");
    }
    var permission = store.save(context, new AssetPermission(name, expiresAt, context.tenantId()));
    log.info("Created asset permission {} in tenant {}", name, context.tenantId());
    return permission;
  }

  @Transactional
  public AssetPermission extendPermission(AuditContext context, UUID permissionId, Instant until) {
    var permission = requirePermission(permissionId);
    permission.extendUntil(until);
    return store.save(context, permission, Set.of("expiresAt"));
  }

  /** Adds the given members; ids already present are ignored. */
  @Transactional
  public <R extends AuditableEntity> AssetPermission grant(
      AuditContext context,
      UUID permissionId,
      RelationDescriptor<AssetPermission, R> relation,
      Collection<UUID> memberIds) {
    var members = entityLookup.findAllById(relation.relatedType(), memberIds);
    return store.addRelated(context, relation, requirePermission(permissionId), members);
  }

  /** Removes the given members; ids not present are ignored. */
  @Transactional
  public <R extends AuditableEntity> AssetPermission revoke(
      AuditContext context,
      UUID permissionId,
      RelationDescriptor<AssetPermission, R> relation,
      Collection<UUID> memberIds) {
    var members = entityLookup.findAllById(relation.relatedType(), memberIds);
    return store.removeRelated(context, relation, requirePermission(permissionId), members);
  }

  @Transactional
  public <R extends AuditableEntity> AssetPermission revokeAll(
      AuditContext context,
      UUID permissionId,
      RelationDescriptor<AssetPermission, R> relation) {
    return store.clearRelated(context, relation, requirePermission(permissionId));
  }

  @Transactional
  public void deletePermission(AuditContext context, UUID permissionId) {
    var permission = requirePermission(permissionId);
    store.delete(context, permission);
    log.info("Deleted asset permission {}", permission.getName());
  }

  private AssetPermission requirePermission(UUID permissionId) {
    return permissionRepository
        .findById(permissionId)
        .orElseThrow(() -> new ResourceNotFoundException("AssetPermission", permissionId));
  }
}
