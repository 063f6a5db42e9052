package io.b2mash.b2b.accessaudit.audit.capture;

import io.b2mash.b2b.accessaudit.audit.ActionType;
import io.b2mash.b2b.accessaudit.audit.AuditLogWriter;
import io.b2mash.b2b.accessaudit.audit.EntityTypeNames;
import io.b2mash.b2b.accessaudit.audit.OperateLog;
import io.b2mash.b2b.accessaudit.audit.mirror.MirroredRecord;
import io.b2mash.b2b.accessaudit.audit.relation.RelationChangeRegistry;
import io.b2mash.b2b.accessaudit.config.AuditProperties;
import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.context.ContextResolver;
import io.b2mash.b2b.accessaudit.context.ResolvedContext;
import io.b2mash.b2b.accessaudit.identity.User;
import io.b2mash.b2b.accessaudit.store.AuditableEntity;
import io.b2mash.b2b.accessaudit.store.EntityLookup;
import io.b2mash.b2b.accessaudit.store.MutationListener;
import io.b2mash.b2b.accessaudit.store.RelationAction;
import io.b2mash.b2b.accessaudit.store.RelationChange;
import java.util.ArrayList;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns storage-layer mutations into {@link OperateLog} records. Writes happen synchronously in the
 * caller's transaction, so a failed write fails the mutation. Mutations without an authenticated
 * actor are not recorded.
 */
@Component
public class OperateLogInterceptor implements MutationListener {

  private static final Logger log = LoggerFactory.getLogger(OperateLogInterceptor.class);

  private final ContextResolver contextResolver;
  private final RelationChangeRegistry registry;
  private final EntityLookup entityLookup;
  private final AuditLogWriter writer;
  private final String defaultTenantId;

  public OperateLogInterceptor(
      ContextResolver contextResolver,
      RelationChangeRegistry registry,
      EntityLookup entityLookup,
      AuditLogWriter writer,
      AuditProperties properties) {
    this.contextResolver = contextResolver;
    this.registry = registry;
    this.entityLookup = entityLookup;
    this.writer = writer;
    this.defaultTenantId = properties.defaultTenantId();
  }

  @Override
  public void onSaved(
      AuditContext context,
      Class<? extends AuditableEntity> entityType,
      AuditableEntity instance,
      boolean created,
      Set<String> changedFields) {
    if (isAuditRecord(entityType)) {
      return;
    }
    if (isLastLoginOnly(entityType, changedFields)) {
      log.debug("Skipping operate log for last-login update of user id={}", instance.getId());
      return;
    }
    record(context, created ? ActionType.CREATE : ActionType.UPDATE, entityType, instance);
  }

  @Override
  public void onDeleting(
      AuditContext context, Class<? extends AuditableEntity> entityType, AuditableEntity instance) {
    if (isAuditRecord(entityType)) {
      return;
    }
    record(context, ActionType.DELETE, entityType, instance);
  }

  @Override
  public void onRelationChanged(AuditContext context, RelationChange change) {
    ActionType action = relationAction(change.action());
    if (action == null || change.relatedIds().isEmpty()) {
      return;
    }
    var resolved = contextResolver.resolve(context);
    if (!resolved.hasActor()) {
      log.debug("No authenticated actor, skipping relation change on {}", change.relation());
      return;
    }
    var template = registry.lookup(change.relation());
    if (template.isEmpty()) {
      log.debug("Relation {} is not audited", change.relation());
      return;
    }

    String pattern =
        action == ActionType.CREATE
            ? template.get().addTemplate()
            : template.get().removeTemplate();
    String ownerTypeName = change.ownerType().getSimpleName();
    String relatedTypeName = change.relatedType().getSimpleName();
    String ownerDisplay = change.owner().getDisplayName();

    var related = entityLookup.findAllById(change.relatedType(), change.relatedIds());
    var records = new ArrayList<OperateLog>(related.size());
    for (AuditableEntity item : related) {
      String resource =
          RelationChangeRegistry.format(
              pattern, ownerTypeName, ownerDisplay, relatedTypeName, item.getDisplayName());
      records.add(operateLog(resolved, action, template.get().category(), resource));
    }
    writer.writeOperateLogs(records);
  }

  private void record(
      AuditContext context,
      ActionType action,
      Class<? extends AuditableEntity> entityType,
      AuditableEntity instance) {
    var resolved = contextResolver.resolve(context);
    if (!resolved.hasActor()) {
      log.debug(
          "No authenticated actor, skipping {} of {} id={}",
          action.value(),
          entityType.getSimpleName(),
          instance.getId());
      return;
    }
    writer.writeOperateLog(
        operateLog(
            resolved,
            action,
            EntityTypeNames.displayName(entityType),
            instance.getDisplayName()));
  }

  private OperateLog operateLog(
      ResolvedContext resolved, ActionType action, String resourceType, String resource) {
    return new OperateLog(
        resolved.actor().display(),
        action,
        resourceType,
        resource,
        resolved.remoteAddr(),
        resolved.tenantIdOr(defaultTenantId));
  }

  private static ActionType relationAction(RelationAction action) {
    return switch (action) {
      case ADD -> ActionType.CREATE;
      case REMOVE, CLEAR -> ActionType.DELETE;
      case PRE_ADD, PRE_REMOVE, PRE_CLEAR -> null;
    };
  }

  private static boolean isAuditRecord(Class<?> entityType) {
    return MirroredRecord.class.isAssignableFrom(entityType);
  }

  private static boolean isLastLoginOnly(Class<?> entityType, Set<String> changedFields) {
    return User.class.isAssignableFrom(entityType)
        && changedFields != null
        && !changedFields.isEmpty()
        && changedFields.stream().allMatch(User.LAST_LOGIN_FIELD::equals);
  }
}
