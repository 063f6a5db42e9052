package io.b2mash.b2b.accessaudit.audit.password;

import io.b2mash.b2b.accessaudit.audit.AuditLogWriter;
import io.b2mash.b2b.accessaudit.audit.PasswordChangeLog;
import io.b2mash.b2b.accessaudit.config.AuditProperties;
import io.b2mash.b2b.accessaudit.context.ContextResolver;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a {@link PasswordChangeLog} for every {@link PasswordChangedEvent}. Runs synchronously in
 * the publisher's transaction, or its own when there is none; a failed write propagates.
 */
@Component
public class PasswordChangeAuditListener {

  private final AuditLogWriter writer;
  private final ContextResolver contextResolver;
  private final String defaultTenantId;

  public PasswordChangeAuditListener(
      AuditLogWriter writer, ContextResolver contextResolver, AuditProperties properties) {
    this.writer = writer;
    this.contextResolver = contextResolver;
    this.defaultTenantId = properties.defaultTenantId();
  }

  @EventListener
  @Transactional
  public void onPasswordChanged(PasswordChangedEvent event) {
    String subject = event.user().display();
    var context = event.context();

    if (context == null || context.isEmpty()) {
      String tenantId = context != null ? context.tenantId() : null;
      writer.writePasswordChangeLog(
          new PasswordChangeLog(
              subject,
              PasswordChangeLog.SYSTEM_ACTOR,
              PasswordChangeLog.LOCAL_ADDRESS,
              tenantId != null ? tenantId : defaultTenantId));
      return;
    }

    var resolved = contextResolver.resolve(context);
    String changeBy = resolved.hasActor() ? resolved.actor().display() : subject;
    String remoteAddr = resolved.remoteAddr();
    if (remoteAddr == null || remoteAddr.isEmpty()) {
      remoteAddr = PasswordChangeLog.LOCAL_ADDRESS;
    }
    writer.writePasswordChangeLog(
        new PasswordChangeLog(
            subject, changeBy, remoteAddr, resolved.tenantIdOr(defaultTenantId)));
  }
}
