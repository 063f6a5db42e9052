package io.b2mash.b2b.accessaudit.audit.mirror;

import java.util.UUID;

/**
 * Persisted record that is copied to the secondary log stream once written. Implementations are
 * never audited through the generic mutation path.
 */
public interface MirroredRecord {

  UUID getId();

  AuditLogCategory mirrorCategory();
}
