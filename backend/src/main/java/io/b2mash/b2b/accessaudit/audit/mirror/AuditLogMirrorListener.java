package io.b2mash.b2b.accessaudit.audit.mirror;

import jakarta.persistence.PostPersist;
import org.springframework.stereotype.Component;

/**
 * JPA entity listener attached to every {@link MirroredRecord} entity. Hibernate obtains it from
 * the Spring bean container, so the mirror is constructor-injected.
 */
@Component
public class AuditLogMirrorListener {

  private final AuditLogMirror mirror;

  public AuditLogMirrorListener(AuditLogMirror mirror) {
    this.mirror = mirror;
  }

  @PostPersist
  public void afterPersist(Object entity) {
    if (entity instanceof MirroredRecord record) {
      mirror.mirror(record);
    }
  }
}
