package io.b2mash.b2b.accessaudit.audit.mirror;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies persisted audit records to the secondary log as {@code <category> - <json>} lines. The
 * formatter is picked by the record's {@link AuditLogCategory}. Mirroring never fails the caller:
 * serialization and appender errors are logged and dropped.
 */
public class AuditLogMirror {

  private static final Logger log = LoggerFactory.getLogger(AuditLogMirror.class);

  private final Map<AuditLogCategory, Function<MirroredRecord, Map<String, Object>>> routes;
  private final ObjectMapper objectMapper;
  private final SecondaryLogAppender appender;
  private final boolean enabled;

  public AuditLogMirror(ObjectMapper objectMapper, SecondaryLogAppender appender, boolean enabled) {
    this.routes = Map.copyOf(MirrorFormatters.routingTable());
    this.objectMapper = objectMapper;
    this.appender = appender;
    this.enabled = enabled;
  }

  public void mirror(MirroredRecord record) {
    if (!enabled || record == null) {
      return;
    }
    var category = record.mirrorCategory();
    var formatter = routes.get(category);
    if (formatter == null) {
      log.warn("No mirror formatter for category={}, record id={}", category, record.getId());
      return;
    }
    try {
      String json = objectMapper.writeValueAsString(formatter.apply(record));
      appender.append(category.code() + " - " + json);
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn(
          "Failed to mirror audit record: category={}, id={}",
          category.code(),
          record.getId(),
          e);
    }
  }
}
