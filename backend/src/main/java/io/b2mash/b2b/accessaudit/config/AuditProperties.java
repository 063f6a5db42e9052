package io.b2mash.b2b.accessaudit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the audit pipeline.
 *
 * @param defaultTenantId tenant stamped on tenant-scoped records when the context carries none
 * @param labelLocale locale the authentication backend labels are resolved in, e.g. {@code en}
 * @param mirror secondary structured log settings
 */
@ConfigurationProperties(prefix = "access-audit")
public record AuditProperties(String defaultTenantId, String labelLocale, Mirror mirror) {

  public static final String DEFAULT_TENANT_ID = "00000000-0000-0000-0000-000000000002";

  public AuditProperties {
    if (defaultTenantId == null || defaultTenantId.isBlank()) {
      defaultTenantId = DEFAULT_TENANT_ID;
    }
    if (labelLocale == null || labelLocale.isBlank()) {
      labelLocale = "en";
    }
    if (mirror == null) {
      mirror = new Mirror(true, null);
    }
  }

  /**
   * @param enabled whether persisted records are copied to the secondary log
   * @param loggerName SLF4J logger the copies are written to
   */
  public record Mirror(boolean enabled, String loggerName) {

    public static final String DEFAULT_LOGGER_NAME = "access-audit.mirror";

    public Mirror {
      if (loggerName == null || loggerName.isBlank()) {
        loggerName = DEFAULT_LOGGER_NAME;
      }
    }
  }
}
