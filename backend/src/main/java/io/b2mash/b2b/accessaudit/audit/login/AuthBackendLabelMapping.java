package io.b2mash.b2b.accessaudit.audit.login;

import io.b2mash.b2b.accessaudit.identity.AuthBackends;
import io.b2mash.b2b.accessaudit.identity.UserSource;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.context.MessageSource;

/**
 * Human label for each authentication backend, stored on login logs. Backends inherit the label
 * of the user source they serve; a few backends carry their own label. Built once at startup and
 * immutable afterwards.
 */
public final class AuthBackendLabelMapping {

  private static final Map<String, String> OWN_LABEL_KEYS =
      Map.of(
          AuthBackends.PUBLIC_KEY, "auth.backend.pubkey",
          AuthBackends.PASSWORD, "auth.backend.password",
          AuthBackends.SSO, "auth.backend.sso",
          AuthBackends.AUTH_TOKEN, "auth.backend.auth-token",
          AuthBackends.WECOM, "auth.backend.wecom",
          AuthBackends.FEISHU, "auth.backend.feishu",
          AuthBackends.DINGTALK, "auth.backend.dingtalk",
          AuthBackends.TEMP_TOKEN, "auth.backend.temp-token");

  private final Map<String, String> labels;

  private AuthBackendLabelMapping(Map<String, String> labels) {
    this.labels = Map.copyOf(labels);
  }

  /**
   * Resolves every label from {@code messages} in {@code locale}. A missing message falls back to
   * the source name or the backend id.
   */
  public static AuthBackendLabelMapping create(MessageSource messages, Locale locale) {
    var labels = new HashMap<String, String>();
    for (UserSource source : UserSource.values()) {
      String label = messages.getMessage(source.getLabelKey(), null, source.name(), locale);
      for (String backend : source.getBackends()) {
        labels.put(backend, label);
      }
    }
    OWN_LABEL_KEYS.forEach(
        (backend, key) -> labels.put(backend, messages.getMessage(key, null, backend, locale)));
    return new AuthBackendLabelMapping(labels);
  }

  /** Returns the label, or an empty string for null or unknown backends. */
  public String labelFor(String backend) {
    if (backend == null) {
      return "";
    }
    return labels.getOrDefault(backend, "");
  }

  public Map<String, String> asMap() {
    return labels;
  }
}
