package io.b2mash.b2b.accessaudit.identity;

import java.util.List;

/** Where a user account comes from, and which authentication backends serve that source. */
public enum UserSource {
  LOCAL("user.source.local", List.of(AuthBackends.PASSWORD, AuthBackends.PUBLIC_KEY)),
  LDAP("user.source.ldap", List.of(AuthBackends.LDAP)),
  OPENID("user.source.openid", List.of(AuthBackends.OIDC_PASSWORD, AuthBackends.OIDC_CODE)),
  RADIUS("user.source.radius", List.of(AuthBackends.RADIUS)),
  CAS("user.source.cas", List.of(AuthBackends.CAS)),
  SAML2("user.source.saml2", List.of(AuthBackends.SAML2)),
  OAUTH2("user.source.oauth2", List.of(AuthBackends.OAUTH2));

  private final String labelKey;
  private final List<String> backends;

  UserSource(String labelKey, List<String> backends) {
    this.labelKey = labelKey;
    this.backends = backends;
  }

  /** Message key of the human label. */
  public String getLabelKey() {
    return labelKey;
  }

  public List<String> getBackends() {
    return backends;
  }
}
