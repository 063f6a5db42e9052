package io.b2mash.b2b.accessaudit.identity;

/** Identifiers of the authentication backends a session can record as its login backend. */
public final class AuthBackends {

  public static final String PASSWORD = "password";
  public static final String PUBLIC_KEY = "pubkey";
  public static final String LDAP = "ldap";
  public static final String OIDC_PASSWORD = "oidc-password";
  public static final String OIDC_CODE = "oidc-code";
  public static final String RADIUS = "radius";
  public static final String CAS = "cas";
  public static final String SAML2 = "saml2";
  public static final String OAUTH2 = "oauth2";
  public static final String SSO = "sso";
  public static final String AUTH_TOKEN = "auth-token";
  public static final String WECOM = "wecom";
  public static final String FEISHU = "feishu";
  public static final String DINGTALK = "dingtalk";
  public static final String TEMP_TOKEN = "temp-token";

  private AuthBackends() {}
}
