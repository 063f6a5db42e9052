package io.b2mash.b2b.accessaudit.audit.login;

/** Channel a login attempt came through, stored by its one-letter code. */
public enum LoginType {
  WEB("W"),
  TERMINAL("T"),
  UNKNOWN("U");

  private final String code;

  LoginType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Maps a stored or header-supplied code; unrecognised codes map to {@link #UNKNOWN}. */
  public static LoginType fromCode(String code) {
    if (code != null) {
      for (LoginType type : values()) {
        if (type.code.equalsIgnoreCase(code.trim())) {
          return type;
        }
      }
    }
    return UNKNOWN;
  }
}
