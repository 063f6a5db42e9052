package io.b2mash.b2b.accessaudit.audit.login;

/**
 * MFA state at the time of a login attempt, stored by its numeric code. Failed attempts do not
 * know it.
 */
public enum MfaStatus {
  DISABLED(0),
  ENABLED(1),
  UNKNOWN(2);

  private final int code;

  MfaStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static MfaStatus of(boolean mfaEnabled) {
    return mfaEnabled ? ENABLED : DISABLED;
  }

  /** Maps a stored code; unrecognised codes map to {@link #UNKNOWN}. */
  public static MfaStatus fromCode(int code) {
    for (MfaStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    return UNKNOWN;
  }
}
