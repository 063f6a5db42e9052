package io.b2mash.b2b.accessaudit.audit;

/** Length caps of audit record text columns. */
public final class AuditText {

  public static final int RESOURCE_MAX_LENGTH = 128;
  public static final int RESOURCE_TYPE_MAX_LENGTH = 64;
  public static final int USER_AGENT_MAX_LENGTH = 255;
  public static final int REASON_MAX_LENGTH = 128;
  public static final int USER_MAX_LENGTH = 128;
  public static final int REMOTE_ADDR_MAX_LENGTH = 128;

  private AuditText() {}

  /**
   * Cuts {@code value} to at most {@code maxCodePoints} Unicode code points. Never splits a
   * surrogate pair; null stays null.
   */
  public static String truncate(String value, int maxCodePoints) {
    if (value == null || value.length() <= maxCodePoints) {
      return value;
    }
    if (value.codePointCount(0, value.length()) <= maxCodePoints) {
      return value;
    }
    return value.substring(0, value.offsetByCodePoints(0, maxCodePoints));
  }
}
