package io.b2mash.b2b.accessaudit.audit;

/** Human-readable type names for audit records. */
public final class EntityTypeNames {

  private EntityTypeNames() {}

  /**
   * Splits a class's simple name into lower-case words, keeping the first letter as is: {@code
   * AssetPermission} becomes {@code Asset permission}, {@code LDAPServer} becomes {@code Ldap
   * server}.
   */
  public static String displayName(Class<?> type) {
    String simple = type.getSimpleName();
    var sb = new StringBuilder(simple.length() + 4);
    for (int i = 0; i < simple.length(); i++) {
      char c = simple.charAt(i);
      if (i == 0 || !Character.isUpperCase(c)) {
        sb.append(c);
        continue;
      }
      char prev = simple.charAt(i - 1);
      boolean acronymEnd =
          Character.isUpperCase(prev)
              && i + 1 < simple.length()
              && Character.isLowerCase(simple.charAt(i + 1));
      if (Character.isLowerCase(prev) || Character.isDigit(prev) || acronymEnd) {
        sb.append(' ');
      }
      sb.append(Character.toLowerCase(c));
    }
    return sb.toString();
  }
}
