package io.b2mash.b2b.accessaudit.context;

/**
 * Minimal view of the session state owned by the authentication layer. The login audit path reads
 * the authentication backend from it and stores the login time.
 */
public interface SessionAttributes {

  /** Returns the attribute value, or null if not set. */
  Object getAttribute(String name);

  void setAttribute(String name, Object value);

  /** Returns the attribute as a string, or {@code defaultValue} if unset or blank. */
  default String getString(String name, String defaultValue) {
    Object value = getAttribute(name);
    if (value == null || value.toString().isBlank()) {
      return defaultValue;
    }
    return value.toString();
  }
}
