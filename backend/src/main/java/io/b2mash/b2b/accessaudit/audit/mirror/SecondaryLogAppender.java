package io.b2mash.b2b.accessaudit.audit.mirror;

/** Destination of mirrored audit lines (syslog, a log shipper, a plain file). */
public interface SecondaryLogAppender {

  /** Appends one complete line. Implementations may throw; the mirror catches and logs. */
  void append(String line);
}
