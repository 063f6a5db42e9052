package io.b2mash.b2b.accessaudit.audit.mirror;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes mirrored lines at INFO to a dedicated logger. {@code logback-spring.xml} routes that
 * logger to its own non-additive appender.
 */
public class Slf4jSecondaryLogAppender implements SecondaryLogAppender {

  private final Logger target;

  public Slf4jSecondaryLogAppender(String loggerName) {
    this.target = LoggerFactory.getLogger(loggerName);
  }

  @Override
  public void append(String line) {
    target.info(line);
  }
}
