package io.b2mash.b2b.accessaudit.context;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** {@link SessionAttributes} kept in memory, used for non-HTTP channels and in tests. */
public class MapSessionAttributes implements SessionAttributes {

  private final Map<String, Object> attributes = new ConcurrentHashMap<>();

  public MapSessionAttributes() {}

  public MapSessionAttributes(Map<String, ?> initial) {
    this.attributes.putAll(initial);
  }

  @Override
  public Object getAttribute(String name) {
    return attributes.get(name);
  }

  @Override
  public void setAttribute(String name, Object value) {
    if (value == null) {
      attributes.remove(name);
    } else {
      attributes.put(name, value);
    }
  }
}
