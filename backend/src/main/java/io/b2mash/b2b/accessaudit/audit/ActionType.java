package io.b2mash.b2b.accessaudit.audit;

/** Kind of mutation recorded in an {@link OperateLog}. */
public enum ActionType {
  CREATE("create"),
  UPDATE("update"),
  DELETE("delete");

  private final String value;

  ActionType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
