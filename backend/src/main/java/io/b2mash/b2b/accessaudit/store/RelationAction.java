package io.b2mash.b2b.accessaudit.store;

/**
 * Phase of a relation change. {@code PRE_*} actions fire before the join rows change, the others
 * after.
 */
public enum RelationAction {
  PRE_ADD,
  ADD,
  PRE_REMOVE,
  REMOVE,
  PRE_CLEAR,
  CLEAR
}
