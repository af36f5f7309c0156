package com.mk.fx.qa.stress.model;

/**
 * Part a process plays in a run.
 *
 * <ul>
 *   <li>{@code STANDALONE}: records operations and aggregates them in the same process.
 *   <li>{@code COORDINATOR}: records nothing, merges snapshots shipped by workers.
 *   <li>{@code WORKER}: records operations and ships snapshots to a coordinator.
 * </ul>
 */
public enum RunRole {
  STANDALONE,
  COORDINATOR,
  WORKER;

  public boolean records() {
    return this != COORDINATOR;
  }
}
