package com.affordabot.backend.gateway.cost;

/** Supplies the tracker of the budget period the caller is currently in. */
@FunctionalInterface
public interface CostTrackerProvider {

  CostTracker current();

  static CostTrackerProvider fixed(CostTracker tracker) {
    if (tracker == null) {
      throw new IllegalArgumentException("tracker must not be null");
    }
    return () -> tracker;
  }
}
