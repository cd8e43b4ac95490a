package com.polycopy.activity;

import com.polycopy.domain.Activity;

import java.util.List;

/**
 * One page of a wallet's activity.
 *
 * @param activities parsed activity, oldest first
 * @param rowCount   rows the feed returned before parsing; unparseable rows count too, so pagination
 *                   can tell a full page from the last one
 */
public record ActivityPage(List<Activity> activities, int rowCount) {

  public ActivityPage {
    activities = activities == null ? List.of() : List.copyOf(activities);
    rowCount = Math.max(rowCount, activities.size());
  }

  public static ActivityPage of(List<Activity> activities) {
    return new ActivityPage(activities, activities == null ? 0 : activities.size());
  }

  public static ActivityPage empty() {
    return new ActivityPage(List.of(), 0);
  }

  public boolean isEmpty() {
    return rowCount == 0;
  }
}
