package com.polycopy.domain;

/**
 * How a follower sizes a copied trade relative to the target's trade value.
 */
public enum CopyMode {
  /**
   * Fixed percentage of the target trade value.
   */
  SCALE,
  /**
   * Balance-proportional allocation. Currently sized as a flat 10% of the target trade value.
   */
  ALLOCATE,
}
