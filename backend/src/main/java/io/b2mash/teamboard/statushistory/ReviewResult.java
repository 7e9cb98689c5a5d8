package io.b2mash.teamboard.statushistory;

/**
 * Outcome carried by a status change record. {@code PENDING} marks an open approval ballot; the
 * other values are terminal.
 */
public enum ReviewResult {
  PENDING,
  PASSED,
  REJECTED,
  CANCELLED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
