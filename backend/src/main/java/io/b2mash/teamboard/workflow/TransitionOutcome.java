package io.b2mash.teamboard.workflow;

public enum TransitionOutcome {
  /** The status change took effect immediately. */
  APPLIED,
  /** A ballot was opened; the status is unchanged until every stakeholder approves. */
  PENDING,
  /** A stakeholder rejected the ballot; the deferred status change will not happen. */
  REJECTED,
  /** The last outstanding approval arrived and the deferred status change was applied. */
  RESOLVED,
  AWAITING_MORE_VOTES,
  /** The requester withdrew the ballot. */
  CANCELLED
}
