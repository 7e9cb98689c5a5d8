package io.b2mash.teamboard.stakeholder;

/** Informational label on a stakeholder row. Every role carries the same single vote. */
public enum StakeholderRole {
  STAKEHOLDER,
  REVIEWER,
  COLLABORATOR
}
