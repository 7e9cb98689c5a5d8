package io.b2mash.teamboard.approval;

public enum VoteAction {
  APPROVE,
  REJECT
}
