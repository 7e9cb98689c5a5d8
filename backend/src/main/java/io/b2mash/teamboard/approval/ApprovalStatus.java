package io.b2mash.teamboard.approval;

public enum ApprovalStatus {
  PENDING,
  APPROVED,
  REJECTED
}
