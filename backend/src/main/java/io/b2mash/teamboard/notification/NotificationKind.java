package io.b2mash.teamboard.notification;

public enum NotificationKind {
  APPROVAL_REQUEST,
  APPROVAL_REJECTED,
  APPROVAL_CANCELLED,
  REVIEW_REQUESTED,
  STATUS_CHANGE,
  MENTION,
  ASSIGNMENT,
  STAKEHOLDER_ADDED
}
