package io.b2mash.teamboard.task;

public enum TaskPriority {
  LOW,
  MEDIUM,
  HIGH,
  URGENT
}
