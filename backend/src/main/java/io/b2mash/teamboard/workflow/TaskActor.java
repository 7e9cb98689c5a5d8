package io.b2mash.teamboard.workflow;

import java.util.UUID;

/**
 * The caller of a workflow operation together with their relation to the task, as resolved by the
 * API layer. The engine trusts these flags and never looks identity up itself.
 */
public record TaskActor(
    UUID memberId,
    String name,
    boolean isCreator,
    boolean isAdmin,
    boolean isAssignee,
    boolean isStakeholder) {

  /** Creators and admins may change a task's status, edit it and manage its stakeholders. */
  public boolean canManage() {
    return isCreator || isAdmin;
  }
}
