package io.b2mash.teamboard.member;

/**
 * What the calling member may do within one project. {@code projectRole} is null for admins who
 * are not enrolled on the project.
 */
public record ProjectAccess(boolean isMember, boolean canManage, String projectRole) {

  public static final ProjectAccess DENIED = new ProjectAccess(false, false, null);
}
