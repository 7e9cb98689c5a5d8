package io.b2mash.teamboard.security;

/**
 * Centralized role constants used across authentication, authorization, and access control.
 *
 * <p>System roles come from the {@code role} claim of the access token and are mirrored on the
 * {@code members} table. Spring authorities are the {@code ROLE_} prefixed versions used by
 * {@code @PreAuthorize}.
 */
public final class Roles {

  public static final String ADMIN = "admin";
  public static final String MANAGER = "manager";
  public static final String MEMBER = "member";

  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_MANAGER = "ROLE_MANAGER";
  public static final String AUTHORITY_MEMBER = "ROLE_MEMBER";
  public static final String AUTHORITY_INTERNAL = "ROLE_INTERNAL_SERVICE";

  // Project-level roles held on project_members
  public static final String PROJECT_LEAD = "lead";
  public static final String PROJECT_MEMBER = "member";

  public static boolean isAdmin(String role) {
    return ADMIN.equals(role);
  }

  private Roles() {}
}
