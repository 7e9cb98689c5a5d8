package io.b2mash.teamboard.member;

import io.b2mash.teamboard.exception.ForbiddenException;
import java.util.UUID;

/**
 * Request-bound identity of the calling member. Bound by {@link MemberFilter} for the duration of
 * a request and read by controllers when building the actor passed into services.
 */
public final class MemberContext {

  private static final ThreadLocal<UUID> CURRENT_MEMBER_ID = new ThreadLocal<>();
  private static final ThreadLocal<String> CURRENT_ROLE = new ThreadLocal<>();

  private MemberContext() {}

  public static void bind(UUID memberId, String role) {
    CURRENT_MEMBER_ID.set(memberId);
    CURRENT_ROLE.set(role);
  }

  public static UUID getCurrentMemberId() {
    return CURRENT_MEMBER_ID.get();
  }

  /** Returns the current member id, failing the request when no member could be resolved. */
  public static UUID requireMemberId() {
    UUID memberId = CURRENT_MEMBER_ID.get();
    if (memberId == null) {
      throw new ForbiddenException(
          "Member context not available", "Unable to resolve member identity for request");
    }
    return memberId;
  }

  public static String getRole() {
    return CURRENT_ROLE.get();
  }

  public static void clear() {
    CURRENT_MEMBER_ID.remove();
    CURRENT_ROLE.remove();
  }
}
