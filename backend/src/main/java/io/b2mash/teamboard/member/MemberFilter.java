package io.b2mash.teamboard.member;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.teamboard.security.JwtClaims;
import io.b2mash.teamboard.security.Roles;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the authenticated JWT subject to a {@link Member} row and binds it to {@link
 * MemberContext}. Members unknown to the directory are created on first sight from the token's
 * profile claims. Deactivated members are refused with 403.
 *
 * <p>The bound role is the one held in the directory, so a role pushed through member sync takes
 * effect on the next request after the cache entry is evicted.
 */
@Component
public class MemberFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(MemberFilter.class);

  private final MemberRepository memberRepository;
  private final Cache<String, ResolvedMember> memberCache =
      Caffeine.newBuilder().maximumSize(50_000).expireAfterWrite(Duration.ofHours(1)).build();

  public MemberFilter(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      filterChain.doFilter(request, response);
      return;
    }

    Jwt jwt = jwtAuth.getToken();
    ResolvedMember member = resolveMember(jwt, JwtClaims.extractRole(jwt));
    if (member != null && !member.active()) {
      log.warn("Rejected request from inactive member {}", member.id());
      response.sendError(HttpServletResponse.SC_FORBIDDEN, "Member account is inactive");
      return;
    }
    try {
      if (member != null) {
        MemberContext.bind(member.id(), member.role());
      }
      filterChain.doFilter(request, response);
    } finally {
      MemberContext.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }

  public void evictFromCache(String externalUserId) {
    memberCache.invalidate(externalUserId);
  }

  private ResolvedMember resolveMember(Jwt jwt, String role) {
    String externalUserId = jwt.getSubject();
    if (externalUserId == null) {
      return null;
    }
    try {
      return memberCache.get(externalUserId, k -> resolveOrCreateMember(jwt, role));
    } catch (RuntimeException e) {
      log.warn("Failed to resolve/create member for user {}: {}", externalUserId, e.getMessage());
      return null;
    }
  }

  private ResolvedMember resolveOrCreateMember(Jwt jwt, String role) {
    return memberRepository
        .findByExternalUserId(jwt.getSubject())
        .map(ResolvedMember::from)
        .orElseGet(() -> lazyCreateMember(jwt, role));
  }

  private ResolvedMember lazyCreateMember(Jwt jwt, String role) {
    String externalUserId = jwt.getSubject();
    String email = JwtClaims.extractEmail(jwt);
    String name = JwtClaims.extractName(jwt);
    try {
      var member =
          new Member(
              externalUserId,
              email != null ? email : externalUserId + "@placeholder.internal",
              name != null ? name : externalUserId,
              null,
              role != null ? role : Roles.MEMBER);
      member = memberRepository.save(member);
      log.info("Lazy-created member {} for user {}", member.getId(), externalUserId);
      return ResolvedMember.from(member);
    } catch (DataIntegrityViolationException e) {
      // Another request created the same member concurrently
      return memberRepository
          .findByExternalUserId(externalUserId)
          .map(ResolvedMember::from)
          .orElseThrow(
              () ->
                  new IllegalStateException(
                      "Member not found after constraint violation for: " + externalUserId));
    }
  }

  /** What the filter caches per JWT subject. */
  record ResolvedMember(UUID id, String role, boolean active) {

    static ResolvedMember from(Member member) {
      String role = member.getRole() != null ? member.getRole() : Roles.MEMBER;
      return new ResolvedMember(member.getId(), role, member.isActive());
    }
  }
}
