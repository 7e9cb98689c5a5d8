package io.b2mash.teamboard.member;

import io.b2mash.teamboard.exception.ResourceNotFoundException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Applies member profile pushes from the identity provider's webhook relay. */
@Service
public class MemberSyncService {

  private static final Logger log = LoggerFactory.getLogger(MemberSyncService.class);

  private final MemberRepository memberRepository;
  private final MemberFilter memberFilter;

  public MemberSyncService(MemberRepository memberRepository, MemberFilter memberFilter) {
    this.memberRepository = memberRepository;
    this.memberFilter = memberFilter;
  }

  @Transactional
  public SyncResult syncMember(
      String externalUserId,
      String email,
      String name,
      String avatarUrl,
      String role,
      String jobTitle) {
    var existing = memberRepository.findByExternalUserId(externalUserId);
    if (existing.isPresent()) {
      var member = existing.get();
      String oldRole = member.getRole();
      member.updateFrom(email, name != null ? name : member.getName(), avatarUrl, role);
      if (jobTitle != null) {
        member.setJobTitle(jobTitle);
      }
      memberRepository.save(member);
      if (!oldRole.equals(role)) {
        // Cached role would otherwise outlive the change
        memberFilter.evictFromCache(externalUserId);
        log.info("Member {} role changed from {} to {}", externalUserId, oldRole, role);
      }
      log.info("Updated member {}", externalUserId);
      return new SyncResult(member.getId(), false);
    }

    var member = new Member(externalUserId, email, name != null ? name : email, avatarUrl, role);
    member.setJobTitle(jobTitle);
    member = memberRepository.save(member);
    log.info("Created member {} for user {}", member.getId(), externalUserId);
    return new SyncResult(member.getId(), true);
  }

  /**
   * Members are deactivated rather than deleted so that tasks, history and votes keep resolving
   * their author.
   */
  @Transactional
  public UUID deactivateMember(String externalUserId) {
    var member =
        memberRepository
            .findByExternalUserId(externalUserId)
            .orElseThrow(() -> new ResourceNotFoundException("Member", externalUserId));
    member.deactivate();
    memberRepository.save(member);
    memberFilter.evictFromCache(externalUserId);
    log.info("Deactivated member {}", externalUserId);
    return member.getId();
  }

  public record SyncResult(UUID memberId, boolean created) {}
}
