package io.b2mash.teamboard.member;

import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/members")
public class MemberController {

  private final MemberRepository memberRepository;

  public MemberController(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<List<MemberResponse>> listMembers() {
    var members = memberRepository.findActive().stream().map(MemberResponse::from).toList();
    return ResponseEntity.ok(members);
  }

  public record MemberResponse(
      UUID id, String name, String email, String avatarUrl, String role, String jobTitle) {

    public static MemberResponse from(Member member) {
      return new MemberResponse(
          member.getId(),
          member.getName(),
          member.getEmail(),
          member.getAvatarUrl(),
          member.getRole(),
          member.getJobTitle());
    }
  }
}
