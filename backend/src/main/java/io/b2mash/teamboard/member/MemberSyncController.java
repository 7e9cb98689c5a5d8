package io.b2mash.teamboard.member;

import io.b2mash.teamboard.security.Roles;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.net.URI;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/members")
public class MemberSyncController {

  private static final Logger log = LoggerFactory.getLogger(MemberSyncController.class);

  private final MemberSyncService syncService;

  public MemberSyncController(MemberSyncService syncService) {
    this.syncService = syncService;
  }

  @PostMapping("/sync")
  public ResponseEntity<SyncMemberResponse> syncMember(
      @Valid @RequestBody SyncMemberRequest request) {
    log.info("Received member sync: externalUserId={}", request.externalUserId());

    var result =
        syncService.syncMember(
            request.externalUserId(),
            request.email(),
            request.name(),
            request.avatarUrl(),
            request.role() != null ? request.role() : Roles.MEMBER,
            request.jobTitle());

    var response =
        new SyncMemberResponse(
            result.memberId(), request.externalUserId(), result.created() ? "created" : "updated");

    if (result.created()) {
      return ResponseEntity.created(URI.create("/internal/members/" + result.memberId()))
          .body(response);
    }
    return ResponseEntity.ok(response);
  }

  @DeleteMapping("/{externalUserId}")
  public ResponseEntity<Void> deactivateMember(@PathVariable String externalUserId) {
    log.info("Received member deactivation: externalUserId={}", externalUserId);
    syncService.deactivateMember(externalUserId);
    return ResponseEntity.noContent().build();
  }

  public record SyncMemberRequest(
      @NotBlank(message = "externalUserId is required") String externalUserId,
      @NotBlank(message = "email is required") String email,
      String name,
      String avatarUrl,
      @Pattern(regexp = "admin|manager|member", message = "role must be admin, manager or member")
          String role,
      String jobTitle) {}

  public record SyncMemberResponse(UUID memberId, String externalUserId, String action) {}
}
