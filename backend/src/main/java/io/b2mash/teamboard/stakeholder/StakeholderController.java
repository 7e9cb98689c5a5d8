package io.b2mash.teamboard.stakeholder;

import io.b2mash.teamboard.member.MemberNameResolver;
import io.b2mash.teamboard.workflow.TaskActorResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tasks/{taskId}/stakeholders")
public class StakeholderController {

  private final StakeholderService stakeholderService;
  private final TaskActorResolver actorResolver;
  private final MemberNameResolver memberNameResolver;

  public StakeholderController(
      StakeholderService stakeholderService,
      TaskActorResolver actorResolver,
      MemberNameResolver memberNameResolver) {
    this.stakeholderService = stakeholderService;
    this.actorResolver = actorResolver;
    this.memberNameResolver = memberNameResolver;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<List<StakeholderResponse>> listStakeholders(@PathVariable UUID taskId) {
    var stakeholders = stakeholderService.listStakeholders(taskId);
    var names =
        memberNameResolver.resolveNames(
            stakeholders.stream().map(TaskStakeholder::getMemberId).toList());
    return ResponseEntity.ok(
        stakeholders.stream().map(s -> StakeholderResponse.from(s, names)).toList());
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<StakeholderResponse> addStakeholder(
      @PathVariable UUID taskId, @Valid @RequestBody AddStakeholderRequest request) {
    var actor = actorResolver.resolve(taskId);
    var stakeholder =
        stakeholderService.addStakeholder(taskId, actor, request.memberId(), request.role());
    var names = memberNameResolver.resolveNames(List.of(stakeholder.getMemberId()));
    return ResponseEntity.created(
            URI.create("/api/tasks/" + taskId + "/stakeholders/" + stakeholder.getId()))
        .body(StakeholderResponse.from(stakeholder, names));
  }

  @DeleteMapping("/{stakeholderId}")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<Void> removeStakeholder(
      @PathVariable UUID taskId, @PathVariable UUID stakeholderId) {
    var actor = actorResolver.resolve(taskId);
    stakeholderService.removeStakeholder(taskId, actor, stakeholderId);
    return ResponseEntity.noContent().build();
  }

  public record AddStakeholderRequest(
      @NotNull(message = "memberId is required") UUID memberId, StakeholderRole role) {}

  public record StakeholderResponse(
      UUID id, UUID memberId, String memberName, StakeholderRole role, Instant createdAt) {

    public static StakeholderResponse from(TaskStakeholder stakeholder, Map<UUID, String> names) {
      return new StakeholderResponse(
          stakeholder.getId(),
          stakeholder.getMemberId(),
          names.get(stakeholder.getMemberId()),
          stakeholder.getRole(),
          stakeholder.getCreatedAt());
    }
  }
}
