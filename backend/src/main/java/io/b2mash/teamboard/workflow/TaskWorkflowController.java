package io.b2mash.teamboard.workflow;

import io.b2mash.teamboard.approval.VoteAction;
import io.b2mash.teamboard.member.MemberNameResolver;
import io.b2mash.teamboard.statushistory.ReviewResult;
import io.b2mash.teamboard.statushistory.StatusChangeRecord;
import io.b2mash.teamboard.statushistory.StatusHistoryService;
import io.b2mash.teamboard.task.TaskController.StatusChangeResponse;
import io.b2mash.teamboard.task.TaskController.TaskResponse;
import io.b2mash.teamboard.task.TaskService;
import io.b2mash.teamboard.task.TaskStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tasks/{id}")
public class TaskWorkflowController {

  private final TransitionEngine transitionEngine;
  private final TaskActorResolver actorResolver;
  private final StatusHistoryService statusHistoryService;
  private final TaskService taskService;
  private final MemberNameResolver memberNameResolver;

  public TaskWorkflowController(
      TransitionEngine transitionEngine,
      TaskActorResolver actorResolver,
      StatusHistoryService statusHistoryService,
      TaskService taskService,
      MemberNameResolver memberNameResolver) {
    this.transitionEngine = transitionEngine;
    this.actorResolver = actorResolver;
    this.statusHistoryService = statusHistoryService;
    this.taskService = taskService;
    this.memberNameResolver = memberNameResolver;
  }

  @PatchMapping("/status")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<TransitionResponse> changeStatus(
      @PathVariable UUID id, @Valid @RequestBody ChangeStatusRequest request) {
    var actor = actorResolver.resolve(id);
    var result =
        transitionEngine.requestTransition(
            id,
            actor,
            request.newStatus(),
            request.comment(),
            request.reviewResult(),
            request.reviewFeedback());
    return ResponseEntity.ok(toResponse(result));
  }

  @PostMapping("/approve")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<TransitionResponse> vote(
      @PathVariable UUID id, @Valid @RequestBody VoteRequest request) {
    var actor = actorResolver.resolve(id);
    var result =
        transitionEngine.castVote(
            id, request.statusChangeId(), actor, request.action(), request.comment());
    return ResponseEntity.ok(toResponse(result));
  }

  @PostMapping("/cancel-approval")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<TransitionResponse> cancelApproval(@PathVariable UUID id) {
    var actor = actorResolver.resolve(id);
    return ResponseEntity.ok(toResponse(transitionEngine.cancelBallot(id, actor)));
  }

  @GetMapping("/status-history")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<List<StatusChangeResponse>> statusHistory(@PathVariable UUID id) {
    taskService.getTask(id);
    var history = statusHistoryService.history(id);
    var names =
        memberNameResolver.resolveNames(
            history.stream().map(StatusChangeRecord::getChangedBy).toList());
    return ResponseEntity.ok(
        history.stream().map(h -> StatusChangeResponse.from(h, names)).toList());
  }

  private TransitionResponse toResponse(TransitionResult result) {
    var task = result.task();
    var ids = new ArrayList<UUID>();
    ids.add(task.getCreatedBy());
    ids.add(task.getAssigneeId());
    var names = memberNameResolver.resolveNames(ids);
    return new TransitionResponse(
        result.outcome(), result.statusChangeId(), TaskResponse.from(task, names));
  }

  // --- DTOs ---

  public record ChangeStatusRequest(
      @NotNull(message = "newStatus is required") TaskStatus newStatus,
      String comment,
      ReviewResult reviewResult,
      String reviewFeedback) {}

  /** {@code statusChangeId} pins the vote to one ballot; when omitted the open ballot is used. */
  public record VoteRequest(
      @NotNull(message = "action is required") VoteAction action,
      String comment,
      UUID statusChangeId) {}

  public record TransitionResponse(
      TransitionOutcome outcome, UUID statusChangeId, TaskResponse task) {}
}
