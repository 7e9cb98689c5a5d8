package io.b2mash.teamboard.task;

import io.b2mash.teamboard.approval.ApprovalStatus;
import io.b2mash.teamboard.approval.Ballot;
import io.b2mash.teamboard.member.MemberContext;
import io.b2mash.teamboard.member.MemberNameResolver;
import io.b2mash.teamboard.stakeholder.StakeholderController.StakeholderResponse;
import io.b2mash.teamboard.stakeholder.StakeholderService;
import io.b2mash.teamboard.statushistory.ReviewResult;
import io.b2mash.teamboard.statushistory.ReviewType;
import io.b2mash.teamboard.statushistory.StatusChangeRecord;
import io.b2mash.teamboard.statushistory.StatusHistoryService;
import io.b2mash.teamboard.workflow.TaskActorResolver;
import io.b2mash.teamboard.workflow.TransitionEngine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskController {

  private final TaskService taskService;
  private final StakeholderService stakeholderService;
  private final StatusHistoryService statusHistoryService;
  private final TransitionEngine transitionEngine;
  private final TaskActorResolver actorResolver;
  private final MemberNameResolver memberNameResolver;

  public TaskController(
      TaskService taskService,
      StakeholderService stakeholderService,
      StatusHistoryService statusHistoryService,
      TransitionEngine transitionEngine,
      TaskActorResolver actorResolver,
      MemberNameResolver memberNameResolver) {
    this.taskService = taskService;
    this.stakeholderService = stakeholderService;
    this.statusHistoryService = statusHistoryService;
    this.transitionEngine = transitionEngine;
    this.actorResolver = actorResolver;
    this.memberNameResolver = memberNameResolver;
  }

  @PostMapping("/api/projects/{projectId}/tasks")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<TaskResponse> createTask(
      @PathVariable UUID projectId, @Valid @RequestBody CreateTaskRequest request) {
    UUID createdBy = MemberContext.requireMemberId();
    var task =
        taskService.createTask(
            projectId,
            createdBy,
            MemberContext.getRole(),
            request.fields(),
            request.stakeholderIds());
    return ResponseEntity.created(URI.create("/api/tasks/" + task.getId()))
        .body(TaskResponse.from(task, resolveNames(List.of(task))));
  }

  @GetMapping("/api/projects/{projectId}/tasks")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<List<TaskResponse>> listTasks(
      @PathVariable UUID projectId,
      @RequestParam(required = false) TaskStatus status,
      @RequestParam(required = false) UUID assigneeId) {
    var tasks =
        taskService.listTasks(
            projectId,
            MemberContext.requireMemberId(),
            MemberContext.getRole(),
            status,
            assigneeId);
    var names = resolveNames(tasks);
    return ResponseEntity.ok(tasks.stream().map(t -> TaskResponse.from(t, names)).toList());
  }

  @GetMapping("/api/tasks/mine")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<List<TaskResponse>> listMyTasks(
      @RequestParam(defaultValue = "true") boolean excludeCancelled) {
    var tasks = taskService.listMyTasks(MemberContext.requireMemberId(), excludeCancelled);
    var names = resolveNames(tasks);
    return ResponseEntity.ok(tasks.stream().map(t -> TaskResponse.from(t, names)).toList());
  }

  @GetMapping("/api/tasks/{id}")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<TaskDetailResponse> getTask(@PathVariable UUID id) {
    var task = taskService.getTask(id);
    var stakeholders = stakeholderService.listStakeholders(id);
    var history = statusHistoryService.history(id);
    var ballot = transitionEngine.findOpenBallot(id);

    Set<UUID> memberIds = new HashSet<>();
    memberIds.add(task.getCreatedBy());
    memberIds.add(task.getAssigneeId());
    stakeholders.forEach(s -> memberIds.add(s.getMemberId()));
    history.forEach(h -> memberIds.add(h.getChangedBy()));
    ballot.ifPresent(b -> memberIds.addAll(b.voters()));
    var names = memberNameResolver.resolveNames(memberIds);

    return ResponseEntity.ok(
        new TaskDetailResponse(
            TaskResponse.from(task, names),
            stakeholders.stream().map(s -> StakeholderResponse.from(s, names)).toList(),
            history.stream().map(h -> StatusChangeResponse.from(h, names)).toList(),
            ballot.map(b -> PendingApprovalResponse.from(b, names)).orElse(null)));
  }

  @PutMapping("/api/tasks/{id}")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<TaskResponse> updateTask(
      @PathVariable UUID id, @Valid @RequestBody UpdateTaskRequest request) {
    var actor = actorResolver.resolve(id);
    var task = taskService.updateTask(id, actor, request.fields(), request.stakeholderIds());
    return ResponseEntity.ok(TaskResponse.from(task, resolveNames(List.of(task))));
  }

  @DeleteMapping("/api/tasks/{id}")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<Void> deleteTask(@PathVariable UUID id) {
    var actor = actorResolver.resolve(id);
    taskService.deleteTask(id, actor);
    return ResponseEntity.noContent().build();
  }

  private Map<UUID, String> resolveNames(List<Task> tasks) {
    var ids = new ArrayList<UUID>();
    for (var task : tasks) {
      ids.add(task.getCreatedBy());
      ids.add(task.getAssigneeId());
    }
    return memberNameResolver.resolveNames(ids);
  }

  // --- DTOs ---

  public record CreateTaskRequest(
      @NotBlank(message = "title is required")
          @Size(max = 500, message = "title must be at most 500 characters")
          String title,
      String description,
      TaskPriority priority,
      @Size(max = 100, message = "taskType must be at most 100 characters") String taskType,
      UUID assigneeId,
      @DecimalMin(value = "0", message = "estimatedHours must not be negative")
          BigDecimal estimatedHours,
      LocalDate startDate,
      LocalDate dueDate,
      List<UUID> stakeholderIds) {

    TaskService.TaskFields fields() {
      return new TaskService.TaskFields(
          title, description, priority, taskType, assigneeId, estimatedHours, startDate, dueDate);
    }
  }

  /** Full replacement of the editable fields; {@code stakeholderIds} is left alone when null. */
  public record UpdateTaskRequest(
      @NotBlank(message = "title is required")
          @Size(max = 500, message = "title must be at most 500 characters")
          String title,
      String description,
      TaskPriority priority,
      @Size(max = 100, message = "taskType must be at most 100 characters") String taskType,
      UUID assigneeId,
      @DecimalMin(value = "0", message = "estimatedHours must not be negative")
          BigDecimal estimatedHours,
      LocalDate startDate,
      LocalDate dueDate,
      List<UUID> stakeholderIds) {

    TaskService.TaskFields fields() {
      return new TaskService.TaskFields(
          title, description, priority, taskType, assigneeId, estimatedHours, startDate, dueDate);
    }
  }

  public record TaskResponse(
      UUID id,
      UUID projectId,
      String title,
      String description,
      TaskStatus status,
      TaskPriority priority,
      String taskType,
      UUID assigneeId,
      String assigneeName,
      UUID createdBy,
      String createdByName,
      BigDecimal estimatedHours,
      LocalDate startDate,
      LocalDate dueDate,
      Instant completedAt,
      int version,
      Instant createdAt,
      Instant updatedAt) {

    public static TaskResponse from(Task task, Map<UUID, String> names) {
      return new TaskResponse(
          task.getId(),
          task.getProjectId(),
          task.getTitle(),
          task.getDescription(),
          task.getStatus(),
          task.getPriority(),
          task.getTaskType(),
          task.getAssigneeId(),
          task.getAssigneeId() != null ? names.get(task.getAssigneeId()) : null,
          task.getCreatedBy(),
          names.get(task.getCreatedBy()),
          task.getEstimatedHours(),
          task.getStartDate(),
          task.getDueDate(),
          task.getCompletedAt(),
          task.getVersion(),
          task.getCreatedAt(),
          task.getUpdatedAt());
    }
  }

  public record StatusChangeResponse(
      UUID id,
      TaskStatus fromStatus,
      TaskStatus toStatus,
      UUID changedBy,
      String changedByName,
      String comment,
      ReviewType reviewType,
      String reviewFeedback,
      ReviewResult reviewResult,
      Instant changedAt) {

    public static StatusChangeResponse from(StatusChangeRecord record, Map<UUID, String> names) {
      return new StatusChangeResponse(
          record.getId(),
          record.getFromStatus(),
          record.getToStatus(),
          record.getChangedBy(),
          names.get(record.getChangedBy()),
          record.getComment(),
          record.getReviewType(),
          record.getReviewFeedback(),
          record.getReviewResult(),
          record.getChangedAt());
    }
  }

  public record VoteResponse(UUID stakeholderId, String stakeholderName, ApprovalStatus status) {}

  public record PendingApprovalResponse(
      UUID statusChangeId,
      UUID requestedBy,
      String requestedByName,
      TaskStatus fromStatus,
      TaskStatus toStatus,
      long approvedCount,
      int totalVotes,
      List<VoteResponse> votes) {

    public static PendingApprovalResponse from(Ballot ballot, Map<UUID, String> names) {
      return new PendingApprovalResponse(
          ballot.statusChangeId(),
          ballot.requestedBy(),
          names.get(ballot.requestedBy()),
          ballot.fromStatus(),
          ballot.toStatus(),
          ballot.approvedCount(),
          ballot.votes().size(),
          ballot.votes().entrySet().stream()
              .map(e -> new VoteResponse(e.getKey(), names.get(e.getKey()), e.getValue()))
              .toList());
    }
  }

  public record TaskDetailResponse(
      TaskResponse task,
      List<StakeholderResponse> stakeholders,
      List<StatusChangeResponse> statusHistory,
      PendingApprovalResponse pendingApproval) {}
}
