package io.b2mash.teamboard.task;

import io.b2mash.teamboard.exception.ForbiddenException;
import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.member.MemberRepository;
import io.b2mash.teamboard.member.ProjectAccessService;
import io.b2mash.teamboard.notification.MentionScanner;
import io.b2mash.teamboard.notification.NotificationKind;
import io.b2mash.teamboard.notification.NotificationPayload;
import io.b2mash.teamboard.notification.NotificationSink;
import io.b2mash.teamboard.stakeholder.StakeholderService;
import io.b2mash.teamboard.statushistory.StatusHistoryService;
import io.b2mash.teamboard.workflow.TaskActor;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Task CRUD. Status changes go through {@link io.b2mash.teamboard.workflow.TransitionEngine}. */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final ProjectAccessService projectAccessService;
  private final MemberRepository memberRepository;
  private final StakeholderService stakeholderService;
  private final StatusHistoryService statusHistoryService;
  private final NotificationSink notificationSink;
  private final MentionScanner mentionScanner;

  public TaskService(
      TaskRepository taskRepository,
      ProjectAccessService projectAccessService,
      MemberRepository memberRepository,
      StakeholderService stakeholderService,
      StatusHistoryService statusHistoryService,
      NotificationSink notificationSink,
      MentionScanner mentionScanner) {
    this.taskRepository = taskRepository;
    this.projectAccessService = projectAccessService;
    this.memberRepository = memberRepository;
    this.stakeholderService = stakeholderService;
    this.statusHistoryService = statusHistoryService;
    this.notificationSink = notificationSink;
    this.mentionScanner = mentionScanner;
  }

  /** Lists a project's tasks. Only project members and admins may list them. */
  @Transactional(readOnly = true)
  public List<Task> listTasks(
      UUID projectId, UUID memberId, String role, TaskStatus status, UUID assigneeId) {
    projectAccessService.requireMembership(projectId, memberId, role);
    return taskRepository.findByProjectIdWithFilters(projectId, status, assigneeId);
  }

  @Transactional(readOnly = true)
  public List<Task> listMyTasks(UUID memberId, boolean excludeCancelled) {
    return taskRepository.findInvolving(memberId, excludeCancelled);
  }

  @Transactional(readOnly = true)
  public Task getTask(UUID id) {
    return taskRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Task", id));
  }

  /**
   * Creates a TODO task. The creator must belong to the project unless they are an admin. The
   * initial {@code null -> TODO} ledger entry is written unconditionally; task creation is never
   * subject to approval.
   */
  @Transactional
  public Task createTask(
      UUID projectId,
      UUID createdBy,
      String role,
      TaskFields fields,
      Collection<UUID> stakeholderIds) {
    projectAccessService.requireMembership(projectId, createdBy, role);
    requireMemberIfPresent(fields.assigneeId());

    var task =
        new Task(
            projectId,
            fields.title(),
            fields.description(),
            fields.priority(),
            fields.taskType(),
            fields.assigneeId(),
            createdBy);
    task.schedule(fields.estimatedHours(), fields.startDate(), fields.dueDate());
    task = taskRepository.save(task);
    statusHistoryService.recordCreation(task.getId(), createdBy);
    if (stakeholderIds != null && !stakeholderIds.isEmpty()) {
      stakeholderService.replaceStakeholders(task.getId(), createdBy, stakeholderIds);
    }
    log.info("Created task {} in project {} by member {}", task.getId(), projectId, createdBy);

    notifyAssignee(task, createdBy);
    notifyMentions(task.getId(), createdBy, task.getDescription(), "description");
    return task;
  }

  /**
   * Edits a task's fields. {@code stakeholderIds}, when non-null, replaces the stakeholder set.
   * Status is not editable here.
   */
  @Transactional
  public Task updateTask(
      UUID id, TaskActor actor, TaskFields fields, Collection<UUID> stakeholderIds) {
    var task =
        taskRepository
            .findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("Task", id));
    requireManager(actor, id);
    requireMemberIfPresent(fields.assigneeId());

    UUID previousAssignee = task.getAssigneeId();
    String previousDescription = task.getDescription();
    task.update(
        fields.title(),
        fields.description(),
        fields.priority(),
        fields.taskType(),
        fields.assigneeId(),
        fields.estimatedHours(),
        fields.startDate(),
        fields.dueDate());
    task = taskRepository.save(task);
    if (stakeholderIds != null) {
      stakeholderService.replaceStakeholders(id, actor.memberId(), stakeholderIds);
    }
    log.info("Updated task {} by member {}", id, actor.memberId());

    if (!Objects.equals(previousAssignee, task.getAssigneeId())) {
      notifyAssignee(task, actor.memberId());
    }
    if (!Objects.equals(previousDescription, task.getDescription())) {
      notifyMentions(id, actor.memberId(), task.getDescription(), "description");
    }
    return task;
  }

  /** Deletes the task; stakeholders, ledger entries and votes go with it. */
  @Transactional
  public void deleteTask(UUID id, TaskActor actor) {
    var task =
        taskRepository
            .findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("Task", id));
    requireManager(actor, id);
    taskRepository.delete(task);
    log.info("Deleted task {} by member {}", id, actor.memberId());
  }

  private void notifyAssignee(Task task, UUID actorId) {
    if (task.getAssigneeId() == null) {
      return;
    }
    notificationSink.notify(
        Set.of(task.getAssigneeId()), NotificationKind.ASSIGNMENT, task.getId(), actorId, Map.of());
  }

  private void notifyMentions(UUID taskId, UUID actorId, String text, String source) {
    if (text == null || text.isBlank()) {
      return;
    }
    Set<UUID> mentioned = mentionScanner.scan(text);
    if (mentioned.isEmpty()) {
      return;
    }
    notificationSink.notify(
        mentioned,
        NotificationKind.MENTION,
        taskId,
        actorId,
        Map.of(NotificationPayload.TEXT, text, NotificationPayload.SOURCE, source));
  }

  private void requireMemberIfPresent(UUID memberId) {
    if (memberId != null && !memberRepository.existsById(memberId)) {
      throw new ResourceNotFoundException("Member", memberId);
    }
  }

  private static void requireManager(TaskActor actor, UUID taskId) {
    if (!actor.canManage()) {
      throw new ForbiddenException(
          "Cannot modify task", "Only the task creator or an admin can modify task " + taskId);
    }
  }

  /** Editable task fields, shared by create and update. */
  public record TaskFields(
      String title,
      String description,
      TaskPriority priority,
      String taskType,
      UUID assigneeId,
      BigDecimal estimatedHours,
      LocalDate startDate,
      LocalDate dueDate) {}
}
