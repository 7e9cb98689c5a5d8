package io.b2mash.teamboard.stakeholder;

import io.b2mash.teamboard.exception.ForbiddenException;
import io.b2mash.teamboard.exception.ResourceConflictException;
import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.member.MemberRepository;
import io.b2mash.teamboard.notification.NotificationKind;
import io.b2mash.teamboard.notification.NotificationPayload;
import io.b2mash.teamboard.notification.NotificationSink;
import io.b2mash.teamboard.task.TaskRepository;
import io.b2mash.teamboard.workflow.TaskActor;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains the per-task stakeholder set. Changes never touch a ballot that is already open: its
 * voters were fixed when it was opened.
 */
@Service
public class StakeholderService {

  private static final Logger log = LoggerFactory.getLogger(StakeholderService.class);

  private final TaskStakeholderRepository stakeholderRepository;
  private final TaskRepository taskRepository;
  private final MemberRepository memberRepository;
  private final NotificationSink notificationSink;

  public StakeholderService(
      TaskStakeholderRepository stakeholderRepository,
      TaskRepository taskRepository,
      MemberRepository memberRepository,
      NotificationSink notificationSink) {
    this.stakeholderRepository = stakeholderRepository;
    this.taskRepository = taskRepository;
    this.memberRepository = memberRepository;
    this.notificationSink = notificationSink;
  }

  @Transactional(readOnly = true)
  public List<TaskStakeholder> listStakeholders(UUID taskId) {
    requireTask(taskId);
    return stakeholderRepository.findByTaskId(taskId);
  }

  @Transactional
  public TaskStakeholder addStakeholder(
      UUID taskId, TaskActor actor, UUID memberId, StakeholderRole role) {
    requireTask(taskId);
    requireManager(actor, taskId);
    requireMember(memberId);
    if (stakeholderRepository.existsByTaskIdAndMemberId(taskId, memberId)) {
      throw new ResourceConflictException(
          "Duplicate stakeholder",
          "Member %s is already a stakeholder of task %s".formatted(memberId, taskId));
    }

    var stakeholder = stakeholderRepository.save(new TaskStakeholder(taskId, memberId, role));
    log.info("Added member {} as {} on task {}", memberId, stakeholder.getRole(), taskId);
    notifyAdded(taskId, actor.memberId(), Set.of(memberId), stakeholder.getRole());
    return stakeholder;
  }

  @Transactional
  public void removeStakeholder(UUID taskId, TaskActor actor, UUID stakeholderId) {
    requireTask(taskId);
    requireManager(actor, taskId);
    var stakeholder =
        stakeholderRepository
            .findById(stakeholderId)
            .filter(s -> s.getTaskId().equals(taskId))
            .orElseThrow(() -> new ResourceNotFoundException("Stakeholder", stakeholderId));
    stakeholderRepository.delete(stakeholder);
    log.info("Removed member {} from stakeholders of task {}", stakeholder.getMemberId(), taskId);
  }

  /**
   * Makes {@code memberIds} the task's exact stakeholder set. Existing rows keep their role; new
   * members are added as {@link StakeholderRole#STAKEHOLDER} and notified.
   *
   * <p>Callers are responsible for authorization.
   */
  @Transactional
  public void replaceStakeholders(UUID taskId, UUID actorId, Collection<UUID> memberIds) {
    Set<UUID> wanted = new LinkedHashSet<>(memberIds);
    wanted.forEach(this::requireMember);

    var existing = stakeholderRepository.findByTaskId(taskId);
    Set<UUID> kept = new LinkedHashSet<>();
    for (var stakeholder : existing) {
      if (wanted.contains(stakeholder.getMemberId())) {
        kept.add(stakeholder.getMemberId());
      } else {
        stakeholderRepository.delete(stakeholder);
      }
    }

    Set<UUID> added = new LinkedHashSet<>(wanted);
    added.removeAll(kept);
    for (UUID memberId : added) {
      stakeholderRepository.save(
          new TaskStakeholder(taskId, memberId, StakeholderRole.STAKEHOLDER));
    }
    if (!added.isEmpty() || kept.size() != existing.size()) {
      log.info(
          "Stakeholders of task {} set to {} member(s), {} added",
          taskId,
          wanted.size(),
          added.size());
    }
    notifyAdded(taskId, actorId, added, StakeholderRole.STAKEHOLDER);
  }

  private void notifyAdded(UUID taskId, UUID actorId, Set<UUID> memberIds, StakeholderRole role) {
    if (memberIds.isEmpty()) {
      return;
    }
    notificationSink.notify(
        memberIds,
        NotificationKind.STAKEHOLDER_ADDED,
        taskId,
        actorId,
        Map.of(NotificationPayload.ROLE, role.name()));
  }

  private void requireTask(UUID taskId) {
    if (!taskRepository.existsById(taskId)) {
      throw new ResourceNotFoundException("Task", taskId);
    }
  }

  private void requireMember(UUID memberId) {
    if (!memberRepository.existsById(memberId)) {
      throw new ResourceNotFoundException("Member", memberId);
    }
  }

  private static void requireManager(TaskActor actor, UUID taskId) {
    if (!actor.canManage()) {
      throw new ForbiddenException(
          "Cannot manage stakeholders",
          "Only the task creator or an admin can change the stakeholders of task " + taskId);
    }
  }
}
