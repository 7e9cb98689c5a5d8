package io.b2mash.teamboard.workflow;

import io.b2mash.teamboard.approval.ApprovalVote;
import io.b2mash.teamboard.approval.ApprovalVoteRepository;
import io.b2mash.teamboard.approval.Ballot;
import io.b2mash.teamboard.approval.VoteAction;
import io.b2mash.teamboard.exception.ApprovalInFlightException;
import io.b2mash.teamboard.exception.ForbiddenException;
import io.b2mash.teamboard.exception.InvalidStateException;
import io.b2mash.teamboard.exception.NoOpenBallotException;
import io.b2mash.teamboard.exception.NoSuchBallotException;
import io.b2mash.teamboard.exception.NotRequesterException;
import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.notification.MentionScanner;
import io.b2mash.teamboard.notification.NotificationKind;
import io.b2mash.teamboard.notification.NotificationPayload;
import io.b2mash.teamboard.notification.NotificationSink;
import io.b2mash.teamboard.stakeholder.TaskStakeholder;
import io.b2mash.teamboard.stakeholder.TaskStakeholderRepository;
import io.b2mash.teamboard.statushistory.ReviewResult;
import io.b2mash.teamboard.statushistory.StatusChangeRecord;
import io.b2mash.teamboard.statushistory.StatusChangeRecordRepository;
import io.b2mash.teamboard.statushistory.StatusHistoryService;
import io.b2mash.teamboard.task.Task;
import io.b2mash.teamboard.task.TaskRepository;
import io.b2mash.teamboard.task.TaskStatus;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Task status state machine with stakeholder approval.
 *
 * <p>A creator's status change on a task that has other stakeholders opens a ballot instead of
 * taking effect: a PENDING ledger record plus one PENDING vote per stakeholder. The change is
 * applied when the last vote approves; a single rejection closes the ballot for good. Moves to
 * CANCELLED and changes by an admin who is not the creator always apply immediately.
 *
 * <p>Every operation locks the task row first, so concurrent requests, votes and cancellations on
 * one task run one after another. Notifications go through {@link NotificationSink} and are only
 * delivered after commit.
 */
@Service
public class TransitionEngine {

  private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

  private final TaskRepository taskRepository;
  private final TaskStakeholderRepository stakeholderRepository;
  private final StatusHistoryService statusHistoryService;
  private final StatusChangeRecordRepository statusChangeRecordRepository;
  private final ApprovalVoteRepository approvalVoteRepository;
  private final NotificationSink notificationSink;
  private final MentionScanner mentionScanner;

  public TransitionEngine(
      TaskRepository taskRepository,
      TaskStakeholderRepository stakeholderRepository,
      StatusHistoryService statusHistoryService,
      StatusChangeRecordRepository statusChangeRecordRepository,
      ApprovalVoteRepository approvalVoteRepository,
      NotificationSink notificationSink,
      MentionScanner mentionScanner) {
    this.taskRepository = taskRepository;
    this.stakeholderRepository = stakeholderRepository;
    this.statusHistoryService = statusHistoryService;
    this.statusChangeRecordRepository = statusChangeRecordRepository;
    this.approvalVoteRepository = approvalVoteRepository;
    this.notificationSink = notificationSink;
    this.mentionScanner = mentionScanner;
  }

  /**
   * Requests moving the task to {@code newStatus}.
   *
   * @param reviewResult result recorded on an immediately applied change; PASSED, REJECTED or null
   * @return {@link TransitionOutcome#PENDING} when a ballot was opened, otherwise {@link
   *     TransitionOutcome#APPLIED}
   * @throws ForbiddenException if the actor is neither creator nor admin
   * @throws io.b2mash.teamboard.exception.InvalidTransitionException if {@code newStatus} is not
   *     an allowed successor
   * @throws ApprovalInFlightException if the task already has an open ballot
   */
  @Transactional
  public TransitionResult requestTransition(
      UUID taskId,
      TaskActor actor,
      TaskStatus newStatus,
      String comment,
      ReviewResult reviewResult,
      String reviewFeedback) {
    var task = lockTask(taskId);
    if (!actor.canManage()) {
      throw new ForbiddenException(
          "Cannot change task status",
          "Only the task creator or an admin can change the status of task " + taskId);
    }
    task.requireTransition(newStatus);
    statusHistoryService
        .findPending(taskId)
        .ifPresent(
            pending -> {
              throw new ApprovalInFlightException(taskId, pending.getId());
            });
    if (reviewResult == ReviewResult.PENDING || reviewResult == ReviewResult.CANCELLED) {
      throw new InvalidStateException(
          "Invalid review result", "reviewResult must be PASSED, REJECTED or empty");
    }

    Set<UUID> voters = stakeholderIds(taskId);
    voters.remove(actor.memberId());
    boolean needsApproval =
        actor.isCreator() && !voters.isEmpty() && newStatus != TaskStatus.CANCELLED;

    if (needsApproval) {
      return openBallot(task, actor, newStatus, comment, reviewFeedback, voters);
    }
    return applyImmediately(task, actor, newStatus, comment, reviewResult, reviewFeedback);
  }

  /**
   * Records the voter's decision on the task's open ballot.
   *
   * @param statusChangeId the ballot being voted on; {@code null} means the task's open ballot
   * @throws NoSuchBallotException if the voter has no pending vote on an open ballot of the task
   */
  @Transactional
  public TransitionResult castVote(
      UUID taskId, UUID statusChangeId, TaskActor voter, VoteAction action, String comment) {
    var task = lockTask(taskId);
    ApprovalVote vote =
        approvalVoteRepository
            .findPendingVoteOnOpenBallot(taskId, voter.memberId())
            .filter(v -> statusChangeId == null || v.getStatusChangeId().equals(statusChangeId))
            .orElseThrow(() -> new NoSuchBallotException(taskId, voter.memberId()));
    StatusChangeRecord record =
        statusChangeRecordRepository
            .findById(vote.getStatusChangeId())
            .orElseThrow(() -> new NoSuchBallotException(taskId, voter.memberId()));

    vote.cast(action, comment);
    approvalVoteRepository.saveAndFlush(vote);

    if (action == VoteAction.REJECT) {
      record.resolve(ReviewResult.REJECTED);
      statusChangeRecordRepository.save(record);
      log.info(
          "Member {} rejected status change {} on task {} ({} -> {})",
          voter.memberId(),
          record.getId(),
          taskId,
          record.getFromStatus(),
          record.getToStatus());
      notificationSink.notify(
          Set.of(record.getChangedBy()),
          NotificationKind.APPROVAL_REJECTED,
          taskId,
          voter.memberId(),
          payload(record.getFromStatus(), record.getToStatus(), comment, record.getId()));
      return new TransitionResult(TransitionOutcome.REJECTED, record.getId(), task);
    }

    // Tally from the stored votes, never from a counter
    long outstanding = approvalVoteRepository.countNotApproved(record.getId());
    if (outstanding > 0) {
      log.debug(
          "Status change {} on task {} awaits {} more approval(s)",
          record.getId(),
          taskId,
          outstanding);
      return new TransitionResult(TransitionOutcome.AWAITING_MORE_VOTES, record.getId(), task);
    }

    TaskStatus from = task.getStatus();
    task.applyStatus(record.getToStatus());
    taskRepository.save(task);
    record.resolve(ReviewResult.PASSED);
    statusChangeRecordRepository.save(record);
    log.info(
        "Status change {} approved by all stakeholders; task {} moved {} -> {}",
        record.getId(),
        taskId,
        from,
        task.getStatus());
    // Announced on behalf of the requester, so the requester is the one left out
    notificationSink.notify(
        audience(task),
        NotificationKind.STATUS_CHANGE,
        taskId,
        record.getChangedBy(),
        payload(from, task.getStatus(), record.getComment(), record.getId()));
    return new TransitionResult(TransitionOutcome.RESOLVED, record.getId(), task);
  }

  /**
   * Withdraws the task's open ballot. The task status is not touched and the withdrawn votes are
   * deleted.
   *
   * @throws NoOpenBallotException if the task has no open ballot
   * @throws NotRequesterException if the actor did not open the ballot
   */
  @Transactional
  public TransitionResult cancelBallot(UUID taskId, TaskActor actor) {
    var task = lockTask(taskId);
    var record =
        statusHistoryService
            .findPending(taskId)
            .orElseThrow(() -> new NoOpenBallotException(taskId));
    if (!record.isRequestedBy(actor.memberId())) {
      throw new NotRequesterException(record.getId());
    }

    Set<UUID> enrolled = new LinkedHashSet<>();
    for (var vote : approvalVoteRepository.findByStatusChangeId(record.getId())) {
      enrolled.add(vote.getStakeholderId());
    }
    record.resolve(ReviewResult.CANCELLED);
    statusChangeRecordRepository.save(record);
    int deleted = approvalVoteRepository.deleteByStatusChangeId(record.getId());
    log.info(
        "Member {} withdrew status change {} on task {} ({} vote(s) removed)",
        actor.memberId(),
        record.getId(),
        taskId,
        deleted);

    notificationSink.notify(
        enrolled,
        NotificationKind.APPROVAL_CANCELLED,
        taskId,
        actor.memberId(),
        payload(record.getFromStatus(), record.getToStatus(), null, record.getId()));
    return new TransitionResult(TransitionOutcome.CANCELLED, record.getId(), task);
  }

  /** The task's open ballot, if any. */
  @Transactional(readOnly = true)
  public Optional<Ballot> findOpenBallot(UUID taskId) {
    return statusHistoryService
        .findPending(taskId)
        .map(
            record ->
                Ballot.of(record, approvalVoteRepository.findByStatusChangeId(record.getId())));
  }

  // --- Private helpers ---

  private TransitionResult openBallot(
      Task task,
      TaskActor actor,
      TaskStatus newStatus,
      String comment,
      String reviewFeedback,
      Set<UUID> voters) {
    TaskStatus from = task.getStatus();
    var record =
        statusHistoryService.openPending(
            task.getId(), from, newStatus, actor.memberId(), comment, reviewFeedback);
    approvalVoteRepository.saveAll(
        voters.stream().map(voterId -> new ApprovalVote(record.getId(), voterId)).toList());
    log.info(
        "Opened approval for task {} ({} -> {}) with {} stakeholder(s), status change {}",
        task.getId(),
        from,
        newStatus,
        voters.size(),
        record.getId());

    notificationSink.notify(
        voters,
        NotificationKind.APPROVAL_REQUEST,
        task.getId(),
        actor.memberId(),
        payload(from, newStatus, comment, record.getId()));
    return new TransitionResult(TransitionOutcome.PENDING, record.getId(), task);
  }

  private TransitionResult applyImmediately(
      Task task,
      TaskActor actor,
      TaskStatus newStatus,
      String comment,
      ReviewResult reviewResult,
      String reviewFeedback) {
    TaskStatus from = task.getStatus();
    task.applyStatus(newStatus);
    taskRepository.save(task);
    var record =
        statusHistoryService.recordApplied(
            task.getId(), from, newStatus, actor.memberId(), comment, reviewFeedback, reviewResult);
    log.info(
        "Task {} moved {} -> {} by member {}", task.getId(), from, newStatus, actor.memberId());

    notificationSink.notify(
        audience(task),
        newStatus.isReview() ? NotificationKind.REVIEW_REQUESTED : NotificationKind.STATUS_CHANGE,
        task.getId(),
        actor.memberId(),
        payload(from, newStatus, comment, record.getId()));
    notifyMentions(task.getId(), actor.memberId(), reviewFeedback);
    return new TransitionResult(TransitionOutcome.APPLIED, record.getId(), task);
  }

  private void notifyMentions(UUID taskId, UUID actorId, String reviewFeedback) {
    if (reviewFeedback == null || reviewFeedback.isBlank()) {
      return;
    }
    Set<UUID> mentioned = mentionScanner.scan(reviewFeedback);
    if (mentioned.isEmpty()) {
      return;
    }
    notificationSink.notify(
        mentioned,
        NotificationKind.MENTION,
        taskId,
        actorId,
        Map.of(NotificationPayload.TEXT, reviewFeedback, NotificationPayload.SOURCE, "review"));
  }

  private Task lockTask(UUID taskId) {
    return taskRepository
        .findByIdForUpdate(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }

  private Set<UUID> stakeholderIds(UUID taskId) {
    Set<UUID> ids = new LinkedHashSet<>();
    List<TaskStakeholder> stakeholders = stakeholderRepository.findByTaskId(taskId);
    for (var stakeholder : stakeholders) {
      ids.add(stakeholder.getMemberId());
    }
    return ids;
  }

  /** Assignee, creator and stakeholders. The actor is dropped at delivery. */
  private Set<UUID> audience(Task task) {
    Set<UUID> recipients = new LinkedHashSet<>();
    if (task.getAssigneeId() != null) {
      recipients.add(task.getAssigneeId());
    }
    recipients.add(task.getCreatedBy());
    recipients.addAll(stakeholderIds(task.getId()));
    return recipients;
  }

  private static Map<String, Object> payload(
      TaskStatus from, TaskStatus to, String comment, UUID statusChangeId) {
    var payload = new HashMap<String, Object>();
    payload.put(NotificationPayload.FROM_STATUS, from != null ? from.name() : null);
    payload.put(NotificationPayload.TO_STATUS, to.name());
    payload.put(NotificationPayload.COMMENT, comment);
    payload.put(NotificationPayload.STATUS_CHANGE_ID, statusChangeId);
    return payload;
  }
}
