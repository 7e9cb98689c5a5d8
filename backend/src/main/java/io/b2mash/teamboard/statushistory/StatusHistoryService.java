package io.b2mash.teamboard.statushistory;

import io.b2mash.teamboard.task.TaskStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Append-only access to a task's status ledger. */
@Service
public class StatusHistoryService {

  static final String CREATION_COMMENT = "Task created";

  private final StatusChangeRecordRepository repository;

  public StatusHistoryService(StatusChangeRecordRepository repository) {
    this.repository = repository;
  }

  /** Writes the {@code null -> TODO} entry every task starts with. */
  @Transactional
  public StatusChangeRecord recordCreation(UUID taskId, UUID createdBy) {
    return repository.save(
        new StatusChangeRecord(
            taskId, null, TaskStatus.TODO, createdBy, CREATION_COMMENT, null, null));
  }

  @Transactional
  public StatusChangeRecord recordApplied(
      UUID taskId,
      TaskStatus from,
      TaskStatus to,
      UUID changedBy,
      String comment,
      String reviewFeedback,
      ReviewResult reviewResult) {
    return repository.save(
        new StatusChangeRecord(taskId, from, to, changedBy, comment, reviewFeedback, reviewResult));
  }

  /** Writes a PENDING entry that represents an open approval ballot. */
  @Transactional
  public StatusChangeRecord openPending(
      UUID taskId,
      TaskStatus from,
      TaskStatus to,
      UUID requestedBy,
      String comment,
      String reviewFeedback) {
    return repository.save(
        new StatusChangeRecord(
            taskId, from, to, requestedBy, comment, reviewFeedback, ReviewResult.PENDING));
  }

  @Transactional(readOnly = true)
  public Optional<StatusChangeRecord> findPending(UUID taskId) {
    return repository.findPendingByTaskId(taskId);
  }

  @Transactional(readOnly = true)
  public List<StatusChangeRecord> history(UUID taskId) {
    return repository.findByTaskIdNewestFirst(taskId);
  }
}
