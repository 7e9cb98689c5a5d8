package io.b2mash.teamboard.task;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  /**
   * Loads the task with a row lock ({@code SELECT ... FOR UPDATE}). Every workflow mutation goes
   * through this so that transitions, votes and cancellations on one task are serialized.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Task t WHERE t.id = :id")
  Optional<Task> findByIdForUpdate(@Param("id") UUID id);

  @Query(
      """
      SELECT t FROM Task t WHERE t.projectId = :projectId
        AND (:status IS NULL OR t.status = :status)
        AND (:assigneeId IS NULL OR t.assigneeId = :assigneeId)
      ORDER BY t.createdAt DESC
      """)
  List<Task> findByProjectIdWithFilters(
      @Param("projectId") UUID projectId,
      @Param("status") TaskStatus status,
      @Param("assigneeId") UUID assigneeId);

  /** Tasks the member is assigned to, created, or holds a stakeholder seat on. */
  @Query(
      """
      SELECT t FROM Task t
      WHERE (t.assigneeId = :memberId
          OR t.createdBy = :memberId
          OR t.id IN (SELECT s.taskId FROM TaskStakeholder s WHERE s.memberId = :memberId))
        AND (:excludeCancelled = false
          OR t.status <> io.b2mash.teamboard.task.TaskStatus.CANCELLED)
      ORDER BY t.dueDate ASC NULLS LAST, t.createdAt DESC
      """)
  List<Task> findInvolving(
      @Param("memberId") UUID memberId, @Param("excludeCancelled") boolean excludeCancelled);
}
