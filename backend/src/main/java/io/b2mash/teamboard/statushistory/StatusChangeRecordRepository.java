package io.b2mash.teamboard.statushistory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StatusChangeRecordRepository extends JpaRepository<StatusChangeRecord, UUID> {

  /** At most one row can match, backed by a partial unique index on {@code task_id}. */
  @Query(
      """
      SELECT r FROM StatusChangeRecord r
      WHERE r.taskId = :taskId
        AND r.reviewResult = io.b2mash.teamboard.statushistory.ReviewResult.PENDING
      """)
  Optional<StatusChangeRecord> findPendingByTaskId(@Param("taskId") UUID taskId);

  @Query(
      """
      SELECT r FROM StatusChangeRecord r
      WHERE r.taskId = :taskId
      ORDER BY r.changedAt DESC, r.id DESC
      """)
  List<StatusChangeRecord> findByTaskIdNewestFirst(@Param("taskId") UUID taskId);

  long countByTaskIdAndReviewResult(UUID taskId, ReviewResult reviewResult);
}
