package io.b2mash.teamboard.approval;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApprovalVoteRepository extends JpaRepository<ApprovalVote, UUID> {

  /**
   * The voter's still-pending vote on the task's open ballot. Votes left PENDING on a ballot that
   * has already been rejected do not match.
   */
  @Query(
      """
      SELECT v FROM ApprovalVote v, StatusChangeRecord r
      WHERE r.id = v.statusChangeId
        AND r.taskId = :taskId
        AND r.reviewResult = io.b2mash.teamboard.statushistory.ReviewResult.PENDING
        AND v.stakeholderId = :stakeholderId
        AND v.approvalStatus = io.b2mash.teamboard.approval.ApprovalStatus.PENDING
      """)
  Optional<ApprovalVote> findPendingVoteOnOpenBallot(
      @Param("taskId") UUID taskId, @Param("stakeholderId") UUID stakeholderId);

  /** Votes on the ballot that are not yet APPROVED. Zero means the ballot is unanimous. */
  @Query(
      """
      SELECT COUNT(v) FROM ApprovalVote v
      WHERE v.statusChangeId = :statusChangeId
        AND v.approvalStatus <> io.b2mash.teamboard.approval.ApprovalStatus.APPROVED
      """)
  long countNotApproved(@Param("statusChangeId") UUID statusChangeId);

  @Query(
      "SELECT v FROM ApprovalVote v WHERE v.statusChangeId = :statusChangeId ORDER BY v.createdAt")
  List<ApprovalVote> findByStatusChangeId(@Param("statusChangeId") UUID statusChangeId);

  @Modifying
  @Query("DELETE FROM ApprovalVote v WHERE v.statusChangeId = :statusChangeId")
  int deleteByStatusChangeId(@Param("statusChangeId") UUID statusChangeId);
}
