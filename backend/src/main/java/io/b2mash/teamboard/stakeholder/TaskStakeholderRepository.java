package io.b2mash.teamboard.stakeholder;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskStakeholderRepository extends JpaRepository<TaskStakeholder, UUID> {

  @Query("SELECT s FROM TaskStakeholder s WHERE s.taskId = :taskId ORDER BY s.createdAt ASC")
  List<TaskStakeholder> findByTaskId(@Param("taskId") UUID taskId);

  Optional<TaskStakeholder> findByTaskIdAndMemberId(UUID taskId, UUID memberId);

  boolean existsByTaskIdAndMemberId(UUID taskId, UUID memberId);

  @Modifying
  @Query("DELETE FROM TaskStakeholder s WHERE s.taskId = :taskId")
  void deleteByTaskId(@Param("taskId") UUID taskId);
}
