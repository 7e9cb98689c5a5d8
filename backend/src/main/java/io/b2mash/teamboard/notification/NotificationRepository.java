package io.b2mash.teamboard.notification;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.recipientMemberId = :memberId
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findByRecipientMemberId(@Param("memberId") UUID memberId, Pageable pageable);

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.recipientMemberId = :memberId
        AND n.isRead = false
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findUnreadByRecipientMemberId(
      @Param("memberId") UUID memberId, Pageable pageable);

  @Query(
      """
      SELECT COUNT(n) FROM Notification n
      WHERE n.recipientMemberId = :memberId
        AND n.isRead = false
      """)
  long countUnreadByRecipientMemberId(@Param("memberId") UUID memberId);

  Optional<Notification> findByIdAndRecipientMemberId(UUID id, UUID recipientMemberId);

  @Modifying
  @Query(
      """
      UPDATE Notification n SET n.isRead = true, n.readAt = :readAt
      WHERE n.recipientMemberId = :memberId
        AND n.isRead = false
      """)
  int markAllAsRead(@Param("memberId") UUID memberId, @Param("readAt") Instant readAt);

  @Modifying
  @Query(
      """
      UPDATE Notification n SET n.isRead = true, n.readAt = :readAt
      WHERE n.recipientMemberId = :memberId
        AND n.id IN :ids
        AND n.isRead = false
      """)
  int markAsReadByIds(
      @Param("memberId") UUID memberId,
      @Param("ids") Collection<UUID> ids,
      @Param("readAt") Instant readAt);

  @Modifying
  @Query(
      """
      DELETE FROM Notification n
      WHERE n.recipientMemberId = :memberId
        AND (:readOnly = false OR n.isRead = true)
      """)
  int deleteForRecipient(@Param("memberId") UUID memberId, @Param("readOnly") boolean readOnly);
}
