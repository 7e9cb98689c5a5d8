package io.b2mash.teamboard.member;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {

  Optional<Member> findByExternalUserId(String externalUserId);

  boolean existsByExternalUserId(String externalUserId);

  @Query("SELECT m FROM Member m WHERE m.status = 'active' ORDER BY m.name ASC")
  List<Member> findActive();

  /** Exact-name lookup used to resolve {@code @name} mentions. Inactive members are skipped. */
  @Query("SELECT m FROM Member m WHERE m.name IN :names AND m.status = 'active'")
  List<Member> findActiveByNameIn(@Param("names") Collection<String> names);
}
