package io.b2mash.teamboard.project;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  @Query("SELECT p FROM Project p ORDER BY p.createdAt DESC")
  List<Project> findAllNewestFirst();
}
