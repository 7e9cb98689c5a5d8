package io.b2mash.teamboard.member;

import io.b2mash.teamboard.exception.ForbiddenException;
import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.project.ProjectRepository;
import io.b2mash.teamboard.security.Roles;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectAccessService {

  private final ProjectMemberRepository projectMemberRepository;
  private final ProjectRepository projectRepository;

  public ProjectAccessService(
      ProjectMemberRepository projectMemberRepository, ProjectRepository projectRepository) {
    this.projectMemberRepository = projectMemberRepository;
    this.projectRepository = projectRepository;
  }

  /**
   * Admins act as members of every project and may manage it. Everyone else needs a membership
   * row; only the project owner may manage.
   *
   * @throws ResourceNotFoundException if the project does not exist
   */
  @Transactional(readOnly = true)
  public ProjectAccess checkAccess(UUID projectId, UUID memberId, String role) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    String projectRole =
        projectMemberRepository
            .findByProjectIdAndMemberId(projectId, memberId)
            .map(ProjectMember::getProjectRole)
            .orElse(null);

    if (Roles.isAdmin(role)) {
      return new ProjectAccess(true, true, projectRole);
    }
    if (projectRole == null) {
      return ProjectAccess.DENIED;
    }
    return new ProjectAccess(true, project.isOwnedBy(memberId), projectRole);
  }

  /** Throws {@link ForbiddenException} unless the caller belongs to the project. */
  @Transactional(readOnly = true)
  public ProjectAccess requireMembership(UUID projectId, UUID memberId, String role) {
    var access = checkAccess(projectId, memberId, role);
    if (!access.isMember()) {
      throw new ForbiddenException(
          "Not a project member", "You are not a member of project " + projectId);
    }
    return access;
  }

  /** Throws {@link ForbiddenException} unless the caller owns the project or is an admin. */
  @Transactional(readOnly = true)
  public ProjectAccess requireManageAccess(UUID projectId, UUID memberId, String role) {
    var access = checkAccess(projectId, memberId, role);
    if (!access.canManage()) {
      throw new ForbiddenException(
          "Cannot manage project",
          "Only the project owner or an admin can manage project " + projectId);
    }
    return access;
  }
}
