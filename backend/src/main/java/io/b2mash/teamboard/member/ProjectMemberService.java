package io.b2mash.teamboard.member;

import io.b2mash.teamboard.exception.InvalidStateException;
import io.b2mash.teamboard.exception.ResourceConflictException;
import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.project.ProjectRepository;
import io.b2mash.teamboard.security.Roles;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectMemberService {

  private static final Logger log = LoggerFactory.getLogger(ProjectMemberService.class);

  private final ProjectMemberRepository projectMemberRepository;
  private final MemberRepository memberRepository;
  private final ProjectRepository projectRepository;
  private final ProjectAccessService projectAccessService;

  public ProjectMemberService(
      ProjectMemberRepository projectMemberRepository,
      MemberRepository memberRepository,
      ProjectRepository projectRepository,
      ProjectAccessService projectAccessService) {
    this.projectMemberRepository = projectMemberRepository;
    this.memberRepository = memberRepository;
    this.projectRepository = projectRepository;
    this.projectAccessService = projectAccessService;
  }

  @Transactional(readOnly = true)
  public List<ProjectMemberInfo> listProjectMembers(UUID projectId) {
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("Project", projectId);
    }
    return projectMemberRepository.findProjectMembersWithDetails(projectId);
  }

  @Transactional
  public ProjectMember addMember(UUID projectId, UUID memberId, UUID addedBy, String role) {
    projectAccessService.requireManageAccess(projectId, addedBy, role);
    var member =
        memberRepository
            .findById(memberId)
            .filter(Member::isActive)
            .orElseThrow(() -> new ResourceNotFoundException("Member", memberId));

    if (projectMemberRepository.existsByProjectIdAndMemberId(projectId, memberId)) {
      throw new ResourceConflictException(
          "Member already on project",
          "Member " + memberId + " is already a member of project " + projectId);
    }

    var projectMember =
        projectMemberRepository.save(
            new ProjectMember(projectId, member.getId(), Roles.PROJECT_MEMBER, addedBy));
    log.info("Added member {} to project {} by member {}", memberId, projectId, addedBy);
    return projectMember;
  }

  @Transactional
  public void removeMember(UUID projectId, UUID memberId, UUID requestedBy, String role) {
    projectAccessService.requireManageAccess(projectId, requestedBy, role);
    var projectMember =
        projectMemberRepository
            .findByProjectIdAndMemberId(projectId, memberId)
            .orElseThrow(() -> new ResourceNotFoundException("Project member", memberId));

    if (Roles.PROJECT_LEAD.equals(projectMember.getProjectRole())) {
      throw new InvalidStateException(
          "Cannot remove project lead", "The project owner cannot be removed from the project");
    }

    projectMemberRepository.delete(projectMember);
    log.info("Removed member {} from project {} by member {}", memberId, projectId, requestedBy);
  }
}
