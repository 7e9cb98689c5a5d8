package io.b2mash.teamboard.project;

import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.member.MemberRepository;
import io.b2mash.teamboard.member.ProjectAccessService;
import io.b2mash.teamboard.member.ProjectMember;
import io.b2mash.teamboard.member.ProjectMemberRepository;
import io.b2mash.teamboard.security.Roles;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository repository;
  private final ProjectMemberRepository projectMemberRepository;
  private final MemberRepository memberRepository;
  private final ProjectAccessService projectAccessService;

  public ProjectService(
      ProjectRepository repository,
      ProjectMemberRepository projectMemberRepository,
      MemberRepository memberRepository,
      ProjectAccessService projectAccessService) {
    this.repository = repository;
    this.projectMemberRepository = projectMemberRepository;
    this.memberRepository = memberRepository;
    this.projectAccessService = projectAccessService;
  }

  @Transactional(readOnly = true)
  public List<Project> listProjects() {
    return repository.findAllNewestFirst();
  }

  @Transactional(readOnly = true)
  public Project getProject(UUID id) {
    return repository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Project", id));
  }

  /**
   * Creates the project with its owner as lead. {@code memberIds} are enrolled as plain members;
   * the owner is skipped if listed.
   */
  @Transactional
  public Project createProject(
      String name, String description, UUID ownerId, Collection<UUID> memberIds) {
    var project = repository.save(new Project(name, description, ownerId));
    projectMemberRepository.save(
        new ProjectMember(project.getId(), ownerId, Roles.PROJECT_LEAD, null));

    var enrolled = new LinkedHashSet<UUID>();
    if (memberIds != null) {
      enrolled.addAll(memberIds);
    }
    enrolled.remove(ownerId);
    for (UUID memberId : enrolled) {
      if (!memberRepository.existsById(memberId)) {
        throw new ResourceNotFoundException("Member", memberId);
      }
      projectMemberRepository.save(
          new ProjectMember(project.getId(), memberId, Roles.PROJECT_MEMBER, ownerId));
    }
    log.info(
        "Created project {} with lead member {} and {} other member(s)",
        project.getId(),
        ownerId,
        enrolled.size());
    return project;
  }

  @Transactional
  public Project updateProject(
      UUID id, String name, String description, UUID memberId, String role) {
    var project = getProject(id);
    projectAccessService.requireManageAccess(id, memberId, role);
    project.update(name, description);
    project = repository.save(project);
    log.info("Updated project {} by member {}", id, memberId);
    return project;
  }

  /** Deletes the project; its tasks and memberships are removed by the database cascade. */
  @Transactional
  public void deleteProject(UUID id, UUID memberId, String role) {
    var project = getProject(id);
    projectAccessService.requireManageAccess(id, memberId, role);
    repository.delete(project);
    log.info("Deleted project {} by member {}", id, memberId);
  }
}
