package io.b2mash.teamboard.project;

import static io.b2mash.teamboard.testutil.TestIds.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.teamboard.exception.ForbiddenException;
import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.member.MemberRepository;
import io.b2mash.teamboard.member.ProjectAccessService;
import io.b2mash.teamboard.member.ProjectMember;
import io.b2mash.teamboard.member.ProjectMemberRepository;
import io.b2mash.teamboard.security.Roles;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID OWNER = UUID.randomUUID();
  private static final UUID TEAMMATE = UUID.randomUUID();

  @Mock private ProjectRepository projectRepository;
  @Mock private ProjectMemberRepository projectMemberRepository;
  @Mock private MemberRepository memberRepository;
  @Mock private ProjectAccessService projectAccessService;

  private ProjectService service;

  @BeforeEach
  void setUp() {
    service =
        new ProjectService(
            projectRepository, projectMemberRepository, memberRepository, projectAccessService);
  }

  @Test
  void createProject_enrolsOwnerAsLeadAndOthersAsMembers() {
    when(projectRepository.save(any(Project.class)))
        .thenAnswer(inv -> withId(inv.<Project>getArgument(0), PROJECT_ID));
    when(memberRepository.existsById(TEAMMATE)).thenReturn(true);

    service.createProject("Launch", null, OWNER, List.of(OWNER, TEAMMATE));

    var captor = ArgumentCaptor.forClass(ProjectMember.class);
    verify(projectMemberRepository, times(2)).save(captor.capture());
    assertThat(captor.getAllValues())
        .extracting(ProjectMember::getMemberId, ProjectMember::getProjectRole)
        .containsExactly(
            tuple(OWNER, Roles.PROJECT_LEAD),
            tuple(TEAMMATE, Roles.PROJECT_MEMBER));
  }

  @Test
  void createProject_rejectsUnknownMember() {
    when(projectRepository.save(any(Project.class)))
        .thenAnswer(inv -> withId(inv.<Project>getArgument(0), PROJECT_ID));
    when(memberRepository.existsById(TEAMMATE)).thenReturn(false);

    assertThatThrownBy(() -> service.createProject("Launch", null, OWNER, List.of(TEAMMATE)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void updateProject_renamesWhenCallerCanManage() {
    var project = withId(new Project("Launch", null, OWNER), PROJECT_ID);
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(projectRepository.save(project)).thenReturn(project);

    var updated = service.updateProject(PROJECT_ID, "Relaunch", "v2", OWNER, Roles.MANAGER);

    assertThat(updated.getName()).isEqualTo("Relaunch");
    assertThat(updated.getDescription()).isEqualTo("v2");
  }

  @Test
  void updateProject_rejectsCallerWhoCannotManage() {
    var project = withId(new Project("Launch", null, OWNER), PROJECT_ID);
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    doThrow(new ForbiddenException("Cannot manage project", "no"))
        .when(projectAccessService)
        .requireManageAccess(PROJECT_ID, TEAMMATE, Roles.MANAGER);

    assertThatThrownBy(
            () -> service.updateProject(PROJECT_ID, "Relaunch", null, TEAMMATE, Roles.MANAGER))
        .isInstanceOf(ForbiddenException.class);
    assertThat(project.getName()).isEqualTo("Launch");
  }

  @Test
  void deleteProject_removesWhenCallerCanManage() {
    var project = withId(new Project("Launch", null, OWNER), PROJECT_ID);
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));

    service.deleteProject(PROJECT_ID, OWNER, Roles.MANAGER);

    verify(projectRepository).delete(project);
  }

  @Test
  void deleteProject_throwsForMissingProject() {
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deleteProject(PROJECT_ID, OWNER, Roles.ADMIN))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(projectRepository, never()).delete(any());
  }
}
