package io.b2mash.teamboard.stakeholder;

import static io.b2mash.teamboard.testutil.TestIds.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.teamboard.exception.ForbiddenException;
import io.b2mash.teamboard.exception.ResourceConflictException;
import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.member.MemberRepository;
import io.b2mash.teamboard.notification.NotificationKind;
import io.b2mash.teamboard.notification.NotificationPayload;
import io.b2mash.teamboard.notification.NotificationSink;
import io.b2mash.teamboard.task.TaskRepository;
import io.b2mash.teamboard.workflow.TaskActor;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StakeholderServiceTest {

  private static final UUID TASK_ID = UUID.randomUUID();
  private static final UUID CREATOR = UUID.randomUUID();
  private static final UUID MEMBER_A = UUID.randomUUID();
  private static final UUID MEMBER_B = UUID.randomUUID();

  private static final TaskActor CREATOR_ACTOR =
      new TaskActor(CREATOR, "Creator", true, false, false, false);

  @Mock private TaskStakeholderRepository stakeholderRepository;
  @Mock private TaskRepository taskRepository;
  @Mock private MemberRepository memberRepository;
  @Mock private NotificationSink notificationSink;
  @InjectMocks private StakeholderService service;

  @BeforeEach
  void setUp() {
    lenient().when(taskRepository.existsById(TASK_ID)).thenReturn(true);
    lenient().when(memberRepository.existsById(any(UUID.class))).thenReturn(true);
    lenient()
        .when(stakeholderRepository.save(any(TaskStakeholder.class)))
        .thenAnswer(inv -> withId(inv.<TaskStakeholder>getArgument(0), UUID.randomUUID()));
  }

  @Test
  void addStakeholder_savesRowAndNotifiesNewStakeholder() {
    var added =
        service.addStakeholder(TASK_ID, CREATOR_ACTOR, MEMBER_A, StakeholderRole.REVIEWER);

    assertThat(added.getMemberId()).isEqualTo(MEMBER_A);
    assertThat(added.getRole()).isEqualTo(StakeholderRole.REVIEWER);
    verify(notificationSink)
        .notify(
            Set.of(MEMBER_A),
            NotificationKind.STAKEHOLDER_ADDED,
            TASK_ID,
            CREATOR,
            Map.of(NotificationPayload.ROLE, "REVIEWER"));
  }

  @Test
  void addStakeholder_defaultsRoleToStakeholder() {
    var added = service.addStakeholder(TASK_ID, CREATOR_ACTOR, MEMBER_A, null);

    assertThat(added.getRole()).isEqualTo(StakeholderRole.STAKEHOLDER);
  }

  @Test
  void addStakeholder_rejectsDuplicateMember() {
    when(stakeholderRepository.existsByTaskIdAndMemberId(TASK_ID, MEMBER_A)).thenReturn(true);

    assertThatThrownBy(() -> service.addStakeholder(TASK_ID, CREATOR_ACTOR, MEMBER_A, null))
        .isInstanceOf(ResourceConflictException.class);
    verify(stakeholderRepository, never()).save(any());
  }

  @Test
  void addStakeholder_throwsWhenMemberUnknown() {
    when(memberRepository.existsById(MEMBER_A)).thenReturn(false);

    assertThatThrownBy(() -> service.addStakeholder(TASK_ID, CREATOR_ACTOR, MEMBER_A, null))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void addStakeholder_rejectsNonManager() {
    var stakeholder = new TaskActor(MEMBER_B, "B", false, false, false, true);

    assertThatThrownBy(() -> service.addStakeholder(TASK_ID, stakeholder, MEMBER_A, null))
        .isInstanceOf(ForbiddenException.class);
    verifyNoInteractions(notificationSink);
  }

  @Test
  void removeStakeholder_rejectsRowOfAnotherTask() {
    var rowId = UUID.randomUUID();
    var foreign =
        withId(
            new TaskStakeholder(UUID.randomUUID(), MEMBER_A, StakeholderRole.STAKEHOLDER), rowId);
    when(stakeholderRepository.findById(rowId)).thenReturn(Optional.of(foreign));

    assertThatThrownBy(() -> service.removeStakeholder(TASK_ID, CREATOR_ACTOR, rowId))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(stakeholderRepository, never()).delete(any());
  }

  @Test
  void replaceStakeholders_keepsExistingDropsMissingAndAddsNew() {
    var keep =
        withId(
            new TaskStakeholder(TASK_ID, MEMBER_A, StakeholderRole.REVIEWER), UUID.randomUUID());
    var drop =
        withId(
            new TaskStakeholder(TASK_ID, CREATOR, StakeholderRole.STAKEHOLDER),
            UUID.randomUUID());
    when(stakeholderRepository.findByTaskId(TASK_ID)).thenReturn(List.of(keep, drop));

    service.replaceStakeholders(TASK_ID, CREATOR, List.of(MEMBER_A, MEMBER_B, MEMBER_B));

    verify(stakeholderRepository).delete(drop);
    verify(stakeholderRepository, never()).delete(keep);
    verify(stakeholderRepository)
        .save(
            argThat((TaskStakeholder s) -> s.getMemberId().equals(MEMBER_B)));
    verify(notificationSink)
        .notify(
            eq(Set.of(MEMBER_B)),
            eq(NotificationKind.STAKEHOLDER_ADDED),
            eq(TASK_ID),
            eq(CREATOR),
            anyMap());
  }

  @Test
  void replaceStakeholders_notifiesNobodyWhenSetUnchanged() {
    var keep =
        withId(
            new TaskStakeholder(TASK_ID, MEMBER_A, StakeholderRole.STAKEHOLDER),
            UUID.randomUUID());
    when(stakeholderRepository.findByTaskId(TASK_ID)).thenReturn(List.of(keep));

    service.replaceStakeholders(TASK_ID, CREATOR, List.of(MEMBER_A));

    verify(stakeholderRepository, never()).save(any());
    verifyNoInteractions(notificationSink);
  }
}
