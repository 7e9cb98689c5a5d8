package io.b2mash.teamboard.workflow;

import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.member.MemberContext;
import io.b2mash.teamboard.member.MemberNameResolver;
import io.b2mash.teamboard.security.Roles;
import io.b2mash.teamboard.stakeholder.TaskStakeholderRepository;
import io.b2mash.teamboard.task.Task;
import io.b2mash.teamboard.task.TaskRepository;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Builds the {@link TaskActor} for the member bound to the current request. */
@Component
public class TaskActorResolver {

  private final TaskRepository taskRepository;
  private final TaskStakeholderRepository stakeholderRepository;
  private final MemberNameResolver memberNameResolver;

  public TaskActorResolver(
      TaskRepository taskRepository,
      TaskStakeholderRepository stakeholderRepository,
      MemberNameResolver memberNameResolver) {
    this.taskRepository = taskRepository;
    this.stakeholderRepository = stakeholderRepository;
    this.memberNameResolver = memberNameResolver;
  }

  @Transactional(readOnly = true)
  public TaskActor resolve(UUID taskId) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    return resolve(task);
  }

  @Transactional(readOnly = true)
  public TaskActor resolve(Task task) {
    UUID memberId = MemberContext.requireMemberId();
    return new TaskActor(
        memberId,
        memberNameResolver.resolveName(memberId),
        task.isCreatedBy(memberId),
        Roles.isAdmin(MemberContext.getRole()),
        memberId.equals(task.getAssigneeId()),
        stakeholderRepository.existsByTaskIdAndMemberId(task.getId(), memberId));
  }
}
