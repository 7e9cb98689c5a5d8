package io.b2mash.teamboard.workflow;

import io.b2mash.teamboard.task.Task;
import java.util.UUID;

/**
 * @param statusChangeId the ledger record written or resolved by the operation
 * @param task the task after the operation
 */
public record TransitionResult(TransitionOutcome outcome, UUID statusChangeId, Task task) {}
