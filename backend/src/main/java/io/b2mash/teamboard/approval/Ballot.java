package io.b2mash.teamboard.approval;

import io.b2mash.teamboard.statushistory.StatusChangeRecord;
import io.b2mash.teamboard.task.TaskStatus;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Snapshot of an approval ballot: the status change it would apply and every enrolled
 * stakeholder's vote.
 */
public record Ballot(
    UUID statusChangeId,
    UUID requestedBy,
    TaskStatus fromStatus,
    TaskStatus toStatus,
    boolean open,
    Map<UUID, ApprovalStatus> votes) {

  public Ballot {
    votes = Collections.unmodifiableMap(new LinkedHashMap<>(votes));
  }

  public static Ballot of(StatusChangeRecord record, Collection<ApprovalVote> votes) {
    var byVoter = new LinkedHashMap<UUID, ApprovalStatus>();
    for (var vote : votes) {
      byVoter.put(vote.getStakeholderId(), vote.getApprovalStatus());
    }
    return new Ballot(
        record.getId(),
        record.getChangedBy(),
        record.getFromStatus(),
        record.getToStatus(),
        record.isPending(),
        byVoter);
  }

  public Set<UUID> voters() {
    return votes.keySet();
  }

  public long approvedCount() {
    return votes.values().stream().filter(status -> status == ApprovalStatus.APPROVED).count();
  }
}
