package io.b2mash.teamboard.statushistory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.teamboard.exception.InvalidStateException;
import io.b2mash.teamboard.task.TaskStatus;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StatusChangeRecordTest {

  private static final UUID TASK_ID = UUID.randomUUID();
  private static final UUID MEMBER = UUID.randomUUID();

  @ParameterizedTest
  @CsvSource({
    "TASK_REVIEW, IN_PROGRESS, TASK_REVIEW",
    "TASK_REVIEW, TODO, TASK_REVIEW",
    "RESULT_REVIEW, DONE, RESULT_REVIEW",
    "RESULT_REVIEW, IN_PROGRESS, RESULT_REVIEW"
  })
  void reviewType_followsTheStatusBeingLeft(
      TaskStatus from, TaskStatus to, ReviewType expected) {
    var record = new StatusChangeRecord(TASK_ID, from, to, MEMBER, null, null, null);

    assertThat(record.getReviewType()).isEqualTo(expected);
  }

  @Test
  void reviewType_isNullWhenLeavingNonReviewState() {
    assertThat(record(TaskStatus.TODO, null).getReviewType()).isNull();
    assertThat(
            new StatusChangeRecord(TASK_ID, null, TaskStatus.TODO, MEMBER, null, null, null)
                .getReviewType())
        .isNull();
  }

  @Test
  void resolve_closesPendingRecordOnce() {
    var record = record(TaskStatus.TODO, ReviewResult.PENDING);

    record.resolve(ReviewResult.PASSED);

    assertThat(record.getReviewResult()).isEqualTo(ReviewResult.PASSED);
    assertThat(record.isPending()).isFalse();
    assertThatThrownBy(() -> record.resolve(ReviewResult.CANCELLED))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void resolve_rejectsAppliedRecord() {
    var record = record(TaskStatus.TODO, null);

    assertThatThrownBy(() -> record.resolve(ReviewResult.REJECTED))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void resolve_rejectsPendingAsOutcome() {
    var record = record(TaskStatus.TODO, ReviewResult.PENDING);

    assertThatThrownBy(() -> record.resolve(ReviewResult.PENDING))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void isRequestedBy_matchesMemberWhoMadeTheChange() {
    var record = record(TaskStatus.TODO, ReviewResult.PENDING);

    assertThat(record.isRequestedBy(MEMBER)).isTrue();
    assertThat(record.isRequestedBy(UUID.randomUUID())).isFalse();
  }

  private static StatusChangeRecord record(TaskStatus from, ReviewResult result) {
    return new StatusChangeRecord(
        TASK_ID, from, TaskStatus.TASK_REVIEW, MEMBER, null, null, result);
  }
}
