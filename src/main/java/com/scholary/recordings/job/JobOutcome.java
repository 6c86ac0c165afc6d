package com.scholary.recordings.job;

/**
 * Terminal result of one worker run. Retryable failures are thrown instead.
 *
 * @param cancelReason {@code null} when the job completed
 */
public record JobOutcome(CancelReason cancelReason) {

  private static final JobOutcome COMPLETED = new JobOutcome(null);

  public static JobOutcome completed() {
    return COMPLETED;
  }

  public static JobOutcome cancelled(CancelReason reason) {
    return new JobOutcome(reason);
  }

  public boolean isCancelled() {
    return cancelReason != null;
  }
}
