package io.nudge.queue.dispatch;

/**
 * What happened to the wake-up notification for one inserted job.
 */
public enum DispatchOutcome {

  /** One locker was notified. */
  NOTIFIED,

  /** No listening locker is interested in the job's queue. */
  NO_ELIGIBLE_LOCKER,

  /** The job is scheduled in the future; polling will pick it up. */
  NOT_READY,

  /** Dispatch is switched off. */
  DISABLED,

  /** Dispatch failed and was rolled back; the insert itself was kept. */
  FAILED
}
