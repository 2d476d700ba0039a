package com.cowcord.client.heartbeat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Liveness bookkeeping for one gateway connection.
 * <p>
 * Inactive until the gateway's {@code hello} announces an interval; while inactive it never
 * fires and {@link #timeUntilNextBeat()} is empty.  Once activated it fires every interval,
 * starting one interval after activation.  A beat is only sent if the previous one was
 * acknowledged, so at most one heartbeat is ever outstanding.
 * <p>
 * Not thread-safe; owned by the connection loop.
 */
public class HeartbeatScheduler {

  /**
   * What the connection loop has to do now.
   */
  public enum Tick {
    /** Nothing is due. */
    IDLE,
    /** Send a heartbeat; it is now outstanding. */
    SEND,
    /** A beat is due but the previous one was never acknowledged. */
    MISSED_ACK
  }

  private final Clock clock;

  private Duration interval;
  private Instant nextBeatAt;
  private boolean ackPending;

  /**
   * Instantiates a new Heartbeat scheduler.
   *
   * @param clock the time source
   */
  public HeartbeatScheduler(final Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Starts beating at the given interval.  Re-activation restarts the schedule.
   *
   * @param interval the heartbeat interval, positive
   */
  public void activate(final Duration interval) {
    if (interval == null || interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Heartbeat interval must be positive: " + interval);
    }
    this.interval = interval;
    this.nextBeatAt = clock.instant().plus(interval);
    this.ackPending = false;
  }

  public boolean isActive() {
    return interval != null;
  }

  public boolean isAckPending() {
    return ackPending;
  }

  /**
   * Time left until the next beat is due.
   *
   * @return empty while inactive, otherwise a non-negative duration
   */
  public Optional<Duration> timeUntilNextBeat() {
    if (!isActive()) {
      return Optional.empty();
    }
    Duration remaining = Duration.between(clock.instant(), nextBeatAt);
    return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
  }

  /**
   * Evaluates the schedule at the current time.  Returns {@link Tick#SEND} at most once per
   * period and marks the beat outstanding.
   *
   * @return the action due now
   */
  public Tick tick() {
    if (!isActive()) {
      return Tick.IDLE;
    }
    Instant now = clock.instant();
    if (now.isBefore(nextBeatAt)) {
      return Tick.IDLE;
    }
    if (ackPending) {
      return Tick.MISSED_ACK;
    }
    ackPending = true;
    Instant next = nextBeatAt.plus(interval);
    // A stalled loop resumes the period from now rather than firing a burst of overdue beats.
    nextBeatAt = next.isAfter(now) ? next : now.plus(interval);
    return Tick.SEND;
  }

  /**
   * Records a {@code heartbeat_ack}.
   */
  public void acknowledge() {
    ackPending = false;
  }
}
