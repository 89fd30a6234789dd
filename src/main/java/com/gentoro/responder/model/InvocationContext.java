package com.gentoro.responder.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Caller-owned cancellation and deadline signal for one or more generation calls.
 *
 * <p>Create one per inbound HTTP request. {@link #cancel()} may be called from any thread; calls
 * blocked on the backend return promptly with a {@link
 * com.gentoro.responder.exception.GenerationCancelledException}. The deadline is also handed to
 * the provider SDK as its per-request timeout, so the network exchange itself ends with it.
 */
public final class InvocationContext {
  private final Instant deadline;
  private final Clock clock;
  private final Set<Runnable> listeners = new LinkedHashSet<>();
  private boolean cancelled;

  private InvocationContext(Instant deadline, Clock clock) {
    this.deadline = deadline;
    this.clock = clock;
  }

  /** A context without deadline; it ends only through {@link #cancel()}. */
  public static InvocationContext none() {
    return new InvocationContext(null, Clock.systemUTC());
  }

  public static InvocationContext withTimeout(Duration timeout) {
    return withDeadline(Instant.now().plus(timeout));
  }

  public static InvocationContext withDeadline(Instant deadline) {
    return new InvocationContext(deadline, Clock.systemUTC());
  }

  /** Marks the context cancelled and runs the registered actions once, outside the lock. */
  public void cancel() {
    List<Runnable> toRun;
    synchronized (listeners) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      toRun = List.copyOf(listeners);
      listeners.clear();
    }
    toRun.forEach(Runnable::run);
  }

  public boolean isCancelled() {
    synchronized (listeners) {
      return cancelled;
    }
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  public boolean isExpired() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  /** Time left until the deadline, never negative; empty when there is no deadline. */
  public Optional<Duration> remaining() {
    if (deadline == null) {
      return Optional.empty();
    }
    Duration left = Duration.between(clock.instant(), deadline);
    return Optional.of(left.isNegative() ? Duration.ZERO : left);
  }

  /**
   * Runs {@code action} once this context is cancelled, immediately if it already is. Closing the
   * returned registration drops the action, so a context shared by many calls does not accumulate
   * them.
   */
  public Registration onCancel(Runnable action) {
    synchronized (listeners) {
      if (!cancelled) {
        Runnable entry = action::run;
        listeners.add(entry);
        return () -> {
          synchronized (listeners) {
            listeners.remove(entry);
          }
        };
      }
    }
    action.run();
    return () -> {};
  }

  /** Number of cancel actions registered and not yet run or closed. */
  public int pendingActions() {
    synchronized (listeners) {
      return listeners.size();
    }
  }

  /** Handle to a cancel action; closing it is idempotent. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
