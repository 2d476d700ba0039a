package com.cowcord.client.state;

import com.cowcord.client.model.SessionPhase;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link PhaseSink} that keeps the most recent phase for any thread to read and forwards each
 * phase to registered listeners.  A listener that throws is logged and skipped.
 */
public class LatestPhaseHolder implements PhaseSink {

  private static final Logger log = LoggerFactory.getLogger(LatestPhaseHolder.class);

  private final AtomicReference<SessionPhase> current = new AtomicReference<>(SessionPhase.loading());
  private final List<Consumer<SessionPhase>> listeners = new CopyOnWriteArrayList<>();

  @Override
  public void publish(final SessionPhase phase) {
    Objects.requireNonNull(phase, "phase");
    log.debug("publish({})", phase.getClass().getSimpleName());
    current.set(phase);
    for (Consumer<SessionPhase> listener : listeners) {
      try {
        listener.accept(phase);
      } catch (RuntimeException e) {
        log.warn("Phase listener failed on {}", phase.getClass().getSimpleName(), e);
      }
    }
  }

  /**
   * The latest published phase, {@code Loading} before the first publish.
   *
   * @return the phase
   */
  public SessionPhase current() {
    return current.get();
  }

  public void addListener(final Consumer<SessionPhase> listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public boolean removeListener(final Consumer<SessionPhase> listener) {
    return listeners.remove(listener);
  }
}
