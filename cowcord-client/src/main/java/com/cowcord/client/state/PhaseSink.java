package com.cowcord.client.state;

import com.cowcord.client.model.SessionPhase;

/**
 * Receives the phases a session moves through.  Called only from the session's own thread.
 */
@FunctionalInterface
public interface PhaseSink {

  /**
   * Publishes the new phase.
   *
   * @param phase the phase
   */
  void publish(SessionPhase phase);
}
