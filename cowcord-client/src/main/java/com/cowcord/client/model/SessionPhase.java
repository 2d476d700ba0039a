package com.cowcord.client.model;

/**
 * The externally visible phase of a login session.  Published to a
 * {@link com.cowcord.client.state.PhaseSink} on every change.
 */
public interface SessionPhase {

  /**
   * The shared loading phase.
   *
   * @return the loading phase
   */
  static SessionPhase loading() {
    return Loading.INSTANCE;
  }

  /**
   * Waiting for the gateway to confirm our public key.  Each new connection attempt starts here.
   */
  record Loading() implements SessionPhase {
    private static final Loading INSTANCE = new Loading();
  }

  /**
   * Fingerprint verified; the payload should be rendered as a QR code for the companion device.
   *
   * @param displayPayload the URL to encode
   */
  record QrCode(String displayPayload) implements SessionPhase {
  }

  /**
   * The companion device scanned the code; waiting for the user to approve there.
   *
   * @param userId        the user id
   * @param discriminator the discriminator
   * @param avatarHash    the avatar hash
   * @param displayName   the username
   */
  record Accepted(String userId, String discriminator, String avatarHash, String displayName)
      implements SessionPhase {

    /**
     * Builds the phase for a parsed identity payload.
     *
     * @param user the user
     * @return the accepted phase
     */
    public static Accepted from(final RemoteUser user) {
      return new Accepted(user.userId(), user.discriminator(), user.avatarHash(), user.username());
    }
  }

  /**
   * The companion device aborted the login.
   */
  record Cancelled() implements SessionPhase {
  }

  /**
   * The token was obtained and handed to the caller.
   */
  record Completed() implements SessionPhase {
  }
}
