package com.cowcord.client.model;

import com.cowcord.client.exceptions.MalformedPayloadException;

/**
 * The identity of the account that approved the login on the companion device, as carried by
 * the decrypted {@code pending_ticket} payload ({@code user_id:discriminator:avatar_hash:username}).
 *
 * @param userId        the user id (snowflake)
 * @param discriminator the four-digit discriminator, {@code "0"} for migrated usernames
 * @param avatarHash    the avatar hash, {@code "0"} if the user has none
 * @param username      the username
 */
public record RemoteUser(String userId, String discriminator, String avatarHash, String username) {

  private static final String NO_AVATAR = "0";
  private static final int FIELD_COUNT = 4;

  /**
   * Parses a decrypted identity payload.
   *
   * @param payload the payload
   * @return the remote user
   * @throws MalformedPayloadException if the payload does not have exactly four fields
   */
  public static RemoteUser parse(final String payload) {
    if (payload == null) {
      throw new MalformedPayloadException("Identity payload is missing", null);
    }
    String[] fields = payload.split(":", -1);
    if (fields.length != FIELD_COUNT) {
      throw new MalformedPayloadException(
          "Identity payload has " + fields.length + " fields, expected " + FIELD_COUNT, null);
    }
    if (fields[0].isEmpty()) {
      throw new MalformedPayloadException("Identity payload has an empty user id", null);
    }
    return new RemoteUser(fields[0], fields[1], fields[2], fields[3]);
  }

  /**
   * Whether the user has a custom avatar.
   *
   * @return false when the avatar hash is empty or {@code "0"}
   */
  public boolean hasAvatar() {
    return avatarHash != null && !avatarHash.isEmpty() && !NO_AVATAR.equals(avatarHash);
  }
}
