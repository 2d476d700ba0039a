package com.cowcord.client.transport;

import com.cowcord.client.exceptions.TransportConnectException;

/**
 * Opens gateway connections.
 */
public interface TransportConnector {

  /**
   * Opens a new connection.
   *
   * @return the open transport
   * @throws TransportConnectException if the connection cannot be established
   */
  Transport connect();
}
