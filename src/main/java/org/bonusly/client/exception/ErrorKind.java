package org.bonusly.client.exception;

/**
 * The closed set of failure kinds a client call can end with.
 */
public enum ErrorKind {
  /** Network-level failure: DNS, connect, I/O, timeout or an aborted request. */
  TRANSPORT,
  /** The server answered with a status outside 2xx. */
  HTTP_STATUS,
  /** The body was not a well-formed envelope of the expected type. */
  DECODE,
  /** A well-formed envelope reported an application-level failure. */
  API,
  /** The client was set up with invalid settings. */
  CONFIGURATION
}
