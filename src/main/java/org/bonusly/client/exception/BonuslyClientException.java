package org.bonusly.client.exception;

/**
 * Base type of every failure surfaced by the client.
 * The subclasses in this package are the only implementations; callers can switch on
 * {@link #kind()} instead of testing types.
 */
public abstract class BonuslyClientException extends RuntimeException {

  private final ErrorKind kind;

  BonuslyClientException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  BonuslyClientException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
