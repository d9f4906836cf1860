package com.example.tokenrelay.exception;

/**
 * Failure talking to, or decoding the answer of, the authentication server.
 */
public class AuthServerException extends RuntimeException {
  public AuthServerException(String message) {
    super(message);
  }

  public AuthServerException(String message, Throwable cause) {
    super(message, cause);
  }
}
