package com.example.tokenrelay.exception;


/**
 * Key Material Exception
 */
public class KeyMaterialException extends RuntimeException {
  public KeyMaterialException(String message) {
    super(message);
  }

  public KeyMaterialException(String message, Throwable cause) {
    super(message, cause);
  }
}
