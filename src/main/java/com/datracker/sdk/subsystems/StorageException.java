package com.datracker.sdk.subsystems;

/**
 * General exception class for all errors in reading from or writing to local storage.
 * <p>
 * The tracker uses this class to avoid depending on exception types from the underlying storage
 * framework (such as {@link java.sql.SQLException}).
 * <p>
 * This is an unchecked exception. Public tracker methods never throw it; it is only relevant when
 * implementing a custom {@link LocalStorage}.
 */
@SuppressWarnings("serial")
public class StorageException extends RuntimeException {
  /**
   * Creates an instance.
   * @param message a description of the failed operation
   * @param cause the underlying exception
   */
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
