package com.scholary.syncmap.fragment;

/**
 * Base exception for fragment list operations that would break the list invariants.
 *
 * <p>Thrown before any mutation takes place, so a list that raised one of these is unchanged.
 */
public class SyncMapException extends RuntimeException {

  public SyncMapException(String message) {
    super(message);
  }

  public SyncMapException(String message, Throwable cause) {
    super(message, cause);
  }
}
