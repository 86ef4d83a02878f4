package com.scholary.syncmap.fragment;

/** Exception thrown when a fragment lies (partly) outside the begin/end of its list. */
public class FragmentBoundsException extends SyncMapException {

  public FragmentBoundsException(String message) {
    super(message);
  }

  public FragmentBoundsException(String message, Throwable cause) {
    super(message, cause);
  }
}
