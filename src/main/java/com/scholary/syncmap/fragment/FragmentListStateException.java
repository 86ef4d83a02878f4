package com.scholary.syncmap.fragment;

/** Exception thrown when a sorted insertion is requested on a list not known to be sorted. */
public class FragmentListStateException extends SyncMapException {

  public FragmentListStateException(String message) {
    super(message);
  }

  public FragmentListStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
