package com.scholary.syncmap.fragment;

/**
 * Exception thrown when two fragments share more than a single boundary point.
 *
 * <p>Raised by a checked insertion, or by {@link SyncMapFragmentList#sort()} when earlier
 * unchecked appends left overlapping fragments behind.
 */
public class FragmentOverlapException extends SyncMapException {

  public FragmentOverlapException(String message) {
    super(message);
  }

  public FragmentOverlapException(String message, Throwable cause) {
    super(message, cause);
  }
}
