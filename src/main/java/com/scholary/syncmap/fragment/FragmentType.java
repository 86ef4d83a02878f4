package com.scholary.syncmap.fragment;

/**
 * What a fragment of the timeline stands for.
 *
 * <p>Most fragments are {@link #REGULAR}, i.e. aligned to a piece of text. The audio before the
 * first and after the last text piece are {@link #HEAD} and {@link #TAIL}; long silences detected
 * between text pieces are {@link #NONSPEECH}.
 */
public enum FragmentType {
  REGULAR,
  HEAD,
  TAIL,
  NONSPEECH
}
