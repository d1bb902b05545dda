package com.lingchain.application.port;

import java.util.Collection;
import java.util.Set;

/** Read-only membership oracle over a fixed word set. */
public interface Dictionary {
  boolean isWord(String w);

  /** Number of distinct words. */
  int size();

  /** Immutable dictionary over a copy of the given words. */
  static Dictionary of(Collection<String> words) {
    Set<String> copy = Set.copyOf(words);
    return new Dictionary() {
      @Override
      public boolean isWord(String w) {
        return w != null && copy.contains(w);
      }

      @Override
      public int size() {
        return copy.size();
      }
    };
  }
}
