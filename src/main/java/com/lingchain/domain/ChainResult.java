package com.lingchain.domain;

import java.util.List;
import java.util.Set;

/**
 * Outcome of one search: the input word, whether it is itself a dictionary word, and every
 * longest chain found (root first).
 */
public record ChainResult(String input, boolean inDictionary, Set<List<String>> chains) {
  public static final String SEPARATOR = " => ";

  public ChainResult {
    chains = Set.copyOf(chains);
  }

  /** Words per chain. All returned chains have the same length. */
  public int length() {
    return chains.stream().mapToInt(List::size).max().orElse(0);
  }

  /** Each chain joined with {@link #SEPARATOR}, one entry per chain. */
  public List<String> lines() {
    return chains.stream().map(c -> String.join(SEPARATOR, c)).sorted().toList();
  }
}
