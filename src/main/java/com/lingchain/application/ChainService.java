package com.lingchain.application;

import com.lingchain.application.port.Dictionary;
import com.lingchain.domain.ChainResult;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Runs chain searches against the application's dictionary. */
@Service
public class ChainService {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final Dictionary dict;
  private final ChainSearch search;

  public ChainService(Dictionary dict, ChainSearch search) {
    this.dict = dict;
    this.search = search;
  }

  /**
   * Find every longest chain starting at the given word.
   *
   * <p>A word that is not in the dictionary is still searched; the result records it.
   *
   * @param word starting word, may be empty
   * @return the chains and whether the word itself is a dictionary word
   * @throws IllegalArgumentException if word is null
   */
  public ChainResult findChains(String word) {
    if (word == null) {
      throw new IllegalArgumentException("Word is required");
    }
    boolean known = dict.isWord(word);
    if (!known) {
      log.info("Input word '{}' is not in the dictionary, searching its substrings", word);
    }

    long t0 = System.nanoTime();
    Set<List<String>> chains = search.search(word, dict);
    ChainResult result = new ChainResult(word, known, chains);
    long ms = (System.nanoTime() - t0) / 1_000_000;
    log.info(
        "Searched '{}': {} chain(s) of {} word(s) ({} ms)",
        word, chains.size(), result.length(), ms);
    return result;
  }
}
