package com.lingchain.application;

import com.lingchain.application.port.Dictionary;
import com.lingchain.domain.ChainNode;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds the longest chains of single-character deletions starting at a word.
 *
 * <p>The search expands whole generations at a time. When a generation produces no children the
 * previous one is the terminal frontier: every node in it sits at the maximal depth, and branches
 * that died out earlier are not part of it. Each generation is one character shorter than the
 * last, so the loop runs at most {@code input.length()} times.
 */
@Service
public class ChainSearch {
  private static final Logger log = LoggerFactory.getLogger(ChainSearch.class);

  private final FrontierExpander expander;
  private final PathReconstructor reconstructor;

  public ChainSearch(FrontierExpander expander, PathReconstructor reconstructor) {
    this.expander = expander;
    this.reconstructor = reconstructor;
  }

  /**
   * Search all maximal chains.
   *
   * @param input starting word; it need not be a dictionary word
   * @param dictionary membership oracle for every word after the first
   * @return every longest chain, root first; {@code [[input]]} when no deletion is a word
   */
  public Set<List<String>> search(String input, Dictionary dictionary) {
    List<ChainNode> frontier = List.of(ChainNode.root(input));
    int generation = 0;
    while (true) {
      List<ChainNode> next = expander.expand(frontier, dictionary);
      if (next.isEmpty()) {
        break;
      }
      generation++;
      log.debug("'{}' generation {}: {} node(s)", input, generation, next.size());
      frontier = next;
    }
    return reconstructor.reconstructAll(frontier);
  }
}
