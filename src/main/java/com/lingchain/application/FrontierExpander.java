package com.lingchain.application;

import com.lingchain.application.port.Dictionary;
import com.lingchain.domain.ChainNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Computes the next generation of a search tree.
 *
 * <p>For every node of the current frontier, each single-character deletion of its value is a
 * candidate; candidates that are dictionary words become children of that node. Candidates are
 * de-duplicated per parent (deleting either 'a' from "aab" yields one "ab" child), but the same
 * value reached from different parents is kept once per parent so that no branch is lost.
 */
@Component
public class FrontierExpander {

  /**
   * Expand one generation.
   *
   * @param frontier nodes of the current generation
   * @param dictionary membership oracle for candidates
   * @return children of all frontier nodes, empty when no deletion survives
   */
  public List<ChainNode> expand(Collection<ChainNode> frontier, Dictionary dictionary) {
    List<ChainNode> next = new ArrayList<>();
    for (ChainNode node : frontier) {
      for (String candidate : deletions(node.value())) {
        if (dictionary.isWord(candidate)) {
          next.add(node.child(candidate));
        }
      }
    }
    return next;
  }

  /** Distinct strings obtained by removing exactly one character, in position order. */
  static Set<String> deletions(String value) {
    Set<String> out = new LinkedHashSet<>();
    for (int i = 0; i < value.length(); i++) {
      out.add(value.substring(0, i) + value.substring(i + 1));
    }
    return out;
  }
}
