package com.lingchain.application;

import com.lingchain.domain.ChainNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Turns leaf nodes back into root-first word chains by following parent links. */
@Component
public class PathReconstructor {

  public List<String> reconstruct(ChainNode leaf) {
    List<String> path = new ArrayList<>(leaf.depth() + 1);
    for (ChainNode n = leaf; n != null; n = n.parent()) {
      path.add(n.value());
    }
    Collections.reverse(path);
    return List.copyOf(path);
  }

  public Set<List<String>> reconstructAll(Collection<ChainNode> leaves) {
    Set<List<String>> paths = new LinkedHashSet<>();
    for (ChainNode leaf : leaves) {
      paths.add(reconstruct(leaf));
    }
    return paths;
  }
}
