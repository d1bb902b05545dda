package com.lingchain.dto;

import com.lingchain.domain.ChainResult;
import java.util.Comparator;
import java.util.List;

public record ChainResponse(
    String type,
    String word,
    boolean inDictionary,
    int length,
    List<List<String>> chains,
    List<String> lines) {

  public static ChainResponse of(ChainResult r) {
    List<List<String>> sorted =
        r.chains().stream().sorted(Comparator.comparing(c -> String.join("\n", c))).toList();
    return new ChainResponse("chains", r.input(), r.inDictionary(), r.length(), sorted, r.lines());
  }
}
