package com.lingchain.interfaces.rest;

import com.lingchain.application.ChainService;
import com.lingchain.dto.ChainRequest;
import com.lingchain.dto.ChainResponse;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ChainController {
  private final ChainService chains;
  private final int maxWordLength;

  public ChainController(
      ChainService chains, @Value("${lingchain.rest.max-word-length:64}") int maxWordLength) {
    this.chains = chains;
    this.maxWordLength = maxWordLength;
  }

  /**
   * Search the longest chains for one word.
   *
   * @throws RejectedWordException if the word exceeds the configured maximum length
   */
  @PostMapping("/chains")
  public ChainResponse chains(@Valid @RequestBody ChainRequest req) {
    String word = req.word();
    if (maxWordLength > 0 && word.length() > maxWordLength) {
      throw new RejectedWordException(
          word, "Word too long: " + word.length() + " characters (max " + maxWordLength + ")");
    }
    return ChainResponse.of(chains.findChains(word));
  }
}
