package com.lingchain.interfaces.rest;

import com.lingchain.domain.ChainResult;
import com.lingchain.application.port.Dictionary;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final Dictionary dictionary;
  private final int maxWordLength;

  public ConfigController(
      Dictionary dictionary,
      @Value("${lingchain.rest.max-word-length:64}") int maxWordLength) {
    this.dictionary = dictionary;
    this.maxWordLength = maxWordLength;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "separator", ChainResult.SEPARATOR,
        "maxWordLength", maxWordLength,
        "dictionarySize", dictionary.size(),
        "protocolVersion", 1);
  }
}
