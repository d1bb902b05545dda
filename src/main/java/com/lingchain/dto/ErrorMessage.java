package com.lingchain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Error reply; {@code word} is set when a specific input word was refused. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorMessage(String type, String message, String word) {
  public static ErrorMessage of(String message) {
    return new ErrorMessage("error", message, null);
  }

  public static ErrorMessage rejected(String word, String reason) {
    return new ErrorMessage("word_rejected", reason, word);
  }
}
