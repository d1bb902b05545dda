package com.lingchain.interfaces.rest;

/** A syntactically valid word the REST surface refuses to search. */
public class RejectedWordException extends IllegalArgumentException {
  private final String word;

  public RejectedWordException(String word, String reason) {
    super(reason);
    this.word = word;
  }

  public String word() {
    return word;
  }
}
