package com.lingchain.infrastructure;

import com.lingchain.application.port.ChainPublisher;
import com.lingchain.domain.ChainResult;
import java.io.PrintStream;
import org.springframework.stereotype.Component;

/** Prints chains to standard output, one line per chain. */
@Component
public class ConsoleChainPublisher implements ChainPublisher {
  static final String NOT_IN_DICTIONARY =
      "Input word is not in the dictionary. Continuing with substrings.";

  private final PrintStream out;

  public ConsoleChainPublisher() {
    this(System.out);
  }

  ConsoleChainPublisher(PrintStream out) {
    this.out = out;
  }

  @Override
  public void publish(ChainResult result) {
    if (!result.inDictionary()) {
      out.println(NOT_IN_DICTIONARY);
    }
    result.lines().forEach(out::println);
    out.flush();
  }
}
