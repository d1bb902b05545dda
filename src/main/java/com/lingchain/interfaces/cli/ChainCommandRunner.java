package com.lingchain.interfaces.cli;

import com.lingchain.application.ChainService;
import com.lingchain.application.port.ChainPublisher;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Command-line entry: {@code lingchain <dictionary-file> <word>}.
 *
 * <p>The dictionary file is wired into the context as a Spring option before startup (see
 * {@link #toSpringArgs(String[])}); once the context is up this runner searches the word and
 * prints every chain.
 */
@Component
public class ChainCommandRunner implements ApplicationRunner {
  static final String USAGE =
      "Please provide two positional arguments, the path to the dictionary file and the string"
          + " input. E.g. lingchain ./dictionary.txt starting";

  private static final Logger log = LoggerFactory.getLogger(ChainCommandRunner.class);

  private final ChainService chains;
  private final ChainPublisher publisher;

  public ChainCommandRunner(ChainService chains, ChainPublisher publisher) {
    this.chains = chains;
    this.publisher = publisher;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    if (positional.isEmpty()) {
      return;
    }
    requireUsage(positional);
    String word = positional.get(1);
    log.debug("Command-line search for '{}' using {}", word, positional.get(0));
    publisher.publish(chains.findChains(word));
  }

  /** True when the arguments carry positional parameters, i.e. a one-shot command-line run. */
  public static boolean isCommandLine(String[] args) {
    return !positional(args).isEmpty();
  }

  /**
   * Append the Spring options that point the dictionary at the given file and keep application
   * logging below WARN off the console.
   *
   * <p>A {@code .db} or {@code .sqlite} file is read as a SQLite dictionary, anything else as a
   * word list.
   *
   * @throws IllegalArgumentException unless exactly two positional arguments are present
   */
  public static String[] toSpringArgs(String[] args) {
    List<String> positional = positional(args);
    requireUsage(positional);

    Path file = Path.of(positional.get(0)).toAbsolutePath().normalize();
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    List<String> out = new ArrayList<>(Arrays.asList(args));
    if (name.endsWith(".db") || name.endsWith(".sqlite")) {
      out.add("--lingchain.dictionary-jdbc-url=jdbc:sqlite:" + file);
    } else {
      out.add("--lingchain.dictionary-location=" + file.toUri());
      out.add("--lingchain.dictionary-jdbc-url=");
    }
    out.add("--logging.level.com.lingchain=WARN");
    return out.toArray(String[]::new);
  }

  private static List<String> positional(String[] args) {
    return Arrays.stream(args).filter(a -> !a.startsWith("--")).toList();
  }

  private static void requireUsage(List<String> positional) {
    if (positional.size() != 2) {
      throw new IllegalArgumentException(USAGE);
    }
  }
}
