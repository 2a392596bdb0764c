package io.lacuna.regular;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.StringTokenizer;

/**
 * Reads a single regex from stdin, and prints its minimal DFA and right-linear grammar to stdout.
 */
public class Main {

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) {
    System.exit(run(System.in, System.out, System.err));
  }

  /**
   * @return the exit status: 0 on success, 1 for a malformed regex, 2 if the input couldn't be read
   */
  static int run(InputStream in, PrintStream out, PrintStream err) {
    String regex;
    try {
      regex = firstToken(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
    } catch (IOException e) {
      LOG.error("failed to read input", e);
      err.println("failed to read input: " + e.getMessage());
      return 2;
    }

    try {
      out.print(RegularGrammar.compile(regex).report().render());
      out.flush();
      return 0;
    } catch (InvalidRegexException e) {
      LOG.warn("rejected '{}' at position {}", e.input(), e.position());
      err.println("invalid regex: " + e.getMessage());
      return 1;
    }
  }

  // an input with no tokens at all is the empty regex
  private static String firstToken(BufferedReader reader) throws IOException {
    String line;
    while ((line = reader.readLine()) != null) {
      StringTokenizer tokens = new StringTokenizer(line);
      if (tokens.hasMoreTokens()) {
        return tokens.nextToken();
      }
    }
    return "";
  }
}
