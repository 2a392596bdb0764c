package io.lacuna.regular;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String input) {
    return run(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
  }

  private int run(InputStream in) {
    return Main.run(in,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private String out() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return err.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void testPrintsReport() {
    assertEquals(0, run("00\n"));
    assertEquals("      0 1\n(s)q0 q1 N\nq1 q2 N\n(e)q2 N N\n\nq0->0q1\nq1->0\n", out());
    assertEquals("", err());
  }

  @Test
  public void testReadsFirstToken() {
    assertEquals(0, run("\n   0*   1\n"));
    assertEquals("      0 1\n(s)(e)q0 q0 N\n\nq0->0q0\nq0->0\n", out());
  }

  @Test
  public void testNoInput() {
    assertEquals(0, run(""));
    assertEquals("      0 1\n(s)q0 N N\n\n", out());
  }

  @Test
  public void testInvalidRegex() {
    assertEquals(1, run("(0+1"));
    assertEquals("", out());
    assertTrue(err().startsWith("invalid regex: missing ')'"), err());
  }

  @Test
  public void testDeeplyNestedRegex() {
    int depth = 10000;
    assertEquals(1, run("(".repeat(depth) + "0" + ")".repeat(depth) + "\n"));
    assertEquals("", out());
    assertTrue(err().startsWith("invalid regex: groups nested more than " + RegexParser.MAX_DEPTH), err());
  }

  @Test
  public void testLongRegex() {
    assertEquals(0, run("0".repeat(20000) + "\n"));
    assertTrue(out().endsWith("\nq19999->0\n"), out().substring(out().length() - 40));
    assertEquals("", err());
  }

  @Test
  public void testUnreadableInput() {
    InputStream broken = new InputStream() {
      @Override
      public int read() throws IOException {
        throw new IOException("closed");
      }
    };

    assertEquals(2, run(broken));
    assertTrue(err().contains("closed"), err());
  }
}
