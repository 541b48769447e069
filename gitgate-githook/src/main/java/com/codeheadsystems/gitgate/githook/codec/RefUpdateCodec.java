package com.codeheadsystems.gitgate.githook.codec;

import com.codeheadsystems.gitgate.githook.exceptions.HookProtocolException;
import com.codeheadsystems.gitgate.model.githook.ReferenceUpdate;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the reference updates git exchanges with pre-receive and post-receive hooks.
 * <p>
 * The format is one line per updated reference, {@code <old-value> SP <new-value> SP <ref-name> LF},
 * terminated by end of stream. See <a href="https://git-scm.com/docs/githooks#pre-receive">githooks</a>.
 */
public final class RefUpdateCodec {

  private static final char SP = ' ';
  private static final char LF = '\n';

  private RefUpdateCodec() {
  }

  /**
   * Parses every reference update up to end of stream, in stream order.
   * <p>
   * All or nothing: a single malformed line fails the whole parse. The stream is not closed.
   *
   * @param in the hook's standard input
   * @return the reference updates
   * @throws HookProtocolException on a malformed line or read failure
   */
  public static List<ReferenceUpdate> parse(final InputStream in) {
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    List<ReferenceUpdate> updates = new ArrayList<>();
    int lineNumber = 0;
    try {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        updates.add(parseLine(line, lineNumber));
      }
    } catch (IOException e) {
      throw new HookProtocolException("error when reading from standard input", e);
    }
    return List.copyOf(updates);
  }

  /**
   * Parses a single {@code <old-value> SP <new-value> SP <ref-name>} record.
   *
   * @param line       the line without its terminator
   * @param lineNumber the 1-based line number, for error messages
   * @return the reference update
   */
  static ReferenceUpdate parseLine(final String line, final int lineNumber) {
    String[] fields = line.split(String.valueOf(SP), -1);
    if (fields.length != 3) {
      throw new HookProtocolException("invalid reference update on line " + lineNumber
          + ": expected 3 space-separated fields but got " + fields.length);
    }
    for (String field : fields) {
      if (field.isEmpty()) {
        throw new HookProtocolException("invalid reference update on line " + lineNumber
            + ": empty field");
      }
    }
    return new ReferenceUpdate(fields[2], fields[0], fields[1]);
  }

  /**
   * Formats reference updates the way git writes them to hook standard input.
   *
   * @param updates the reference updates
   * @return the encoded text
   */
  public static String format(final List<ReferenceUpdate> updates) {
    StringBuilder sb = new StringBuilder();
    for (ReferenceUpdate update : updates) {
      sb.append(update.oldSha()).append(SP)
          .append(update.newSha()).append(SP)
          .append(update.ref()).append(LF);
    }
    return sb.toString();
  }
}
