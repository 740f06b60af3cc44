package stela.util;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Reports source locations of elaboration problems.
 */
public class SourceLines {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private SourceLines() {}

  /**
   * Reads one line of a source file.
   * @param filename the file, may be null
   * @param line 1-based line number
   * @return the line text, or empty if the file or the line is not available
   */
  public static Optional<String> readLine(String filename, int line) {
    if (filename == null || line < 1)
      return Optional.empty();
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(filename), StandardCharsets.UTF_8))) {
      String text = null;
      for (int i = 0; i < line; ++i) {
        text = reader.readLine();
        if (text == null)
          return Optional.empty();
      }
      return Optional.of(text);
    } catch (IOException e) {
      logger.debug("Cannot read source file {}: {}", filename, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Logs the location and, if the file is readable, the text of a source line.
   * @param filename the file, may be null
   * @param line the absolute line, negative if unknown
   */
  public static void logSource(String filename, int line) {
    if (line < 0) {
      logger.error("{}: unknown line", filename == null ? "<unknown>" : filename);
      return;
    }
    Optional<String> text = readLine(filename, line);
    if (text.isPresent())
      logger.error("{}:{}: {}", filename, line, text.get().strip());
    else
      logger.error("{}:{}", filename == null ? "<unknown>" : filename, line);
  }
}
