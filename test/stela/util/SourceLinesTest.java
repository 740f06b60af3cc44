package stela.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceLinesTest {
  @TempDir
  Path tempDir;

  @Test
  void testReadLine() throws IOException {
    Path file = tempDir.resolve("blocks.py");
    Files.write(file, List.of("@always_comb", "def comb(self):", "    self.a = 1"));
    Assertions.assertEquals(Optional.of("    self.a = 1"), SourceLines.readLine(file.toString(), 3));
    Assertions.assertEquals(Optional.empty(), SourceLines.readLine(file.toString(), 4));
    Assertions.assertEquals(Optional.empty(), SourceLines.readLine(file.toString(), 0));
    Assertions.assertEquals(Optional.empty(), SourceLines.readLine(tempDir.resolve("missing.py").toString(), 1));
    Assertions.assertEquals(Optional.empty(), SourceLines.readLine(null, 1));
    SourceLines.logSource(file.toString(), 3);
    SourceLines.logSource(null, -1);
  }
}
