package ca.gc.cra.rollup.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void requireReadableFileAcceptsExistingFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("raw.json"), "[]");
    assertEquals(file.toAbsolutePath().normalize(), Paths.requireReadableFile("in", file));
  }

  @Test
  void requireReadableFileRejectsMissingFileAndDirectory() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("in", tempDir.resolve("missing.json")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", tempDir));
  }

  @Test
  void requireReadableDirRejectsFiles() throws IOException {
    Path file = Files.writeString(tempDir.resolve("raw.json"), "[]");
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir("in", file));
  }

  @Test
  void validateWritableFileRequiresAllowOverwriteForExistingFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("out.json"), "[]");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableFile("out", file, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(file.toAbsolutePath().normalize(), Paths.validateWritableFile("out", file, true));
  }

  @Test
  void validateWritableFileRejectsMissingParent() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableFile("out", tempDir.resolve("nope/out.json"), false));
  }

  @Test
  void validateWritableDirRejectsNonEmptyDirectoryWithoutReuse() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("nonEmpty"));
    Files.createFile(dir.resolve("file.json"));

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(dir, false, false));
    assertEquals(dir.toRealPath(), Paths.validateWritableDir(dir, false, true));
  }

  @Test
  void validateWritableDirCreatesWhenRequested() {
    Path validated = Paths.validateWritableDir(tempDir.resolve("missing"), true, false);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirAcceptsFutureDirectoryWithoutCreatingIt() {
    Path dir = tempDir.resolve("future/child");

    Path validated = Paths.validateWritableDir(dir, false, false);

    assertEquals(dir.toAbsolutePath().normalize(), validated);
    assertFalse(Files.exists(dir));
  }
}
