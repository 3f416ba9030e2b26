package ca.gc.cra.rollup.infrastructure.file;

import ca.gc.cra.rollup.application.port.CompressedOutputPort;
import ca.gc.cra.rollup.application.port.CompressedPayload;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes each compressed payload to {@code <outputDirectory>/<key>}, replacing any existing file.
 * <p>Path separators and control characters in keys become {@code _}, so a key never escapes the
 * output directory.
 * Synchronized so concurrent writers never interleave directory creation.</p>
 *
 * @since 0.1.0
 */
public final class FileCompressedOutputAdapter implements CompressedOutputPort {
  private final Path outputDirectory;

  /**
   * Creates a file-backed output adapter.
   *
   * @param outputDirectory directory receiving compressed files; created on first write when missing
   */
  public FileCompressedOutputAdapter(Path outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  /**
   * Writes the payload to a file named after its key.
   *
   * @param payload compressed payload; must not be {@code null}
   * @throws IOException if the directory or file cannot be written
   */
  @Override
  public synchronized void write(CompressedPayload payload) throws IOException {
    Objects.requireNonNull(payload, "payload");
    if (!Files.exists(outputDirectory)) {
      Files.createDirectories(outputDirectory);
    }
    Files.write(resolve(payload.key()), payload.content());
  }

  /**
   * Returns the file a payload with {@code key} is written to.
   *
   * @param key payload key
   * @return target path inside the output directory
   */
  public Path resolve(String key) {
    return outputDirectory.resolve(sanitize(key));
  }

  private static String sanitize(String key) {
    StringBuilder sb = new StringBuilder(Math.max(16, key.length()));
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (c == '/' || c == '\\' || Character.isISOControl(c)) {
        sb.append('_');
      } else {
        sb.append(c);
      }
    }
    String name = sb.toString();
    if (name.isEmpty() || name.equals(".") || name.equals("..")) {
      return "payload.json";
    }
    return name;
  }
}
