package com.example.detectionledger.app;

import static org.junit.jupiter.api.Assertions.*;

import com.example.detectionledger.core.pipeline.ImageRef;
import com.example.detectionledger.core.store.ImageKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

public class DirectoryImageSourceTest {

  @TempDir Path root;

  private void touch(final String relative) throws IOException {
    final var file = root.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.write(file, new byte[] {1});
  }

  private static List<ImageKey> keys(final Iterable<ImageRef> source) {
    final var keys = new ArrayList<ImageKey>();
    source.forEach(ref -> keys.add(ref.key()));
    return keys;
  }

  @Test
  @DisplayName("Should yield images by upload date, then file name")
  void ordersByDateAndName() throws IOException {
    touch("2024-01-02/b.jpg");
    touch("2024-01-02/a.PNG");
    touch("2024-01-01/z.jpeg");

    final var source = new DirectoryImageSource(root, "acme");

    assertEquals("acme", source.customer());
    assertEquals(
        List.of(
            new ImageKey("acme", LocalDate.of(2024, 1, 1), "z.jpeg"),
            new ImageKey("acme", LocalDate.of(2024, 1, 2), "a.PNG"),
            new ImageKey("acme", LocalDate.of(2024, 1, 2), "b.jpg")),
        keys(source));
  }

  @Test
  @DisplayName("Should ignore non-date directories and non-image files")
  void ignoresNoise() throws IOException {
    touch("2024-01-01/img1.jpg");
    touch("2024-01-01/labels.txt");
    touch("2024-01-01/.hidden");
    touch("thumbnails/img1.jpg");
    touch("readme.jpg");

    final var refs = new ArrayList<ImageRef>();
    new DirectoryImageSource(root, "acme").forEach(refs::add);

    assertEquals(1, refs.size());
    assertEquals(root.resolve("2024-01-01/img1.jpg"), refs.get(0).path());
  }

  @Test
  @DisplayName("Should be traversable more than once")
  void reiterable() throws IOException {
    touch("2024-01-01/img1.jpg");
    final var source = new DirectoryImageSource(root, "acme");

    assertEquals(keys(source), keys(source));
  }

  @Test
  @DisplayName("Should reject a missing root")
  void rejectsMissingRoot() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new DirectoryImageSource(root.resolve("missing"), "acme"));
  }

  @Test
  @DisplayName("Should recognise image extensions case-insensitively")
  void imageExtensions() {
    assertTrue(DirectoryImageSource.isImage(Path.of("a.JPG")));
    assertTrue(DirectoryImageSource.isImage(Path.of("a.tiff")));
    assertFalse(DirectoryImageSource.isImage(Path.of("jpg")));
    assertFalse(DirectoryImageSource.isImage(Path.of("a.json")));
  }
}
