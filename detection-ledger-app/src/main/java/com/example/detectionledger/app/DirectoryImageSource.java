package com.example.detectionledger.app;

import static java.lang.System.Logger.Level.*;

import com.example.detectionledger.core.pipeline.ImageRef;
import com.example.detectionledger.core.pipeline.ImageSource;
import com.example.detectionledger.core.store.ImageKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Images of one customer laid out as {@code <root>/<yyyy-MM-dd>/<file>}.
 *
 * <p>Upload-date directories are visited in date order and their files in name order, one directory
 * at a time. Directories whose name is not a date and files that are not images are ignored.
 */
public final class DirectoryImageSource implements ImageSource {

  private static final Logger logger = System.getLogger(DirectoryImageSource.class.getName());
  private static final Set<String> IMAGE_EXTENSIONS =
      Set.of("jpg", "jpeg", "png", "bmp", "tif", "tiff", "webp");

  private final Path root;
  private final String customer;

  public DirectoryImageSource(final Path root, final String customer) {
    this.root = Objects.requireNonNull(root, "root");
    this.customer = Objects.requireNonNull(customer, "customer");
    if (!Files.isDirectory(root))
      throw new IllegalArgumentException("Not a directory: " + root);
  }

  @Override
  public String customer() {
    return customer;
  }

  /**
   * @throws UncheckedIOException if a directory cannot be listed
   */
  @Override
  public Iterator<ImageRef> iterator() {
    return uploadDates().stream().flatMap(this::imagesOf).iterator();
  }

  private List<LocalDate> uploadDates() {
    try (Stream<Path> entries = Files.list(root)) {
      return entries
          .filter(Files::isDirectory)
          .map(dir -> parseDate(dir.getFileName().toString()))
          .flatMap(Optional::stream)
          .sorted()
          .collect(Collectors.toList());
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to list " + root, e);
    }
  }

  private Stream<ImageRef> imagesOf(final LocalDate date) {
    final var dir = root.resolve(date.toString());
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(DirectoryImageSource::isImage)
          .sorted()
          .map(file -> new ImageRef(
              new ImageKey(customer, date, file.getFileName().toString()), file))
          .collect(Collectors.toList())
          .stream();
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to list " + dir, e);
    }
  }

  private static Optional<LocalDate> parseDate(final String name) {
    try {
      return Optional.of(LocalDate.parse(name));
    } catch (final DateTimeParseException e) {
      logger.log(DEBUG, "Ignoring directory {0}: not an upload date", name);
      return Optional.empty();
    }
  }

  static boolean isImage(final Path file) {
    final var name = file.getFileName().toString();
    final var dot = name.lastIndexOf('.');
    return dot > 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
