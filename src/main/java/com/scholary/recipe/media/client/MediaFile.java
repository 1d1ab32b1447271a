package com.scholary.recipe.media.client;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * A file selected for upload, either on disk or already in memory.
 *
 * <p>Size and mime type are fixed when the instance is created. Files on disk are streamed, never
 * read into memory whole.
 */
public final class MediaFile {

  private final String name;
  private final String mimeType;
  private final long size;
  private final Path path;
  private final byte[] data;

  private MediaFile(String name, String mimeType, long size, Path path, byte[] data) {
    this.name = name;
    this.mimeType = mimeType;
    this.size = size;
    this.path = path;
    this.data = data;
  }

  /**
   * A file on disk. The mime type is probed from the file system when not given.
   *
   * @throws IOException if the file cannot be read
   */
  public static MediaFile of(Path path, String mimeType) throws IOException {
    Objects.requireNonNull(path, "path");
    String type = mimeType != null ? mimeType : Files.probeContentType(path);
    return new MediaFile(
        path.getFileName().toString(),
        type != null ? type : "application/octet-stream",
        Files.size(path),
        path,
        null);
  }

  public static MediaFile of(String name, String mimeType, byte[] data) {
    Objects.requireNonNull(data, "data");
    return new MediaFile(name, mimeType, data.length, null, data.clone());
  }

  public String name() {
    return name;
  }

  public String mimeType() {
    return mimeType;
  }

  public long size() {
    return size;
  }

  /** A publisher for the whole file. */
  public BodyPublisher bodyPublisher() throws FileNotFoundException {
    return path != null ? BodyPublishers.ofFile(path) : BodyPublishers.ofByteArray(data);
  }

  /**
   * Read {@code length} bytes starting at {@code offset}, fewer at the end of the file.
   *
   * @throws IOException if the file cannot be read
   */
  public byte[] readRange(long offset, int length) throws IOException {
    if (offset < 0 || offset > size) {
      throw new IllegalArgumentException("Offset out of range: " + offset);
    }
    int count = (int) Math.min(length, size - offset);
    if (data != null) {
      return Arrays.copyOfRange(data, (int) offset, (int) offset + count);
    }
    byte[] buffer = new byte[count];
    try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
      file.seek(offset);
      file.readFully(buffer);
    }
    return buffer;
  }

  @Override
  public String toString() {
    return "MediaFile{name=" + name + ", mimeType=" + mimeType + ", size=" + size + "}";
  }
}
