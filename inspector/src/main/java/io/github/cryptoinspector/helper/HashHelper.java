package io.github.cryptoinspector.helper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.immutables.value.Value;

/**
 * SHA-256 over files and over field lists.
 *
 * <p>Field hashes join the trimmed parts with a single newline. Record hashes, precheck hashes
 * and audit chain hashes all use this form, so the formula must not change once evidence has
 * been recorded with it.
 */
@Singleton
public class HashHelper {

  private static final int BUFFER_SIZE = 64 * 1024;
  private static final HexFormat HEX = HexFormat.of();

  /**
   * Instantiates a new Hash helper.
   */
  @Inject
  public HashHelper() {
    // Default constructor
  }

  /**
   * A new SHA-256 digest.
   *
   * @return the message digest
   */
  public MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  /**
   * Lower case hex of a finished digest.
   *
   * @param digest the digest
   * @return the hex string
   */
  public String hex(final MessageDigest digest) {
    return HEX.formatHex(digest.digest());
  }

  /**
   * Hash of the given fields.
   *
   * @param parts the fields
   * @return the hex digest
   */
  public String text(final String... parts) {
    final MessageDigest digest = newDigest();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        digest.update((byte) '\n');
      }
      final String part = parts[i] == null ? "" : parts[i].trim();
      digest.update(part.getBytes(StandardCharsets.UTF_8));
    }
    return hex(digest);
  }

  /**
   * Chain hash of an audit event.
   *
   * @param chainPrevHash the previous hash, empty for the first event of a case
   * @param caseId        the case id
   * @param eventType     the event type
   * @param action        the action
   * @param status        the status wire value
   * @param occurredAt    the time in epoch millis
   * @param detailJson    the stored detail text
   * @return the hex digest
   */
  public String chainHash(final String chainPrevHash,
                          final String caseId,
                          final String eventType,
                          final String action,
                          final String status,
                          final long occurredAt,
                          final String detailJson) {
    return text(chainPrevHash, caseId, eventType, action, status, Long.toString(occurredAt), detailJson);
  }

  /**
   * Hash and size of a file's contents.
   *
   * @param path the file
   * @return the digest
   * @throws IOException if the file cannot be read
   */
  public FileDigest file(final Path path) throws IOException {
    final MessageDigest digest = newDigest();
    long size = 0;
    try (InputStream in = Files.newInputStream(path)) {
      final byte[] buffer = new byte[BUFFER_SIZE];
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
        size += read;
      }
    }
    return ImmutableFileDigest.of(hex(digest), size);
  }

  /**
   * Hash and size of a byte array.
   *
   * @param bytes the bytes
   * @return the digest
   */
  public FileDigest bytes(final byte[] bytes) {
    final MessageDigest digest = newDigest();
    digest.update(bytes);
    return ImmutableFileDigest.of(hex(digest), bytes.length);
  }

  /**
   * SHA-256 and byte count of some content.
   */
  @Value.Immutable
  public interface FileDigest {

    @Value.Parameter
    String sha256();

    @Value.Parameter
    long sizeBytes();
  }
}
