package dev.athenaeum.content;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.jspecify.annotations.Nullable;

/**
 * Static utility for SHA-256 hashing. Used as the deduplication key of content snapshots and to
 * fingerprint access scopes in cache keys.
 */
public final class ContentHasher {

  /** Separates document fields so that moving text between fields changes the hash. */
  private static final char FIELD_SEPARATOR = '\u001F';

  private ContentHasher() {
    // utility class
  }

  /**
   * Compute the SHA-256 hash of the given value.
   *
   * @param value the value to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /**
   * Hash of a snapshot document. Line endings are normalised and surrounding whitespace trimmed,
   * so re-submitting the same text from a different editor does not produce a new version.
   *
   * @param title snapshot title
   * @param summary optional summary
   * @param text snapshot body
   * @return lowercase hex SHA-256
   */
  public static String documentHash(String title, @Nullable String summary, String text) {
    return sha256(
        canonical(title)
            + FIELD_SEPARATOR
            + (summary == null ? "" : canonical(summary))
            + FIELD_SEPARATOR
            + canonical(text));
  }

  private static String canonical(String value) {
    return value.replace("\r\n", "\n").replace('\r', '\n').strip();
  }
}
