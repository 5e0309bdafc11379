package dev.archivist.store;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Static utility for SHA-256 content hashes. Binary uploads carry the hash in their stored
 * filename and metadata so duplicates can be recognised downstream.
 */
public final class ContentHasher {

  /** Number of hex characters of the hash embedded in stored binary filenames. */
  public static final int FILENAME_HASH_LENGTH = 16;

  private ContentHasher() {
    // utility class
  }

  /**
   * Compute the SHA-256 hash of raw bytes.
   *
   * @param content the bytes to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String sha256(byte[] content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
