package com.codeheadsystems.hashchain.digest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SHA-256 linking of a record to its predecessor. The previous hash is hashed together with the
 * content, so rewriting one record means rewriting every record after it.
 */
@Singleton
public class ChainDigester {

  /**
   * Previous hash of the first record of every stream.
   */
  public static final String GENESIS = "GENESIS";

  /**
   * Width of a digest in bytes.
   */
  public static final int HASH_WIDTH = 32;

  private static final Logger log = LoggerFactory.getLogger(ChainDigester.class);
  private static final Pattern HEX_HASH = Pattern.compile("[0-9a-f]{64}");

  /**
   * Instantiates a new Chain digester.
   */
  @Inject
  public ChainDigester() {
    log.info("ChainDigester()");
  }

  /**
   * Plain SHA-256.
   *
   * @param bytes the bytes
   * @return 32 bytes
   */
  public byte[] digest(final byte[] bytes) {
    return DigestUtils.sha256(bytes);
  }

  /**
   * Content hash of a record: SHA-256 over its canonical bytes followed by the UTF-8 bytes of the
   * previous hash.
   *
   * @param canonical    the canonical content
   * @param previousHash {@link #GENESIS} or a hex content hash
   * @return lowercase hex
   */
  public String linkHash(final byte[] canonical, final String previousHash) {
    if (!isPreviousHash(previousHash)) {
      throw new IllegalArgumentException("Not a previous hash: " + previousHash);
    }
    final MessageDigest digest = DigestUtils.getSha256Digest();
    digest.update(canonical);
    digest.update(previousHash.getBytes(StandardCharsets.UTF_8));
    return Hex.encodeHexString(digest.digest());
  }

  /**
   * Whether the value is a well formed content hash.
   *
   * @param value the value
   * @return the boolean
   */
  public boolean isContentHash(final String value) {
    return value != null && HEX_HASH.matcher(value).matches();
  }

  /**
   * Whether the value may appear as a previous hash.
   *
   * @param value the value
   * @return the boolean
   */
  public boolean isPreviousHash(final String value) {
    return GENESIS.equals(value) || isContentHash(value);
  }
}
