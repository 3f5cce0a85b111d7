package com.codeheadsystems.hashchain.canonical;

import com.codeheadsystems.hashchain.exception.InvalidContentException;
import com.codeheadsystems.hashchain.model.ContentField;
import com.codeheadsystems.hashchain.model.FieldType;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a record's actor, capture time and content fields into the exact bytes that get hashed.
 *
 * <p>Every entry is written as {@code <byteLength>:<name>|<TYPE>|<byteLength>:<value>\n}, with
 * {@code ~} in place of the value for NULL. The length prefixes make the encoding injective: no
 * choice of names or values can read back as a different list of fields.
 */
@Singleton
public class ContentCanonicalizer {

  /**
   * Name of the header entry carrying the actor.
   */
  public static final String ACTOR = "actor";

  /**
   * Longest actor a record can carry.
   */
  public static final int MAX_ACTOR_LENGTH = 1024;

  /**
   * Name of the header entry carrying the capture time.
   */
  public static final String RECORDED_AT = "recorded_at";

  private static final Logger log = LoggerFactory.getLogger(ContentCanonicalizer.class);
  private static final byte NULL_MARKER = '~';

  /**
   * Instantiates a new Content canonicalizer.
   */
  @Inject
  public ContentCanonicalizer() {
    log.info("ContentCanonicalizer()");
  }

  /**
   * Canonical bytes of a record.
   *
   * @param actor      the actor
   * @param recordedAt the capture time
   * @param content    the ordered content fields
   * @return the bytes
   * @throws InvalidContentException if any part cannot be canonicalized
   */
  public byte[] canonicalize(final String actor,
                             final Instant recordedAt,
                             final List<ContentField> content) {
    log.trace("canonicalize({}, {}, {})", actor, recordedAt, content);
    validate(actor, content);
    if (recordedAt == null) {
      throw new InvalidContentException("recordedAt is required");
    }
    final CharsetEncoder encoder = newEncoder();
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    write(out, encoder, ContentField.string(ACTOR, actor));
    write(out, encoder, ContentField.instant(RECORDED_AT, recordedAt));
    for (ContentField field : content) {
      write(out, encoder, field);
    }
    return out.toByteArray();
  }

  /**
   * Checks actor and content without producing bytes, so an append can fail before it locks
   * anything.
   *
   * @param actor   the actor
   * @param content the content
   * @throws InvalidContentException on the first problem found
   */
  public void validate(final String actor, final List<ContentField> content) {
    if (actor == null || actor.isBlank()) {
      throw new InvalidContentException("actor is required");
    }
    if (actor.length() > MAX_ACTOR_LENGTH) {
      throw new InvalidContentException("actor longer than " + MAX_ACTOR_LENGTH + " characters");
    }
    if (content == null) {
      throw new InvalidContentException("content is required");
    }
    final CharsetEncoder encoder = newEncoder();
    encode(encoder, actor, "actor");
    final Set<String> names = new HashSet<>();
    for (ContentField field : content) {
      if (field == null) {
        throw new InvalidContentException("null content field");
      }
      if (field.name().isBlank()) {
        throw new InvalidContentException("blank field name");
      }
      if (!names.add(field.name())) {
        throw new InvalidContentException("duplicate field name: " + field.name());
      }
      encode(encoder, field.name(), "field name");
      validateValue(encoder, field);
    }
  }

  private void validateValue(final CharsetEncoder encoder, final ContentField field) {
    final FieldType type = field.type();
    if (type == FieldType.NULL) {
      if (field.value().isPresent()) {
        throw new InvalidContentException("NULL field carries a value: " + field.name());
      }
      return;
    }
    final String value = field.value()
        .orElseThrow(() -> new InvalidContentException(type + " field has no value: " + field.name()));
    if (!isCanonical(type, value)) {
      throw new InvalidContentException("Not a canonical " + type + " value for " + field.name() + ": " + value);
    }
    encode(encoder, value, field.name());
  }

  private boolean isCanonical(final FieldType type, final String value) {
    try {
      switch (type) {
        case STRING:
          return true;
        case LONG:
          return Long.toString(Long.parseLong(value)).equals(value);
        case DECIMAL:
          return ContentField.canonicalDecimal(new BigDecimal(value)).equals(value);
        case BOOLEAN:
          return "true".equals(value) || "false".equals(value);
        case INSTANT:
          return ContentField.INSTANT_FORMAT.format(Instant.from(ContentField.INSTANT_FORMAT.parse(value))).equals(value);
        default:
          return false;
      }
    } catch (NumberFormatException | DateTimeParseException e) {
      log.debug("isCanonical({}, {}): {}", type, value, e.getMessage());
      return false;
    }
  }

  private void write(final ByteArrayOutputStream out,
                     final CharsetEncoder encoder,
                     final ContentField field) {
    writeSized(out, encode(encoder, field.name(), "field name"));
    out.write('|');
    final byte[] type = field.type().name().getBytes(StandardCharsets.US_ASCII);
    out.write(type, 0, type.length);
    out.write('|');
    if (field.value().isPresent()) {
      writeSized(out, encode(encoder, field.value().get(), field.name()));
    } else {
      out.write(NULL_MARKER);
    }
    out.write('\n');
  }

  private void writeSized(final ByteArrayOutputStream out, final byte[] bytes) {
    final byte[] length = Integer.toString(bytes.length).getBytes(StandardCharsets.US_ASCII);
    out.write(length, 0, length.length);
    out.write(':');
    out.write(bytes, 0, bytes.length);
  }

  private byte[] encode(final CharsetEncoder encoder, final String text, final String what) {
    try {
      final ByteBuffer buffer = encoder.reset().encode(CharBuffer.wrap(text));
      final byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return bytes;
    } catch (CharacterCodingException e) {
      throw new InvalidContentException("Unencodable characters in " + what, e);
    }
  }

  private CharsetEncoder newEncoder() {
    return StandardCharsets.UTF_8.newEncoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
  }
}
