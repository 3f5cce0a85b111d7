package com.codeheadsystems.hashchain.model;

import com.codeheadsystems.hashchain.exception.InvalidContentException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One named, typed value in a record's content. The value is kept in its canonical text form so
 * hashing never depends on locale or on how a number or time was originally written.
 */
@Value.Immutable
public interface ContentField {

  /**
   * Canonical text form of {@link FieldType#INSTANT} values: UTC with nine fraction digits.
   */
  DateTimeFormatter INSTANT_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'")
      .withZone(ZoneOffset.UTC);

  /**
   * Bound on the digits, precision plus magnitude of the scale, of a {@link FieldType#DECIMAL} value.
   */
  int MAX_DECIMAL_DIGITS = 1000;

  /**
   * String field. A null value gives a NULL field.
   *
   * @param name  the name
   * @param value the value
   * @return the content field
   */
  static ContentField string(final String name, final String value) {
    return value == null ? nullValue(name) : of(name, FieldType.STRING, value);
  }

  /**
   * Long field.
   *
   * @param name  the name
   * @param value the value
   * @return the content field
   */
  static ContentField ofLong(final String name, final long value) {
    return of(name, FieldType.LONG, Long.toString(value));
  }

  /**
   * Decimal field, scale-insensitive: 1.50 and 1.5 are the same value.
   *
   * @param name  the name
   * @param value the value
   * @return the content field
   */
  static ContentField decimal(final String name, final BigDecimal value) {
    return value == null ? nullValue(name) : of(name, FieldType.DECIMAL, canonicalDecimal(value));
  }

  /**
   * Boolean field.
   *
   * @param name  the name
   * @param value the value
   * @return the content field
   */
  static ContentField bool(final String name, final boolean value) {
    return of(name, FieldType.BOOLEAN, Boolean.toString(value));
  }

  /**
   * Instant field.
   *
   * @param name  the name
   * @param value the value
   * @return the content field
   */
  static ContentField instant(final String name, final Instant value) {
    return value == null ? nullValue(name) : of(name, FieldType.INSTANT, INSTANT_FORMAT.format(value));
  }

  /**
   * Explicit NULL field.
   *
   * @param name the name
   * @return the content field
   */
  static ContentField nullValue(final String name) {
    return ImmutableContentField.builder().name(name).type(FieldType.NULL).build();
  }

  /**
   * Field from already-canonical text, as read back from storage.
   *
   * @param name  the name
   * @param type  the type
   * @param value the value, empty for NULL
   * @return the content field
   */
  static ContentField of(final String name, final FieldType type, final String value) {
    return ImmutableContentField.builder().name(name).type(type).value(Optional.ofNullable(value)).build();
  }

  /**
   * Canonical text of a decimal: plain notation, no trailing zeros.
   *
   * @param value the value
   * @return the string
   * @throws InvalidContentException if the plain form would need more than {@link #MAX_DECIMAL_DIGITS} digits
   */
  static String canonicalDecimal(final BigDecimal value) {
    if (value.signum() == 0) {
      return "0";
    }
    final BigDecimal stripped = value.stripTrailingZeros();
    final long digits = (long) stripped.precision() + Math.abs((long) stripped.scale());
    if (digits > MAX_DECIMAL_DIGITS) {
      throw new InvalidContentException("Decimal needs " + digits + " digits, at most " + MAX_DECIMAL_DIGITS + " allowed");
    }
    return stripped.toPlainString();
  }

  /**
   * Field name, unique within a record.
   *
   * @return the name
   */
  String name();

  /**
   * Type tag.
   *
   * @return the type
   */
  FieldType type();

  /**
   * Canonical text value; empty exactly when the type is NULL.
   *
   * @return the value
   */
  Optional<String> value();

}
