package ca.gc.cra.landsat.domain.metadata;

import java.math.BigInteger;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed value of a single MTL attribute.
 * <p><strong>Why:</strong> MTL values are integers, floating-point numbers, or (usually quoted) text; a closed
 * hierarchy lets callers switch on the variant instead of probing {@link Object} instances.</p>
 * <p><strong>Role:</strong> Domain value object held by {@link MetadataRecord}.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface MetadataValue
    permits MetadataValue.IntegerValue, MetadataValue.LargeIntegerValue, MetadataValue.FloatValue,
    MetadataValue.TextValue {

  /**
   * Returns the boxed Java value ({@link Long}, {@link BigInteger}, {@link Double}, or {@link String}).
   *
   * @return underlying value; never {@code null}
   */
  Object raw();

  /**
   * Renders the value the way it reads in the MTL file, without quotes.
   *
   * @return textual form
   */
  String asText();

  /**
   * Wraps an integer attribute.
   *
   * @param value parsed integer
   * @return integer variant
   */
  static MetadataValue of(long value) {
    return new IntegerValue(value);
  }

  /**
   * Wraps an integer of any magnitude, keeping {@link IntegerValue} for everything that fits a {@code long}.
   *
   * @param value parsed integer
   * @return integer variant; {@link LargeIntegerValue} only outside the {@code long} range
   */
  static MetadataValue of(BigInteger value) {
    Objects.requireNonNull(value, "value");
    return value.bitLength() < Long.SIZE ? new IntegerValue(value.longValue()) : new LargeIntegerValue(value);
  }

  /**
   * Wraps a floating-point attribute.
   *
   * @param value parsed number
   * @return float variant
   */
  static MetadataValue of(double value) {
    return new FloatValue(value);
  }

  /**
   * Wraps a text attribute.
   *
   * @param value unquoted text; must not be {@code null}
   * @return text variant
   */
  static MetadataValue of(String value) {
    return new TextValue(value);
  }

  /** Integer attribute such as {@code WRS_PATH = 44}. */
  record IntegerValue(long value) implements MetadataValue {
    @Override
    public Object raw() {
      return value;
    }

    @Override
    public String asText() {
      return Long.toString(value);
    }
  }

  /** Integer attribute outside the {@code long} range, kept exact. */
  record LargeIntegerValue(BigInteger value) implements MetadataValue {
    public LargeIntegerValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Object raw() {
      return value;
    }

    @Override
    public String asText() {
      return value.toString();
    }
  }

  /** Floating-point attribute such as {@code CLOUD_COVER = 12.34}. */
  record FloatValue(double value) implements MetadataValue {
    @Override
    public Object raw() {
      return value;
    }

    @Override
    public String asText() {
      return Double.toString(value);
    }
  }

  /** Text attribute; quoted MTL values arrive here with one layer of quotes removed. */
  record TextValue(String value) implements MetadataValue {
    public TextValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Object raw() {
      return value;
    }

    @Override
    public String asText() {
      return value;
    }
  }
}
