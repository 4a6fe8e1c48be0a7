package ca.gc.cra.landsat.application.metadata;

import ca.gc.cra.landsat.domain.metadata.MetadataValue;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts a raw MTL token into the best-fitting {@link MetadataValue}.
 *
 * <p>Attempts run in a fixed order: integer, then floating point, then text with one surrounding pair of double
 * quotes removed. The text fallback always succeeds.</p>
 *
 * <p>Integers are exact at any magnitude: values outside the {@code long} range become
 * {@link MetadataValue.LargeIntegerValue} rather than a rounded {@code double}.</p>
 *
 * @since 0.1.0
 */
public final class ValueCaster {
  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern FLOAT = Pattern.compile(
      "[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?|[+-]?(?i:nan|inf|infinity)");

  private ValueCaster() {}

  /**
   * Casts a token to an integer, float, or unquoted string.
   *
   * @param token raw value text as found after {@code =}; {@code null} is treated as empty text
   * @return typed value
   */
  public static MetadataValue castToBest(String token) {
    if (token == null) {
      return MetadataValue.of("");
    }
    String value = token.strip();
    if (INTEGER.matcher(value).matches()) {
      return MetadataValue.of(new BigInteger(value));
    }
    if (FLOAT.matcher(value).matches()) {
      return MetadataValue.of(parseFloat(value));
    }
    return MetadataValue.of(unquote(value));
  }

  private static double parseFloat(String value) {
    String lower = value.toLowerCase(Locale.ROOT);
    boolean negative = lower.startsWith("-");
    String unsigned = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
    if (unsigned.equals("nan")) {
      return Double.NaN;
    }
    if (unsigned.equals("inf") || unsigned.equals("infinity")) {
      return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    return Double.parseDouble(value);
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"') {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }
}
