package ca.gc.cra.landsat.validation;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through archive options and configuration files.
 * <p><strong>Why:</strong> Rejects blank or control-character input before it reaches file lookups or log lines.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Compile caller-supplied metadata templates case-insensitively with a readable error.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Returns a trimmed value, or {@code null} when the input is {@code null} or blank.
   *
   * @param name logical parameter name for diagnostics
   * @param value optional text
   * @return trimmed value or {@code null}
   * @throws IllegalArgumentException if the value contains ISO control characters
   */
  public static String optional(String name, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return requireNonBlank(name, value);
  }

  /**
   * Compiles a regular expression that is matched case-insensitively against file base names.
   *
   * @param name logical parameter name for diagnostics
   * @param regex expression; must be non-blank
   * @return compiled pattern with {@link Pattern#CASE_INSENSITIVE}
   * @throws IllegalArgumentException if the expression is blank or invalid
   */
  public static Pattern compileTemplate(String name, String regex) {
    String sanitized = requireNonBlank(name, regex);
    try {
      return Pattern.compile(sanitized, Pattern.CASE_INSENSITIVE);
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException(message(name, "is not a valid regular expression: " + ex.getDescription()), ex);
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
