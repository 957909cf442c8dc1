package dev.secondbrain.search;

import java.util.regex.Pattern;

/**
 * Normalizes free-form user input into a keyword query.
 *
 * <p>Strips query-syntax characters, replaces grouping characters and hyphens that are not between
 * word characters with spaces, drops unbalanced double quotes and collapses whitespace. Intra-word
 * hyphens are kept so the query tokenizes the same way as indexed text. A result shorter than two
 * characters becomes empty. Multi-word queries are wrapped in double quotes to request phrase matching.
 */
public final class QuerySanitizer {

  private static final Pattern REMOVED = Pattern.compile("[<>=^@#$%&*]");
  private static final Pattern SPACED =
      Pattern.compile("[():]|(?<!\\w)-|-(?!\\w)", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private QuerySanitizer() {}

  public static String sanitize(String query) {
    if (query == null || query.isBlank()) {
      return "";
    }
    String q = REMOVED.matcher(query.strip()).replaceAll("");
    q = SPACED.matcher(q).replaceAll(" ");
    if (q.chars().filter(c -> c == '"').count() % 2 != 0) {
      q = q.replace("\"", "");
    }
    q = WHITESPACE.matcher(q).replaceAll(" ").strip();
    if (q.length() < 2) {
      return "";
    }
    return q.indexOf(' ') < 0 ? q : "\"" + q + "\"";
  }
}
