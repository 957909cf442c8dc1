package dev.secondbrain.sparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Keyword tokenizer shared by indexing and querying.
 *
 * <p>Lower-cases the text, splits on anything that is not a word character while keeping
 * intra-word underscores and hyphens ({@code machine_learning}, {@code cross-validation}), then
 * drops stopwords and single-character tokens.
 */
public final class Tokenizer {

  static final Set<String> STOPWORDS =
      Set.of(
          "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
          "is", "are", "was", "were", "be", "been", "being", "have", "has", "had", "do", "does",
          "did", "will", "would", "could", "should", "may", "might", "must", "this", "that",
          "these", "those", "i", "you", "he", "she", "it", "we", "they");

  private static final Pattern TOKEN =
      Pattern.compile("\\w+(?:-\\w+)*", Pattern.UNICODE_CHARACTER_CLASS);

  private Tokenizer() {}

  /**
   * Tokenizes text for BM25.
   *
   * @param text the text to tokenize; null or blank yields no tokens
   * @return tokens in text order, duplicates preserved
   */
  public static List<String> tokenize(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String token = matcher.group();
      if (token.length() > 1 && !STOPWORDS.contains(token)) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
