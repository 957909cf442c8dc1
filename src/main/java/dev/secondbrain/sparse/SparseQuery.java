package dev.secondbrain.sparse;

import dev.secondbrain.retrieval.InvalidQueryException;
import java.util.List;

/**
 * A tokenized keyword query.
 *
 * @param tokens query tokens, normalized exactly like indexed text; repeats are kept
 * @param phrase true if the tokens must occur contiguously in a matching document
 */
public record SparseQuery(List<String> tokens, boolean phrase) {

  public SparseQuery {
    tokens = List.copyOf(tokens);
  }

  /**
   * Parses a sanitized query string. A query wrapped in double quotes is a phrase query.
   *
   * @param sanitized output of query sanitization
   * @throws InvalidQueryException if no indexable token remains
   */
  public static SparseQuery parse(String sanitized) {
    String text = sanitized.strip();
    boolean quoted = text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"");
    if (quoted) {
      text = text.substring(1, text.length() - 1);
    }
    List<String> tokens = Tokenizer.tokenize(text);
    if (tokens.isEmpty()) {
      throw new InvalidQueryException("No searchable terms in query: '" + sanitized + "'");
    }
    return new SparseQuery(tokens, quoted && tokens.size() > 1);
  }
}
