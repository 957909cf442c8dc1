package dev.secondbrain.retrieval;

/** A ranking signal that can contribute to a search result. */
public enum Signal {
  BM25("bm25"),
  SEMANTIC("semantic"),
  RERANK("rerank");

  private final String label;

  Signal(String label) {
    this.label = label;
  }

  /** Lower-case name used in logs and observability output. */
  public String label() {
    return label;
  }
}
