package dev.secondbrain.search;

/**
 * Which engines can currently serve queries, and the active fusion parameters.
 *
 * @param sparseIndexBuilt BM25 index has a snapshot
 * @param indexedDocuments documents in the BM25 snapshot
 * @param embeddingAvailable a real embedding backend is configured
 * @param embeddingModel active embedding model id
 * @param embeddedDocuments documents with an embedding for the active model
 * @param rerankerAvailable a cross-encoder is loaded
 * @param rrfK RRF rank constant
 * @param semanticWeight semantic signal weight
 * @param bm25Weight BM25 signal weight
 * @param rerankWeight rerank signal weight
 * @param rerankBlend share of the combined score taken by the reranker
 */
public record SearchCapabilities(
    boolean sparseIndexBuilt,
    int indexedDocuments,
    boolean embeddingAvailable,
    String embeddingModel,
    int embeddedDocuments,
    boolean rerankerAvailable,
    int rrfK,
    double semanticWeight,
    double bm25Weight,
    double rerankWeight,
    double rerankBlend) {}
