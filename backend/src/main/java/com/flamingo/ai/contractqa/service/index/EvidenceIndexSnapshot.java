package com.flamingo.ai.contractqa.service.index;

import com.flamingo.ai.contractqa.domain.model.ClauseUnit;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fully built evidence index of one document. Never modified after construction, so any number
 * of queries may read it while a newer snapshot is being built.
 */
public final class EvidenceIndexSnapshot {

  private final String documentId;
  private final Map<String, ClauseUnit> unitsById;
  private final InMemoryEmbeddingStore<TextSegment> store;
  private final int dimension;

  EvidenceIndexSnapshot(
      String documentId,
      List<ClauseUnit> units,
      InMemoryEmbeddingStore<TextSegment> store,
      int dimension) {
    Map<String, ClauseUnit> byId = new LinkedHashMap<>();
    for (ClauseUnit unit : units) {
      byId.put(unit.id(), unit);
    }
    this.documentId = documentId;
    this.unitsById = Collections.unmodifiableMap(byId);
    this.store = store;
    this.dimension = dimension;
  }

  static EvidenceIndexSnapshot empty(String documentId) {
    return new EvidenceIndexSnapshot(documentId, List.of(), new InMemoryEmbeddingStore<>(), 0);
  }

  List<EmbeddingMatch<TextSegment>> nearest(Embedding queryEmbedding, int maxResults) {
    return store
        .search(
            EmbeddingSearchRequest.builder()
                .queryEmbedding(queryEmbedding)
                .maxResults(maxResults)
                .minScore(0.0)
                .build())
        .matches();
  }

  public String getDocumentId() {
    return documentId;
  }

  public int getDimension() {
    return dimension;
  }

  public int size() {
    return unitsById.size();
  }

  public boolean isEmpty() {
    return unitsById.isEmpty();
  }

  public Optional<ClauseUnit> unit(String unitId) {
    return Optional.ofNullable(unitsById.get(unitId));
  }
}
