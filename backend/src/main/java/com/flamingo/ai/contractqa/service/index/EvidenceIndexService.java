package com.flamingo.ai.contractqa.service.index;

import com.flamingo.ai.contractqa.domain.model.ClauseUnit;
import com.flamingo.ai.contractqa.domain.model.EvidenceItem;
import com.flamingo.ai.contractqa.domain.model.EvidenceSet;
import com.flamingo.ai.contractqa.exception.EmbeddingServiceException;
import com.flamingo.ai.contractqa.exception.IndexBuildException;
import com.flamingo.ai.contractqa.service.embedding.EmbeddingService;
import com.flamingo.ai.contractqa.service.pipeline.CancellationToken;
import com.flamingo.ai.contractqa.service.pipeline.ExternalCallGuard;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds evidence index snapshots and answers nearest-neighbour queries against them.
 *
 * <p>Ranking uses the store's cosine relevance score, re-sorted by descending score with ties
 * broken by ascending clause ordinal so identical inputs always rank identically.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceIndexService {

  // Passages embedded concurrently per window
  private static final int EMBEDDING_WINDOW = 16;

  private static final Comparator<EvidenceItem> RANKING =
      Comparator.comparingDouble(EvidenceItem::score)
          .reversed()
          .thenComparingInt(EvidenceItem::ordinal);

  private final EmbeddingService embeddingService;
  private final ExternalCallGuard guard;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds every unit and builds an immutable snapshot.
   *
   * @param documentId owning document
   * @param units units in document order
   * @param token cancellation token of the build
   * @return the snapshot, empty when there are no units
   * @throws IndexBuildException if a vector is empty or vector dimensions disagree
   */
  @Timed(value = "index.build", description = "Time to build an evidence index")
  public EvidenceIndexSnapshot build(
      String documentId, List<ClauseUnit> units, CancellationToken token) {
    if (units.isEmpty()) {
      return EvidenceIndexSnapshot.empty(documentId);
    }

    List<float[]> vectors = embedAll(units, token);

    InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
    int dimension = -1;
    for (int i = 0; i < units.size(); i++) {
      ClauseUnit unit = units.get(i);
      float[] vector = vectors.get(i);
      if (vector == null || vector.length == 0) {
        meterRegistry.counter("index.build.failure", "reason", "empty_vector").increment();
        throw new IndexBuildException(
            documentId, "Embedding for " + unit.id() + " is empty");
      }
      if (dimension < 0) {
        dimension = vector.length;
      } else if (vector.length != dimension) {
        meterRegistry.counter("index.build.failure", "reason", "dimension_mismatch").increment();
        throw new IndexBuildException(
            documentId,
            String.format(
                "Embedding for %s has dimension %d, expected %d",
                unit.id(), vector.length, dimension));
      }
      store.add(unit.id(), Embedding.from(vector));
    }

    meterRegistry.counter("index.build.success").increment();
    log.info(
        "Built evidence index for document {}: {} units, dimension {}",
        documentId,
        units.size(),
        dimension);
    return new EvidenceIndexSnapshot(documentId, units, store, dimension);
  }

  /**
   * Ranks the snapshot's units against a query vector.
   *
   * @param snapshot index to search
   * @param queryVector query embedding
   * @param topK maximum results; larger than the index returns every unit
   * @return ranked evidence, empty when the index is empty
   */
  public EvidenceSet query(EvidenceIndexSnapshot snapshot, float[] queryVector, int topK) {
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be positive, got " + topK);
    }
    if (snapshot.isEmpty()) {
      return EvidenceSet.empty();
    }
    if (queryVector == null || queryVector.length != snapshot.getDimension()) {
      throw new EmbeddingServiceException(
          String.format(
              "Query embedding dimension %d does not match index dimension %d",
              queryVector == null ? 0 : queryVector.length,
              snapshot.getDimension()),
          false);
    }

    // Ask for every unit so ties at the cut-off are resolved by ordinal, not by the store
    List<EmbeddingMatch<TextSegment>> matches =
        snapshot.nearest(Embedding.from(queryVector), snapshot.size());

    List<EvidenceItem> items = new ArrayList<>(matches.size());
    for (EmbeddingMatch<TextSegment> match : matches) {
      snapshot
          .unit(match.embeddingId())
          .ifPresent(
              unit ->
                  items.add(
                      new EvidenceItem(unit.id(), unit.ordinal(), unit.text(), match.score())));
    }
    items.sort(RANKING);
    return EvidenceSet.of(items.subList(0, Math.min(topK, items.size())));
  }

  private List<float[]> embedAll(List<ClauseUnit> units, CancellationToken token) {
    List<float[]> vectors = new ArrayList<>(units.size());
    for (int from = 0; from < units.size(); from += EMBEDDING_WINDOW) {
      List<ClauseUnit> window =
          units.subList(from, Math.min(from + EMBEDDING_WINDOW, units.size()));
      List<Future<float[]>> futures = new ArrayList<>(window.size());
      try {
        for (ClauseUnit unit : window) {
          futures.add(guard.submit(token, () -> embeddingService.embedPassage(unit.text())));
        }
        for (Future<float[]> future : futures) {
          vectors.add(guard.await(ExternalCallGuard.EMBEDDING, token, future));
        }
      } finally {
        futures.forEach(future -> future.cancel(true));
      }
    }
    return vectors;
  }
}
