package com.flamingo.ai.contractqa.support;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Deterministic embedding model for tests. Each dimension flags one topic keyword group; the last
 * dimension is a constant bias so no vector is all zeros.
 */
public class KeywordEmbeddingModel implements EmbeddingModel {

  private static final List<Pattern> TOPICS =
      List.of(
          Pattern.compile("payment|\\bpay|\\bdue\\b"),
          Pattern.compile("penalt|\\bfine|interest"),
          Pattern.compile("\\blate\\b|overdue|after due"),
          Pattern.compile("confidential"),
          Pattern.compile("terminat"));

  public static final int DIMENSION = TOPICS.size() + 1;

  private final AtomicInteger calls = new AtomicInteger();

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
    List<Embedding> embeddings = new ArrayList<>(segments.size());
    for (TextSegment segment : segments) {
      calls.incrementAndGet();
      embeddings.add(Embedding.from(vectorOf(segment.text())));
    }
    return Response.from(embeddings);
  }

  @Override
  public int dimension() {
    return DIMENSION;
  }

  public int calls() {
    return calls.get();
  }

  public static float[] vectorOf(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    float[] vector = new float[DIMENSION];
    for (int i = 0; i < TOPICS.size(); i++) {
      vector[i] = TOPICS.get(i).matcher(lower).find() ? 1f : 0f;
    }
    vector[DIMENSION - 1] = 0.1f;
    return vector;
  }
}
