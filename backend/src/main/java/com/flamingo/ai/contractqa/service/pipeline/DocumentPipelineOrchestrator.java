package com.flamingo.ai.contractqa.service.pipeline;

import com.flamingo.ai.contractqa.domain.enums.BuildStage;
import com.flamingo.ai.contractqa.domain.enums.ErrorKind;
import com.flamingo.ai.contractqa.domain.model.ClauseUnit;
import com.flamingo.ai.contractqa.domain.model.ContractDocument;
import com.flamingo.ai.contractqa.exception.DocumentConflictException;
import com.flamingo.ai.contractqa.exception.PipelineException;
import com.flamingo.ai.contractqa.service.index.EvidenceIndexRegistry;
import com.flamingo.ai.contractqa.service.index.EvidenceIndexService;
import com.flamingo.ai.contractqa.service.index.EvidenceIndexSnapshot;
import com.flamingo.ai.contractqa.service.segmentation.ClauseSegmenter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Ingests a document and builds its evidence index: ingest, segment, index.
 *
 * <p>Documents are immutable. Re-ingesting the same id with the same text returns the existing
 * build; the same id with different text is rejected unless the earlier build failed.
 */
@Service
@Slf4j
public class DocumentPipelineOrchestrator {

  private final Map<String, DocumentBuild> builds = new ConcurrentHashMap<>();

  private final ClauseSegmenter segmenter;
  private final EvidenceIndexService indexService;
  private final EvidenceIndexRegistry indexRegistry;
  private final ServiceRetryPolicy retryPolicy;
  private final TaskExecutor executor;
  private final MeterRegistry meterRegistry;

  public DocumentPipelineOrchestrator(
      ClauseSegmenter segmenter,
      EvidenceIndexService indexService,
      EvidenceIndexRegistry indexRegistry,
      ServiceRetryPolicy retryPolicy,
      @Qualifier("documentProcessingExecutor") TaskExecutor executor,
      MeterRegistry meterRegistry) {
    this.segmenter = segmenter;
    this.indexService = indexService;
    this.indexRegistry = indexRegistry;
    this.retryPolicy = retryPolicy;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Ingests and indexes a document on the caller's thread.
   *
   * @return the finished build record
   * @throws DocumentConflictException if the id is taken by different text
   * @throws PipelineException if the build failed
   */
  public DocumentBuildRecord ingest(String documentId, String text) {
    Registration registration = register(documentId, text);
    if (!registration.created()) {
      return registration.build().record();
    }
    return run(registration.build());
  }

  /**
   * Registers a document and builds its index in the background. Build failures are recorded on
   * the document's run state.
   *
   * @return the build record as of registration
   */
  public DocumentBuildRecord ingestAsync(String documentId, String text) {
    Registration registration = register(documentId, text);
    DocumentBuild build = registration.build();
    if (registration.created()) {
      try {
        executor.execute(() -> runInBackground(build));
      } catch (TaskRejectedException e) {
        build.state().fail(ErrorKind.INDEX_BUILD);
        throw e;
      }
    }
    return build.record();
  }

  public Optional<DocumentBuildRecord> find(String documentId) {
    return Optional.ofNullable(builds.get(documentId)).map(DocumentBuild::record);
  }

  private synchronized Registration register(String documentId, String text) {
    ContractDocument document = ContractDocument.of(documentId, text);
    DocumentBuild existing = builds.get(documentId);
    if (existing != null && existing.state().getStage() != BuildStage.FAILED) {
      if (existing.document().contentHash().equals(document.contentHash())) {
        log.debug("Document {} already ingested with identical content", documentId);
        return new Registration(existing, false);
      }
      throw new DocumentConflictException(documentId);
    }
    DocumentBuild build = new DocumentBuild(document, RunState.forBuild(documentId));
    builds.put(documentId, build);
    return new Registration(build, true);
  }

  DocumentBuildRecord run(DocumentBuild build) {
    RunState<BuildStage> state = build.state();
    String documentId = build.document().id();
    CancellationToken token = new CancellationToken();
    Timer.Sample sample = Timer.start(meterRegistry);

    try {
      state.transitionTo(BuildStage.INGESTING);
      log.info(
          "Ingesting document {} ({} chars)", documentId, build.document().text().length());

      state.transitionTo(BuildStage.SEGMENTING);
      List<ClauseUnit> units = segmenter.segment(build.document());
      build.unitCount = units.size();

      state.transitionTo(BuildStage.INDEXING);
      indexRegistry.beginBuild(documentId);
      try {
        EvidenceIndexSnapshot snapshot =
            retryPolicy.execute(
                "indexing", state, token, () -> indexService.build(documentId, units, token));
        indexRegistry.publish(snapshot);
      } finally {
        indexRegistry.endBuild(documentId);
      }

      state.transitionTo(BuildStage.INDEXED);
      meterRegistry.counter("pipeline.build.completed").increment();
      log.info("Document {} indexed with {} clauses", documentId, units.size());
      return build.record();
    } catch (PipelineException e) {
      e.atStage(state.getStage().name());
      state.fail(e.getKind());
      meterRegistry.counter("pipeline.build.failed", "kind", e.getKind().name()).increment();
      log.error("Build of document {} failed at {}: {}", documentId, e.getStage(), e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      state.fail(null);
      meterRegistry.counter("pipeline.build.failed", "kind", "UNEXPECTED").increment();
      log.error("Build of document {} failed unexpectedly", documentId, e);
      throw e;
    } finally {
      sample.stop(
          meterRegistry.timer("pipeline.build.duration", "outcome", state.getStage().name()));
    }
  }

  private void runInBackground(DocumentBuild build) {
    try {
      run(build);
    } catch (RuntimeException e) {
      // Already logged and recorded on the run state; readers poll the build record
      log.debug(
          "Background build of {} ended with {}",
          build.document().id(),
          e.getClass().getSimpleName());
    }
  }

  static final class DocumentBuild {
    private final ContractDocument document;
    private final RunState<BuildStage> state;
    private volatile int unitCount;

    DocumentBuild(ContractDocument document, RunState<BuildStage> state) {
      this.document = document;
      this.state = state;
    }

    ContractDocument document() {
      return document;
    }

    RunState<BuildStage> state() {
      return state;
    }

    DocumentBuildRecord record() {
      return new DocumentBuildRecord(
          document.id(), document.contentHash(), unitCount, state.view());
    }
  }

  private record Registration(DocumentBuild build, boolean created) {}
}
