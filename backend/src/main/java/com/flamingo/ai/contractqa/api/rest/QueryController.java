package com.flamingo.ai.contractqa.api.rest;

import com.flamingo.ai.contractqa.api.dto.request.QueryRequest;
import com.flamingo.ai.contractqa.config.PipelineConfig;
import com.flamingo.ai.contractqa.domain.model.ContractQuery;
import com.flamingo.ai.contractqa.service.pipeline.QueryPipelineOrchestrator;
import com.flamingo.ai.contractqa.service.pipeline.QueryResult;
import com.flamingo.ai.contractqa.service.render.AnswerMarkdownRenderer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for questions about a document. Answers synchronously; the run can be polled
 * or cancelled through {@link QueryRunController} while it is in flight.
 */
@RestController
@RequestMapping("/api/documents/{documentId}/queries")
@RequiredArgsConstructor
public class QueryController {

  public static final String RUN_ID_HEADER = "X-Run-Id";
  public static final String ATTEMPTS_HEADER = "X-Generation-Attempts";
  public static final String RETRIES_HEADER = "X-Service-Retries";

  private final QueryPipelineOrchestrator queryPipeline;
  private final AnswerMarkdownRenderer markdownRenderer;
  private final PipelineConfig pipelineConfig;

  /** Answers a question as JSON, or as Markdown when the client asks for text/markdown. */
  @PostMapping(
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_MARKDOWN_VALUE})
  public ResponseEntity<?> ask(
      @PathVariable String documentId,
      @Valid @RequestBody QueryRequest request,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    QueryResult result = queryPipeline.answer(documentId, toQuery(request), request.getRunId());

    ResponseEntity.BodyBuilder response =
        ResponseEntity.ok()
            .header(RUN_ID_HEADER, result.run().runId())
            .header(ATTEMPTS_HEADER, String.valueOf(result.run().attemptCount()))
            .header(RETRIES_HEADER, String.valueOf(result.run().serviceRetryCount()));

    if (wantsMarkdown(accept)) {
      return response
          .contentType(MediaType.TEXT_MARKDOWN)
          .body(markdownRenderer.render(result.answer()));
    }
    return response.contentType(MediaType.APPLICATION_JSON).body(result.answer());
  }

  private ContractQuery toQuery(QueryRequest request) {
    PipelineConfig.Retrieval retrieval = pipelineConfig.getRetrieval();
    int topK = request.getTopK() != null ? request.getTopK() : retrieval.getDefaultTopK();
    if (topK > retrieval.getMaxTopK()) {
      throw new IllegalArgumentException(
          "topK must be at most " + retrieval.getMaxTopK() + ", got " + topK);
    }
    return new ContractQuery(request.getQuestion(), topK);
  }

  // Markdown only when named explicitly and preferred; wildcards keep the JSON contract
  private boolean wantsMarkdown(String accept) {
    if (accept == null || accept.isBlank()) {
      return false;
    }
    MediaType preferred = null;
    for (MediaType mediaType : MediaType.parseMediaTypes(accept)) {
      if (mediaType.isWildcardType() || mediaType.isWildcardSubtype()) {
        continue;
      }
      if (preferred == null || mediaType.getQualityValue() > preferred.getQualityValue()) {
        preferred = mediaType;
      }
    }
    return preferred != null && MediaType.TEXT_MARKDOWN.includes(preferred);
  }
}
