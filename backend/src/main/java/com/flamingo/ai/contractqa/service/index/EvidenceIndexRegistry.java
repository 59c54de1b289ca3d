package com.flamingo.ai.contractqa.service.index;

import com.flamingo.ai.contractqa.exception.IndexBuildException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Published evidence index snapshots by document id.
 *
 * <p>A snapshot becomes visible only once it is fully built. At most one build per document runs
 * at a time; the in-progress set is bookkeeping only and no lock is held while embedding.
 */
@Component
@Slf4j
public class EvidenceIndexRegistry {

  private final Map<String, EvidenceIndexSnapshot> published = new ConcurrentHashMap<>();
  private final Set<String> building = ConcurrentHashMap.newKeySet();

  /**
   * Claims the exclusive build slot of a document.
   *
   * @throws IndexBuildException if a build of the document is already running
   */
  public void beginBuild(String documentId) {
    if (!building.add(documentId)) {
      throw new IndexBuildException(
          documentId, "Index build already in progress for document " + documentId);
    }
  }

  public void endBuild(String documentId) {
    building.remove(documentId);
  }

  public boolean isBuilding(String documentId) {
    return building.contains(documentId);
  }

  public void publish(EvidenceIndexSnapshot snapshot) {
    EvidenceIndexSnapshot previous = published.put(snapshot.getDocumentId(), snapshot);
    log.debug(
        "Published index for document {} ({} units, replaced existing: {})",
        snapshot.getDocumentId(),
        snapshot.size(),
        previous != null);
  }

  public Optional<EvidenceIndexSnapshot> find(String documentId) {
    return Optional.ofNullable(published.get(documentId));
  }
}
