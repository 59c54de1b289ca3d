package com.flamingo.ai.contractqa.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.contractqa.exception.IndexBuildException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EvidenceIndexRegistry Tests")
class EvidenceIndexRegistryTest {

  private EvidenceIndexRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new EvidenceIndexRegistry();
  }

  @Test
  @DisplayName("Should allow only one build per document at a time")
  void shouldAllowOneBuildPerDocument() {
    registry.beginBuild("doc");

    assertThatThrownBy(() -> registry.beginBuild("doc"))
        .isInstanceOf(IndexBuildException.class)
        .hasMessageContaining("already in progress");

    registry.beginBuild("other");
    registry.endBuild("doc");
    registry.beginBuild("doc");
    assertThat(registry.isBuilding("doc")).isTrue();
  }

  @Test
  @DisplayName("Should expose only published snapshots")
  void shouldExposeOnlyPublishedSnapshots() {
    registry.beginBuild("doc");
    assertThat(registry.find("doc")).isEmpty();

    EvidenceIndexSnapshot snapshot = EvidenceIndexSnapshot.empty("doc");
    registry.publish(snapshot);
    registry.endBuild("doc");

    assertThat(registry.find("doc")).containsSame(snapshot);
  }

  @Test
  @DisplayName("Should keep the previous snapshot until a new one is published")
  void shouldSwapSnapshotsAtomically() {
    EvidenceIndexSnapshot first = EvidenceIndexSnapshot.empty("doc");
    registry.publish(first);

    registry.beginBuild("doc");
    assertThat(registry.find("doc")).containsSame(first);

    EvidenceIndexSnapshot second = EvidenceIndexSnapshot.empty("doc");
    registry.publish(second);
    assertThat(registry.find("doc")).containsSame(second);
  }
}
