package com.flamingo.ai.contractqa.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EvidenceSet Tests")
class EvidenceSetTest {

  private final EvidenceSet evidence =
      EvidenceSet.of(
          List.of(
              new EvidenceItem(
                  "contract-1/clause_2", 2, "1.5% monthly penalty after due date", 0.9),
              new EvidenceItem("contract-1/clause_1", 1, "Payment due within 30 days", 0.8)));

  @Test
  @DisplayName("Should expose unit ids in ranked order")
  void shouldExposeUnitIdsInRankedOrder() {
    assertThat(evidence.unitIds()).containsExactly("contract-1/clause_2", "contract-1/clause_1");
    assertThat(evidence.contains("contract-1/clause_1")).isTrue();
    assertThat(evidence.contains("contract-1/clause_3")).isFalse();
  }

  @Test
  @DisplayName("Should not let callers remove unit ids")
  void shouldRejectUnitIdRemoval() {
    assertThatThrownBy(() -> evidence.unitIds().remove("contract-1/clause_2"))
        .isInstanceOf(UnsupportedOperationException.class);

    assertThat(evidence.contains("contract-1/clause_2")).isTrue();
    assertThat(evidence.find("contract-1/clause_2")).isPresent();
  }
}
