package com.flamingo.ai.contractqa.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Clauses retrieved for one query, ordered by descending score with ties broken by ascending
 * ordinal. Lives only as long as the query that produced it.
 */
public final class EvidenceSet {

  private static final EvidenceSet EMPTY = new EvidenceSet(List.of());

  private final List<EvidenceItem> items;
  private final Map<String, EvidenceItem> byUnitId;

  private EvidenceSet(List<EvidenceItem> items) {
    this.items = List.copyOf(items);
    Map<String, EvidenceItem> index = new LinkedHashMap<>();
    for (EvidenceItem item : this.items) {
      index.put(item.unitId(), item);
    }
    this.byUnitId = Collections.unmodifiableMap(index);
  }

  public static EvidenceSet of(List<EvidenceItem> items) {
    return items.isEmpty() ? EMPTY : new EvidenceSet(items);
  }

  public static EvidenceSet empty() {
    return EMPTY;
  }

  public List<EvidenceItem> items() {
    return items;
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public boolean contains(String unitId) {
    return byUnitId.containsKey(unitId);
  }

  public Optional<EvidenceItem> find(String unitId) {
    return Optional.ofNullable(byUnitId.get(unitId));
  }

  public Set<String> unitIds() {
    return byUnitId.keySet();
  }

  @Override
  public String toString() {
    return "EvidenceSet" + byUnitId.keySet();
  }
}
