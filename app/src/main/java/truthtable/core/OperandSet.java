package truthtable.core;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import truthtable.tree.SourceNode;

/**
 * Operands in first-occurrence order with set semantics on labels.
 *
 * <p>Adding an operand whose label is already present merges its occurrences into the existing
 * entry, so a later occurrence can still be looked up by node. Add, lookup and removal are
 * amortized O(1); iteration follows insertion order.
 */
public final class OperandSet implements Iterable<Operand> {
  private final Map<String, Operand> byLabel = new LinkedHashMap<>();
  private final Map<SourceNode, Operand> byNode = new IdentityHashMap<>();

  public static OperandSet of(Operand... operands) {
    OperandSet set = new OperandSet();
    for (Operand operand : operands) {
      set.add(operand);
    }
    return set;
  }

  /**
   * Adds {@code operand}, or merges it into the entry with the same label.
   *
   * @return {@code true} if the label was not present before
   */
  public boolean add(Operand operand) {
    Operand existing = byLabel.get(operand.label());
    if (existing == null) {
      Operand stored = operand.copy();
      byLabel.put(stored.label(), stored);
      index(stored);
      return true;
    }
    existing.merge(operand);
    index(existing);
    return false;
  }

  /** Union in place, keeping this set's order and appending new labels in {@code other}'s order. */
  public OperandSet addAll(OperandSet other) {
    for (Operand operand : other) {
      add(operand);
    }
    return this;
  }

  public boolean contains(String label) {
    return byLabel.containsKey(label);
  }

  public boolean contains(SourceNode node) {
    return byNode.containsKey(node);
  }

  public Optional<Operand> get(String label) {
    return Optional.ofNullable(byLabel.get(label));
  }

  public Optional<Operand> find(SourceNode node) {
    return Optional.ofNullable(byNode.get(node));
  }

  public boolean remove(String label) {
    Operand removed = byLabel.remove(label);
    if (removed == null) {
      return false;
    }
    for (SourceNode node : removed.nodes()) {
      byNode.remove(node);
    }
    return true;
  }

  public int size() {
    return byLabel.size();
  }

  public boolean isEmpty() {
    return byLabel.isEmpty();
  }

  public List<String> labels() {
    return List.copyOf(byLabel.keySet());
  }

  /** Position of every registered occurrence, keyed by node identity. */
  public Map<SourceNode, Integer> positions() {
    Map<SourceNode, Integer> positions = new IdentityHashMap<>();
    int index = 0;
    for (Operand operand : byLabel.values()) {
      for (SourceNode node : operand.nodes()) {
        positions.put(node, index);
      }
      index++;
    }
    return positions;
  }

  @Override
  public Iterator<Operand> iterator() {
    return Collections.unmodifiableCollection(byLabel.values()).iterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof OperandSet other)) {
      return false;
    }
    return labels().equals(other.labels());
  }

  @Override
  public int hashCode() {
    return labels().hashCode();
  }

  @Override
  public String toString() {
    return "OperandSet" + byLabel.keySet();
  }

  private void index(Operand operand) {
    for (SourceNode node : operand.nodes()) {
      byNode.put(node, operand);
    }
  }
}
