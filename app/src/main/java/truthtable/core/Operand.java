package truthtable.core;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import truthtable.tree.SourceNode;

/**
 * One logical variable of a truth table: a canonical label and every node occurrence that renders
 * to it. Equality is by label only.
 */
public final class Operand {
  private final String label;
  private final Set<SourceNode> nodes = Collections.newSetFromMap(new IdentityHashMap<>());

  public Operand(String label, SourceNode node) {
    this.label = Objects.requireNonNull(label, "label");
    nodes.add(Objects.requireNonNull(node, "node"));
  }

  private Operand(Operand source) {
    this.label = source.label;
    this.nodes.addAll(source.nodes);
  }

  public String label() {
    return label;
  }

  public Set<SourceNode> nodes() {
    return Collections.unmodifiableSet(nodes);
  }

  /** Absorbs the occurrences of an operand with the same label. */
  void merge(Operand other) {
    if (!label.equals(other.label)) {
      throw new IllegalArgumentException(
          "Cannot merge operand '" + other.label + "' into '" + label + "'");
    }
    nodes.addAll(other.nodes);
  }

  Operand copy() {
    return new Operand(this);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Operand other)) {
      return false;
    }
    return label.equals(other.label);
  }

  @Override
  public int hashCode() {
    return label.hashCode();
  }

  @Override
  public String toString() {
    return label;
  }
}
