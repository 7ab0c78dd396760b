package com.transys.label;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Decomposition of state and edge labels into sub-labels, each drawn from its own algebra. State labels
 * are always elements of the power set of the atomic propositions ({@code ap}). Edge labels carry one
 * field ({@code actions}) for closed systems and two ({@code sys_actions}, {@code env_actions}) for open
 * ones.
 */
public final class LabelSchema {
  public enum Kind {
    CLOSED, OPEN
  }

  public static final String ATOMIC_PROPOSITIONS = "ap";
  public static final String ACTIONS = "actions";
  public static final String SYSTEM_ACTIONS = "sys_actions";
  public static final String ENVIRONMENT_ACTIONS = "env_actions";

  private final Kind kind;
  private final PowerSet<String> stateLabels;
  private final ImmutableMap<String, MathSet<Object>> edgeFields;
  private final ImmutableMap<String, String> dotPrefixes;
  private final String dotTypeSeparator;

  private LabelSchema(Kind kind, MathSet<String> atomicPropositions, ImmutableMap<String, MathSet<Object>> edgeFields,
      ImmutableMap<String, String> dotPrefixes, String dotTypeSeparator) {
    this.kind = kind;
    this.stateLabels = new PowerSet<>(atomicPropositions);
    this.edgeFields = edgeFields;
    this.dotPrefixes = dotPrefixes;
    this.dotTypeSeparator = dotTypeSeparator;
  }

  public static LabelSchema closed(Iterable<String> atomicPropositions, Iterable<?> actions) {
    return new LabelSchema(Kind.CLOSED, MathSet.of(atomicPropositions),
        ImmutableMap.of(ACTIONS, MathSet.<Object>of(actions)),
        ImmutableMap.of(ACTIONS, ""), "");
  }

  public static LabelSchema open(Iterable<String> atomicPropositions, Iterable<?> systemActions,
      Iterable<?> environmentActions) {
    return new LabelSchema(Kind.OPEN, MathSet.of(atomicPropositions),
        ImmutableMap.of(
            SYSTEM_ACTIONS, MathSet.<Object>of(systemActions),
            ENVIRONMENT_ACTIONS, MathSet.<Object>of(environmentActions)),
        ImmutableMap.of(SYSTEM_ACTIONS, "sys", ENVIRONMENT_ACTIONS, "env"), ":");
  }

  public Kind kind() {
    return kind;
  }

  public MathSet<String> atomicPropositions() {
    return stateLabels.base();
  }

  public List<String> edgeFields() {
    return edgeFields.keySet().asList();
  }

  public MathSet<Object> alphabet(String field) {
    @Nullable
    MathSet<Object> alphabet = edgeFields.get(field);
    checkArgument(alphabet != null, "Unknown edge field %s for %s system", field, kind);
    return alphabet;
  }

  public void checkStateLabel(Collection<String> label) {
    stateLabels.checkMember(label);
  }

  public void checkEdgeLabel(EdgeLabel label) {
    for (Map.Entry<String, Object> entry : label.values().entrySet()) {
      @Nullable
      MathSet<Object> alphabet = edgeFields.get(entry.getKey());
      if (alphabet == null) {
        throw new DomainException("Edge field %s does not exist for %s systems, expected one of %s"
            .formatted(entry.getKey(), kind, edgeFields.keySet()));
      }
      alphabet.checkMember(entry.getValue());
    }
  }

  public String dotLabel(EdgeLabel label, Function<Object, String> formatter) {
    return label.values().entrySet().stream()
        .map(entry -> {
          String prefix = dotPrefixes.getOrDefault(entry.getKey(), entry.getKey());
          String value = formatter.apply(entry.getValue());
          return prefix.isEmpty() ? value : prefix + dotTypeSeparator + value;
        })
        .collect(Collectors.joining("\\n"));
  }

  @Override
  public String toString() {
    return edgeFields.entrySet().stream()
        .map(e -> "%s -> %s".formatted(e.getKey(), e.getValue()))
        .collect(Collectors.joining(", ", "%s[%s -> %s, ".formatted(kind, ATOMIC_PROPOSITIONS, stateLabels), "]"));
  }
}
