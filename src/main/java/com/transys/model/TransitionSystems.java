package com.transys.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Streams;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import javax.annotation.Nullable;

/**
 * Builders which populate closed transition systems from plain tuples and label sequences.
 */
public final class TransitionSystems {
  private static final Logger logger = Logger.getLogger(TransitionSystems.class.getName());

  /** The constant true proposition added by {@link #negationClosure(Iterable)}. */
  public static final String TRUE = "True";
  public static final String NEGATION = "!";

  private TransitionSystems() {}

  public static String negate(String proposition) {
    return proposition.startsWith(NEGATION) ? proposition.substring(NEGATION.length()) : NEGATION + proposition;
  }

  public static boolean isNegated(String proposition) {
    return proposition.startsWith(NEGATION);
  }

  /**
   * Each proposition followed by its negation, then {@link #TRUE}. Duplicates are dropped, the first
   * occurrence fixes the order.
   */
  public static ImmutableSet<String> negationClosure(Iterable<String> propositions) {
    ImmutableSet.Builder<String> closure = ImmutableSet.builder();
    for (String proposition : propositions) {
      closure.add(proposition, negate(proposition));
    }
    return closure.add(TRUE).build();
  }

  public static FiniteTransitionSystem<String> fromTuple(FtsTuple tuple) {
    String prefix = tuple.prefix() == null ? "" : tuple.prefix();
    if (!prefix.isEmpty()) {
      logger.log(Level.FINE, "Prepending {0} to all states", prefix);
    }

    FiniteTransitionSystem<String> system = new FiniteTransitionSystem<>(tuple.name());
    system.addStates(tuple.states().stream().map(s -> prefix + s).toList());
    system.setInitial(tuple.initialStates().stream().map(s -> prefix + s).toList());
    system.growAtomicPropositions(tuple.atomicPropositions());

    if (tuple.labeling() != null) {
      for (Map.Entry<?, ?> entry : pairLabelsWithStates(tuple.states(), tuple.labeling())) {
        String state = prefix + entry.getKey();
        Set<String> label = toLabel(entry.getValue());
        logger.log(Level.FINER, () -> "Labeling state %s with %s".formatted(state, label));
        system.labelState(state, label);
      }
    }

    if (tuple.actions() == null) {
      for (List<?> transition : tuple.transitions()) {
        checkArgument(transition.size() == 2, "Expected (from, to) without actions, got %s", transition);
        String source = prefix + transition.get(0);
        String target = prefix + transition.get(1);
        logger.log(Level.FINER, () -> "Adding unlabeled edge %s -> %s".formatted(source, target));
        system.addTransition(source, target);
      }
    } else {
      system.growActions(tuple.actions());
      for (List<?> transition : tuple.transitions()) {
        checkArgument(transition.size() == 3, "Expected (from, to, action), got %s", transition);
        String source = prefix + transition.get(0);
        String target = prefix + transition.get(1);
        Object action = transition.get(2);
        logger.log(Level.FINER, () -> "Adding edge %s -[%s]-> %s".formatted(source, action, target));
        system.addLabeledTransition(source, target, action);
      }
    }
    return system;
  }

  /**
   * Chain {@code s<start> -> s<start+1> -> ...} with one state per label. No initial states are set.
   * A label is either a collection of propositions or a single proposition.
   */
  public static FiniteTransitionSystem<String> lineLabeledWith(List<?> labels, int start) {
    List<Set<String>> stateLabels = labels.stream().map(TransitionSystems::toLabel).toList();
    Set<String> propositions = stateLabels.stream()
        .flatMap(Set::stream)
        .collect(ImmutableSet.toImmutableSet());

    int count = labels.size();
    List<Integer> states = IntStream.range(start, start + count).boxed().toList();
    List<List<?>> transitions = new ArrayList<>();
    for (int i = start; i < start + count - 1; i++) {
      transitions.add(List.of(i, i + 1));
    }
    return fromTuple(new FtsTuple(states, List.of(), List.copyOf(negationClosure(propositions)),
        stateLabels, null, transitions, "fts", "s"));
  }

  public static FiniteTransitionSystem<String> lineLabeledWith(List<?> labels) {
    return lineLabeledWith(labels, 0);
  }

  /** As {@link #lineLabeledWith(List)}, with an extra transition from the last state back to {@code s0}. */
  public static FiniteTransitionSystem<String> cycleLabeledWith(List<?> labels) {
    checkArgument(!labels.isEmpty(), "A cycle needs at least one state");
    FiniteTransitionSystem<String> system = lineLabeledWith(labels, 0);
    system.addTransition("s" + (labels.size() - 1), "s0");
    return system;
  }

  private static List<? extends Map.Entry<?, ?>> pairLabelsWithStates(List<?> states, List<?> labeling) {
    if (labeling.isEmpty()) {
      return List.of();
    }
    if (labeling.stream().allMatch(Map.Entry.class::isInstance)) {
      return labeling.stream().map(entry -> (Map.Entry<?, ?>) entry).toList();
    }
    logger.log(Level.FINE, "State labeling is not given as (state, label) pairs, zipping with states");
    return Streams.zip(states.stream(), labeling.stream(), Map::entry).toList();
  }

  static Set<String> toLabel(@Nullable Object label) {
    if (label == null) {
      return Set.of();
    }
    if (label instanceof String proposition) {
      return Set.of(proposition);
    }
    if (label instanceof Collection<?> collection) {
      ImmutableSet.Builder<String> builder = ImmutableSet.builder();
      for (Object element : collection) {
        checkArgument(element instanceof String, "Propositions must be strings, got %s", element);
        builder.add((String) element);
      }
      return builder.build();
    }
    throw new IllegalArgumentException("Unsupported state label " + label);
  }
}
