package com.transys.graph;

import com.google.common.collect.Streams;
import com.transys.label.EdgeLabel;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Storage of a directed multigraph with labeled states and labeled edges. Implementations only enforce
 * structural constraints (known endpoints, unique states); what a label may contain is decided by the
 * owner of the graph.
 */
public interface LabeledGraph<S> {
  /** Adds an unlabeled state, returns false if it already exists. */
  boolean addState(S state);

  /**
   * Adds a state with the given label. Re-adding an existing state with the same label does nothing.
   *
   * @throws DuplicateStateException if the state exists with a different label
   */
  boolean addState(S state, Set<String> label);

  /**
   * Replaces the label of an existing state.
   *
   * @throws UnknownStateException if the state does not exist
   */
  void relabel(S state, Set<String> label);

  Set<String> label(S state);

  boolean hasState(S state);

  Set<S> states();

  Set<S> initialStates();

  /**
   * Unions the given states into the initial states.
   *
   * @throws UnknownStateException if any of the states does not exist
   */
  void addInitialStates(Iterable<? extends S> states);

  /**
   * Adds an edge, returns false if the same edge (including label) is already present.
   *
   * @throws UnknownStateException if either endpoint does not exist
   */
  boolean addTransition(S source, S target, EdgeLabel label);

  default boolean addTransition(S source, S target) {
    return addTransition(source, target, EdgeLabel.empty());
  }

  /**
   * Lazy view on the edges matching the given endpoints in insertion order. A {@code null} endpoint
   * matches every state. The view can be iterated repeatedly.
   */
  Iterable<Transition<S>> transitions(@Nullable S source, @Nullable S target);

  default Iterable<Transition<S>> transitions() {
    return transitions(null, null);
  }

  int transitionCount();

  default Set<S> successors(S state) {
    return Streams.stream(transitions(state, null))
        .map(Transition::target)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
