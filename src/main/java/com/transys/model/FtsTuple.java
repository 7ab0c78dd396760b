package com.transys.model;

import static java.util.Objects.requireNonNull;

import java.util.List;
import javax.annotation.Nullable;

/**
 * The fields of a closed transition system in tuple form.
 *
 * @param states the states
 * @param initialStates the initial states, a subset of {@code states}
 * @param atomicPropositions the atomic propositions
 * @param labeling either {@link java.util.Map.Entry} pairs of state and label, or labels aligned with
 *     {@code states}; a label is a collection of propositions or a single proposition. {@code null} skips
 *     state labeling.
 * @param actions the actions, {@code null} if transitions are unlabeled
 * @param transitions {@code (from, to)} tuples if {@code actions} is {@code null}, {@code (from, to,
 *     action)} tuples otherwise
 * @param name name of the system
 * @param prefix prepended to every state identifier, may be {@code null}
 */
public record FtsTuple(
    List<?> states,
    List<?> initialStates,
    List<String> atomicPropositions,
    @Nullable List<?> labeling,
    @Nullable List<?> actions,
    List<? extends List<?>> transitions,
    String name,
    @Nullable String prefix) {
  public FtsTuple {
    requireNonNull(states, "Missing states");
    requireNonNull(initialStates, "Missing initial states");
    requireNonNull(atomicPropositions, "Missing atomic propositions");
    requireNonNull(transitions, "Missing transitions");
    requireNonNull(name, "Missing name");
  }

  public FtsTuple(List<?> states, List<?> initialStates, List<String> atomicPropositions,
      @Nullable List<?> labeling, @Nullable List<?> actions, List<? extends List<?>> transitions) {
    this(states, initialStates, atomicPropositions, labeling, actions, transitions, "fts", null);
  }

  public FtsTuple withPrefix(@Nullable String prefix) {
    return new FtsTuple(states, initialStates, atomicPropositions, labeling, actions, transitions, name, prefix);
  }
}
