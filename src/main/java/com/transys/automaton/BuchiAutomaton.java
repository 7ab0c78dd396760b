package com.transys.automaton;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A nondeterministic Büchi automaton reading letters from the power set of its atomic propositions.
 */
public interface BuchiAutomaton<Q> {
  List<String> atomicPropositions();

  Set<Q> states();

  Set<Q> initialStates();

  /** Successors of {@code state} when reading {@code letter}, a subset of the atomic propositions. */
  Set<Q> successors(Q state, Set<String> letter);

  boolean isAccepting(Q state);

  default Set<Q> acceptingStates() {
    return states().stream().filter(this::isAccepting).collect(Collectors.toUnmodifiableSet());
  }
}
