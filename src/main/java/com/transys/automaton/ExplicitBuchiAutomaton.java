package com.transys.automaton;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class ExplicitBuchiAutomaton<Q> implements BuchiAutomaton<Q> {
  private record LetterKey<Q>(Q state, Set<String> letter) {}

  private final List<String> atomicPropositions;
  private final Set<Q> states;
  private final Set<Q> initialStates;
  private final Set<Q> acceptingStates;
  private final SetMultimap<LetterKey<Q>, Q> transitions;

  private ExplicitBuchiAutomaton(List<String> atomicPropositions, Set<Q> states, Set<Q> initialStates,
      Set<Q> acceptingStates, SetMultimap<LetterKey<Q>, Q> transitions) {
    assert states.containsAll(initialStates);
    assert states.containsAll(acceptingStates);
    assert transitions.entries().stream()
        .allMatch(e -> states.contains(e.getKey().state()) && states.contains(e.getValue()));

    this.atomicPropositions = List.copyOf(atomicPropositions);
    this.states = ImmutableSet.copyOf(states);
    this.initialStates = ImmutableSet.copyOf(initialStates);
    this.acceptingStates = ImmutableSet.copyOf(acceptingStates);
    this.transitions = ImmutableSetMultimap.copyOf(transitions);
  }

  public static <Q> Builder<Q> builder(Collection<String> atomicPropositions) {
    return new Builder<>(atomicPropositions);
  }

  @Override
  public List<String> atomicPropositions() {
    return atomicPropositions;
  }

  @Override
  public Set<Q> states() {
    return states;
  }

  @Override
  public Set<Q> initialStates() {
    return initialStates;
  }

  @Override
  public Set<Q> successors(Q state, Set<String> letter) {
    return transitions.get(new LetterKey<>(state, Set.copyOf(letter)));
  }

  @Override
  public boolean isAccepting(Q state) {
    return acceptingStates.contains(state);
  }

  @Override
  public Set<Q> acceptingStates() {
    return acceptingStates;
  }

  @Override
  public String toString() {
    return "BA[%d states, %d initial, %d accepting]@%s"
        .formatted(states.size(), initialStates.size(), acceptingStates.size(), atomicPropositions);
  }

  public static final class Builder<Q> {
    private final List<String> atomicPropositions;
    private final Set<Q> states = new LinkedHashSet<>();
    private final Set<Q> initialStates = new LinkedHashSet<>();
    private final Set<Q> acceptingStates = new LinkedHashSet<>();
    private final ImmutableSetMultimap.Builder<LetterKey<Q>, Q> transitions = ImmutableSetMultimap.builder();

    private Builder(Collection<String> atomicPropositions) {
      this.atomicPropositions = new ArrayList<>(new LinkedHashSet<>(atomicPropositions));
    }

    public Builder<Q> state(Q state) {
      states.add(Objects.requireNonNull(state));
      return this;
    }

    public Builder<Q> initial(Q state) {
      initialStates.add(state);
      return state(state);
    }

    public Builder<Q> accepting(Q state) {
      acceptingStates.add(state);
      return state(state);
    }

    public Builder<Q> transition(Q source, Set<String> letter, Q target) {
      checkArgument(atomicPropositions.containsAll(letter),
          "Letter %s is not a subset of %s", letter, atomicPropositions);
      state(source);
      state(target);
      transitions.put(new LetterKey<>(source, Set.copyOf(letter)), target);
      return this;
    }

    public Builder<Q> transitionOnAnyLetter(Q source, Q target) {
      for (Set<String> letter : Sets.powerSet(Set.copyOf(atomicPropositions))) {
        transition(source, letter, target);
      }
      return this;
    }

    public ExplicitBuchiAutomaton<Q> build() {
      return new ExplicitBuchiAutomaton<>(atomicPropositions, states, initialStates, acceptingStates,
          transitions.build());
    }
  }
}
