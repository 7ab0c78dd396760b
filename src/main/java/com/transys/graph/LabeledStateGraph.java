package com.transys.graph;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.transys.label.EdgeLabel;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

public final class LabeledStateGraph<S> implements LabeledGraph<S> {
  private final Map<S, ImmutableSet<String>> labels = new LinkedHashMap<>();
  private final Set<S> initialStates = new LinkedHashSet<>();
  private final Set<Transition<S>> transitions = new LinkedHashSet<>();
  private final SetMultimap<S, Transition<S>> outgoing = LinkedHashMultimap.create();
  private final SetMultimap<S, Transition<S>> incoming = LinkedHashMultimap.create();

  @Override
  public boolean addState(S state) {
    requireNonNull(state, "state");
    return labels.putIfAbsent(state, ImmutableSet.of()) == null;
  }

  @Override
  public boolean addState(S state, Set<String> label) {
    requireNonNull(state, "state");
    ImmutableSet<String> copy = ImmutableSet.copyOf(label);
    @Nullable
    ImmutableSet<String> existing = labels.putIfAbsent(state, copy);
    if (existing == null) {
      return true;
    }
    if (!existing.equals(copy)) {
      throw new DuplicateStateException(state, existing, copy);
    }
    return false;
  }

  @Override
  public void relabel(S state, Set<String> label) {
    checkKnown(state);
    labels.put(state, ImmutableSet.copyOf(label));
  }

  @Override
  public Set<String> label(S state) {
    @Nullable
    ImmutableSet<String> label = labels.get(state);
    if (label == null) {
      throw new UnknownStateException(state);
    }
    return label;
  }

  @Override
  public boolean hasState(S state) {
    return labels.containsKey(state);
  }

  @Override
  public Set<S> states() {
    return Collections.unmodifiableSet(labels.keySet());
  }

  @Override
  public Set<S> initialStates() {
    return Collections.unmodifiableSet(initialStates);
  }

  @Override
  public void addInitialStates(Iterable<? extends S> states) {
    // Validate everything first so a failing call leaves the initial states untouched
    for (S state : states) {
      checkKnown(state);
    }
    Iterables.addAll(initialStates, states);
  }

  @Override
  public boolean addTransition(S source, S target, EdgeLabel label) {
    checkKnown(source);
    checkKnown(target);
    Transition<S> transition = new Transition<>(source, target, requireNonNull(label, "label"));
    if (!transitions.add(transition)) {
      return false;
    }
    outgoing.put(source, transition);
    incoming.put(target, transition);
    return true;
  }

  @Override
  public Iterable<Transition<S>> transitions(@Nullable S source, @Nullable S target) {
    if (source == null && target == null) {
      return Collections.unmodifiableSet(transitions);
    }
    if (source != null) {
      Iterable<Transition<S>> candidates = Collections.unmodifiableSet(outgoing.get(source));
      return target == null ? candidates : Iterables.filter(candidates, t -> target.equals(t.target()));
    }
    return Collections.unmodifiableSet(incoming.get(target));
  }

  @Override
  public int transitionCount() {
    return transitions.size();
  }

  private void checkKnown(S state) {
    if (!labels.containsKey(state)) {
      throw new UnknownStateException(state);
    }
  }
}
