package com.transys.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Product of a closed transition system with a Büchi automaton. States pair a system state with an
 * automaton state and keep the label of the system state; a product state is accepting iff its
 * automaton component is.
 */
public final class BuchiProduct<S, Q> extends FiniteTransitionSystem<ProductState<S, Q>> {
  private final Set<ProductState<S, Q>> acceptingStates = new LinkedHashSet<>();

  BuchiProduct(String name, boolean mutable) {
    super(name, mutable);
  }

  void markAccepting(ProductState<S, Q> state) {
    assert hasState(state);
    acceptingStates.add(state);
  }

  /** Merges as {@link TransitionSystem#merge}; accepting states of a product source stay accepting. */
  @Override
  public BuchiProduct<S, Q> merge(TransitionSystem<ProductState<S, Q>> source) {
    super.merge(source);
    if (source != this && source instanceof BuchiProduct<S, Q> product) {
      product.acceptingStates().forEach(this::markAccepting);
    }
    return this;
  }

  public Set<ProductState<S, Q>> acceptingStates() {
    return Collections.unmodifiableSet(acceptingStates);
  }

  public boolean isAccepting(ProductState<S, Q> state) {
    return acceptingStates.contains(state);
  }
}
