package com.transys.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.transys.label.EdgeLabel;
import com.transys.label.LabelSchema;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Finite transition system of an open system. Edges are labeled by a system action, an environment
 * action, or both.
 */
public class OpenFiniteTransitionSystem<S> extends TransitionSystem<S> {
  public OpenFiniteTransitionSystem(String name) {
    this(name, List.of(), List.of(), List.of(), false);
  }

  public OpenFiniteTransitionSystem(String name, boolean mutable) {
    this(name, List.of(), List.of(), List.of(), mutable);
  }

  public OpenFiniteTransitionSystem(String name, Iterable<String> atomicPropositions, Iterable<?> systemActions,
      Iterable<?> environmentActions) {
    this(name, atomicPropositions, systemActions, environmentActions, false);
  }

  public OpenFiniteTransitionSystem(String name, Iterable<String> atomicPropositions, Iterable<?> systemActions,
      Iterable<?> environmentActions, boolean mutable) {
    super(name, LabelSchema.open(atomicPropositions, systemActions, environmentActions), mutable);
  }

  public Set<Object> systemActions() {
    return alphabet(LabelSchema.SYSTEM_ACTIONS);
  }

  public Set<Object> environmentActions() {
    return alphabet(LabelSchema.ENVIRONMENT_ACTIONS);
  }

  public void growSystemActions(Iterable<?> actions) {
    growAlphabet(LabelSchema.SYSTEM_ACTIONS, actions);
  }

  public void growEnvironmentActions(Iterable<?> actions) {
    growAlphabet(LabelSchema.ENVIRONMENT_ACTIONS, actions);
  }

  public boolean addLabeledTransition(S source, S target, @Nullable Object systemAction,
      @Nullable Object environmentAction) {
    checkArgument(systemAction != null || environmentAction != null,
        "Labeled transition %s -> %s needs a system or an environment action", source, target);
    ImmutableMap.Builder<String, Object> label = ImmutableMap.builder();
    if (systemAction != null) {
      label.put(LabelSchema.SYSTEM_ACTIONS, systemAction);
    }
    if (environmentAction != null) {
      label.put(LabelSchema.ENVIRONMENT_ACTIONS, environmentAction);
    }
    return addTransition(source, target, EdgeLabel.of(label.build()));
  }

  @Override
  public OpenFiniteTransitionSystem<S> merge(TransitionSystem<S> source) {
    super.merge(source);
    return this;
  }

  public <T> OpenFiniteTransitionSystem<ProductState<S, T>> synchronousProduct(TransitionSystem<T> other) {
    checkKind("synchronous product", other);
    return Products.synchronous(this, other,
        new OpenFiniteTransitionSystem<>(productName(other), productMutable(other)));
  }

  public <T> OpenFiniteTransitionSystem<ProductState<S, T>> asynchronousProduct(TransitionSystem<T> other) {
    checkKind("asynchronous product", other);
    return Products.asynchronous(this, other,
        new OpenFiniteTransitionSystem<>(productName(other), productMutable(other)));
  }
}
