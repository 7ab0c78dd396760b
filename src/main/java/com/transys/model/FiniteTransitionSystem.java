package com.transys.model;

import com.transys.automaton.BuchiAutomaton;
import com.transys.label.EdgeLabel;
import com.transys.label.LabelSchema;
import java.util.List;
import java.util.Set;

/**
 * Finite transition system modeling a closed system (Baier and Katoen, Def. 2.1). Edges carry at most
 * one action of a single alphabet.
 */
public class FiniteTransitionSystem<S> extends TransitionSystem<S> {
  public FiniteTransitionSystem(String name) {
    this(name, List.of(), List.of(), false);
  }

  public FiniteTransitionSystem(String name, boolean mutable) {
    this(name, List.of(), List.of(), mutable);
  }

  public FiniteTransitionSystem(String name, Iterable<String> atomicPropositions, Iterable<?> actions) {
    this(name, atomicPropositions, actions, false);
  }

  public FiniteTransitionSystem(String name, Iterable<String> atomicPropositions, Iterable<?> actions,
      boolean mutable) {
    super(name, LabelSchema.closed(atomicPropositions, actions), mutable);
  }

  public Set<Object> actions() {
    return alphabet(LabelSchema.ACTIONS);
  }

  public void growActions(Iterable<?> actions) {
    growAlphabet(LabelSchema.ACTIONS, actions);
  }

  public boolean addLabeledTransition(S source, S target, Object action) {
    return addTransition(source, target, EdgeLabel.of(LabelSchema.ACTIONS, action));
  }

  @Override
  public FiniteTransitionSystem<S> merge(TransitionSystem<S> source) {
    super.merge(source);
    return this;
  }

  /** Synchronous (tensor) product with another closed system (Baier and Katoen, Def. 2.42). */
  public <T> FiniteTransitionSystem<ProductState<S, T>> synchronousProduct(TransitionSystem<T> other) {
    checkKind("synchronous product", other);
    return Products.synchronous(this, other,
        new FiniteTransitionSystem<>(productName(other), productMutable(other)));
  }

  /** Product with a Büchi automaton reading the state labels of this system (Baier and Katoen, Def. 4.62). */
  public <Q> BuchiProduct<S, Q> synchronousProduct(BuchiAutomaton<Q> automaton) {
    return Products.synchronous(this, automaton, new BuchiProduct<>(name() + "_x_ba", isMutable()));
  }

  public <T, Q> FiniteTransitionSystem<? extends ProductState<S, ?>> synchronousProduct(
      ProductOperand<T, Q> operand) {
    return operand.<FiniteTransitionSystem<? extends ProductState<S, ?>>>map(
        system -> synchronousProduct(system),
        automaton -> synchronousProduct(automaton));
  }

  /** Asynchronous (interleaving) product with another closed system (Baier and Katoen, Def. 2.18). */
  public <T> FiniteTransitionSystem<ProductState<S, T>> asynchronousProduct(TransitionSystem<T> other) {
    checkKind("asynchronous product", other);
    return Products.asynchronous(this, other,
        new FiniteTransitionSystem<>(productName(other), productMutable(other)));
  }

  public <T, Q> FiniteTransitionSystem<ProductState<S, T>> asynchronousProduct(ProductOperand<T, Q> operand) {
    return operand.<FiniteTransitionSystem<ProductState<S, T>>>map(
        system -> asynchronousProduct(system),
        automaton -> {
          throw new UnsupportedOperationException("Asynchronous product with an automaton is not defined");
        });
  }

  public FiniteTransitionSystem<S> intersection(TransitionSystem<S> other) {
    throw new UnsupportedOperationException("intersection");
  }

  public FiniteTransitionSystem<S> difference(TransitionSystem<S> other) {
    throw new UnsupportedOperationException("difference");
  }

  public FiniteTransitionSystem<S> composition(TransitionSystem<?> other) {
    throw new UnsupportedOperationException("composition");
  }

  public FiniteTransitionSystem<?> project(int factor) {
    throw new UnsupportedOperationException("project");
  }

  public List<S> simulate() {
    throw new UnsupportedOperationException("simulate");
  }

  public List<S> sim() {
    return simulate();
  }

  public boolean isSimulation(List<S> execution) {
    throw new UnsupportedOperationException("isSimulation");
  }

  public static FiniteTransitionSystem<String> loadSpinAutomaton(String path) {
    throw new UnsupportedOperationException("loadSpinAutomaton");
  }
}
