package com.transys.model;

import com.transys.graph.LabeledGraph;
import com.transys.graph.LabeledStateGraph;
import com.transys.graph.Transition;
import com.transys.label.EdgeLabel;
import com.transys.label.LabelSchema;
import com.transys.output.Formatter;
import java.util.Arrays;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * A finite transition system: states labeled with subsets of the atomic propositions, a distinguished
 * set of initial states, and a transition relation whose edges are labeled according to the
 * {@link LabelSchema} of the concrete kind of system.
 *
 * <p>Every label is validated against the current universes on insertion. Universes only grow, hence
 * labels stay valid for the lifetime of the system.
 */
public abstract class TransitionSystem<S> {
  private static final Logger logger = Logger.getLogger(TransitionSystem.class.getName());

  private final String name;
  private final LabelSchema schema;
  private final boolean mutable;
  private final LabeledGraph<S> graph = new LabeledStateGraph<>();

  protected TransitionSystem(String name, LabelSchema schema, boolean mutable) {
    this.name = name;
    this.schema = schema;
    this.mutable = mutable;
  }

  public String name() {
    return name;
  }

  public LabelSchema schema() {
    return schema;
  }

  public LabelSchema.Kind kind() {
    return schema.kind();
  }

  /** Whether state identifiers come from a space in which fresh identifiers can be generated safely. */
  public boolean isMutable() {
    return mutable;
  }

  public Set<String> atomicPropositions() {
    return schema.atomicPropositions().asSet();
  }

  public void growAtomicPropositions(Iterable<String> propositions) {
    schema.atomicPropositions().addAll(propositions);
  }

  public Set<Object> alphabet(String field) {
    return schema.alphabet(field).asSet();
  }

  public void growAlphabet(String field, Iterable<?> values) {
    schema.alphabet(field).addAll(values);
  }

  public boolean addState(S state) {
    return graph.addState(state);
  }

  public boolean addState(S state, Set<String> label) {
    schema.checkStateLabel(label);
    return graph.addState(state, label);
  }

  public void addStates(Iterable<? extends S> states) {
    for (S state : states) {
      graph.addState(state);
    }
  }

  public void labelState(S state, Set<String> label) {
    schema.checkStateLabel(label);
    graph.relabel(state, label);
  }

  public Set<String> label(S state) {
    return graph.label(state);
  }

  public boolean hasState(S state) {
    return graph.hasState(state);
  }

  public Set<S> states() {
    return graph.states();
  }

  public int size() {
    return graph.states().size();
  }

  public Set<S> initialStates() {
    return graph.initialStates();
  }

  public void setInitial(Iterable<? extends S> states) {
    graph.addInitialStates(states);
  }

  @SafeVarargs
  public final void setInitial(S... states) {
    graph.addInitialStates(Arrays.asList(states));
  }

  public boolean addTransition(S source, S target) {
    return graph.addTransition(source, target);
  }

  public boolean addTransition(S source, S target, EdgeLabel label) {
    schema.checkEdgeLabel(label);
    return graph.addTransition(source, target, label);
  }

  public Iterable<Transition<S>> transitions() {
    return graph.transitions();
  }

  public Iterable<Transition<S>> findTransitions(@Nullable S source, @Nullable S target) {
    return graph.transitions(source, target);
  }

  public int transitionCount() {
    return graph.transitionCount();
  }

  public Set<S> successors(S state) {
    return graph.successors(state);
  }

  /**
   * Merges {@code source} into this system. Universes, states, initial states and transitions are
   * united; non-empty state labels of {@code source} overwrite the labels of this system.
   */
  public TransitionSystem<S> merge(TransitionSystem<S> source) {
    checkKind("merge", source);
    if (source == this) {
      return this;
    }
    logger.log(Level.FINE, () -> "Merging %s into %s".formatted(source.name, name));

    growAtomicPropositions(source.atomicPropositions());
    for (String field : schema.edgeFields()) {
      growAlphabet(field, source.alphabet(field));
    }
    for (S state : source.states()) {
      addState(state);
      Set<String> label = source.label(state);
      if (!label.isEmpty()) {
        labelState(state, label);
      }
    }
    setInitial(source.initialStates());
    for (Transition<S> transition : source.transitions()) {
      if (transition.isLabeled()) {
        addTransition(transition.source(), transition.target(), transition.label());
      } else {
        addTransition(transition.source(), transition.target());
      }
    }
    return this;
  }

  protected final void checkKind(String operation, TransitionSystem<?> other) {
    if (other.kind() != kind()) {
      throw TypeMismatchException.of(operation, kind(), other.kind());
    }
  }

  protected final String productName(TransitionSystem<?> other) {
    return name + "_x_" + other.name;
  }

  protected final boolean productMutable(TransitionSystem<?> other) {
    return mutable || other.mutable;
  }

  @Override
  public String toString() {
    return Formatter.describe(this);
  }
}
