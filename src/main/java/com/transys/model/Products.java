package com.transys.model;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.transys.automaton.BuchiAutomaton;
import com.transys.graph.Transition;
import com.transys.label.EdgeLabel;
import com.transys.label.MathSet;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Product constructions. All of them explore the product breadth-first from its initial states, so
 * only reachable product states are materialized. Operands are only read.
 */
final class Products {
  private static final Logger logger = Logger.getLogger(Products.class.getName());

  private Products() {}

  static <S, T, P extends TransitionSystem<ProductState<S, T>>> P synchronous(
      TransitionSystem<S> left, TransitionSystem<T> right, P product) {
    assert left.kind() == right.kind() && product.kind() == left.kind();
    logger.log(Level.FINE, () -> "Computing synchronous product of %s and %s".formatted(left.name(), right.name()));
    Stopwatch timer = Stopwatch.createStarted();

    product.growAtomicPropositions(left.atomicPropositions());
    product.growAtomicPropositions(right.atomicPropositions());
    for (String field : product.schema().edgeFields()) {
      product.growAlphabet(field, MathSet.cartesian(left.schema().alphabet(field), right.schema().alphabet(field)));
    }

    Queue<ProductState<S, T>> queue = new ArrayDeque<>();
    Set<ProductState<S, T>> initialStates = new LinkedHashSet<>();
    for (S leftInitial : left.initialStates()) {
      for (T rightInitial : right.initialStates()) {
        ProductState<S, T> state = new ProductState<>(leftInitial, rightInitial);
        if (visit(product, state, left, right)) {
          queue.add(state);
        }
        initialStates.add(state);
      }
    }
    product.setInitial(initialStates);

    while (!queue.isEmpty()) {
      ProductState<S, T> current = queue.poll();
      for (Transition<S> leftMove : left.findTransitions(current.left(), null)) {
        for (Transition<T> rightMove : right.findTransitions(current.right(), null)) {
          ProductState<S, T> successor = new ProductState<>(leftMove.target(), rightMove.target());
          if (visit(product, successor, left, right)) {
            queue.add(successor);
          }
          product.addTransition(current, successor, EdgeLabel.paired(leftMove.label(), rightMove.label()));
        }
      }
    }

    logger.log(Level.FINER, () -> "Synchronous product has %d states, %d initial, %d transitions (%s)"
        .formatted(product.size(), product.initialStates().size(), product.transitionCount(), timer));
    return product;
  }

  static <S, T, P extends TransitionSystem<ProductState<S, T>>> P asynchronous(
      TransitionSystem<S> left, TransitionSystem<T> right, P product) {
    assert left.kind() == right.kind() && product.kind() == left.kind();
    logger.log(Level.FINE, () -> "Computing asynchronous product of %s and %s".formatted(left.name(), right.name()));
    Stopwatch timer = Stopwatch.createStarted();

    product.growAtomicPropositions(left.atomicPropositions());
    product.growAtomicPropositions(right.atomicPropositions());
    for (String field : product.schema().edgeFields()) {
      product.growAlphabet(field, left.schema().alphabet(field).union(right.schema().alphabet(field)));
    }

    Queue<ProductState<S, T>> queue = new ArrayDeque<>();
    Set<ProductState<S, T>> initialStates = new LinkedHashSet<>();
    for (S leftInitial : left.initialStates()) {
      for (T rightInitial : right.initialStates()) {
        ProductState<S, T> state = new ProductState<>(leftInitial, rightInitial);
        if (visit(product, state, left, right)) {
          queue.add(state);
        }
        initialStates.add(state);
      }
    }
    product.setInitial(initialStates);

    while (!queue.isEmpty()) {
      ProductState<S, T> current = queue.poll();
      // Exactly one component moves, the other one is frozen
      for (Transition<S> leftMove : left.findTransitions(current.left(), null)) {
        ProductState<S, T> successor = new ProductState<>(leftMove.target(), current.right());
        if (visit(product, successor, left, right)) {
          queue.add(successor);
        }
        product.addTransition(current, successor, leftMove.label());
      }
      for (Transition<T> rightMove : right.findTransitions(current.right(), null)) {
        ProductState<S, T> successor = new ProductState<>(current.left(), rightMove.target());
        if (visit(product, successor, left, right)) {
          queue.add(successor);
        }
        product.addTransition(current, successor, rightMove.label());
      }
    }

    logger.log(Level.FINER, () -> "Asynchronous product has %d states, %d initial, %d transitions (%s)"
        .formatted(product.size(), product.initialStates().size(), product.transitionCount(), timer));
    return product;
  }

  static <S, Q> BuchiProduct<S, Q> synchronous(TransitionSystem<S> system, BuchiAutomaton<Q> automaton,
      BuchiProduct<S, Q> product) {
    logger.log(Level.FINE, () -> "Computing product of %s with %s".formatted(system.name(), automaton));
    Stopwatch timer = Stopwatch.createStarted();

    product.growAtomicPropositions(system.atomicPropositions());
    for (String field : product.schema().edgeFields()) {
      product.growAlphabet(field, system.alphabet(field));
    }

    Set<String> automatonPropositions = Set.copyOf(automaton.atomicPropositions());
    Map<S, Set<String>> letterCache = new HashMap<>();

    Queue<ProductState<S, Q>> queue = new ArrayDeque<>();
    Set<ProductState<S, Q>> initialStates = new LinkedHashSet<>();
    for (S systemInitial : system.initialStates()) {
      Set<String> letter = letterCache.computeIfAbsent(systemInitial,
          state -> ImmutableSet.copyOf(Sets.intersection(system.label(state), automatonPropositions)));
      for (Q automatonInitial : automaton.initialStates()) {
        for (Q successor : automaton.successors(automatonInitial, letter)) {
          ProductState<S, Q> state = new ProductState<>(systemInitial, successor);
          if (visit(product, state, system, automaton)) {
            queue.add(state);
          }
          initialStates.add(state);
        }
      }
    }
    product.setInitial(initialStates);

    while (!queue.isEmpty()) {
      ProductState<S, Q> current = queue.poll();
      for (Transition<S> move : system.findTransitions(current.left(), null)) {
        Set<String> letter = letterCache.computeIfAbsent(move.target(),
            state -> ImmutableSet.copyOf(Sets.intersection(system.label(state), automatonPropositions)));
        for (Q automatonSuccessor : automaton.successors(current.right(), letter)) {
          ProductState<S, Q> successor = new ProductState<>(move.target(), automatonSuccessor);
          if (visit(product, successor, system, automaton)) {
            queue.add(successor);
          }
          product.addTransition(current, successor, move.label());
        }
      }
    }

    logger.log(Level.FINER, () -> "Automaton product has %d states, %d initial, %d accepting (%s)"
        .formatted(product.size(), product.initialStates().size(), product.acceptingStates().size(), timer));
    return product;
  }

  private static <S, T> boolean visit(TransitionSystem<ProductState<S, T>> product, ProductState<S, T> state,
      TransitionSystem<S> left, TransitionSystem<T> right) {
    if (product.hasState(state)) {
      return false;
    }
    product.addState(state, Sets.union(left.label(state.left()), right.label(state.right())));
    return true;
  }

  private static <S, Q> boolean visit(BuchiProduct<S, Q> product, ProductState<S, Q> state,
      TransitionSystem<S> system, BuchiAutomaton<Q> automaton) {
    if (product.hasState(state)) {
      return false;
    }
    product.addState(state, system.label(state.left()));
    if (automaton.isAccepting(state.right())) {
      product.markAccepting(state);
    }
    return true;
  }
}
