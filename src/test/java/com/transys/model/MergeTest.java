package com.transys.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.transys.automaton.ExplicitBuchiAutomaton;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MergeTest {
  @Test
  void disjointSystemsAreUnited() {
    FiniteTransitionSystem<String> first = TransitionSystems.lineLabeledWith(List.of("p", "q"));
    FiniteTransitionSystem<String> second = TransitionSystems.lineLabeledWith(List.of("r", "r", "r"), 2);
    first.setInitial("s0");
    second.setInitial("s2");

    FiniteTransitionSystem<String> merged = first.merge(second);

    assertSame(first, merged);
    assertEquals(5, merged.size());
    assertEquals(3, merged.transitionCount());
    assertEquals(Set.of("s0", "s2"), merged.initialStates());
    assertEquals(Set.of("r"), merged.label("s4"));
    assertEquals(Set.of("p", "!p", "q", "!q", "True", "r", "!r"), merged.atomicPropositions());
  }

  @Test
  void sourceLabelsWin() {
    FiniteTransitionSystem<String> target = new FiniteTransitionSystem<>("target", List.of("p", "q"), List.of("a"));
    target.addState("s", Set.of("p"));
    target.addState("t", Set.of("q"));
    FiniteTransitionSystem<String> source = new FiniteTransitionSystem<>("source", List.of("r"), List.of("b"));
    source.addState("s", Set.of("r"));
    source.addState("t");
    source.addState("u");
    source.addLabeledTransition("s", "u", "b");
    source.addTransition("u", "s");

    target.merge(source);

    assertEquals(Set.of("r"), target.label("s"));
    assertEquals(Set.of("q"), target.label("t"));
    assertEquals(Set.of(), target.label("u"));
    assertEquals(Set.of("a", "b"), target.actions());
    assertEquals(2, target.transitionCount());
    assertEquals(Set.of("u"), target.successors("s"));
  }

  @Test
  void mergingWithItselfChangesNothing() {
    FiniteTransitionSystem<String> system = TransitionSystems.cycleLabeledWith(List.of("p", "q"));
    String before = system.toString();

    system.merge(system);

    assertEquals(before, system.toString());
  }

  @Test
  void openSystemsMergeAllFields() {
    OpenFiniteTransitionSystem<String> target = new OpenFiniteTransitionSystem<>("a", List.of(), List.of("go"),
        List.of());
    target.addState("x");
    OpenFiniteTransitionSystem<String> source = new OpenFiniteTransitionSystem<>("b", List.of(), List.of(),
        List.of("push"));
    source.addState("x");
    source.addState("y");
    source.addLabeledTransition("x", "y", null, "push");

    target.merge(source);

    assertEquals(Set.of("go"), target.systemActions());
    assertEquals(Set.of("push"), target.environmentActions());
    assertEquals(1, target.transitionCount());
  }

  @Test
  void productMergeKeepsAcceptingStates() {
    ExplicitBuchiAutomaton<String> automaton = ExplicitBuchiAutomaton.<String>builder(List.of())
        .initial("q0")
        .accepting("q0")
        .transitionOnAnyLetter("q0", "q0")
        .build();
    FiniteTransitionSystem<String> cycle = TransitionSystems.cycleLabeledWith(List.of("p"));
    cycle.setInitial("s0");
    FiniteTransitionSystem<String> line = TransitionSystems.lineLabeledWith(List.of("p", "p"), 5);
    line.setInitial("s5");
    BuchiProduct<String, String> target = cycle.synchronousProduct(automaton);
    BuchiProduct<String, String> source = line.synchronousProduct(automaton);

    BuchiProduct<String, String> merged = target.merge(source);

    assertSame(target, merged);
    assertEquals(3, merged.size());
    assertEquals(Set.of(new ProductState<>("s0", "q0"), new ProductState<>("s5", "q0"),
        new ProductState<>("s6", "q0")), merged.acceptingStates());
  }

  @Test
  void mergeNeedsSameKind() {
    FiniteTransitionSystem<Object> closed = new FiniteTransitionSystem<>("c");
    OpenFiniteTransitionSystem<Object> open = new OpenFiniteTransitionSystem<>("o");

    assertThrows(TypeMismatchException.class, () -> closed.merge(open));
    assertThrows(TypeMismatchException.class, () -> open.merge(closed));
  }
}
