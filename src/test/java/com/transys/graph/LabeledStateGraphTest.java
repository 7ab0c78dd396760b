package com.transys.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import com.transys.label.EdgeLabel;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LabeledStateGraphTest {
  private LabeledStateGraph<String> graph;

  @BeforeEach
  void setup() {
    graph = new LabeledStateGraph<>();
    graph.addState("a", Set.of("p"));
    graph.addState("b");
    graph.addState("c");
  }

  @Test
  void reAddingWithSameLabelIsNoOp() {
    assertFalse(graph.addState("a", Set.of("p")));
    assertFalse(graph.addState("a"));
    assertEquals(Set.of("p"), graph.label("a"));
  }

  @Test
  void reAddingWithConflictingLabelFails() {
    assertThrows(DuplicateStateException.class, () -> graph.addState("a", Set.of("q")));
    assertThrows(DuplicateStateException.class, () -> graph.addState("b", Set.of("q")));
  }

  @Test
  void transitionsNeedKnownEndpoints() {
    UnknownStateException exception = assertThrows(UnknownStateException.class, () -> graph.addTransition("a", "x"));
    assertEquals("x", exception.state());
    assertThrows(UnknownStateException.class, () -> graph.addTransition("x", "a"));
    assertEquals(0, graph.transitionCount());
  }

  @Test
  void initialStatesMustExist() {
    assertThrows(UnknownStateException.class, () -> graph.addInitialStates(List.of("a", "x")));
    assertTrue(graph.initialStates().isEmpty());

    graph.addInitialStates(List.of("a"));
    graph.addInitialStates(List.of("b"));
    assertEquals(Set.of("a", "b"), graph.initialStates());
  }

  @Test
  void parallelEdgesNeedDistinctLabels() {
    assertTrue(graph.addTransition("a", "b", EdgeLabel.of("actions", "x")));
    assertTrue(graph.addTransition("a", "b", EdgeLabel.of("actions", "y")));
    assertTrue(graph.addTransition("a", "b"));
    assertFalse(graph.addTransition("a", "b", EdgeLabel.of("actions", "x")));
    assertTrue(graph.addTransition("a", "a"));

    assertEquals(4, graph.transitionCount());
  }

  @Test
  void findFiltersBySourceAndTarget() {
    graph.addTransition("a", "b");
    graph.addTransition("a", "c");
    graph.addTransition("b", "c");
    graph.addTransition("c", "a");

    assertEquals(List.of(new Transition<>("a", "b", EdgeLabel.empty()), new Transition<>("a", "c", EdgeLabel.empty())),
        ImmutableList.copyOf(graph.transitions("a", null)));
    assertEquals(2, ImmutableList.copyOf(graph.transitions(null, "c")).size());
    assertEquals(1, ImmutableList.copyOf(graph.transitions("b", "c")).size());
    assertEquals(0, ImmutableList.copyOf(graph.transitions("b", "a")).size());
    assertEquals(4, ImmutableList.copyOf(graph.transitions()).size());
    assertEquals(Set.of("b", "c"), graph.successors("a"));
  }

  @Test
  void findIsRestartableAndLazy() {
    graph.addTransition("a", "b");
    Iterable<Transition<String>> outgoing = graph.transitions("a", null);

    assertEquals(1, ImmutableList.copyOf(outgoing).size());
    graph.addTransition("a", "c");
    assertEquals(2, ImmutableList.copyOf(outgoing).size());
  }

  @Test
  void relabelOverwrites() {
    graph.relabel("a", Set.of("q"));
    assertEquals(Set.of("q"), graph.label("a"));
    assertThrows(UnknownStateException.class, () -> graph.relabel("x", Set.of()));
    assertThrows(UnknownStateException.class, () -> graph.label("x"));
  }
}
