package com.transys.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import com.transys.graph.DuplicateStateException;
import com.transys.graph.Transition;
import com.transys.graph.UnknownStateException;
import com.transys.label.DomainException;
import com.transys.label.EdgeLabel;
import com.transys.label.LabelSchema;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FiniteTransitionSystemTest {
  private static FiniteTransitionSystem<String> trafficLight() {
    FiniteTransitionSystem<String> system = new FiniteTransitionSystem<>("light", List.of("red", "green"),
        List.of("switch"));
    system.addState("r", Set.of("red"));
    system.addState("g", Set.of("green"));
    system.setInitial("r");
    system.addLabeledTransition("r", "g", "switch");
    system.addLabeledTransition("g", "r", "switch");
    return system;
  }

  @Test
  void basicConstruction() {
    FiniteTransitionSystem<String> system = trafficLight();

    assertEquals(LabelSchema.Kind.CLOSED, system.kind());
    assertEquals(2, system.size());
    assertEquals(Set.of("r"), system.initialStates());
    assertEquals(2, system.transitionCount());
    assertEquals(Set.of("g"), system.successors("r"));
    assertEquals(List.of(new Transition<>("r", "g", EdgeLabel.of(LabelSchema.ACTIONS, "switch"))),
        ImmutableList.copyOf(system.findTransitions("r", "g")));
  }

  @Test
  void stateLabelsMustUseKnownPropositions() {
    FiniteTransitionSystem<String> system = trafficLight();

    assertThrows(DomainException.class, () -> system.addState("y", Set.of("yellow")));
    assertFalse(system.hasState("y"));
    assertThrows(DomainException.class, () -> system.labelState("r", Set.of("yellow")));

    system.growAtomicPropositions(List.of("yellow"));
    assertTrue(system.addState("y", Set.of("yellow")));
    assertEquals(Set.of("red", "green", "yellow"), system.atomicPropositions());
  }

  @Test
  void conflictingStateLabelsAreRejected() {
    FiniteTransitionSystem<String> system = trafficLight();

    assertFalse(system.addState("r", Set.of("red")));
    assertThrows(DuplicateStateException.class, () -> system.addState("r", Set.of("green")));
    assertEquals(Set.of("red"), system.label("r"));
  }

  @Test
  void transitionsAreValidated() {
    FiniteTransitionSystem<String> system = trafficLight();

    assertThrows(DomainException.class, () -> system.addLabeledTransition("r", "g", "blink"));
    assertThrows(UnknownStateException.class, () -> system.addLabeledTransition("r", "y", "switch"));
    assertThrows(DomainException.class,
        () -> system.addTransition("r", "g", EdgeLabel.of(LabelSchema.SYSTEM_ACTIONS, "switch")));
    assertThrows(UnknownStateException.class, () -> system.setInitial("y"));

    system.growActions(List.of("blink"));
    assertTrue(system.addLabeledTransition("r", "g", "blink"));
    assertEquals(Set.of("switch", "blink"), system.actions());
  }

  @Test
  void identicalTransitionIsStoredOnce() {
    FiniteTransitionSystem<String> system = trafficLight();

    assertFalse(system.addLabeledTransition("r", "g", "switch"));
    assertTrue(system.addTransition("r", "g"));
    assertEquals(3, system.transitionCount());
  }

  @Test
  void existingLabelsStayValidAfterGrowth() {
    FiniteTransitionSystem<String> system = trafficLight();
    system.growAtomicPropositions(List.of("blue"));
    system.growActions(List.of("reset"));

    for (String state : system.states()) {
      system.schema().checkStateLabel(system.label(state));
    }
    for (Transition<String> transition : system.transitions()) {
      system.schema().checkEdgeLabel(transition.label());
    }
  }

  @Test
  void unimplementedOperationsFail() {
    FiniteTransitionSystem<String> system = trafficLight();

    assertThrows(UnsupportedOperationException.class, () -> system.intersection(system));
    assertThrows(UnsupportedOperationException.class, () -> system.difference(system));
    assertThrows(UnsupportedOperationException.class, () -> system.composition(system));
    assertThrows(UnsupportedOperationException.class, () -> system.project(0));
    assertThrows(UnsupportedOperationException.class, system::simulate);
    assertThrows(UnsupportedOperationException.class, system::sim);
    assertThrows(UnsupportedOperationException.class, () -> system.isSimulation(List.of("r")));
    assertThrows(UnsupportedOperationException.class, () -> FiniteTransitionSystem.loadSpinAutomaton("a.pml"));
  }

  @Test
  void openSystemNeedsSomeAction() {
    OpenFiniteTransitionSystem<String> system = new OpenFiniteTransitionSystem<>("robot", List.of(),
        List.of("move"), List.of("push"));
    system.addState("a");
    system.addState("b");

    assertThrows(IllegalArgumentException.class, () -> system.addLabeledTransition("a", "b", null, null));
    assertTrue(system.addLabeledTransition("a", "b", "move", null));
    assertTrue(system.addLabeledTransition("a", "b", null, "push"));
    assertTrue(system.addLabeledTransition("a", "b", "move", "push"));
    assertThrows(DomainException.class, () -> system.addLabeledTransition("a", "b", "push", null));
    assertEquals(3, system.transitionCount());
  }

  @Test
  void descriptionListsEverything() {
    String description = trafficLight().toString();

    assertTrue(description.contains("Finite Transition System (closed) : light"));
    assertTrue(description.contains("Initial States:\n\t{r}"));
    assertTrue(description.contains("Actions:\n\t{switch}"));
  }
}
