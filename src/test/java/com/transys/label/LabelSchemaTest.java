package com.transys.label;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class LabelSchemaTest {
  @Test
  void closedSchemaHasSingleActionField() {
    LabelSchema schema = LabelSchema.closed(List.of("p"), List.of("a"));

    assertEquals(LabelSchema.Kind.CLOSED, schema.kind());
    assertEquals(List.of(LabelSchema.ACTIONS), schema.edgeFields());
    schema.checkEdgeLabel(EdgeLabel.of(LabelSchema.ACTIONS, "a"));
    schema.checkEdgeLabel(EdgeLabel.empty());
    assertThrows(DomainException.class, () -> schema.checkEdgeLabel(EdgeLabel.of(LabelSchema.ACTIONS, "b")));
    assertThrows(DomainException.class, () -> schema.checkEdgeLabel(EdgeLabel.of(LabelSchema.SYSTEM_ACTIONS, "a")));
  }

  @Test
  void openSchemaOrdersSystemBeforeEnvironment() {
    LabelSchema schema = LabelSchema.open(List.of(), List.of("move"), List.of("push"));

    assertEquals(List.of(LabelSchema.SYSTEM_ACTIONS, LabelSchema.ENVIRONMENT_ACTIONS), schema.edgeFields());
    schema.checkEdgeLabel(EdgeLabel.of(Map.of(LabelSchema.SYSTEM_ACTIONS, "move", LabelSchema.ENVIRONMENT_ACTIONS,
        "push")));
    assertThrows(DomainException.class, () -> schema.checkEdgeLabel(EdgeLabel.of(LabelSchema.ACTIONS, "move")));
    assertThrows(IllegalArgumentException.class, () -> schema.alphabet(LabelSchema.ACTIONS));
  }

  @Test
  void stateLabelsMustBeSubsetsOfPropositions() {
    LabelSchema schema = LabelSchema.closed(List.of("p", "q"), List.of());

    schema.checkStateLabel(Set.of("p", "q"));
    assertThrows(DomainException.class, () -> schema.checkStateLabel(Set.of("r")));
  }

  @Test
  void dotLabelUsesFieldPrefixes() {
    LabelSchema open = LabelSchema.open(List.of(), List.of("move"), List.of("push"));
    EdgeLabel label = EdgeLabel.of(Map.of(LabelSchema.SYSTEM_ACTIONS, "move"));
    assertEquals("sys:move", open.dotLabel(label, String::valueOf));

    LabelSchema closed = LabelSchema.closed(List.of(), List.of("a"));
    assertEquals("a", closed.dotLabel(EdgeLabel.of(LabelSchema.ACTIONS, "a"), String::valueOf));
  }

  @Test
  void pairedLabelKeepsCommonFields() {
    EdgeLabel left = EdgeLabel.of(LabelSchema.ACTIONS, "a");
    EdgeLabel right = EdgeLabel.of(LabelSchema.ACTIONS, "b");

    assertEquals(new Pair<>("a", "b"), EdgeLabel.paired(left, right).values().get(LabelSchema.ACTIONS));
    assertTrue(EdgeLabel.paired(left, EdgeLabel.empty()).isEmpty());
  }
}
