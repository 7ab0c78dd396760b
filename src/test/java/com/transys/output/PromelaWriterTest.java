package com.transys.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMap;
import com.transys.label.EdgeLabel;
import com.transys.label.LabelSchema;
import com.transys.label.Pair;
import com.transys.model.FiniteTransitionSystem;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PromelaWriterTest {
  private static FiniteTransitionSystem<String> system() {
    FiniteTransitionSystem<String> system = new FiniteTransitionSystem<>("light", List.of("p", "!p", "True"),
        List.of("a"));
    system.addState("s0", Set.of("p", "True"));
    system.addState("s1", Set.of("!p"));
    system.setInitial("s0");
    system.addLabeledTransition("s0", "s1", "a");
    system.addTransition("s1", "s0");
    return system;
  }

  @Test
  void process() {
    String expected = "bool p;\n"
        + "\n"
        + "active proctype light(){\n"
        + "\t if\n"
        + "\t :: goto s0\n"
        + "\t fi;\n"
        + "s0:\n"
        + "\t printf(\"State: s0\\n\");\n"
        + "\t atomic{p = 1;}\n"
        + "\t if\n"
        + "\t :: printf(\"{'actions': 'a'}\\n\");\n"
        + "\t\t goto s1\n"
        + "\t fi;\n"
        + "\n"
        + "s1:\n"
        + "\t printf(\"State: s1\\n\");\n"
        + "\t atomic{p = 0;}\n"
        + "\t if\n"
        + "\t :: printf(\"{}\\n\");\n"
        + "\t\t goto s0\n"
        + "\t fi;\n"
        + "\n"
        + "}\n";

    assertEquals(expected, PromelaWriter.promela(system()));
  }

  @Test
  void traceLabelsUseDictionaryNotation() {
    assertEquals("{}", PromelaWriter.traceLabel(EdgeLabel.empty()));
    assertEquals("{'actions': ('a', 'b')}",
        PromelaWriter.traceLabel(EdgeLabel.of(LabelSchema.ACTIONS, new Pair<>("a", "b"))));
    assertEquals("{'sys_actions': 'go', 'env_actions': 'push'}", PromelaWriter.traceLabel(EdgeLabel.of(
        ImmutableMap.of(LabelSchema.SYSTEM_ACTIONS, "go", LabelSchema.ENVIRONMENT_ACTIONS, "push"))));
  }

  @Test
  void procnameOverridesName() {
    assertTrue(PromelaWriter.promela(system(), "controller").contains("active proctype controller(){\n"));
  }

  @Test
  void header() {
    ZonedDateTime date = ZonedDateTime.of(2021, 3, 4, 5, 6, 7, 0, ZoneOffset.UTC);

    assertEquals("/*\n * Promela file generated with transys\n * Date: 03/04/21 05:06:07 +0000\n */\n\n",
        PromelaWriter.header(date));
  }

  @Test
  void saveAppendsExtension(@TempDir Path directory) throws IOException {
    Path written = PromelaWriter.save(system(), directory.resolve("light"), null);

    assertEquals(directory.resolve("light.pml"), written);
    String content = Files.readString(written);
    assertTrue(content.startsWith("/*\n * Promela file generated with transys"));
    assertTrue(content.endsWith(PromelaWriter.promela(system())));

    assertEquals(directory.resolve("other.pml"), PromelaWriter.save(system(), directory.resolve("other.pml"), null));
  }
}
