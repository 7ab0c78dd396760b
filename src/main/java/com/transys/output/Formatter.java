package com.transys.output;

import com.google.common.base.Strings;
import com.google.common.collect.Streams;
import com.transys.graph.Transition;
import com.transys.label.LabelSchema;
import com.transys.model.TransitionSystem;
import java.util.stream.Collectors;

public final class Formatter {
  private static final String RULE = Strings.repeat("-", 60);

  private Formatter() {}

  public static String describe(TransitionSystem<?> system) {
    return describeTyped(system);
  }

  private static <S> String describeTyped(TransitionSystem<S> system) {
    StringBuilder builder = new StringBuilder();
    builder.append(RULE).append('\n')
        .append("Finite Transition System (%s) : %s\n".formatted(
            system.kind() == LabelSchema.Kind.CLOSED ? "closed" : "open", system.name()))
        .append(RULE).append('\n');

    builder.append("Atomic Propositions:\n\t").append(system.schema().atomicPropositions()).append("\n\n");

    builder.append("States and State Labels (in 2^AP):\n");
    for (S state : system.states()) {
      builder.append("\t").append(state).append(": ").append(format(system.label(state))).append('\n');
    }
    builder.append('\n');

    builder.append("Initial States:\n\t").append(format(system.initialStates())).append("\n\n");

    for (String field : system.schema().edgeFields()) {
      builder.append(fieldTitle(field)).append(":\n\t").append(system.schema().alphabet(field)).append("\n\n");
    }

    builder.append("Transitions & Labels:\n");
    builder.append(Streams.stream(system.transitions())
        .map(Transition::toString)
        .map(s -> "\t" + s + "\n")
        .collect(Collectors.joining()));
    builder.append(RULE).append('\n');
    return builder.toString();
  }

  private static String format(Iterable<?> elements) {
    return Streams.stream(elements).map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
  }

  private static String fieldTitle(String field) {
    return switch (field) {
      case LabelSchema.ACTIONS -> "Actions";
      case LabelSchema.SYSTEM_ACTIONS -> "System Actions";
      case LabelSchema.ENVIRONMENT_ACTIONS -> "Environment Actions";
      default -> field;
    };
  }
}
