package com.transys.output;

import static com.transys.model.TransitionSystems.TRUE;
import static com.transys.model.TransitionSystems.isNegated;

import com.transys.graph.Transition;
import com.transys.label.EdgeLabel;
import com.transys.label.Pair;
import com.transys.model.TransitionSystem;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Renders a transition system as a Promela process for the SPIN model checker. Propositions starting
 * with {@code !} are negations: they are assigned {@code 0} and not declared.
 */
public final class PromelaWriter {
  private static final Logger logger = Logger.getLogger(PromelaWriter.class.getName());
  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yy HH:mm:ss Z");
  public static final String EXTENSION = ".pml";

  private PromelaWriter() {}

  public static <S> String promela(TransitionSystem<S> system, @Nullable String procname) {
    StringBuilder builder = new StringBuilder();
    for (String proposition : system.atomicPropositions()) {
      if (!isNegated(proposition) && !TRUE.equals(proposition)) {
        builder.append("bool ").append(proposition).append(";\n");
      }
    }

    builder.append("\nactive proctype ").append(procname == null ? system.name() : procname).append("(){\n");
    builder.append("\t if\n");
    for (S initialState : system.initialStates()) {
      builder.append("\t :: goto ").append(initialState).append('\n');
    }
    builder.append("\t fi;\n");

    for (S state : system.states()) {
      appendState(builder, state, system.label(state));
      appendOutgoing(builder, system.findTransitions(state, null));
    }
    builder.append("}\n");
    return builder.toString();
  }

  public static <S> String promela(TransitionSystem<S> system) {
    return promela(system, null);
  }

  public static String header(ZonedDateTime date) {
    return "/*\n * Promela file generated with transys\n * Date: %s\n */\n\n".formatted(DATE_FORMAT.format(date));
  }

  /** Writes the Promela file, adding the {@code .pml} extension if missing, and returns its path. */
  public static Path save(TransitionSystem<?> system, Path path, @Nullable String procname) throws IOException {
    Path destination = path.getFileName().toString().endsWith(EXTENSION)
        ? path
        : path.resolveSibling(path.getFileName() + EXTENSION);
    Files.writeString(destination, header(ZonedDateTime.now()) + promela(system, procname), StandardCharsets.UTF_8);
    logger.log(Level.FINE, "Wrote Promela for {0} to {1}", new Object[] {system.name(), destination});
    return destination;
  }

  private static void appendState(StringBuilder builder, Object state, Set<String> label) {
    builder.append(state).append(":\n");
    builder.append("\t printf(\"State: ").append(state).append("\\n\");\n\t atomic{");

    List<String> present = label.stream().filter(p -> !isNegated(p) && !TRUE.equals(p)).toList();
    List<String> missing = label.stream().filter(p -> isNegated(p)).toList();
    builder.append(present.stream().map(p -> p + " = 1;").collect(Collectors.joining(" ")));
    builder.append(missing.stream().map(p -> p.substring(1) + " = 0;").collect(Collectors.joining(" ")));
    builder.append("}\n");
  }

  /** Edge label as printed in SPIN traces, for example {@code {'actions': 'a'}}. */
  static String traceLabel(EdgeLabel label) {
    return label.values().entrySet().stream()
        .map(entry -> traceValue(entry.getKey()) + ": " + traceValue(entry.getValue()))
        .collect(Collectors.joining(", ", "{", "}"));
  }

  private static String traceValue(Object value) {
    if (value instanceof Pair<?, ?> pair) {
      return "(%s, %s)".formatted(traceValue(pair.first()), traceValue(pair.second()));
    }
    return value instanceof String string ? "'" + string + "'" : String.valueOf(value);
  }

  private static <S> void appendOutgoing(StringBuilder builder, Iterable<Transition<S>> transitions) {
    builder.append("\t if\n");
    for (Transition<S> transition : transitions) {
      builder.append("\t :: printf(\"").append(traceLabel(transition.label())).append("\\n\");\n");
      builder.append("\t\t goto ").append(transition.target()).append('\n');
    }
    builder.append("\t fi;\n\n");
  }
}
