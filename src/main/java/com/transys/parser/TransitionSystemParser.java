package com.transys.parser;

import static com.transys.parser.ParseUtil.stream;
import static com.transys.parser.ParseUtil.strings;
import static java.util.Objects.requireNonNull;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.transys.label.EdgeLabel;
import com.transys.label.LabelSchema;
import com.transys.model.FiniteTransitionSystem;
import com.transys.model.FtsTuple;
import com.transys.model.OpenFiniteTransitionSystem;
import com.transys.model.TransitionSystem;
import com.transys.model.TransitionSystems;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

public final class TransitionSystemParser {
  private TransitionSystemParser() {}

  public static TransitionSystem<String> parse(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path)) {
      return parse(JsonParser.parseReader(reader).getAsJsonObject());
    }
  }

  public static TransitionSystem<String> parse(JsonObject json) {
    String type = requireNonNull(json.getAsJsonPrimitive("type"), "Missing type").getAsString();
    return switch (type) {
      case "closed" -> parseExplicit(json, LabelSchema.Kind.CLOSED);
      case "open" -> parseExplicit(json, LabelSchema.Kind.OPEN);
      case "tuple" -> TransitionSystems.fromTuple(parseTuple(json));
      default -> throw new IllegalArgumentException("Unknown type " + type);
    };
  }

  static TransitionSystem<String> parseExplicit(JsonObject json, LabelSchema.Kind kind) {
    String name = requireNonNull(json.getAsJsonPrimitive("name"), "Missing name").getAsString();
    List<String> propositions = strings(requireNonNull(json.getAsJsonArray("ap"), "Missing atomic propositions"));

    TransitionSystem<String> system = switch (kind) {
      case CLOSED -> new FiniteTransitionSystem<>(name, propositions,
          strings(requireNonNull(json.getAsJsonArray(LabelSchema.ACTIONS), "Missing actions")));
      case OPEN -> new OpenFiniteTransitionSystem<>(name, propositions,
          strings(requireNonNull(json.getAsJsonArray(LabelSchema.SYSTEM_ACTIONS), "Missing system actions")),
          strings(requireNonNull(json.getAsJsonArray(LabelSchema.ENVIRONMENT_ACTIONS), "Missing environment actions")));
    };

    JsonObject states = requireNonNull(json.getAsJsonObject("states"), "Missing states definition");
    for (var stateEntry : states.entrySet()) {
      String stateName = stateEntry.getKey();
      JsonObject stateData = stateEntry.getValue().getAsJsonObject();
      @Nullable
      JsonArray labels = stateData.getAsJsonArray("labels");
      system.addState(stateName, labels == null ? Set.of() : Set.copyOf(strings(labels)));
    }
    for (var stateEntry : states.entrySet()) {
      String stateName = stateEntry.getKey();
      @Nullable
      JsonArray transitions = stateEntry.getValue().getAsJsonObject().getAsJsonArray("transitions");
      if (transitions == null) {
        continue;
      }
      stream(transitions).map(JsonElement::getAsJsonObject).forEach(transitionData -> {
        String target = requireNonNull(transitionData.getAsJsonPrimitive("to"),
            () -> "Missing target of transition on state %s".formatted(stateName)).getAsString();
        Map<String, String> label = new LinkedHashMap<>();
        for (String field : system.schema().edgeFields()) {
          if (transitionData.has(field)) {
            label.put(field, transitionData.getAsJsonPrimitive(field).getAsString());
          }
        }
        system.addTransition(stateName, target, EdgeLabel.of(label));
      });
    }

    system.setInitial(strings(requireNonNull(json.getAsJsonArray("initial"), "Missing initial states")));
    return system;
  }

  static FtsTuple parseTuple(JsonObject json) {
    List<?> states = values(requireNonNull(json.getAsJsonArray("states"), "Missing states"));
    List<?> initialStates = values(requireNonNull(json.getAsJsonArray("initial"), "Missing initial states"));
    List<String> propositions = strings(requireNonNull(json.getAsJsonArray("ap"), "Missing atomic propositions"));

    @Nullable
    List<?> labeling;
    @Nullable
    JsonElement labels = json.get("labels");
    if (labels == null || labels.isJsonNull()) {
      labeling = null;
    } else if (labels.isJsonObject()) {
      labeling = labels.getAsJsonObject().entrySet().stream()
          .map(e -> Map.entry(e.getKey(), requireNonNull(ParseUtil.value(e.getValue()),
              () -> "Missing label of state %s".formatted(e.getKey()))))
          .toList();
    } else {
      labeling = values(labels.getAsJsonArray());
    }

    @Nullable
    JsonElement actionsElement = json.get("actions");
    @Nullable
    List<?> actions = actionsElement == null || actionsElement.isJsonNull()
        ? null
        : values(actionsElement.getAsJsonArray());
    List<List<?>> transitions = stream(requireNonNull(json.getAsJsonArray("transitions"), "Missing transitions"))
        .map(JsonElement::getAsJsonArray)
        .map(TransitionSystemParser::values)
        .collect(Collectors.toList());

    String name = json.has("name") ? json.getAsJsonPrimitive("name").getAsString() : "fts";
    @Nullable
    String prefix = json.has("prefix") ? json.getAsJsonPrimitive("prefix").getAsString() : null;
    return new FtsTuple(states, initialStates, propositions, labeling, actions, transitions, name, prefix);
  }

  private static List<?> values(JsonArray array) {
    return stream(array).map(ParseUtil::value).toList();
  }
}
