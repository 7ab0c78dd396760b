package com.transys.parser;

import static com.transys.parser.ParseUtil.stream;
import static com.transys.parser.ParseUtil.strings;
import static java.util.Objects.requireNonNull;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.transys.automaton.ExplicitBuchiAutomaton;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import javax.annotation.Nullable;

public final class AutomatonParser {
  private AutomatonParser() {}

  public static ExplicitBuchiAutomaton<String> parse(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path)) {
      return parse(JsonParser.parseReader(reader).getAsJsonObject());
    }
  }

  public static ExplicitBuchiAutomaton<String> parse(JsonObject json) {
    ExplicitBuchiAutomaton.Builder<String> builder = ExplicitBuchiAutomaton.builder(
        strings(requireNonNull(json.getAsJsonArray("ap"), "Missing atomic propositions")));
    strings(requireNonNull(json.getAsJsonArray("states"), "Missing states")).forEach(builder::state);
    strings(requireNonNull(json.getAsJsonArray("initial"), "Missing initial states")).forEach(builder::initial);
    @Nullable
    JsonArray accepting = json.getAsJsonArray("accepting");
    if (accepting != null) {
      strings(accepting).forEach(builder::accepting);
    }

    stream(requireNonNull(json.getAsJsonArray("transitions"), "Missing transitions"))
        .map(JsonElement::getAsJsonObject)
        .forEach(transition -> {
          String source = requireNonNull(transition.getAsJsonPrimitive("from"), "Missing source").getAsString();
          String target = requireNonNull(transition.getAsJsonPrimitive("to"),
              () -> "Missing target of transition from %s".formatted(source)).getAsString();
          @Nullable
          JsonArray letter = transition.getAsJsonArray("letter");
          if (letter == null) {
            builder.transitionOnAnyLetter(source, target);
          } else {
            builder.transition(source, Set.copyOf(strings(letter)), target);
          }
        });
    return builder.build();
  }
}
