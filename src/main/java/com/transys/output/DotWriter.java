package com.transys.output;

import static com.transys.output.DotFormatted.escape;
import static com.transys.output.DotFormatted.toDotString;

import com.transys.graph.Transition;
import com.transys.model.BuchiProduct;
import com.transys.model.TransitionSystem;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import java.io.PrintStream;
import java.util.function.Predicate;

public final class DotWriter {
    private DotWriter() {
    }

    public static <S> void writeSystem(TransitionSystem<S> system, PrintStream writer) {
        Predicate<S> accepting = acceptingPredicate(system);
        Object2IntMap<S> ids = new Object2IntLinkedOpenHashMap<>();
        system.states().forEach(s -> ids.put(s, ids.size()));

        writer.append("digraph \"%s\" {\n".formatted(escape(system.name())));
        writer.append("node [shape=box]\n");
        for (Object2IntMap.Entry<S> entry : ids.object2IntEntrySet()) {
            S state = entry.getKey();
            String label = escape(toDotString(state)) + "\\n" + escape(toDotString(system.label(state)));
            StringBuilder attributes = new StringBuilder("label=\"%s\"".formatted(label));
            if (system.initialStates().contains(state)) {
                attributes.append(", peripheries=2");
            }
            if (accepting.test(state)) {
                attributes.append(", shape=doubleoctagon");
            }
            writer.append("S_%d [%s]\n".formatted(entry.getIntValue(), attributes));
        }

        for (Transition<S> transition : system.transitions()) {
            int source = ids.getInt(transition.source());
            int target = ids.getInt(transition.target());
            if (transition.isLabeled()) {
                String label = system.schema().dotLabel(transition.label(), value -> escape(toDotString(value)));
                writer.append("S_%d -> S_%d [label=\"%s\"]\n".formatted(source, target, label));
            } else {
                writer.append("S_%d -> S_%d\n".formatted(source, target));
            }
        }
        writer.append("}\n");
    }

    private static <S> Predicate<S> acceptingPredicate(TransitionSystem<S> system) {
        if (system instanceof BuchiProduct<?, ?> product) {
            return state -> product.acceptingStates().contains(state);
        }
        return state -> false;
    }
}
