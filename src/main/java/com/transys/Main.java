package com.transys;

import static picocli.CommandLine.ArgGroup;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.common.base.Stopwatch;
import com.transys.model.FiniteTransitionSystem;
import com.transys.model.OpenFiniteTransitionSystem;
import com.transys.model.ProductOperand;
import com.transys.model.TransitionSystem;
import com.transys.model.TypeMismatchException;
import com.transys.output.DotWriter;
import com.transys.output.Formatter;
import com.transys.output.PromelaWriter;
import com.transys.parser.AutomatonParser;
import com.transys.parser.TransitionSystemParser;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.BiConsumer;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(
    name = "transys",
    mixinStandardHelpOptions = true,
    version = "transys 0.1",
    description = "Builds products and merges of finite transition systems")
public final class Main implements Callable<Void> {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    enum Operation {
        NONE, SYNC, ASYNC, MERGE
    }

    private static PrintStream open(String output) throws IOException {
        return "-".equals(output)
            ? System.out
            : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))));
    }

    private static <S> void writeIfPresent(@Nullable String output, S object, BiConsumer<S, PrintStream> formatter)
        throws IOException {
        if (output != null) {
            try (var stream = open(output)) {
                formatter.accept(object, stream);
            }
        }
    }

    @Option(
        names = {"--system"},
        required = true,
        description = "Transition system in JSON format")
    private String system;

    @Nullable
    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private OperandSource operandSource;

    @Option(
        names = {"--operation"},
        description = "Operation to apply. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private Operation operation = Operation.NONE;

    @Nullable
    @Option(
        names = {"--write-dot"},
        description = "Write the resulting system in dot format")
    private String writeDot;

    @Nullable
    @Option(
        names = {"--write-promela"},
        description = "Write the resulting system as Promela process (.pml is appended if missing)")
    private String writePromela;

    @Nullable
    @Option(
        names = {"--procname"},
        description = "Name of the Promela process, defaults to the name of the system")
    private String procname;

    @Option(
        names = {"-O", "--output"},
        description = "Write a description of the resulting system")
    private String writeOutput = "-";

    @Option(
        names = {"-v", "--verbose"},
        description = "Log construction details")
    private boolean verbose = false;

    static class OperandSource {
        @Nullable
        @Option(names = "--with", description = "Second transition system in JSON format")
        private String system;

        @Nullable
        @Option(names = "--automaton", description = "Büchi automaton in JSON format")
        private String automaton;
    }

    private Main() {}

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args));
    }

    private ProductOperand<String, String> operand() throws IOException {
        if (operandSource == null) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "Operation %s needs --with or --automaton".formatted(operation));
        }
        if (operandSource.automaton != null) {
            return ProductOperand.of(AutomatonParser.parse(Path.of(operandSource.automaton)));
        }
        assert operandSource.system != null;
        return ProductOperand.of(TransitionSystemParser.parse(Path.of(operandSource.system)));
    }

    private TransitionSystem<?> synchronous(TransitionSystem<String> left, ProductOperand<String, String> right) {
        return switch (left.kind()) {
            case CLOSED -> ((FiniteTransitionSystem<String>) left).synchronousProduct(right);
            case OPEN -> right.<TransitionSystem<?>>map(
                ((OpenFiniteTransitionSystem<String>) left)::synchronousProduct,
                automaton -> {
                    throw new TypeMismatchException("Products with automata need a closed system");
                });
        };
    }

    private TransitionSystem<?> asynchronous(TransitionSystem<String> left, ProductOperand<String, String> right) {
        return switch (left.kind()) {
            case CLOSED -> ((FiniteTransitionSystem<String>) left).asynchronousProduct(right);
            case OPEN -> right.<TransitionSystem<?>>map(
                ((OpenFiniteTransitionSystem<String>) left)::asynchronousProduct,
                automaton -> {
                    throw new UnsupportedOperationException("Asynchronous product with an automaton is not defined");
                });
        };
    }

    private TransitionSystem<?> merge(TransitionSystem<String> target, ProductOperand<String, String> source) {
        return source.<TransitionSystem<?>>map(
            target::merge,
            automaton -> {
                throw new TypeMismatchException("Cannot merge an automaton into a transition system");
            });
    }

    @Override
    public Void call() throws Exception {
        if (verbose) {
            Logger root = Logger.getLogger("");
            root.setLevel(Level.FINE);
            for (Handler handler : root.getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }

        Stopwatch overall = Stopwatch.createStarted();
        TransitionSystem<String> input = TransitionSystemParser.parse(Path.of(system));
        log.log(Level.INFO, () -> "Read %s with %d states and %d transitions"
            .formatted(input.name(), input.size(), input.transitionCount()));

        TransitionSystem<?> result = switch (operation) {
            case NONE -> input;
            case SYNC -> synchronous(input, operand());
            case ASYNC -> asynchronous(input, operand());
            case MERGE -> merge(input, operand());
        };
        log.log(Level.INFO, () -> "Computed %s (%d states, %d transitions) in %s"
            .formatted(result.name(), result.size(), result.transitionCount(), overall));

        writeIfPresent(writeDot, result, DotWriter::writeSystem);
        if (writePromela != null) {
            Path destination = PromelaWriter.save(result, Path.of(writePromela), procname);
            log.log(Level.INFO, "Wrote Promela to {0}", destination);
        }
        writeIfPresent(writeOutput, result, (described, stream) -> stream.print(Formatter.describe(described)));
        return null;
    }
}
