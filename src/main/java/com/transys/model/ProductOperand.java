package com.transys.model;

import static java.util.Objects.requireNonNull;

import com.transys.automaton.BuchiAutomaton;
import java.util.function.Function;

/**
 * Right-hand operand of a product: either a transition system or a Büchi automaton.
 */
public abstract class ProductOperand<T, Q> {
  public enum Type {
    TRANSITION_SYSTEM, AUTOMATON
  }

  private ProductOperand() {}

  public static <T, Q> ProductOperand<T, Q> of(TransitionSystem<T> system) {
    return new OfSystem<>(requireNonNull(system));
  }

  public static <T, Q> ProductOperand<T, Q> of(BuchiAutomaton<Q> automaton) {
    return new OfAutomaton<>(requireNonNull(automaton));
  }

  public abstract Type type();

  public abstract <R> R map(Function<? super TransitionSystem<T>, ? extends R> onSystem,
      Function<? super BuchiAutomaton<Q>, ? extends R> onAutomaton);

  private static final class OfSystem<T, Q> extends ProductOperand<T, Q> {
    private final TransitionSystem<T> system;

    OfSystem(TransitionSystem<T> system) {
      this.system = system;
    }

    @Override
    public Type type() {
      return Type.TRANSITION_SYSTEM;
    }

    @Override
    public <R> R map(Function<? super TransitionSystem<T>, ? extends R> onSystem,
        Function<? super BuchiAutomaton<Q>, ? extends R> onAutomaton) {
      return onSystem.apply(system);
    }

    @Override
    public String toString() {
      return "TS[%s]".formatted(system.name());
    }
  }

  private static final class OfAutomaton<T, Q> extends ProductOperand<T, Q> {
    private final BuchiAutomaton<Q> automaton;

    OfAutomaton(BuchiAutomaton<Q> automaton) {
      this.automaton = automaton;
    }

    @Override
    public Type type() {
      return Type.AUTOMATON;
    }

    @Override
    public <R> R map(Function<? super TransitionSystem<T>, ? extends R> onSystem,
        Function<? super BuchiAutomaton<Q>, ? extends R> onAutomaton) {
      return onAutomaton.apply(automaton);
    }

    @Override
    public String toString() {
      return automaton.toString();
    }
  }
}
