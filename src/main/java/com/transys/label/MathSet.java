package com.transys.label;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A finite, duplicate-free and insertion-ordered set which can only grow. Used as the universe of
 * atomic propositions and as action alphabets.
 */
public final class MathSet<T> implements Iterable<T> {
  private final Set<T> elements = new LinkedHashSet<>();

  public MathSet() {}

  public static <T> MathSet<T> of(Iterable<? extends T> elements) {
    MathSet<T> set = new MathSet<>();
    set.addAll(elements);
    return set;
  }

  @SafeVarargs
  public static <T> MathSet<T> of(T... elements) {
    MathSet<T> set = new MathSet<>();
    for (T element : elements) {
      set.add(element);
    }
    return set;
  }

  public static <A, B> MathSet<Pair<A, B>> cartesian(MathSet<? extends A> left, MathSet<? extends B> right) {
    MathSet<Pair<A, B>> product = new MathSet<>();
    for (A first : left) {
      for (B second : right) {
        product.add(new Pair<>(first, second));
      }
    }
    return product;
  }

  public boolean add(T element) {
    return elements.add(element);
  }

  public boolean addAll(Iterable<? extends T> elements) {
    boolean changed = false;
    for (T element : elements) {
      changed |= this.elements.add(element);
    }
    return changed;
  }

  public MathSet<T> union(MathSet<? extends T> other) {
    MathSet<T> union = MathSet.of(elements);
    union.addAll(other);
    return union;
  }

  public boolean contains(Object element) {
    return elements.contains(element);
  }

  public void checkMember(Object element) {
    if (!elements.contains(element)) {
      throw new DomainException("%s is not an element of %s".formatted(element, this));
    }
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public Set<T> asSet() {
    return Collections.unmodifiableSet(elements);
  }

  public Stream<T> stream() {
    return elements.stream();
  }

  @Override
  public Iterator<T> iterator() {
    return Collections.unmodifiableSet(elements).iterator();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj || (obj instanceof MathSet<?> that && elements.equals(that.elements));
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
  }
}
