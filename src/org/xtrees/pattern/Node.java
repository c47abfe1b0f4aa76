/* @LICENSE@
 */
package org.xtrees.pattern;

import java.util.Iterator;
import java.util.List;

/**
 * Root of the closed hierarchy of pattern elements: a {@link Leaf} wraps one
 * element of the caller's type, an {@link Op} marks a sub-sequence for the
 * regex-like operator language, and a {@link Tree} is a structural
 * combinator. No other subclasses exist.
 * <p>
 * Equality is structural. Leaves are compared with their natural
 * <code>equals</code> by {@link #equals(Object)}; use
 * {@link #equivalent(Node, Units)} to compare through a caller supplied
 * {@link Units}.
 *
 * @param <T> the element type
 */
public abstract class Node<T> {

    Node() {}   // closed hierarchy

    /**
     * Structural comparison, elements compared with <code>units</code>.
     */
    public abstract boolean equivalent(Node<T> other, Units<? super T> units);

    abstract void appendTo(StringBuilder sb, Units<? super T> units);

    public final String toString(Units<? super T> units) {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, units);
        return sb.toString();
    }

    @Override
    public final String toString() {
        return toString(Units.<T>natural());
    }

    @SuppressWarnings("unchecked")
    @Override
    public final boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof Node)) return false;
        return equivalent((Node<T>) o, Units.<T>natural());
    }

    @Override
    public abstract int hashCode();

    public static <T> Leaf<T> leaf(T value) {
        return new Leaf<T>(value);
    }

    /**
     * A single element of the caller's type.
     */
    public static final class Leaf<T> extends Node<T> {

        final T value;

        private Leaf(T value) {
            this.value = value;
        }

        public T value() {
            return value;
        }

        @Override
        public boolean equivalent(Node<T> other, Units<? super T> units) {
            return other instanceof Leaf
                && units.equivalent(value, ((Leaf<T>) other).value);
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append(units.display(value));
        }

        @Override
        public int hashCode() {
            return value == null ? 0 : value.hashCode();
        }
    }

    /*
     * helpers shared by the combinators
     */

    static <T> boolean equivalent(List<? extends Node<T>> lhs,
            List<? extends Node<T>> rhs, Units<? super T> units) {
        if (lhs.size() != rhs.size()) return false;
        Iterator<? extends Node<T>> r = rhs.iterator();
        for (Node<T> l : lhs) {
            if (!l.equivalent(r.next(), units)) return false;
        }
        return true;
    }

    static <T> void appendTo(StringBuilder sb, String sep,
            List<? extends Node<T>> nodes, Units<? super T> units) {
        boolean first = true;
        for (Node<T> n : nodes) {
            if (!first) sb.append(sep);
            n.appendTo(sb, units);
            first = false;
        }
    }
}
