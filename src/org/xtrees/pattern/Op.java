/* @LICENSE@
 */
package org.xtrees.pattern;

import static org.xtrees.pattern.Instruction.unitList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Operator wrappers: the regex-like layer over sequences of elements. Each
 * operator knows its own Thompson construction, emitted through an
 * {@link Assembler} when the enclosing sequence is compiled into a
 * {@link Program}.
 * <p>
 * Operator bodies hold {@link Node.Leaf leaves} and other operators only; a
 * {@link Tree} inside a body is rejected at construction.
 */
public abstract class Op<T> extends Node<T> {

    Op() {}

    abstract void compile(Assembler<T> asm);

    static <T> List<Node<T>> body(String op, List<? extends Node<T>> elems) {
        if (elems.isEmpty()) {
            throw new MalformedPatternException(op + " requires at least one element");
        }
        for (Node<T> n : elems) {
            if (n == null) {
                throw new MalformedPatternException(op + " element cannot be null");
            }
            if (n instanceof Tree) {
                throw new MalformedPatternException(
                    op + " cannot contain a tree pattern: " + n);
            }
        }
        return Misc.frozen(elems);
    }

    /**
     * Common base of {@link Plus}, {@link Star} and {@link QMark}.
     */
    public static abstract class Quantifier<T> extends Op<T> {

        final List<Node<T>> elems;
        final boolean greedy;

        Quantifier(List<? extends Node<T>> elems, boolean greedy) {
            this.elems = body(getClass().getSimpleName(), elems);
            this.greedy = greedy;
        }

        public final List<Node<T>> elems() {
            return elems;
        }

        public final boolean isGreedy() {
            return greedy;
        }

        @Override
        public final boolean equivalent(Node<T> other, Units<? super T> units) {
            if (other == null || other.getClass() != getClass()) return false;
            Quantifier<T> q = (Quantifier<T>) other;
            return q.greedy == greedy && equivalent(elems, q.elems, units);
        }

        @Override
        final void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append(getClass().getSimpleName()).append('(');
            appendTo(sb, ", ", elems, units);
            sb.append(", greedy=").append(greedy).append(')');
        }

        @Override
        public final int hashCode() {
            return (getClass().hashCode() * 31 + elems.hashCode()) * 31
                + (greedy ? 1 : 0);
        }

        /*
         * the preferred branch of a split comes first
         */
        final Instruction<T> fork(int loop, int exit) {
            return greedy ? Instruction.<T>split(loop, exit)
                          : Instruction.<T>split(exit, loop);
        }
    }

    /**
     * One or more repetitions of the body.
     */
    public static final class Plus<T> extends Quantifier<T> {

        Plus(List<? extends Node<T>> elems, boolean greedy) {
            super(elems, greedy);
        }

        @Override
        void compile(Assembler<T> asm) {
            int start = asm.pc();
            asm.emitAll(elems);
            asm.emit(fork(start, asm.pc() + 1));
        }
    }

    /**
     * Zero or more repetitions of the body.
     */
    public static final class Star<T> extends Quantifier<T> {

        Star(List<? extends Node<T>> elems, boolean greedy) {
            super(elems, greedy);
        }

        @Override
        void compile(Assembler<T> asm) {
            int at = asm.reserve();
            asm.emitAll(elems);
            int after = asm.pc() + 1;
            asm.emit(Instruction.<T>jump(at));
            asm.patch(at, fork(at + 1, after));
        }
    }

    /**
     * Zero or one occurrence of the body.
     */
    public static final class QMark<T> extends Quantifier<T> {

        QMark(List<? extends Node<T>> elems, boolean greedy) {
            super(elems, greedy);
        }

        @Override
        void compile(Assembler<T> asm) {
            int at = asm.reserve();
            asm.emitAll(elems);
            asm.patch(at, fork(at + 1, asm.pc()));
        }
    }

    /**
     * Either the left or the right sequence, left preferred.
     */
    public static final class Alt<T> extends Op<T> {

        final List<Node<T>> left, right;

        Alt(List<? extends Node<T>> left, List<? extends Node<T>> right) {
            this.left = body("Alt", left);
            this.right = body("Alt", right);
        }

        public List<Node<T>> left() {
            return left;
        }

        public List<Node<T>> right() {
            return right;
        }

        @Override
        void compile(Assembler<T> asm) {
            int at = asm.reserve();
            asm.emitAll(left);
            int exit = asm.reserve();
            int rhs = asm.pc();
            asm.emitAll(right);
            asm.patch(at, Instruction.<T>split(at + 1, rhs));
            asm.patch(exit, Instruction.<T>jump(asm.pc()));
        }

        @Override
        public boolean equivalent(Node<T> other, Units<? super T> units) {
            if (!(other instanceof Alt)) return false;
            Alt<T> a = (Alt<T>) other;
            return equivalent(left, a.left, units) && equivalent(right, a.right, units);
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append("Alt([");
            appendTo(sb, ", ", left, units);
            sb.append("], [");
            appendTo(sb, ", ", right, units);
            sb.append("])");
        }

        @Override
        public int hashCode() {
            return (Alt.class.hashCode() * 31 + left.hashCode()) * 31 + right.hashCode();
        }
    }

    /**
     * Any one of a list of elements.
     */
    public static final class Lst<T> extends Op<T> {

        final List<T> values;

        Lst(List<? extends T> values) {
            if (values.isEmpty()) {
                throw new MalformedPatternException("Lst requires at least one element");
            }
            this.values = Misc.frozen(values);
        }

        public List<T> values() {
            return values;
        }

        @Override
        void compile(Assembler<T> asm) {
            asm.emit(unitList(values));
        }

        @Override
        public boolean equivalent(Node<T> other, Units<? super T> units) {
            if (!(other instanceof Lst)) return false;
            List<T> those = ((Lst<T>) other).values;
            if (those.size() != values.size()) return false;
            Iterator<T> it = those.iterator();
            for (T v : values) {
                if (!units.equivalent(v, it.next())) return false;
            }
            return true;
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append("Lst(");
            for (int i = 0; i < values.size(); ++i) {
                sb.append(i == 0 ? "" : ", ").append(units.display(values.get(i)));
            }
            sb.append(')');
        }

        @Override
        public int hashCode() {
            return Lst.class.hashCode() * 31 + values.hashCode();
        }
    }

    /**
     * Any single element.
     */
    public static final class Dot<T> extends Op<T> {

        Dot() {}

        @Override
        void compile(Assembler<T> asm) {
            asm.emit(Instruction.<T>anyUnit());
        }

        @Override
        public boolean equivalent(Node<T> other, Units<? super T> units) {
            return other instanceof Dot;
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append("Dot()");
        }

        @Override
        public int hashCode() {
            return Dot.class.hashCode();
        }
    }

    /**
     * Exactly <code>count</code> copies of the body, unrolled.
     */
    public static final class Repeat<T> extends Op<T> {

        final List<Node<T>> elems;
        final int count;

        Repeat(List<? extends Node<T>> elems, int count) {
            if (count < 0) {
                throw new MalformedPatternException("Repeat count is negative: " + count);
            }
            this.elems = body("Repeat", elems);
            this.count = count;
        }

        public List<Node<T>> elems() {
            return elems;
        }

        public int count() {
            return count;
        }

        @Override
        void compile(Assembler<T> asm) {
            for (int i = 0; i < count; ++i) {
                asm.emitAll(elems);
            }
        }

        @Override
        public boolean equivalent(Node<T> other, Units<? super T> units) {
            if (!(other instanceof Repeat)) return false;
            Repeat<T> r = (Repeat<T>) other;
            return r.count == count && equivalent(elems, r.elems, units);
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append("Repeat(");
            appendTo(sb, ", ", elems, units);
            sb.append(", count=").append(count).append(')');
        }

        @Override
        public int hashCode() {
            return (Repeat.class.hashCode() * 31 + elems.hashCode()) * 31 + count;
        }
    }

    /*
     * static factories
     */

    public static <T> Plus<T> plus(Node<T>... elems) {
        return new Plus<T>(Arrays.asList(elems), true);
    }

    public static <T> Plus<T> plus(boolean greedy, Node<T>... elems) {
        return new Plus<T>(Arrays.asList(elems), greedy);
    }

    public static <T> Plus<T> plus(List<? extends Node<T>> elems, boolean greedy) {
        return new Plus<T>(elems, greedy);
    }

    public static <T> Star<T> star(Node<T>... elems) {
        return new Star<T>(Arrays.asList(elems), true);
    }

    public static <T> Star<T> star(boolean greedy, Node<T>... elems) {
        return new Star<T>(Arrays.asList(elems), greedy);
    }

    public static <T> Star<T> star(List<? extends Node<T>> elems, boolean greedy) {
        return new Star<T>(elems, greedy);
    }

    public static <T> QMark<T> qmark(Node<T>... elems) {
        return new QMark<T>(Arrays.asList(elems), true);
    }

    public static <T> QMark<T> qmark(boolean greedy, Node<T>... elems) {
        return new QMark<T>(Arrays.asList(elems), greedy);
    }

    public static <T> QMark<T> qmark(List<? extends Node<T>> elems, boolean greedy) {
        return new QMark<T>(elems, greedy);
    }

    public static <T> Alt<T> alt(List<? extends Node<T>> left,
            List<? extends Node<T>> right) {
        return new Alt<T>(left, right);
    }

    public static <T> Alt<T> alt(Node<T> left, Node<T> right) {
        List<Node<T>> l = new ArrayList<Node<T>>(1);
        List<Node<T>> r = new ArrayList<Node<T>>(1);
        l.add(left);
        r.add(right);
        return new Alt<T>(l, r);
    }

    public static <T> Lst<T> lst(T... values) {
        return new Lst<T>(Arrays.asList(values));
    }

    public static <T> Lst<T> lst(List<? extends T> values) {
        return new Lst<T>(values);
    }

    public static <T> Dot<T> dot() {
        return new Dot<T>();
    }

    public static <T> Repeat<T> repeat(int count, Node<T>... elems) {
        return new Repeat<T>(Arrays.asList(elems), count);
    }

    public static <T> Repeat<T> repeat(List<? extends Node<T>> elems, int count) {
        return new Repeat<T>(elems, count);
    }
}
