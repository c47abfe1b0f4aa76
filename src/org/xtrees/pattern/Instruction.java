/* @LICENSE@
 */
package org.xtrees.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One instruction of a compiled {@link Program}. Addresses held by
 * {@link Jump} and {@link Split} are absolute indices into the program.
 * Instances are immutable.
 */
public abstract class Instruction<T> {

    public enum Opcode {
        UNIT, UNIT_LIST, ANY_UNIT, MATCH, JUMP, SPLIT;
    }

    final Opcode opcode;

    private Instruction(Opcode opcode) {
        this.opcode = opcode;
    }

    public final Opcode opcode() {
        return opcode;
    }

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

    /**
     * Advances past the current item when it is equivalent to
     * {@link #value()}.
     */
    public static final class Unit<T> extends Instruction<T> {

        final T value;

        private Unit(T value) {
            super(Opcode.UNIT);
            this.value = value;
        }

        public T value() {
            return value;
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append("Unit(").append(units.display(value)).append(')');
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Unit)) return false;
            Object v = ((Unit<?>) o).value;
            return value == null ? v == null : value.equals(v);
        }

        @Override
        public int hashCode() {
            return 31 * opcode.hashCode() + (value == null ? 0 : value.hashCode());
        }
    }

    /**
     * Advances past the current item when it is equivalent to any of
     * {@link #values()}; the analog of a character class.
     */
    public static final class UnitList<T> extends Instruction<T> {

        final List<T> values;

        private UnitList(List<? extends T> values) {
            super(Opcode.UNIT_LIST);
            this.values = Collections.unmodifiableList(new ArrayList<T>(values));
        }

        public List<T> values() {
            return values;
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append("UnitList([");
            for (int i = 0; i < values.size(); ++i) {
                sb.append(i == 0 ? "" : ", ").append(units.display(values.get(i)));
            }
            sb.append("])");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UnitList && values.equals(((UnitList<?>) o).values);
        }

        @Override
        public int hashCode() {
            return 31 * opcode.hashCode() + values.hashCode();
        }
    }

    /**
     * Operand free instructions: {@link Opcode#ANY_UNIT} and
     * {@link Opcode#MATCH}.
     */
    static final class Bare<T> extends Instruction<T> {

        private Bare(Opcode opcode) {
            super(opcode);
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append(opcode == Opcode.ANY_UNIT ? "AnyUnit" : "Match");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bare && ((Bare<?>) o).opcode == opcode;
        }

        @Override
        public int hashCode() {
            return opcode.hashCode();
        }
    }

    public static final class Jump<T> extends Instruction<T> {

        final int target;

        private Jump(int target) {
            super(Opcode.JUMP);
            this.target = target;
        }

        public int target() {
            return target;
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append("Jump(").append(target).append(')');
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Jump && ((Jump<?>) o).target == target;
        }

        @Override
        public int hashCode() {
            return 31 * opcode.hashCode() + target;
        }
    }

    /**
     * Forks the thread; {@link #first()} is the preferred branch.
     */
    public static final class Split<T> extends Instruction<T> {

        final int t1, t2;

        private Split(int t1, int t2) {
            super(Opcode.SPLIT);
            this.t1 = t1;
            this.t2 = t2;
        }

        public int first() {
            return t1;
        }

        public int second() {
            return t2;
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append("Split(").append(t1).append(", ").append(t2).append(')');
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Split)) return false;
            Split<?> s = (Split<?>) o;
            return s.t1 == t1 && s.t2 == t2;
        }

        @Override
        public int hashCode() {
            return (31 * opcode.hashCode() + t1) * 31 + t2;
        }
    }

    /*
     * static factories
     */

    public static <T> Unit<T> unit(T value) {
        return new Unit<T>(value);
    }

    public static <T> UnitList<T> unitList(List<? extends T> values) {
        if (values.isEmpty()) {
            throw new MalformedPatternException("UnitList cannot be empty");
        }
        return new UnitList<T>(values);
    }

    public static <T> Instruction<T> anyUnit() {
        return new Bare<T>(Opcode.ANY_UNIT);
    }

    public static <T> Instruction<T> match() {
        return new Bare<T>(Opcode.MATCH);
    }

    public static <T> Jump<T> jump(int target) {
        return new Jump<T>(target);
    }

    public static <T> Split<T> split(int t1, int t2) {
        return new Split<T>(t1, t2);
    }
}
