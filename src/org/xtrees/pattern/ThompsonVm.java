/* @LICENSE@
 */
package org.xtrees.pattern;

import static org.xtrees.pattern.Misc.LS;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Non-backtracking simulation of a compiled {@link Program}, in the manner of
 * Pike: every live thread advances in lock step, one input item at a time,
 * followed by one final step on an end sentinel.
 * <p>
 * Thread lists are de-duplicated per step, so a run visits at most
 * <code>size * (n + 1)</code> threads for a program of <code>size</code>
 * instructions and an input of <code>n</code> items, whatever the pattern.
 * <p>
 * An instance reuses its thread lists between runs and belongs to one thread
 * at a time. The program itself may be shared.
 */
public final class ThompsonVm<T> {

    private static final Logger logger = Logger.getLogger("org.xtrees.pattern");
    private static final Level level = Level.FINEST;

    /*
     * ThreadList
     *  - pcs in insertion order, which is priority order
     *  - mark[pc] == gen iff pc is already on the list: clearing is O(1)
     */
    private static final class ThreadList {
        final int[] pcs;
        final int[] mark;
        int size = 0;
        int gen = 1;
        ThreadList(int n) {
            pcs = new int[n];
            mark = new int[n];
        }
        boolean add(int pc) {
            if (mark[pc] == gen) return false;
            mark[pc] = gen;
            pcs[size++] = pc;
            return true;
        }
        void clear() {
            size = 0;
            if (++gen == Integer.MAX_VALUE) {
                Arrays.fill(mark, 0);
                gen = 1;
            }
        }
        int[] toArray() {
            return Arrays.copyOf(pcs, size);
        }
        @Override
        public String toString() {
            return Arrays.toString(toArray());
        }
    }

    private final List<Instruction<T>> code;
    private final Units<? super T> units;

    private ThreadList curr, next;
    private int visits = 0;

    public ThompsonVm(List<Instruction<T>> program, Units<? super T> units) {
        if (units == null) throw new NullPointerException("units");
        this.code = new ArrayList<Instruction<T>>(checked(program));
        this.units = units;
        this.curr = new ThreadList(code.size());
        this.next = new ThreadList(code.size());
    }

    /**
     * One-shot prefix match of <code>seq</code> against <code>program</code>.
     *
     * @see #lookingAt(List)
     */
    public static <T> boolean run(List<Instruction<T>> program,
            List<? extends T> seq, Units<? super T> units) {
        return new ThompsonVm<T>(program, units).lookingAt(seq);
    }

    /**
     * @return true as soon as some thread reaches <code>Match</code>, i.e.
     *         when a prefix of <code>seq</code> (possibly empty) matches.
     */
    public boolean lookingAt(List<? extends T> seq) {
        return run(seq, false);
    }

    /**
     * @return true only if <code>Match</code> is reached with the whole of
     *         <code>seq</code> consumed.
     */
    public boolean matches(List<? extends T> seq) {
        return run(seq, true);
    }

    /**
     * @return the number of thread visits made by the last run.
     */
    public int visits() {
        return visits;
    }

    /**
     * Performs a single transition with prefix acceptance.
     *
     * @param threads the program counters live before <code>item</code>, in
     *        priority order.
     * @param item the current input item; ignored if <code>atEnd</code>.
     * @param atEnd true for the end sentinel step.
     * @return <code>null</code> if some thread reached <code>Match</code>,
     *         otherwise the threads live after <code>item</code>, possibly
     *         none.
     */
    public int[] step(int[] threads, T item, boolean atEnd) {
        curr.clear();
        next.clear();
        for (int pc : threads) {
            if (pc < 0 || pc >= code.size()) {
                throw new IllegalArgumentException("no instruction at " + pc);
            }
            curr.add(pc);
        }
        return advance(item, atEnd, false) ? null : next.toArray();
    }

    private boolean run(List<? extends T> seq, boolean anchorEnd) {
        visits = 0;
        curr.clear();
        next.clear();
        curr.add(0);
        final int n = seq.size();
        boolean accepted = false;
        for (int i = 0; i <= n; ++i) {
            boolean atEnd = i == n;
            if (advance(atEnd ? null : seq.get(i), atEnd, anchorEnd)) {
                accepted = true;
                break;
            }
            ThreadList temp = curr;
            curr = next;
            next = temp;
            next.clear();
            if (curr.size == 0) break;
        }
        if (logger.isLoggable(level)) {
            logger.log(level, (anchorEnd ? "matches" : "lookingAt") + " " + seq
                + " -> " + accepted + " (" + visits + " visits)");
        }
        return accepted;
    }

    /*
     * Runs every thread of curr against one item. Jump and Split targets go
     * on curr itself, behind the thread being run; consuming instructions
     * feed next.
     */
    private boolean advance(T item, boolean atEnd, boolean anchorEnd) {
        for (int k = 0; k < curr.size; ++k) {
            int pc = curr.pcs[k];
            ++visits;
            Instruction<T> inst = code.get(pc);
            switch (inst.opcode) {
            case UNIT:
                if (!atEnd && units.equivalent(item, ((Instruction.Unit<T>) inst).value)) {
                    next.add(pc + 1);
                }
                break;
            case UNIT_LIST:
                if (!atEnd) {
                    for (T v : ((Instruction.UnitList<T>) inst).values) {
                        if (units.equivalent(item, v)) {
                            next.add(pc + 1);
                            break;
                        }
                    }
                }
                break;
            case ANY_UNIT:
                next.add(pc + 1);
                break;
            case MATCH:
                if (!anchorEnd || atEnd) return true;
                break;
            case JUMP:
                curr.add(((Instruction.Jump<T>) inst).target);
                break;
            case SPLIT:
                Instruction.Split<T> s = (Instruction.Split<T>) inst;
                curr.add(s.t1);
                curr.add(s.t2);
                break;
            default:
                throw new AssertionError("unknown instruction at " + pc + ": " + inst);
            }
        }
        return false;
    }

    /**
     * Structural checks on a program: non-empty, no null instruction, every
     * jump target in range, and no instruction able to advance past the end.
     *
     * @throws IllegalArgumentException on the first violation.
     */
    static <T> List<Instruction<T>> checked(List<Instruction<T>> program) {
        if (program == null || program.isEmpty()) {
            throw new IllegalArgumentException("empty program");
        }
        final int size = program.size();
        for (int pc = 0; pc < size; ++pc) {
            Instruction<T> inst = program.get(pc);
            if (inst == null) {
                throw new IllegalArgumentException("no instruction at " + pc);
            }
            switch (inst.opcode) {
            case JUMP:
                checkTarget(pc, ((Instruction.Jump<T>) inst).target, size);
                break;
            case SPLIT:
                checkTarget(pc, ((Instruction.Split<T>) inst).t1, size);
                checkTarget(pc, ((Instruction.Split<T>) inst).t2, size);
                break;
            case MATCH:
                break;
            default:
                if (pc == size - 1) {
                    throw new IllegalArgumentException(
                        "last instruction " + inst + " falls off the end of the program");
                }
            }
        }
        return program;
    }

    private static void checkTarget(int pc, int target, int size) {
        if (target < 0 || target >= size) {
            throw new IllegalArgumentException(
                "instruction " + pc + " targets " + target + ", outside 0.." + (size - 1));
        }
    }

    @Override
    public String toString() {
        return "ThompsonVm{curr=" + curr + LS + " next=" + next + '}';
    }
}
