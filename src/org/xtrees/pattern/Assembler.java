/* @LICENSE@
 */
package org.xtrees.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the instructions of one compilation. Addresses are absolute; the
 * program counter is the address the next emitted instruction will get.
 * Forward references are handled by {@link #reserve() reserving} a slot and
 * {@link #patch(int, Instruction) patching} it once the target is known.
 * <p>
 * Belongs to a single compilation; never shared.
 */
final class Assembler<T> {

    private final List<Instruction<T>> code = new ArrayList<Instruction<T>>();
    private boolean finished = false;

    int pc() {
        return code.size();
    }

    int emit(Instruction<T> inst) {
        assert !finished;
        assert inst != null;
        code.add(inst);
        return code.size() - 1;
    }

    int reserve() {
        assert !finished;
        code.add(null);
        return code.size() - 1;
    }

    void patch(int addr, Instruction<T> inst) {
        assert code.get(addr) == null : "slot " + addr + " already holds " + code.get(addr);
        code.set(addr, inst);
    }

    void emitAll(List<? extends Node<T>> elems) {
        for (Node<T> n : elems) {
            if (n instanceof Node.Leaf) {
                emit(Instruction.unit(((Node.Leaf<T>) n).value));
            } else if (n instanceof Op) {
                ((Op<T>) n).compile(this);
            } else {
                throw new MalformedPatternException(
                    "cannot compile " + (n == null ? "null" : n.getClass().getSimpleName())
                    + " into a program: " + n);
            }
        }
    }

    List<Instruction<T>> finish() {
        emit(Instruction.<T>match());
        finished = true;
        assert !code.contains(null) : "unpatched slot in " + code;
        return Collections.unmodifiableList(code);
    }
}
