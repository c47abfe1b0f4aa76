/* @LICENSE@
 */
package org.xtrees.pattern;

import static org.xtrees.pattern.Misc.LS;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A sequence pattern compiled by Thompson construction into a linear list of
 * {@link Instruction}s, ending in a single <code>Match</code>.
 * <p>
 * Typical usage:
 *
 * <pre>
 * Program&lt;String&gt; p = Program.compile(leaf(&quot;a&quot;), Op.star(leaf(&quot;b&quot;)), leaf(&quot;c&quot;));
 * p.lookingAt(Arrays.asList(&quot;a&quot;, &quot;b&quot;, &quot;b&quot;, &quot;c&quot;));   // true
 * </pre>
 *
 * Programs are immutable and may be shared between threads; every match call
 * runs on its own {@link ThompsonVm}.
 */
public final class Program<T> {

    private static final Logger logger = Logger.getLogger("org.xtrees.pattern");
    private static final Level level = Level.FINEST;

    private final List<Instruction<T>> instructions;

    private Program(List<Instruction<T>> instructions) {
        this.instructions = instructions;
        if (logger.isLoggable(level)) {
            logger.log(level, "program:" + LS + this);
        }
    }

    /**
     * Compiles a sequence of {@link Node.Leaf leaves} and {@link Op}s. A leaf
     * becomes a <code>Unit</code>; each operator emits its own construction.
     *
     * @throws MalformedPatternException if the sequence holds a {@link Tree}.
     */
    public static <T> Program<T> compile(List<? extends Node<T>> seq) {
        Assembler<T> asm = new Assembler<T>();
        asm.emitAll(seq);
        return new Program<T>(asm.finish());
    }

    public static <T> Program<T> compile(Node<T>... seq) {
        return compile(Arrays.asList(seq));
    }

    /**
     * Wraps an already assembled instruction list.
     *
     * @throws IllegalArgumentException if the list is not a runnable program.
     */
    public static <T> Program<T> of(List<Instruction<T>> instructions) {
        return new Program<T>(Misc.frozen(ThompsonVm.checked(instructions)));
    }

    public List<Instruction<T>> instructions() {
        return instructions;
    }

    public int size() {
        return instructions.size();
    }

    public boolean lookingAt(List<? extends T> seq, Units<? super T> units) {
        return new ThompsonVm<T>(instructions, units).lookingAt(seq);
    }

    public boolean lookingAt(List<? extends T> seq) {
        return lookingAt(seq, Units.<T>natural());
    }

    public boolean matches(List<? extends T> seq, Units<? super T> units) {
        return new ThompsonVm<T>(instructions, units).matches(seq);
    }

    public boolean matches(List<? extends T> seq) {
        return matches(seq, Units.<T>natural());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Program && instructions.equals(((Program<?>) o).instructions);
    }

    @Override
    public int hashCode() {
        return instructions.hashCode();
    }

    public String toString(Units<? super T> units) {
        StringBuilder sb = new StringBuilder();
        int width = Integer.toString(instructions.size() - 1).length();
        for (int pc = 0; pc < instructions.size(); ++pc) {
            String addr = Integer.toString(pc);
            for (int i = addr.length(); i < width; ++i) sb.append(' ');
            sb.append(addr).append(": ")
              .append(instructions.get(pc).toString(units)).append(LS);
        }
        return sb.toString();
    }

    /**
     * Numbered disassembly, one instruction per line.
     */
    @Override
    public String toString() {
        return toString(Units.<T>natural());
    }
}
