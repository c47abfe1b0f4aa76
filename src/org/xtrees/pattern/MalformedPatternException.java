/* @LICENSE@
 */
package org.xtrees.pattern;

/**
 * Thrown when a pattern is built with a structure the algebra does not admit:
 * an empty combinator, a {@link Tree} anywhere but at the end of a
 * {@link Tree.Branch}, a tree inside an {@link Op} body, a negative repeat
 * count. Always raised by the call that builds the offending pattern, never
 * deferred to normalization or compilation.
 */
public final class MalformedPatternException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedPatternException(String msg) {
        super(msg);
    }
}
