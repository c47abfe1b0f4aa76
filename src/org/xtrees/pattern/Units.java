/* @LICENSE@
 */
package org.xtrees.pattern;

/**
 * The equality and display behavior for the opaque element type of a pattern.
 * Patterns never assume their elements have a useful <code>equals</code> or
 * <code>toString</code>; every comparison the normalizer, the compiler and the
 * {@link ThompsonVm} make goes through an instance of this class, supplied once
 * by the caller.
 *
 * @param <T> the element type
 */
public abstract class Units<T> {

    /**
     * @return true if <code>a</code> (typically an input item) is the same
     *         unit as <code>b</code> (typically a pattern element).
     */
    public abstract boolean equivalent(T a, T b);

    public abstract String display(T a);

    private static final Units<Object> NATURAL = new Units<Object>() {
        @Override
        public boolean equivalent(Object a, Object b) {
            return a == null ? b == null : a.equals(b);
        }
        @Override
        public String display(Object a) {
            return String.valueOf(a);
        }
        @Override
        public String toString() {
            return "Units.natural";
        }
    };

    /**
     * The element's own <code>equals</code> and <code>toString</code>.
     */
    @SuppressWarnings("unchecked")
    public static <T> Units<T> natural() {
        return (Units<T>) NATURAL;
    }
}
