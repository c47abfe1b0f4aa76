/* @LICENSE@
 */
package org.xtrees.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Sibling constraint: the named branches of a group share a parent, found
 * <code>index</code> levels below the pattern root. Elements are branch names
 * (<code>String</code>) or nested groups; a nested group with the same index is
 * merged into this one when constructed.
 */
public final class Sibling {

    final int index;
    final List<Object> elems;

    private Sibling(int index, List<?> elems) {
        if (elems.isEmpty()) {
            throw new MalformedPatternException("Sibling requires at least one element");
        }
        List<Object> l = new ArrayList<Object>(elems.size());
        for (Object e : elems) {
            if (e instanceof Sibling && ((Sibling) e).index == index) {
                l.addAll(((Sibling) e).elems);
            } else if (e instanceof Sibling || e instanceof String) {
                l.add(e);
            } else {
                throw new MalformedPatternException(
                    "sibling elements are names or siblings, not " + e);
            }
        }
        this.index = index;
        this.elems = Collections.unmodifiableList(l);
    }

    public static Sibling of(int index, Object... elems) {
        return new Sibling(index, Arrays.asList(elems));
    }

    public static Sibling of(int index, List<?> elems) {
        return new Sibling(index, elems);
    }

    public int index() {
        return index;
    }

    public List<Object> elems() {
        return elems;
    }

    /**
     * Splits a nested group into flat ones. The first group is this one with
     * every nested group replaced by its representative, the first name of
     * that group; the nested groups' own flat lists follow, depth first.
     *
     * <pre>
     * Sibling.of(0, "A", Sibling.of(1, "B", "C")).flatten()
     *     == [Sibling(0, A, B), Sibling(1, B, C)]
     * </pre>
     */
    public List<Sibling> flatten() {
        List<Object> top = new ArrayList<Object>(elems.size());
        List<Sibling> nested = new ArrayList<Sibling>();
        for (Object e : elems) {
            if (e instanceof Sibling) {
                List<Sibling> flat = ((Sibling) e).flatten();
                top.add(flat.get(0).elems.get(0));
                nested.addAll(flat);
            } else {
                top.add(e);
            }
        }
        List<Sibling> ret = new ArrayList<Sibling>(nested.size() + 1);
        ret.add(new Sibling(index, top));
        ret.addAll(nested);
        return ret;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Sibling)) return false;
        Sibling s = (Sibling) o;
        return s.index == index && s.elems.equals(elems);
    }

    @Override
    public int hashCode() {
        return index * 31 + elems.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Sibling(").append(index);
        for (Object e : elems) sb.append(", ").append(e);
        return sb.append(')').toString();
    }
}
