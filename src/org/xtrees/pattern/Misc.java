/*
 * @LICENSE@
 */

package org.xtrees.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Package constants (the line separator, the default disjunct cap) and the
 * list helpers used by normalization: defensive copies, concatenation and
 * cartesian products.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /**
     * Default cap on the number of disjuncts a single distribution step of
     * the disjunctive normal form may produce.
     */
    static final int MAX_DISJUNCTS =
        Integer.getInteger("org.xtrees.pattern.maxDisjuncts", 1 << 16);

    static <E> List<E> concat(List<? extends E> lhs, List<? extends E> rhs) {
        List<E> ret = new ArrayList<E>(lhs.size() + rhs.size());
        ret.addAll(lhs);
        ret.addAll(rhs);
        return ret;
    }

    static <E> List<E> frozen(List<? extends E> list) {
        return Collections.unmodifiableList(new ArrayList<E>(list));
    }

    /**
     * Cartesian product, leftmost list varying slowest.
     */
    static <E> List<List<E>> product(List<? extends List<? extends E>> lists) {
        List<List<E>> ret = new ArrayList<List<E>>();
        ret.add(new ArrayList<E>());
        for (List<? extends E> choices : lists) {
            List<List<E>> next = new ArrayList<List<E>>(ret.size() * choices.size());
            for (List<E> prefix : ret) {
                for (E choice : choices) {
                    List<E> l = new ArrayList<E>(prefix.size() + 1);
                    l.addAll(prefix);
                    l.add(choice);
                    next.add(l);
                }
            }
            ret = next;
        }
        return ret;
    }

    /**
     * Size of the {@link #product(List)} of <code>lists</code>, saturating at
     * <code>Long.MAX_VALUE</code>.
     */
    static long productSize(List<? extends List<?>> lists) {
        long n = 1;
        for (List<?> l : lists) {
            if (l.isEmpty()) return 0;
            if (n > Long.MAX_VALUE / l.size()) return Long.MAX_VALUE;
            n *= l.size();
        }
        return n;
    }
}
