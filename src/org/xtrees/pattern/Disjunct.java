/* @LICENSE@
 */
package org.xtrees.pattern;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The constraints of one alternative of a normalized {@link Tree}: the
 * branches by name, how they are grouped under common parents, and how they
 * are ordered.
 */
public final class Disjunct<T> {

    final Map<String, Tree.Branch<T>> aliases;
    final Object sibling;
    final Ord order;

    Disjunct(Map<String, Tree.Branch<T>> aliases, Object sibling, Ord order) {
        this.aliases = Collections.unmodifiableMap(aliases);
        this.sibling = sibling;
        this.order = order;
    }

    /**
     * @return branch name to branch, in naming order.
     */
    public Map<String, Tree.Branch<T>> aliases() {
        return aliases;
    }

    public Tree.Branch<T> branch(String name) {
        return aliases.get(name);
    }

    /**
     * @return the branch name (a <code>String</code>) when the alternative
     *         is a single branch, otherwise a {@link Sibling}.
     */
    public Object sibling() {
        return sibling;
    }

    public Ord order() {
        return order;
    }

    public Map<String, Set<String>> dag() {
        return order.toDag();
    }

    /**
     * @return the flattened sibling groups; empty for a single branch.
     */
    public List<Sibling> siblingGroups() {
        if (sibling instanceof Sibling) {
            return ((Sibling) sibling).flatten();
        }
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "Disjunct{aliases=" + aliases + ", sibling=" + sibling
            + ", order=" + order + '}';
    }
}
