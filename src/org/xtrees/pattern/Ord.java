/* @LICENSE@
 */
package org.xtrees.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordering constraint over branch names. A {@link Total} orders its members
 * one after the other; a {@link Partial} groups members with no order among
 * them. Members are names or nested orderings.
 * <p>
 * {@link #toDag()} turns the expression into a precedence graph:
 *
 * <pre>
 * total(&quot;A&quot;, partial(total(partial(&quot;B&quot;, &quot;C&quot;), &quot;D&quot;), &quot;E&quot;)).toDag()
 *     == {A=[B, C, E], B=[D], C=[D]}
 * </pre>
 */
public abstract class Ord {

    Ord() {}

    /*
     * first and last names reached through an expression
     */
    private static final class Ends {
        final Set<String> heads, tails;
        Ends(Set<String> heads, Set<String> tails) {
            this.heads = heads;
            this.tails = tails;
        }
    }

    abstract Ends link(Map<String, Set<String>> dag);

    abstract List<List<String>> chains();

    /**
     * @return each name mapped to the set of its direct successors; names
     *         with no successor are not keys. Iteration follows the order in
     *         which edges are first met.
     */
    public final Map<String, Set<String>> toDag() {
        Map<String, Set<String>> dag = new LinkedHashMap<String, Set<String>>();
        link(dag);
        return dag;
    }

    /**
     * @return every maximal chain of names the expression admits: the
     *         cartesian product of the members' chains for a {@link Total},
     *         their union for a {@link Partial}.
     */
    public final List<List<String>> paths() {
        return chains();
    }

    /**
     * A single branch name.
     */
    public static final class Name extends Ord {

        final String name;

        Name(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        @Override
        Ends link(Map<String, Set<String>> dag) {
            Set<String> self = Collections.singleton(name);
            return new Ends(self, self);
        }

        @Override
        List<List<String>> chains() {
            List<List<String>> ret = new ArrayList<List<String>>(1);
            ret.add(Collections.singletonList(name));
            return ret;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Name && ((Name) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Common base of {@link Total} and {@link Partial}.
     */
    public static abstract class Group extends Ord {

        final List<Ord> members;

        Group(List<?> members) {
            if (members.isEmpty()) {
                throw new MalformedPatternException(
                    getClass().getSimpleName() + " requires at least one member");
            }
            List<Ord> l = new ArrayList<Ord>(members.size());
            for (Object m : members) l.add(member(m));
            this.members = Collections.unmodifiableList(l);
        }

        public final List<Ord> members() {
            return members;
        }

        @Override
        public final boolean equals(Object o) {
            return o != null && o.getClass() == getClass()
                && ((Group) o).members.equals(members);
        }

        @Override
        public final int hashCode() {
            return getClass().hashCode() * 31 + members.hashCode();
        }

        @Override
        public final String toString() {
            StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('(');
            for (int i = 0; i < members.size(); ++i) {
                sb.append(i == 0 ? "" : ", ").append(members.get(i));
            }
            return sb.append(')').toString();
        }
    }

    /**
     * Members in sequence: every last name of one member precedes every first
     * name of the next.
     */
    public static final class Total extends Group {

        Total(List<?> members) {
            super(members);
        }

        @Override
        Ends link(Map<String, Set<String>> dag) {
            Ends first = null, prev = null;
            for (Ord m : members) {
                Ends e = m.link(dag);
                if (prev == null) {
                    first = e;
                } else {
                    for (String t : prev.tails) {
                        Set<String> succ = dag.get(t);
                        if (succ == null) {
                            dag.put(t, succ = new LinkedHashSet<String>());
                        }
                        succ.addAll(e.heads);
                    }
                }
                prev = e;
            }
            return new Ends(first.heads, prev.tails);
        }

        @Override
        List<List<String>> chains() {
            List<List<List<String>>> choices = new ArrayList<List<List<String>>>();
            for (Ord m : members) choices.add(m.chains());
            List<List<String>> ret = new ArrayList<List<String>>();
            for (List<List<String>> combo : Misc.product(choices)) {
                List<String> path = new ArrayList<String>();
                for (List<String> part : combo) path.addAll(part);
                ret.add(Collections.unmodifiableList(path));
            }
            return ret;
        }
    }

    /**
     * Members with no order among them; edges inside members are kept.
     */
    public static final class Partial extends Group {

        Partial(List<?> members) {
            super(members);
        }

        @Override
        Ends link(Map<String, Set<String>> dag) {
            Set<String> heads = new LinkedHashSet<String>();
            Set<String> tails = new LinkedHashSet<String>();
            for (Ord m : members) {
                Ends e = m.link(dag);
                heads.addAll(e.heads);
                tails.addAll(e.tails);
            }
            return new Ends(heads, tails);
        }

        @Override
        List<List<String>> chains() {
            List<List<String>> ret = new ArrayList<List<String>>();
            for (Ord m : members) ret.addAll(m.chains());
            return ret;
        }
    }

    private static Ord member(Object o) {
        if (o instanceof Ord) return (Ord) o;
        if (o instanceof String) return new Name((String) o);
        throw new MalformedPatternException(
            "ordering members are names or orderings, not " + o);
    }

    /*
     * static factories
     */

    public static Name name(String name) {
        if (name == null) throw new MalformedPatternException("null name");
        return new Name(name);
    }

    /**
     * @param members names (<code>String</code>) or {@link Ord}s.
     */
    public static Total total(Object... members) {
        return new Total(Arrays.asList(members));
    }

    public static Total total(List<?> members) {
        return new Total(members);
    }

    /**
     * @param members names (<code>String</code>) or {@link Ord}s.
     */
    public static Partial partial(Object... members) {
        return new Partial(Arrays.asList(members));
    }

    public static Partial partial(List<?> members) {
        return new Partial(members);
    }
}
