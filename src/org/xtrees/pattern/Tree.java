/* @LICENSE@
 */
package org.xtrees.pattern;

import static org.xtrees.pattern.Misc.LS;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Structural tree patterns. A {@link Branch} is a root-to-leaf chain of
 * elements, optionally ending in a nested tree; {@link And} requires all of
 * its children in any order, {@link Then} all of them in order, {@link Or} any
 * one of them.
 * <p>
 * Trees are immutable. {@link #canonicalNf()} rewrites a tree into canonical
 * normal form, pushing branch prefixes down into forks and lifting every
 * {@link Or} to the root; {@link #toExprs()} then extracts the sibling and
 * ordering constraints of each alternative.
 *
 * <pre>
 * then(leaf(&quot;A&quot;), and(leaf(&quot;B&quot;), leaf(&quot;C&quot;))).canonicalNf().toExprs()
 *     == [aliases {B0, B1, B2}, Sibling(0, B0, B1, B2), Total(B0, Partial(B1, B2))]
 * </pre>
 *
 * @param <T> the element type
 */
public abstract class Tree<T> extends Node<T> {

    private static final Logger logger = Logger.getLogger("org.xtrees.pattern");
    private static final Level level = Level.FINER;

    Tree() {}

    /**
     * Thrown when distributing a fork over its {@link Or} children would
     * produce more alternatives than allowed.
     */
    public static final class ExpansionLimitException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final long requested;
        private final int limit;

        ExpansionLimitException(long requested, int limit) {
            super("disjunctive expansion needs " + requested
                + " alternatives, limit is " + limit);
            this.requested = requested;
            this.limit = limit;
        }

        public long requested() {
            return requested;
        }

        public int limit() {
            return limit;
        }
    }

    /**
     * @return the direct children: a branch's elements, a fork's subtrees.
     */
    public abstract List<? extends Node<T>> children();

    /**
     * Canonical normal form, capped at the default number of alternatives
     * (system property <code>org.xtrees.pattern.maxDisjuncts</code>).
     */
    public final Tree<T> canonicalNf() {
        return canonicalNf(Misc.MAX_DISJUNCTS);
    }

    /**
     * Rewrites this tree into canonical normal form: branch prefixes pushed
     * into the forks below them, single-child forks collapsed, same-kind
     * same-scope forks merged, and forks distributed over {@link Or}
     * children. The result holds at most one {@link Or}, at the root.
     * <p>
     * This tree is left untouched; unchanged subtrees are shared with the
     * result. Normalizing a tree already in canonical normal form returns an
     * equal tree with the same scope indexes.
     *
     * @param maxDisjuncts the most alternatives a single distribution step may
     *        produce.
     * @throws ExpansionLimitException if a step would exceed
     *         <code>maxDisjuncts</code>.
     */
    public final Tree<T> canonicalNf(int maxDisjuncts) {
        if (maxDisjuncts < 1) {
            throw new IllegalArgumentException("maxDisjuncts < 1: " + maxDisjuncts);
        }
        Tree<T> ret = normalise(0, Collections.<Node<T>>emptyList(), maxDisjuncts);
        if (logger.isLoggable(level)) {
            logger.log(level, "canonical form of:" + LS + toTreeString()
                + "is:" + LS + ret.toTreeString());
        }
        return ret;
    }

    abstract Tree<T> normalise(int loc, List<Node<T>> prefix, int max);

    /**
     * @return the alternatives of a root {@link Or}, or this tree alone.
     */
    public List<Tree<T>> disjuncts() {
        return Collections.<Tree<T>>singletonList(this);
    }

    /**
     * Extracts the constraints of a tree in canonical normal form, one
     * {@link Disjunct} per alternative, in order. Branches are named
     * <code>B0</code>, <code>B1</code>, ... depth first, one name per
     * occurrence, unique within the call.
     *
     * @throws IllegalStateException if the tree is not in canonical normal
     *         form.
     */
    public final List<Disjunct<T>> toExprs() {
        List<Disjunct<T>> ret = Collections.unmodifiableList(exprs(new Namer()));
        if (logger.isLoggable(level)) {
            StringBuilder sb = new StringBuilder("constraints of " + this + ":");
            for (Disjunct<T> d : ret) sb.append(LS).append("    ").append(d);
            logger.log(level, sb.toString());
        }
        return ret;
    }

    abstract List<Disjunct<T>> exprs(Namer namer);

    private static final class Namer {
        private int count = 0;
        String next() {
            return "B" + count++;
        }
    }

    public final String toTreeString() {
        return toTreeString(Units.<T>natural());
    }

    /**
     * @return an indented rendering, one node per line.
     */
    public final String toTreeString(Units<? super T> units) {
        TreePrinter<T> p = new TreePrinter<T>(units);
        p.walk(this);
        return p.sb.toString();
    }

    /*
     * Branch
     */

    /**
     * A chain of elements from an ancestor down to a descendant. Every element
     * but the last is a {@link Node.Leaf leaf} or an {@link Op}; the last may
     * be a nested {@link Tree}, continuing the chain below it.
     */
    public static final class Branch<T> extends Tree<T> {

        final List<Node<T>> members;

        Branch(List<? extends Node<T>> members) {
            if (members.isEmpty()) {
                throw new MalformedPatternException("Branch cannot be empty");
            }
            for (int i = 0; i < members.size(); ++i) {
                Node<T> n = members.get(i);
                if (n == null) {
                    throw new MalformedPatternException("Branch element cannot be null");
                }
                if (n instanceof Tree && i != members.size() - 1) {
                    throw new MalformedPatternException(
                        "a tree may only end a Branch; found " + n + " at " + i);
                }
            }
            this.members = Misc.frozen(members);
        }

        @Override
        public List<Node<T>> children() {
            return members;
        }

        /**
         * @return the nested tree ending this branch, or <code>null</code>.
         */
        public Tree<T> tail() {
            Node<T> last = members.get(members.size() - 1);
            return last instanceof Tree ? (Tree<T>) last : null;
        }

        /**
         * Compiles the elements of this branch into a {@link Program}, so the
         * root-to-leaf path it describes can be checked against a sequence.
         *
         * @throws IllegalStateException if the branch ends in a nested tree.
         */
        public Program<T> compile() {
            if (tail() != null) {
                throw new IllegalStateException(
                    "branch ends in a nested tree, normalise it first: " + this);
            }
            return Program.compile(members);
        }

        @Override
        Tree<T> normalise(int loc, List<Node<T>> prefix, int max) {
            Tree<T> tail = tail();
            if (tail != null) {
                List<Node<T>> head = members.subList(0, members.size() - 1);
                return tail.normalise(loc + head.size(), Misc.concat(prefix, head), max);
            }
            return prefix.isEmpty() ? this : new Branch<T>(Misc.concat(prefix, members));
        }

        @Override
        List<Disjunct<T>> exprs(Namer namer) {
            if (tail() != null) {
                throw new IllegalStateException("not in canonical normal form: " + this);
            }
            String name = namer.next();
            Map<String, Branch<T>> aliases = new LinkedHashMap<String, Branch<T>>();
            aliases.put(name, this);
            return Collections.singletonList(
                new Disjunct<T>(aliases, name, Ord.name(name)));
        }

        @Override
        public boolean equivalent(Node<T> other, Units<? super T> units) {
            return other instanceof Branch
                && equivalent(members, ((Branch<T>) other).members, units);
        }

        @Override
        void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append("Branch(");
            appendTo(sb, ", ", members, units);
            sb.append(')');
        }

        @Override
        public int hashCode() {
            return Branch.class.getName().hashCode() * 31 + members.hashCode();
        }
    }

    /*
     * Forks
     */

    /**
     * Common base of {@link And}, {@link Then} and {@link Or}. Bare leaves
     * and operators among the children are wrapped in a {@link Branch}.
     */
    public static abstract class Fork<T> extends Tree<T> {

        final List<Tree<T>> children;
        final int loc;

        Fork(List<? extends Node<T>> children, int loc) {
            if (children.isEmpty()) {
                throw new MalformedPatternException(
                    getClass().getSimpleName() + " cannot be empty");
            }
            if (loc < 0) {
                throw new MalformedPatternException("negative scope index " + loc);
            }
            List<Tree<T>> l = new ArrayList<Tree<T>>(children.size());
            for (Node<T> n : children) {
                if (n == null) {
                    throw new MalformedPatternException(
                        getClass().getSimpleName() + " child cannot be null");
                }
                l.add(n instanceof Tree ? (Tree<T>) n
                    : new Branch<T>(Collections.singletonList(n)));
            }
            this.children = Collections.unmodifiableList(l);
            this.loc = loc;
        }

        @Override
        public final List<Tree<T>> children() {
            return children;
        }

        /**
         * @return the scope index: the depth, counted in branch elements from
         *         the pattern root, of the node whose children this fork
         *         constrains.
         */
        public final int loc() {
            return loc;
        }

        abstract Fork<T> newFork(List<Tree<T>> children, int loc);

        abstract Ord order(List<Ord> members);

        final boolean absorbs(Tree<T> t, int scope) {
            return t.getClass() == getClass() && ((Fork<T>) t).loc == scope;
        }

        @Override
        Tree<T> normalise(int loc, List<Node<T>> prefix, int max) {
            int scope = Math.max(loc, this.loc);
            List<Tree<T>> kids = new ArrayList<Tree<T>>(children.size());
            boolean hasOr = false;
            for (Tree<T> child : children) {
                Tree<T> n = child.normalise(scope, prefix, max);
                if (absorbs(n, scope)) {
                    kids.addAll(((Fork<T>) n).children);
                } else {
                    kids.add(n);
                    hasOr |= n instanceof Or;
                }
            }
            if (kids.size() == 1) {
                return kids.get(0);
            }
            if (hasOr) {
                return distribute(kids, scope, max);
            }
            return scope == this.loc && sameElements(kids, children)
                ? this : newFork(kids, scope);
        }

        /*
         * one fork per choice of an alternative from each Or child, leftmost
         * child varying slowest
         */
        private Tree<T> distribute(List<Tree<T>> kids, int scope, int max) {
            List<List<Tree<T>>> choices = new ArrayList<List<Tree<T>>>(kids.size());
            for (Tree<T> k : kids) {
                choices.add(k instanceof Or ? ((Or<T>) k).children
                                            : Collections.singletonList(k));
            }
            long size = Misc.productSize(choices);
            if (size > max) {
                throw new ExpansionLimitException(size, max);
            }
            List<Tree<T>> arms = new ArrayList<Tree<T>>((int) size);
            for (List<Tree<T>> combo : Misc.product(choices)) {
                List<Tree<T>> flat = new ArrayList<Tree<T>>(combo.size());
                for (Tree<T> t : combo) {
                    if (absorbs(t, scope)) {
                        flat.addAll(((Fork<T>) t).children);
                    } else {
                        flat.add(t);
                    }
                }
                arms.add(newFork(flat, scope));
            }
            if (logger.isLoggable(level)) {
                logger.log(level, getClass().getSimpleName() + " at scope " + scope
                    + " distributed into " + arms.size() + " alternatives");
            }
            return new Or<T>(arms);
        }

        @Override
        List<Disjunct<T>> exprs(Namer namer) {
            Map<String, Branch<T>> aliases = new LinkedHashMap<String, Branch<T>>();
            List<Object> siblings = new ArrayList<Object>(children.size());
            List<Ord> orders = new ArrayList<Ord>(children.size());
            for (Tree<T> child : children) {
                if (child instanceof Or) {
                    throw new IllegalStateException(
                        "not in canonical normal form, Or below " + getClass().getSimpleName()
                        + ": " + this);
                }
                List<Disjunct<T>> d = child.exprs(namer);
                assert d.size() == 1 : d;
                aliases.putAll(d.get(0).aliases);
                siblings.add(d.get(0).sibling);
                orders.add(d.get(0).order);
            }
            return Collections.singletonList(
                new Disjunct<T>(aliases, Sibling.of(loc, siblings), order(orders)));
        }

        @Override
        public final boolean equivalent(Node<T> other, Units<? super T> units) {
            return other != null && other.getClass() == getClass()
                && equivalent(children, ((Fork<T>) other).children, units);
        }

        @Override
        final void appendTo(StringBuilder sb, Units<? super T> units) {
            sb.append(getClass().getSimpleName()).append('(');
            appendTo(sb, ", ", children, units);
            sb.append(')');
        }

        @Override
        public final int hashCode() {
            return getClass().getName().hashCode() * 31 + children.hashCode();
        }
    }

    /**
     * All children, in any order.
     */
    public static final class And<T> extends Fork<T> {

        And(List<? extends Node<T>> children, int loc) {
            super(children, loc);
        }

        @Override
        Fork<T> newFork(List<Tree<T>> children, int loc) {
            return new And<T>(children, loc);
        }

        @Override
        Ord order(List<Ord> members) {
            return Ord.partial(members);
        }
    }

    /**
     * All children, in order.
     */
    public static final class Then<T> extends Fork<T> {

        Then(List<? extends Node<T>> children, int loc) {
            super(children, loc);
        }

        @Override
        Fork<T> newFork(List<Tree<T>> children, int loc) {
            return new Then<T>(children, loc);
        }

        @Override
        Ord order(List<Ord> members) {
            return Ord.total(members);
        }
    }

    /**
     * Any one child. Carries no scope index.
     */
    public static final class Or<T> extends Fork<T> {

        Or(List<? extends Node<T>> children) {
            super(children, 0);
        }

        @Override
        Fork<T> newFork(List<Tree<T>> children, int loc) {
            return new Or<T>(children);
        }

        @Override
        Ord order(List<Ord> members) {
            throw new AssertionError("an Or has no ordering of its own");
        }

        @Override
        public List<Tree<T>> disjuncts() {
            return children;
        }

        /*
         * nested Ors are flattened whatever their position
         */
        @Override
        Tree<T> normalise(int loc, List<Node<T>> prefix, int max) {
            List<Tree<T>> kids = new ArrayList<Tree<T>>(children.size());
            for (Tree<T> child : children) {
                Tree<T> n = child.normalise(loc, prefix, max);
                if (n instanceof Or) {
                    kids.addAll(((Or<T>) n).children);
                } else {
                    kids.add(n);
                }
            }
            if (kids.size() == 1) {
                return kids.get(0);
            }
            return sameElements(kids, children) ? this : new Or<T>(kids);
        }

        @Override
        List<Disjunct<T>> exprs(Namer namer) {
            List<Disjunct<T>> ret = new ArrayList<Disjunct<T>>();
            for (Tree<T> child : children) {
                ret.addAll(child.exprs(namer));
            }
            return ret;
        }
    }

    private static <E> boolean sameElements(List<? extends E> lhs, List<? extends E> rhs) {
        if (lhs.size() != rhs.size()) return false;
        for (int i = 0; i < lhs.size(); ++i) {
            if (lhs.get(i) != rhs.get(i)) return false;
        }
        return true;
    }

    /*
     * Visitor
     */

    /**
     * Walks a pattern, dispatching on the concrete node class. Subclasses
     * override the <code>visit</code> overloads for the granularity they
     * need; {@link TraversalOrder} says whether a tree is visited before or
     * after its children. Operators are visited as a whole.
     */
    public static abstract class Visitor<T> {

        public enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        public final void walk(Node<T> root) {
            visit(root);
        }

        /*
         * multi-dispatch, in this one place
         */

        protected void visit(Node<T> node) {
            if (node instanceof Tree) {
                visit((Tree<T>) node);
            } else if (node instanceof Node.Leaf) {
                visit((Node.Leaf<T>) node);
            } else if (node instanceof Op) {
                visit((Op<T>) node);
            } else {
                error(node);
            }
        }

        protected void visit(Tree<T> node) {
            if (order == TraversalOrder.BOTTOM_UP) {
                for (Node<T> n : node.children()) {
                    visit(n);
                }
            }
            if (node instanceof Branch) {
                visit((Branch<T>) node);
            } else if (node instanceof Fork) {
                visit((Fork<T>) node);
            } else {
                error(node);
            }
            if (order == TraversalOrder.TOP_DOWN) {
                for (Node<T> n : node.children()) {
                    visit(n);
                }
            }
        }

        protected void visit(Fork<T> node) {
            if (node instanceof And) {
                visit((And<T>) node);
            } else if (node instanceof Then) {
                visit((Then<T>) node);
            } else if (node instanceof Or) {
                visit((Or<T>) node);
            } else {
                error(node);
            }
        }

        protected void visit(Branch<T> node) {}
        protected void visit(And<T> node) {}
        protected void visit(Then<T> node) {}
        protected void visit(Or<T> node) {}
        protected void visit(Node.Leaf<T> node) {}
        protected void visit(Op<T> node) {}

        private static void error(Node<?> node) {
            throw new AssertionError("unknown node type " + node.getClass());
        }
    }

    private static final class TreePrinter<T> extends Visitor<T> {

        final StringBuilder sb = new StringBuilder();
        private final Units<? super T> units;
        private int nspace = 0;

        TreePrinter(Units<? super T> units) {
            super(TraversalOrder.TOP_DOWN);
            this.units = units;
        }

        private void line(String s) {
            for (int i = 0; i < nspace; ++i) sb.append(' ');
            sb.append(s).append(LS);
        }

        @Override
        protected void visit(Tree<T> node) {
            super.visit(node);
            nspace -= 4;
        }

        @Override
        protected void visit(Branch<T> node) {
            line("Branch");
            nspace += 4;
        }

        @Override
        protected void visit(And<T> node) {
            line("And loc=" + node.loc);
            nspace += 4;
        }

        @Override
        protected void visit(Then<T> node) {
            line("Then loc=" + node.loc);
            nspace += 4;
        }

        @Override
        protected void visit(Or<T> node) {
            line("Or");
            nspace += 4;
        }

        @Override
        protected void visit(Node.Leaf<T> node) {
            line(units.display(node.value));
        }

        @Override
        protected void visit(Op<T> node) {
            line(node.toString(units));
        }
    }

    /*
     * static factories
     */

    public static <T> Branch<T> branch(Node<T>... members) {
        return new Branch<T>(Arrays.asList(members));
    }

    public static <T> Branch<T> branch(List<? extends Node<T>> members) {
        return new Branch<T>(members);
    }

    /**
     * @return a {@link Branch} of leaves, one per value.
     */
    public static <T> Branch<T> chain(T... values) {
        List<Node<T>> l = new ArrayList<Node<T>>(values.length);
        for (T v : values) l.add(Node.leaf(v));
        return new Branch<T>(l);
    }

    public static <T> And<T> and(Node<T>... children) {
        return new And<T>(Arrays.asList(children), 0);
    }

    public static <T> And<T> and(int loc, Node<T>... children) {
        return new And<T>(Arrays.asList(children), loc);
    }

    public static <T> And<T> and(List<? extends Node<T>> children, int loc) {
        return new And<T>(children, loc);
    }

    public static <T> Then<T> then(Node<T>... children) {
        return new Then<T>(Arrays.asList(children), 0);
    }

    public static <T> Then<T> then(int loc, Node<T>... children) {
        return new Then<T>(Arrays.asList(children), loc);
    }

    public static <T> Then<T> then(List<? extends Node<T>> children, int loc) {
        return new Then<T>(children, loc);
    }

    public static <T> Or<T> or(Node<T>... children) {
        return new Or<T>(Arrays.asList(children));
    }

    public static <T> Or<T> or(List<? extends Node<T>> children) {
        return new Or<T>(children);
    }
}
