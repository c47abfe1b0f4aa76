/*
 * @LICENSE@
 */

/**
 * <h3><b>xtrees</b> - structural pattern matching over labeled trees.</h3>
 * <p>
 * <h4>Overview.</h4>
 * <p>
 * A caller describes a shape: the nodes it must contain, how they descend from
 * one another, which of them share a parent, in what order they appear, and
 * regex-like repetition along a path. <b>xtrees</b> decides whether a concrete
 * tree, or a token sequence drawn from one, satisfies that shape. The element
 * type is opaque; all comparisons go through a caller supplied
 * {@link org.xtrees.pattern.Units}.
 * <p>
 * <h4>Tree patterns.</h4>
 * <p>
 * {@link org.xtrees.pattern.Tree.Branch Branch}, {@link
 * org.xtrees.pattern.Tree.And And}, {@link org.xtrees.pattern.Tree.Then Then}
 * and {@link org.xtrees.pattern.Tree.Or Or} build a pattern. {@link
 * org.xtrees.pattern.Tree#canonicalNf()} rewrites it into canonical normal
 * form, a flat set of root-to-leaf branches under forks with at most one
 * <code>Or</code>, at the root; {@link org.xtrees.pattern.Tree#toExprs()}
 * extracts from each alternative its {@link org.xtrees.pattern.Sibling}
 * grouping and its {@link org.xtrees.pattern.Ord} ordering, which {@link
 * org.xtrees.pattern.Ord#toDag()} turns into a precedence graph.
 * <p>
 * <h4>Operators.</h4>
 * <p>
 * Along a single path, {@link org.xtrees.pattern.Op} gives the usual
 * repetition and alternation operators. A sequence of leaves and operators
 * compiles by Thompson construction into a {@link org.xtrees.pattern.Program},
 * run without backtracking by the {@link org.xtrees.pattern.ThompsonVm}; the
 * work done is linear in the length of the input for any pattern.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>Russ Cox, <a href="http://swtch.com/~rsc/regexp/regexp2.html">Regular
 * Expression Matching: the Virtual Machine Approach</a>, for the instruction set
 * and the lock step simulation.</li>
 * </ul>
 */
package org.xtrees.pattern;
