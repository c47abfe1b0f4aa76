/* @LICENSE@
 */

package org.xtrees.pattern;

import static org.xtrees.pattern.Tree.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ToExprsTestCase extends AbstractPatternTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ToExprsTestCase.class);
    }

    public ToExprsTestCase(String name) {
        super(name);
    }

    private static Map<String, Branch<String>> aliases(Object... pairs) {
        Map<String, Branch<String>> ret = new LinkedHashMap<String, Branch<String>>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            Branch<String> br = (Branch<String>) pairs[i + 1];
            ret.put((String) pairs[i], br);
        }
        return ret;
    }

    private static Disjunct<String> only(Tree<String> t) {
        List<Disjunct<String>> ds = t.canonicalNf().toExprs();
        assertEquals(ds.toString(), 1, ds.size());
        return ds.get(0);
    }

    public void testBranch() {
        Disjunct<String> d = only(b("A", "B", "C"));
        assertEquals(aliases("B0", b("A", "B", "C")), d.aliases());
        assertEquals("B0", d.sibling());
        assertEquals(Ord.name("B0"), d.order());
        assertTrue(d.dag().isEmpty());
        assertTrue(d.siblingGroups().isEmpty());
    }

    public void testAnd() {
        Disjunct<String> d = only(and(u("A"), u("B"), u("C")));
        assertEquals(aliases("B0", b("A"), "B1", b("B"), "B2", b("C")), d.aliases());
        assertEquals(Sibling.of(0, "B0", "B1", "B2"), d.sibling());
        assertEquals(Ord.partial("B0", "B1", "B2"), d.order());
        assertTrue(d.dag().isEmpty());
    }

    public void testThen() {
        Disjunct<String> d = only(then(u("A"), u("B"), u("C")));
        assertEquals(aliases("B0", b("A"), "B1", b("B"), "B2", b("C")), d.aliases());
        assertEquals(Sibling.of(0, "B0", "B1", "B2"), d.sibling());
        assertEquals(Ord.total("B0", "B1", "B2"), d.order());
        assertEquals(2, d.dag().size());
    }

    public void testOr() {
        Tree<String> cnf = or(u("A"), u("B"), u("C")).canonicalNf();
        List<Disjunct<String>> ds = cnf.toExprs();
        assertEquals(3, ds.size());
        for (int i = 0; i < ds.size(); ++i) {
            String name = "B" + i;
            assertEquals(aliases(name, cnf.disjuncts().get(i)), ds.get(i).aliases());
            assertEquals(name, ds.get(i).sibling());
            assertEquals(Ord.name(name), ds.get(i).order());
        }
    }

    public void testScopeOfPushedPrefix() {
        Disjunct<String> d = only(branch(u("A"), u("B"), and(u("C"), b("D", "E"))));
        assertEquals(aliases("B0", b("A", "B", "C"), "B1", b("A", "B", "D", "E")),
            d.aliases());
        assertEquals(Sibling.of(2, "B0", "B1"), d.sibling());
        assertEquals(Ord.partial("B0", "B1"), d.order());
        assertSame(d.aliases().get("B1"), d.branch("B1"));
    }

    public void testSameScopeSiblingsMerged() {
        Disjunct<String> d = only(then(u("A"), and(u("B"), u("C"))));
        assertEquals(Sibling.of(0, "B0", "B1", "B2"), d.sibling());
        assertEquals(Ord.total("B0", Ord.partial("B1", "B2")), d.order());
        Map<String, Set<String>> dag = new HashMap<String, Set<String>>();
        dag.put("B0", new HashSet<String>(Arrays.asList("B1", "B2")));
        assertEquals(dag, d.dag());
    }

    public void testNestedScopes() {
        Disjunct<String> d = only(and(u("A"), branch(u("B"), and(u("C"), u("D")))));
        assertEquals(aliases("B0", b("A"), "B1", b("B", "C"), "B2", b("B", "D")),
            d.aliases());
        assertEquals(Sibling.of(0, "B0", Sibling.of(1, "B1", "B2")), d.sibling());
        assertEquals(
            Arrays.asList(Sibling.of(0, "B0", "B1"), Sibling.of(1, "B1", "B2")),
            d.siblingGroups());
        assertEquals(Ord.partial("B0", Ord.partial("B1", "B2")), d.order());
    }

    public void testNamesUniqueAcrossDisjuncts() {
        Tree<String> cnf = then(or(u("A"), u("B")), or(u("C"), u("D"))).canonicalNf();
        List<Disjunct<String>> ds = cnf.toExprs();
        assertEquals(4, ds.size());
        assertEquals(aliases("B0", b("A"), "B1", b("C")), ds.get(0).aliases());
        assertEquals(aliases("B2", b("A"), "B3", b("D")), ds.get(1).aliases());
        assertEquals(aliases("B4", b("B"), "B5", b("C")), ds.get(2).aliases());
        assertEquals(aliases("B6", b("B"), "B7", b("D")), ds.get(3).aliases());
        assertEquals(Ord.total("B6", "B7"), ds.get(3).order());
    }

    public void testNamesRestartPerCall() {
        Tree<String> cnf = and(u("A"), u("B")).canonicalNf();
        assertEquals(cnf.toExprs().toString(), cnf.toExprs().toString());
        assertTrue(cnf.toExprs().get(0).aliases().containsKey("B0"));
    }

    public void testNotCanonical() {
        try {
            and(u("A"), or(u("B"), u("C"))).toExprs();
            fail("Or below And accepted");
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            branch(u("A"), then(u("B"), u("C"))).toExprs();
            fail("nested tree in a branch accepted");
        } catch (IllegalStateException e) {
            // expected
        }
    }
}
