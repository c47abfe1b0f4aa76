/* @LICENSE@
 */

package org.xtrees.pattern;

import static org.xtrees.pattern.Ord.partial;
import static org.xtrees.pattern.Ord.total;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import junit.framework.TestCase;

public class ConstraintsTestCase extends TestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ConstraintsTestCase.class);
    }

    public ConstraintsTestCase(String name) {
        super(name);
    }

    /*
     * "A:B,C" is the edge set A -> B, A -> C
     */
    private static Map<String, Set<String>> dag(String... entries) {
        Map<String, Set<String>> ret = new HashMap<String, Set<String>>();
        for (String edges : entries) {
            String[] kv = edges.split(":");
            ret.put(kv[0], new HashSet<String>(Arrays.asList(kv[1].split(","))));
        }
        return ret;
    }

    private static List<String> path(String... names) {
        return Arrays.asList(names);
    }

    /*
     * Sibling
     */

    public void testSiblingFlatGroup() {
        assertEquals(Arrays.asList(Sibling.of(0, "A", "B")),
            Sibling.of(0, "A", "B").flatten());
    }

    public void testSiblingNestedGroup() {
        assertEquals(Arrays.asList(Sibling.of(0, "A", "B"), Sibling.of(1, "B", "C")),
            Sibling.of(0, "A", Sibling.of(1, "B", "C")).flatten());
    }

    public void testSiblingRepresentatives() {
        Sibling s = Sibling.of(0, Sibling.of(1, "A", "D"), Sibling.of(1, "B", "C"));
        assertEquals(
            Arrays.asList(
                Sibling.of(0, "A", "B"),
                Sibling.of(1, "A", "D"),
                Sibling.of(1, "B", "C")),
            s.flatten());
        // flattening leaves the receiver alone
        assertEquals(Sibling.of(1, "A", "D"), s.elems().get(0));
    }

    public void testSiblingDeepNesting() {
        Sibling s = Sibling.of(0, "A", Sibling.of(1, Sibling.of(2, "B", "C"), "D"));
        assertEquals(
            Arrays.asList(
                Sibling.of(0, "A", "B"),
                Sibling.of(1, "B", "D"),
                Sibling.of(2, "B", "C")),
            s.flatten());
    }

    public void testSiblingSameIndexInlined() {
        assertEquals(Sibling.of(0, "A", "B", "C"), Sibling.of(0, "A", Sibling.of(0, "B", "C")));
        assertFalse(Sibling.of(0, "A", "B", "C").equals(
            Sibling.of(0, "A", Sibling.of(1, "B", "C"))));
    }

    public void testSiblingEquals() {
        Sibling s1 = Sibling.of(0, "A", "B");
        assertEquals(s1, Sibling.of(0, "A", "B"));
        assertEquals(s1.hashCode(), Sibling.of(0, "A", "B").hashCode());
        assertFalse(s1.equals(Sibling.of(1, "A", "B")));
        assertFalse(s1.equals(Sibling.of(0, "X", "Y")));
        assertFalse(s1.equals(Sibling.of(0, "A", "B", "C")));
        assertFalse(s1.equals(total("A", "B")));
        assertEquals("Sibling(0, A, Sibling(1, B, C))",
            Sibling.of(0, "A", Sibling.of(1, "B", "C")).toString());
    }

    public void testSiblingMalformed() {
        try {
            Sibling.of(0);
            fail();
        } catch (MalformedPatternException e) {
            // expected
        }
        try {
            Sibling.of(0, "A", Integer.valueOf(1));
            fail();
        } catch (MalformedPatternException e) {
            // expected
        }
    }

    /*
     * Ord
     */

    public void testChain() {
        assertEquals(dag("A:B"), total("A", "B").toDag());
        assertEquals(dag("A:B", "B:C"), total("A", total("B", "C")).toDag());
    }

    public void testFanOutAndIn() {
        assertEquals(dag("A:B,C"), total("A", partial("B", "C")).toDag());
        assertEquals(dag("A:C", "B:C"), total(partial("A", "B"), "C").toDag());
    }

    public void testPartialKeepsInnerEdges() {
        assertEquals(dag("A:B,D", "B:C"),
            total("A", partial(total("B", "C"), "D")).toDag());
        assertEquals(dag("A:D", "B:C", "C:D"),
            total(partial("A", total("B", "C")), "D").toDag());
    }

    public void testNested() {
        assertEquals(dag("A:B,C,E", "B:D", "C:D"),
            total("A", partial(total(partial("B", "C"), "D"), "E")).toDag());
        assertEquals(dag("A:B,C,E", "B:D", "C:D", "D:F", "E:F"),
            total("A", partial(total(partial("B", "C"), "D"), "E"), "F").toDag());
    }

    public void testUnordered() {
        assertTrue(partial("B", "C").toDag().isEmpty());
        assertTrue(Ord.name("A").toDag().isEmpty());
    }

    public void testLongChain() {
        Map<String, Set<String>> expected = dag(
            "A:N1", "N1:N2", "N2:B1,C1", "B1:B2,C2", "C1:B2,C2", "B2:D", "C2:D");
        assertEquals(expected,
            total("A", total("N1", "N2"), partial("B1", "C1"), partial("B2", "C2"), "D")
                .toDag());
    }

    public void testPaths() {
        assertEquals(Arrays.asList(path("A", "B", "C")),
            total("A", total("B", "C")).paths());
        assertEquals(Arrays.asList(path("A", "B"), path("A", "C")),
            total("A", partial("B", "C")).paths());
        assertEquals(Arrays.asList(path("B"), path("C")),
            partial("B", "C").paths());
        assertEquals(
            Arrays.asList(path("A", "B", "D", "F"), path("A", "C", "D", "F"),
                          path("A", "E", "F")),
            total("A", partial(total(partial("B", "C"), "D"), "E"), "F").paths());
    }

    public void testOrdEquals() {
        assertEquals(total("A", "B", "C"), total("A", "B", "C"));
        assertEquals(partial("A", "B", "C"), partial("A", "B", "C"));
        assertFalse(total("A", "B", "C").equals(total("B", "C")));
        assertFalse(total("B", "C").equals(partial("B", "C")));
        assertFalse(partial("A", "B", "C").equals(partial("B", "C")));
        assertEquals(Ord.name("A"), total("A").members().get(0));
        assertEquals("Total(A, Partial(B, C))", total("A", partial("B", "C")).toString());
    }

    public void testOrdMalformed() {
        try {
            total();
            fail();
        } catch (MalformedPatternException e) {
            // expected
        }
        try {
            partial("A", Integer.valueOf(2));
            fail();
        } catch (MalformedPatternException e) {
            // expected
        }
    }
}
