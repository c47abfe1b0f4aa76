/* @LICENSE@
 */

package org.xtrees.pattern.test;

import static org.xtrees.pattern.Node.leaf;
import static org.xtrees.pattern.Tree.and;
import static org.xtrees.pattern.Tree.branch;
import static org.xtrees.pattern.Tree.then;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.xtrees.pattern.AbstractPatternTestCase;
import org.xtrees.pattern.Disjunct;
import org.xtrees.pattern.Node;
import org.xtrees.pattern.Op;
import org.xtrees.pattern.Program;
import org.xtrees.pattern.Sibling;
import org.xtrees.pattern.Tree;
import org.xtrees.pattern.UnitRegistry;
import org.xtrees.pattern.Units;

/**
 * Drives the engine through its public API only, on a token type it knows
 * nothing about.
 */
public class ProgramTestCase extends AbstractPatternTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ProgramTestCase.class);
    }

    public ProgramTestCase(String name) {
        super(name);
    }

    /*
     * stand in for an AST node: identity equality, no useful toString
     */
    static final class Token {
        final String kind;
        final String text;
        Token(String kind, String text) {
            this.kind = kind;
            this.text = text;
        }
    }

    private static Token tok(String kind) {
        return new Token(kind, null);
    }

    private static final Units<Token> BY_KIND = new Units<Token>() {
        @Override
        public boolean equivalent(Token a, Token b) {
            return b != null && a.kind.equals(b.kind);
        }
        @Override
        public String display(Token a) {
            return a.kind;
        }
    };

    private static List<Token> tokens(String... kinds) {
        List<Token> ret = new ArrayList<Token>();
        for (String k : kinds) ret.add(new Token(k, k.toLowerCase()));
        return ret;
    }

    public void testTokensByKind() {
        Program<Token> p = Program.compile(
            leaf(tok("Call")), Op.star(Op.lst(tok("Name"), tok("Attr"))), leaf(tok("Args")));
        assertTrue(p.matches(tokens("Call", "Attr", "Name", "Args"), BY_KIND));
        assertTrue(p.matches(tokens("Call", "Args"), BY_KIND));
        assertFalse(p.matches(tokens("Call", "Num", "Args"), BY_KIND));
        assertFalse(p.matches(tokens("Call", "Args")));
        assertTrue(p.toString(BY_KIND).contains("UnitList([Name, Attr])"));
    }

    public void testRegistryForTokens() {
        UnitRegistry registry = new UnitRegistry().register(Token.class, BY_KIND);
        Program<Object> p = Program.compile(
            Node.<Object>leaf(tok("If")), Op.<Object>dot(), Node.<Object>leaf(tok("Else")));
        List<Object> in = new ArrayList<Object>(tokens("If", "Block", "Else"));
        assertTrue(p.matches(in, registry));
        in.add(new Token("Extra", null));
        assertFalse(p.matches(in, registry));
        assertTrue(p.lookingAt(in, registry));
    }

    /*
     * from tree pattern, through constraints, to one program per branch
     */
    public void testDisjunctBranchesCompile() {
        Tree<String> pat = branch(u("Module"), Op.star(u("If")),
            then(u("Assign"), and(u("Call"), branch(u("Return"), Op.qmark(u("Name"))))));
        List<Disjunct<String>> ds = pat.canonicalNf().toExprs();
        assertEquals(1, ds.size());
        Disjunct<String> d = ds.get(0);
        assertEquals(3, d.aliases().size());

        Map<String, Set<String>> dag = d.dag();
        assertEquals(new HashSet<String>(Arrays.asList("B1", "B2")), dag.get("B0"));
        assertEquals(Arrays.asList(Sibling.of(2, "B0", "B1", "B2")), d.siblingGroups());

        Program<String> assign = d.branch("B0").compile();
        assertTrue(assign.matches(seq("Module", "If", "If", "Assign")));
        assertTrue(assign.matches(seq("Module", "Assign")));
        assertFalse(assign.matches(seq("Module", "Call")));

        Program<String> ret = d.branch("B2").compile();
        assertTrue(ret.matches(seq("Module", "Return")));
        assertTrue(ret.matches(seq("Module", "If", "Return", "Name")));
        assertFalse(ret.matches(seq("Module", "Return", "Name", "Name")));
    }

    public void testCompileNeedsNormalForm() {
        Tree.Branch<String> br = branch(u("A"), and(u("B"), u("C")));
        try {
            br.compile();
            fail("nested tree compiled");
        } catch (IllegalStateException e) {
            // expected
        }
        assertNull(branch(u("A"), u("B")).tail());
        assertEquals(and(u("B"), u("C")), br.tail());
    }

    private static List<String> seq(String... values) {
        return Arrays.asList(values);
    }
}
