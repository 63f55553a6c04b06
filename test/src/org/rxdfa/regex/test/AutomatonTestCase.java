/* @LICENSE@
 */

package org.rxdfa.regex.test;

import static org.rxdfa.regex.DfaAssert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.rxdfa.regex.AbstractRxTestCase;
import org.rxdfa.regex.Automaton;
import org.rxdfa.regex.CompileException;

public class AutomatonTestCase extends AbstractRxTestCase {

    private static final String LS = System.getProperty("line.separator");

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AutomatonTestCase.class);
    }

    public AutomatonTestCase(String name) {
        super(name);
    }

    private static CompileException assertFails(String pattern, CompileException.Kind kind) {
        try {
            Automaton.compile(pattern);
            fail("should throw: " + pattern);
            return null;
        } catch (CompileException e) {
            assertEquals(e.getMessage(), kind, e.kind());
            return e;
        }
    }

    public void testTextbook() {
        Automaton a = Automaton.compile("(a|b)*abb#");
        assertAccepts(a, "abb", "aabb", "babb", "ababb");
        assertRejects(a, "", "ab", "abbb", "ba");
        assertEquals(4, a.stateCount());
        assertEquals("[3]", a.acceptStates().toString());
    }

    public void testPlus() {
        Automaton a = Automaton.compile("a+#");
        assertAccepts(a, "a", "aa", "aaaa");
        assertRejects(a, "", "b", "ab");
    }

    public void testSingleLiteral() {
        Automaton a = Automaton.compile("a#");
        assertAccepts(a, "a");
        assertRejects(a, "", "aa");
    }

    public void testEscapedOperator() {
        Automaton a = Automaton.compile("a\\*b#");
        assertAccepts(a, "a*b");
        assertRejects(a, "ab", "aab", "a**b");
        assertTrue(a.alphabet().contains('*'));
    }

    public void testUnknownSymbolsReject() {
        Automaton a = Automaton.compile("(a|b)*abb#");
        assertRejects(a, "c", "abbc", "xabb", "ab b", "#", "abb#");
    }

    public void testPlusIsXDotXStar() {
        String[] bases = { "a", "(ab)", "(a|b)", "(a*b)", "(a|bc)", "(ab?)" };
        for (String x : bases) {
            assertSameLanguage(
                Automaton.compile(x + "." + x + "*#"),
                Automaton.compile(x + "+#"),
                "abc", 6);
        }
    }

    public void testOptional() {
        Automaton a = Automaton.compile("ab?c#");
        assertAccepts(a, "ac", "abc");
        assertRejects(a, "abbc", "bc", "a");
    }

    public void testEpsilon() {
        Automaton a = Automaton.compile("a(b|ε)#");
        assertAccepts(a, "a", "ab");
        assertRejects(a, "", "b", "abb");
        assertSameLanguage(Automaton.compile("ab?#"), a, "ab", 4);

        a = Automaton.compile("ε#");
        assertAccepts(a, "");
        assertRejects(a, "a", "ε");
    }

    public void testEndMarkerOnly() {
        Automaton a = Automaton.compile("#");
        assertEquals(1, a.stateCount());
        assertTrue(a.alphabet().isEmpty());
        assertAccepts(a, "");
        assertRejects(a, "a", "#");
    }

    public void testExplicitConcatenation() {
        assertEquals(Automaton.compile("abc#"), Automaton.compile("a.b.c#"));
        assertEquals(Automaton.compile("(a|b)c#"), Automaton.compile("(a|b).c#"));
    }

    public void testStarOfNullable() {
        Automaton a = Automaton.compile("(a*|b)*#");
        assertAccepts(a, "", "a", "b", "abba", "bbbb");
        assertAllReachable(a);
    }

    public void testDeterministicNumbering() {
        String pattern = "((ab|c)*d?|e+f)(g|hi)*#";
        Automaton a1 = Automaton.compile(pattern);
        Automaton a2 = Automaton.compile(pattern);
        assertNotSame(a1, a2);
        assertEquals(a1, a2);
        assertEquals(a1.hashCode(), a2.hashCode());
        assertEquals(a1.transitionTable(), a2.transitionTable());
        assertEquals(a1.toTableString(), a2.toTableString());
        assertFalse(a1.equals(Automaton.compile("(a|b)*abb#")));
    }

    public void testAllStatesReachable() {
        assertAllReachable(Automaton.compile("(a|b)*abb#"));
        assertAllReachable(Automaton.compile("((ab|c)*d?|e+f)(g|hi)*#"));
        assertAllReachable(Automaton.compile("(a|b)*a(a|b)(a|b)#"));
    }

    public void testStateQueries() {
        Automaton a = Automaton.compile("(a|b)*abb#");
        assertEquals(1, a.next(0, 'a'));
        assertEquals(0, a.next(0, 'b'));
        assertEquals(3, a.next(2, 'b'));
        assertEquals(-1, a.next(0, 'c'));
        assertEquals("[1, 2, 3, 6]", a.positions(3).toString());
        assertTrue(a.isAccepting(3));
        assertFalse(a.isAccepting(0));
        assertEquals("[a, b]", a.alphabet().toString());
        try {
            a.next(4, 'a');
            fail("no state 4");
        } catch (IndexOutOfBoundsException e) {
            assertTrue(e.getMessage().contains("4"));
        }
        try {
            a.positions(-1);
            fail("no state -1");
        } catch (IndexOutOfBoundsException e) {
        }
    }

    public void testTransitionTableIsSnapshot() {
        Automaton a = Automaton.compile("a#");
        assertEquals("{0={a=1}, 1={}}", a.transitionTable().toString());
        try {
            a.transitionTable().get(0).put('b', 0);
            fail("should be unmodifiable");
        } catch (UnsupportedOperationException e) {
        }
    }

    public void testToTableString() {
        String expected =
            "states: 2 accept: {1}" + LS +
            "state 0 {1}" + LS +
            "    a -> 1" + LS +
            "state 1 {2} (accept)" + LS;
        assertEquals(expected, Automaton.compile("a#").toTableString());
    }

    public void testMatches() {
        assertTrue(Automaton.matches("(a|b)*abb#", "babb"));
        assertFalse(Automaton.matches("(a|b)*abb#", "bab"));
    }

    public void testTokenizeErrors() {
        CompileException e = assertFails("a$b#", CompileException.Kind.TOKENIZE);
        assertEquals(1, e.getIndex());
        assertEquals("a$b#", e.getPattern());
        assertEquals(2, assertFails("ab#c", CompileException.Kind.TOKENIZE).getIndex());
        assertEquals(1, assertFails("a\\", CompileException.Kind.TOKENIZE).getIndex());
    }

    public void testOperatorErrors() {
        CompileException e = assertFails("+a#", CompileException.Kind.OPERATOR);
        assertEquals(0, e.getIndex());
        assertEquals("+a#", e.getPattern());
        assertEquals(1, assertFails("|+#", CompileException.Kind.OPERATOR).getIndex());
    }

    public void testStructuralErrors() {
        assertFails("(a|b#", CompileException.Kind.STRUCTURAL);
        assertFails("a)#", CompileException.Kind.STRUCTURAL);
        assertFails("a||b#", CompileException.Kind.STRUCTURAL);
        assertFails("ab", CompileException.Kind.STRUCTURAL);
        assertFails("*#", CompileException.Kind.STRUCTURAL);
        assertFails("", CompileException.Kind.STRUCTURAL);
    }

    public void testErrorsArePatternSyntaxExceptions() {
        try {
            Automaton.compile("a||b#");
            fail();
        } catch (java.util.regex.PatternSyntaxException e) {
            assertTrue(e instanceof CompileException);
            assertEquals("a||b#", e.getPattern());
        }
    }

    public void testStateLimitProperty() {
        String saved = System.getProperty(Automaton.MAX_STATE_COUNT_PROPERTY);
        System.setProperty(Automaton.MAX_STATE_COUNT_PROPERTY, "4");
        try {
            assertEquals(4, Automaton.compile("(a|b)*abb#").stateCount());
            CompileException e = assertFails(
                "(a|b)*a(a|b)(a|b)#", CompileException.Kind.STATE_LIMIT);
            assertEquals(4, ((CompileException.StateLimit) e).limit());
        } finally {
            if (saved == null) {
                System.clearProperty(Automaton.MAX_STATE_COUNT_PROPERTY);
            } else {
                System.setProperty(Automaton.MAX_STATE_COUNT_PROPERTY, saved);
            }
        }
        assertEquals(8, Automaton.compile("(a|b)*a(a|b)(a|b)#").stateCount());
    }

    public void testAppendEndMarker() {
        Automaton a = Automaton.compile("(a|b)*abb", Automaton.APPEND_END_MARKER);
        assertEquals("((a|b)*abb)#", a.pattern());
        assertEquals(Automaton.APPEND_END_MARKER, a.flags());
        assertEquals(Automaton.compile("(a|b)*abb#"), a);

        // never a second marker
        a = Automaton.compile("a#", Automaton.APPEND_END_MARKER);
        assertEquals("a#", a.pattern());
        assertAccepts(a, "a");

        // the marker ends every alternative
        a = Automaton.compile("a|bc", Automaton.APPEND_END_MARKER);
        assertAccepts(a, "a", "bc");
        assertRejects(a, "", "b", "abc");
        assertAccepts(Automaton.compile("a|bc#"), "bc");
        assertRejects(Automaton.compile("a|bc#"), "a");

        a = Automaton.compile("", Automaton.APPEND_END_MARKER);
        assertEquals("#", a.pattern());
        assertAccepts(a, "");
        assertRejects(a, "a");
    }

    private static CompileException assertAppendFails(String pattern, CompileException.Kind kind) {
        try {
            Automaton.compile(pattern, Automaton.APPEND_END_MARKER);
            fail("should throw: " + pattern);
            return null;
        } catch (CompileException e) {
            assertEquals(e.getMessage(), kind, e.kind());
            assertEquals(pattern, e.getPattern());
            return e;
        }
    }

    public void testAppendEndMarkerKeepsErrors() {
        // the added group may not balance the caller's parentheses
        assertAppendFails("a)(b", CompileException.Kind.STRUCTURAL);
        assertAppendFails("a(b", CompileException.Kind.STRUCTURAL);
        assertAppendFails("a)", CompileException.Kind.STRUCTURAL);
        assertAppendFails("(a|b", CompileException.Kind.STRUCTURAL);
        assertFails("a)(b#", CompileException.Kind.STRUCTURAL);

        // a truncated escape stays truncated
        assertEquals(1,
            assertAppendFails("a\\", CompileException.Kind.TOKENIZE).getIndex());
        // and an escaped marker is still no marker
        assertEquals(3,
            assertAppendFails("ab\\#", CompileException.Kind.TOKENIZE).getIndex());
        assertEquals(0,
            assertAppendFails("+a", CompileException.Kind.OPERATOR).getIndex());
    }

    public void testLiteral() {
        Automaton a = Automaton.compile("a*(b)", Automaton.LITERAL);
        assertEquals("(\\a\\*\\(\\b\\))#", a.pattern());
        assertAccepts(a, "a*(b)");
        assertRejects(a, "aa(b)", "(b)", "a*b");
        assertEquals(Automaton.compile(Automaton.quote("a*(b)") + "#"), a);

        // the marker cannot be quoted
        assertEquals(CompileException.Kind.TOKENIZE, assertLiteralFails("a#"));
        assertEquals(CompileException.Kind.TOKENIZE, assertLiteralFails("#"));
    }

    private static CompileException.Kind assertLiteralFails(String s) {
        try {
            Automaton.compile(s, Automaton.LITERAL);
            fail("should throw: " + s);
            return null;
        } catch (CompileException e) {
            return e.kind();
        }
    }

    public void testUnknownFlags() {
        try {
            Automaton.compile("a#", 0x80 | Automaton.LITERAL);
            fail("unknown flag");
        } catch (IllegalArgumentException e) {
            assertEquals("unknown flags: 0x80", e.getMessage());
        }
        // every defined flag is accepted, alone or together
        int both = Automaton.APPEND_END_MARKER | Automaton.LITERAL;
        assertEquals(both, Automaton.compile("a", both).flags());
    }

    public void testSharedAcrossThreads() throws Exception {
        final Automaton a = Automaton.compile("(a|b)*abb#");
        final List<String> inputs = stringsOver("ab", 8);
        final boolean[] expected = new boolean[inputs.size()];
        for (int i = 0; i < expected.length; ++i) {
            expected[i] = inputs.get(i).endsWith("abb");
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> results = new ArrayList<Future<Integer>>();
            for (int t = 0; t < 8; ++t) {
                results.add(pool.submit(new Callable<Integer>() {
                    public Integer call() {
                        int mismatches = 0;
                        for (int i = 0; i < expected.length; ++i) {
                            if (a.accepts(inputs.get(i)) != expected[i]) ++mismatches;
                        }
                        return mismatches;
                    }
                }));
            }
            for (Future<Integer> f : results) {
                assertEquals(0, f.get().intValue());
            }
        } finally {
            pool.shutdown();
        }
    }
}
