/*@LICENSE@
 */
package org.rxdfa.regex.test;

import java.util.List;
import java.util.logging.LogRecord;

import org.rxdfa.regex.AbstractRxTestCase;
import org.rxdfa.regex.Automaton;

public class LogDemoTestCase extends AbstractRxTestCase {

    private static final String LS = System.getProperty("line.separator");

    private List<LogRecord> records;

    public LogDemoTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        records = logRx();
    }

    private boolean logged(String prefix) {
        synchronized (records) {
            for (LogRecord r : records) {
                if (r.getMessage().startsWith(prefix)) return true;
            }
        }
        return false;
    }

    public void testTextbook() {
        Automaton.compile("(a|b)*abb#");
        assertTrue(logged("pattern: (a|b)*abb#"));
        assertTrue(logged("postfix: "));
        assertTrue(logged("tree:"));
        assertTrue(logged("map: followpos"));
        assertTrue(logged("dfa: total states: 4"));
    }

    public void testFlags() {
        Automaton.compile("a*b", Automaton.APPEND_END_MARKER);
        assertTrue(logged("flags: APPEND_END_MARKER"));
        assertTrue(logged("pattern: a*b"));

        Automaton.compile("b", Automaton.LITERAL | Automaton.APPEND_END_MARKER);
        assertTrue(logged("flags: APPEND_END_MARKER, LITERAL"));
    }

    public void testEpsilonOnly() {
        Automaton.compile("ε", Automaton.APPEND_END_MARKER);
        assertTrue(logged("dfa: total states: 1"));
    }

    public void testOptionalAndEpsilon() {
        Automaton.compile("a?ε#");
        // the ε leaves keep their positions in the tree but never reach the table
        assertTrue(logged("tree:" + LS + "& {1,4} {4}"));
        assertTrue(logged("map: followpos" + LS
            + "    1 --> [4]" + LS
            + "    2 --> []" + LS
            + "    3 --> []" + LS
            + "    4 --> []" + LS));
        assertTrue(logged("dfa: total states: 2 total arcs: 1"));
    }
}
