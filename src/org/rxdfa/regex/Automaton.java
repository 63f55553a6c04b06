/*
 * @LICENSE@
 */

package org.rxdfa.regex;

import static org.rxdfa.regex.Misc.LS;
import static org.rxdfa.regex.Misc.appendSet;
import static org.rxdfa.regex.Misc.isSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdfa.regex.AST.Node;
import org.rxdfa.regex.Misc.FlagMgr;

/**
 * A deterministic finite automaton compiled from a regular expression.
 * Instances are immutable and thread safe; one automaton may be shared and
 * {@linkplain #accepts(CharSequence) run} from any number of threads.
 * <p>
 * <strong>Syntax:</strong> letters and digits are literals, {@code |} is
 * alternation, {@code .} is explicit concatenation (adjacent operands are
 * concatenated implicitly), {@code *} is zero or more, {@code +} one or more,
 * {@code ?} zero or one, and parenthesis group. {@code \} makes the next
 * character a literal, whatever it is. An unescaped {@code ε} matches the
 * empty string.
 * <p>
 * <strong>End marker:</strong> the pattern must end with the end marker
 * {@code #}, which may appear nowhere else, not even inside a group, and
 * cannot be escaped; either misuse is a {@link CompileException.Kind#TOKENIZE}
 * error. The states containing its position are the accepting states. With
 * the {@link #APPEND_END_MARKER} flag the compiler appends it instead.
 * <p>
 * The automaton is built directly from the syntax tree of the pattern, using
 * the firstpos and followpos position sets; no NFA is constructed and no
 * minimization is performed. States are numbered from 0 (the initial state)
 * in breadth first discovery order, so compiling the same pattern twice
 * yields {@linkplain #equals(Object) equal} automata.
 */
public final class Automaton {

    private static final Logger logger = Logger.getLogger("org.rxdfa.regex");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * The compiler appends the end marker to the pattern, after grouping it:
     * {@code a|b} compiles as {@code (a|b)#}. A pattern which already ends
     * with the marker does not get a second one.
     */
    public static final int APPEND_END_MARKER = flagMgr.next("APPEND_END_MARKER");

    /**
     * Every character of the pattern is a literal. Implies
     * {@link #APPEND_END_MARKER}; the pattern may not contain the end marker,
     * which cannot be escaped.
     */
    public static final int LITERAL = flagMgr.next("LITERAL");

    /** The end-of-input marker symbol. */
    public static final char END_MARKER = RegexCompiler.END_MARKER;

    /** The epsilon (empty string) symbol. */
    public static final char EPSILON = RegexCompiler.EPSILON;

    /**
     * System property overriding the ceiling on the number of states of one
     * automaton.
     */
    public static final String MAX_STATE_COUNT_PROPERTY = "org.rxdfa.regex.maxStateCount";

    private static final int NO_STATE = -1;

    private final String pattern;
    private final int flags;
    private final SortedSet<Character> alphabet;
    private final List<SortedSet<Integer>> positions;
    private final char[][] symbols;     // per state, ascending
    private final int[][] targets;      // parallel to symbols
    private final boolean[] accept;

    private Automaton(String pattern, int flags, DFA dfa) {
        this.pattern = pattern;
        this.flags = flags;
        this.alphabet = dfa.sigma;

        List<DFA.State> states = dfa.states();
        int n = states.size();
        List<SortedSet<Integer>> sets = new ArrayList<SortedSet<Integer>>(n);
        symbols = new char[n][];
        targets = new int[n][];
        accept = new boolean[n];
        for (DFA.State state : states) {
            DFA.Arc[] arcs = state.arcs();
            symbols[state.id] = new char[arcs.length];
            targets[state.id] = new int[arcs.length];
            for (int i = 0; i < arcs.length; ++i) {
                symbols[state.id][i] = arcs[i].symbol;
                targets[state.id][i] = arcs[i].ns.id;
            }
            accept[state.id] = state.accept;
            sets.add(state.positions);
        }
        this.positions = Collections.unmodifiableList(sets);
    }

    public static Automaton compile(String pattern) {
        return compile(pattern, 0);
    }

    /**
     * Compiles a pattern with the given flags.
     *
     * @param pattern
     *            the regular expression to be compiled.
     * @param flags
     *            a bit mask of {@link #APPEND_END_MARKER} and
     *            {@link #LITERAL}.
     * @return the automaton.
     * @throws CompileException
     *             if the pattern is malformed or its automaton would exceed
     *             the state count ceiling.
     * @throws IllegalArgumentException
     *             for unknown flags.
     */
    public static Automaton compile(String pattern, int flags) {
        return compile(pattern, flags, maxStateCount());
    }

    static Automaton compile(String pattern, int flags, int maxStateCount) {

        flagMgr.check(flags);
        String regex = isSet(flags, LITERAL) ? quote(pattern) : pattern;
        boolean append = isSet(flags, APPEND_END_MARKER | LITERAL);
        logger.log(level, "pattern: " + regex);
        logger.log(level, "flags: " + flagMgr.stringFrom(flags));

        List<Token> postfix = new RegexCompiler().compileToPostfix(regex, append);
        Node root = new TreeBuilder(regex).build(postfix);
        if (logger.isLoggable(level)) {
            logger.log(level, "tree:" + LS + root.toTreeString());
        }
        SortedMap<Integer, SortedSet<Integer>> followpos = Followpos.compute(root);
        if (logger.isLoggable(level)) {
            logger.log(level, Misc.stringFrom("followpos", followpos));
        }
        DFA dfa = new DFA(root, followpos, Followpos.leafSymbols(root), maxStateCount);
        return new Automaton(
            append ? RegexCompiler.endMarked(regex) : regex, flags, dfa);
    }

    public static boolean matches(String pattern, CharSequence input) {
        return compile(pattern).accepts(input);
    }

    /**
     * Escapes every character of s, so that it compiles as a literal string.
     */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(2 * s.length());
        for (int i = 0; i < s.length(); ++i) {
            sb.append(RegexCompiler.ESCAPE).append(s.charAt(i));
        }
        return sb.toString();
    }

    private static int maxStateCount() {
        return Integer.getInteger(MAX_STATE_COUNT_PROPERTY, DFA.MAX_STATE_COUNT);
    }

    /**
     * Runs the automaton over the whole input. The run stops at the first
     * character without a transition, symbols outside the alphabet included.
     *
     * @return true if the input is accepted.
     */
    public boolean accepts(CharSequence input) {
        if (accept.length == 0) return false;
        int state = 0;
        for (int i = 0; i < input.length(); ++i) {
            state = delta(state, input.charAt(i));
            if (state == NO_STATE) return false;
        }
        return accept[state];
    }

    private int delta(int state, char c) {
        int i = Arrays.binarySearch(symbols[state], c);
        return i < 0 ? NO_STATE : targets[state][i];
    }

    /**
     * @return the next state id, or -1 when there is no transition.
     */
    public int next(int state, char c) {
        checkState(state);
        return delta(state, c);
    }

    public int stateCount() {
        return accept.length;
    }

    /**
     * The symbols the automaton has transitions on; never contains the end
     * marker.
     */
    public SortedSet<Character> alphabet() {
        return alphabet;
    }

    /**
     * The leaf positions of the pattern which make up a state.
     */
    public SortedSet<Integer> positions(int state) {
        checkState(state);
        return positions.get(state);
    }

    public boolean isAccepting(int state) {
        checkState(state);
        return accept[state];
    }

    public SortedSet<Integer> acceptStates() {
        SortedSet<Integer> ret = new TreeSet<Integer>();
        for (int s = 0; s < accept.length; ++s) {
            if (accept[s]) ret.add(s);
        }
        return Collections.unmodifiableSortedSet(ret);
    }

    /**
     * A snapshot of the transition table: state id to symbol to next state id.
     * States without transitions map to an empty table.
     */
    public SortedMap<Integer, SortedMap<Character, Integer>> transitionTable() {
        SortedMap<Integer, SortedMap<Character, Integer>> ret =
            new TreeMap<Integer, SortedMap<Character, Integer>>();
        for (int s = 0; s < symbols.length; ++s) {
            SortedMap<Character, Integer> row = new TreeMap<Character, Integer>();
            for (int i = 0; i < symbols[s].length; ++i) {
                row.put(symbols[s][i], targets[s][i]);
            }
            ret.put(s, Collections.unmodifiableSortedMap(row));
        }
        return Collections.unmodifiableSortedMap(ret);
    }

    /**
     * The pattern as compiled, including the end marker.
     */
    public String pattern() {
        return pattern;
    }

    public int flags() {
        return flags;
    }

    private void checkState(int state) {
        if (state < 0 || state >= accept.length) {
            throw new IndexOutOfBoundsException("no state " + state);
        }
    }

    /**
     * Renders the states, their position sets and their transitions, one
     * state per block.
     */
    public String toTableString() {
        StringBuilder sb = new StringBuilder();
        sb.append("states: ").append(stateCount())
            .append(" accept: ");
        appendSet(sb, acceptStates()).append(LS);
        for (int s = 0; s < symbols.length; ++s) {
            sb.append("state ").append(s).append(' ');
            appendSet(sb, positions.get(s));
            if (accept[s]) sb.append(" (accept)");
            sb.append(LS);
            for (int i = 0; i < symbols[s].length; ++i) {
                sb.append("    ").append(Token.literal(symbols[s][i]))
                    .append(" -> ").append(targets[s][i]).append(LS);
            }
        }
        return sb.toString();
    }

    /**
     * Two automata are equal when their transition tables and accepting
     * states are the same, state ids included.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Automaton)) return false;
        Automaton that = (Automaton) o;
        return Arrays.equals(accept, that.accept)
            && Arrays.deepEquals(symbols, that.symbols)
            && Arrays.deepEquals(targets, that.targets);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(accept) + Arrays.deepHashCode(targets);
    }

    @Override
    public String toString() {
        return pattern;
    }
}
