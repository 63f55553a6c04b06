/* @LICENSE@
 */


package org.rxdfa.regex;


import static org.rxdfa.regex.Misc.LS;
import static org.rxdfa.regex.Misc.appendSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdfa.regex.AST.Node;
import org.rxdfa.regex.Misc.BreadthFirstVisitor;
import org.rxdfa.regex.Misc.Edge;
import org.rxdfa.regex.Misc.Vertex;


/**
 * The DFA of an annotated syntax tree, built directly from firstpos and
 * followpos: every state is a set of leaf positions, and no NFA is involved.
 */
final class DFA {

    private static final Logger logger = Logger.getLogger("org.rxdfa.regex");
    private static final Level level = Level.FINEST;

    /**
     * An entry in the transition table: a symbol mapped to a next state.
     */
    static final class Arc implements Edge<State> {

        final char symbol;
        final State ns;

        private Arc(char symbol, State ns) {
            this.symbol = symbol;
            this.ns = ns;
        }

        public State vertex() {
            return ns;
        }

        @Override
        public String toString() {
            return Token.literal(symbol) + " -> " + ns.id;
        }
    }

    private static final Arc[] NO_ARCS = new Arc[0];

    static final class State implements Vertex<Arc> {

        final int id;
        final SortedSet<Integer> positions;
        final boolean accept;
        private Arc[] arcs = NO_ARCS;

        private State(int id, SortedSet<Integer> positions, boolean accept) {
            this.id = id;
            this.positions = Collections.unmodifiableSortedSet(
                new TreeSet<Integer>(positions));
            this.accept = accept;
        }

        private void arcs(Arc[] arcs) {
            this.arcs = arcs;
        }

        public Iterable<Arc> edges() {
            return Collections.unmodifiableList(Arrays.asList(arcs));
        }

        Arc[] arcs() {
            return arcs.clone();
        }

        private static final String INDENT = "    ";

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("state ").append(id).append(' ');
            appendSet(sb, positions);
            if (accept) sb.append(" (accept)");
            sb.append(LS);
            for (Arc arc : arcs) {
                sb.append(INDENT).append(arc).append(LS);
            }
            return sb.toString();
        }
    }

    /** The default ceiling on the number of states of one DFA. */
    static final int MAX_STATE_COUNT = 10 * 1000;

    final State init;
    final SortedSet<Character> sigma;
    final int endMarker;
    private final List<State> states = new ArrayList<State>();

    /**
     * Construct a complete DFA from an annotated syntax tree.
     *
     * @param root
     *            the tree; its firstpos is the initial state.
     * @param followpos
     *            followpos of every leaf position.
     * @param leafSymbols
     *            the symbol of every position which consumes input.
     * @param maxStateCount
     *            ceiling on the number of states.
     * @throws CompileException.StateLimit
     *             when construction would need more than maxStateCount states.
     */
    DFA(final Node root,
            final SortedMap<Integer, SortedSet<Integer>> followpos,
            final SortedMap<Integer, Character> leafSymbols,
            final int maxStateCount) {

        int marker = -1;
        final SortedSet<Character> alphabet = new TreeSet<Character>();
        for (Map.Entry<Integer, Character> e : leafSymbols.entrySet()) {
            if (e.getValue() == RegexCompiler.END_MARKER) {
                assert marker == -1 : "more than one end marker";
                marker = e.getKey();
            } else {
                alphabet.add(e.getValue());
            }
        }
        this.endMarker = marker;
        this.sigma = Collections.unmodifiableSortedSet(alphabet);

        if (leafSymbols.isEmpty()) {
            // nothing to consume, nothing to accept
            init = null;
            logger.log(level, "dfa: no leaves, no states");
            return;
        }

        final class StateFactory {

            private final Map<SortedSet<Integer>, State> map =
                new LinkedHashMap<SortedSet<Integer>, State>();

            private State stateFrom(SortedSet<Integer> positions) {
                State state = map.get(positions);
                if (state == null) {
                    if (map.size() >= maxStateCount) {
                        throw new CompileException.StateLimit(
                            root.toString(), maxStateCount);
                    }
                    state = new State(
                        map.size(), positions, positions.contains(endMarker));
                    map.put(state.positions, state);
                    states.add(state);
                }
                return state;
            }
        }
        final StateFactory factory = new StateFactory();

        /*
         * Position set construction as breadth first search. States get their
         * ids when discovered, in alphabet order, which is also the order the
         * search queues them.
         */
        init = factory.stateFrom(root.firstpos);
        new BreadthFirstVisitor<State, Arc>() {

            final SortedSet<Integer> next = new TreeSet<Integer>();
            final List<Arc> arcs = new ArrayList<Arc>();
            int expected = 0;

            /*
             * Create all the arcs for the state already discovered.
             */
            @Override
            protected void visit(State state) {

                assert state.id == expected++ : state;

                arcs.clear();
                for (char a : sigma) {
                    next.clear();
                    for (int p : state.positions) {
                        Character symbol = leafSymbols.get(p);
                        assert symbol != null : "position " + p + " consumes nothing";
                        if (symbol.charValue() == a) {
                            next.addAll(followpos.get(p));
                        }
                    }
                    if (!next.isEmpty()) {
                        arcs.add(new Arc(a, factory.stateFrom(next)));
                    }
                }
                state.arcs(arcs.toArray(new Arc[arcs.size()]));
            }
        }.start(init);

        assert size() == states.size() : "unreachable states";

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + toString());
        }
    }

    /**
     * The states in id order.
     */
    List<State> states() {
        return Collections.unmodifiableList(states);
    }

    /**
     * Counts the states reachable from the initial state.
     */
    int size() {
        if (init == null) return 0;
        return new BreadthFirstVisitor<State, Arc>(){}.start(init).count();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int nArcs = 0;
        for (State state : states) nArcs += state.arcs.length;
        sb
            .append("total states: ").append(states.size())
            .append(" total arcs: ").append(nArcs)
            .append(LS);
        for (State state : states) {
            sb.append(state);
        }
        return sb.toString();
    }
}
