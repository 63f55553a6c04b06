/*
 * @LICENSE@
 */

package org.rxdfa.regex;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Small helpers shared across the compiler: text rendering, the flag
 * registry, and the graph walk the DFA is built with.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    /*
     * "{1,2,3}" - the label format used for position sets everywhere.
     */
    static StringBuilder appendSet(StringBuilder sb, Iterable<Integer> positions) {
        final int mark = sb.length();
        for (int p : positions) {
            sb.append(sb.length() == mark ? '{' : ',');
            sb.append(p);
        }
        if (sb.length() == mark) sb.append('{');
        return sb.append('}');
    }

    static <K, V> String stringFrom(String title, Map<K, V> map) {
        StringBuilder sb = new StringBuilder();
        sb.append("map: ").append(title).append(LS);
        for (Map.Entry<K, V> e : map.entrySet()) {
            sb.append("    ").append(e.getKey()).append(" --> ")
                .append(e.getValue()).append(LS);
        }
        return sb.toString();
    }

    /**
     * Bit flag registry backing the public flag constants of
     * {@link Automaton}. Flags are handed out in declaration order.
     */
    static final class FlagMgr {

        private final List<String> labels = new ArrayList<String>(4);
        private int defined = 0;

        int next(String label) {
            int flag = 1 << labels.size();
            labels.add(label);
            defined |= flag;
            return flag;
        }

        void check(int flags) {
            int unknown = flags & ~defined;
            if (unknown != 0) {
                throw new IllegalArgumentException(
                    "unknown flags: 0x" + Integer.toHexString(unknown));
            }
        }

        /*
         * "APPEND_END_MARKER, LITERAL"
         */
        String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            for (int n = 0; n < labels.size(); ++n) {
                if (isSet(flags, 1 << n)) {
                    sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                }
            }
            return sb.toString();
        }
    }

    interface Vertex<E extends Edge<?>> {
        Iterable<E> edges();
    }

    interface Edge<V extends Vertex<?>> {
        V vertex();
    }

    /**
     * Breadth first traversal of a graph which may still be under
     * construction: {@link #visit(Vertex)} is called before the edges of the
     * vertex are read, so a subclass can create the edges (and the vertices
     * they lead to) on the fly. Vertices are visited in the order they are
     * first reached.
     */
    static abstract class BreadthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {

        private final Map<V, Void> seen = new IdentityHashMap<V, Void>();
        private final Queue<V> pending = new LinkedList<V>();

        final BreadthFirstVisitor<V, E> start(V init) {
            seen.clear();
            pending.clear();
            reach(init);
            while (!pending.isEmpty()) {
                V vertex = pending.remove();
                visit(vertex);
                for (E edge : vertex.edges()) {
                    reach(edge.vertex());
                }
            }
            return this;
        }

        private void reach(V vertex) {
            if (!seen.containsKey(vertex)) {
                seen.put(vertex, null);
                pending.offer(vertex);
            }
        }

        /**
         * @return the number of vertices reached by the last traversal.
         */
        final int count() {
            return seen.size();
        }

        protected void visit(V vertex) {}
    }
}
