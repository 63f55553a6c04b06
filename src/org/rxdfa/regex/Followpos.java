/* @LICENSE@
 */
package org.rxdfa.regex;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.rxdfa.regex.AST.Cat;
import org.rxdfa.regex.AST.Leaf;
import org.rxdfa.regex.AST.Node;
import org.rxdfa.regex.AST.Star;
import org.rxdfa.regex.AST.Visitor;
import org.rxdfa.regex.AST.Visitor.TraversalOrder;

/**
 * Static methods deriving the position tables of an annotated syntax tree.
 */
final class Followpos {

    private Followpos() {}  // uninstantiable

    /**
     * Computes followpos for every leaf position of the tree.
     *
     * @param root
     *            the annotated syntax tree.
     * @return an unmodifiable map with an entry, possibly empty, for every
     *         leaf position.
     */
    static SortedMap<Integer, SortedSet<Integer>> compute(Node root) {

        final SortedMap<Integer, SortedSet<Integer>> work =
            new TreeMap<Integer, SortedSet<Integer>>();

        // bottom up: every leaf has its entry before an operator adds to it
        new Visitor(TraversalOrder.BOTTOM_UP) {
            @Override
            protected void visit(Leaf node) {
                work.put(node.position, new TreeSet<Integer>());
            }
            @Override
            protected void visit(Cat node) {
                for (int p : node.first.lastpos) {
                    work.get(p).addAll(node.second.firstpos);
                }
            }
            @Override
            protected void visit(Star node) {
                for (int p : node.child.lastpos) {
                    work.get(p).addAll(node.child.firstpos);
                }
            }
        }.visit(root);

        SortedMap<Integer, SortedSet<Integer>> ret =
            new TreeMap<Integer, SortedSet<Integer>>();
        for (Map.Entry<Integer, SortedSet<Integer>> e : work.entrySet()) {
            ret.put(e.getKey(), Collections.unmodifiableSortedSet(e.getValue()));
        }
        return Collections.unmodifiableSortedMap(ret);
    }

    /**
     * Maps every position which consumes an input character to its symbol.
     * Epsilon leaves consume nothing and are left out.
     */
    static SortedMap<Integer, Character> leafSymbols(Node root) {
        final SortedMap<Integer, Character> ret = new TreeMap<Integer, Character>();
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(Leaf node) {
                if (!node.epsilon) ret.put(node.position, node.symbol);
            }
        }.visit(root);
        return Collections.unmodifiableSortedMap(ret);
    }
}
