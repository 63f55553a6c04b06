/* @LICENSE@
 */
package org.rxdfa.regex;

import static org.rxdfa.regex.Misc.LS;
import static org.rxdfa.regex.Misc.appendSet;
import static org.rxdfa.regex.Misc.clear;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import org.rxdfa.regex.AST.Visitor.TraversalOrder;

/**
 *
 * Uninstantiable class which serves as a source container for the static
 * classes and static methods used the construction of annotated syntax trees.
 * <p>
 * The node family is closed: {@link Leaf}, {@link Cat}, {@link Alt} and
 * {@link Star}, all with private constructors. Every node computes its
 * nullable, firstpos and lastpos attributes when it is constructed, from the
 * already complete attributes of its children.
 *
 * @author ndw
 *
 */
final class AST {

    private static final SortedSet<Integer> NO_POSITIONS =
        Collections.unmodifiableSortedSet(new TreeSet<Integer>());

    static abstract class Node {

        final boolean nullable;
        final SortedSet<Integer> firstpos;
        final SortedSet<Integer> lastpos;

        private Node(boolean nullable,
                SortedSet<Integer> firstpos, SortedSet<Integer> lastpos) {
            this.nullable = nullable;
            this.firstpos = firstpos;
            this.lastpos = lastpos;
        }

        final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

                private int nspace = 0;

                @Override
                protected void visit(Node node) {
                    for (int i = 0; i < nspace; ++i) {
                        sb.append(' ');
                    }
                    super.visit(node);
                }

                @Override
                protected void visit(NonTerminal node) {
                    sb.append(label(node));
                    appendAttributes(node);
                    nspace += 4;
                    super.visit(node);
                    for (Node child : node.children()) {
                        visit(child);
                    }
                    nspace -= 4;
                }

                @Override
                protected void visit(Leaf node) {
                    sb.append(node.toString()).append(' ')
                        .append('[').append(node.position).append(']');
                    appendAttributes(node);
                }

                private void appendAttributes(Node node) {
                    sb.append(' ');
                    appendSet(sb, node.firstpos).append(' ');
                    appendSet(sb, node.lastpos);
                    if (node.nullable) sb.append(" nullable");
                    sb.append(LS);
                }

                private String label(NonTerminal node) {
                    if (node instanceof Cat) return "&";
                    if (node instanceof Alt) return "|";
                    return "*";
                }
            }.visit(this);
            return sb.toString();
        }

        /**
         * The equals relation is always the identity relation for all Node
         * subclasses.
         */
        @Override
        public final boolean equals(Object o) {
            return super.equals(o);
        }
        @Override
        public final int hashCode() {
            return super.hashCode();
        }

        /**
         * Renders the subtree as a pattern, with the parenthesis needed to
         * read it back as the same tree shape.
         */
        @Override
        public String toString() {

            return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

                private final StringBuilder sb = new StringBuilder();

                @Override
                public String toString() {
                    clear(sb);
                    visit(Node.this);
                    return sb.toString();
                }

                @Override
                protected void visit(Cat node) {
                    visitGrouped(node.first, node.first instanceof Alt);
                    visitGrouped(node.second, node.second instanceof Alt);
                }

                @Override
                protected void visit(Alt node) {
                    visit(node.first);
                    sb.append('|');
                    visit(node.second);
                }

                @Override
                protected void visit(Star node) {
                    visitGrouped(node.child, !(node.child instanceof Leaf));
                    sb.append('*');
                }

                @Override
                protected void visit(Leaf node) {
                    sb.append(node.toString());
                }

                private void visitGrouped(Node child, boolean paren) {
                    if (paren) sb.append('(');
                    visit(child);
                    if (paren) sb.append(')');
                }
            }.toString();
        }
    }

    static final class Leaf extends Node {

        final char symbol;
        final int position;
        final boolean epsilon;

        private Leaf(char symbol, int position) {
            super(false, singleton(position), singleton(position));
            this.symbol = symbol;
            this.position = position;
            this.epsilon = false;
        }

        /*
         * epsilon: a position of its own, but never the first or last of
         * anything.
         */
        private Leaf(int position) {
            super(true, NO_POSITIONS, NO_POSITIONS);
            this.symbol = RegexCompiler.EPSILON;
            this.position = position;
            this.epsilon = true;
        }

        boolean isEndMarker() {
            return !epsilon && symbol == RegexCompiler.END_MARKER;
        }

        @Override
        public String toString() {
            if (epsilon) return String.valueOf(symbol);
            return Token.literal(symbol).toString();
        }
    }

    static abstract class NonTerminal extends Node {

        private NonTerminal(boolean nullable,
                SortedSet<Integer> firstpos, SortedSet<Integer> lastpos) {
            super(nullable, firstpos, lastpos);
        }

        abstract Node[] children();
    }

    static final class Star extends NonTerminal {

        final Node child;

        private Star(Node child) {
            super(true, child.firstpos, child.lastpos);
            this.child = child;
        }

        @Override
        Node[] children() {
            return new Node[] {child};
        }
    }

    static abstract class Binary extends NonTerminal {

        final Node first, second;

        private Binary(Node first, Node second, boolean nullable,
                SortedSet<Integer> firstpos, SortedSet<Integer> lastpos) {
            super(nullable, firstpos, lastpos);
            this.first = first;
            this.second = second;
        }

        @Override
        final Node[] children() {
            return new Node[] {first, second};
        }
    }

    static final class Cat extends Binary {

        private Cat(Node first, Node second) {
            super(first, second,
                first.nullable && second.nullable,
                first.nullable
                    ? union(first.firstpos, second.firstpos)
                    : first.firstpos,
                second.nullable
                    ? union(second.lastpos, first.lastpos)
                    : second.lastpos);
        }
    }

    static final class Alt extends Binary {

        private Alt(Node first, Node second) {
            super(first, second,
                first.nullable || second.nullable,
                union(first.firstpos, second.firstpos),
                union(first.lastpos, second.lastpos));
        }
    }

    static abstract class Visitor {

        enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        protected void visit(Node node) {
            if (node instanceof NonTerminal) {
                visit((NonTerminal) node);
            } else if (node instanceof Leaf) {
                visit((Leaf) node);
            } else {
                error(node);
            }
        }

        protected void visit(NonTerminal node) {
            if (order == TraversalOrder.BOTTOM_UP) {
                for (Node n : node.children()) {
                    visit(n);
                }
            }
            if (node instanceof Cat) {
                visit((Cat) node);
            } else if (node instanceof Alt) {
                visit((Alt) node);
            } else if (node instanceof Star) {
                visit((Star) node);
            } else {
                error(node);
            }
            if (order == TraversalOrder.TOP_DOWN) {
                for (Node n : node.children()) {
                    visit(n);
                }
            }
        }

        protected void visit(Cat node) {}
        protected void visit(Alt node) {}
        protected void visit(Star node) {}

        protected void visit(Leaf node) {}

        private static void error(Node node) {
            assert false : "unknown node type " + node;
        }
    }

    /*
     * static factories of convenience for the tree builder and testing
     */

    static Leaf leaf(char symbol, int position) {
        return new Leaf(symbol, position);
    }

    static Leaf epsilon(int position) {
        return new Leaf(position);
    }

    static Cat cat(Node first, Node second) {
        return new Cat(first, second);
    }

    static Alt alt(Node first, Node second) {
        return new Alt(first, second);
    }

    static Star star(Node child) {
        return new Star(child);
    }

    private static SortedSet<Integer> singleton(int position) {
        return Collections.unmodifiableSortedSet(
            new TreeSet<Integer>(Collections.singleton(position)));
    }

    private static SortedSet<Integer> union(SortedSet<Integer> lhs, SortedSet<Integer> rhs) {
        if (rhs.isEmpty()) return lhs;
        if (lhs.isEmpty()) return rhs;
        SortedSet<Integer> ret = new TreeSet<Integer>(lhs);
        ret.addAll(rhs);
        return Collections.unmodifiableSortedSet(ret);
    }

    private AST() {}    // uninstantiable
}
