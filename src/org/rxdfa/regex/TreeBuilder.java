/* @LICENSE@
 */
package org.rxdfa.regex;

import java.util.List;
import java.util.Stack;

import org.rxdfa.regex.AST.Node;

/**
 * Builds the annotated syntax tree from a postfix token sequence with a single
 * left to right pass over a stack of subtrees. Leaf positions are handed out
 * from 1 upwards in the order the leaves are created.
 */
final class TreeBuilder {

    private final String pattern;
    private final Stack<Node> kids = new Stack<Node>();
    private int position;

    TreeBuilder(String pattern) {
        this.pattern = pattern;
    }

    Node build(List<Token> postfix) {

        kids.clear();
        position = 0;

        for (Token t : postfix) {
            if (t.equals(Token.EPSILON)) {
                kids.push(AST.epsilon(++position));
            } else if (t.isLiteral()) {
                kids.push(AST.leaf(t.value, ++position));
            } else if (t.equals(Token.STAR)) {
                kids.push(AST.star(pop(t)));
            } else if (t.equals(Token.QUESTION)) {
                // X? == X|ε
                Node child = pop(t);
                kids.push(AST.alt(child, AST.epsilon(++position)));
            } else if (t.equals(Token.CONCAT)) {
                Node second = pop(t);
                Node first = pop(t);
                kids.push(AST.cat(first, second));
            } else if (t.equals(Token.UNION)) {
                Node second = pop(t);
                Node first = pop(t);
                kids.push(AST.alt(first, second));
            } else {
                throw new CompileException.Structural(
                    "Unexpected token in postfix sequence: '" + t + "'", pattern);
            }
        }
        if (kids.size() != 1) {
            throw new CompileException.Structural(
                kids.isEmpty()
                    ? "Empty expression"
                    : "Missing operator: " + kids.size() + " subexpressions left over",
                pattern);
        }
        return kids.pop();
    }

    private Node pop(Token operator) {
        if (kids.isEmpty()) {
            throw new CompileException.Structural(
                "Missing operand for '" + operator + "'", pattern);
        }
        return kids.pop();
    }
}
