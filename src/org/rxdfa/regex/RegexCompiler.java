/* @LICENSE@
 */

package org.rxdfa.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a pattern string into a postfix (reverse polish) token sequence.
 * <p>
 * Tokenizing inserts the implicit concatenation operators and rewrites
 * {@code X+} as {@code X.X*}; the shunting-yard pass then orders the tokens
 * so the syntax tree can be built with a single stack. Instances hold the
 * state of one compilation and are not thread safe; use a new instance per
 * pattern.
 */
final class RegexCompiler {

    private static final Logger logger = Logger.getLogger("org.rxdfa.regex");
    private static final Level level = Level.FINEST;

    static final char END_MARKER = '#';
    static final char EPSILON = '\u03b5';
    static final char ESCAPE = '\\';

    /*
     * binary operators only: star and optional bind tightest and never
     * touch the operator stack.
     */
    private static final Map<Token, Integer> PRECEDENCE;
    static {
        Map<Token, Integer> map = new HashMap<Token, Integer>();
        map.put(Token.UNION, 1);
        map.put(Token.CONCAT, 2);
        PRECEDENCE = Collections.unmodifiableMap(map);
    }

    private String pattern;

    List<Token> compileToPostfix(String pattern) {
        return compileToPostfix(pattern, false);
    }

    /**
     * @param appendEndMarker
     *            if the pattern has no end marker, group it and append one,
     *            so the marker follows every alternative.
     */
    List<Token> compileToPostfix(String pattern, boolean appendEndMarker) {
        List<Token> tokens = tokenize(pattern);
        if (appendEndMarker && !tokens.contains(Token.END_MARKER)) {
            tokens = endMarked(tokens);
        }
        if (!tokens.contains(Token.END_MARKER)) {
            throw new CompileException.Structural(
                "Pattern is missing the end marker '" + END_MARKER + "'", pattern);
        }
        List<Token> postfix = toPostfix(tokens);
        logger.log(level, "postfix: " + postfix);
        return postfix;
    }

    /**
     * Tokenizes the pattern, with implicit concatenations made explicit and
     * every one-or-more operator expanded.
     */
    List<Token> tokenize(String pattern) {

        this.pattern = pattern;
        final List<Token> out = new ArrayList<Token>();
        int endMarkerAt = -1;

        for (int i = 0; i < pattern.length(); ++i) {

            if (endMarkerAt != -1) {
                tokenizeError(
                    "End marker '" + END_MARKER + "' must be the last character",
                    endMarkerAt);
            }
            char c = pattern.charAt(i);

            switch (c) {

            case ESCAPE:
                if (++i == pattern.length()) {
                    tokenizeError("Unclosed escape sequence at end of pattern", i - 1);
                }
                c = pattern.charAt(i);
                if (c == END_MARKER) {
                    tokenizeError(
                        "End marker '" + END_MARKER + "' cannot be escaped", i);
                }
                atom(out, Token.literal(c));
                break;

            case '(':
                if (concatNeeded(out)) out.add(Token.CONCAT);
                out.add(Token.OPEN);
                break;

            case ')':
                out.add(Token.CLOSE);
                break;

            case '|':
                out.add(Token.UNION);
                break;

            case '.':
                out.add(Token.CONCAT);
                break;

            case '*':
                out.add(Token.STAR);
                break;

            case '?':
                out.add(Token.QUESTION);
                break;

            case '+':
                expandPlus(out, i);
                break;

            case EPSILON:
                atom(out, Token.EPSILON);
                break;

            case END_MARKER:
                atom(out, Token.END_MARKER);
                endMarkerAt = i;
                break;

            default:
                if (!Character.isLetterOrDigit(c)) {
                    tokenizeError("Unrecognized character '" + c + "'", i);
                }
                atom(out, Token.literal(c));
                break;
            }
        }
        return out;
    }

    /*
     * (tokens).# - the groups must balance before the outer one goes on.
     */
    private List<Token> endMarked(List<Token> tokens) {
        List<Token> out = new ArrayList<Token>(tokens.size() + 4);
        if (!tokens.isEmpty()) {
            checkGroups(tokens);
            out.add(Token.OPEN);
            out.addAll(tokens);
            out.add(Token.CLOSE);
            out.add(Token.CONCAT);
        }
        out.add(Token.END_MARKER);
        return out;
    }

    private void checkGroups(List<Token> tokens) {
        int depth = 0;
        for (Token t : tokens) {
            if (t.equals(Token.OPEN)) {
                ++depth;
            } else if (t.equals(Token.CLOSE) && --depth < 0) {
                throw new CompileException.Structural("Unmatched closing ')'", pattern);
            }
        }
        if (depth != 0) {
            throw new CompileException.Structural("Unclosed group", pattern);
        }
    }

    /*
     * the pattern text tokens would be compiled from, end marker included
     */
    static String endMarked(String pattern) {
        if (pattern.length() == 0) return String.valueOf(END_MARKER);
        if (pattern.charAt(pattern.length() - 1) == END_MARKER) return pattern;
        return "(" + pattern + ")" + END_MARKER;
    }

    /*
     * an atom after another operand gets an implicit concatenation
     */
    private static void atom(List<Token> out, Token token) {
        if (concatNeeded(out)) out.add(Token.CONCAT);
        out.add(token);
    }

    private static boolean concatNeeded(List<Token> out) {
        if (out.isEmpty()) return false;
        Token prev = out.get(out.size() - 1);
        return prev.isAtom() || prev.isPostfixUnary() || prev.equals(Token.CLOSE);
    }

    /*
     * X+ --> X.X*, where X is either the single preceding literal or the
     * complete preceding group.
     */
    private void expandPlus(List<Token> out, int index) {
        Token prev = out.isEmpty() ? null : out.get(out.size() - 1);
        if (prev != null && prev.equals(Token.CLOSE)) {
            int open = matchingOpen(out, out.size() - 1);
            if (open == -1) {
                throw new CompileException.Structural("Unmatched closing ')'", pattern);
            }
            List<Token> group = new ArrayList<Token>(out.subList(open + 1, out.size() - 1));
            out.add(Token.CONCAT);
            out.add(Token.OPEN);
            out.addAll(group);
            out.add(Token.CLOSE);
            out.add(Token.STAR);
        } else if (prev != null && prev.isAtom()) {
            out.add(Token.CONCAT);
            out.add(prev);
            out.add(Token.STAR);
        } else {
            throw new CompileException.Operator(
                "Dangling meta character '" + Token.PLUS.value + "'", pattern, index);
        }
    }

    /*
     * Scans backwards from the ')' at index close for the first unmatched '('.
     */
    private static int matchingOpen(List<Token> tokens, int close) {
        assert tokens.get(close).equals(Token.CLOSE);
        int depth = 0;
        for (int j = close - 1; j >= 0; --j) {
            Token t = tokens.get(j);
            if (t.equals(Token.CLOSE)) {
                ++depth;
            } else if (t.equals(Token.OPEN)) {
                if (depth == 0) return j;
                --depth;
            }
        }
        return -1;
    }

    /**
     * Shunting-yard conversion of an infix token sequence.
     */
    List<Token> toPostfix(List<Token> tokens) {

        final List<Token> output = new ArrayList<Token>(tokens.size());
        final Stack<Token> ops = new Stack<Token>();

        for (Token t : tokens) {
            if (t.isAtom() || t.isPostfixUnary()) {
                output.add(t);
            } else if (t.equals(Token.OPEN)) {
                ops.push(t);
            } else if (t.equals(Token.CLOSE)) {
                while (!ops.isEmpty() && !ops.peek().equals(Token.OPEN)) {
                    output.add(ops.pop());
                }
                if (ops.isEmpty()) {
                    throw new CompileException.Structural("Unmatched closing ')'", pattern);
                }
                ops.pop();
            } else {
                assert t.isBinary() : t;
                while (!ops.isEmpty()
                        && !ops.peek().equals(Token.OPEN)
                        && PRECEDENCE.get(t) <= PRECEDENCE.get(ops.peek())) {
                    output.add(ops.pop());
                }
                ops.push(t);
            }
        }
        while (!ops.isEmpty()) {
            Token t = ops.pop();
            if (t.equals(Token.OPEN)) {
                throw new CompileException.Structural("Unclosed group", pattern);
            }
            output.add(t);
        }
        return output;
    }

    private void tokenizeError(String msg, int index) {
        throw new CompileException.Tokenize(msg, pattern, index);
    }
}
