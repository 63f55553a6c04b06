/* @LICENSE@
 */
package org.rxdfa.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Unchecked exception thrown when a pattern cannot be compiled into an
 * {@link Automaton}. Compilation either succeeds completely or throws one of
 * the nested subclasses; no partial automaton is ever returned.
 * <p>
 * Since this class extends {@link PatternSyntaxException}, the
 * {@linkplain #getPattern() pattern}, the
 * {@linkplain #getIndex() index} of the error (-1 when the error has no single
 * position) and a {@linkplain #getDescription() description} are available.
 * The {@link Kind} identifies the stage which failed.
 */
public abstract class CompileException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    /**
     * The compilation stage which detected the error.
     */
    public enum Kind {
        /**
         * Unrecognized character, an escape truncated by the end of the
         * pattern, or a misplaced end marker: one that is escaped, repeated,
         * or followed by anything, a closing group included.
         */
        TOKENIZE,
        /**
         * The one-or-more operator without a preceding operand.
         */
        OPERATOR,
        /**
         * Unbalanced groups, or a postfix sequence which does not reduce to a
         * single syntax tree.
         */
        STRUCTURAL,
        /**
         * The automaton exceeded the configured state count ceiling.
         */
        STATE_LIMIT;
    }

    private final Kind kind;

    private CompileException(Kind kind, String desc, String pattern, int index) {
        super(desc, pattern, index);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static final class Tokenize extends CompileException {

        private static final long serialVersionUID = 1L;

        Tokenize(String desc, String pattern, int index) {
            super(Kind.TOKENIZE, desc, pattern, index);
        }
    }

    public static final class Operator extends CompileException {

        private static final long serialVersionUID = 1L;

        Operator(String desc, String pattern, int index) {
            super(Kind.OPERATOR, desc, pattern, index);
        }
    }

    public static final class Structural extends CompileException {

        private static final long serialVersionUID = 1L;

        Structural(String desc, String pattern) {
            super(Kind.STRUCTURAL, desc, pattern, -1);
        }
    }

    public static final class StateLimit extends CompileException {

        private static final long serialVersionUID = 1L;

        private final int limit;

        StateLimit(String pattern, int limit) {
            super(Kind.STATE_LIMIT, "DFA state count exceeded: " + limit, pattern, -1);
            this.limit = limit;
        }

        public int limit() {
            return limit;
        }
    }
}
