/* @LICENSE@
 */
package org.rxdfa.regex;

/**
 * A single character of a tokenized pattern, flagged as either an operator
 * (meta character) or a literal. Tokens are values: two tokens with the same
 * character and the same flag are equal.
 */
final class Token {

    static final Token UNION    = new Token('|', true);
    static final Token CONCAT   = new Token('.', true);
    static final Token STAR     = new Token('*', true);
    static final Token PLUS     = new Token('+', true);
    static final Token QUESTION = new Token('?', true);
    static final Token OPEN     = new Token('(', true);
    static final Token CLOSE    = new Token(')', true);

    /*
     * Unescaped epsilon is meta syntax: an atom matching the empty string.
     */
    static final Token EPSILON  = new Token(RegexCompiler.EPSILON, true);

    static final Token END_MARKER = new Token(RegexCompiler.END_MARKER, false);

    final char value;
    final boolean operator;

    private Token(char value, boolean operator) {
        this.value = value;
        this.operator = operator;
    }

    static Token literal(char c) {
        return new Token(c, false);
    }

    boolean isLiteral() {
        return !operator;
    }

    /**
     * True for tokens which stand for an operand on their own: literals
     * (including the end marker) and epsilon.
     */
    boolean isAtom() {
        return !operator || equals(EPSILON);
    }

    /*
     * postfix unary operators, which go straight to the output
     */
    boolean isPostfixUnary() {
        return equals(STAR) || equals(QUESTION);
    }

    boolean isBinary() {
        return equals(UNION) || equals(CONCAT);
    }

    boolean isEndMarker() {
        return equals(END_MARKER);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token that = (Token) o;
        return value == that.value && operator == that.operator;
    }

    @Override
    public int hashCode() {
        return operator ? -value : value;
    }

    /*
     * Literals which would read as meta characters are shown escaped, so the
     * string form of a token sequence is unambiguous.
     */
    @Override
    public String toString() {
        if (operator
                || value == RegexCompiler.END_MARKER
                || (Character.isLetterOrDigit(value) && value != RegexCompiler.EPSILON)) {
            return String.valueOf(value);
        }
        return "\\" + value;
    }
}
