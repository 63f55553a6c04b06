/*
 * @LICENSE@
 */

/**
 * <h3><b>rxdfa</b> - compiles regular expressions straight to deterministic
 * finite automata.</h3>
 * <p>
 * <h4>How it works.</h4>
 * <p>
 * The pattern is tokenized (implicit concatenation made explicit,
 * <code>X+</code> rewritten as <code>X.X*</code>) and put in postfix order
 * with the shunting-yard algorithm. A single stack pass over the postfix
 * sequence builds the syntax tree, and each node computes its
 * <em>nullable</em>, <em>firstpos</em> and <em>lastpos</em> attributes as it
 * is created. A bottom up walk of the tree yields <em>followpos</em> for every
 * leaf position. The automaton states are then discovered breadth first,
 * starting from the firstpos of the root: each state is a set of positions,
 * and the state reached on a symbol is the union of followpos over the
 * positions of that symbol. There is no intermediate NFA and no subset
 * construction over one.
 * <p>
 * The caller ends the pattern with the end marker <code>#</code>; a state is
 * accepting when it contains the position of the marker. See
 * {@link org.rxdfa.regex.Automaton} for the syntax and the flags.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * The compiler logs every stage (postfix sequence, annotated tree, followpos
 * table, automaton) to the <code>java.util.logging</code> logger
 * <code>org.rxdfa.regex</code> at level <code>FINEST</code>.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>Section 3.9 of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book</a>, "Optimization of DFA-Based Pattern Matchers", describes the
 * construction of a DFA directly from a regular expression.</li>
 * </ul>
 */
package org.rxdfa.regex;
