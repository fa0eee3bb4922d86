package io.github.cyfko.logicnf.core.api;

import io.github.cyfko.logicnf.core.exception.ExpressionTooLongException;
import io.github.cyfko.logicnf.core.exception.FormulaSyntaxException;
import io.github.cyfko.logicnf.core.exception.LexException;

/**
 * Parser turning the textual form of a propositional formula into a {@link Formula} tree.
 *
 * <h2>Operators</h2>
 * <table border="1">
 * <caption>Operator reference, tightest first</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbols</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>N/A</td><td>(A | B) &amp; C</td></tr>
 * <tr><td>NOT</td><td>~ ! ¬</td><td>Right (prefix)</td><td>~~A</td></tr>
 * <tr><td>AND</td><td>&amp; ∧</td><td>Left</td><td>A &amp; B</td></tr>
 * <tr><td>OR</td><td>| ∨</td><td>Left</td><td>A | B</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt; =&gt;</td><td>Left</td><td>A -&gt; B</td></tr>
 * <tr><td>EQUIV</td><td>&lt;-&gt; &lt;=&gt;</td><td>Left</td><td>A &lt;-&gt; B</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * equiv    := implies ( "&lt;-&gt;" implies )* ;
 * implies  := or ( "-&gt;" or )* ;
 * or       := and ( "|" and )* ;
 * and      := not ( "&amp;" not )* ;
 * not      := "~" not | primary ;
 * primary  := variable | "(" equiv ")" ;
 * variable := [A-Za-z][A-Za-z0-9_]* ;
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 * Formula f1 = parser.parse("A -> B");
 * Formula f2 = parser.parse("A | B & C");     // A | (B & C)
 * Formula f3 = parser.parse("¬(A ∧ B) <=> C");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaParser {

    /**
     * Parses the given text into a formula tree.
     *
     * @param text the formula source text
     * @return the root of the parsed tree
     * @throws NullPointerException        if text is null
     * @throws ExpressionTooLongException  if text exceeds the configured length
     * @throws LexException                if text contains a character that starts no token
     * @throws FormulaSyntaxException      if the tokens do not form a formula
     */
    Formula parse(String text);
}
