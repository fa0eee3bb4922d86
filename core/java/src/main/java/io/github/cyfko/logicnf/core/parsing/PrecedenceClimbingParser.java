package io.github.cyfko.logicnf.core.parsing;

import io.github.cyfko.logicnf.core.api.Connective;
import io.github.cyfko.logicnf.core.api.Formula;
import io.github.cyfko.logicnf.core.exception.FormulaSyntaxException;
import io.github.cyfko.logicnf.core.exception.FormulaSyntaxException.Reason;

import java.util.List;

/**
 * Recursive-descent parser building a {@link Formula} from tokens, one method level per binding
 * strength.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * parseLevel(i):                       i indexes EQUIV, IMPLIES, OR, AND (loosest first)
 *   left = parseLevel(i + 1)
 *   while next token is the connective of level i:
 *     consume it
 *     left = Binary(connective, left, parseLevel(i + 1))      → left associativity
 *   return left
 *
 * parseLevel(4)  = parseNegation:  "~" parseNegation | primary   → right associativity
 * primary        = variable | "(" parseLevel(0) ")"            → parentheses re-enter at EQUIV
 * </pre>
 *
 * <p>
 * The depth limit is enforced twice. Each negation and each opening parenthesis counts one
 * nesting level of the text, which bounds this parser's recursion. Each negation and each
 * connective also adds one level to the tree being built, which bounds the recursion of every
 * visitor run on the result: {@code A & A & ... & A} is a left-nested tree as deep as its
 * operator count. Going past the limit either way fails with {@link Reason#NESTING_TOO_DEEP}.
 * Tokens left after the top-level formula fail with {@link Reason#TRAILING_INPUT}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PrecedenceClimbingParser {

    private static final Connective[] LEVELS = {
        Connective.EQUIV, Connective.IMPLIES, Connective.OR, Connective.AND
    };

    private static final String OPERAND = "variable, '~' or '('";

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int pos;
    private int depth;

    private PrecedenceClimbingParser(List<Token> tokens, int maxNestingDepth) {
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses a complete token sequence.
     *
     * @param tokens          tokens from {@link FormulaTokenizer}
     * @param maxNestingDepth maximum nesting of the text and depth of the tree
     * @return the root of the formula tree
     * @throws FormulaSyntaxException if the tokens do not form exactly one formula
     */
    public static Formula parse(List<Token> tokens, int maxNestingDepth) {
        return new PrecedenceClimbingParser(tokens, maxNestingDepth).parseFormula();
    }

    private Formula parseFormula() {
        Node root = parseLevel(0);
        if (!isAtEnd()) {
            throw FormulaSyntaxException.at(Reason.TRAILING_INPUT, peek(), "operator or end of input");
        }
        return root.formula();
    }

    private Node parseLevel(int level) {
        if (level == LEVELS.length) {
            return parseNegation();
        }
        Connective connective = LEVELS[level];
        Node left = parseLevel(level + 1);
        while (isNext(connective)) {
            Token operator = tokens.get(pos++);
            Node right = parseLevel(level + 1);
            left = node(operator, new Formula.Binary(connective, left.formula(), right.formula()),
                Math.max(left.height(), right.height()));
        }
        return left;
    }

    private Node parseNegation() {
        if (!isAtEnd() && peek() instanceof Token.Operator op && op.operator() == LogicOperator.NOT) {
            enter(op);
            pos++;
            Node operand = parseNegation();
            depth--;
            return node(op, new Formula.Not(operand.formula()), operand.height());
        }
        return parsePrimary();
    }

    private Node parsePrimary() {
        if (isAtEnd()) {
            throw FormulaSyntaxException.atEnd(Reason.UNEXPECTED_END_OF_INPUT, expectedOperand());
        }
        Token token = peek();
        if (token instanceof Token.Variable variable) {
            pos++;
            return new Node(new Formula.Var(variable.name()), 0);
        }
        if (token instanceof Token.Paren paren && paren.open()) {
            enter(paren);
            pos++;
            Node inner = parseLevel(0);
            expectClosingParenthesis();
            depth--;
            return inner;
        }
        throw FormulaSyntaxException.at(Reason.UNEXPECTED_TOKEN, token, OPERAND);
    }

    // height of the new node is one more than its deepest child
    private Node node(Token token, Formula formula, int childHeight) {
        if (childHeight + 1 > maxNestingDepth) {
            throw FormulaSyntaxException.nestingTooDeep(token, maxNestingDepth);
        }
        return new Node(formula, childHeight + 1);
    }

    private void expectClosingParenthesis() {
        if (isAtEnd()) {
            throw FormulaSyntaxException.atEnd(Reason.MISSING_CLOSING_PARENTHESIS, "')'");
        }
        Token token = peek();
        if (!(token instanceof Token.Paren paren) || paren.open()) {
            throw FormulaSyntaxException.at(Reason.MISSING_CLOSING_PARENTHESIS, token, "')'");
        }
        pos++;
    }

    private void enter(Token token) {
        if (++depth > maxNestingDepth) {
            throw FormulaSyntaxException.nestingTooDeep(token, maxNestingDepth);
        }
    }

    private boolean isNext(Connective connective) {
        return !isAtEnd()
            && peek() instanceof Token.Operator op
            && op.operator() != LogicOperator.NOT
            && op.operator().connective() == connective;
    }

    private String expectedOperand() {
        return pos == 0 ? OPERAND : "operand after '" + tokens.get(pos - 1).text() + "'";
    }

    private boolean isAtEnd() {
        return pos >= tokens.size();
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private record Node(Formula formula, int height) {}
}
