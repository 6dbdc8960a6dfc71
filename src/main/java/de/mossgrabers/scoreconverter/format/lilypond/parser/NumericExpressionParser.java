// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import de.mossgrabers.scoreconverter.format.lilypond.lexer.Token;
import de.mossgrabers.scoreconverter.format.lilypond.lexer.TokenType;
import de.mossgrabers.scoreconverter.format.lilypond.model.NumericExpression;


/**
 * Parses arithmetic expressions over numbers with optional units, e.g. '150\mm - 2\cm'. Unary minus
 * binds stronger than multiplication and division which bind stronger than addition and
 * subtraction.
 *
 * @author Jürgen Moßgraber
 */
public class NumericExpressionParser
{
    private final TokenCursor cursor;


    /**
     * Constructor.
     *
     * @param cursor The token cursor
     */
    public NumericExpressionParser (final TokenCursor cursor)
    {
        this.cursor = cursor;
    }


    /**
     * Check if the current token can start a numeric expression.
     *
     * @return True if a number, a minus or an opening parenthesis follows
     */
    public boolean isExpressionAhead ()
    {
        return this.cursor.check (TokenType.NUMBER) || this.cursor.check (TokenType.REAL) || this.cursor.check (TokenType.MINUS) || this.cursor.check (TokenType.OPEN_PAREN);
    }


    /**
     * Parse an expression.
     *
     * @return The expression
     * @throws ParseError Malformed expression
     */
    public NumericExpression parseExpression () throws ParseError
    {
        NumericExpression left = this.parseProduct ();
        while (true)
        {
            final NumericExpression.Operator operator;
            if (this.cursor.check (TokenType.PLUS))
                operator = NumericExpression.Operator.ADD;
            else if (this.cursor.check (TokenType.MINUS))
                operator = NumericExpression.Operator.SUBTRACT;
            else
                return left;
            this.cursor.next ();
            left = NumericExpression.binary (operator, left, this.parseProduct ());
        }
    }


    private NumericExpression parseProduct () throws ParseError
    {
        NumericExpression left = this.parseUnary ();
        while (true)
        {
            final NumericExpression.Operator operator;
            if (this.cursor.check (TokenType.STAR))
                operator = NumericExpression.Operator.MULTIPLY;
            else if (this.cursor.check (TokenType.SLASH))
                operator = NumericExpression.Operator.DIVIDE;
            else
                return left;
            this.cursor.next ();
            left = NumericExpression.binary (operator, left, this.parseUnary ());
        }
    }


    private NumericExpression parseUnary () throws ParseError
    {
        if (this.cursor.accept (TokenType.MINUS))
            return NumericExpression.negate (this.parseUnary ());
        return this.parsePrimary ();
    }


    private NumericExpression parsePrimary () throws ParseError
    {
        if (this.cursor.accept (TokenType.OPEN_PAREN))
        {
            final NumericExpression inner = this.parseExpression ();
            this.cursor.expect (TokenType.CLOSE_PAREN, ")");
            return inner;
        }

        if (!this.cursor.check (TokenType.NUMBER) && !this.cursor.check (TokenType.REAL))
            throw this.cursor.error ("a number");
        final Token number = this.cursor.next ();

        String unit = null;
        final Token next = this.cursor.peek ();
        if (next.is (TokenType.COMMAND) && Vocabulary.UNITS.contains (next.getText ()))
        {
            this.cursor.next ();
            unit = next.getText ();
        }
        return NumericExpression.literal (number.getText (), unit);
    }
}
