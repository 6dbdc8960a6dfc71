// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * An arithmetic expression over numbers which may carry a unit, e.g. '150\mm - 2\cm'.
 *
 * @author Jürgen Moßgraber
 */
public class NumericExpression extends AstNode
{
    /** The operators. LITERAL marks a leaf. */
    public enum Operator
    {
        LITERAL(""),
        NEGATE("-"),
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/");


        private final String symbol;


        private Operator (final String symbol)
        {
            this.symbol = symbol;
        }


        public String getSymbol ()
        {
            return this.symbol;
        }
    }


    private final Operator          operator;
    private final String            literal;
    private final String            unit;
    private final NumericExpression left;
    private final NumericExpression right;


    private NumericExpression (final Operator operator, final String literal, final String unit, final NumericExpression left, final NumericExpression right)
    {
        this.operator = operator;
        this.literal = literal;
        this.unit = unit;
        this.left = left;
        this.right = right;
    }


    /**
     * Create a number.
     *
     * @param literal The number as written in the source
     * @param unit The unit (mm, cm, in, pt) or null
     * @return The expression
     */
    public static NumericExpression literal (final String literal, final String unit)
    {
        return new NumericExpression (Operator.LITERAL, literal, unit, null, null);
    }


    /**
     * Create a negation.
     *
     * @param operand The negated expression
     * @return The expression
     */
    public static NumericExpression negate (final NumericExpression operand)
    {
        return new NumericExpression (Operator.NEGATE, null, null, operand, null);
    }


    /**
     * Create a binary expression.
     *
     * @param operator The operator
     * @param left The left operand
     * @param right The right operand
     * @return The expression
     */
    public static NumericExpression binary (final Operator operator, final NumericExpression left, final NumericExpression right)
    {
        return new NumericExpression (operator, null, null, left, right);
    }


    public Operator getOperator ()
    {
        return this.operator;
    }


    public String getLiteral ()
    {
        return this.literal;
    }


    public String getUnit ()
    {
        return this.unit;
    }


    public NumericExpression getLeft ()
    {
        return this.left;
    }


    public NumericExpression getRight ()
    {
        return this.right;
    }


    /**
     * Calculate the value. Lengths are converted to millimeters.
     *
     * @return The value
     */
    public double evaluate ()
    {
        switch (this.operator)
        {
            case LITERAL:
                return Double.parseDouble (this.literal) * unitFactor (this.unit);
            case NEGATE:
                return -this.left.evaluate ();
            case ADD:
                return this.left.evaluate () + this.right.evaluate ();
            case SUBTRACT:
                return this.left.evaluate () - this.right.evaluate ();
            case MULTIPLY:
                return this.left.evaluate () * this.right.evaluate ();
            case DIVIDE:
            default:
                return this.left.evaluate () / this.right.evaluate ();
        }
    }


    /**
     * Get the precedence of the operator. Higher binds stronger.
     *
     * @return The precedence
     */
    public int getPrecedence ()
    {
        switch (this.operator)
        {
            case ADD:
            case SUBTRACT:
                return 1;
            case MULTIPLY:
            case DIVIDE:
                return 2;
            case NEGATE:
                return 3;
            case LITERAL:
            default:
                return 4;
        }
    }


    private static double unitFactor (final String unit)
    {
        if (unit == null)
            return 1;
        switch (unit)
        {
            case "cm":
                return 10;
            case "in":
                return 25.4;
            case "pt":
                return 25.4 / 72.27;
            case "mm":
            default:
                return 1;
        }
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.operator,
            this.literal,
            this.unit,
            this.left,
            this.right
        };
    }
}
