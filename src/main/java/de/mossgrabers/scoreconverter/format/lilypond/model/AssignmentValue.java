// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The value of an assignment.
 *
 * @author Jürgen Moßgraber
 */
public class AssignmentValue extends AstNode
{
    /** The kinds of values. */
    public enum Kind
    {
        /** A quoted string. */
        STRING,
        /** A plain number without unit. */
        NUMBER,
        /** An arithmetic expression or a number with unit. */
        EXPRESSION,
        /** A music expression. */
        MUSIC,
        /** A reference to another variable. */
        IDENTIFIER,
        /** A Scheme expression. */
        SCHEME,
        /** A markup. */
        MARKUP
    }


    private final Kind              kind;
    private final String            text;
    private final NumericExpression expression;
    private final Music             music;
    private final Markup            markup;


    private AssignmentValue (final Kind kind, final String text, final NumericExpression expression, final Music music, final Markup markup)
    {
        this.kind = kind;
        this.text = text;
        this.expression = expression;
        this.music = music;
        this.markup = markup;
    }


    /**
     * Create a string value.
     *
     * @param text The unquoted text
     * @return The value
     */
    public static AssignmentValue ofString (final String text)
    {
        return new AssignmentValue (Kind.STRING, text, null, null, null);
    }


    /**
     * Create a numeric value.
     *
     * @param expression The expression
     * @return The value, of kind NUMBER for a literal without unit, otherwise EXPRESSION
     */
    public static AssignmentValue ofExpression (final NumericExpression expression)
    {
        final boolean plain = expression.getOperator () == NumericExpression.Operator.LITERAL && expression.getUnit () == null;
        return new AssignmentValue (plain ? Kind.NUMBER : Kind.EXPRESSION, null, expression, null, null);
    }


    /**
     * Create a music value.
     *
     * @param music The music
     * @return The value
     */
    public static AssignmentValue ofMusic (final Music music)
    {
        return new AssignmentValue (Kind.MUSIC, null, null, music, null);
    }


    /**
     * Create a reference to another variable.
     *
     * @param name The name of the referenced variable
     * @return The value
     */
    public static AssignmentValue ofIdentifier (final String name)
    {
        return new AssignmentValue (Kind.IDENTIFIER, name, null, null, null);
    }


    /**
     * Create a Scheme value.
     *
     * @param expression The expression including the leading #
     * @return The value
     */
    public static AssignmentValue ofScheme (final String expression)
    {
        return new AssignmentValue (Kind.SCHEME, expression, null, null, null);
    }


    /**
     * Create a markup value.
     *
     * @param markup The markup
     * @return The value
     */
    public static AssignmentValue ofMarkup (final Markup markup)
    {
        return new AssignmentValue (Kind.MARKUP, null, null, null, markup);
    }


    public Kind getKind ()
    {
        return this.kind;
    }


    /**
     * Get the text of a string, identifier or Scheme value.
     *
     * @return The text
     */
    public String getText ()
    {
        return this.text;
    }


    public NumericExpression getExpression ()
    {
        return this.expression;
    }


    public Music getMusic ()
    {
        return this.music;
    }


    public Markup getMarkup ()
    {
        return this.markup;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.kind,
            this.text,
            this.expression,
            this.music,
            this.markup
        };
    }
}
