// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A markup text. Either a plain quoted string or the source of a markup expression (the part
 * following \markup, normalized to single spaces between tokens).
 *
 * @author Jürgen Moßgraber
 */
public class Markup extends AstNode
{
    private final String  text;
    private final boolean plainString;


    private Markup (final String text, final boolean plainString)
    {
        this.text = text;
        this.plainString = plainString;
    }


    /**
     * Create a markup from a plain string.
     *
     * @param text The unquoted text
     * @return The markup
     */
    public static Markup ofString (final String text)
    {
        return new Markup (text, true);
    }


    /**
     * Create a markup from a markup expression.
     *
     * @param source The normalized source of the expression
     * @return The markup
     */
    public static Markup ofExpression (final String source)
    {
        return new Markup (source, false);
    }


    /**
     * Get the text. For a plain string this is the unquoted text, otherwise the source of the
     * expression.
     *
     * @return The text
     */
    public String getText ()
    {
        return this.text;
    }


    public boolean isPlainString ()
    {
        return this.plainString;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.text,
            Boolean.valueOf (this.plainString)
        };
    }
}
