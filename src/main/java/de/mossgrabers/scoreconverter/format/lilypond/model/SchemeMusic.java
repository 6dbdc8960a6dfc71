// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * An embedded Scheme expression in music.
 *
 * @author Jürgen Moßgraber
 */
public class SchemeMusic extends Music
{
    private final String expression;


    /**
     * Constructor.
     *
     * @param expression The expression including the leading #
     */
    public SchemeMusic (final String expression)
    {
        this.expression = expression;
    }


    public String getExpression ()
    {
        return this.expression;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitSchemeMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.expression
        };
    }
}
