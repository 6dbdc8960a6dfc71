// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A Scheme expression on the top level, e.g. #(set-global-staff-size 18).
 *
 * @author Jürgen Moßgraber
 */
public class ToplevelScheme extends ToplevelExpression
{
    private final String expression;


    /**
     * Constructor.
     *
     * @param expression The expression including the leading #
     */
    public ToplevelScheme (final String expression)
    {
        this.expression = expression;
    }


    public String getExpression ()
    {
        return this.expression;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final ToplevelVisitor<R> visitor)
    {
        return visitor.visitScheme (this);
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
