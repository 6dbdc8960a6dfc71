// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A block which is kept as source text, e.g. a \context block in a \layout definition.
 *
 * @author Jürgen Moßgraber
 */
public class RawBlock extends ToplevelExpression
{
    private final String text;


    /**
     * Constructor.
     *
     * @param text The normalized source text
     */
    public RawBlock (final String text)
    {
        this.text = text;
    }


    public String getText ()
    {
        return this.text;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final ToplevelVisitor<R> visitor)
    {
        return visitor.visitRaw (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.text
        };
    }
}
