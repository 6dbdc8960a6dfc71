// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A bar line, e.g. \bar "|.".
 *
 * @author Jürgen Moßgraber
 */
public class BarLine extends Music
{
    private final String glyph;


    /**
     * Constructor.
     *
     * @param glyph The bar line glyph
     */
    public BarLine (final String glyph)
    {
        this.glyph = glyph;
    }


    public String getGlyph ()
    {
        return this.glyph;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitBarLine (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.glyph
        };
    }
}
