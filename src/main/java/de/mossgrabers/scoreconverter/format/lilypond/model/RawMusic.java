// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Source text which could not be parsed and was skipped.
 *
 * @author Jürgen Moßgraber
 */
public class RawMusic extends Music
{
    private final String text;


    /**
     * Constructor.
     *
     * @param text The source text
     */
    public RawMusic (final String text)
    {
        this.text = text;
    }


    public String getText ()
    {
        return this.text;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitRawMusic (this);
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
