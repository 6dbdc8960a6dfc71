// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A text mark.
 *
 * @author Jürgen Moßgraber
 */
public class TextMarkEvent extends Music
{
    private final Markup text;


    /**
     * Constructor.
     *
     * @param text The text
     */
    public TextMarkEvent (final Markup text)
    {
        this.text = text;
    }


    public Markup getText ()
    {
        return this.text;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitTextMarkEvent (this);
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
