// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A \markup in music.
 *
 * @author Jürgen Moßgraber
 */
public class MarkupMusic extends Music
{
    private final Markup markup;


    /**
     * Constructor.
     *
     * @param markup The markup
     */
    public MarkupMusic (final Markup markup)
    {
        this.markup = markup;
    }


    public Markup getMarkup ()
    {
        return this.markup;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitMarkupMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.markup
        };
    }
}
