// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A \markuplist in music.
 *
 * @author Jürgen Moßgraber
 */
public class MarkupListMusic extends Music
{
    private final Markup markup;


    /**
     * Constructor.
     *
     * @param markup The markup list
     */
    public MarkupListMusic (final Markup markup)
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
        return visitor.visitMarkupListMusic (this);
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
