// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * Music in curly braces, played one after the other.
 *
 * @author Jürgen Moßgraber
 */
public class SequentialMusic extends Music
{
    private final List<Music> items;


    /**
     * Constructor.
     *
     * @param items The items
     */
    public SequentialMusic (final List<Music> items)
    {
        this.items = List.copyOf (items);
    }


    public List<Music> getItems ()
    {
        return this.items;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitSequentialMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.items
        };
    }
}
