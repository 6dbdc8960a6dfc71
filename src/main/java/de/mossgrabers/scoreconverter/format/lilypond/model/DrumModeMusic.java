// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * Drums in \drummode.
 *
 * @author Jürgen Moßgraber
 */
public class DrumModeMusic extends Music
{
    private final List<Music> items;


    /**
     * Constructor.
     *
     * @param items The drum events
     */
    public DrumModeMusic (final List<Music> items)
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
        return visitor.visitDrumModeMusic (this);
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
