// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

import java.util.List;


/**
 * The items of a score block which are not its music, e.g. header, layout and midi blocks.
 *
 * @author Jürgen Moßgraber
 */
public class OutputDefs extends ExtensionPayload
{
    private final int                  musicPosition;
    private final List<PositionedItem> items;


    /**
     * Constructor.
     *
     * @param musicPosition The index of the music in the score block
     * @param items The other items
     */
    public OutputDefs (final int musicPosition, final List<PositionedItem> items)
    {
        this.musicPosition = musicPosition;
        this.items = List.copyOf (items);
    }


    public int getMusicPosition ()
    {
        return this.musicPosition;
    }


    public List<PositionedItem> getItems ()
    {
        return this.items;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Integer.valueOf (this.musicPosition),
            this.items
        };
    }
}
