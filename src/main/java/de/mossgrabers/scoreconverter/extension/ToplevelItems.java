// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

import java.util.List;


/**
 * The top-level items of a file which have no representation in the document, e.g. paper blocks,
 * markup or further music expressions.
 *
 * @author Jürgen Moßgraber
 */
public class ToplevelItems extends ExtensionPayload
{
    private final String               version;
    private final int                  itemCount;
    private final List<PositionedItem> items;


    /**
     * Constructor.
     *
     * @param version The LilyPond version of the file, null if none
     * @param itemCount The number of all top-level items of the file
     * @param items The serialized items
     */
    public ToplevelItems (final String version, final int itemCount, final List<PositionedItem> items)
    {
        this.version = version;
        this.itemCount = itemCount;
        this.items = List.copyOf (items);
    }


    public String getVersion ()
    {
        return this.version;
    }


    public int getItemCount ()
    {
        return this.itemCount;
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
            this.version,
            Integer.valueOf (this.itemCount),
            this.items
        };
    }
}
