// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * A piece of LilyPond source text together with its index in the enclosing list of items.
 *
 * @author Jürgen Moßgraber
 */
public class PositionedItem extends ExtensionPayload
{
    private final int    position;
    private final String source;


    /**
     * Constructor.
     *
     * @param position The index of the item in its parent
     * @param source The serialized item
     */
    public PositionedItem (final int position, final String source)
    {
        this.position = position;
        this.source = source;
    }


    public int getPosition ()
    {
        return this.position;
    }


    public String getSource ()
    {
        return this.source;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Integer.valueOf (this.position),
            this.source
        };
    }
}
