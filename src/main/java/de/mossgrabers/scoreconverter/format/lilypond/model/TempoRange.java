// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The beats per minute of a metronome mark, either a single value or a range.
 *
 * @author Jürgen Moßgraber
 */
public class TempoRange extends AstNode
{
    private final int     low;
    private final Integer high;


    /**
     * Constructor.
     *
     * @param low The (lower) value
     * @param high The upper value of a range, null for a single value
     */
    public TempoRange (final int low, final Integer high)
    {
        this.low = low;
        this.high = high;
    }


    public int getLow ()
    {
        return this.low;
    }


    public Integer getHigh ()
    {
        return this.high;
    }


    public boolean isRange ()
    {
        return this.high != null;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Integer.valueOf (this.low),
            this.high
        };
    }
}
