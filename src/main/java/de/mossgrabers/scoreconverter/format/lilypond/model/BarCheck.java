// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A bar check (|).
 *
 * @author Jürgen Moßgraber
 */
public class BarCheck extends Music
{
    /**
     * Constructor.
     */
    public BarCheck ()
    {
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitBarCheck (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object [0];
    }
}
