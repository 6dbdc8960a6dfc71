// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A rehearsal mark.
 *
 * @author Jürgen Moßgraber
 */
public class MarkEvent extends Music
{
    private final Markup  label;
    private final Integer number;


    /**
     * Constructor.
     *
     * @param label The label, null for a number or \default
     * @param number The explicit number, null if none
     */
    public MarkEvent (final Markup label, final Integer number)
    {
        this.label = label;
        this.number = number;
    }


    public Markup getLabel ()
    {
        return this.label;
    }


    public Integer getNumber ()
    {
        return this.number;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitMarkEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.label,
            this.number
        };
    }
}
