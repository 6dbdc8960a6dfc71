// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Switches automatic beaming on or off.
 *
 * @author Jürgen Moßgraber
 */
public class AutoBeamEvent extends Music
{
    private final boolean on;


    /**
     * Constructor.
     *
     * @param on True for \autoBeamOn
     */
    public AutoBeamEvent (final boolean on)
    {
        this.on = on;
    }


    public boolean isOn ()
    {
        return this.on;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitAutoBeamEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Boolean.valueOf (this.on)
        };
    }
}
