// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A clef change.
 *
 * @author Jürgen Moßgraber
 */
public class ClefEvent extends Music
{
    private final String name;


    /**
     * Constructor.
     *
     * @param name The name of the clef, e.g. treble_8
     */
    public ClefEvent (final String name)
    {
        this.name = name;
    }


    public String getName ()
    {
        return this.name;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitClefEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.name
        };
    }
}
