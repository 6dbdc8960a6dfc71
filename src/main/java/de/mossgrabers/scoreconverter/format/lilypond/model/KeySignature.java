// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A key signature, e.g. \key g \major.
 *
 * @author Jürgen Moßgraber
 */
public class KeySignature extends Music
{
    private final Pitch   tonic;
    private final KeyMode mode;


    /**
     * Constructor.
     *
     * @param tonic The tonic
     * @param mode The mode
     */
    public KeySignature (final Pitch tonic, final KeyMode mode)
    {
        this.tonic = tonic;
        this.mode = mode;
    }


    public Pitch getTonic ()
    {
        return this.tonic;
    }


    public KeyMode getMode ()
    {
        return this.mode;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitKeySignature (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.tonic,
            this.mode
        };
    }
}
