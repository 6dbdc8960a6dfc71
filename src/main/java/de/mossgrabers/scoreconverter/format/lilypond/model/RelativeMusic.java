// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Music with relative octave entry (\relative).
 *
 * @author Jürgen Moßgraber
 */
public class RelativeMusic extends Music
{
    private final Pitch reference;
    private final Music body;


    /**
     * Constructor.
     *
     * @param reference The reference pitch, null if none was given
     * @param body The music
     */
    public RelativeMusic (final Pitch reference, final Music body)
    {
        this.reference = reference;
        this.body = body;
    }


    public Pitch getReference ()
    {
        return this.reference;
    }


    public Music getBody ()
    {
        return this.body;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitRelativeMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.reference,
            this.body
        };
    }
}
