// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Music with octaves fixed relative to a reference pitch (\fixed).
 *
 * @author Jürgen Moßgraber
 */
public class FixedMusic extends Music
{
    private final Pitch reference;
    private final Music body;


    /**
     * Constructor.
     *
     * @param reference The reference pitch
     * @param body The music
     */
    public FixedMusic (final Pitch reference, final Music body)
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
        return visitor.visitFixedMusic (this);
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
