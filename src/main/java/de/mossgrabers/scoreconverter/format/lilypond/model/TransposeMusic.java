// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Transposed music (\transpose).
 *
 * @author Jürgen Moßgraber
 */
public class TransposeMusic extends Music
{
    private final Pitch from;
    private final Pitch to;
    private final Music body;


    /**
     * Constructor.
     *
     * @param from The start of the interval
     * @param to The end of the interval
     * @param body The music
     */
    public TransposeMusic (final Pitch from, final Pitch to, final Music body)
    {
        this.from = from;
        this.to = to;
        this.body = body;
    }


    public Pitch getFrom ()
    {
        return this.from;
    }


    public Pitch getTo ()
    {
        return this.to;
    }


    public Music getBody ()
    {
        return this.body;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitTransposeMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.from,
            this.to,
            this.body
        };
    }
}
