// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A tuplet, e.g. \tuplet 3/2 { c8 d e }.
 *
 * @author Jürgen Moßgraber
 */
public class TupletMusic extends Music
{
    private final int      numerator;
    private final int      denominator;
    private final Duration spanDuration;
    private final Music    body;


    /**
     * Constructor.
     *
     * @param numerator The number of notes
     * @param denominator The number of notes in the normal time
     * @param spanDuration The optional grouping duration, null if none
     * @param body The music
     */
    public TupletMusic (final int numerator, final int denominator, final Duration spanDuration, final Music body)
    {
        this.numerator = numerator;
        this.denominator = denominator;
        this.spanDuration = spanDuration;
        this.body = body;
    }


    public int getNumerator ()
    {
        return this.numerator;
    }


    public int getDenominator ()
    {
        return this.denominator;
    }


    public Duration getSpanDuration ()
    {
        return this.spanDuration;
    }


    public Music getBody ()
    {
        return this.body;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitTupletMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Integer.valueOf (this.numerator),
            Integer.valueOf (this.denominator),
            this.spanDuration,
            this.body
        };
    }
}
