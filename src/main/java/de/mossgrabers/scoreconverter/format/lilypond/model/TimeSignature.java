// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A time signature, e.g. \time 3/4 or \time 2+3/8.
 *
 * @author Jürgen Moßgraber
 */
public class TimeSignature extends Music
{
    private final List<Integer> numerators;
    private final int           denominator;


    /**
     * Constructor.
     *
     * @param numerators The numerators
     * @param denominator The denominator
     */
    public TimeSignature (final List<Integer> numerators, final int denominator)
    {
        this.numerators = List.copyOf (numerators);
        this.denominator = denominator;
    }


    public List<Integer> getNumerators ()
    {
        return this.numerators;
    }


    public int getDenominator ()
    {
        return this.denominator;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitTimeSignature (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.numerators,
            Integer.valueOf (this.denominator)
        };
    }
}
