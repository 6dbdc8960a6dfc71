// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A duration scaling factor, e.g. the 3/2 in 'c4*3/2'.
 *
 * @author Jürgen Moßgraber
 */
public class Multiplier extends AstNode
{
    private final int numerator;
    private final int denominator;


    /**
     * Constructor.
     *
     * @param numerator The numerator
     * @param denominator The denominator, 1 if only a factor was given
     */
    public Multiplier (final int numerator, final int denominator)
    {
        this.numerator = numerator;
        this.denominator = denominator;
    }


    public int getNumerator ()
    {
        return this.numerator;
    }


    public int getDenominator ()
    {
        return this.denominator;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Integer.valueOf (this.numerator),
            Integer.valueOf (this.denominator)
        };
    }
}
