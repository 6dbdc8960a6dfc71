// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.Collections;
import java.util.List;


/**
 * A duration: a power of two base (1 = whole, 2 = half, ...), the number of augmentation dots
 * and optional scaling factors.
 *
 * @author Jürgen Moßgraber
 */
public class Duration extends AstNode
{
    private final int              base;
    private final int              dots;
    private final List<Multiplier> multipliers;


    /**
     * Constructor for a duration without scaling.
     *
     * @param base The base value
     * @param dots The number of dots
     */
    public Duration (final int base, final int dots)
    {
        this (base, dots, Collections.emptyList ());
    }


    /**
     * Constructor.
     *
     * @param base The base value
     * @param dots The number of dots
     * @param multipliers The scaling factors
     */
    public Duration (final int base, final int dots, final List<Multiplier> multipliers)
    {
        this.base = base;
        this.dots = dots;
        this.multipliers = List.copyOf (multipliers);
    }


    public int getBase ()
    {
        return this.base;
    }


    public int getDots ()
    {
        return this.dots;
    }


    public List<Multiplier> getMultipliers ()
    {
        return this.multipliers;
    }


    /**
     * Get the length of the duration in whole notes including dots and multipliers.
     *
     * @return The length
     */
    public double getLength ()
    {
        double length = 1.0 / this.base;
        double dotValue = length;
        for (int i = 0; i < this.dots; i++)
        {
            dotValue /= 2;
            length += dotValue;
        }
        for (final Multiplier multiplier: this.multipliers)
            length = length * multiplier.getNumerator () / multiplier.getDenominator ();
        return length;
    }


    /**
     * Check if the base is a power of two between 1 and 128.
     *
     * @param base The base to check
     * @return True if valid
     */
    public static boolean isValidBase (final int base)
    {
        return base >= 1 && base <= 128 && (base & base - 1) == 0;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Integer.valueOf (this.base),
            Integer.valueOf (this.dots),
            this.multipliers
        };
    }
}
