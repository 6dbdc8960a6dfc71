// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * An item of the quality of a chord in chord mode: either a named modifier (m, maj, dim, aug,
 * sus) or a numbered scale step with an optional alteration.
 *
 * @author Jürgen Moßgraber
 */
public class ChordQualityItem extends AstNode
{
    private final String modifier;
    private final int    step;
    private final int    alteration;


    private ChordQualityItem (final String modifier, final int step, final int alteration)
    {
        this.modifier = modifier;
        this.step = step;
        this.alteration = alteration;
    }


    /**
     * Create a named modifier.
     *
     * @param modifier The name, e.g. 'dim'
     * @return The item
     */
    public static ChordQualityItem modifier (final String modifier)
    {
        return new ChordQualityItem (modifier, 0, 0);
    }


    /**
     * Create a scale step.
     *
     * @param step The step number, e.g. 7
     * @param alteration +1 for '+', -1 for '-', 0 for natural
     * @return The item
     */
    public static ChordQualityItem step (final int step, final int alteration)
    {
        return new ChordQualityItem (null, step, alteration);
    }


    public boolean isModifier ()
    {
        return this.modifier != null;
    }


    public String getModifier ()
    {
        return this.modifier;
    }


    public int getStep ()
    {
        return this.step;
    }


    public int getAlteration ()
    {
        return this.alteration;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.modifier,
            Integer.valueOf (this.step),
            Integer.valueOf (this.alteration)
        };
    }
}
