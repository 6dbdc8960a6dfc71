// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Grace notes at the end of a note (\afterGrace).
 *
 * @author Jürgen Moßgraber
 */
public class AfterGraceMusic extends Music
{
    private final Multiplier fraction;
    private final Music      main;
    private final Music      grace;


    /**
     * Constructor.
     *
     * @param fraction The fraction of the main note after which the grace notes start, null for the default
     * @param main The main note
     * @param grace The grace notes
     */
    public AfterGraceMusic (final Multiplier fraction, final Music main, final Music grace)
    {
        this.fraction = fraction;
        this.main = main;
        this.grace = grace;
    }


    public Multiplier getFraction ()
    {
        return this.fraction;
    }


    public Music getMain ()
    {
        return this.main;
    }


    public Music getGrace ()
    {
        return this.grace;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitAfterGraceMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.fraction,
            this.main,
            this.grace
        };
    }
}
