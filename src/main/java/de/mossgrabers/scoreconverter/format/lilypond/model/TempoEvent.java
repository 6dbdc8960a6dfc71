// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A tempo indication, e.g. \tempo "Vivace" 4. = 132-144.
 *
 * @author Jürgen Moßgraber
 */
public class TempoEvent extends Music
{
    private final Markup     text;
    private final Duration   unit;
    private final TempoRange bpm;


    /**
     * Constructor.
     *
     * @param text The text, null if none
     * @param unit The beat unit, null if there is no metronome mark
     * @param bpm The beats per minute, null if there is no metronome mark
     */
    public TempoEvent (final Markup text, final Duration unit, final TempoRange bpm)
    {
        this.text = text;
        this.unit = unit;
        this.bpm = bpm;
    }


    public Markup getText ()
    {
        return this.text;
    }


    public Duration getUnit ()
    {
        return this.unit;
    }


    public TempoRange getBpm ()
    {
        return this.bpm;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitTempoEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.text,
            this.unit,
            this.bpm
        };
    }
}
