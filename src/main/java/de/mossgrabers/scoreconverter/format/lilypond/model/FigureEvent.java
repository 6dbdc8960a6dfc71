// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A group of bass figures, e.g. <6 4>4.
 *
 * @author Jürgen Moßgraber
 */
public class FigureEvent extends Music
{
    private final List<Figure> figures;
    private final Duration     duration;


    /**
     * Constructor.
     *
     * @param figures The figures
     * @param duration The duration, null if the previous one is used
     */
    public FigureEvent (final List<Figure> figures, final Duration duration)
    {
        this.figures = List.copyOf (figures);
        this.duration = duration;
    }


    public List<Figure> getFigures ()
    {
        return this.figures;
    }


    public Duration getDuration ()
    {
        return this.duration;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitFigureEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.figures,
            this.duration
        };
    }
}
