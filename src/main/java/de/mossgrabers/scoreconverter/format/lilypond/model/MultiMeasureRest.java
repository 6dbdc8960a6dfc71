// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A multi-measure rest, e.g. R1*4.
 *
 * @author Jürgen Moßgraber
 */
public class MultiMeasureRest extends MusicEvent
{
    private final Duration        duration;
    private final List<PostEvent> postEvents;


    /**
     * Constructor.
     *
     * @param duration The duration, null if the previous one is used
     * @param postEvents The post events
     */
    public MultiMeasureRest (final Duration duration, final List<PostEvent> postEvents)
    {
        this.duration = duration;
        this.postEvents = List.copyOf (postEvents);
    }


    /** {@inheritDoc} */
    @Override
    public Duration getDuration ()
    {
        return this.duration;
    }


    /** {@inheritDoc} */
    @Override
    public List<PostEvent> getPostEvents ()
    {
        return this.postEvents;
    }


    /** {@inheritDoc} */
    @Override
    public MultiMeasureRest withDuration (final Duration newDuration)
    {
        return new MultiMeasureRest (newDuration, this.postEvents);
    }


    /** {@inheritDoc} */
    @Override
    public MultiMeasureRest withPostEvents (final List<PostEvent> newPostEvents)
    {
        return new MultiMeasureRest (this.duration, newPostEvents);
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitMultiMeasureRest (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.duration,
            this.postEvents
        };
    }
}
