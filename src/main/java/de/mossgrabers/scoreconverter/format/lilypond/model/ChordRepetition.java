// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * The repetition of the previous chord (q).
 *
 * @author Jürgen Moßgraber
 */
public class ChordRepetition extends MusicEvent
{
    private final Duration        duration;
    private final List<PostEvent> postEvents;


    /**
     * Constructor.
     *
     * @param duration The duration, null if the previous one is used
     * @param postEvents The post events
     */
    public ChordRepetition (final Duration duration, final List<PostEvent> postEvents)
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
    public ChordRepetition withDuration (final Duration newDuration)
    {
        return new ChordRepetition (newDuration, this.postEvents);
    }


    /** {@inheritDoc} */
    @Override
    public ChordRepetition withPostEvents (final List<PostEvent> newPostEvents)
    {
        return new ChordRepetition (this.duration, newPostEvents);
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitChordRepetition (this);
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
