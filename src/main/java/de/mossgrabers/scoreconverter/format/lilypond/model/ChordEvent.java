// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A chord in single angle brackets, e.g. <c e g>4.
 *
 * @author Jürgen Moßgraber
 */
public class ChordEvent extends MusicEvent
{
    private final List<Pitch>     pitches;
    private final Duration        duration;
    private final List<PostEvent> postEvents;


    /**
     * Constructor.
     *
     * @param pitches The pitches
     * @param duration The duration, null if the previous one is used
     * @param postEvents The post events
     */
    public ChordEvent (final List<Pitch> pitches, final Duration duration, final List<PostEvent> postEvents)
    {
        this.pitches = List.copyOf (pitches);
        this.duration = duration;
        this.postEvents = List.copyOf (postEvents);
    }


    public List<Pitch> getPitches ()
    {
        return this.pitches;
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
    public ChordEvent withDuration (final Duration newDuration)
    {
        return new ChordEvent (this.pitches, newDuration, this.postEvents);
    }


    /** {@inheritDoc} */
    @Override
    public ChordEvent withPostEvents (final List<PostEvent> newPostEvents)
    {
        return new ChordEvent (this.pitches, this.duration, newPostEvents);
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitChordEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.pitches,
            this.duration,
            this.postEvents
        };
    }
}
