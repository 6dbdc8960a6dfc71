// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * Several drums played at once, e.g. <bd hh>8.
 *
 * @author Jürgen Moßgraber
 */
public class DrumChordEvent extends MusicEvent
{
    private final List<String>    drumNames;
    private final Duration        duration;
    private final List<PostEvent> postEvents;


    /**
     * Constructor.
     *
     * @param drumNames The names of the drums
     * @param duration The duration, null if the previous one is used
     * @param postEvents The post events
     */
    public DrumChordEvent (final List<String> drumNames, final Duration duration, final List<PostEvent> postEvents)
    {
        this.drumNames = List.copyOf (drumNames);
        this.duration = duration;
        this.postEvents = List.copyOf (postEvents);
    }


    public List<String> getDrumNames ()
    {
        return this.drumNames;
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
    public DrumChordEvent withDuration (final Duration newDuration)
    {
        return new DrumChordEvent (this.drumNames, newDuration, this.postEvents);
    }


    /** {@inheritDoc} */
    @Override
    public DrumChordEvent withPostEvents (final List<PostEvent> newPostEvents)
    {
        return new DrumChordEvent (this.drumNames, this.duration, newPostEvents);
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitDrumChordEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.drumNames,
            this.duration,
            this.postEvents
        };
    }
}
