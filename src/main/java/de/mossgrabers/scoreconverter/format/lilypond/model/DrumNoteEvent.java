// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A note in drum mode, e.g. bd4.
 *
 * @author Jürgen Moßgraber
 */
public class DrumNoteEvent extends MusicEvent
{
    private final String          drumName;
    private final Duration        duration;
    private final List<PostEvent> postEvents;


    /**
     * Constructor.
     *
     * @param drumName The name of the drum
     * @param duration The duration, null if the previous one is used
     * @param postEvents The post events
     */
    public DrumNoteEvent (final String drumName, final Duration duration, final List<PostEvent> postEvents)
    {
        this.drumName = drumName;
        this.duration = duration;
        this.postEvents = List.copyOf (postEvents);
    }


    public String getDrumName ()
    {
        return this.drumName;
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
    public DrumNoteEvent withDuration (final Duration newDuration)
    {
        return new DrumNoteEvent (this.drumName, newDuration, this.postEvents);
    }


    /** {@inheritDoc} */
    @Override
    public DrumNoteEvent withPostEvents (final List<PostEvent> newPostEvents)
    {
        return new DrumNoteEvent (this.drumName, this.duration, newPostEvents);
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitDrumNoteEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.drumName,
            this.duration,
            this.postEvents
        };
    }
}
