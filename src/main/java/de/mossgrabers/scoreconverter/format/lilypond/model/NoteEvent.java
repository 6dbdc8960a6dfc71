// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A note.
 *
 * @author Jürgen Moßgraber
 */
public class NoteEvent extends MusicEvent
{
    private final Pitch           pitch;
    private final boolean         pitchedRest;
    private final Duration        duration;
    private final List<PostEvent> postEvents;


    /**
     * Constructor.
     *
     * @param pitch The pitch
     * @param pitchedRest True if the pitch only positions a rest (\rest)
     * @param duration The duration, null if the previous one is used
     * @param postEvents The post events
     */
    public NoteEvent (final Pitch pitch, final boolean pitchedRest, final Duration duration, final List<PostEvent> postEvents)
    {
        this.pitch = pitch;
        this.pitchedRest = pitchedRest;
        this.duration = duration;
        this.postEvents = List.copyOf (postEvents);
    }


    public Pitch getPitch ()
    {
        return this.pitch;
    }


    public boolean isPitchedRest ()
    {
        return this.pitchedRest;
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
    public NoteEvent withDuration (final Duration newDuration)
    {
        return new NoteEvent (this.pitch, this.pitchedRest, newDuration, this.postEvents);
    }


    /** {@inheritDoc} */
    @Override
    public NoteEvent withPostEvents (final List<PostEvent> newPostEvents)
    {
        return new NoteEvent (this.pitch, this.pitchedRest, this.duration, newPostEvents);
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitNoteEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.pitch,
            Boolean.valueOf (this.pitchedRest),
            this.duration,
            this.postEvents
        };
    }
}
