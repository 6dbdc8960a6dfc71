// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A syllable of lyrics.
 *
 * @author Jürgen Moßgraber
 */
public class LyricEvent extends MusicEvent
{
    private final String          text;
    private final boolean         quoted;
    private final Duration        duration;
    private final List<PostEvent> postEvents;


    /**
     * Constructor.
     *
     * @param text The text, '_' for a skipped note
     * @param quoted True if the text was a quoted string
     * @param duration The duration, null if the previous one is used
     * @param postEvents The post events
     */
    public LyricEvent (final String text, final boolean quoted, final Duration duration, final List<PostEvent> postEvents)
    {
        this.text = text;
        this.quoted = quoted;
        this.duration = duration;
        this.postEvents = List.copyOf (postEvents);
    }


    public String getText ()
    {
        return this.text;
    }


    public boolean isQuoted ()
    {
        return this.quoted;
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
    public LyricEvent withDuration (final Duration newDuration)
    {
        return new LyricEvent (this.text, this.quoted, newDuration, this.postEvents);
    }


    /** {@inheritDoc} */
    @Override
    public LyricEvent withPostEvents (final List<PostEvent> newPostEvents)
    {
        return new LyricEvent (this.text, this.quoted, this.duration, newPostEvents);
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitLyricEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.text,
            Boolean.valueOf (this.quoted),
            this.duration,
            this.postEvents
        };
    }
}
