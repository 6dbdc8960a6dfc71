// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * Base class of music which takes time and can carry post events: notes, chords, rests, skips
 * and the like.
 *
 * @author Jürgen Moßgraber
 */
public abstract class MusicEvent extends Music
{
    /**
     * Get the duration.
     *
     * @return The duration or null if the duration of the previous event applies
     */
    public abstract Duration getDuration ();


    /**
     * Get the post events.
     *
     * @return The post events, never null
     */
    public abstract List<PostEvent> getPostEvents ();


    /**
     * Create a copy with a different duration.
     *
     * @param newDuration The new duration, may be null
     * @return The copy
     */
    public abstract MusicEvent withDuration (Duration newDuration);


    /**
     * Create a copy with different post events.
     *
     * @param newPostEvents The new post events
     * @return The copy
     */
    public abstract MusicEvent withPostEvents (List<PostEvent> newPostEvents);
}
