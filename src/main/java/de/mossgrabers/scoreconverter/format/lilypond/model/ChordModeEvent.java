// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A chord in chord mode, e.g. c:dim7/f.
 *
 * @author Jürgen Moßgraber
 */
public class ChordModeEvent extends MusicEvent
{
    private final Pitch                  root;
    private final Duration               duration;
    private final List<ChordQualityItem> quality;
    private final List<ChordQualityItem> removals;
    private final Pitch                  inversion;
    private final Pitch                  bass;
    private final List<PostEvent>        postEvents;


    /**
     * Constructor.
     *
     * @param root The root
     * @param duration The duration, null if the previous one is used
     * @param quality The items after the ':'
     * @param removals The steps removed with '^'
     * @param inversion The pitch after '/', null if none
     * @param bass The pitch after '/+', null if none
     * @param postEvents The post events
     */
    public ChordModeEvent (final Pitch root, final Duration duration, final List<ChordQualityItem> quality, final List<ChordQualityItem> removals, final Pitch inversion, final Pitch bass, final List<PostEvent> postEvents)
    {
        this.root = root;
        this.duration = duration;
        this.quality = List.copyOf (quality);
        this.removals = List.copyOf (removals);
        this.inversion = inversion;
        this.bass = bass;
        this.postEvents = List.copyOf (postEvents);
    }


    public Pitch getRoot ()
    {
        return this.root;
    }


    /** {@inheritDoc} */
    @Override
    public Duration getDuration ()
    {
        return this.duration;
    }


    public List<ChordQualityItem> getQuality ()
    {
        return this.quality;
    }


    public List<ChordQualityItem> getRemovals ()
    {
        return this.removals;
    }


    public Pitch getInversion ()
    {
        return this.inversion;
    }


    public Pitch getBass ()
    {
        return this.bass;
    }


    /** {@inheritDoc} */
    @Override
    public List<PostEvent> getPostEvents ()
    {
        return this.postEvents;
    }


    /** {@inheritDoc} */
    @Override
    public ChordModeEvent withDuration (final Duration newDuration)
    {
        return new ChordModeEvent (this.root, newDuration, this.quality, this.removals, this.inversion, this.bass, this.postEvents);
    }


    /** {@inheritDoc} */
    @Override
    public ChordModeEvent withPostEvents (final List<PostEvent> newPostEvents)
    {
        return new ChordModeEvent (this.root, this.duration, this.quality, this.removals, this.inversion, this.bass, newPostEvents);
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitChordModeEvent (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.root,
            this.duration,
            this.quality,
            this.removals,
            this.inversion,
            this.bass,
            this.postEvents
        };
    }
}
