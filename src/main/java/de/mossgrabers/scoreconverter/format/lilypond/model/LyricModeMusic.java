// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * Lyrics, either in \lyricmode or aligned to a voice with \lyricsto.
 *
 * @author Jürgen Moßgraber
 */
public class LyricModeMusic extends Music
{
    private final String      lyricsTo;
    private final List<Music> items;


    /**
     * Constructor.
     *
     * @param lyricsTo The name of the voice the lyrics are aligned to, null for \lyricmode
     * @param items The syllables
     */
    public LyricModeMusic (final String lyricsTo, final List<Music> items)
    {
        this.lyricsTo = lyricsTo;
        this.items = List.copyOf (items);
    }


    public String getLyricsTo ()
    {
        return this.lyricsTo;
    }


    public List<Music> getItems ()
    {
        return this.items;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitLyricModeMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.lyricsTo,
            this.items
        };
    }
}
