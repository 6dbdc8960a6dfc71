// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

/**
 * The input modes of LilyPond. The mode decides how words are interpreted.
 *
 * @author Jürgen Moßgraber
 */
public enum InputMode
{
    /** Words are note names. */
    NOTES,
    /** Words are chord roots followed by quality items. */
    CHORDS,
    /** Angle brackets contain figured bass figures. */
    FIGURES,
    /** Words are drum names. */
    DRUMS,
    /** Words are lyric syllables. */
    LYRICS
}
