// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.imports;

import de.mossgrabers.scoreconverter.format.lilypond.model.AfterGraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.FixedMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.GraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.LyricEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.RelativeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RepeatMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TransposeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TupletMusic;


/**
 * Checks if a music expression of a voice contains events which become layer events. Constructs
 * without such events are kept as source text instead of being spread over the layer.
 *
 * @author Jürgen Moßgraber
 */
class EventFinder
{
    /**
     * Private constructor since this is a utility class.
     */
    private EventFinder ()
    {
        // Intentionally empty
    }


    /**
     * Check if the music becomes at least one layer event.
     *
     * @param music The music
     * @return True if it contains events
     */
    static boolean hasEvents (final Music music)
    {
        if (music instanceof ChordModeEvent || music instanceof LyricEvent)
            return false;
        if (music instanceof MusicEvent)
            return true;
        if (music instanceof final SequentialMusic sequentialMusic)
        {
            for (final Music item: sequentialMusic.getItems ())
            {
                if (hasEvents (item))
                    return true;
            }
            return false;
        }
        if (music instanceof final RelativeMusic relativeMusic)
            return hasEvents (relativeMusic.getBody ());
        if (music instanceof final FixedMusic fixedMusic)
            return hasEvents (fixedMusic.getBody ());
        if (music instanceof final TransposeMusic transposeMusic)
            return hasEvents (transposeMusic.getBody ());
        if (music instanceof final TupletMusic tupletMusic)
            return hasEvents (tupletMusic.getBody ());
        if (music instanceof final GraceMusic graceMusic)
            return hasEvents (graceMusic.getBody ());
        if (music instanceof final AfterGraceMusic afterGraceMusic)
            return hasEvents (afterGraceMusic.getMain ()) && hasEvents (afterGraceMusic.getGrace ());
        if (music instanceof final RepeatMusic repeatMusic)
        {
            if (!hasEvents (repeatMusic.getBody ()))
                return false;
            if (repeatMusic.getAlternatives () != null)
            {
                for (final Music alternative: repeatMusic.getAlternatives ())
                {
                    if (!hasEvents (alternative))
                        return false;
                }
            }
            return true;
        }
        return false;
    }
}
