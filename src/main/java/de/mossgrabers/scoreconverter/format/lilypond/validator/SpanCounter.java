// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.validator;

import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicTransformer;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;


/**
 * Counts the start and end post events of slurs, phrasing slurs, beams and hairpins in a music
 * expression. Each count is an array of 2 values: opened and closed.
 *
 * @author Jürgen Moßgraber
 */
class SpanCounter extends MusicTransformer
{
    private final int [] slurs          = new int [2];
    private final int [] phrasingSlurs  = new int [2];
    private final int [] beams          = new int [2];
    private final int [] hairpins       = new int [2];


    /**
     * Count all spanners of the given music.
     *
     * @param music The music
     */
    public void count (final Music music)
    {
        this.transform (music);
    }


    /** {@inheritDoc} */
    @Override
    protected Music transformEvent (final MusicEvent event)
    {
        for (final PostEvent postEvent: event.getPostEvents ())
        {
            switch (postEvent.getType ())
            {
                case SLUR_START:
                    this.slurs[0]++;
                    break;
                case SLUR_END:
                    this.slurs[1]++;
                    break;
                case PHRASING_SLUR_START:
                    this.phrasingSlurs[0]++;
                    break;
                case PHRASING_SLUR_END:
                    this.phrasingSlurs[1]++;
                    break;
                case BEAM_START:
                    this.beams[0]++;
                    break;
                case BEAM_END:
                    this.beams[1]++;
                    break;
                case CRESCENDO:
                case DECRESCENDO:
                    this.hairpins[0]++;
                    break;
                case HAIRPIN_END:
                    this.hairpins[1]++;
                    break;
                case DYNAMIC:
                    // A dynamic also ends a running hairpin
                    if (this.hairpins[0] > this.hairpins[1])
                        this.hairpins[1]++;
                    break;
                default:
                    break;
            }
        }
        return event;
    }


    public int [] getSlurs ()
    {
        return this.slurs;
    }


    public int [] getPhrasingSlurs ()
    {
        return this.phrasingSlurs;
    }


    public int [] getBeams ()
    {
        return this.beams;
    }


    public int [] getHairpins ()
    {
        return this.hairpins;
    }
}
