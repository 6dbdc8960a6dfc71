// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.exports;

import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.convert.PitchContext;
import de.mossgrabers.scoreconverter.convert.StructureLabels;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.FixedMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicTransformer;
import de.mossgrabers.scoreconverter.format.lilypond.model.NoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.RelativeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TransposeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;


/**
 * Rewrites the absolute pitches of the exported events into the pitches which have to be written
 * inside of relative, fixed and transposed music. Items which were kept as source text are
 * already written correctly and are not touched.
 *
 * @author Jürgen Moßgraber
 */
class PitchContextRewriter extends MusicTransformer
{
    private final Set<Music> keptItems;
    private PitchContext     pitchContext;


    /**
     * Constructor.
     *
     * @param pitchContext The context at the start of the music
     * @param keptItems The items which are not rewritten, compared by identity
     */
    PitchContextRewriter (final PitchContext pitchContext, final Set<Music> keptItems)
    {
        this.pitchContext = pitchContext;
        this.keptItems = keptItems;
    }


    /**
     * Create the pitch context which results from the wrapper segments of the enclosing staff
     * groups and staves.
     *
     * @param segments The segments from the outermost to the innermost, other segments than
     *            wrappers are ignored
     * @return The context
     * @throws ParseError A pitch in a segment could not be parsed
     */
    static PitchContext createContext (final List<LabelSegment> segments) throws ParseError
    {
        PitchContext context = PitchContext.absolute ();
        for (final LabelSegment segment: segments)
        {
            switch (segment.getKind ())
            {
                case StructureLabels.RELATIVE:
                    context = context.enterRelative (segment.getField (0) == null ? null : StructureLabels.parsePitch (segment.getField (0)));
                    break;
                case StructureLabels.FIXED:
                    context = context.enterFixed (StructureLabels.parsePitch (segment.getField (0)));
                    break;
                case StructureLabels.TRANSPOSE:
                    context = context.enterTranspose (StructureLabels.parsePitch (segment.getField (0)), StructureLabels.parsePitch (segment.getField (1)));
                    break;
                default:
                    break;
            }
        }
        return context;
    }


    /** {@inheritDoc} */
    @Override
    public Music transform (final Music music)
    {
        if (music == null || this.keptItems.contains (music))
            return music;
        return super.transform (music);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitRelativeMusic (final RelativeMusic relativeMusic)
    {
        final PitchContext previous = this.pitchContext;
        this.pitchContext = previous.enterRelative (relativeMusic.getReference ());
        final Music result = super.visitRelativeMusic (relativeMusic);
        this.pitchContext = previous;
        return result;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitFixedMusic (final FixedMusic fixedMusic)
    {
        final PitchContext previous = this.pitchContext;
        this.pitchContext = previous.enterFixed (fixedMusic.getReference ());
        final Music result = super.visitFixedMusic (fixedMusic);
        this.pitchContext = previous;
        return result;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitTransposeMusic (final TransposeMusic transposeMusic)
    {
        final PitchContext previous = this.pitchContext;
        this.pitchContext = previous.enterTranspose (transposeMusic.getFrom (), transposeMusic.getTo ());
        final Music result = super.visitTransposeMusic (transposeMusic);
        this.pitchContext = previous;
        return result;
    }


    /** {@inheritDoc} */
    @Override
    protected Music transformEvent (final MusicEvent event)
    {
        if (event instanceof final NoteEvent noteEvent)
            return new NoteEvent (this.pitchContext.toWritten (noteEvent.getPitch ()), noteEvent.isPitchedRest (), noteEvent.getDuration (), noteEvent.getPostEvents ());

        if (event instanceof final ChordEvent chordEvent)
        {
            final List<Pitch> pitches = new ArrayList<> ();
            this.pitchContext.startChord ();
            for (final Pitch pitch: chordEvent.getPitches ())
                pitches.add (this.pitchContext.toWritten (pitch));
            this.pitchContext.endChord ();
            return new ChordEvent (pitches, chordEvent.getDuration (), chordEvent.getPostEvents ());
        }
        return event;
    }
}
