// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.validator;

import de.mossgrabers.scoreconverter.format.lilypond.model.AfterGraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Assignment;
import de.mossgrabers.scoreconverter.format.lilypond.model.AutoBeamEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.BarCheck;
import de.mossgrabers.scoreconverter.format.lilypond.model.BarLine;
import de.mossgrabers.scoreconverter.format.lilypond.model.Block;
import de.mossgrabers.scoreconverter.format.lilypond.model.BlockType;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordQualityItem;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordRepetition;
import de.mossgrabers.scoreconverter.format.lilypond.model.ClefEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextChange;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumNoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.Figure;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FixedMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FunctionArgument;
import de.mossgrabers.scoreconverter.format.lilypond.model.GraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.HeaderBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.IdentifierMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.KeySignature;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.LyricEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.LyricModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.MarkEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.MarkupListMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.MarkupMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.MultiMeasureRest;
import de.mossgrabers.scoreconverter.format.lilypond.model.Multiplier;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicFunctionCall;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicVisitor;
import de.mossgrabers.scoreconverter.format.lilypond.model.NoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.OutputDefBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.PartialFunction;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.PropertyOperation;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RelativeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RepeatMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RestEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.SchemeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SimultaneousMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SkipEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.TempoEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.TextMarkEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.TimeSignature;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelExpression;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMarkup;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelScheme;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelVisitor;
import de.mossgrabers.scoreconverter.format.lilypond.model.TransposeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TupletMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Vocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;


/**
 * Lightweight structural checks of a LilyPond AST, e.g. balanced slurs, valid durations and known
 * context types. The checks are independent of the structural validation of the MEI document.
 *
 * @author Jürgen Moßgraber
 */
public class Validator implements MusicVisitor<Void>, ToplevelVisitor<Void>
{
    private static final Set<String>    CONTEXT_TYPES = Set.of ("Score", "StaffGroup", "ChoirStaff", "GrandStaff", "PianoStaff", "Staff", "RhythmicStaff", "TabStaff", "DrumStaff", "Voice", "TabVoice", "DrumVoice", "Lyrics", "ChordNames", "FiguredBass", "FretBoards", "Dynamics", "Devnull", "NullVoice", "CueVoice", "Global", "MensuralStaff", "MensuralVoice", "VaticanaStaff", "VaticanaVoice", "GregorianTranscriptionStaff", "GregorianTranscriptionVoice", "KievanStaff", "KievanVoice", "PetrucciStaff", "PetrucciVoice");
    private static final Set<String>    CLEF_NAMES    = Set.of ("treble", "violin", "G", "G2", "GG", "tenorG", "french", "soprano", "mezzosoprano", "alto", "C", "tenor", "baritone", "varbaritone", "bass", "F", "subbass", "varC", "altovarC", "tenorvarC", "percussion", "tab", "moderntab", "C1", "C2", "C3", "C4", "C5", "F3", "F4", "F5", "G1");

    private final List<ValidationError> errors        = new ArrayList<> ();


    /**
     * Validate a file.
     *
     * @param file The file to check
     * @return The found problems, empty if the AST is structurally fine
     */
    public static List<ValidationError> validate (final LilyPondFile file)
    {
        final Validator validator = new Validator ();
        for (final ToplevelExpression item: file.getItems ())
            item.accept (validator);
        return validator.errors;
    }


    /**
     * Validate a single music expression including the balance of its spanners.
     *
     * @param music The music to check
     * @return The found problems
     */
    public static List<ValidationError> validate (final Music music)
    {
        final Validator validator = new Validator ();
        validator.checkMusicItem (music);
        return validator.errors;
    }


    /**
     * Check if a clef name is known. Transposition suffixes like _8 or ^15 are accepted.
     *
     * @param name The clef name
     * @return True if known
     */
    public static boolean isKnownClef (final String name)
    {
        return CLEF_NAMES.contains (name.replaceFirst ("[_^][(\\[]?\\d+[)\\]]?$", ""));
    }


    private void checkMusicItem (final Music music)
    {
        music.accept (this);
        final SpanCounter counter = new SpanCounter ();
        counter.count (music);
        this.checkBalance (ValidationError.Type.UNMATCHED_SLUR, "slur", counter.getSlurs ());
        this.checkBalance (ValidationError.Type.UNMATCHED_PHRASING_SLUR, "phrasing slur", counter.getPhrasingSlurs ());
        this.checkBalance (ValidationError.Type.UNMATCHED_BEAM, "beam", counter.getBeams ());
        this.checkBalance (ValidationError.Type.UNMATCHED_HAIRPIN, "hairpin", counter.getHairpins ());
    }


    private void checkBalance (final ValidationError.Type type, final String name, final int [] counts)
    {
        if (counts[0] != counts[1])
            this.add (type, "Unmatched " + name + ": " + counts[0] + " open, " + counts[1] + " close");
    }


    private void add (final ValidationError.Type type, final String message)
    {
        this.errors.add (new ValidationError (type, message));
    }


    private void accept (final Music music)
    {
        if (music != null)
            music.accept (this);
    }


    private void acceptAll (final List<Music> items)
    {
        if (items != null)
            for (final Music item: items)
                item.accept (this);
    }


    private void checkDuration (final Duration duration)
    {
        if (duration == null)
            return;
        if (!Duration.isValidBase (duration.getBase ()))
            this.add (ValidationError.Type.INVALID_DURATION_BASE, "Invalid duration base " + duration.getBase () + ": must be a power of 2 (1..128)");
        if (duration.getDots () > 4)
            this.add (ValidationError.Type.EXCESSIVE_DOTS, "Excessive dots (" + duration.getDots () + "): maximum is 4");
        for (final Multiplier multiplier: duration.getMultipliers ())
        {
            if (multiplier.getDenominator () == 0)
                this.add (ValidationError.Type.ZERO_MULTIPLIER_DENOMINATOR, "Duration multiplier denominator is zero");
        }
    }


    private void checkEvent (final MusicEvent event)
    {
        this.checkDuration (event.getDuration ());
        for (final PostEvent postEvent: event.getPostEvents ())
        {
            switch (postEvent.getType ())
            {
                case DYNAMIC:
                    if (!Vocabulary.DYNAMICS.contains (postEvent.getValue ()))
                        this.add (ValidationError.Type.UNKNOWN_DYNAMIC, "Unknown dynamic marking '\\" + postEvent.getValue () + "'");
                    break;
                case FINGERING:
                    if (postEvent.getNumber () > 9)
                        this.add (ValidationError.Type.INVALID_FINGERING, "Fingering digit " + postEvent.getNumber () + " out of range (0-9)");
                    break;
                case STRING_NUMBER:
                    if (postEvent.getNumber () > 9)
                        this.add (ValidationError.Type.INVALID_STRING_NUMBER, "String number " + postEvent.getNumber () + " out of range (0-9)");
                    break;
                case TREMOLO:
                    final int value = postEvent.getNumber ();
                    if (value != 0 && (value < 8 || (value & value - 1) != 0))
                        this.add (ValidationError.Type.INVALID_TREMOLO, "Invalid tremolo type " + value + ": must be 0 or a power of 2 >= 8");
                    break;
                default:
                    break;
            }
        }
    }


    private void checkContextType (final String contextType)
    {
        if (!CONTEXT_TYPES.contains (contextType))
            this.add (ValidationError.Type.UNKNOWN_CONTEXT_TYPE, "Unknown context type '" + contextType + "'");
    }


    private void checkChordSteps (final List<ChordQualityItem> items)
    {
        for (final ChordQualityItem item: items)
        {
            if (!item.isModifier () && (item.getStep () < 1 || item.getStep () > 13))
                this.add (ValidationError.Type.INVALID_CHORD_STEP, "Invalid chord step " + item.getStep () + ": must be 1-13");
        }
    }


    ////////////////////////////////////////////////////////////////
    // Top-level expressions


    /** {@inheritDoc} */
    @Override
    public Void visitAssignment (final Assignment assignment)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitBlock (final Block block)
    {
        if (block.getType () == BlockType.SCORE)
        {
            boolean hasMusic = false;
            for (final ToplevelExpression item: block.getItems ())
                hasMusic |= item instanceof ToplevelMusic;
            if (!hasMusic)
                this.add (ValidationError.Type.SCORE_NO_MUSIC, "Score block has no music");
        }
        for (final ToplevelExpression item: block.getItems ())
            item.accept (this);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitHeader (final HeaderBlock header)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitOutputDef (final OutputDefBlock outputDef)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMusic (final ToplevelMusic music)
    {
        this.checkMusicItem (music.getMusic ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMarkup (final ToplevelMarkup markup)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitScheme (final ToplevelScheme scheme)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitRaw (final RawBlock raw)
    {
        return null;
    }


    ////////////////////////////////////////////////////////////////
    // Music


    /** {@inheritDoc} */
    @Override
    public Void visitSequentialMusic (final SequentialMusic sequentialMusic)
    {
        this.acceptAll (sequentialMusic.getItems ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitSimultaneousMusic (final SimultaneousMusic simultaneousMusic)
    {
        this.acceptAll (simultaneousMusic.getItems ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitRelativeMusic (final RelativeMusic relativeMusic)
    {
        this.accept (relativeMusic.getBody ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitFixedMusic (final FixedMusic fixedMusic)
    {
        this.accept (fixedMusic.getBody ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTransposeMusic (final TransposeMusic transposeMusic)
    {
        this.accept (transposeMusic.getBody ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTupletMusic (final TupletMusic tupletMusic)
    {
        if (tupletMusic.getNumerator () <= 0 || tupletMusic.getDenominator () <= 0)
            this.add (ValidationError.Type.INVALID_TUPLET_FRACTION, "Invalid tuplet fraction: numerator and denominator must be positive");
        this.checkDuration (tupletMusic.getSpanDuration ());
        this.accept (tupletMusic.getBody ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitContextMusic (final ContextMusic contextMusic)
    {
        this.checkContextType (contextMusic.getContextType ());
        this.accept (contextMusic.getBody ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitContextChange (final ContextChange contextChange)
    {
        this.checkContextType (contextChange.getContextType ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitNoteEvent (final NoteEvent noteEvent)
    {
        this.checkEvent (noteEvent);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitChordEvent (final ChordEvent chordEvent)
    {
        if (chordEvent.getPitches ().isEmpty ())
            this.add (ValidationError.Type.EMPTY_CHORD, "Chord must contain at least one pitch");
        this.checkEvent (chordEvent);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitChordRepetition (final ChordRepetition chordRepetition)
    {
        this.checkEvent (chordRepetition);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitChordModeEvent (final ChordModeEvent chordModeEvent)
    {
        this.checkChordSteps (chordModeEvent.getQuality ());
        this.checkChordSteps (chordModeEvent.getRemovals ());
        this.checkEvent (chordModeEvent);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitDrumNoteEvent (final DrumNoteEvent drumNoteEvent)
    {
        this.checkEvent (drumNoteEvent);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitDrumChordEvent (final DrumChordEvent drumChordEvent)
    {
        if (drumChordEvent.getDrumNames ().isEmpty ())
            this.add (ValidationError.Type.EMPTY_CHORD, "Drum chord must contain at least one drum");
        this.checkEvent (drumChordEvent);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitRestEvent (final RestEvent restEvent)
    {
        this.checkEvent (restEvent);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitSkipEvent (final SkipEvent skipEvent)
    {
        this.checkEvent (skipEvent);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMultiMeasureRest (final MultiMeasureRest multiMeasureRest)
    {
        this.checkEvent (multiMeasureRest);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitClefEvent (final ClefEvent clefEvent)
    {
        if (!isKnownClef (clefEvent.getName ()))
            this.add (ValidationError.Type.UNKNOWN_CLEF_NAME, "Unknown clef name '" + clefEvent.getName () + "'");
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitKeySignature (final KeySignature keySignature)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTimeSignature (final TimeSignature timeSignature)
    {
        boolean valid = !timeSignature.getNumerators ().isEmpty ();
        for (final Integer numerator: timeSignature.getNumerators ())
            valid &= numerator.intValue () > 0;
        if (!valid)
            this.add (ValidationError.Type.INVALID_TIME_NUMERATOR, "Invalid time signature: numerator must be positive");
        if (timeSignature.getDenominator () <= 0)
            this.add (ValidationError.Type.INVALID_TIME_DENOMINATOR, "Invalid time signature: denominator must be positive");
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitAutoBeamEvent (final AutoBeamEvent autoBeamEvent)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitGraceMusic (final GraceMusic graceMusic)
    {
        this.accept (graceMusic.getBody ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitAfterGraceMusic (final AfterGraceMusic afterGraceMusic)
    {
        final Multiplier fraction = afterGraceMusic.getFraction ();
        if (fraction != null && (fraction.getNumerator () <= 0 || fraction.getDenominator () <= 0))
            this.add (ValidationError.Type.INVALID_AFTER_GRACE_FRACTION, "Invalid afterGrace fraction: numerator and denominator must be positive");
        this.accept (afterGraceMusic.getMain ());
        this.accept (afterGraceMusic.getGrace ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitRepeatMusic (final RepeatMusic repeatMusic)
    {
        if (repeatMusic.getCount () <= 0)
            this.add (ValidationError.Type.INVALID_REPEAT_COUNT, "Invalid repeat count: must be positive");
        this.accept (repeatMusic.getBody ());
        this.acceptAll (repeatMusic.getAlternatives ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitLyricModeMusic (final LyricModeMusic lyricModeMusic)
    {
        this.acceptAll (lyricModeMusic.getItems ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitLyricEvent (final LyricEvent lyricEvent)
    {
        this.checkDuration (lyricEvent.getDuration ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitFigureModeMusic (final FigureModeMusic figureModeMusic)
    {
        this.acceptAll (figureModeMusic.getItems ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitFigureEvent (final FigureEvent figureEvent)
    {
        this.checkDuration (figureEvent.getDuration ());
        for (final Figure figure: figureEvent.getFigures ())
        {
            final Integer number = figure.getNumber ();
            if (number != null && (number.intValue () <= 0 || number.intValue () > 99))
                this.add (ValidationError.Type.INVALID_FIGURE_NUMBER, "Invalid figure number " + number + ": must be 1-99");
        }
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitChordModeMusic (final ChordModeMusic chordModeMusic)
    {
        this.acceptAll (chordModeMusic.getItems ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitDrumModeMusic (final DrumModeMusic drumModeMusic)
    {
        this.acceptAll (drumModeMusic.getItems ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMusicFunctionCall (final MusicFunctionCall musicFunctionCall)
    {
        this.checkArguments (musicFunctionCall.getArguments ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitPartialFunction (final PartialFunction partialFunction)
    {
        this.checkArguments (partialFunction.getArguments ());
        return null;
    }


    private void checkArguments (final List<FunctionArgument> arguments)
    {
        for (final FunctionArgument argument: arguments)
        {
            if (argument.getType () == FunctionArgument.Type.MUSIC)
                this.accept (argument.getMusic ());
            else if (argument.getType () == FunctionArgument.Type.DURATION)
                this.checkDuration (argument.getDuration ());
        }
    }


    /** {@inheritDoc} */
    @Override
    public Void visitIdentifierMusic (final IdentifierMusic identifierMusic)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTempoEvent (final TempoEvent tempoEvent)
    {
        if (tempoEvent.getText () == null && tempoEvent.getUnit () == null)
            this.add (ValidationError.Type.EMPTY_TEMPO, "Tempo must have text or metronome mark");
        this.checkDuration (tempoEvent.getUnit ());
        if (tempoEvent.getBpm () == null)
            return null;

        final int low = tempoEvent.getBpm ().getLow ();
        final Integer high = tempoEvent.getBpm ().getHigh ();
        if (low <= 0 || high != null && high.intValue () <= 0)
            this.add (ValidationError.Type.INVALID_TEMPO_BPM, "Tempo BPM must be positive");
        if (high != null && low >= high.intValue ())
            this.add (ValidationError.Type.INVALID_TEMPO_RANGE, "Tempo BPM range: low (" + low + ") must be less than high (" + high + ")");
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMarkEvent (final MarkEvent markEvent)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTextMarkEvent (final TextMarkEvent textMarkEvent)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMarkupMusic (final MarkupMusic markupMusic)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMarkupListMusic (final MarkupListMusic markupListMusic)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitRawMusic (final RawMusic rawMusic)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitSchemeMusic (final SchemeMusic schemeMusic)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitPropertyOperation (final PropertyOperation propertyOperation)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitBarCheck (final BarCheck barCheck)
    {
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitBarLine (final BarLine barLine)
    {
        if (barLine.getGlyph ().isEmpty ())
            this.add (ValidationError.Type.EMPTY_BAR_LINE, "Empty bar line type");
        return null;
    }
}
