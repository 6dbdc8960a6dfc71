// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.format.lilypond.model.Block;
import de.mossgrabers.scoreconverter.format.lilypond.model.BlockType;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordQualityItem;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.Figure;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FunctionArgument;
import de.mossgrabers.scoreconverter.format.lilypond.model.IdentifierMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.Markup;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicFunctionCall;
import de.mossgrabers.scoreconverter.format.lilypond.model.NoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RelativeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TempoEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.TempoRange;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TupletMusic;

import org.junit.jupiter.api.Test;

import java.util.List;


/**
 * Tests for the parser.
 *
 * @author Jürgen Moßgraber
 */
class ParserTest
{
    @Test
    void chordModeWithQualityAndInversion () throws ParseError
    {
        final Music music = Parser.parseMusic ("c:dim7/f", InputMode.CHORDS);
        final ChordModeEvent chord = assertInstanceOf (ChordModeEvent.class, music);
        assertEquals (new Pitch ('c', 0, 0), chord.getRoot ());
        assertEquals (List.of (ChordQualityItem.modifier ("dim"), ChordQualityItem.step (7, 0)), chord.getQuality ());
        assertEquals (new Pitch ('f', 0, 0), chord.getInversion ());
        assertNull (chord.getBass ());
        assertNull (chord.getDuration ());
    }


    @Test
    void tempoWithTextAndRange () throws ParseError
    {
        final Music music = Parser.parseMusic ("\\tempo \"Vivace\" 4. = 132-144", InputMode.NOTES);
        final TempoEvent tempo = assertInstanceOf (TempoEvent.class, music);
        assertEquals (Markup.ofString ("Vivace"), tempo.getText ());
        assertEquals (new Duration (4, 1), tempo.getUnit ());
        assertEquals (new TempoRange (132, Integer.valueOf (144)), tempo.getBpm ());
        assertTrue (tempo.getBpm ().isRange ());
    }


    @Test
    void tempoNeedsTextOrMetronome ()
    {
        assertThrows (ParseError.class, () -> Parser.parseMusic ("\\tempo", InputMode.NOTES));
    }


    @Test
    void octaveMarksAndImplicitDuration () throws ParseError
    {
        final ParseResult result = Parser.parse ("{ c''4 d,, e }");
        assertTrue (result.getWarnings ().isEmpty ());

        final List<Music> items = sequentialItems (result.getFile ());
        assertEquals (3, items.size ());
        final NoteEvent first = (NoteEvent) items.get (0);
        assertEquals (2, first.getPitch ().getOctave ());
        assertEquals (new Duration (4, 0), first.getDuration ());
        assertEquals (-2, ((NoteEvent) items.get (1)).getPitch ().getOctave ());
        assertNull (((NoteEvent) items.get (1)).getDuration ());
        assertNull (((NoteEvent) items.get (2)).getDuration ());
    }


    @Test
    void mixedOctaveMarksAreSummedAndReportedOnce () throws ParseError
    {
        final ParseResult result = Parser.parse ("{ e',' }");
        final NoteEvent note = (NoteEvent) sequentialItems (result.getFile ()).get (0);
        assertEquals (1, note.getPitch ().getOctave ());
        assertEquals (1, result.getWarnings ().size ());
        assertEquals (ParseWarning.Type.MIXED_OCTAVE_MARKS, result.getWarnings ().get (0).getType ());
    }


    @Test
    void octaveMarksAfterTheDuration () throws ParseError
    {
        final ParseResult result = Parser.parse ("{ c'4, }");
        final NoteEvent note = (NoteEvent) sequentialItems (result.getFile ()).get (0);
        assertEquals (0, note.getPitch ().getOctave ());
        assertEquals (new Duration (4, 0), note.getDuration ());

        final List<ParseWarning> warnings = result.getWarnings ();
        assertEquals (2, warnings.size ());
        assertEquals (ParseWarning.Type.OCTAVE_AFTER_DURATION, warnings.get (0).getType ());
        assertEquals (ParseWarning.Type.MIXED_OCTAVE_MARKS, warnings.get (1).getType ());
    }


    @Test
    void accidentalFlagsAndOctaveCheck () throws ParseError
    {
        final NoteEvent note = (NoteEvent) Parser.parseMusic ("fis'!?='8", InputMode.NOTES);
        final Pitch pitch = note.getPitch ();
        assertEquals ('f', pitch.getStep ());
        assertEquals (1.0, pitch.getAlter ());
        assertTrue (pitch.isForceAccidental ());
        assertTrue (pitch.isCautionary ());
        assertEquals (Integer.valueOf (1), pitch.getOctaveCheck ());
        assertEquals (new Duration (8, 0), note.getDuration ());
    }


    @Test
    void postEvents () throws ParseError
    {
        final NoteEvent note = (NoteEvent) Parser.parseMusic ("c4~( -. ^\"dolce\" \\f \\<", InputMode.NOTES);
        final List<PostEvent> postEvents = note.getPostEvents ();
        assertEquals (6, postEvents.size ());
        assertEquals (PostEvent.Type.TIE, postEvents.get (0).getType ());
        assertEquals (PostEvent.Type.SLUR_START, postEvents.get (1).getType ());
        assertEquals (PostEvent.Type.ARTICULATION, postEvents.get (2).getType ());
        assertEquals (".", postEvents.get (2).getValue ());
        assertEquals (PostEvent.Type.TEXT_SCRIPT, postEvents.get (3).getType ());
        assertEquals (Markup.ofString ("dolce"), postEvents.get (3).getText ());
        assertEquals (PostEvent.Type.DYNAMIC, postEvents.get (4).getType ());
        assertEquals (PostEvent.Type.CRESCENDO, postEvents.get (5).getType ());
    }


    @Test
    void standalonePostEventsStartingWithTremolo () throws ParseError
    {
        final List<PostEvent> postEvents = Parser.parsePostEvents (":32 -.");
        assertEquals (2, postEvents.size ());
        assertEquals (PostEvent.Type.TREMOLO, postEvents.get (0).getType ());
        assertEquals (32, postEvents.get (0).getNumber ());
        assertEquals (PostEvent.Type.ARTICULATION, postEvents.get (1).getType ());

        final NoteEvent note = (NoteEvent) Parser.parseMusic ("c4:", InputMode.NOTES);
        assertEquals (0, note.getPostEvents ().get (0).getNumber ());
    }


    @Test
    void figureModifications () throws ParseError
    {
        final FigureModeMusic music = (FigureModeMusic) Parser.parseMusic ("\\figuremode { \\<5\\+ 3/ 7\\!\\>4 <7 5\\+\\\\>2 }", InputMode.NOTES);
        assertEquals (2, music.getItems ().size ());

        final List<Figure> figures = ((FigureEvent) music.getItems ().get (0)).getFigures ();
        assertEquals (3, figures.size ());
        assertEquals (List.of (Figure.Modification.AUGMENTED), figures.get (0).getModifications ());
        assertEquals (List.of (Figure.Modification.DIMINISHED), figures.get (1).getModifications ());
        assertEquals (List.of (Figure.Modification.NO_CONTINUATION), figures.get (2).getModifications ());

        final List<Figure> second = ((FigureEvent) music.getItems ().get (1)).getFigures ();
        assertTrue (second.get (0).getModifications ().isEmpty ());
        assertEquals (List.of (Figure.Modification.AUGMENTED, Figure.Modification.AUGMENTED_SLASH), second.get (1).getModifications ());
        assertEquals ("\\+\\\\", second.get (1).formatModifications ());
    }


    @Test
    void timesIsNormalizedToTuplet () throws ParseError
    {
        final TupletMusic tuplet = (TupletMusic) Parser.parseMusic ("\\times 2/3 { c8 d e }", InputMode.NOTES);
        assertEquals (3, tuplet.getNumerator ());
        assertEquals (2, tuplet.getDenominator ());
        assertEquals (tuplet, Parser.parseMusic ("\\tuplet 3/2 { c8 d e }", InputMode.NOTES));
    }


    @Test
    void relativeWithReference () throws ParseError
    {
        final RelativeMusic relative = (RelativeMusic) Parser.parseMusic ("\\relative c' { c d }", InputMode.NOTES);
        assertEquals (new Pitch ('c', 0, 1), relative.getReference ());
        assertInstanceOf (SequentialMusic.class, relative.getBody ());
    }


    @Test
    void functionCallsAndVariables () throws ParseError
    {
        final MusicFunctionCall call = (MusicFunctionCall) Parser.parseMusic ("\\tag #'score { c4 }", InputMode.NOTES);
        assertEquals ("tag", call.getName ());
        assertEquals (2, call.getArguments ().size ());
        assertEquals (FunctionArgument.Type.SCHEME, call.getArguments ().get (0).getType ());
        assertEquals (FunctionArgument.Type.MUSIC, call.getArguments ().get (1).getType ());

        final IdentifierMusic identifier = (IdentifierMusic) Parser.parseMusic ("\\melody", InputMode.NOTES);
        assertEquals ("melody", identifier.getName ());
    }


    @Test
    void recoveryInsideMusic () throws ParseError
    {
        final ParseResult result = Parser.parse ("{ c4 \\key c \\foo d4 | e4 }");
        final List<Music> items = sequentialItems (result.getFile ());
        assertEquals (4, items.size ());
        assertEquals (new RawMusic ("\\key c \\foo d4"), items.get (1));
        assertEquals (1, result.getWarnings ().size ());
        assertEquals (ParseWarning.Type.RECOVERED_ERROR, result.getWarnings ().get (0).getType ());
    }


    @Test
    void recoveryOnTopLevel () throws ParseError
    {
        final ParseResult result = Parser.parse ("\\version \"2.24.0\"\n\\score { c4 }\n\\header { title }");
        final LilyPondFile file = result.getFile ();
        assertEquals ("2.24.0", file.getVersion ());
        assertEquals (2, file.getItems ().size ());
        assertEquals (BlockType.SCORE, ((Block) file.getItems ().get (0)).getType ());
        assertInstanceOf (RawBlock.class, file.getItems ().get (1));
        assertEquals (ParseWarning.Type.RECOVERED_ERROR, result.getWarnings ().get (0).getType ());
    }


    @Test
    void unbalancedTailIsFatal ()
    {
        assertThrows (ParseError.class, () -> Parser.parse ("{ c4 d4"));
    }


    @Test
    void invalidDuration ()
    {
        final ParseError error = assertThrows (ParseError.class, () -> Parser.parseMusic ("c3", InputMode.NOTES));
        assertEquals (1, error.getErrorOffset ());
    }


    private static List<Music> sequentialItems (final LilyPondFile file)
    {
        final ToplevelMusic music = (ToplevelMusic) file.getItems ().get (0);
        return ((SequentialMusic) music.getMusic ()).getItems ();
    }
}
