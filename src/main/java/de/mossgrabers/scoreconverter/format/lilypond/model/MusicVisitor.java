// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Visitor over all kinds of music. Every consumer of the syntax tree implements it, therefore a new
 * kind of music needs to be handled everywhere.
 *
 * @param <R> The result type
 *
 * @author Jürgen Moßgraber
 */
public interface MusicVisitor<R>
{
    /**
     * Visit a SequentialMusic.
     *
     * @param sequentialMusic The music
     * @return The result
     */
    R visitSequentialMusic (SequentialMusic sequentialMusic);


    /**
     * Visit a SimultaneousMusic.
     *
     * @param simultaneousMusic The music
     * @return The result
     */
    R visitSimultaneousMusic (SimultaneousMusic simultaneousMusic);


    /**
     * Visit a RelativeMusic.
     *
     * @param relativeMusic The music
     * @return The result
     */
    R visitRelativeMusic (RelativeMusic relativeMusic);


    /**
     * Visit a FixedMusic.
     *
     * @param fixedMusic The music
     * @return The result
     */
    R visitFixedMusic (FixedMusic fixedMusic);


    /**
     * Visit a TransposeMusic.
     *
     * @param transposeMusic The music
     * @return The result
     */
    R visitTransposeMusic (TransposeMusic transposeMusic);


    /**
     * Visit a TupletMusic.
     *
     * @param tupletMusic The music
     * @return The result
     */
    R visitTupletMusic (TupletMusic tupletMusic);


    /**
     * Visit a ContextMusic.
     *
     * @param contextMusic The music
     * @return The result
     */
    R visitContextMusic (ContextMusic contextMusic);


    /**
     * Visit a ContextChange.
     *
     * @param contextChange The music
     * @return The result
     */
    R visitContextChange (ContextChange contextChange);


    /**
     * Visit a NoteEvent.
     *
     * @param noteEvent The music
     * @return The result
     */
    R visitNoteEvent (NoteEvent noteEvent);


    /**
     * Visit a ChordEvent.
     *
     * @param chordEvent The music
     * @return The result
     */
    R visitChordEvent (ChordEvent chordEvent);


    /**
     * Visit a ChordRepetition.
     *
     * @param chordRepetition The music
     * @return The result
     */
    R visitChordRepetition (ChordRepetition chordRepetition);


    /**
     * Visit a ChordModeEvent.
     *
     * @param chordModeEvent The music
     * @return The result
     */
    R visitChordModeEvent (ChordModeEvent chordModeEvent);


    /**
     * Visit a DrumNoteEvent.
     *
     * @param drumNoteEvent The music
     * @return The result
     */
    R visitDrumNoteEvent (DrumNoteEvent drumNoteEvent);


    /**
     * Visit a DrumChordEvent.
     *
     * @param drumChordEvent The music
     * @return The result
     */
    R visitDrumChordEvent (DrumChordEvent drumChordEvent);


    /**
     * Visit a RestEvent.
     *
     * @param restEvent The music
     * @return The result
     */
    R visitRestEvent (RestEvent restEvent);


    /**
     * Visit a SkipEvent.
     *
     * @param skipEvent The music
     * @return The result
     */
    R visitSkipEvent (SkipEvent skipEvent);


    /**
     * Visit a MultiMeasureRest.
     *
     * @param multiMeasureRest The music
     * @return The result
     */
    R visitMultiMeasureRest (MultiMeasureRest multiMeasureRest);


    /**
     * Visit a ClefEvent.
     *
     * @param clefEvent The music
     * @return The result
     */
    R visitClefEvent (ClefEvent clefEvent);


    /**
     * Visit a KeySignature.
     *
     * @param keySignature The music
     * @return The result
     */
    R visitKeySignature (KeySignature keySignature);


    /**
     * Visit a TimeSignature.
     *
     * @param timeSignature The music
     * @return The result
     */
    R visitTimeSignature (TimeSignature timeSignature);


    /**
     * Visit a AutoBeamEvent.
     *
     * @param autoBeamEvent The music
     * @return The result
     */
    R visitAutoBeamEvent (AutoBeamEvent autoBeamEvent);


    /**
     * Visit a GraceMusic.
     *
     * @param graceMusic The music
     * @return The result
     */
    R visitGraceMusic (GraceMusic graceMusic);


    /**
     * Visit a AfterGraceMusic.
     *
     * @param afterGraceMusic The music
     * @return The result
     */
    R visitAfterGraceMusic (AfterGraceMusic afterGraceMusic);


    /**
     * Visit a RepeatMusic.
     *
     * @param repeatMusic The music
     * @return The result
     */
    R visitRepeatMusic (RepeatMusic repeatMusic);


    /**
     * Visit a LyricModeMusic.
     *
     * @param lyricModeMusic The music
     * @return The result
     */
    R visitLyricModeMusic (LyricModeMusic lyricModeMusic);


    /**
     * Visit a LyricEvent.
     *
     * @param lyricEvent The music
     * @return The result
     */
    R visitLyricEvent (LyricEvent lyricEvent);


    /**
     * Visit a FigureModeMusic.
     *
     * @param figureModeMusic The music
     * @return The result
     */
    R visitFigureModeMusic (FigureModeMusic figureModeMusic);


    /**
     * Visit a FigureEvent.
     *
     * @param figureEvent The music
     * @return The result
     */
    R visitFigureEvent (FigureEvent figureEvent);


    /**
     * Visit a ChordModeMusic.
     *
     * @param chordModeMusic The music
     * @return The result
     */
    R visitChordModeMusic (ChordModeMusic chordModeMusic);


    /**
     * Visit a DrumModeMusic.
     *
     * @param drumModeMusic The music
     * @return The result
     */
    R visitDrumModeMusic (DrumModeMusic drumModeMusic);


    /**
     * Visit a MusicFunctionCall.
     *
     * @param musicFunctionCall The music
     * @return The result
     */
    R visitMusicFunctionCall (MusicFunctionCall musicFunctionCall);


    /**
     * Visit a PartialFunction.
     *
     * @param partialFunction The music
     * @return The result
     */
    R visitPartialFunction (PartialFunction partialFunction);


    /**
     * Visit a IdentifierMusic.
     *
     * @param identifierMusic The music
     * @return The result
     */
    R visitIdentifierMusic (IdentifierMusic identifierMusic);


    /**
     * Visit a TempoEvent.
     *
     * @param tempoEvent The music
     * @return The result
     */
    R visitTempoEvent (TempoEvent tempoEvent);


    /**
     * Visit a MarkEvent.
     *
     * @param markEvent The music
     * @return The result
     */
    R visitMarkEvent (MarkEvent markEvent);


    /**
     * Visit a TextMarkEvent.
     *
     * @param textMarkEvent The music
     * @return The result
     */
    R visitTextMarkEvent (TextMarkEvent textMarkEvent);


    /**
     * Visit a MarkupMusic.
     *
     * @param markupMusic The music
     * @return The result
     */
    R visitMarkupMusic (MarkupMusic markupMusic);


    /**
     * Visit a MarkupListMusic.
     *
     * @param markupListMusic The music
     * @return The result
     */
    R visitMarkupListMusic (MarkupListMusic markupListMusic);


    /**
     * Visit a RawMusic.
     *
     * @param rawMusic The music
     * @return The result
     */
    R visitRawMusic (RawMusic rawMusic);


    /**
     * Visit a SchemeMusic.
     *
     * @param schemeMusic The music
     * @return The result
     */
    R visitSchemeMusic (SchemeMusic schemeMusic);


    /**
     * Visit a PropertyOperation.
     *
     * @param propertyOperation The music
     * @return The result
     */
    R visitPropertyOperation (PropertyOperation propertyOperation);


    /**
     * Visit a BarCheck.
     *
     * @param barCheck The music
     * @return The result
     */
    R visitBarCheck (BarCheck barCheck);


    /**
     * Visit a BarLine.
     *
     * @param barLine The music
     * @return The result
     */
    R visitBarLine (BarLine barLine);
}
