// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.ArrayList;
import java.util.List;


/**
 * Base class for visitors which rebuild a music tree. The default implementation returns a copy
 * in which all children have been transformed; leaves are returned unchanged. Sub-classes override
 * the methods of the nodes they want to change.
 *
 * @author Jürgen Moßgraber
 */
public class MusicTransformer implements MusicVisitor<Music>
{
    /**
     * Transform a music expression.
     *
     * @param music The music, might be null
     * @return The transformed music or null
     */
    public Music transform (final Music music)
    {
        return music == null ? null : music.accept (this);
    }


    /**
     * Transform a list of music expressions.
     *
     * @param items The items, might be null
     * @return The transformed items or null
     */
    public List<Music> transformAll (final List<Music> items)
    {
        if (items == null)
            return null;
        final List<Music> result = new ArrayList<> (items.size ());
        for (final Music item: items)
            result.add (this.transform (item));
        return result;
    }


    private List<FunctionArgument> transformArguments (final List<FunctionArgument> arguments)
    {
        final List<FunctionArgument> result = new ArrayList<> (arguments.size ());
        for (final FunctionArgument argument: arguments)
            result.add (argument.getType () == FunctionArgument.Type.MUSIC ? argument.withMusic (this.transform (argument.getMusic ())) : argument);
        return result;
    }


    /**
     * Called for all events (notes, chords, rests, ...). Returns the event unchanged.
     *
     * @param event The event
     * @return The transformed event
     */
    protected Music transformEvent (final MusicEvent event)
    {
        return event;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitSequentialMusic (final SequentialMusic sequentialMusic)
    {
        return new SequentialMusic (this.transformAll (sequentialMusic.getItems ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitSimultaneousMusic (final SimultaneousMusic simultaneousMusic)
    {
        return new SimultaneousMusic (this.transformAll (simultaneousMusic.getItems ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitRelativeMusic (final RelativeMusic relativeMusic)
    {
        return new RelativeMusic (relativeMusic.getReference (), this.transform (relativeMusic.getBody ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitFixedMusic (final FixedMusic fixedMusic)
    {
        return new FixedMusic (fixedMusic.getReference (), this.transform (fixedMusic.getBody ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitTransposeMusic (final TransposeMusic transposeMusic)
    {
        return new TransposeMusic (transposeMusic.getFrom (), transposeMusic.getTo (), this.transform (transposeMusic.getBody ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitTupletMusic (final TupletMusic tupletMusic)
    {
        return new TupletMusic (tupletMusic.getNumerator (), tupletMusic.getDenominator (), tupletMusic.getSpanDuration (), this.transform (tupletMusic.getBody ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitContextMusic (final ContextMusic contextMusic)
    {
        return new ContextMusic (contextMusic.getKeyword (), contextMusic.getContextType (), contextMusic.getName (), contextMusic.getWithItems (), this.transform (contextMusic.getBody ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitContextChange (final ContextChange contextChange)
    {
        return contextChange;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitNoteEvent (final NoteEvent noteEvent)
    {
        return this.transformEvent (noteEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitChordEvent (final ChordEvent chordEvent)
    {
        return this.transformEvent (chordEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitChordRepetition (final ChordRepetition chordRepetition)
    {
        return this.transformEvent (chordRepetition);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitChordModeEvent (final ChordModeEvent chordModeEvent)
    {
        return this.transformEvent (chordModeEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitDrumNoteEvent (final DrumNoteEvent drumNoteEvent)
    {
        return this.transformEvent (drumNoteEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitDrumChordEvent (final DrumChordEvent drumChordEvent)
    {
        return this.transformEvent (drumChordEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitRestEvent (final RestEvent restEvent)
    {
        return this.transformEvent (restEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitSkipEvent (final SkipEvent skipEvent)
    {
        return this.transformEvent (skipEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitMultiMeasureRest (final MultiMeasureRest multiMeasureRest)
    {
        return this.transformEvent (multiMeasureRest);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitClefEvent (final ClefEvent clefEvent)
    {
        return clefEvent;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitKeySignature (final KeySignature keySignature)
    {
        return keySignature;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitTimeSignature (final TimeSignature timeSignature)
    {
        return timeSignature;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitAutoBeamEvent (final AutoBeamEvent autoBeamEvent)
    {
        return autoBeamEvent;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitGraceMusic (final GraceMusic graceMusic)
    {
        return new GraceMusic (graceMusic.getGraceType (), this.transform (graceMusic.getBody ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitAfterGraceMusic (final AfterGraceMusic afterGraceMusic)
    {
        return new AfterGraceMusic (afterGraceMusic.getFraction (), this.transform (afterGraceMusic.getMain ()), this.transform (afterGraceMusic.getGrace ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitRepeatMusic (final RepeatMusic repeatMusic)
    {
        return new RepeatMusic (repeatMusic.getRepeatType (), repeatMusic.getCount (), this.transform (repeatMusic.getBody ()), this.transformAll (repeatMusic.getAlternatives ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitLyricModeMusic (final LyricModeMusic lyricModeMusic)
    {
        return new LyricModeMusic (lyricModeMusic.getLyricsTo (), this.transformAll (lyricModeMusic.getItems ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitLyricEvent (final LyricEvent lyricEvent)
    {
        return this.transformEvent (lyricEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitFigureModeMusic (final FigureModeMusic figureModeMusic)
    {
        return new FigureModeMusic (this.transformAll (figureModeMusic.getItems ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitFigureEvent (final FigureEvent figureEvent)
    {
        return figureEvent;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitChordModeMusic (final ChordModeMusic chordModeMusic)
    {
        return new ChordModeMusic (this.transformAll (chordModeMusic.getItems ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitDrumModeMusic (final DrumModeMusic drumModeMusic)
    {
        return new DrumModeMusic (this.transformAll (drumModeMusic.getItems ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitMusicFunctionCall (final MusicFunctionCall musicFunctionCall)
    {
        return new MusicFunctionCall (musicFunctionCall.getName (), this.transformArguments (musicFunctionCall.getArguments ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitPartialFunction (final PartialFunction partialFunction)
    {
        return new PartialFunction (partialFunction.getName (), this.transformArguments (partialFunction.getArguments ()));
    }


    /** {@inheritDoc} */
    @Override
    public Music visitIdentifierMusic (final IdentifierMusic identifierMusic)
    {
        return identifierMusic;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitTempoEvent (final TempoEvent tempoEvent)
    {
        return tempoEvent;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitMarkEvent (final MarkEvent markEvent)
    {
        return markEvent;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitTextMarkEvent (final TextMarkEvent textMarkEvent)
    {
        return textMarkEvent;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitMarkupMusic (final MarkupMusic markupMusic)
    {
        return markupMusic;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitMarkupListMusic (final MarkupListMusic markupListMusic)
    {
        return markupListMusic;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitRawMusic (final RawMusic rawMusic)
    {
        return rawMusic;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitSchemeMusic (final SchemeMusic schemeMusic)
    {
        return schemeMusic;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitPropertyOperation (final PropertyOperation propertyOperation)
    {
        return propertyOperation;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitBarCheck (final BarCheck barCheck)
    {
        return barCheck;
    }


    /** {@inheritDoc} */
    @Override
    public Music visitBarLine (final BarLine barLine)
    {
        return barLine;
    }
}
