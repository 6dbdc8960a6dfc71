// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.exports;

import de.mossgrabers.scoreconverter.convert.LabelCodec;
import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.convert.NotationMapping;
import de.mossgrabers.scoreconverter.convert.StructureLabels;
import de.mossgrabers.scoreconverter.extension.DrumEvent;
import de.mossgrabers.scoreconverter.extension.MRestDetail;
import de.mossgrabers.scoreconverter.extension.PitchedRest;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordRepetition;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.MultiMeasureRest;
import de.mossgrabers.scoreconverter.format.lilypond.model.Multiplier;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.NoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.RestEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.SkipEvent;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;
import de.mossgrabers.scoreconverter.format.mei.model.Chord;
import de.mossgrabers.scoreconverter.format.mei.model.LayerElement;
import de.mossgrabers.scoreconverter.format.mei.model.MRest;
import de.mossgrabers.scoreconverter.format.mei.model.Note;
import de.mossgrabers.scoreconverter.format.mei.model.Rest;
import de.mossgrabers.scoreconverter.format.mei.model.Space;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;


/**
 * Creates the LilyPond event for a layer element. The pitches of the created notes and chords
 * are absolute, they are rewritten afterwards for relative music.
 *
 * @author Jürgen Moßgraber
 */
class EventBuilder
{
    private final ExportContext                context;
    private final Map<String, List<PostEvent>> derivedPostEvents;


    /**
     * Constructor.
     *
     * @param context The export context
     * @param derivedPostEvents The post events which were derived from the control events of the
     *            layer, used for elements which do not carry their post events in the label
     */
    EventBuilder (final ExportContext context, final Map<String, List<PostEvent>> derivedPostEvents)
    {
        this.context = context;
        this.derivedPostEvents = derivedPostEvents;
    }


    /**
     * Create the event for a layer element.
     *
     * @param element The element
     * @return The event
     * @throws ParseError The duration of a multi-measure rest in the extension store could not be parsed
     */
    Music build (final LayerElement element) throws ParseError
    {
        final List<LabelSegment> segments = LabelCodec.decode (element.label);
        final Optional<LabelSegment> post = LabelCodec.find (segments, "post");
        final List<PostEvent> postEvents = post.isPresent () ? this.context.parsePostEvents (element.id, post.get ().getField (0)) : this.derivedPostEvents.getOrDefault (element.id, Collections.emptyList ());
        final boolean isRepetition = LabelCodec.find (segments, "q").isPresent ();

        if (element instanceof final Note note)
        {
            final Optional<DrumEvent> drumEvent = this.context.getStore ().drumEvent (note.id);
            if (drumEvent.isPresent ())
                return this.context.parseMusic (note.id, drumEvent.get ().getSource (), InputMode.DRUMS);
            final Pitch pitch = NotationMapping.getPitch (note);
            if (pitch == null)
            {
                this.context.addNote (note.id, "A note without a pitch is written as a skip.");
                return new SkipEvent (createDuration (element, segments, 4), postEvents);
            }
            return new NoteEvent (applyDisplay (pitch, segments), false, createDuration (element, segments, 4), postEvents);
        }

        if (element instanceof final Chord chord)
        {
            if (isRepetition)
                return new ChordRepetition (createDuration (element, segments, 4), postEvents);
            final List<Pitch> pitches = new ArrayList<> ();
            for (final Note note: chord.notes)
            {
                final Pitch pitch = NotationMapping.getPitch (note);
                if (pitch == null)
                    this.context.addNote (note.id, "A note without a pitch in a chord is dropped.");
                else
                    pitches.add (applyDisplay (pitch, LabelCodec.decode (note.label)));
            }
            return new ChordEvent (pitches, createDuration (element, segments, 4), postEvents);
        }

        if (element instanceof final Rest rest)
        {
            final Optional<PitchedRest> pitchedRest = this.context.getStore ().pitchedRest (rest.id);
            if (pitchedRest.isPresent ())
                return new NoteEvent (StructureLabels.parsePitch (pitchedRest.get ().getPitch ()), true, createDuration (element, segments, 4), postEvents);
            if (rest.ploc != null && rest.ploc.length () == 1)
            {
                final int octave = rest.oloc == null ? 0 : rest.oloc.intValue () - Pitch.BASE_OCTAVE;
                return new NoteEvent (new Pitch (rest.ploc.charAt (0), 0, octave), true, createDuration (element, segments, 4), postEvents);
            }
            return new RestEvent (createDuration (element, segments, 4), postEvents);
        }

        if (element instanceof MRest)
        {
            final Optional<MRestDetail> detail = this.context.getStore ().mrestDetail (element.id);
            Duration duration = createDuration (element, segments, 1);
            if (detail.isPresent ())
                duration = detail.get ().getDuration ().isEmpty () ? null : ((MultiMeasureRest) Parser.parseMusic ("R" + detail.get ().getDuration (), InputMode.NOTES)).getDuration ();
            return new MultiMeasureRest (duration, postEvents);
        }

        if (element instanceof Space && isRepetition)
            return new ChordRepetition (createDuration (element, segments, 4), postEvents);
        return new SkipEvent (createDuration (element, segments, 4), postEvents);
    }


    /**
     * Create the duration of an element from the dur and dots attributes and the multipliers in
     * the label.
     *
     * @param element The element
     * @param segments The segments of the label of the element
     * @param defaultBase The base if the element has no duration
     * @return The duration or null if the duration was not written
     */
    private static Duration createDuration (final LayerElement element, final List<LabelSegment> segments, final int defaultBase)
    {
        if (LabelCodec.find (segments, "dur").map (segment -> segment.hasFlag ("implicit")).orElse (Boolean.FALSE).booleanValue ())
            return null;

        final List<Multiplier> multipliers = new ArrayList<> ();
        final Optional<LabelSegment> mul = LabelCodec.find (segments, "mul");
        if (mul.isPresent ())
        {
            for (final String field: mul.get ().getFields ())
            {
                final int slash = field.indexOf ('/');
                if (slash > 0)
                    multipliers.add (new Multiplier (Integer.parseInt (field.substring (0, slash)), Integer.parseInt (field.substring (slash + 1))));
            }
        }
        final int dots = element.dots == null ? 0 : element.dots.intValue ();
        return new Duration (NotationMapping.fromDur (element.dur, defaultBase), dots, multipliers);
    }


    private static Pitch applyDisplay (final Pitch pitch, final List<LabelSegment> segments)
    {
        final Optional<LabelSegment> accidental = LabelCodec.find (segments, "acc");
        final Optional<LabelSegment> octaveCheck = LabelCodec.find (segments, "ochk");
        if (accidental.isEmpty () && octaveCheck.isEmpty ())
            return pitch;
        final boolean force = accidental.isPresent () && accidental.get ().hasFlag ("force");
        final boolean caution = accidental.isPresent () && accidental.get ().hasFlag ("caution");
        final Integer check = octaveCheck.isPresent () ? Integer.valueOf (octaveCheck.get ().getField (0)) : null;
        return new Pitch (pitch.getStep (), pitch.getAlter (), pitch.getOctave (), force, caution, check);
    }
}
