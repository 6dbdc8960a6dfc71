// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.exports;

import de.mossgrabers.scoreconverter.convert.LabelCodec;
import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.convert.NotationMapping;
import de.mossgrabers.scoreconverter.extension.Metronome;
import de.mossgrabers.scoreconverter.format.lilypond.model.ClefEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Direction;
import de.mossgrabers.scoreconverter.format.lilypond.model.KeySignature;
import de.mossgrabers.scoreconverter.format.lilypond.model.Markup;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.TimeSignature;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.serializer.Serializer;
import de.mossgrabers.scoreconverter.format.mei.model.BeamSpan;
import de.mossgrabers.scoreconverter.format.mei.model.Chord;
import de.mossgrabers.scoreconverter.format.mei.model.ControlEvent;
import de.mossgrabers.scoreconverter.format.mei.model.Dir;
import de.mossgrabers.scoreconverter.format.mei.model.Dynam;
import de.mossgrabers.scoreconverter.format.mei.model.Hairpin;
import de.mossgrabers.scoreconverter.format.mei.model.LayerElement;
import de.mossgrabers.scoreconverter.format.mei.model.Note;
import de.mossgrabers.scoreconverter.format.mei.model.Slur;
import de.mossgrabers.scoreconverter.format.mei.model.StaffDef;
import de.mossgrabers.scoreconverter.format.mei.model.Tempo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;


/**
 * Turns control events back into LilyPond music: tempo marks and rehearsal marks which are
 * referenced from the event lists of the staves, the post events of layers which were not
 * created from LilyPond and the initial clef, key and time of a staff definition.
 *
 * @author Jürgen Moßgraber
 */
class ControlEventReplayer
{
    private final ExportContext context;


    /**
     * Constructor.
     *
     * @param context The export context
     */
    ControlEventReplayer (final ExportContext context)
    {
        this.context = context;
    }


    /**
     * Create the music for a referenced tempo or mark element.
     *
     * @param controlEvent The control event
     * @return The music or null if the element cannot be expressed
     */
    Music replay (final ControlEvent controlEvent)
    {
        final List<LabelSegment> segments = LabelCodec.decode (controlEvent.label);
        if (controlEvent instanceof final Tempo tempo)
            return this.replayTempo (tempo, segments);

        if (controlEvent instanceof Dir)
        {
            for (final String kind: List.of ("mark", "textmark"))
            {
                final Optional<LabelSegment> segment = LabelCodec.find (segments, kind);
                if (segment.isPresent ())
                    return this.context.parseMusic (controlEvent.id, segment.get ().getField (0), InputMode.NOTES);
            }
        }

        this.context.addNote (controlEvent.id, "The referenced element cannot be written as LilyPond.");
        return null;
    }


    private Music replayTempo (final Tempo tempo, final List<LabelSegment> segments)
    {
        final StringBuilder source = new StringBuilder ("\\tempo");
        final Optional<LabelSegment> markup = LabelCodec.find (segments, "markup");
        if (markup.isPresent ())
            source.append (' ').append (markup.get ().getField (0));
        else if (tempo.text != null)
            source.append (' ').append (Serializer.quote (tempo.text));

        final Optional<Metronome> metronome = this.context.getStore ().metronome (tempo.id);
        String unit = null;
        String bpm = null;
        if (metronome.isPresent () && metronome.get ().getForm () == Metronome.Form.BEAT_UNIT_BPM)
        {
            unit = metronome.get ().getUnit ();
            bpm = metronome.get ().getBpmLow ().toString ();
            if (metronome.get ().getBpmHigh () != null)
                bpm += "-" + metronome.get ().getBpmHigh ();
        }
        else if (tempo.mmUnit != null && tempo.mm != null)
        {
            unit = Integer.toString (NotationMapping.fromDur (tempo.mmUnit, 4)) + ".".repeat (tempo.mmDots == null ? 0 : tempo.mmDots.intValue ());
            bpm = Integer.toString ((int) Math.round (tempo.mm.doubleValue ()));
        }
        if (unit != null)
            source.append (' ').append (unit).append (" = ").append (bpm);

        if (markup.isEmpty () && tempo.text == null && unit == null)
        {
            this.context.addNote (tempo.id, "A tempo without text and metronome value is dropped.");
            return null;
        }
        return this.context.parseMusic (tempo.id, source.toString (), InputMode.NOTES);
    }


    /**
     * Derive the post events of the elements of a layer from the control events which refer to
     * them. Used for documents which were not created from LilyPond.
     *
     * @param elements The elements of the layer
     * @param controlEvents All control events of the measure
     * @return The post events by the ID of the element
     */
    static Map<String, List<PostEvent>> derivePostEvents (final List<LayerElement> elements, final List<ControlEvent> controlEvents)
    {
        final Map<String, List<PostEvent>> result = new HashMap<> ();
        for (final LayerElement element: elements)
        {
            final String tie = element instanceof final Note note ? note.tie : element instanceof final Chord chord ? chord.tie : null;
            if ("i".equals (tie) || "m".equals (tie))
                add (result, element.id, PostEvent.of (PostEvent.Type.TIE));
        }

        final Set<String> ids = new HashSet<> ();
        for (final LayerElement element: elements)
            ids.add (element.id);

        for (final ControlEvent controlEvent: controlEvents)
        {
            final String startId = controlEvent.getStartId ();
            if (startId == null || !ids.contains (startId))
                continue;
            final String endId = controlEvent.getEndId ();

            if (controlEvent instanceof Slur)
            {
                add (result, startId, PostEvent.of (PostEvent.Type.SLUR_START));
                if (endId != null)
                    add (result, endId, PostEvent.of (PostEvent.Type.SLUR_END));
            }
            else if (controlEvent instanceof BeamSpan)
            {
                add (result, startId, PostEvent.of (PostEvent.Type.BEAM_START));
                if (endId != null)
                    add (result, endId, PostEvent.of (PostEvent.Type.BEAM_END));
            }
            else if (controlEvent instanceof final Hairpin hairpin)
            {
                add (result, startId, PostEvent.of ("dim".equals (hairpin.form) ? PostEvent.Type.DECRESCENDO : PostEvent.Type.CRESCENDO));
                if (endId != null)
                    add (result, endId, PostEvent.of (PostEvent.Type.HAIRPIN_END));
            }
            else if (controlEvent instanceof final Dynam dynam && dynam.text != null)
                add (result, startId, PostEvent.named (PostEvent.Type.DYNAMIC, toDirection (dynam.place, Direction.NONE), dynam.text.trim ()));
            else if (controlEvent instanceof final Dir dir && dir.text != null && dir.label == null)
                add (result, startId, PostEvent.textScript (toDirection (dir.place, Direction.NEUTRAL), Markup.ofString (dir.text)));
        }
        return result;
    }


    /**
     * Create the clef, key and time signature of a staff definition.
     *
     * @param staffDef The staff definition
     * @return The music items
     */
    List<Music> createInitialItems (final StaffDef staffDef)
    {
        final List<Music> items = new ArrayList<> ();
        final ClefEvent clef = NotationMapping.getClef (staffDef);
        if (clef != null)
            items.add (clef);
        else if (staffDef.clefShape != null)
            this.context.addNote (staffDef.id, "The clef " + staffDef.clefShape + staffDef.clefLine + " has no LilyPond equivalent.");
        final KeySignature key = NotationMapping.getKey (staffDef);
        if (key != null)
            items.add (key);
        final TimeSignature time = NotationMapping.getMeter (staffDef);
        if (time != null)
            items.add (time);
        return items;
    }


    private static void add (final Map<String, List<PostEvent>> postEvents, final String id, final PostEvent postEvent)
    {
        postEvents.computeIfAbsent (id, key -> new ArrayList<> ()).add (postEvent);
    }


    private static Direction toDirection (final String place, final Direction defaultDirection)
    {
        if ("above".equals (place))
            return Direction.UP;
        if ("below".equals (place))
            return Direction.DOWN;
        return defaultDirection;
    }
}
