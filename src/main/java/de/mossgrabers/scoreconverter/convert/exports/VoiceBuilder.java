// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.exports;

import de.mossgrabers.scoreconverter.convert.LabelCodec;
import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.convert.StructureLabels;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.mei.model.ControlEvent;
import de.mossgrabers.scoreconverter.format.mei.model.LayerElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Creates the music of one voice from the elements of a layer, the items which were kept as
 * source text and the control events which span events of the layer.
 *
 * @author Jürgen Moßgraber
 */
class VoiceBuilder
{
    /** An item which was kept as source text, positioned in the event stream of the voice. */
    private static class Entry
    {
        private final int    position;
        private final int    ordinal;
        private final String owner;
        private final Music  music;


        Entry (final int position, final int ordinal, final String owner, final Music music)
        {
            this.position = position;
            this.ordinal = ordinal;
            this.owner = owner;
            this.music = music;
        }
    }


    private final ExportContext               context;
    private final List<ControlEvent>          controlEvents;
    private final Map<String, ControlEvent>   controlEventsById = new HashMap<> ();
    private final ControlEventReplayer        replayer;


    /**
     * Constructor.
     *
     * @param context The export context
     * @param controlEvents All control events of the score
     */
    VoiceBuilder (final ExportContext context, final List<ControlEvent> controlEvents)
    {
        this.context = context;
        this.controlEvents = controlEvents;
        this.replayer = new ControlEventReplayer (context);
        for (final ControlEvent controlEvent: controlEvents)
        {
            if (controlEvent.id != null)
                this.controlEventsById.put (controlEvent.id, controlEvent);
        }
    }


    /**
     * Build the music of a voice.
     *
     * @param label The label of the layer, null if the layer was not created from LilyPond
     * @param elements The elements of the layer
     * @param staffEntries The staff-wide items, only given for the first voice of a staff
     * @param initialItems Items which are placed before the first event
     * @param outerChain The wrapper segments of the enclosing staff and staff groups
     * @return The music of the voice
     * @throws ParseError Data in a label could not be parsed
     */
    Music build (final String label, final List<LayerElement> elements, final List<String> staffEntries, final List<Music> initialItems, final List<LabelSegment> outerChain) throws ParseError
    {
        final boolean isLabeled = label != null;
        final List<LabelSegment> segments = LabelCodec.decode (label);
        final InputMode mode = LabelCodec.find (segments, StructureLabels.DRUMMODE).isPresent () ? InputMode.DRUMS : InputMode.NOTES;

        // Events
        final Map<String, List<PostEvent>> derivedPostEvents = isLabeled ? Collections.emptyMap () : ControlEventReplayer.derivePostEvents (elements, this.controlEvents);
        final EventBuilder eventBuilder = new EventBuilder (this.context, derivedPostEvents);
        final Map<String, Integer> eventIndices = new HashMap<> ();
        final List<Music> events = new ArrayList<> ();
        for (final LayerElement element: elements)
        {
            eventIndices.put (element.id, Integer.valueOf (events.size ()));
            events.add (eventBuilder.build (element));
        }

        // Items which were kept as source text
        final Set<Music> keptItems = Collections.newSetFromMap (new IdentityHashMap<> ());
        final List<Entry> entries = new ArrayList<> ();
        final List<String> rawEntries = new ArrayList<> (staffEntries);
        LabelCodec.find (segments, "inline").ifPresent (segment -> rawEntries.addAll (segment.getFields ()));
        for (final String rawEntry: rawEntries)
        {
            final Entry entry = this.parseEntry (rawEntry, mode);
            if (entry != null)
            {
                entries.add (entry);
                keptItems.add (entry.music);
            }
        }
        entries.sort (Comparator.comparingInt ((final Entry entry) -> entry.position).thenComparingInt (entry -> entry.ordinal));

        // Build the node list: the items before each event, then the event
        final List<SpanReconstructor.Node> nodes = new ArrayList<> ();
        for (final Music item: initialItems)
            nodes.add (SpanReconstructor.Node.item ("", item));
        int entryIndex = 0;
        for (int i = 0; i <= events.size (); i++)
        {
            while (entryIndex < entries.size () && (entries.get (entryIndex).position <= i || i == events.size ()))
            {
                final Entry entry = entries.get (entryIndex);
                nodes.add (SpanReconstructor.Node.item (entry.owner, entry.music));
                entryIndex++;
            }
            if (i < events.size ())
                nodes.add (SpanReconstructor.Node.event (i, events.get (i)));
        }

        final List<ControlEvent> spans = new ArrayList<> ();
        for (final ControlEvent controlEvent: this.controlEvents)
        {
            if (eventIndices.containsKey (controlEvent.getStartId ()) && SpanReconstructor.isSpan (controlEvent))
                spans.add (controlEvent);
        }
        final List<Music> items = new SpanReconstructor (this.context, eventIndices).reconstruct (nodes, spans);

        Music body = LabelCodec.find (segments, "bare").isPresent () && items.size () == 1 ? items.get (0) : new SequentialMusic (items);
        body = StructureLabels.wrap (segments, body);
        body = new PitchContextRewriter (PitchContextRewriter.createContext (outerChain), keptItems).transform (body);

        final ContextMusic voice = StructureLabels.restoreContext (segments, "voice", body);
        return voice == null ? body : voice;
    }


    /**
     * Parse an entry of the form 'position.ordinal.owner=content'. The content is either LilyPond
     * source or the reference to a control event, e.g. '3.4.=@ly-tempo-7'.
     *
     * @param rawEntry The entry
     * @param mode The input mode of the voice
     * @return The entry or null if it is malformed or refers to a control event which cannot be
     *         expressed
     */
    private Entry parseEntry (final String rawEntry, final InputMode mode)
    {
        final int equals = rawEntry.indexOf ('=');
        final String [] position = rawEntry.substring (0, Math.max (equals, 0)).split ("\\.", 3);
        if (equals < 0 || position.length < 2 || !isNumber (position[0]) || !isNumber (position[1]))
        {
            this.context.addNote (null, "The malformed entry '" + rawEntry + "' is ignored.");
            return null;
        }

        final String content = rawEntry.substring (equals + 1);
        final String owner = position.length > 2 ? position[2] : "";
        final Music music;
        if (content.startsWith (LabelCodec.REFERENCE_PREFIX))
        {
            final ControlEvent controlEvent = this.controlEventsById.get (content.substring (LabelCodec.REFERENCE_PREFIX.length ()));
            if (controlEvent == null)
            {
                this.context.addNote (null, "The referenced element " + content + " does not exist.");
                return null;
            }
            music = this.replayer.replay (controlEvent);
            if (music == null)
                return null;
        }
        else
            music = this.context.parseMusic (null, content, mode);

        return new Entry (Integer.parseInt (position[0]), Integer.parseInt (position[1]), owner, music);
    }


    private static boolean isNumber (final String text)
    {
        return !text.isEmpty () && text.length () < 10 && text.chars ().allMatch (Character::isDigit);
    }
}
