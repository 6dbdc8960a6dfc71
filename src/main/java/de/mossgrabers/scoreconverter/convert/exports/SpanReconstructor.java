// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.exports;

import de.mossgrabers.scoreconverter.convert.LabelCodec;
import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.convert.StructureLabels;
import de.mossgrabers.scoreconverter.format.lilypond.model.AfterGraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.GraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.GraceType;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Multiplier;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.RepeatMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RepeatType;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TupletMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;
import de.mossgrabers.scoreconverter.format.mei.model.ControlEvent;
import de.mossgrabers.scoreconverter.format.mei.model.Dir;
import de.mossgrabers.scoreconverter.format.mei.model.TupletSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Rebuilds the nested constructs of a voice (braces, relative music, tuplets, grace notes, repeats
 * with their alternatives) from the control events which span their first and last event. The
 * spans are applied from the smallest to the largest so that inner constructs are wrapped first.
 *
 * @author Jürgen Moßgraber
 */
class SpanReconstructor
{
    /** The kinds of direction labels which describe a span. */
    static final Set<String> SPAN_KINDS = Set.of (StructureLabels.SEQ, StructureLabels.RELATIVE, StructureLabels.FIXED, StructureLabels.TRANSPOSE, "tuplet", "grace", "aftergrace", "repeat", "ending");


    /** One element of the voice: an event, an item or an already wrapped construct. */
    static class Node
    {
        private final int     firstEvent;
        private final int     lastEvent;
        private final String  owner;
        private final Music   music;
        private final Integer endingIndex;


        Node (final int firstEvent, final int lastEvent, final String owner, final Music music, final Integer endingIndex)
        {
            this.firstEvent = firstEvent;
            this.lastEvent = lastEvent;
            this.owner = owner;
            this.music = music;
            this.endingIndex = endingIndex;
        }


        static Node event (final int index, final Music music)
        {
            return new Node (index, index, null, music, null);
        }


        static Node item (final String owner, final Music music)
        {
            return new Node (-1, -1, owner, music, null);
        }


        boolean hasEvents ()
        {
            return this.firstEvent >= 0;
        }


        Music getMusic ()
        {
            return this.music;
        }
    }


    private final ExportContext        context;
    private final Map<String, Integer> eventIndices;


    /**
     * Constructor.
     *
     * @param context The export context
     * @param eventIndices The index of each event of the voice by its ID
     */
    SpanReconstructor (final ExportContext context, final Map<String, Integer> eventIndices)
    {
        this.context = context;
        this.eventIndices = eventIndices;
    }


    /**
     * Check if a control event describes a span which this reconstructor handles.
     *
     * @param controlEvent The control event
     * @return True if it is a span
     */
    static boolean isSpan (final ControlEvent controlEvent)
    {
        if (controlEvent instanceof TupletSpan)
            return true;
        if (!(controlEvent instanceof Dir))
            return false;
        final List<LabelSegment> segments = LabelCodec.decode (controlEvent.label);
        return !segments.isEmpty () && SPAN_KINDS.contains (segments.get (0).getKind ());
    }


    /**
     * Apply all spans to the nodes of a voice.
     *
     * @param nodes The events and items of the voice in their order, the list is modified
     * @param spans The span control events of the voice in document order
     * @return The music of the voice
     * @throws ParseError A value in a label could not be parsed
     */
    List<Music> reconstruct (final List<Node> nodes, final List<ControlEvent> spans) throws ParseError
    {
        final List<ControlEvent> sorted = new ArrayList<> (spans);
        sorted.sort (Comparator.comparingInt (this::getEventCount));

        for (final ControlEvent span: sorted)
            this.apply (nodes, span);

        final List<Music> result = new ArrayList<> (nodes.size ());
        for (final Node node: nodes)
        {
            if (node.endingIndex != null)
                this.context.addNote (null, "An alternative ending without a repeat is written as plain music.");
            result.add (node.music);
        }
        return result;
    }


    private int getEventCount (final ControlEvent span)
    {
        final Integer start = this.eventIndices.get (span.getStartId ());
        final Integer end = this.eventIndices.get (span.getEndId ());
        if (start == null || end == null)
            return Integer.MAX_VALUE;
        return end.intValue () - start.intValue ();
    }


    private void apply (final List<Node> nodes, final ControlEvent span) throws ParseError
    {
        final Integer start = this.eventIndices.get (span.getStartId ());
        final Integer end = this.eventIndices.get (span.getEndId ());
        if (start == null || end == null)
        {
            this.context.addNote (span.id, "The span refers to unknown events and is ignored.");
            return;
        }

        int first = -1;
        int last = -1;
        for (int i = 0; i < nodes.size (); i++)
        {
            final Node node = nodes.get (i);
            if (first < 0 && node.hasEvents () && node.firstEvent == start.intValue ())
                first = i;
            if (node.hasEvents () && node.lastEvent == end.intValue ())
                last = i;
        }
        if (first < 0 || last < first)
        {
            this.context.addNote (span.id, "The span overlaps another construct and is ignored.");
            return;
        }

        while (first > 0 && isOwnedItem (nodes.get (first - 1), span.id))
            first--;
        while (last + 1 < nodes.size () && isOwnedItem (nodes.get (last + 1), span.id))
            last++;

        final List<Node> range = nodes.subList (first, last + 1);
        final Node wrapped = this.wrap (span, new ArrayList<> (range), start.intValue (), end.intValue ());
        range.clear ();
        nodes.add (first, wrapped);
    }


    private Node wrap (final ControlEvent span, final List<Node> inner, final int start, final int end) throws ParseError
    {
        final List<LabelSegment> segments = LabelCodec.decode (span.label);
        if (segments.isEmpty ())
        {
            // A tuplet from another source
            final TupletSpan tupletSpan = (TupletSpan) span;
            final int numerator = tupletSpan.num == null ? 3 : tupletSpan.num.intValue ();
            final int denominator = tupletSpan.numbase == null ? 2 : tupletSpan.numbase.intValue ();
            return new Node (start, end, null, new TupletMusic (numerator, denominator, null, sequential (inner)), null);
        }

        final LabelSegment segment = segments.get (0);
        final boolean isBare = segment.hasFlag ("bare");
        final Music music;
        switch (segment.getKind ())
        {
            case StructureLabels.SEQ:
                music = sequential (inner);
                break;

            case StructureLabels.RELATIVE:
            case StructureLabels.FIXED:
            case StructureLabels.TRANSPOSE:
                final List<String> fields = new ArrayList<> (segment.getFields ());
                fields.remove ("bare");
                music = StructureLabels.wrap (new LabelSegment (segment.getKind (), fields), body (inner, isBare));
                break;

            case "tuplet":
                final String [] fraction = segment.getField (0).split ("/");
                final String spanDuration = segment.getOption ("span");
                music = new TupletMusic (Integer.parseInt (fraction[0]), Integer.parseInt (fraction[1]), spanDuration == null ? null : parseDuration (spanDuration), body (inner, isBare));
                break;

            case "grace":
                final GraceType graceType = GraceType.fromCommand (segment.getField (0));
                music = new GraceMusic (graceType == null ? GraceType.GRACE : graceType, body (inner, isBare));
                break;

            case "ending":
                return new Node (start, end, null, body (inner, isBare), Integer.valueOf (segment.getField (0)));

            case "repeat":
                music = this.createRepeat (span, segment, inner, isBare);
                break;

            case "aftergrace":
                music = this.createAfterGrace (span, segment, inner);
                break;

            default:
                music = sequential (inner);
                break;
        }
        return new Node (start, end, null, music, null);
    }


    private Music createRepeat (final ControlEvent span, final LabelSegment segment, final List<Node> inner, final boolean isBare)
    {
        final String alternativeCount = segment.getOption ("alts");
        final int count = alternativeCount == null ? 0 : Integer.parseInt (alternativeCount);

        int bodyEnd = inner.size ();
        while (bodyEnd > 0 && inner.size () - bodyEnd < count && inner.get (bodyEnd - 1).endingIndex != null)
            bodyEnd--;
        final List<Node> endings = new ArrayList<> (inner.subList (bodyEnd, inner.size ()));
        endings.sort (Comparator.comparingInt (node -> node.endingIndex.intValue ()));
        if (endings.size () != count)
            this.context.addNote (span.id, "The repeat has " + endings.size () + " instead of " + count + " alternatives.");

        List<Music> alternatives = null;
        if (alternativeCount != null)
        {
            alternatives = new ArrayList<> ();
            for (final Node ending: endings)
                alternatives.add (ending.music);
        }

        RepeatType type = RepeatType.fromName (segment.getField (0));
        if (type == null)
        {
            this.context.addNote (span.id, "Unknown repeat type '" + segment.getField (0) + "', written as volta.");
            type = RepeatType.VOLTA;
        }
        final int times = Integer.parseInt (segment.getField (1));
        return new RepeatMusic (type, times, body (inner.subList (0, bodyEnd), isBare), alternatives);
    }


    private Music createAfterGrace (final ControlEvent span, final LabelSegment segment, final List<Node> inner)
    {
        final Integer split = this.eventIndices.get (segment.getOption ("split"));
        int splitNode = inner.size ();
        if (split != null)
        {
            for (int i = 0; i < inner.size (); i++)
            {
                final Node node = inner.get (i);
                if (node.hasEvents () && node.lastEvent >= split.intValue ())
                {
                    splitNode = i;
                    break;
                }
            }
        }
        if (splitNode == 0 || splitNode == inner.size ())
        {
            this.context.addNote (span.id, "The grace notes of an after grace could not be separated.");
            return sequential (inner);
        }

        final List<Node> mainNodes = inner.subList (0, splitNode);
        final List<Node> graceNodes = inner.subList (splitNode, inner.size ());
        final Music main = segment.hasFlag ("mainseq") ? sequential (mainNodes) : body (mainNodes, true);
        final Music grace = body (graceNodes, segment.hasFlag ("gracebare"));

        Multiplier fraction = null;
        final String fractionText = segment.getOption ("fraction");
        if (fractionText != null)
        {
            final String [] parts = fractionText.split ("/");
            fraction = new Multiplier (Integer.parseInt (parts[0]), Integer.parseInt (parts[1]));
        }
        return new AfterGraceMusic (fraction, main, grace);
    }


    private static boolean isOwnedItem (final Node node, final String spanId)
    {
        return !node.hasEvents () && node.endingIndex == null && spanId.equals (node.owner);
    }


    private static Music body (final List<Node> nodes, final boolean isBare)
    {
        if (isBare && nodes.size () == 1)
            return nodes.get (0).music;
        return sequential (nodes);
    }


    private static SequentialMusic sequential (final List<Node> nodes)
    {
        final List<Music> items = new ArrayList<> (nodes.size ());
        for (final Node node: nodes)
            items.add (node.music);
        return new SequentialMusic (items);
    }


    private static Duration parseDuration (final String text) throws ParseError
    {
        final Music music = Parser.parseMusic ("s" + text, InputMode.NOTES);
        return music instanceof final MusicEvent event ? event.getDuration () : null;
    }
}
