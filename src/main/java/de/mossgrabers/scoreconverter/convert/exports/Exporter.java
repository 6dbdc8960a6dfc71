// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.exports;

import de.mossgrabers.scoreconverter.convert.LabelCodec;
import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.convert.StructureLabels;
import de.mossgrabers.scoreconverter.core.ConversionNote;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextKeyword;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SimultaneousMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.MusicParser;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.mei.model.ControlEvent;
import de.mossgrabers.scoreconverter.format.mei.model.Layer;
import de.mossgrabers.scoreconverter.format.mei.model.LayerElement;
import de.mossgrabers.scoreconverter.format.mei.model.Mdiv;
import de.mossgrabers.scoreconverter.format.mei.model.Measure;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;
import de.mossgrabers.scoreconverter.format.mei.model.MeiElement;
import de.mossgrabers.scoreconverter.format.mei.model.Score;
import de.mossgrabers.scoreconverter.format.mei.model.Section;
import de.mossgrabers.scoreconverter.format.mei.model.Staff;
import de.mossgrabers.scoreconverter.format.mei.model.StaffDef;
import de.mossgrabers.scoreconverter.format.mei.model.StaffGrp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;


/**
 * Converts a MEI document back into a LilyPond file. The labels and the extension store which
 * were written by the importer restore the original structure. Documents from other sources
 * (no labels, empty store) are written as plain absolute music with one staff per staff
 * definition.
 *
 * @author Jürgen Moßgraber
 */
public class Exporter
{
    /** The LilyPond version which is written if the document does not contain one. */
    public static final String        DEFAULT_VERSION = "2.24.0";

    private static final Set<String>  GROUP_PARTS     = Set.of ("lyrics", "chordnames", "figuredbass", "part");
    private static final Set<String>  STAFF_PARTS     = Set.of ("part");

    private final String              defaultVersion;
    private ExportContext             context;
    private VoiceBuilder              voiceBuilder;
    private ControlEventReplayer      replayer;
    private Map<Integer, List<Layer>> layers;


    /**
     * Constructor.
     */
    public Exporter ()
    {
        this (DEFAULT_VERSION);
    }


    /**
     * Constructor.
     *
     * @param defaultVersion The LilyPond version to write if the document does not contain one
     */
    public Exporter (final String defaultVersion)
    {
        this.defaultVersion = defaultVersion;
    }


    /**
     * Convert a document.
     *
     * @param mei The document
     * @param store The extension store of the document, may be empty
     * @return The LilyPond file
     * @throws ParseError Source text which is stored in a label or the store could not be parsed
     */
    public LilyPondFile exportDocument (final Mei mei, final ExtensionStore store) throws ParseError
    {
        this.context = new ExportContext (store);
        this.replayer = new ControlEventReplayer (this.context);

        final Map<String, Music> music = new LinkedHashMap<> ();
        if (mei.music != null && mei.music.body != null)
        {
            for (final Mdiv mdiv: mei.music.body.mdivs)
            {
                if (mdiv.score == null)
                    this.context.addNote (mdiv.id, "The division contains no score.");
                else
                    music.put (mdiv.id, this.exportScore (mdiv.score));
            }
        }
        return new BookReconstructor (this.context).reconstruct (mei, music, this.defaultVersion);
    }


    /**
     * Get the notes about everything which could only be approximated in the last export.
     *
     * @return The notes
     */
    public List<ConversionNote> getNotes ()
    {
        return this.context == null ? Collections.emptyList () : Collections.unmodifiableList (this.context.getNotes ());
    }


    private Music exportScore (final Score score) throws ParseError
    {
        // Layers with the same number in several measures are joined
        final TreeMap<Integer, TreeMap<Integer, Layer>> joined = new TreeMap<> ();
        final List<ControlEvent> controlEvents = new ArrayList<> ();
        for (final Section section: score.sections)
        {
            for (final Measure measure: section.measures)
            {
                controlEvents.addAll (measure.controlEvents);
                for (final Staff staff: measure.staves)
                {
                    final TreeMap<Integer, Layer> staffLayers = joined.computeIfAbsent (staff.n == null ? Integer.valueOf (1) : staff.n, n -> new TreeMap<> ());
                    for (int i = 0; i < staff.layers.size (); i++)
                    {
                        final Layer layer = staff.layers.get (i);
                        final Integer n = layer.n == null ? Integer.valueOf (i + 1) : layer.n;
                        final Layer target = staffLayers.computeIfAbsent (n, key -> {
                            final Layer created = new Layer ();
                            created.n = key;
                            created.label = layer.label;
                            return created;
                        });
                        target.children.addAll (layer.children);
                    }
                }
            }
        }

        this.layers = new TreeMap<> ();
        for (final Map.Entry<Integer, TreeMap<Integer, Layer>> entry: joined.entrySet ())
            this.layers.put (entry.getKey (), new ArrayList<> (entry.getValue ().values ()));
        this.voiceBuilder = new VoiceBuilder (this.context, controlEvents);

        return this.exportGroup (score.scoreDef.staffGrp, true, Collections.emptyList ());
    }


    private Music exportGroup (final StaffGrp staffGrp, final boolean isRoot, final List<LabelSegment> outerChain) throws ParseError
    {
        final List<LabelSegment> segments = LabelCodec.decode (staffGrp.label);
        final List<LabelSegment> chain = extendChain (outerChain, segments);

        final List<Music> items = new ArrayList<> ();
        for (final MeiElement child: staffGrp.children)
        {
            if (child instanceof final StaffGrp group)
                items.add (this.exportGroup (group, false, chain));
            else if (child instanceof final StaffDef staffDef)
                items.add (this.exportStaff (staffDef, chain));
        }
        this.insertParts (items, segments, GROUP_PARTS);

        final boolean isLabeled = staffGrp.label != null;
        Music body = this.combine (items, LabelCodec.find (segments, "sim").isPresent () || !isLabeled && items.size () > 1);
        body = StructureLabels.wrap (segments, body);
        if (isRoot)
            return body;

        final ContextMusic group = StructureLabels.restoreContext (segments, "group", body);
        if (group != null)
            return group;
        if (!isLabeled)
            return new ContextMusic (ContextKeyword.NEW, "brace".equals (staffGrp.symbol) ? "PianoStaff" : "StaffGroup", null, null, body);
        return body;
    }


    private Music exportStaff (final StaffDef staffDef, final List<LabelSegment> outerChain) throws ParseError
    {
        final List<LabelSegment> segments = LabelCodec.decode (staffDef.label);
        final boolean isLabeled = staffDef.label != null;
        final List<LabelSegment> chain = extendChain (outerChain, segments);
        final List<String> staffEntries = LabelCodec.find (segments, "events").map (LabelSegment::getFields).orElse (Collections.emptyList ());
        final List<Music> initialItems = isLabeled ? Collections.emptyList () : this.replayer.createInitialItems (staffDef);

        final List<Layer> staffLayers = staffDef.n == null ? null : this.layers.get (staffDef.n);
        final List<Music> items = new ArrayList<> ();
        if (staffLayers == null || staffLayers.isEmpty ())
            this.context.addNote (staffDef.id, "The staff definition has no staff with content.");
        else
        {
            for (int i = 0; i < staffLayers.size (); i++)
            {
                final Layer layer = staffLayers.get (i);
                final boolean isFirst = i == 0;
                if (!isFirst && (!isLabeled || LabelCodec.find (LabelCodec.decode (layer.label), "sep").isPresent ()))
                    items.add (new RawMusic (MusicParser.VOICE_SEPARATOR));
                final List<LayerElement> elements = layer.children;
                items.add (this.voiceBuilder.build (layer.label, elements, isFirst ? staffEntries : Collections.emptyList (), isFirst ? initialItems : Collections.emptyList (), chain));
            }
        }
        this.insertParts (items, segments, STAFF_PARTS);

        Music body = this.combine (items, LabelCodec.find (segments, "sim").isPresent () || !isLabeled && staffLayers != null && staffLayers.size () > 1);
        body = StructureLabels.wrap (segments, body);

        final ContextMusic staff = StructureLabels.restoreContext (segments, "staff", body);
        if (staff != null)
            return staff;
        if (!isLabeled)
            return new ContextMusic (ContextKeyword.NEW, staffDef.lines != null && staffDef.lines.intValue () == 1 ? "RhythmicStaff" : "Staff", null, null, body);
        return body;
    }


    private Music combine (final List<Music> items, final boolean isSimultaneous)
    {
        if (isSimultaneous)
            return new SimultaneousMusic (items);
        if (items.size () == 1)
            return items.get (0);
        return new SequentialMusic (items);
    }


    /**
     * Insert the parts which were kept as source text at their original index.
     *
     * @param items The items to insert into
     * @param segments The segments of the label
     * @param kinds The kinds of the part segments
     */
    private void insertParts (final List<Music> items, final List<LabelSegment> segments, final Set<String> kinds)
    {
        final List<LabelSegment> parts = new ArrayList<> ();
        for (final LabelSegment segment: segments)
        {
            if (kinds.contains (segment.getKind ()))
                parts.add (segment);
        }
        parts.sort (Comparator.comparingInt (segment -> Integer.parseInt (segment.getField (0))));
        for (final LabelSegment part: parts)
        {
            final int index = Math.min (Integer.parseInt (part.getField (0)), items.size ());
            items.add (index, this.context.parseMusic (null, part.getField (1), InputMode.NOTES));
        }
    }


    private static List<LabelSegment> extendChain (final List<LabelSegment> outerChain, final List<LabelSegment> segments)
    {
        final List<LabelSegment> chain = new ArrayList<> (outerChain);
        for (final LabelSegment segment: segments)
        {
            if (StructureLabels.isWrapperSegment (segment))
                chain.add (segment);
        }
        return chain;
    }
}
