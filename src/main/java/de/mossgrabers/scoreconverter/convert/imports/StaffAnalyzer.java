// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.imports;

import de.mossgrabers.scoreconverter.convert.LabelCodec;
import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.convert.PitchContext;
import de.mossgrabers.scoreconverter.convert.StructureLabels;
import de.mossgrabers.scoreconverter.extension.ExtensionKind;
import de.mossgrabers.scoreconverter.extension.FiguredBass;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.Figure;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FixedMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.LyricEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.LyricModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RelativeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SimultaneousMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SkipEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.TransposeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.MusicParser;
import de.mossgrabers.scoreconverter.format.mei.model.Chord;
import de.mossgrabers.scoreconverter.format.mei.model.F;
import de.mossgrabers.scoreconverter.format.mei.model.Fb;
import de.mossgrabers.scoreconverter.format.mei.model.Harm;
import de.mossgrabers.scoreconverter.format.mei.model.Layer;
import de.mossgrabers.scoreconverter.format.mei.model.LayerElement;
import de.mossgrabers.scoreconverter.format.mei.model.Measure;
import de.mossgrabers.scoreconverter.format.mei.model.Note;
import de.mossgrabers.scoreconverter.format.mei.model.Staff;
import de.mossgrabers.scoreconverter.format.mei.model.StaffDef;
import de.mossgrabers.scoreconverter.format.mei.model.StaffGrp;
import de.mossgrabers.scoreconverter.format.mei.model.Syl;
import de.mossgrabers.scoreconverter.format.mei.model.Verse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Maps the context tree of the music of one score to staff groups, staves and layers. Voices
 * are collected with an {@link EventCollector}. Lyrics, chord names and figured bass are attached
 * after all voices are known. Everything else which is placed between the staves is kept as
 * source text in the label of the enclosing staff group.
 *
 * @author Jürgen Moßgraber
 */
class StaffAnalyzer
{
    static final Set<String>                   GROUP_TYPES  = Set.of ("StaffGroup", "ChoirStaff", "GrandStaff", "PianoStaff");
    static final Set<String>                   STAFF_TYPES  = Set.of ("Staff", "RhythmicStaff", "TabStaff", "DrumStaff");
    static final Set<String>                   VOICE_TYPES  = Set.of ("Voice", "CueVoice", "NullVoice", "TabVoice", "DrumVoice");

    private final ImportContext                context;
    private final Measure                      measure      = new Measure ();
    private final Map<String, EventCollector>  namedVoices  = new HashMap<> ();
    private final List<EventCollector>         voices       = new ArrayList<> ();
    private final Map<EventCollector, Integer> verseCounts  = new HashMap<> ();
    private final List<ContextMusic>           lyricsParts  = new ArrayList<> ();
    private int                                staffCount   = 0;


    /**
     * Constructor.
     *
     * @param context The import context
     */
    StaffAnalyzer (final ImportContext context)
    {
        this.context = context;
        this.measure.id = context.createId ("measure");
        this.measure.n = "1";
    }


    /**
     * Analyze the music of a score.
     *
     * @param music The music
     * @param staffGrp The root staff group to fill
     */
    void analyze (final Music music, final StaffGrp staffGrp)
    {
        staffGrp.id = this.context.createId ("staffgrp");
        this.processGroup (music, staffGrp, new ArrayList<> (), new ArrayList<> ());
        for (final ContextMusic lyrics: this.lyricsParts)
            this.attachLyrics (lyrics);
    }


    /**
     * Get the measure which contains all staves and control events.
     *
     * @return The measure
     */
    Measure getMeasure ()
    {
        return this.measure;
    }


    private void processGroup (final Music body, final StaffGrp staffGrp, final List<LabelSegment> segments, final List<Music> outerChain)
    {
        final List<Music> chain = new ArrayList<> (outerChain);
        Music inner = body;
        while (StructureLabels.isWrapper (inner, true))
        {
            segments.add (StructureLabels.describeWrapper (inner));
            chain.add (inner);
            inner = StructureLabels.unwrap (inner);
        }

        final List<Music> items;
        if (inner instanceof final SimultaneousMusic simultaneousMusic)
        {
            segments.add (LabelSegment.of ("sim"));
            items = simultaneousMusic.getItems ();
        }
        else
            items = List.of (inner);

        for (int i = 0; i < items.size (); i++)
            this.processGroupItem (items.get (i), i, staffGrp, segments, chain);

        if (staffGrp.children.isEmpty ())
            this.context.addNote (staffGrp.id, "The score contains no staff.");
        staffGrp.label = LabelCodec.encode (segments);
    }


    private void processGroupItem (final Music item, final int index, final StaffGrp staffGrp, final List<LabelSegment> segments, final List<Music> chain)
    {
        if (item instanceof final ContextMusic contextMusic)
        {
            final String type = contextMusic.getContextType ();
            if (GROUP_TYPES.contains (type))
            {
                final StaffGrp group = new StaffGrp ();
                group.id = this.context.createId ("staffgrp");
                group.symbol = "PianoStaff".equals (type) || "GrandStaff".equals (type) ? "brace" : "bracket";
                staffGrp.children.add (group);
                this.processGroup (contextMusic.getBody (), group, StructureLabels.describeContext ("group", contextMusic, this.context.getSerializer ()), chain);
                return;
            }
            if (STAFF_TYPES.contains (type))
            {
                this.processStaff (contextMusic, contextMusic.getBody (), staffGrp, chain);
                return;
            }
            if (VOICE_TYPES.contains (type))
            {
                this.processStaff (null, contextMusic, staffGrp, chain);
                return;
            }

            final String source = this.context.serialize (contextMusic);
            switch (type)
            {
                case "Lyrics":
                    segments.add (LabelSegment.of ("lyrics", Integer.toString (index), source));
                    this.lyricsParts.add (contextMusic);
                    return;
                case "ChordNames":
                    segments.add (LabelSegment.of ("chordnames", Integer.toString (index), source));
                    this.addHarmonies (contextMusic.getBody ());
                    return;
                case "FiguredBass":
                    segments.add (LabelSegment.of ("figuredbass", Integer.toString (index), source));
                    this.addFigures (contextMusic.getBody ());
                    return;
                default:
                    segments.add (LabelSegment.of ("part", Integer.toString (index), source));
                    return;
            }
        }

        if (EventFinder.hasEvents (item))
            this.processStaff (null, item, staffGrp, chain);
        else
            segments.add (LabelSegment.of ("part", Integer.toString (index), this.context.serialize (item)));
    }


    private void processStaff (final ContextMusic staffContext, final Music body, final StaffGrp staffGrp, final List<Music> outerChain)
    {
        this.staffCount++;
        final StaffDef staffDef = new StaffDef ();
        staffDef.id = this.context.createId ("staffdef");
        staffDef.n = Integer.valueOf (this.staffCount);
        staffDef.lines = Integer.valueOf (5);
        staffGrp.children.add (staffDef);

        final List<LabelSegment> segments;
        if (staffContext == null)
            segments = new ArrayList<> (List.of (LabelSegment.of ("staff")));
        else
        {
            segments = StructureLabels.describeContext ("staff", staffContext, this.context.getSerializer ());
            if ("RhythmicStaff".equals (staffContext.getContextType ()))
                staffDef.lines = Integer.valueOf (1);
            else if ("TabStaff".equals (staffContext.getContextType ()))
                staffDef.lines = Integer.valueOf (6);
        }

        final Staff staff = new Staff ();
        staff.id = this.context.createId ("staff");
        staff.n = staffDef.n;
        this.measure.staves.add (staff);

        // The wrappers belong to the staff only if they lead to several voices
        final List<Music> chain = new ArrayList<> (outerChain);
        final List<LabelSegment> chainSegments = new ArrayList<> ();
        Music inner = body;
        while (StructureLabels.isWrapper (inner, true))
        {
            chainSegments.add (StructureLabels.describeWrapper (inner));
            chain.add (inner);
            inner = StructureLabels.unwrap (inner);
        }

        final List<Music> items;
        if (inner instanceof final SimultaneousMusic simultaneousMusic)
        {
            segments.addAll (chainSegments);
            segments.add (LabelSegment.of ("sim"));
            items = simultaneousMusic.getItems ();
        }
        else if (inner instanceof final ContextMusic contextMusic && VOICE_TYPES.contains (contextMusic.getContextType ()))
        {
            segments.addAll (chainSegments);
            items = List.of (inner);
        }
        else
        {
            chain.clear ();
            chain.addAll (outerChain);
            items = List.of (body);
        }

        final List<LabelSegment> parts = new ArrayList<> ();
        List<String> staffEntries = null;
        boolean isSeparated = false;
        for (int i = 0; i < items.size (); i++)
        {
            final Music item = items.get (i);
            if (item instanceof final RawMusic rawMusic && MusicParser.VOICE_SEPARATOR.equals (rawMusic.getText ()))
            {
                isSeparated = true;
                continue;
            }

            final boolean isVoice = item instanceof final ContextMusic contextMusic ? VOICE_TYPES.contains (contextMusic.getContextType ()) : EventFinder.hasEvents (item);
            if (!isVoice)
            {
                parts.add (LabelSegment.of ("part", Integer.toString (i), this.context.serialize (item)));
                continue;
            }

            final boolean isFirst = staff.layers.isEmpty ();
            final EventCollector collector = this.processVoice (item, staff, isFirst ? staffDef : null, chain, isSeparated);
            if (isFirst)
                staffEntries = collector.getStaffEntries ();
            isSeparated = false;
        }

        if (staff.layers.isEmpty ())
            this.context.addNote (staffDef.id, "The staff contains no voice.");
        if (staffEntries != null && !staffEntries.isEmpty ())
            segments.add (new LabelSegment ("events", staffEntries));
        segments.addAll (parts);
        staffDef.label = LabelCodec.encode (segments);
    }


    private EventCollector processVoice (final Music item, final Staff staff, final StaffDef staffDef, final List<Music> outerChain, final boolean isSeparated)
    {
        final List<LabelSegment> segments = new ArrayList<> ();
        Music body = item;
        String name = null;
        if (item instanceof final ContextMusic contextMusic)
        {
            segments.addAll (StructureLabels.describeContext ("voice", contextMusic, this.context.getSerializer ()));
            body = contextMusic.getBody ();
            name = contextMusic.getName ();
        }
        else
            segments.add (LabelSegment.of ("voice"));
        if (isSeparated)
            segments.add (LabelSegment.of ("sep"));

        final List<Music> chain = new ArrayList<> (outerChain);
        while (StructureLabels.isWrapper (body, false))
        {
            segments.add (StructureLabels.describeWrapper (body));
            chain.add (body);
            body = StructureLabels.unwrap (body);
        }

        final List<Music> items;
        if (body instanceof final SequentialMusic sequentialMusic)
            items = sequentialMusic.getItems ();
        else
        {
            segments.add (LabelSegment.of ("bare"));
            items = List.of (body);
        }

        final int layerNumber = staff.layers.size () + 1;
        final EventCollector collector = new EventCollector (this.context, staff.n.toString (), layerNumber, staffDef, createPitchContext (chain));
        collector.collect (items);
        final Layer layer = collector.finish (segments);
        layer.id = this.context.createId ("layer");
        staff.layers.add (layer);
        this.measure.controlEvents.addAll (collector.getControlEvents ());

        this.voices.add (collector);
        if (name != null)
            this.namedVoices.put (name, collector);
        return collector;
    }


    /**
     * Create the pitch context for a chain of wrappers. Each voice gets its own context, the
     * state of a relative wrapper around several staves is not continued from staff to staff.
     *
     * @param chain The wrappers from the outermost to the innermost
     * @return The pitch context
     */
    private static PitchContext createPitchContext (final List<Music> chain)
    {
        PitchContext pitchContext = PitchContext.absolute ();
        for (final Music wrapper: chain)
        {
            if (wrapper instanceof final RelativeMusic relativeMusic)
                pitchContext = pitchContext.enterRelative (relativeMusic.getReference ());
            else if (wrapper instanceof final FixedMusic fixedMusic)
                pitchContext = pitchContext.enterFixed (fixedMusic.getReference ());
            else if (wrapper instanceof final TransposeMusic transposeMusic)
                pitchContext = pitchContext.enterTranspose (transposeMusic.getFrom (), transposeMusic.getTo ());
        }
        return pitchContext;
    }


    private void attachLyrics (final ContextMusic lyrics)
    {
        final LyricModeMusic lyricModeMusic = findFirst (lyrics.getBody (), LyricModeMusic.class);
        if (lyricModeMusic == null)
            return;

        final String target = lyricModeMusic.getLyricsTo ();
        EventCollector voice = target == null ? null : this.namedVoices.get (target);
        if (voice == null)
        {
            if (this.voices.isEmpty ())
                return;
            voice = this.voices.get (this.voices.size () - 1);
            if (target != null)
                this.context.addNote (null, "Lyrics refer to the unknown voice '" + target + "', attached to the last voice.");
        }

        final int verseNumber = this.verseCounts.merge (voice, Integer.valueOf (1), (a, b) -> Integer.valueOf (a.intValue () + b.intValue ())).intValue ();
        final List<LayerElement> targets = voice.getLyricTargets ();
        int position = 0;
        boolean isWordOpen = false;
        for (final Music item: flatten (lyricModeMusic.getItems ()))
        {
            if (item instanceof SkipEvent)
            {
                position++;
                continue;
            }
            if (!(item instanceof final LyricEvent lyricEvent))
                continue;

            if (position >= targets.size ())
            {
                this.context.addNote (null, "More syllables than notes for verse " + verseNumber + ".");
                return;
            }

            final LayerElement element = targets.get (position);
            position++;
            if (!lyricEvent.isQuoted () && "_".equals (lyricEvent.getText ()))
                continue;

            final boolean hasHyphen = hasPostEvent (lyricEvent, PostEvent.Type.LYRIC_HYPHEN);
            final Syl syl = new Syl ();
            syl.text = lyricEvent.getText ();
            if (isWordOpen)
                syl.wordpos = hasHyphen ? "m" : "t";
            else
                syl.wordpos = hasHyphen ? "i" : "s";
            if (hasHyphen)
                syl.con = "d";
            else if (hasPostEvent (lyricEvent, PostEvent.Type.LYRIC_EXTENDER))
                syl.con = "u";
            isWordOpen = hasHyphen;

            final Verse verse = new Verse ();
            verse.n = Integer.valueOf (verseNumber);
            verse.syls.add (syl);
            if (element instanceof final Note note)
                note.verses.add (verse);
            else if (element instanceof final Chord chord)
                chord.verses.add (verse);
        }
    }


    private void addHarmonies (final Music body)
    {
        final ChordModeMusic chordModeMusic = findFirst (body, ChordModeMusic.class);
        if (chordModeMusic == null)
            return;

        double onset = 0;
        Duration lastDuration = new Duration (4, 0);
        for (final Music item: flatten (chordModeMusic.getItems ()))
        {
            if (!(item instanceof final MusicEvent event))
                continue;
            if (event instanceof ChordModeEvent)
            {
                final Harm harm = new Harm ();
                harm.id = this.context.createId ("harm");
                harm.staff = "1";
                harm.tstamp = Double.valueOf (1 + onset * 4);
                harm.text = this.context.serialize (event);
                this.measure.controlEvents.add (harm);
            }
            if (event.getDuration () != null)
                lastDuration = event.getDuration ();
            onset += lastDuration.getLength ();
        }
    }


    private void addFigures (final Music body)
    {
        final FigureModeMusic figureModeMusic = findFirst (body, FigureModeMusic.class);
        if (figureModeMusic == null)
            return;

        double onset = 0;
        Duration lastDuration = new Duration (4, 0);
        for (final Music item: flatten (figureModeMusic.getItems ()))
        {
            Duration duration = null;
            if (item instanceof final FigureEvent figureEvent)
            {
                final Fb fb = new Fb ();
                fb.id = this.context.createId ("fb");
                fb.staff = "1";
                fb.tstamp = Double.valueOf (1 + onset * 4);
                for (final Figure figure: figureEvent.getFigures ())
                    fb.figures.add (new F (formatFigure (figure)));
                this.measure.controlEvents.add (fb);
                this.context.getStore ().insert (ExtensionKind.FIGURED_BASS, fb.id, new FiguredBass (this.context.serialize (figureEvent)));
                duration = figureEvent.getDuration ();
            }
            else if (item instanceof final MusicEvent event)
                duration = event.getDuration ();
            else
                continue;

            if (duration != null)
                lastDuration = duration;
            onset += lastDuration.getLength ();
        }
    }


    private static String formatFigure (final Figure figure)
    {
        final StringBuilder sb = new StringBuilder ();
        sb.append (figure.getNumber () == null ? "_" : figure.getNumber ().toString ());
        if (figure.getAlteration () != null)
            sb.append (figure.getAlteration ());
        sb.append (figure.formatModifications ());
        return sb.toString ();
    }


    private static boolean hasPostEvent (final LyricEvent lyricEvent, final PostEvent.Type type)
    {
        for (final PostEvent postEvent: lyricEvent.getPostEvents ())
            if (postEvent.getType () == type)
                return true;
        return false;
    }


    /**
     * Find the first music of the given type. Braces and simultaneous music are searched.
     *
     * @param music Where to start
     * @param type The type to look for
     * @param <T> The type of the music
     * @return The music or null
     */
    private static <T extends Music> T findFirst (final Music music, final Class<T> type)
    {
        if (type.isInstance (music))
            return type.cast (music);
        final List<Music> items;
        if (music instanceof final SequentialMusic sequentialMusic)
            items = sequentialMusic.getItems ();
        else if (music instanceof final SimultaneousMusic simultaneousMusic)
            items = simultaneousMusic.getItems ();
        else
            return null;
        for (final Music item: items)
        {
            final T result = findFirst (item, type);
            if (result != null)
                return result;
        }
        return null;
    }


    private static List<Music> flatten (final List<Music> items)
    {
        final List<Music> result = new ArrayList<> ();
        for (final Music item: items)
        {
            if (item instanceof final SequentialMusic sequentialMusic)
                result.addAll (flatten (sequentialMusic.getItems ()));
            else
                result.add (item);
        }
        return result;
    }
}
