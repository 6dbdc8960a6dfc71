// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.imports;

import de.mossgrabers.scoreconverter.convert.LabelCodec;
import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.convert.NotationMapping;
import de.mossgrabers.scoreconverter.convert.PitchContext;
import de.mossgrabers.scoreconverter.extension.Barline;
import de.mossgrabers.scoreconverter.extension.DrumEvent;
import de.mossgrabers.scoreconverter.extension.ExtensionKind;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.extension.MRestDetail;
import de.mossgrabers.scoreconverter.extension.Metronome;
import de.mossgrabers.scoreconverter.extension.PitchedRest;
import de.mossgrabers.scoreconverter.extension.Technical;
import de.mossgrabers.scoreconverter.extension.TechnicalKind;
import de.mossgrabers.scoreconverter.format.lilypond.model.AfterGraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.AutoBeamEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.BarCheck;
import de.mossgrabers.scoreconverter.format.lilypond.model.BarLine;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordRepetition;
import de.mossgrabers.scoreconverter.format.lilypond.model.ClefEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextChange;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Direction;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumNoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FixedMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.GraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.GraceType;
import de.mossgrabers.scoreconverter.format.lilypond.model.IdentifierMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.KeySignature;
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
import de.mossgrabers.scoreconverter.format.lilypond.model.PartialFunction;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.PropertyOperation;
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
import de.mossgrabers.scoreconverter.format.lilypond.model.TransposeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TupletMusic;
import de.mossgrabers.scoreconverter.format.lilypond.serializer.Serializer;
import de.mossgrabers.scoreconverter.format.mei.model.BeamSpan;
import de.mossgrabers.scoreconverter.format.mei.model.Chord;
import de.mossgrabers.scoreconverter.format.mei.model.ControlEvent;
import de.mossgrabers.scoreconverter.format.mei.model.Dir;
import de.mossgrabers.scoreconverter.format.mei.model.Dynam;
import de.mossgrabers.scoreconverter.format.mei.model.Hairpin;
import de.mossgrabers.scoreconverter.format.mei.model.Layer;
import de.mossgrabers.scoreconverter.format.mei.model.LayerElement;
import de.mossgrabers.scoreconverter.format.mei.model.MRest;
import de.mossgrabers.scoreconverter.format.mei.model.Note;
import de.mossgrabers.scoreconverter.format.mei.model.Rest;
import de.mossgrabers.scoreconverter.format.mei.model.Slur;
import de.mossgrabers.scoreconverter.format.mei.model.Space;
import de.mossgrabers.scoreconverter.format.mei.model.StaffDef;
import de.mossgrabers.scoreconverter.format.mei.model.Tempo;
import de.mossgrabers.scoreconverter.format.mei.model.Tie;
import de.mossgrabers.scoreconverter.format.mei.model.TupletSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;


/**
 * Collects the events of one voice into a MEI layer. Notes, chords and rests become layer
 * elements; slurs, ties, dynamics and other post events become control events. Constructs which
 * contain events (tuplets, repeats, grace notes, nested pitch contexts and braces) become control
 * events which span their first and last event. All other items are kept as source text together
 * with their position in the event stream: the number of preceding events, the running number of
 * the item in the voice and the ID of the innermost enclosing span.
 *
 * @author Jürgen Moßgraber
 */
class EventCollector implements MusicVisitor<Void>
{
    private static final Map<String, TechnicalKind> TECHNICAL_ARTICULATIONS = Map.ofEntries (Map.entry ("upbow", TechnicalKind.UP_BOW), Map.entry ("downbow", TechnicalKind.DOWN_BOW), Map.entry ("flageolet", TechnicalKind.HARMONIC), Map.entry ("harmonic", TechnicalKind.HARMONIC), Map.entry ("open", TechnicalKind.OPEN_STRING), Map.entry ("halfopen", TechnicalKind.OTHER), Map.entry ("thumb", TechnicalKind.THUMB_POSITION), Map.entry ("stopped", TechnicalKind.STOPPED), Map.entry ("+", TechnicalKind.STOPPED), Map.entry ("snappizzicato", TechnicalKind.SNAP_PIZZICATO), Map.entry ("lheel", TechnicalKind.HEEL), Map.entry ("rheel", TechnicalKind.HEEL), Map.entry ("ltoe", TechnicalKind.TOE), Map.entry ("rtoe", TechnicalKind.TOE));
    private static final Map<String, String>        SHORTHANDS              = Map.of (".", "staccato", "-", "tenuto", ">", "accent", "^", "marcato", "!", "staccatissimo", "_", "portato", "+", "stopped");

    private final ImportContext                     context;
    private final String                            staffNumber;
    private final StaffDef                          staffDef;
    private final Layer                             layer                   = new Layer ();
    private final List<ControlEvent>                controlEvents           = new ArrayList<> ();
    private final List<String>                      inlineEntries           = new ArrayList<> ();
    private final List<String>                      staffEntries            = new ArrayList<> ();
    private final List<LayerElement>                lyricTargets            = new ArrayList<> ();
    private final List<Object []>                   anchors                 = new ArrayList<> ();
    private final Deque<String>                     owners                  = new ArrayDeque<> ();
    private final Deque<String>                     slurs                   = new ArrayDeque<> ();
    private final Deque<String>                     phrasingSlurs           = new ArrayDeque<> ();
    private final Deque<String>                     beams                   = new ArrayDeque<> ();

    private PitchContext                            pitchContext;
    private String                                  hairpinStart;
    private String                                  hairpinForm;
    private LayerElement                            pendingTie;
    private int                                     ordinal                 = 0;
    private int                                     graceDepth              = 0;
    private String                                  graceValue;
    private Duration                                lastDuration            = new Duration (4, 0);
    private List<Pitch>                             lastChord;
    private int                                     measure                 = 1;
    private boolean                                 hasInitialClef;
    private boolean                                 hasInitialKey;
    private boolean                                 hasInitialTime;


    /**
     * Constructor.
     *
     * @param context The import context
     * @param staffNumber The number of the staff
     * @param layerNumber The number of the layer in the staff
     * @param staffDef The definition of the staff if this is the first voice of the staff,
     *            otherwise null; staff-wide events are only recorded for the first voice
     * @param pitchContext The pitch context at the start of the voice
     */
    EventCollector (final ImportContext context, final String staffNumber, final int layerNumber, final StaffDef staffDef, final PitchContext pitchContext)
    {
        this.context = context;
        this.staffNumber = staffNumber;
        this.staffDef = staffDef;
        this.pitchContext = pitchContext;
        this.layer.n = Integer.valueOf (layerNumber);
        this.owners.push ("");
    }


    /**
     * Collect the items of the voice.
     *
     * @param items The items
     */
    void collect (final List<Music> items)
    {
        for (final Music item: items)
            item.accept (this);
    }


    /**
     * Finish the voice: resolve the anchors of tempo marks and set the label of the layer.
     *
     * @param segments The label segments which describe the voice (context, pitch context)
     * @return The layer
     */
    Layer finish (final List<LabelSegment> segments)
    {
        final List<LayerElement> events = this.layer.children;
        for (final Object [] anchor: this.anchors)
        {
            final ControlEvent controlEvent = (ControlEvent) anchor[0];
            final int position = ((Integer) anchor[1]).intValue ();
            if (position < events.size ())
                controlEvent.startid = ControlEvent.ref (events.get (position).id);
            else if (!events.isEmpty ())
                controlEvent.startid = ControlEvent.ref (events.get (events.size () - 1).id);
            else
                controlEvent.tstamp = Double.valueOf (1);
        }

        if (!this.slurs.isEmpty () || !this.phrasingSlurs.isEmpty ())
            this.context.addNote (null, "Slur without an end in staff " + this.staffNumber + ".");
        if (!this.beams.isEmpty ())
            this.context.addNote (null, "Beam without an end in staff " + this.staffNumber + ".");
        if (this.hairpinStart != null)
            this.context.addNote (this.hairpinStart, "Hairpin without an end.");

        final List<LabelSegment> all = new ArrayList<> (segments);
        if (!this.inlineEntries.isEmpty ())
            all.add (new LabelSegment ("inline", this.inlineEntries));
        this.layer.label = LabelCodec.encode (all);
        return this.layer;
    }


    List<ControlEvent> getControlEvents ()
    {
        return this.controlEvents;
    }


    List<String> getStaffEntries ()
    {
        return this.staffEntries;
    }


    List<LayerElement> getLyricTargets ()
    {
        return this.lyricTargets;
    }


    ////////////////////////////////////////////////////////////////
    // Constructs which span events


    /** {@inheritDoc} */
    @Override
    public Void visitSequentialMusic (final SequentialMusic sequentialMusic)
    {
        if (!EventFinder.hasEvents (sequentialMusic))
            return this.addItem (sequentialMusic);

        final Dir dir = new Dir ();
        this.span (dir, "seq", List.of (LabelSegment.of ("seq")), () -> this.collect (sequentialMusic.getItems ()));
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitRelativeMusic (final RelativeMusic relativeMusic)
    {
        if (!EventFinder.hasEvents (relativeMusic))
            return this.addItem (relativeMusic);

        final Pitch reference = relativeMusic.getReference ();
        final LabelSegment segment = reference == null ? LabelSegment.of ("relative") : LabelSegment.of ("relative", Serializer.serializePitch (reference));
        this.pitchSpan (this.pitchContext.enterRelative (reference), segment, relativeMusic.getBody ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitFixedMusic (final FixedMusic fixedMusic)
    {
        if (!EventFinder.hasEvents (fixedMusic))
            return this.addItem (fixedMusic);

        final LabelSegment segment = LabelSegment.of ("fixed", Serializer.serializePitch (fixedMusic.getReference ()));
        this.pitchSpan (this.pitchContext.enterFixed (fixedMusic.getReference ()), segment, fixedMusic.getBody ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTransposeMusic (final TransposeMusic transposeMusic)
    {
        if (!EventFinder.hasEvents (transposeMusic))
            return this.addItem (transposeMusic);

        final LabelSegment segment = LabelSegment.of ("transpose", Serializer.serializePitch (transposeMusic.getFrom ()), Serializer.serializePitch (transposeMusic.getTo ()));
        this.pitchSpan (this.pitchContext.enterTranspose (transposeMusic.getFrom (), transposeMusic.getTo ()), segment, transposeMusic.getBody ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTupletMusic (final TupletMusic tupletMusic)
    {
        if (!EventFinder.hasEvents (tupletMusic))
            return this.addItem (tupletMusic);

        final TupletSpan tupletSpan = new TupletSpan ();
        tupletSpan.num = Integer.valueOf (tupletMusic.getNumerator ());
        tupletSpan.numbase = Integer.valueOf (tupletMusic.getDenominator ());

        final List<String> fields = new ArrayList<> ();
        fields.add (tupletMusic.getNumerator () + "/" + tupletMusic.getDenominator ());
        if (tupletMusic.getSpanDuration () != null)
            fields.add ("span=" + Serializer.serializeDuration (tupletMusic.getSpanDuration ()));
        addBareFlag (fields, tupletMusic.getBody ());
        this.span (tupletSpan, "tuplet", List.of (new LabelSegment ("tuplet", fields)), () -> this.collectBody (tupletMusic.getBody ()));
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitGraceMusic (final GraceMusic graceMusic)
    {
        if (!EventFinder.hasEvents (graceMusic))
            return this.addItem (graceMusic);

        final List<String> fields = new ArrayList<> ();
        fields.add (graceMusic.getGraceType ().getCommand ());
        addBareFlag (fields, graceMusic.getBody ());
        final String value = graceMusic.getGraceType () == GraceType.ACCIACCATURA || graceMusic.getGraceType () == GraceType.SLASHED_GRACE ? "acc" : "unacc";
        this.span (new Dir (), "dir", List.of (new LabelSegment ("grace", fields)), () -> this.collectGrace (graceMusic.getBody (), value));
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitAfterGraceMusic (final AfterGraceMusic afterGraceMusic)
    {
        if (!EventFinder.hasEvents (afterGraceMusic))
            return this.addItem (afterGraceMusic);

        final List<String> fields = new ArrayList<> ();
        final Multiplier fraction = afterGraceMusic.getFraction ();
        if (fraction != null)
            fields.add ("fraction=" + fraction.getNumerator () + "/" + fraction.getDenominator ());
        if (afterGraceMusic.getMain () instanceof SequentialMusic)
            fields.add ("mainseq");
        if (!(afterGraceMusic.getGrace () instanceof SequentialMusic))
            fields.add ("gracebare");

        this.span (new Dir (), "dir", List.of (), () -> {
            final Music main = afterGraceMusic.getMain ();
            if (main instanceof final SequentialMusic sequentialMusic)
                this.collect (sequentialMusic.getItems ());
            else
                main.accept (this);
            fields.add ("split=" + this.nextEventPlaceholder ());
            this.collectGrace (afterGraceMusic.getGrace (), "unacc");
        });

        // The ID of the first grace event is only known after collecting
        final Dir dir = (Dir) this.controlEvents.get (this.controlEvents.size () - 1);
        final int splitIndex = fields.size () - 1;
        final int position = Integer.parseInt (fields.get (splitIndex).substring ("split=#".length ()));
        fields.set (splitIndex, "split=" + this.layer.children.get (position).id);
        dir.label = LabelCodec.encode (List.of (new LabelSegment ("aftergrace", fields)));
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitRepeatMusic (final RepeatMusic repeatMusic)
    {
        if (!EventFinder.hasEvents (repeatMusic))
            return this.addItem (repeatMusic);

        final List<String> fields = new ArrayList<> ();
        fields.add (repeatMusic.getRepeatType ().getName ());
        fields.add (Integer.toString (repeatMusic.getCount ()));
        final List<Music> alternatives = repeatMusic.getAlternatives ();
        if (alternatives != null)
            fields.add ("alts=" + alternatives.size ());
        addBareFlag (fields, repeatMusic.getBody ());

        this.span (new Dir (), "dir", List.of (new LabelSegment ("repeat", fields)), () -> {
            this.collectBody (repeatMusic.getBody ());
            if (alternatives == null)
                return;
            for (int i = 0; i < alternatives.size (); i++)
            {
                final Music alternative = alternatives.get (i);
                final List<String> endingFields = new ArrayList<> ();
                endingFields.add (Integer.toString (i));
                addBareFlag (endingFields, alternative);
                this.span (new Dir (), "dir", List.of (new LabelSegment ("ending", endingFields)), () -> this.collectBody (alternative));
            }
        });
        return null;
    }


    ////////////////////////////////////////////////////////////////
    // Events


    /** {@inheritDoc} */
    @Override
    public Void visitNoteEvent (final NoteEvent noteEvent)
    {
        final Pitch written = noteEvent.getPitch ();
        final Pitch absolute = this.pitchContext.toAbsolute (written);
        final List<LabelSegment> labels = new ArrayList<> ();
        addPitchLabels (labels, written);

        if (noteEvent.isPitchedRest ())
        {
            final Rest rest = new Rest ();
            rest.id = this.context.createId ("rest");
            rest.ploc = String.valueOf (absolute.getStep ());
            rest.oloc = Integer.valueOf (absolute.getAbsoluteOctave ());
            this.context.getStore ().insert (ExtensionKind.PITCHED_REST, rest.id, new PitchedRest (Serializer.serializePitch (absolute.plain ())));
            this.addEvent (rest, noteEvent, labels);
            return null;
        }

        final Note note = new Note ();
        note.id = this.context.createId ("note");
        this.setPitch (note, absolute);
        this.addEvent (note, noteEvent, labels);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitChordEvent (final ChordEvent chordEvent)
    {
        final Chord chord = new Chord ();
        chord.id = this.context.createId ("chord");

        final List<Pitch> absolutePitches = new ArrayList<> ();
        this.pitchContext.startChord ();
        for (final Pitch written: chordEvent.getPitches ())
        {
            final Pitch absolute = this.pitchContext.toAbsolute (written);
            absolutePitches.add (absolute.plain ());
            final Note note = new Note ();
            note.id = this.context.createId ("note");
            this.setPitch (note, absolute);
            final List<LabelSegment> noteLabels = new ArrayList<> ();
            addPitchLabels (noteLabels, written);
            note.label = LabelCodec.encode (noteLabels);
            chord.notes.add (note);
        }
        this.pitchContext.endChord ();
        this.lastChord = absolutePitches;

        this.addEvent (chord, chordEvent, new ArrayList<> ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitChordRepetition (final ChordRepetition chordRepetition)
    {
        final List<LabelSegment> labels = new ArrayList<> ();
        labels.add (LabelSegment.of ("q"));
        if (this.lastChord == null)
        {
            final Space space = new Space ();
            space.id = this.context.createId ("space");
            this.context.addNote (space.id, "Chord repetition without a preceding chord.");
            this.addEvent (space, chordRepetition, labels);
            return null;
        }

        final Chord chord = new Chord ();
        chord.id = this.context.createId ("chord");
        for (final Pitch pitch: this.lastChord)
        {
            final Note note = new Note ();
            note.id = this.context.createId ("note");
            this.setPitch (note, pitch);
            chord.notes.add (note);
        }
        this.addEvent (chord, chordRepetition, labels);
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitDrumNoteEvent (final DrumNoteEvent drumNoteEvent)
    {
        return this.addDrumEvent (drumNoteEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitDrumChordEvent (final DrumChordEvent drumChordEvent)
    {
        return this.addDrumEvent (drumChordEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitRestEvent (final RestEvent restEvent)
    {
        final Rest rest = new Rest ();
        rest.id = this.context.createId ("rest");
        this.addEvent (rest, restEvent, new ArrayList<> ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitSkipEvent (final SkipEvent skipEvent)
    {
        final Space space = new Space ();
        space.id = this.context.createId ("space");
        this.addEvent (space, skipEvent, new ArrayList<> ());
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMultiMeasureRest (final MultiMeasureRest multiMeasureRest)
    {
        final MRest mRest = new MRest ();
        mRest.id = this.context.createId ("mrest");
        this.context.getStore ().insert (ExtensionKind.MREST_DETAIL, mRest.id, new MRestDetail (Serializer.serializeDuration (multiMeasureRest.getDuration ())));
        this.addEvent (mRest, multiMeasureRest, new ArrayList<> ());
        return null;
    }


    ////////////////////////////////////////////////////////////////
    // Staff-wide control events


    /** {@inheritDoc} */
    @Override
    public Void visitClefEvent (final ClefEvent clefEvent)
    {
        if (this.isInitial () && !this.hasInitialClef)
        {
            this.hasInitialClef = true;
            if (!NotationMapping.setClef (this.staffDef, clefEvent))
                this.context.addNote (this.staffDef.id, "Clef '" + clefEvent.getName () + "' has no MEI equivalent.");
        }
        return this.addItem (clefEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitKeySignature (final KeySignature keySignature)
    {
        if (this.isInitial () && !this.hasInitialKey)
        {
            this.hasInitialKey = true;
            NotationMapping.setKey (this.staffDef, keySignature);
        }
        return this.addItem (keySignature);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTimeSignature (final TimeSignature timeSignature)
    {
        if (this.isInitial () && !this.hasInitialTime)
        {
            this.hasInitialTime = true;
            NotationMapping.setMeter (this.staffDef, timeSignature);
        }
        return this.addItem (timeSignature);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitAutoBeamEvent (final AutoBeamEvent autoBeamEvent)
    {
        return this.addItem (autoBeamEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTempoEvent (final TempoEvent tempoEvent)
    {
        if (this.staffDef == null)
            return this.addItem (tempoEvent);

        final Tempo tempo = new Tempo ();
        tempo.id = this.context.createId ("tempo");
        tempo.staff = this.staffNumber;
        final List<LabelSegment> labels = new ArrayList<> ();
        labels.add (LabelSegment.of ("tempo"));
        String text = null;
        if (tempoEvent.getText () != null)
        {
            text = Serializer.serializeMarkup (tempoEvent.getText ());
            tempo.text = tempoEvent.getText ().getText ();
            if (!tempoEvent.getText ().isPlainString ())
                labels.add (LabelSegment.of ("markup", text));
        }
        if (tempoEvent.getUnit () != null && tempoEvent.getBpm () != null)
        {
            tempo.mm = Double.valueOf (tempoEvent.getBpm ().getLow ());
            tempo.mmUnit = NotationMapping.toDur (tempoEvent.getUnit ());
            if (tempoEvent.getUnit ().getDots () > 0)
                tempo.mmDots = Integer.valueOf (tempoEvent.getUnit ().getDots ());
            this.context.getStore ().insert (ExtensionKind.METRONOME, tempo.id, Metronome.beatUnit (text, Serializer.serializeDuration (tempoEvent.getUnit ()), tempoEvent.getBpm ().getLow (), tempoEvent.getBpm ().getHigh ()));
        }
        tempo.label = LabelCodec.encode (labels);
        return this.addReferencedItem (tempo);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMarkEvent (final MarkEvent markEvent)
    {
        if (this.staffDef == null)
            return this.addItem (markEvent);

        final Dir dir = new Dir ();
        dir.id = this.context.createId ("dir");
        dir.staff = this.staffNumber;
        dir.place = "above";
        if (markEvent.getLabel () != null)
            dir.text = markEvent.getLabel ().getText ();
        else if (markEvent.getNumber () != null)
            dir.text = markEvent.getNumber ().toString ();
        dir.label = LabelCodec.encode (List.of (LabelSegment.of ("mark", this.context.serialize (markEvent))));
        return this.addReferencedItem (dir);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitTextMarkEvent (final TextMarkEvent textMarkEvent)
    {
        if (this.staffDef == null)
            return this.addItem (textMarkEvent);

        final Dir dir = new Dir ();
        dir.id = this.context.createId ("dir");
        dir.staff = this.staffNumber;
        dir.place = "above";
        dir.text = textMarkEvent.getText ().getText ();
        dir.label = LabelCodec.encode (List.of (LabelSegment.of ("textmark", this.context.serialize (textMarkEvent))));
        return this.addReferencedItem (dir);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitBarCheck (final BarCheck barCheck)
    {
        this.measure++;
        return this.addItem (barCheck);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitBarLine (final BarLine barLine)
    {
        if (this.staffDef != null)
            this.context.getStore ().insert (ExtensionKind.BARLINE, ExtensionStore.barlineKey (this.measure, "right"), new Barline (barLine.getGlyph ()));
        return this.addItem (barLine);
    }


    ////////////////////////////////////////////////////////////////
    // Items which are kept as source text


    /** {@inheritDoc} */
    @Override
    public Void visitSimultaneousMusic (final SimultaneousMusic simultaneousMusic)
    {
        if (EventFinder.hasEvents (new SequentialMusic (simultaneousMusic.getItems ())))
            this.context.addNote (null, "Simultaneous music inside of a voice in staff " + this.staffNumber + " is kept as source text.");
        return this.addItem (simultaneousMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitContextMusic (final ContextMusic contextMusic)
    {
        if (EventFinder.hasEvents (contextMusic.getBody ()))
            this.context.addNote (null, "Context '" + contextMusic.getContextType () + "' inside of a voice in staff " + this.staffNumber + " is kept as source text.");
        return this.addItem (contextMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitContextChange (final ContextChange contextChange)
    {
        return this.addItem (contextChange);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitChordModeEvent (final ChordModeEvent chordModeEvent)
    {
        return this.addItem (chordModeEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitLyricModeMusic (final LyricModeMusic lyricModeMusic)
    {
        return this.addItem (lyricModeMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitLyricEvent (final LyricEvent lyricEvent)
    {
        return this.addItem (lyricEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitFigureModeMusic (final FigureModeMusic figureModeMusic)
    {
        return this.addItem (figureModeMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitFigureEvent (final FigureEvent figureEvent)
    {
        return this.addItem (figureEvent);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitChordModeMusic (final ChordModeMusic chordModeMusic)
    {
        return this.addItem (chordModeMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitDrumModeMusic (final DrumModeMusic drumModeMusic)
    {
        return this.addItem (drumModeMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMusicFunctionCall (final MusicFunctionCall musicFunctionCall)
    {
        return this.addItem (musicFunctionCall);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitPartialFunction (final PartialFunction partialFunction)
    {
        return this.addItem (partialFunction);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitIdentifierMusic (final IdentifierMusic identifierMusic)
    {
        this.context.addNote (null, "Unresolved variable '\\" + identifierMusic.getName () + "' is kept as source text.");
        return this.addItem (identifierMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMarkupMusic (final MarkupMusic markupMusic)
    {
        return this.addItem (markupMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitMarkupListMusic (final MarkupListMusic markupListMusic)
    {
        return this.addItem (markupListMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitRawMusic (final RawMusic rawMusic)
    {
        return this.addItem (rawMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitSchemeMusic (final SchemeMusic schemeMusic)
    {
        return this.addItem (schemeMusic);
    }


    /** {@inheritDoc} */
    @Override
    public Void visitPropertyOperation (final PropertyOperation propertyOperation)
    {
        return this.addItem (propertyOperation);
    }


    ////////////////////////////////////////////////////////////////
    // Helpers


    private void collectBody (final Music body)
    {
        if (body instanceof final SequentialMusic sequentialMusic)
            this.collect (sequentialMusic.getItems ());
        else
            body.accept (this);
    }


    private void collectGrace (final Music body, final String value)
    {
        final String previousValue = this.graceValue;
        this.graceDepth++;
        this.graceValue = value;
        this.collectBody (body);
        this.graceDepth--;
        this.graceValue = previousValue;
    }


    private void pitchSpan (final PitchContext nestedContext, final LabelSegment segment, final Music body)
    {
        final List<String> fields = new ArrayList<> (segment.getFields ());
        addBareFlag (fields, body);
        final PitchContext previous = this.pitchContext;
        this.pitchContext = nestedContext;
        this.span (new Dir (), "dir", List.of (new LabelSegment (segment.getKind (), fields)), () -> this.collectBody (body));
        this.pitchContext = previous;
    }


    /**
     * Create a control event which spans all events collected by the given walker. Items which
     * are collected by the walker are owned by the span.
     *
     * @param span The control event
     * @param type The type for the ID
     * @param segments The label of the span
     * @param walker Collects the content
     */
    private void span (final ControlEvent span, final String type, final List<LabelSegment> segments, final Runnable walker)
    {
        span.id = this.context.createId (type);
        span.staff = this.staffNumber;
        final int start = this.layer.children.size ();
        this.owners.push (span.id);
        walker.run ();
        this.owners.pop ();
        final int end = this.layer.children.size () - 1;

        span.startid = ControlEvent.ref (this.layer.children.get (start).id);
        span.endid = ControlEvent.ref (this.layer.children.get (end).id);
        span.label = LabelCodec.encode (segments);
        this.controlEvents.add (span);
    }


    private String nextEventPlaceholder ()
    {
        return "#" + this.layer.children.size ();
    }


    private boolean isInitial ()
    {
        return this.staffDef != null && this.layer.children.isEmpty () && this.owners.size () == 1;
    }


    private Void addItem (final Music music)
    {
        final boolean isStaffEvent = music instanceof ClefEvent || music instanceof KeySignature || music instanceof TimeSignature || music instanceof AutoBeamEvent;
        this.addEntry (this.staffDef != null && isStaffEvent ? this.staffEntries : this.inlineEntries, this.context.serialize (music));
        return null;
    }


    private Void addReferencedItem (final ControlEvent controlEvent)
    {
        this.anchors.add (new Object []
        {
            controlEvent,
            Integer.valueOf (this.layer.children.size ())
        });
        this.controlEvents.add (controlEvent);
        this.addEntry (this.staffEntries, LabelCodec.REFERENCE_PREFIX + controlEvent.id);
        return null;
    }


    private void addEntry (final List<String> entries, final String content)
    {
        entries.add (this.layer.children.size () + "." + this.ordinal + "." + this.owners.peek () + "=" + content);
        this.ordinal++;
    }


    private Void addDrumEvent (final MusicEvent drumEvent)
    {
        final Note note = new Note ();
        note.id = this.context.createId ("note");
        this.context.getStore ().insert (ExtensionKind.DRUM_EVENT, note.id, new DrumEvent (this.context.serialize (drumEvent)));
        this.addEvent (note, drumEvent, new ArrayList<> ());
        return null;
    }


    private void setPitch (final Note note, final Pitch absolute)
    {
        if (!NotationMapping.setPitch (note, absolute))
            this.context.addNote (note.id, "The alteration " + absolute.getAlter () + " has no matching accidental and is dropped.");
    }


    private void addEvent (final LayerElement element, final MusicEvent event, final List<LabelSegment> labels)
    {
        Duration duration = event.getDuration ();
        if (duration == null)
        {
            labels.add (LabelSegment.of ("dur", "implicit"));
            duration = this.lastDuration;
        }
        else
        {
            this.lastDuration = duration;
            if (!duration.getMultipliers ().isEmpty ())
            {
                final List<String> fields = new ArrayList<> ();
                for (final Multiplier multiplier: duration.getMultipliers ())
                    fields.add (multiplier.getNumerator () + "/" + multiplier.getDenominator ());
                labels.add (new LabelSegment ("mul", fields));
            }
        }
        element.dur = NotationMapping.toDur (duration);
        if (duration.getDots () > 0)
            element.dots = Integer.valueOf (duration.getDots ());

        final boolean isPitched = element instanceof Note && !this.context.getStore ().drumEvent (element.id).isPresent () || element instanceof Chord;
        if (this.graceDepth > 0)
            setGrace (element, this.graceValue);

        boolean isTieContinuation = false;
        if (this.pendingTie != null)
        {
            if (isPitched)
            {
                isTieContinuation = true;
                setTie (element, "t");
                final Tie tie = new Tie ();
                tie.id = this.context.createId ("tie");
                tie.staff = this.staffNumber;
                tie.startid = ControlEvent.ref (this.pendingTie.id);
                tie.endid = ControlEvent.ref (element.id);
                this.controlEvents.add (tie);
            }
            this.pendingTie = null;
        }

        if (isPitched && !isTieContinuation && this.graceDepth == 0 && this.slurs.isEmpty ())
            this.lyricTargets.add (element);

        final List<PostEvent> postEvents = event.getPostEvents ();
        if (!postEvents.isEmpty ())
        {
            labels.add (LabelSegment.of ("post", this.context.getSerializer ().serializePostEvents (postEvents)));
            for (final PostEvent postEvent: postEvents)
                this.addPostEvent (element, postEvent, isPitched);
        }

        element.label = LabelCodec.encode (labels);
        this.layer.children.add (element);
    }


    private void addPostEvent (final LayerElement element, final PostEvent postEvent, final boolean isPitched)
    {
        switch (postEvent.getType ())
        {
            case TIE:
                if (isPitched)
                {
                    setTie (element, "i");
                    this.pendingTie = element;
                }
                break;

            case SLUR_START:
                this.slurs.push (element.id);
                break;
            case SLUR_END:
                this.closeSlur (this.slurs, element, null);
                break;
            case PHRASING_SLUR_START:
                this.phrasingSlurs.push (element.id);
                break;
            case PHRASING_SLUR_END:
                this.closeSlur (this.phrasingSlurs, element, "phrasing");
                break;

            case BEAM_START:
                this.beams.push (element.id);
                break;
            case BEAM_END:
                if (this.beams.isEmpty ())
                    this.context.addNote (element.id, "Beam end without a start.");
                else
                {
                    final BeamSpan beamSpan = new BeamSpan ();
                    this.addSpanning (beamSpan, "beam", this.beams.pop (), element.id);
                }
                break;

            case CRESCENDO:
            case DECRESCENDO:
                this.closeHairpin (element.id);
                this.hairpinStart = element.id;
                this.hairpinForm = postEvent.getType () == PostEvent.Type.CRESCENDO ? "cres" : "dim";
                break;
            case HAIRPIN_END:
                if (this.hairpinStart == null)
                    this.context.addNote (element.id, "Hairpin end without a start.");
                this.closeHairpin (element.id);
                break;

            case DYNAMIC:
                this.closeHairpin (element.id);
                final Dynam dynam = new Dynam ();
                dynam.text = postEvent.getValue ();
                dynam.place = toPlace (postEvent.getDirection (), "below");
                this.addSpanning (dynam, "dynam", element.id, null);
                break;

            case ARTICULATION:
            case NAMED_ARTICULATION:
                final String name = postEvent.getType () == PostEvent.Type.ARTICULATION ? SHORTHANDS.getOrDefault (postEvent.getValue (), postEvent.getValue ()) : postEvent.getValue ();
                final Dir articulation = this.addDirection (element, name, postEvent.getDirection ());
                final TechnicalKind technicalKind = TECHNICAL_ARTICULATIONS.get (postEvent.getValue ());
                if (technicalKind != null)
                    this.context.getStore ().insert (ExtensionKind.TECHNICAL, articulation.id, new Technical (technicalKind, name));
                break;
            case FINGERING:
                final Dir fingering = this.addDirection (element, Integer.toString (postEvent.getNumber ()), postEvent.getDirection ());
                this.context.getStore ().insert (ExtensionKind.TECHNICAL, fingering.id, new Technical (TechnicalKind.FINGERING, Integer.toString (postEvent.getNumber ())));
                break;
            case STRING_NUMBER:
                final Dir stringNumber = this.addDirection (element, "string " + postEvent.getNumber (), postEvent.getDirection ());
                this.context.getStore ().insert (ExtensionKind.TECHNICAL, stringNumber.id, new Technical (TechnicalKind.STRING, Integer.toString (postEvent.getNumber ())));
                break;
            case TREMOLO:
                this.addDirection (element, postEvent.getNumber () == 0 ? "tremolo" : "tremolo " + postEvent.getNumber (), Direction.NONE);
                break;
            case TEXT_SCRIPT:
                this.addDirection (element, postEvent.getText ().getText (), postEvent.getDirection ());
                break;

            case LYRIC_HYPHEN:
            case LYRIC_EXTENDER:
            default:
                break;
        }
    }


    private void closeSlur (final Deque<String> openSlurs, final LayerElement element, final String label)
    {
        if (openSlurs.isEmpty ())
        {
            this.context.addNote (element.id, "Slur end without a start.");
            return;
        }
        final Slur slur = new Slur ();
        if (label != null)
            slur.label = LabelCodec.encode (List.of (LabelSegment.of (label)));
        this.addSpanning (slur, "slur", openSlurs.pop (), element.id);
    }


    private void closeHairpin (final String endId)
    {
        if (this.hairpinStart == null)
            return;
        final Hairpin hairpin = new Hairpin ();
        hairpin.form = this.hairpinForm;
        this.addSpanning (hairpin, "hairpin", this.hairpinStart, endId);
        this.hairpinStart = null;
        this.hairpinForm = null;
    }


    private Dir addDirection (final LayerElement element, final String text, final Direction direction)
    {
        final Dir dir = new Dir ();
        dir.text = text;
        dir.place = toPlace (direction, null);
        this.addSpanning (dir, "dir", element.id, null);
        return dir;
    }


    private void addSpanning (final ControlEvent controlEvent, final String type, final String startId, final String endId)
    {
        controlEvent.id = this.context.createId (type);
        controlEvent.staff = this.staffNumber;
        controlEvent.startid = ControlEvent.ref (startId);
        controlEvent.endid = ControlEvent.ref (endId);
        this.controlEvents.add (controlEvent);
    }


    private static String toPlace (final Direction direction, final String defaultPlace)
    {
        switch (direction)
        {
            case UP:
                return "above";
            case DOWN:
                return "below";
            default:
                return defaultPlace;
        }
    }


    private static void addPitchLabels (final List<LabelSegment> labels, final Pitch written)
    {
        if (written.isForceAccidental ())
            labels.add (LabelSegment.of ("acc", "force"));
        else if (written.isCautionary ())
            labels.add (LabelSegment.of ("acc", "caution"));
        if (written.getOctaveCheck () != null)
            labels.add (LabelSegment.of ("ochk", written.getOctaveCheck ().toString ()));
    }


    private static void addBareFlag (final List<String> fields, final Music body)
    {
        if (!(body instanceof SequentialMusic))
            fields.add ("bare");
    }


    private static void setTie (final LayerElement element, final String value)
    {
        if (element instanceof final Note note)
            note.tie = combineTie (note.tie, value);
        else if (element instanceof final Chord chord)
            chord.tie = combineTie (chord.tie, value);
    }


    private static String combineTie (final String existing, final String value)
    {
        if (existing == null)
            return value;
        return existing.equals (value) ? value : "m";
    }


    private static void setGrace (final LayerElement element, final String value)
    {
        if (element instanceof final Note note)
            note.grace = value;
        else if (element instanceof final Chord chord)
            chord.grace = value;
    }
}
