// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert;

import de.mossgrabers.scoreconverter.format.lilypond.model.ContextKeyword;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextModItem;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FixedMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.NoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.RelativeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SimultaneousMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TransposeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;
import de.mossgrabers.scoreconverter.format.lilypond.serializer.Serializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * Label segments which describe the structure around the events: contexts like staff groups,
 * staves and voices as well as the chain of wrappers (relative, fixed, transpose, braces, drum
 * mode) between a context and its music.
 *
 * @author Jürgen Moßgraber
 */
public class StructureLabels
{
    /** Segment kind of a relative pitch wrapper. */
    public static final String RELATIVE  = "relative";
    /** Segment kind of a fixed pitch wrapper. */
    public static final String FIXED     = "fixed";
    /** Segment kind of a transposition. */
    public static final String TRANSPOSE = "transpose";
    /** Segment kind of braces around a single expression. */
    public static final String SEQ       = "seq";
    /** Segment kind of the drum mode. */
    public static final String DRUMMODE  = "drummode";
    /** Segment kind of the with-block of a context. */
    public static final String WITH      = "with";


    /**
     * Private constructor since this is a utility class.
     */
    private StructureLabels ()
    {
        // Intentionally empty
    }


    /**
     * Describe a context, e.g. 'staff,new,Staff,upper'.
     *
     * @param kind The kind of the segment
     * @param context The context music
     * @param serializer Serializes the with-block
     * @return One segment or two if the context has a with-block
     */
    public static List<LabelSegment> describeContext (final String kind, final ContextMusic context, final Serializer serializer)
    {
        final List<LabelSegment> segments = new ArrayList<> ();
        final List<String> fields = new ArrayList<> ();
        fields.add (context.getKeyword ().getKeyword ());
        fields.add (context.getContextType ());
        if (context.getName () != null)
            fields.add (context.getName ());
        segments.add (new LabelSegment (kind, fields));

        if (context.getWithItems () != null)
        {
            final ContextMusic empty = new ContextMusic (context.getKeyword (), context.getContextType (), null, context.getWithItems (), new SequentialMusic (Collections.emptyList ()));
            segments.add (LabelSegment.of (WITH, serializer.serialize (empty)));
        }
        return segments;
    }


    /**
     * Restore a context from its description.
     *
     * @param segments All segments of the label
     * @param kind The kind of the context segment
     * @param body The body of the context
     * @return The context or null if there is no or only an implicit description
     * @throws ParseError The with-block could not be parsed
     */
    public static ContextMusic restoreContext (final List<LabelSegment> segments, final String kind, final Music body) throws ParseError
    {
        final LabelSegment segment = LabelCodec.find (segments, kind).orElse (null);
        if (segment == null || segment.getFields ().size () < 2)
            return null;

        final ContextKeyword keyword = "context".equals (segment.getField (0)) ? ContextKeyword.CONTEXT : ContextKeyword.NEW;
        List<ContextModItem> withItems = null;
        final LabelSegment with = LabelCodec.find (segments, WITH).orElse (null);
        if (with != null && with.getField (0) != null && Parser.parseMusic (with.getField (0), InputMode.NOTES) instanceof final ContextMusic parsed)
            withItems = parsed.getWithItems ();
        return new ContextMusic (keyword, segment.getField (1), segment.getField (2), withItems, body);
    }


    /**
     * Check if the music is a wrapper which can be part of a chain.
     *
     * @param music The music
     * @param allowContexts True if braces around a context or simultaneous music are part of the
     *            chain
     * @return True if it is a wrapper
     */
    public static boolean isWrapper (final Music music, final boolean allowContexts)
    {
        if (music instanceof RelativeMusic || music instanceof FixedMusic || music instanceof TransposeMusic || music instanceof DrumModeMusic)
            return true;
        if (music instanceof final SequentialMusic sequentialMusic && sequentialMusic.getItems ().size () == 1)
        {
            final Music inner = sequentialMusic.getItems ().get (0);
            return isWrapper (inner, allowContexts) || allowContexts && (inner instanceof ContextMusic || inner instanceof SimultaneousMusic);
        }
        return false;
    }


    /**
     * Describe a wrapper.
     *
     * @param wrapper The wrapper, see {@link #isWrapper(Music, boolean)}
     * @return The segment
     */
    public static LabelSegment describeWrapper (final Music wrapper)
    {
        if (wrapper instanceof final RelativeMusic relativeMusic)
            return relativeMusic.getReference () == null ? LabelSegment.of (RELATIVE) : LabelSegment.of (RELATIVE, Serializer.serializePitch (relativeMusic.getReference ()));
        if (wrapper instanceof final FixedMusic fixedMusic)
            return LabelSegment.of (FIXED, Serializer.serializePitch (fixedMusic.getReference ()));
        if (wrapper instanceof final TransposeMusic transposeMusic)
            return LabelSegment.of (TRANSPOSE, Serializer.serializePitch (transposeMusic.getFrom ()), Serializer.serializePitch (transposeMusic.getTo ()));
        if (wrapper instanceof DrumModeMusic)
            return LabelSegment.of (DRUMMODE);
        return LabelSegment.of (SEQ);
    }


    /**
     * Get the music inside of a wrapper.
     *
     * @param wrapper The wrapper, see {@link #isWrapper(Music, boolean)}
     * @return The inner music
     */
    public static Music unwrap (final Music wrapper)
    {
        if (wrapper instanceof final RelativeMusic relativeMusic)
            return relativeMusic.getBody ();
        if (wrapper instanceof final FixedMusic fixedMusic)
            return fixedMusic.getBody ();
        if (wrapper instanceof final TransposeMusic transposeMusic)
            return transposeMusic.getBody ();
        if (wrapper instanceof final DrumModeMusic drumModeMusic)
            return new SequentialMusic (drumModeMusic.getItems ());
        return ((SequentialMusic) wrapper).getItems ().get (0);
    }


    /**
     * Check if the segment describes a wrapper.
     *
     * @param segment The segment
     * @return True if it is a wrapper segment
     */
    public static boolean isWrapperSegment (final LabelSegment segment)
    {
        switch (segment.getKind ())
        {
            case RELATIVE:
            case FIXED:
            case TRANSPOSE:
            case SEQ:
            case DRUMMODE:
                return true;
            default:
                return false;
        }
    }


    /**
     * Wrap the music with all wrapper segments of a label, the first segment is the outermost
     * wrapper.
     *
     * @param segments The segments of a label, others than wrapper segments are ignored
     * @param music The music to wrap
     * @return The wrapped music
     * @throws ParseError A pitch could not be parsed
     */
    public static Music wrap (final List<LabelSegment> segments, final Music music) throws ParseError
    {
        Music result = music;
        for (int i = segments.size () - 1; i >= 0; i--)
        {
            final LabelSegment segment = segments.get (i);
            if (isWrapperSegment (segment))
                result = wrap (segment, result);
        }
        return result;
    }


    /**
     * Wrap the music with one wrapper.
     *
     * @param segment The wrapper segment
     * @param music The music to wrap
     * @return The wrapped music
     * @throws ParseError A pitch could not be parsed
     */
    public static Music wrap (final LabelSegment segment, final Music music) throws ParseError
    {
        switch (segment.getKind ())
        {
            case RELATIVE:
                return new RelativeMusic (segment.getField (0) == null ? null : parsePitch (segment.getField (0)), music);
            case FIXED:
                return new FixedMusic (parsePitch (segment.getField (0)), music);
            case TRANSPOSE:
                return new TransposeMusic (parsePitch (segment.getField (0)), parsePitch (segment.getField (1)), music);
            case DRUMMODE:
                return new DrumModeMusic (music instanceof final SequentialMusic sequentialMusic ? sequentialMusic.getItems () : List.of (music));
            default:
                return new SequentialMusic (List.of (music));
        }
    }


    /**
     * Parse a pitch which was written with {@link Serializer#serializePitch(Pitch)}.
     *
     * @param text The text
     * @return The pitch
     * @throws ParseError The text is not a pitch
     */
    public static Pitch parsePitch (final String text) throws ParseError
    {
        if (Parser.parseMusic (text, InputMode.NOTES) instanceof final NoteEvent noteEvent)
            return noteEvent.getPitch ();
        throw new ParseError ("Not a pitch: " + text, 0, "pitch");
    }
}
