// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.serializer;

import de.mossgrabers.scoreconverter.format.lilypond.model.AfterGraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Assignment;
import de.mossgrabers.scoreconverter.format.lilypond.model.AssignmentValue;
import de.mossgrabers.scoreconverter.format.lilypond.model.AutoBeamEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.BarCheck;
import de.mossgrabers.scoreconverter.format.lilypond.model.BarLine;
import de.mossgrabers.scoreconverter.format.lilypond.model.Block;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordQualityItem;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordRepetition;
import de.mossgrabers.scoreconverter.format.lilypond.model.ClefEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextChange;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextModItem;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumNoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.Figure;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FixedMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FunctionArgument;
import de.mossgrabers.scoreconverter.format.lilypond.model.GraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.HeaderBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.IdentifierMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.KeySignature;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.LyricEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.LyricModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.MarkEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Markup;
import de.mossgrabers.scoreconverter.format.lilypond.model.MarkupListMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.MarkupMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.MultiMeasureRest;
import de.mossgrabers.scoreconverter.format.lilypond.model.Multiplier;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicFunctionCall;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicVisitor;
import de.mossgrabers.scoreconverter.format.lilypond.model.NoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.NumericExpression;
import de.mossgrabers.scoreconverter.format.lilypond.model.OutputDefBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.PartialFunction;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.PropertyOperation;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawBlock;
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
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelExpression;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMarkup;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelScheme;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelVisitor;
import de.mossgrabers.scoreconverter.format.lilypond.model.TransposeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TupletMusic;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;


/**
 * Renders the LilyPond AST as source text. Each node type has exactly one way to be written which
 * is read back by the parser into an equal node.
 *
 * @author Jürgen Moßgraber
 */
public class Serializer implements MusicVisitor<String>, ToplevelVisitor<String>
{
    private static final int     LINE_LENGTH = 80;
    private static final Pattern PLAIN_WORD  = Pattern.compile ("\\p{L}+([-_]\\p{L}+)*");

    private final String         indent;
    private boolean              lyricMode;


    /**
     * Constructor.
     *
     * @param indentSize The number of blanks to indent nested blocks
     */
    public Serializer (final int indentSize)
    {
        this.indent = " ".repeat (Math.max (0, indentSize));
    }


    /**
     * Constructor which indents with 2 blanks.
     */
    public Serializer ()
    {
        this (2);
    }


    /**
     * Render a file.
     *
     * @param file The file
     * @return The source text
     */
    public String serialize (final LilyPondFile file)
    {
        final StringBuilder sb = new StringBuilder ();
        if (file.getVersion () != null)
            sb.append ("\\version ").append (quote (file.getVersion ())).append ("\n\n");
        for (final ToplevelExpression item: file.getItems ())
            sb.append (item.accept (this)).append ("\n\n");
        return sb.toString ().stripTrailing () + "\n";
    }


    /**
     * Render a music expression.
     *
     * @param music The music
     * @return The source text
     */
    public String serialize (final Music music)
    {
        return music.accept (this);
    }


    /**
     * Render a top-level expression.
     *
     * @param expression The expression
     * @return The source text
     */
    public String serialize (final ToplevelExpression expression)
    {
        return expression.accept (this);
    }


    /**
     * Render a list of post events.
     *
     * @param postEvents The post events
     * @return The source text
     */
    public String serializePostEvents (final List<PostEvent> postEvents)
    {
        final StringBuilder sb = new StringBuilder ();
        for (final PostEvent postEvent: postEvents)
            sb.append (this.serializePostEvent (postEvent));
        return sb.toString ();
    }


    /**
     * Render the value of an assignment.
     *
     * @param value The value
     * @return The source text
     */
    public String serializeValue (final AssignmentValue value)
    {
        switch (value.getKind ())
        {
            case STRING:
                return quote (value.getText ());
            case NUMBER:
            case EXPRESSION:
                return serializeExpression (value.getExpression ());
            case MUSIC:
                return this.serialize (value.getMusic ());
            case IDENTIFIER:
                return "\\" + value.getText ();
            case SCHEME:
                return value.getText ();
            case MARKUP:
            default:
                return serializeMarkup (value.getMarkup ());
        }
    }


    /**
     * Render a pitch with octave marks, accidental flags and octave check.
     *
     * @param pitch The pitch
     * @return The source text
     */
    public static String serializePitch (final Pitch pitch)
    {
        final StringBuilder sb = new StringBuilder (pitch.getNoteName ()).append (pitch.getOctaveMarks ());
        if (pitch.isForceAccidental ())
            sb.append ('!');
        if (pitch.isCautionary ())
            sb.append ('?');
        if (pitch.getOctaveCheck () != null)
            sb.append ('=').append (Pitch.marks (pitch.getOctaveCheck ().intValue ()));
        return sb.toString ();
    }


    /**
     * Render a duration.
     *
     * @param duration The duration, might be null
     * @return The source text, empty for null
     */
    public static String serializeDuration (final Duration duration)
    {
        if (duration == null)
            return "";
        final StringBuilder sb = new StringBuilder ().append (duration.getBase ()).append (".".repeat (duration.getDots ()));
        for (final Multiplier multiplier: duration.getMultipliers ())
        {
            sb.append ('*').append (multiplier.getNumerator ());
            if (multiplier.getDenominator () != 1)
                sb.append ('/').append (multiplier.getDenominator ());
        }
        return sb.toString ();
    }


    /**
     * Render a markup. A plain string is quoted, an expression gets the \markup command.
     *
     * @param markup The markup
     * @return The source text
     */
    public static String serializeMarkup (final Markup markup)
    {
        return markup.isPlainString () ? quote (markup.getText ()) : "\\markup " + markup.getText ();
    }


    /**
     * Render a numeric expression with the minimum of parenthesis.
     *
     * @param expression The expression
     * @return The source text
     */
    public static String serializeExpression (final NumericExpression expression)
    {
        switch (expression.getOperator ())
        {
            case LITERAL:
                return expression.getUnit () == null ? expression.getLiteral () : expression.getLiteral () + "\\" + expression.getUnit ();
            case NEGATE:
                return "-" + wrap (expression.getLeft (), expression.getPrecedence (), false);
            default:
                final int precedence = expression.getPrecedence ();
                return wrap (expression.getLeft (), precedence, false) + " " + expression.getOperator ().getSymbol () + " " + wrap (expression.getRight (), precedence, true);
        }
    }


    private static String wrap (final NumericExpression operand, final int parentPrecedence, final boolean isRight)
    {
        final String text = serializeExpression (operand);
        final int precedence = operand.getPrecedence ();
        if (precedence < parentPrecedence || isRight && precedence == parentPrecedence)
            return "(" + text + ")";
        return text;
    }


    /**
     * Quote a string and escape quotes and backslashes.
     *
     * @param text The text
     * @return The quoted text
     */
    public static String quote (final String text)
    {
        final StringBuilder sb = new StringBuilder ("\"");
        for (int i = 0; i < text.length (); i++)
        {
            final char c = text.charAt (i);
            switch (c)
            {
                case '"':
                case '\\':
                    sb.append ('\\').append (c);
                    break;
                case '\n':
                    sb.append ("\\n");
                    break;
                case '\t':
                    sb.append ("\\t");
                    break;
                default:
                    sb.append (c);
                    break;
            }
        }
        return sb.append ('"').toString ();
    }


    private static String wordOrQuote (final String text)
    {
        return PLAIN_WORD.matcher (text).matches () ? text : quote (text);
    }


    ////////////////////////////////////////////////////////////////
    // Top-level expressions


    /** {@inheritDoc} */
    @Override
    public String visitAssignment (final Assignment assignment)
    {
        return wordOrQuote (assignment.getName ()) + " = " + this.serializeValue (assignment.getValue ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitBlock (final Block block)
    {
        final List<String> parts = new ArrayList<> ();
        for (final ToplevelExpression item: block.getItems ())
            parts.add (item.accept (this));
        return "\\" + block.getType ().getCommand () + " " + this.block (parts);
    }


    /** {@inheritDoc} */
    @Override
    public String visitHeader (final HeaderBlock header)
    {
        final List<String> parts = new ArrayList<> ();
        for (final Assignment field: header.getFieldList ())
            parts.add (this.visitAssignment (field));
        return "\\header " + this.block (parts);
    }


    /** {@inheritDoc} */
    @Override
    public String visitOutputDef (final OutputDefBlock outputDef)
    {
        final List<String> parts = new ArrayList<> ();
        for (final ToplevelExpression item: outputDef.getItems ())
            parts.add (item.accept (this));
        return "\\" + outputDef.getType ().getCommand () + " " + this.block (parts);
    }


    /** {@inheritDoc} */
    @Override
    public String visitMusic (final ToplevelMusic music)
    {
        return this.serialize (music.getMusic ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitMarkup (final ToplevelMarkup markup)
    {
        final Markup content = markup.getMarkup ();
        final String text = content.isPlainString () ? quote (content.getText ()) : content.getText ();
        return (markup.isList () ? "\\markuplist " : "\\markup ") + text;
    }


    /** {@inheritDoc} */
    @Override
    public String visitScheme (final ToplevelScheme scheme)
    {
        return scheme.getExpression ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitRaw (final RawBlock raw)
    {
        return raw.getText ();
    }


    /**
     * Format a braced block with one item per line.
     *
     * @param parts The rendered items
     * @return The block
     */
    private String block (final List<String> parts)
    {
        if (parts.isEmpty ())
            return "{ }";
        final StringBuilder sb = new StringBuilder ("{\n");
        for (final String part: parts)
            sb.append (this.indentLines (part)).append ('\n');
        return sb.append ('}').toString ();
    }


    private String indentLines (final String text)
    {
        final StringBuilder sb = new StringBuilder ();
        final String [] lines = text.split ("\n", -1);
        for (int i = 0; i < lines.length; i++)
        {
            if (i > 0)
                sb.append ('\n');
            if (!lines[i].isEmpty ())
                sb.append (this.indent).append (lines[i]);
        }
        return sb.toString ();
    }


    /**
     * Format music items between delimiters. Short content stays on one line, otherwise the items
     * are filled into indented lines.
     *
     * @param open The opening delimiter
     * @param items The music items
     * @param close The closing delimiter
     * @param oneItemPerLine Do not fill several items into one line
     * @return The formatted text
     */
    private String musicBlock (final String open, final List<Music> items, final String close, final boolean oneItemPerLine)
    {
        final List<String> parts = new ArrayList<> ();
        int length = 0;
        boolean multiLine = false;
        for (final Music item: items)
        {
            final String part = item.accept (this);
            parts.add (part);
            length += part.length () + 1;
            multiLine |= part.indexOf ('\n') >= 0;
        }
        if (parts.isEmpty ())
            return open + " " + close;
        if (!multiLine && length + open.length () + close.length () + 2 <= LINE_LENGTH && (!oneItemPerLine || parts.size () == 1))
            return open + " " + String.join (" ", parts) + " " + close;

        final StringBuilder sb = new StringBuilder (open).append ('\n');
        final StringBuilder line = new StringBuilder ();
        for (final String part: parts)
        {
            final boolean flush = line.length () > 0 && (oneItemPerLine || part.indexOf ('\n') >= 0 || line.length () + part.length () + 1 > LINE_LENGTH);
            if (flush)
            {
                sb.append (this.indentLines (line.toString ())).append ('\n');
                line.setLength (0);
            }
            if (line.length () > 0)
                line.append (' ');
            line.append (part);
            if (part.indexOf ('\n') >= 0)
            {
                sb.append (this.indentLines (line.toString ())).append ('\n');
                line.setLength (0);
            }
        }
        if (line.length () > 0)
            sb.append (this.indentLines (line.toString ())).append ('\n');
        return sb.append (close).toString ();
    }


    private String modeBlock (final String command, final List<Music> items, final boolean lyrics)
    {
        final boolean previous = this.lyricMode;
        this.lyricMode = lyrics;
        try
        {
            return command + " " + this.musicBlock ("{", items, "}", false);
        }
        finally
        {
            this.lyricMode = previous;
        }
    }


    ////////////////////////////////////////////////////////////////
    // Music


    /** {@inheritDoc} */
    @Override
    public String visitSequentialMusic (final SequentialMusic sequentialMusic)
    {
        return this.musicBlock ("{", sequentialMusic.getItems (), "}", false);
    }


    /** {@inheritDoc} */
    @Override
    public String visitSimultaneousMusic (final SimultaneousMusic simultaneousMusic)
    {
        return this.musicBlock ("<<", simultaneousMusic.getItems (), ">>", true);
    }


    /** {@inheritDoc} */
    @Override
    public String visitRelativeMusic (final RelativeMusic relativeMusic)
    {
        final Pitch reference = relativeMusic.getReference ();
        final String prefix = reference == null ? "\\relative " : "\\relative " + serializePitch (reference) + " ";
        return prefix + relativeMusic.getBody ().accept (this);
    }


    /** {@inheritDoc} */
    @Override
    public String visitFixedMusic (final FixedMusic fixedMusic)
    {
        return "\\fixed " + serializePitch (fixedMusic.getReference ()) + " " + fixedMusic.getBody ().accept (this);
    }


    /** {@inheritDoc} */
    @Override
    public String visitTransposeMusic (final TransposeMusic transposeMusic)
    {
        return "\\transpose " + serializePitch (transposeMusic.getFrom ()) + " " + serializePitch (transposeMusic.getTo ()) + " " + transposeMusic.getBody ().accept (this);
    }


    /** {@inheritDoc} */
    @Override
    public String visitTupletMusic (final TupletMusic tupletMusic)
    {
        final StringBuilder sb = new StringBuilder ("\\tuplet ").append (tupletMusic.getNumerator ()).append ('/').append (tupletMusic.getDenominator ()).append (' ');
        if (tupletMusic.getSpanDuration () != null)
            sb.append (serializeDuration (tupletMusic.getSpanDuration ())).append (' ');
        return sb.append (tupletMusic.getBody ().accept (this)).toString ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitContextMusic (final ContextMusic contextMusic)
    {
        final StringBuilder sb = new StringBuilder ("\\").append (contextMusic.getKeyword ().getKeyword ()).append (' ').append (contextMusic.getContextType ());
        if (contextMusic.getName () != null)
            sb.append (" = ").append (quote (contextMusic.getName ()));
        if (contextMusic.getWithItems () != null)
        {
            final List<String> parts = new ArrayList<> ();
            for (final ContextModItem item: contextMusic.getWithItems ())
                parts.add (serializeContextMod (item));
            sb.append (" \\with ").append (this.block (parts));
        }
        return sb.append (' ').append (contextMusic.getBody ().accept (this)).toString ();
    }


    private static String serializeContextMod (final ContextModItem item)
    {
        switch (item.getType ())
        {
            case ASSIGNMENT:
                return item.getPath () + " = " + item.getValue ();
            case CONTEXT_REF:
                return "\\" + item.getPath ();
            case OVERRIDE:
                return "\\override " + item.getPath () + " = " + item.getValue ();
            case REVERT:
                return "\\revert " + item.getPath ();
            default:
                return "\\" + item.getType ().getCommand () + " " + quote (item.getPath ());
        }
    }


    /** {@inheritDoc} */
    @Override
    public String visitContextChange (final ContextChange contextChange)
    {
        return "\\change " + contextChange.getContextType () + " = " + quote (contextChange.getName ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitNoteEvent (final NoteEvent noteEvent)
    {
        return serializePitch (noteEvent.getPitch ()) + serializeDuration (noteEvent.getDuration ()) + (noteEvent.isPitchedRest () ? "\\rest" : "") + this.serializePostEvents (noteEvent.getPostEvents ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitChordEvent (final ChordEvent chordEvent)
    {
        final List<String> pitches = new ArrayList<> ();
        for (final Pitch pitch: chordEvent.getPitches ())
            pitches.add (serializePitch (pitch));
        return "<" + String.join (" ", pitches) + ">" + serializeDuration (chordEvent.getDuration ()) + this.serializePostEvents (chordEvent.getPostEvents ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitChordRepetition (final ChordRepetition chordRepetition)
    {
        return "q" + serializeDuration (chordRepetition.getDuration ()) + this.serializePostEvents (chordRepetition.getPostEvents ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitChordModeEvent (final ChordModeEvent chordModeEvent)
    {
        final StringBuilder sb = new StringBuilder (serializePitch (chordModeEvent.getRoot ())).append (serializeDuration (chordModeEvent.getDuration ()));
        if (!chordModeEvent.getQuality ().isEmpty ())
            sb.append (':').append (serializeChordSteps (chordModeEvent.getQuality ()));
        if (!chordModeEvent.getRemovals ().isEmpty ())
            sb.append ('^').append (serializeChordSteps (chordModeEvent.getRemovals ()));
        if (chordModeEvent.getInversion () != null)
            sb.append ('/').append (serializePitch (chordModeEvent.getInversion ()));
        else if (chordModeEvent.getBass () != null)
            sb.append ("/+").append (serializePitch (chordModeEvent.getBass ()));
        return sb.append (this.serializePostEvents (chordModeEvent.getPostEvents ())).toString ();
    }


    /**
     * Join chord steps with dots. A step which directly follows a named modifier is attached to it,
     * e.g. 'dim7'.
     *
     * @param items The items
     * @return The text
     */
    private static String serializeChordSteps (final List<ChordQualityItem> items)
    {
        final StringBuilder sb = new StringBuilder ();
        ChordQualityItem previous = null;
        for (final ChordQualityItem item: items)
        {
            final boolean attach = previous != null && previous.isModifier () && !item.isModifier ();
            if (previous != null && !attach)
                sb.append ('.');
            if (item.isModifier ())
                sb.append (item.getModifier ());
            else
            {
                sb.append (item.getStep ());
                if (item.getAlteration () > 0)
                    sb.append ('+');
                else if (item.getAlteration () < 0)
                    sb.append ('-');
            }
            previous = item;
        }
        return sb.toString ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitDrumNoteEvent (final DrumNoteEvent drumNoteEvent)
    {
        return drumNoteEvent.getDrumName () + serializeDuration (drumNoteEvent.getDuration ()) + this.serializePostEvents (drumNoteEvent.getPostEvents ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitDrumChordEvent (final DrumChordEvent drumChordEvent)
    {
        return "<" + String.join (" ", drumChordEvent.getDrumNames ()) + ">" + serializeDuration (drumChordEvent.getDuration ()) + this.serializePostEvents (drumChordEvent.getPostEvents ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitRestEvent (final RestEvent restEvent)
    {
        return "r" + serializeDuration (restEvent.getDuration ()) + this.serializePostEvents (restEvent.getPostEvents ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitSkipEvent (final SkipEvent skipEvent)
    {
        if (this.lyricMode && skipEvent.getDuration () != null)
            return "\\skip " + serializeDuration (skipEvent.getDuration ());
        return "s" + serializeDuration (skipEvent.getDuration ()) + this.serializePostEvents (skipEvent.getPostEvents ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitMultiMeasureRest (final MultiMeasureRest multiMeasureRest)
    {
        return "R" + serializeDuration (multiMeasureRest.getDuration ()) + this.serializePostEvents (multiMeasureRest.getPostEvents ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitClefEvent (final ClefEvent clefEvent)
    {
        return "\\clef " + wordOrQuote (clefEvent.getName ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitKeySignature (final KeySignature keySignature)
    {
        return "\\key " + serializePitch (keySignature.getTonic ()) + " \\" + keySignature.getMode ().getName ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitTimeSignature (final TimeSignature timeSignature)
    {
        final List<String> numerators = new ArrayList<> ();
        for (final Integer numerator: timeSignature.getNumerators ())
            numerators.add (numerator.toString ());
        return "\\time " + String.join ("+", numerators) + "/" + timeSignature.getDenominator ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitAutoBeamEvent (final AutoBeamEvent autoBeamEvent)
    {
        return autoBeamEvent.isOn () ? "\\autoBeamOn" : "\\autoBeamOff";
    }


    /** {@inheritDoc} */
    @Override
    public String visitGraceMusic (final GraceMusic graceMusic)
    {
        return "\\" + graceMusic.getGraceType ().getCommand () + " " + graceMusic.getBody ().accept (this);
    }


    /** {@inheritDoc} */
    @Override
    public String visitAfterGraceMusic (final AfterGraceMusic afterGraceMusic)
    {
        final StringBuilder sb = new StringBuilder ("\\afterGrace ");
        final Multiplier fraction = afterGraceMusic.getFraction ();
        if (fraction != null)
            sb.append (fraction.getNumerator ()).append ('/').append (fraction.getDenominator ()).append (' ');
        return sb.append (afterGraceMusic.getMain ().accept (this)).append (' ').append (afterGraceMusic.getGrace ().accept (this)).toString ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitRepeatMusic (final RepeatMusic repeatMusic)
    {
        final StringBuilder sb = new StringBuilder ("\\repeat ").append (repeatMusic.getRepeatType ().getName ()).append (' ').append (repeatMusic.getCount ()).append (' ').append (repeatMusic.getBody ().accept (this));
        if (repeatMusic.getAlternatives () != null)
            sb.append (" \\alternative ").append (this.musicBlock ("{", repeatMusic.getAlternatives (), "}", true));
        return sb.toString ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitLyricModeMusic (final LyricModeMusic lyricModeMusic)
    {
        final String command = lyricModeMusic.getLyricsTo () == null ? "\\lyricmode" : "\\lyricsto " + quote (lyricModeMusic.getLyricsTo ());
        return this.modeBlock (command, lyricModeMusic.getItems (), true);
    }


    /** {@inheritDoc} */
    @Override
    public String visitLyricEvent (final LyricEvent lyricEvent)
    {
        final StringBuilder sb = new StringBuilder (lyricEvent.isQuoted () ? quote (lyricEvent.getText ()) : lyricEvent.getText ());
        sb.append (serializeDuration (lyricEvent.getDuration ()));
        for (final PostEvent postEvent: lyricEvent.getPostEvents ())
            sb.append (postEvent.getType () == PostEvent.Type.LYRIC_HYPHEN ? " --" : " __");
        return sb.toString ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitFigureModeMusic (final FigureModeMusic figureModeMusic)
    {
        return this.modeBlock ("\\figuremode", figureModeMusic.getItems (), false);
    }


    /** {@inheritDoc} */
    @Override
    public String visitFigureEvent (final FigureEvent figureEvent)
    {
        final List<String> figures = new ArrayList<> ();
        for (final Figure figure: figureEvent.getFigures ())
        {
            final StringBuilder sb = new StringBuilder ();
            if (figure.isBracketStart ())
                sb.append ('[');
            sb.append (figure.getNumber () == null ? "_" : figure.getNumber ().toString ());
            if (figure.getAlteration () != null)
                sb.append (figure.getAlteration ());
            sb.append (figure.formatModifications ());
            if (figure.isBracketEnd ())
                sb.append (']');
            figures.add (sb.toString ());
        }
        return "<" + String.join (" ", figures) + ">" + serializeDuration (figureEvent.getDuration ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitChordModeMusic (final ChordModeMusic chordModeMusic)
    {
        return this.modeBlock ("\\chordmode", chordModeMusic.getItems (), false);
    }


    /** {@inheritDoc} */
    @Override
    public String visitDrumModeMusic (final DrumModeMusic drumModeMusic)
    {
        return this.modeBlock ("\\drummode", drumModeMusic.getItems (), false);
    }


    /** {@inheritDoc} */
    @Override
    public String visitMusicFunctionCall (final MusicFunctionCall musicFunctionCall)
    {
        return "\\" + musicFunctionCall.getName () + this.serializeArguments (musicFunctionCall.getArguments ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitPartialFunction (final PartialFunction partialFunction)
    {
        return "\\" + partialFunction.getName () + this.serializeArguments (partialFunction.getArguments ()) + " \\etc";
    }


    private String serializeArguments (final List<FunctionArgument> arguments)
    {
        final StringBuilder sb = new StringBuilder ();
        for (final FunctionArgument argument: arguments)
        {
            sb.append (' ');
            switch (argument.getType ())
            {
                case STRING:
                    sb.append (quote (argument.getText ()));
                    break;
                case DURATION:
                    sb.append (serializeDuration (argument.getDuration ()));
                    break;
                case DEFAULT:
                    sb.append ("\\default");
                    break;
                case MUSIC:
                    sb.append (argument.getMusic ().accept (this));
                    break;
                default:
                    sb.append (argument.getText ());
                    break;
            }
        }
        return sb.toString ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitIdentifierMusic (final IdentifierMusic identifierMusic)
    {
        return "\\" + identifierMusic.getName ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitTempoEvent (final TempoEvent tempoEvent)
    {
        final StringBuilder sb = new StringBuilder ("\\tempo");
        if (tempoEvent.getText () != null)
            sb.append (' ').append (serializeMarkup (tempoEvent.getText ()));
        if (tempoEvent.getUnit () != null && tempoEvent.getBpm () != null)
        {
            sb.append (' ').append (serializeDuration (tempoEvent.getUnit ())).append (" = ").append (tempoEvent.getBpm ().getLow ());
            if (tempoEvent.getBpm ().isRange ())
                sb.append ('-').append (tempoEvent.getBpm ().getHigh ());
        }
        return sb.toString ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitMarkEvent (final MarkEvent markEvent)
    {
        if (markEvent.getLabel () != null)
            return "\\mark " + serializeMarkup (markEvent.getLabel ());
        if (markEvent.getNumber () != null)
            return "\\mark " + markEvent.getNumber ();
        return "\\mark \\default";
    }


    /** {@inheritDoc} */
    @Override
    public String visitTextMarkEvent (final TextMarkEvent textMarkEvent)
    {
        return "\\textMark " + serializeMarkup (textMarkEvent.getText ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitMarkupMusic (final MarkupMusic markupMusic)
    {
        final Markup markup = markupMusic.getMarkup ();
        return "\\markup " + (markup.isPlainString () ? quote (markup.getText ()) : markup.getText ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitMarkupListMusic (final MarkupListMusic markupListMusic)
    {
        final Markup markup = markupListMusic.getMarkup ();
        return "\\markuplist " + (markup.isPlainString () ? quote (markup.getText ()) : markup.getText ());
    }


    /** {@inheritDoc} */
    @Override
    public String visitRawMusic (final RawMusic rawMusic)
    {
        return rawMusic.getText ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitSchemeMusic (final SchemeMusic schemeMusic)
    {
        return schemeMusic.getExpression ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitPropertyOperation (final PropertyOperation propertyOperation)
    {
        final StringBuilder sb = new StringBuilder ();
        if (propertyOperation.isOnce ())
            sb.append ("\\once ");
        sb.append ('\\').append (propertyOperation.getCommand ().getCommand ()).append (' ').append (propertyOperation.getPath ());
        if (propertyOperation.getValue () != null)
            sb.append (" = ").append (propertyOperation.getValue ());
        return sb.toString ();
    }


    /** {@inheritDoc} */
    @Override
    public String visitBarCheck (final BarCheck barCheck)
    {
        return "|";
    }


    /** {@inheritDoc} */
    @Override
    public String visitBarLine (final BarLine barLine)
    {
        return "\\bar " + quote (barLine.getGlyph ());
    }


    ////////////////////////////////////////////////////////////////
    // Post events


    private String serializePostEvent (final PostEvent postEvent)
    {
        final String prefix = postEvent.getDirection ().getPrefix ();
        switch (postEvent.getType ())
        {
            case TIE:
                return prefix + "~";
            case SLUR_START:
                return prefix + "(";
            case SLUR_END:
                return prefix + ")";
            case PHRASING_SLUR_START:
                return prefix + "\\(";
            case PHRASING_SLUR_END:
                return prefix + "\\)";
            case BEAM_START:
                return prefix + "[";
            case BEAM_END:
                return prefix + "]";
            case CRESCENDO:
                return prefix + "\\<";
            case DECRESCENDO:
                return prefix + "\\>";
            case HAIRPIN_END:
                return prefix + "\\!";
            case DYNAMIC:
            case NAMED_ARTICULATION:
                return prefix + "\\" + postEvent.getValue ();
            case ARTICULATION:
                return prefix + postEvent.getValue ();
            case FINGERING:
                return (prefix.isEmpty () ? "-" : prefix) + postEvent.getNumber ();
            case STRING_NUMBER:
                return prefix + "\\" + postEvent.getNumber ();
            case TREMOLO:
                return postEvent.getNumber () == 0 ? ":" : ":" + postEvent.getNumber ();
            case TEXT_SCRIPT:
                return (prefix.isEmpty () ? "-" : prefix) + serializeMarkup (postEvent.getText ());
            case LYRIC_HYPHEN:
                return " --";
            case LYRIC_EXTENDER:
            default:
                return " __";
        }
    }
}
