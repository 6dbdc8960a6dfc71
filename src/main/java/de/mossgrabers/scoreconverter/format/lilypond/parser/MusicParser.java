// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import de.mossgrabers.scoreconverter.format.lilypond.lexer.Token;
import de.mossgrabers.scoreconverter.format.lilypond.lexer.TokenType;
import de.mossgrabers.scoreconverter.format.lilypond.model.AfterGraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.AutoBeamEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.BarCheck;
import de.mossgrabers.scoreconverter.format.lilypond.model.BarLine;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ClefEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextChange;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextKeyword;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextModItem;
import de.mossgrabers.scoreconverter.format.lilypond.model.ContextMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FixedMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.FunctionArgument;
import de.mossgrabers.scoreconverter.format.lilypond.model.GraceMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.GraceType;
import de.mossgrabers.scoreconverter.format.lilypond.model.IdentifierMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.KeyMode;
import de.mossgrabers.scoreconverter.format.lilypond.model.KeySignature;
import de.mossgrabers.scoreconverter.format.lilypond.model.LyricModeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.MarkEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Markup;
import de.mossgrabers.scoreconverter.format.lilypond.model.MarkupListMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.MarkupMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.Multiplier;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicFunctionCall;
import de.mossgrabers.scoreconverter.format.lilypond.model.PartialFunction;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.PropertyCommand;
import de.mossgrabers.scoreconverter.format.lilypond.model.PropertyOperation;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RelativeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RepeatMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.RepeatType;
import de.mossgrabers.scoreconverter.format.lilypond.model.SchemeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SimultaneousMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.SkipEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.TempoEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.TempoRange;
import de.mossgrabers.scoreconverter.format.lilypond.model.TextMarkEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.TimeSignature;
import de.mossgrabers.scoreconverter.format.lilypond.model.TransposeMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.TupletMusic;

import java.util.ArrayList;
import java.util.List;


/**
 * Parses music expressions. Keeps track of the input mode which changes with \chordmode,
 * \lyricmode, etc.
 *
 * @author Jürgen Moßgraber
 */
public class MusicParser
{
    /** The separator of voices in simultaneous music. */
    public static final String VOICE_SEPARATOR = "\\\\";

    private final TokenCursor  cursor;
    private final EventParser  eventParser;
    private final MarkupParser markupParser;
    private InputMode          mode = InputMode.NOTES;


    /**
     * Constructor.
     *
     * @param cursor The token cursor
     */
    public MusicParser (final TokenCursor cursor)
    {
        this.cursor = cursor;
        this.eventParser = new EventParser (cursor);
        this.markupParser = new MarkupParser (cursor);
    }


    /**
     * Set the input mode for the following music.
     *
     * @param mode The mode
     */
    public void setMode (final InputMode mode)
    {
        this.mode = mode;
    }


    public EventParser getEventParser ()
    {
        return this.eventParser;
    }


    public MarkupParser getMarkupParser ()
    {
        return this.markupParser;
    }


    /**
     * Parse one music expression.
     *
     * @return The music
     * @throws ParseError Malformed music
     */
    public Music parseMusic () throws ParseError
    {
        final Token token = this.cursor.peek ();
        switch (token.getType ())
        {
            case OPEN_BRACE:
                return new SequentialMusic (this.parseSequentialItems ());

            case DOUBLE_ANGLE_OPEN:
                return this.parseSimultaneous ();

            case PIPE:
                this.cursor.next ();
                return new BarCheck ();

            case SCHEME:
                this.cursor.next ();
                return new SchemeMusic (token.getText ());

            case COMMAND:
                return this.parseCommand ();

            case ANGLE_OPEN:
                return this.eventParser.parseAngleEvent (this.mode);

            case ESCAPED_ANGLE_OPEN:
                if (this.mode != InputMode.FIGURES)
                    throw this.cursor.error ("a music expression");
                return this.eventParser.parseAngleEvent (this.mode);

            case STRING:
            case UNDERSCORE:
                if (this.mode != InputMode.LYRICS)
                    throw this.cursor.error ("a music expression");
                return this.eventParser.parseWordEvent (this.mode);

            case WORD:
                return this.eventParser.parseWordEvent (this.mode);

            default:
                throw this.cursor.error ("a music expression");
        }
    }


    /**
     * Parse the items of a braced block. Errors in an item are recovered by skipping to the next
     * bar check or the closing brace. The skipped text is kept as raw music.
     *
     * @return The items
     * @throws ParseError The block is not terminated
     */
    public List<Music> parseSequentialItems () throws ParseError
    {
        this.cursor.expect (TokenType.OPEN_BRACE, "{");
        final List<Music> items = new ArrayList<> ();
        while (!this.cursor.accept (TokenType.CLOSE_BRACE))
        {
            if (this.cursor.isAtEnd ())
                throw this.cursor.error ("}");

            final int start = this.cursor.getPosition ();
            try
            {
                items.add (this.parseMusic ());
            }
            catch (final ParseError error)
            {
                items.add (this.recover (start, error));
            }
        }
        return items;
    }


    private RawMusic recover (final int start, final ParseError error) throws ParseError
    {
        this.cursor.reset (start);
        int depth = 0;
        boolean consumed = false;
        while (true)
        {
            final Token token = this.cursor.peek ();
            if (token.is (TokenType.EOF))
                throw error;
            if (consumed && depth == 0 && (token.is (TokenType.PIPE) || token.is (TokenType.CLOSE_BRACE)))
                break;
            if (token.is (TokenType.OPEN_BRACE) || token.is (TokenType.DOUBLE_ANGLE_OPEN))
                depth++;
            else if (token.is (TokenType.CLOSE_BRACE) || token.is (TokenType.DOUBLE_ANGLE_CLOSE))
                depth = Math.max (0, depth - 1);
            this.cursor.next ();
            consumed = true;
        }
        this.cursor.warn (ParseWarning.Type.RECOVERED_ERROR, error.getErrorOffset (), error.getMessage ());
        return new RawMusic (this.cursor.getSource (start, this.cursor.getPosition ()));
    }


    private SimultaneousMusic parseSimultaneous () throws ParseError
    {
        this.cursor.expect (TokenType.DOUBLE_ANGLE_OPEN, "<<");
        final List<Music> items = new ArrayList<> ();
        while (!this.cursor.accept (TokenType.DOUBLE_ANGLE_CLOSE))
        {
            if (this.cursor.accept (TokenType.DOUBLE_BACKSLASH))
                items.add (new RawMusic (VOICE_SEPARATOR));
            else
                items.add (this.parseMusic ());
        }
        return new SimultaneousMusic (items);
    }


    private Music parseCommand () throws ParseError
    {
        final Token command = this.cursor.next ();
        final String name = command.getText ();

        final GraceType graceType = GraceType.fromCommand (name);
        if (graceType != null)
            return new GraceMusic (graceType, this.parseMusic ());

        final PropertyCommand propertyCommand = PropertyCommand.fromCommand (name);
        if (propertyCommand != null)
            return this.parsePropertyOperation (propertyCommand, false);

        switch (name)
        {
            case "relative":
                final Pitch relativeReference = this.eventParser.isPitchAhead () ? this.eventParser.parseStandalonePitch () : null;
                return new RelativeMusic (relativeReference, this.parseMusic ());

            case "fixed":
                final Pitch fixedReference = this.eventParser.parseStandalonePitch ();
                return new FixedMusic (fixedReference, this.parseMusic ());

            case "transpose":
                final Pitch from = this.eventParser.parseStandalonePitch ();
                final Pitch to = this.eventParser.parseStandalonePitch ();
                return new TransposeMusic (from, to, this.parseMusic ());

            case "tuplet":
                final int [] fraction = this.parseFraction ();
                final Duration span = this.cursor.check (TokenType.NUMBER) ? this.eventParser.parseDuration () : null;
                return new TupletMusic (fraction[0], fraction[1], span, this.parseMusic ());

            case "times":
                final int [] timesFraction = this.parseFraction ();
                return new TupletMusic (timesFraction[1], timesFraction[0], null, this.parseMusic ());

            case "new":
                return this.parseContext (ContextKeyword.NEW);

            case "context":
                return this.parseContext (ContextKeyword.CONTEXT);

            case "change":
                final String changeType = this.cursor.expect (TokenType.WORD, "a context type").getText ();
                this.cursor.expect (TokenType.EQUALS, "=");
                return new ContextChange (changeType, this.parseName ());

            case "afterGrace":
                Multiplier afterFraction = null;
                if (this.cursor.check (TokenType.NUMBER) && this.cursor.peek (1).is (TokenType.SLASH))
                {
                    final int [] values = this.parseFraction ();
                    afterFraction = new Multiplier (values[0], values[1]);
                }
                final Music main = this.parseMusic ();
                return new AfterGraceMusic (afterFraction, main, this.parseMusic ());

            case "repeat":
                return this.parseRepeat ();

            case "lyricmode":
                return new LyricModeMusic (null, this.parseModeItems (InputMode.LYRICS));

            case "lyrics":
                return newContext ("Lyrics", new LyricModeMusic (null, this.parseModeItems (InputMode.LYRICS)));

            case "lyricsto":
                final String voice = this.parseName ();
                if (this.cursor.peek ().isCommand ("lyricmode"))
                    this.cursor.next ();
                return new LyricModeMusic (voice, this.parseModeItems (InputMode.LYRICS));

            case "chordmode":
                return new ChordModeMusic (this.parseModeItems (InputMode.CHORDS));

            case "chords":
                return newContext ("ChordNames", new ChordModeMusic (this.parseModeItems (InputMode.CHORDS)));

            case "figuremode":
                return new FigureModeMusic (this.parseModeItems (InputMode.FIGURES));

            case "figures":
                return newContext ("FiguredBass", new FigureModeMusic (this.parseModeItems (InputMode.FIGURES)));

            case "drummode":
                return new DrumModeMusic (this.parseModeItems (InputMode.DRUMS));

            case "drums":
                return newContext ("DrumStaff", new DrumModeMusic (this.parseModeItems (InputMode.DRUMS)));

            case "clef":
                if (this.cursor.check (TokenType.STRING))
                    return new ClefEvent (this.cursor.next ().getText ());
                return new ClefEvent (this.cursor.expect (TokenType.WORD, "a clef name").getText ());

            case "key":
                final Pitch tonic = this.eventParser.parseStandalonePitch ();
                final Token modeToken = this.cursor.expect (TokenType.COMMAND, "a key mode");
                final KeyMode keyMode = KeyMode.fromName (modeToken.getText ());
                if (keyMode == null)
                    throw new ParseError ("Unknown key mode '" + modeToken.getText () + "'", modeToken.getOffset (), "a key mode");
                return new KeySignature (tonic, keyMode);

            case "time":
                return this.parseTimeSignature ();

            case "autoBeamOn":
                return new AutoBeamEvent (true);

            case "autoBeamOff":
                return new AutoBeamEvent (false);

            case "tempo":
                return this.parseTempo ();

            case "mark":
                if (this.cursor.peek ().isCommand ("default"))
                {
                    this.cursor.next ();
                    return new MarkEvent (null, null);
                }
                if (this.cursor.check (TokenType.NUMBER))
                    return new MarkEvent (null, Integer.valueOf (this.cursor.next ().getText ()));
                return new MarkEvent (this.parseTextOrMarkup (), null);

            case "textMark":
                return new TextMarkEvent (this.parseTextOrMarkup ());

            case "markup":
                return new MarkupMusic (this.markupParser.parseMarkup ());

            case "markuplist":
                return new MarkupListMusic (this.markupParser.parseMarkup ());

            case "once":
                final Token next = this.cursor.peek ();
                final PropertyCommand onceCommand = next.is (TokenType.COMMAND) ? PropertyCommand.fromCommand (next.getText ()) : null;
                if (onceCommand == null)
                    return this.parseFunctionCall (name);
                this.cursor.next ();
                return this.parsePropertyOperation (onceCommand, true);

            case "bar":
                return new BarLine (this.cursor.expect (TokenType.STRING, "a bar line glyph").getText ());

            case "skip":
                return new SkipEvent (this.eventParser.parseDuration (), List.of ());

            default:
                return this.parseFunctionCall (name);
        }
    }


    private static ContextMusic newContext (final String contextType, final Music body)
    {
        return new ContextMusic (ContextKeyword.NEW, contextType, null, null, body);
    }


    private List<Music> parseModeItems (final InputMode newMode) throws ParseError
    {
        final InputMode previous = this.mode;
        this.mode = newMode;
        try
        {
            if (this.cursor.check (TokenType.OPEN_BRACE))
                return this.parseSequentialItems ();
            return List.of (this.parseMusic ());
        }
        finally
        {
            this.mode = previous;
        }
    }


    private int [] parseFraction () throws ParseError
    {
        final int numerator = Integer.parseInt (this.cursor.expect (TokenType.NUMBER, "a fraction").getText ());
        this.cursor.expect (TokenType.SLASH, "/");
        final int denominator = Integer.parseInt (this.cursor.expect (TokenType.NUMBER, "a denominator").getText ());
        return new int []
        {
            numerator,
            denominator
        };
    }


    private String parseName () throws ParseError
    {
        if (this.cursor.check (TokenType.STRING))
            return this.cursor.next ().getText ();
        return this.cursor.expect (TokenType.WORD, "a name").getText ();
    }


    private ContextMusic parseContext (final ContextKeyword keyword) throws ParseError
    {
        final String contextType = this.cursor.expect (TokenType.WORD, "a context type").getText ();
        String contextName = null;
        if (this.cursor.accept (TokenType.EQUALS))
            contextName = this.parseName ();
        List<ContextModItem> withItems = null;
        if (this.cursor.peek ().isCommand ("with"))
        {
            this.cursor.next ();
            withItems = this.parseWithBlock ();
        }
        return new ContextMusic (keyword, contextType, contextName, withItems, this.parseMusic ());
    }


    /**
     * Parse the content of a \with block.
     *
     * @return The modifications
     * @throws ParseError Malformed block
     */
    public List<ContextModItem> parseWithBlock () throws ParseError
    {
        this.cursor.expect (TokenType.OPEN_BRACE, "{");
        final List<ContextModItem> items = new ArrayList<> ();
        while (!this.cursor.accept (TokenType.CLOSE_BRACE))
        {
            final Token token = this.cursor.peek ();
            if (token.is (TokenType.WORD))
            {
                final String path = this.markupParser.parsePath ();
                this.cursor.expect (TokenType.EQUALS, "=");
                items.add (new ContextModItem (ContextModItem.Type.ASSIGNMENT, path, this.markupParser.parseValue ()));
                continue;
            }

            final Token command = this.cursor.expect (TokenType.COMMAND, "a context modification");
            final ContextModItem.Type type = ContextModItem.Type.fromCommand (command.getText ());
            if (type == null)
            {
                items.add (new ContextModItem (ContextModItem.Type.CONTEXT_REF, command.getText (), null));
                continue;
            }
            switch (type)
            {
                case OVERRIDE:
                    final String path = this.markupParser.parsePath ();
                    this.cursor.expect (TokenType.EQUALS, "=");
                    items.add (new ContextModItem (type, path, this.markupParser.parseValue ()));
                    break;
                case REVERT:
                    items.add (new ContextModItem (type, this.markupParser.parsePath (), null));
                    break;
                default:
                    items.add (new ContextModItem (type, this.parseName (), null));
                    break;
            }
        }
        return items;
    }


    private PropertyOperation parsePropertyOperation (final PropertyCommand command, final boolean once) throws ParseError
    {
        final String path = this.markupParser.parsePath ();
        String value = null;
        if (command.hasValue ())
        {
            this.cursor.expect (TokenType.EQUALS, "=");
            value = this.markupParser.parseValue ();
        }
        return new PropertyOperation (command, once, path, value);
    }


    private RepeatMusic parseRepeat () throws ParseError
    {
        final Token typeToken = this.cursor.expect (TokenType.WORD, "a repeat type");
        final RepeatType repeatType = RepeatType.fromName (typeToken.getText ());
        if (repeatType == null)
            throw new ParseError ("Unknown repeat type '" + typeToken.getText () + "'", typeToken.getOffset (), "a repeat type");
        final int count = Integer.parseInt (this.cursor.expect (TokenType.NUMBER, "a repeat count").getText ());
        final Music body = this.parseMusic ();

        List<Music> alternatives = null;
        if (this.cursor.peek ().isCommand ("alternative"))
        {
            this.cursor.next ();
            this.cursor.expect (TokenType.OPEN_BRACE, "{");
            alternatives = new ArrayList<> ();
            while (!this.cursor.accept (TokenType.CLOSE_BRACE))
                alternatives.add (this.parseMusic ());
        }
        return new RepeatMusic (repeatType, count, body, alternatives);
    }


    private TimeSignature parseTimeSignature () throws ParseError
    {
        final List<Integer> numerators = new ArrayList<> ();
        numerators.add (Integer.valueOf (this.cursor.expect (TokenType.NUMBER, "a time signature").getText ()));
        while (this.cursor.accept (TokenType.PLUS))
            numerators.add (Integer.valueOf (this.cursor.expect (TokenType.NUMBER, "a numerator").getText ()));
        this.cursor.expect (TokenType.SLASH, "/");
        final int denominator = Integer.parseInt (this.cursor.expect (TokenType.NUMBER, "a denominator").getText ());
        return new TimeSignature (numerators, denominator);
    }


    private TempoEvent parseTempo () throws ParseError
    {
        Markup text = null;
        if (this.cursor.check (TokenType.STRING))
            text = Markup.ofString (this.cursor.next ().getText ());
        else if (this.cursor.peek ().isCommand ("markup"))
        {
            this.cursor.next ();
            text = this.markupParser.parseMarkup ();
        }

        Duration unit = null;
        TempoRange bpm = null;
        if (this.cursor.check (TokenType.NUMBER))
        {
            unit = this.eventParser.parseDuration ();
            this.cursor.expect (TokenType.EQUALS, "=");
            final int low = Integer.parseInt (this.cursor.expect (TokenType.NUMBER, "a tempo").getText ());
            Integer high = null;
            if (this.cursor.accept (TokenType.MINUS))
                high = Integer.valueOf (this.cursor.expect (TokenType.NUMBER, "the end of the tempo range").getText ());
            bpm = new TempoRange (low, high);
        }

        if (text == null && unit == null)
            throw this.cursor.error ("a tempo text or metronome mark");
        return new TempoEvent (text, unit, bpm);
    }


    private Markup parseTextOrMarkup () throws ParseError
    {
        if (this.cursor.check (TokenType.STRING))
            return Markup.ofString (this.cursor.next ().getText ());
        if (!this.cursor.peek ().isCommand ("markup"))
            throw this.cursor.error ("a string or markup");
        this.cursor.next ();
        return this.markupParser.parseMarkup ();
    }


    /**
     * Parse the arguments of an unknown command. Without arguments the command is a reference to a
     * variable.
     *
     * @param name The name of the command
     * @return The music
     * @throws ParseError Malformed argument
     */
    private Music parseFunctionCall (final String name) throws ParseError
    {
        final List<FunctionArgument> arguments = new ArrayList<> ();
        while (true)
        {
            final Token token = this.cursor.peek ();
            if (token.is (TokenType.STRING))
            {
                this.cursor.next ();
                arguments.add (FunctionArgument.ofText (FunctionArgument.Type.STRING, token.getText ()));
            }
            else if (token.is (TokenType.NUMBER))
            {
                if (this.cursor.peek (1).is (TokenType.SLASH) && this.cursor.peek (2).is (TokenType.NUMBER))
                {
                    final int [] fraction = this.parseFraction ();
                    arguments.add (FunctionArgument.ofText (FunctionArgument.Type.FRACTION, fraction[0] + "/" + fraction[1]));
                }
                else if (this.cursor.peek (1).is (TokenType.DOT) && !this.cursor.peek (1).hasSpaceBefore () || this.cursor.peek (1).is (TokenType.STAR) && !this.cursor.peek (1).hasSpaceBefore ())
                    arguments.add (FunctionArgument.ofDuration (this.eventParser.parseDuration ()));
                else
                {
                    this.cursor.next ();
                    arguments.add (FunctionArgument.ofText (FunctionArgument.Type.NUMBER, token.getText ()));
                }
            }
            else if (token.is (TokenType.REAL))
            {
                this.cursor.next ();
                arguments.add (FunctionArgument.ofText (FunctionArgument.Type.NUMBER, token.getText ()));
            }
            else if (token.is (TokenType.SCHEME))
            {
                this.cursor.next ();
                arguments.add (FunctionArgument.ofText (FunctionArgument.Type.SCHEME, token.getText ()));
            }
            else if (token.isCommand ("default"))
            {
                this.cursor.next ();
                arguments.add (FunctionArgument.ofDefault ());
            }
            else if (token.is (TokenType.OPEN_BRACE) || token.is (TokenType.DOUBLE_ANGLE_OPEN))
                arguments.add (FunctionArgument.ofMusic (this.parseMusic ()));
            else
                break;
        }

        if (this.cursor.peek ().isCommand ("etc"))
        {
            this.cursor.next ();
            return new PartialFunction (name, arguments);
        }
        if (arguments.isEmpty ())
            return new IdentifierMusic (name);
        return new MusicFunctionCall (name, arguments);
    }
}
