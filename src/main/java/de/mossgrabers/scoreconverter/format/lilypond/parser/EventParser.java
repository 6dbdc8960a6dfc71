// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import de.mossgrabers.scoreconverter.format.lilypond.lexer.Token;
import de.mossgrabers.scoreconverter.format.lilypond.lexer.TokenType;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordModeEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordQualityItem;
import de.mossgrabers.scoreconverter.format.lilypond.model.ChordRepetition;
import de.mossgrabers.scoreconverter.format.lilypond.model.Direction;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumChordEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.DrumNoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.Figure;
import de.mossgrabers.scoreconverter.format.lilypond.model.FigureEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.LyricEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Markup;
import de.mossgrabers.scoreconverter.format.lilypond.model.MultiMeasureRest;
import de.mossgrabers.scoreconverter.format.lilypond.model.Multiplier;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.NoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.RestEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.SkipEvent;

import java.util.ArrayList;
import java.util.List;


/**
 * Parses the events of all input modes: notes, chords, rests, chord mode entries, figures, drum
 * notes and lyric syllables including their durations and post events.
 *
 * @author Jürgen Moßgraber
 */
public class EventParser
{
    private final TokenCursor  cursor;
    private final MarkupParser markupParser;
    private Duration           lastDuration;


    /**
     * Constructor.
     *
     * @param cursor The token cursor
     */
    public EventParser (final TokenCursor cursor)
    {
        this.cursor = cursor;
        this.markupParser = new MarkupParser (cursor);
    }


    /**
     * Parse an event which starts with a word.
     *
     * @param mode The current input mode
     * @return The event
     * @throws ParseError Could not parse the event
     */
    public Music parseWordEvent (final InputMode mode) throws ParseError
    {
        final Token token = this.cursor.peek ();
        if (mode == InputMode.LYRICS)
            return this.parseLyricEvent ();

        if (token.is (TokenType.WORD))
        {
            switch (token.getText ())
            {
                case "r":
                    this.cursor.next ();
                    return new RestEvent (this.parseAttachedDuration (), this.parsePostEvents (mode));
                case "R":
                    this.cursor.next ();
                    return new MultiMeasureRest (this.parseAttachedDuration (), this.parsePostEvents (mode));
                case "s":
                    this.cursor.next ();
                    return new SkipEvent (this.parseAttachedDuration (), this.parsePostEvents (mode));
                case "q":
                    if (mode == InputMode.NOTES)
                    {
                        this.cursor.next ();
                        return new ChordRepetition (this.parseAttachedDuration (), this.parsePostEvents (mode));
                    }
                    break;
                default:
                    break;
            }
        }

        switch (mode)
        {
            case DRUMS:
                final Token name = this.cursor.expect (TokenType.WORD, "a drum name");
                return new DrumNoteEvent (name.getText (), this.parseAttachedDuration (), this.parsePostEvents (mode));
            case CHORDS:
                return this.parseChordModeEvent ();
            case FIGURES:
                throw this.cursor.error ("a figure");
            case NOTES:
            default:
                return this.parseNoteEvent ();
        }
    }


    /**
     * Parse an event which starts with an angle bracket. In figure mode the figures can also be
     * enclosed in '\<' and '\>'.
     *
     * @param mode The current input mode
     * @return The event
     * @throws ParseError Could not parse the event
     */
    public Music parseAngleEvent (final InputMode mode) throws ParseError
    {
        if (mode == InputMode.FIGURES && this.cursor.accept (TokenType.ESCAPED_ANGLE_OPEN))
            return this.parseFigureEvent (TokenType.ESCAPED_ANGLE_CLOSE);

        this.cursor.expect (TokenType.ANGLE_OPEN, "<");
        switch (mode)
        {
            case FIGURES:
                return this.parseFigureEvent (TokenType.ANGLE_CLOSE);

            case DRUMS:
                final List<String> names = new ArrayList<> ();
                while (!this.cursor.accept (TokenType.ANGLE_CLOSE))
                    names.add (this.cursor.expect (TokenType.WORD, "a drum name or >").getText ());
                return new DrumChordEvent (names, this.parseAttachedDuration (), this.parsePostEvents (mode));

            default:
                final List<Pitch> pitches = new ArrayList<> ();
                while (!this.cursor.accept (TokenType.ANGLE_CLOSE))
                    pitches.add (this.parsePitch (false));
                return new ChordEvent (pitches, this.parseAttachedDuration (), this.parsePostEvents (mode));
        }
    }


    private NoteEvent parseNoteEvent () throws ParseError
    {
        final Pitch pitch = this.parsePitch (true);
        final boolean pitchedRest = this.cursor.peek ().isCommand ("rest");
        if (pitchedRest)
            this.cursor.next ();
        return new NoteEvent (pitch, pitchedRest, this.lastDuration, this.parsePostEvents (InputMode.NOTES));
    }


    /**
     * Parse a pitch with octave marks, accidental flags and octave check.
     *
     * @param withDuration If true a duration and octave marks following the duration are parsed as
     *            well, the duration is stored in lastDuration
     * @return The pitch
     * @throws ParseError Not a note name
     */
    private Pitch parsePitch (final boolean withDuration) throws ParseError
    {
        final Token word = this.cursor.expect (TokenType.WORD, "a note name");
        final Pitch pitch = Pitch.fromNoteName (word.getText ());
        if (pitch == null)
            throw new ParseError ("Unknown note name '" + word.getText () + "'", word.getOffset (), "a note name");

        final int [] marks = this.readOctaveMarks ();
        final boolean force = this.cursor.checkAdjacent (TokenType.EXCLAMATION);
        if (force)
            this.cursor.next ();
        final boolean cautionary = this.cursor.checkAdjacent (TokenType.QUESTION);
        if (cautionary)
            this.cursor.next ();
        Integer octaveCheck = null;
        if (this.cursor.checkAdjacent (TokenType.EQUALS))
        {
            this.cursor.next ();
            final int [] checkMarks = this.readOctaveMarks ();
            octaveCheck = Integer.valueOf (checkMarks[0] - checkMarks[1]);
        }

        if (withDuration)
        {
            this.lastDuration = this.parseAttachedDuration ();
            if (this.lastDuration != null)
            {
                final int [] after = this.readOctaveMarks ();
                if (after[0] + after[1] > 0)
                {
                    this.cursor.warn (ParseWarning.Type.OCTAVE_AFTER_DURATION, word.getOffset (), "Octave marks after the duration of '" + word.getText () + "'");
                    marks[0] += after[0];
                    marks[1] += after[1];
                }
            }
        }

        if (marks[0] > 0 && marks[1] > 0)
            this.cursor.warn (ParseWarning.Type.MIXED_OCTAVE_MARKS, word.getOffset (), "Mixed octave marks on '" + word.getText () + "'");

        return new Pitch (pitch.getStep (), pitch.getAlter (), marks[0] - marks[1], force, cautionary, octaveCheck);
    }


    /**
     * Parse a pitch which stands on its own, e.g. the reference pitch of a relative block.
     *
     * @return The pitch
     * @throws ParseError Not a pitch
     */
    public Pitch parseStandalonePitch () throws ParseError
    {
        return this.parsePitch (false);
    }


    /**
     * Check if the current token is a note name.
     *
     * @return True if it is a note name
     */
    public boolean isPitchAhead ()
    {
        final Token token = this.cursor.peek ();
        return token.is (TokenType.WORD) && Pitch.fromNoteName (token.getText ()) != null;
    }


    /**
     * Count the adjacent octave marks.
     *
     * @return The number of ' at index 0 and of , at index 1
     */
    private int [] readOctaveMarks ()
    {
        final int [] marks = new int [2];
        while (true)
        {
            if (this.cursor.checkAdjacent (TokenType.APOSTROPHE))
                marks[0]++;
            else if (this.cursor.checkAdjacent (TokenType.COMMA))
                marks[1]++;
            else
                return marks;
            this.cursor.next ();
        }
    }


    /**
     * Parse a duration which must be written directly after the previous token.
     *
     * @return The duration or null if there is none
     * @throws ParseError Invalid duration
     */
    public Duration parseAttachedDuration () throws ParseError
    {
        if (!this.cursor.checkAdjacent (TokenType.NUMBER))
            return null;
        return this.parseDuration ();
    }


    /**
     * Parse a duration: base, dots and multipliers.
     *
     * @return The duration
     * @throws ParseError Invalid duration
     */
    public Duration parseDuration () throws ParseError
    {
        final Token number = this.cursor.expect (TokenType.NUMBER, "a duration");
        final int base = Integer.parseInt (number.getText ());
        if (!Duration.isValidBase (base))
            throw new ParseError ("Invalid duration " + base, number.getOffset (), "a power of two");

        int dots = 0;
        while (this.cursor.checkAdjacent (TokenType.DOT))
        {
            this.cursor.next ();
            dots++;
        }

        final List<Multiplier> multipliers = new ArrayList<> ();
        while (this.cursor.checkAdjacent (TokenType.STAR))
        {
            this.cursor.next ();
            final int numerator = Integer.parseInt (this.cursor.expect (TokenType.NUMBER, "a multiplier").getText ());
            int denominator = 1;
            if (this.cursor.checkAdjacent (TokenType.SLASH))
            {
                this.cursor.next ();
                denominator = Integer.parseInt (this.cursor.expect (TokenType.NUMBER, "a denominator").getText ());
            }
            multipliers.add (new Multiplier (numerator, denominator));
        }
        return new Duration (base, dots, multipliers);
    }


    private ChordModeEvent parseChordModeEvent () throws ParseError
    {
        final Pitch root = this.parsePitch (false);
        final Duration duration = this.parseAttachedDuration ();

        final List<ChordQualityItem> quality = new ArrayList<> ();
        if (this.cursor.checkAdjacent (TokenType.COLON))
        {
            this.cursor.next ();
            this.parseChordSteps (quality, true);
        }

        final List<ChordQualityItem> removals = new ArrayList<> ();
        if (this.cursor.checkAdjacent (TokenType.HAT))
        {
            this.cursor.next ();
            this.parseChordSteps (removals, false);
        }

        Pitch inversion = null;
        Pitch bass = null;
        if (this.cursor.checkAdjacent (TokenType.SLASH))
        {
            this.cursor.next ();
            if (this.cursor.checkAdjacent (TokenType.PLUS))
            {
                this.cursor.next ();
                bass = this.parsePitch (false);
            }
            else
                inversion = this.parsePitch (false);
        }

        return new ChordModeEvent (root, duration, quality, removals, inversion, bass, this.parsePostEvents (InputMode.CHORDS));
    }


    /**
     * Parse dot-separated chord steps, e.g. 'm7.9-'.
     *
     * @param items Where to add the items
     * @param allowModifiers True if named modifiers like 'dim' are allowed
     * @throws ParseError Missing step
     */
    private void parseChordSteps (final List<ChordQualityItem> items, final boolean allowModifiers) throws ParseError
    {
        while (true)
        {
            boolean found = false;
            if (allowModifiers && this.cursor.checkAdjacent (TokenType.WORD))
            {
                items.add (ChordQualityItem.modifier (this.cursor.next ().getText ()));
                found = true;
            }
            if (this.cursor.checkAdjacent (TokenType.NUMBER))
            {
                final int step = Integer.parseInt (this.cursor.next ().getText ());
                int alteration = 0;
                if (this.cursor.checkAdjacent (TokenType.PLUS))
                {
                    this.cursor.next ();
                    alteration = 1;
                }
                else if (this.cursor.checkAdjacent (TokenType.MINUS))
                {
                    this.cursor.next ();
                    alteration = -1;
                }
                items.add (ChordQualityItem.step (step, alteration));
                found = true;
            }
            if (!found)
                throw this.cursor.error ("a chord step");

            final Token afterDot = this.cursor.peek (1);
            if (!this.cursor.checkAdjacent (TokenType.DOT) || afterDot.hasSpaceBefore () || !afterDot.is (TokenType.NUMBER) && !afterDot.is (TokenType.WORD))
                return;
            this.cursor.next ();
        }
    }


    private FigureEvent parseFigureEvent (final TokenType closing) throws ParseError
    {
        final List<Figure> figures = new ArrayList<> ();
        while (!this.cursor.accept (closing))
        {
            final boolean bracketStart = this.cursor.accept (TokenType.OPEN_BRACKET);

            Integer number = null;
            if (this.cursor.check (TokenType.NUMBER))
                number = Integer.valueOf (this.cursor.next ().getText ());
            else
                this.cursor.expect (TokenType.UNDERSCORE, "a figure");

            final StringBuilder alteration = new StringBuilder ();
            while (true)
            {
                final Token token = this.cursor.peek ();
                if (token.hasSpaceBefore () || !token.is (TokenType.PLUS) && !token.is (TokenType.MINUS) && !token.is (TokenType.EXCLAMATION) && !token.is (TokenType.DOUBLE_DASH))
                    break;
                alteration.append (this.cursor.next ().getText ());
            }

            final List<Figure.Modification> modifications = new ArrayList<> ();
            Figure.Modification modification;
            while ((modification = this.parseFigureModification ()) != null)
                modifications.add (modification);

            final boolean bracketEnd = this.cursor.accept (TokenType.CLOSE_BRACKET);
            figures.add (new Figure (number, alteration.length () == 0 ? null : alteration.toString (), modifications, bracketStart, bracketEnd));
        }
        return new FigureEvent (figures, this.parseAttachedDuration ());
    }


    private Figure.Modification parseFigureModification ()
    {
        final Token token = this.cursor.peek ();
        if (token.hasSpaceBefore ())
            return null;
        final Figure.Modification modification;
        switch (token.getType ())
        {
            case ESCAPED_PLUS:
                modification = Figure.Modification.AUGMENTED;
                break;
            case ESCAPED_EXCLAMATION:
                modification = Figure.Modification.NO_CONTINUATION;
                break;
            case SLASH:
                modification = Figure.Modification.DIMINISHED;
                break;
            case DOUBLE_BACKSLASH:
                modification = Figure.Modification.AUGMENTED_SLASH;
                break;
            default:
                return null;
        }
        this.cursor.next ();
        return modification;
    }


    private LyricEvent parseLyricEvent () throws ParseError
    {
        final Token first = this.cursor.next ();
        final String text;
        final boolean quoted;
        if (first.is (TokenType.STRING))
        {
            text = first.getText ();
            quoted = true;
        }
        else if (first.is (TokenType.WORD) || first.is (TokenType.UNDERSCORE))
        {
            final StringBuilder sb = new StringBuilder (first.getText ());
            while (isSyllablePart (this.cursor.peek ()))
                sb.append (this.cursor.next ().getText ());
            text = sb.toString ();
            quoted = false;
        }
        else
            throw new ParseError ("Unexpected '" + first.getText () + "'", first.getOffset (), "a lyric syllable");

        return new LyricEvent (text, quoted, this.parseAttachedDuration (), this.parsePostEvents (InputMode.LYRICS));
    }


    private static boolean isSyllablePart (final Token token)
    {
        if (token.hasSpaceBefore ())
            return false;
        switch (token.getType ())
        {
            case WORD:
            case APOSTROPHE:
            case COMMA:
            case DOT:
            case EXCLAMATION:
            case QUESTION:
            case COLON:
                return true;
            default:
                return false;
        }
    }


    /**
     * Parse all post events which follow an event.
     *
     * @param mode The current input mode
     * @return The post events, might be empty
     * @throws ParseError Malformed post event
     */
    public List<PostEvent> parsePostEvents (final InputMode mode) throws ParseError
    {
        final List<PostEvent> postEvents = new ArrayList<> ();
        while (true)
        {
            final PostEvent postEvent = this.parsePostEvent (mode);
            if (postEvent == null)
                return postEvents;
            postEvents.add (postEvent);
        }
    }


    private PostEvent parsePostEvent (final InputMode mode) throws ParseError
    {
        final Token token = this.cursor.peek ();

        if (mode == InputMode.LYRICS)
        {
            if (token.is (TokenType.DOUBLE_DASH))
            {
                this.cursor.next ();
                return PostEvent.of (PostEvent.Type.LYRIC_HYPHEN);
            }
            if (token.is (TokenType.DOUBLE_UNDERSCORE))
            {
                this.cursor.next ();
                return PostEvent.of (PostEvent.Type.LYRIC_EXTENDER);
            }
            return null;
        }

        switch (token.getType ())
        {
            case DOUBLE_DASH:
                this.cursor.next ();
                return PostEvent.named (PostEvent.Type.ARTICULATION, Direction.NEUTRAL, "-");

            case DOUBLE_UNDERSCORE:
                this.cursor.next ();
                return PostEvent.named (PostEvent.Type.ARTICULATION, Direction.DOWN, "_");

            case MINUS:
                this.cursor.next ();
                return this.parseDirectedPostEvent (Direction.NEUTRAL);

            case HAT:
                this.cursor.next ();
                return this.parseDirectedPostEvent (Direction.UP);

            case UNDERSCORE:
                this.cursor.next ();
                return this.parseDirectedPostEvent (Direction.DOWN);

            case COLON:
                // The first token of a standalone post event list has no event to attach to
                if (token.hasSpaceBefore () && this.cursor.getPosition () > 0)
                    return null;
                this.cursor.next ();
                int tremolo = 0;
                if (this.cursor.checkAdjacent (TokenType.NUMBER))
                    tremolo = Integer.parseInt (this.cursor.next ().getText ());
                return PostEvent.numbered (PostEvent.Type.TREMOLO, Direction.NONE, tremolo);

            default:
                return this.parseSimplePostEvent (Direction.NONE);
        }
    }


    /**
     * Parse the post events which can be written with and without a direction prefix.
     *
     * @param direction The direction
     * @return The post event or null if the current token does not start one
     * @throws ParseError Malformed markup
     */
    private PostEvent parseSimplePostEvent (final Direction direction) throws ParseError
    {
        final Token token = this.cursor.peek ();
        final PostEvent.Type simpleType = simpleType (token.getType ());
        if (simpleType != null)
        {
            this.cursor.next ();
            return new PostEvent (simpleType, direction, null, 0, null);
        }

        if (token.is (TokenType.STRING_NUMBER))
        {
            this.cursor.next ();
            return PostEvent.numbered (PostEvent.Type.STRING_NUMBER, direction, Integer.parseInt (token.getText ()));
        }

        if (token.is (TokenType.COMMAND))
        {
            final String name = token.getText ();
            if (Vocabulary.DYNAMICS.contains (name))
            {
                this.cursor.next ();
                return PostEvent.named (PostEvent.Type.DYNAMIC, direction, name);
            }
            if (Vocabulary.ARTICULATIONS.contains (name))
            {
                this.cursor.next ();
                return PostEvent.named (PostEvent.Type.NAMED_ARTICULATION, direction, name);
            }
        }
        return null;
    }


    private PostEvent parseDirectedPostEvent (final Direction direction) throws ParseError
    {
        final Token token = this.cursor.peek ();
        switch (token.getType ())
        {
            case DOT:
            case MINUS:
            case ANGLE_CLOSE:
            case HAT:
            case PLUS:
            case EXCLAMATION:
            case UNDERSCORE:
                this.cursor.next ();
                return PostEvent.named (PostEvent.Type.ARTICULATION, direction, token.getText ());

            case NUMBER:
                this.cursor.next ();
                return PostEvent.numbered (PostEvent.Type.FINGERING, direction, Integer.parseInt (token.getText ()));

            case STRING:
                this.cursor.next ();
                return PostEvent.textScript (direction, Markup.ofString (token.getText ()));

            case COMMAND:
                if (token.isCommand ("markup"))
                {
                    this.cursor.next ();
                    return PostEvent.textScript (direction, this.markupParser.parseMarkup ());
                }
                final PostEvent simple = this.parseSimplePostEvent (direction);
                if (simple != null)
                    return simple;
                // Any other command after a direction is an articulation
                this.cursor.next ();
                return PostEvent.named (PostEvent.Type.NAMED_ARTICULATION, direction, token.getText ());

            default:
                final PostEvent other = this.parseSimplePostEvent (direction);
                if (other == null)
                    throw this.cursor.error ("a post event");
                return other;
        }
    }


    private static PostEvent.Type simpleType (final TokenType type)
    {
        switch (type)
        {
            case TILDE:
                return PostEvent.Type.TIE;
            case OPEN_PAREN:
                return PostEvent.Type.SLUR_START;
            case CLOSE_PAREN:
                return PostEvent.Type.SLUR_END;
            case ESCAPED_OPEN_PAREN:
                return PostEvent.Type.PHRASING_SLUR_START;
            case ESCAPED_CLOSE_PAREN:
                return PostEvent.Type.PHRASING_SLUR_END;
            case OPEN_BRACKET:
                return PostEvent.Type.BEAM_START;
            case CLOSE_BRACKET:
                return PostEvent.Type.BEAM_END;
            case ESCAPED_ANGLE_OPEN:
                return PostEvent.Type.CRESCENDO;
            case ESCAPED_ANGLE_CLOSE:
                return PostEvent.Type.DECRESCENDO;
            case ESCAPED_EXCLAMATION:
                return PostEvent.Type.HAIRPIN_END;
            default:
                return null;
        }
    }
}
