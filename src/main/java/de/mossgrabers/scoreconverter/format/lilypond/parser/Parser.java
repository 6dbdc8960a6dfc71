// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import de.mossgrabers.scoreconverter.format.lilypond.lexer.Lexer;
import de.mossgrabers.scoreconverter.format.lilypond.lexer.Token;
import de.mossgrabers.scoreconverter.format.lilypond.lexer.TokenType;
import de.mossgrabers.scoreconverter.format.lilypond.model.Assignment;
import de.mossgrabers.scoreconverter.format.lilypond.model.AssignmentValue;
import de.mossgrabers.scoreconverter.format.lilypond.model.Block;
import de.mossgrabers.scoreconverter.format.lilypond.model.BlockType;
import de.mossgrabers.scoreconverter.format.lilypond.model.HeaderBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.IdentifierMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.OutputDefBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.OutputDefType;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelExpression;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMarkup;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelScheme;

import java.util.ArrayList;
import java.util.List;


/**
 * Recursive descent parser for LilyPond files. Parses the top-level structure and delegates music
 * expressions to the music parser.
 *
 * @author Jürgen Moßgraber
 */
public class Parser
{
    private final TokenCursor             cursor;
    private final MusicParser             musicParser;
    private final NumericExpressionParser numericParser;


    /**
     * Constructor.
     *
     * @param source The text to parse
     * @throws ParseError The text could not be tokenized
     */
    public Parser (final String source) throws ParseError
    {
        this.cursor = new TokenCursor (source, new Lexer (source).tokenize ());
        this.musicParser = new MusicParser (this.cursor);
        this.numericParser = new NumericExpressionParser (this.cursor);
    }


    /**
     * Parse a complete file.
     *
     * @param source The content of the file
     * @return The file and the warnings
     * @throws ParseError The file could not be parsed
     */
    public static ParseResult parse (final String source) throws ParseError
    {
        final Parser parser = new Parser (source);
        final LilyPondFile file = parser.parseFile ();
        return new ParseResult (file, parser.cursor.getWarnings ());
    }


    /**
     * Parse a single music expression, e.g. a fragment which was stored as text.
     *
     * @param source The text
     * @param mode The input mode to start with
     * @return The music
     * @throws ParseError The text is not exactly one music expression
     */
    public static Music parseMusic (final String source, final InputMode mode) throws ParseError
    {
        final Parser parser = new Parser (source);
        parser.musicParser.setMode (mode);
        final Music music = parser.musicParser.parseMusic ();
        parser.expectEnd ();
        return music;
    }


    /**
     * Parse a single top-level expression.
     *
     * @param source The text
     * @return The expression
     * @throws ParseError The text is not exactly one top-level expression
     */
    public static ToplevelExpression parseToplevel (final String source) throws ParseError
    {
        final Parser parser = new Parser (source);
        final ToplevelExpression expression = parser.parseToplevelExpression ();
        parser.expectEnd ();
        return expression;
    }


    /**
     * Parse the value of an assignment.
     *
     * @param source The text
     * @return The value
     * @throws ParseError The text is not exactly one value
     */
    public static AssignmentValue parseAssignmentValue (final String source) throws ParseError
    {
        final Parser parser = new Parser (source);
        final AssignmentValue value = parser.parseValue ();
        parser.expectEnd ();
        return value;
    }


    /**
     * Parse a list of post events, e.g. '-. ( ^"dolce"'.
     *
     * @param source The text
     * @return The post events
     * @throws ParseError The text does not only contain post events
     */
    public static List<PostEvent> parsePostEvents (final String source) throws ParseError
    {
        final Parser parser = new Parser (source);
        final List<PostEvent> postEvents = parser.musicParser.getEventParser ().parsePostEvents (InputMode.NOTES);
        parser.expectEnd ();
        return postEvents;
    }


    private void expectEnd () throws ParseError
    {
        if (!this.cursor.isAtEnd ())
            throw this.cursor.error ("end of input");
    }


    private LilyPondFile parseFile () throws ParseError
    {
        String version = null;
        final List<ToplevelExpression> items = new ArrayList<> ();
        while (!this.cursor.isAtEnd ())
        {
            if (this.cursor.peek ().isCommand ("version"))
            {
                this.cursor.next ();
                version = this.cursor.expect (TokenType.STRING, "a version string").getText ();
                continue;
            }

            final int start = this.cursor.getPosition ();
            try
            {
                items.add (this.parseToplevelExpression ());
            }
            catch (final ParseError error)
            {
                items.add (this.recover (start, error));
            }
        }
        return new LilyPondFile (version, items);
    }


    /**
     * Skip a failed top-level expression up to the next balanced position which starts a new
     * expression.
     *
     * @param start The position of the failed expression
     * @param error The error
     * @return The skipped text
     * @throws ParseError The remaining text is not balanced
     */
    private RawBlock recover (final int start, final ParseError error) throws ParseError
    {
        this.cursor.reset (start);
        int depth = 0;
        boolean consumed = false;
        while (true)
        {
            final Token token = this.cursor.peek ();
            if (token.is (TokenType.EOF))
            {
                if (depth == 0 && consumed)
                    break;
                throw error;
            }
            if (consumed && depth == 0 && this.isToplevelStart ())
                break;
            if (token.is (TokenType.OPEN_BRACE) || token.is (TokenType.DOUBLE_ANGLE_OPEN))
                depth++;
            else if (token.is (TokenType.CLOSE_BRACE) || token.is (TokenType.DOUBLE_ANGLE_CLOSE))
                depth = Math.max (0, depth - 1);
            this.cursor.next ();
            consumed = true;
        }
        this.cursor.warn (ParseWarning.Type.RECOVERED_ERROR, error.getErrorOffset (), error.getMessage ());
        return new RawBlock (this.cursor.getSource (start, this.cursor.getPosition ()));
    }


    private boolean isToplevelStart ()
    {
        final Token token = this.cursor.peek ();
        if (token.is (TokenType.WORD))
            return this.cursor.peek (1).is (TokenType.EQUALS);
        if (!token.is (TokenType.COMMAND))
            return false;
        switch (token.getText ())
        {
            case "version":
            case "header":
            case "paper":
            case "layout":
            case "midi":
            case "score":
            case "book":
            case "bookpart":
            case "markup":
            case "markuplist":
                return true;
            default:
                return false;
        }
    }


    private ToplevelExpression parseToplevelExpression () throws ParseError
    {
        final Token token = this.cursor.peek ();
        if (token.is (TokenType.SCHEME))
        {
            this.cursor.next ();
            return new ToplevelScheme (token.getText ());
        }

        if ((token.is (TokenType.WORD) || token.is (TokenType.STRING)) && this.cursor.peek (1).is (TokenType.EQUALS))
            return this.parseAssignment ();

        if (token.is (TokenType.COMMAND))
        {
            final OutputDefType outputDefType = OutputDefType.fromCommand (token.getText ());
            if (outputDefType != null)
            {
                this.cursor.next ();
                return new OutputDefBlock (outputDefType, this.parseOutputDefItems ());
            }

            switch (token.getText ())
            {
                case "header":
                    this.cursor.next ();
                    return new HeaderBlock (this.parseHeaderFields ());
                case "score":
                    this.cursor.next ();
                    return new Block (BlockType.SCORE, this.parseBlockItems ());
                case "book":
                    this.cursor.next ();
                    return new Block (BlockType.BOOK, this.parseBlockItems ());
                case "bookpart":
                    this.cursor.next ();
                    return new Block (BlockType.BOOKPART, this.parseBlockItems ());
                case "markup":
                    this.cursor.next ();
                    return new ToplevelMarkup (this.musicParser.getMarkupParser ().parseMarkup (), false);
                case "markuplist":
                    this.cursor.next ();
                    return new ToplevelMarkup (this.musicParser.getMarkupParser ().parseMarkup (), true);
                default:
                    break;
            }
        }

        return new ToplevelMusic (this.musicParser.parseMusic ());
    }


    private List<ToplevelExpression> parseBlockItems () throws ParseError
    {
        this.cursor.expect (TokenType.OPEN_BRACE, "{");
        final List<ToplevelExpression> items = new ArrayList<> ();
        while (!this.cursor.accept (TokenType.CLOSE_BRACE))
        {
            if (this.cursor.isAtEnd ())
                throw this.cursor.error ("}");
            items.add (this.parseToplevelExpression ());
        }
        return items;
    }


    private List<Assignment> parseHeaderFields () throws ParseError
    {
        this.cursor.expect (TokenType.OPEN_BRACE, "{");
        final List<Assignment> fields = new ArrayList<> ();
        while (!this.cursor.accept (TokenType.CLOSE_BRACE))
            fields.add (this.parseAssignment ());
        return fields;
    }


    private List<ToplevelExpression> parseOutputDefItems () throws ParseError
    {
        this.cursor.expect (TokenType.OPEN_BRACE, "{");
        final List<ToplevelExpression> items = new ArrayList<> ();
        while (!this.cursor.accept (TokenType.CLOSE_BRACE))
        {
            final Token token = this.cursor.peek ();
            if (token.is (TokenType.SCHEME))
            {
                this.cursor.next ();
                items.add (new ToplevelScheme (token.getText ()));
            }
            else if (token.is (TokenType.COMMAND))
                items.add (new RawBlock (this.captureCommandBlock ()));
            else
                items.add (this.parseAssignment ());
        }
        return items;
    }


    /**
     * Capture a command and a following braced block, e.g. '\context { \Staff ... }'.
     *
     * @return The normalized source
     * @throws ParseError The block is not terminated
     */
    private String captureCommandBlock () throws ParseError
    {
        final int start = this.cursor.getPosition ();
        this.cursor.next ();
        if (this.cursor.check (TokenType.OPEN_BRACE))
        {
            int depth = 0;
            do
            {
                final Token token = this.cursor.next ();
                if (token.is (TokenType.EOF))
                    throw this.cursor.error ("}");
                if (token.is (TokenType.OPEN_BRACE))
                    depth++;
                else if (token.is (TokenType.CLOSE_BRACE))
                    depth--;
            } while (depth > 0);
        }
        return this.cursor.getSource (start, this.cursor.getPosition ());
    }


    private Assignment parseAssignment () throws ParseError
    {
        final Token name = this.cursor.peek ();
        if (!name.is (TokenType.WORD) && !name.is (TokenType.STRING))
            throw this.cursor.error ("an assignment");
        this.cursor.next ();
        this.cursor.expect (TokenType.EQUALS, "=");
        return new Assignment (name.getText (), this.parseValue ());
    }


    private AssignmentValue parseValue () throws ParseError
    {
        final Token token = this.cursor.peek ();
        if (token.is (TokenType.STRING))
        {
            this.cursor.next ();
            return AssignmentValue.ofString (token.getText ());
        }
        if (token.is (TokenType.SCHEME))
        {
            this.cursor.next ();
            return AssignmentValue.ofScheme (token.getText ());
        }
        if (token.isCommand ("markup"))
        {
            this.cursor.next ();
            return AssignmentValue.ofMarkup (this.musicParser.getMarkupParser ().parseMarkup ());
        }
        if (this.numericParser.isExpressionAhead ())
            return AssignmentValue.ofExpression (this.numericParser.parseExpression ());

        final Music music = this.musicParser.parseMusic ();
        if (music instanceof IdentifierMusic)
            return AssignmentValue.ofIdentifier (((IdentifierMusic) music).getName ());
        return AssignmentValue.ofMusic (music);
    }
}
