// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import de.mossgrabers.scoreconverter.format.lilypond.lexer.Token;
import de.mossgrabers.scoreconverter.format.lilypond.lexer.TokenType;
import de.mossgrabers.scoreconverter.format.lilypond.model.Markup;


/**
 * Captures the source text of constructs which are not interpreted: markup expressions, property
 * paths and property values.
 *
 * @author Jürgen Moßgraber
 */
public class MarkupParser
{
    private final TokenCursor cursor;


    /**
     * Constructor.
     *
     * @param cursor The token cursor
     */
    public MarkupParser (final TokenCursor cursor)
    {
        this.cursor = cursor;
    }


    /**
     * Parse one markup expression. The \markup command must already be consumed.
     *
     * @return The markup, the text is the normalized source
     * @throws ParseError Malformed markup
     */
    public Markup parseMarkup () throws ParseError
    {
        final int start = this.cursor.getPosition ();
        this.parseMarkupUnit ();
        return Markup.ofExpression (this.cursor.getSource (start, this.cursor.getPosition ()));
    }


    private void parseMarkupUnit () throws ParseError
    {
        final Token token = this.cursor.peek ();
        switch (token.getType ())
        {
            case OPEN_BRACE:
                this.cursor.next ();
                while (!this.cursor.accept (TokenType.CLOSE_BRACE))
                {
                    final Token inner = this.cursor.peek ();
                    if (inner.is (TokenType.EOF))
                        throw this.cursor.error ("}");
                    if (inner.is (TokenType.OPEN_BRACE) || inner.is (TokenType.COMMAND))
                        this.parseMarkupUnit ();
                    else
                        this.cursor.next ();
                }
                return;

            case STRING:
            case WORD:
            case SCHEME:
            case NUMBER:
            case REAL:
                this.cursor.next ();
                return;

            case COMMAND:
                this.cursor.next ();
                while (this.cursor.check (TokenType.SCHEME) || this.cursor.check (TokenType.NUMBER))
                    this.cursor.next ();
                final String name = token.getText ();
                if (Vocabulary.MARKUP_WITHOUT_ARGUMENT.contains (name) || !this.isMarkupArgumentAhead ())
                    return;
                this.parseMarkupUnit ();
                if (Vocabulary.MARKUP_TWO_ARGUMENTS.contains (name) && this.isMarkupArgumentAhead ())
                    this.parseMarkupUnit ();
                return;

            default:
                throw this.cursor.error ("a markup");
        }
    }


    private boolean isMarkupArgumentAhead ()
    {
        final Token token = this.cursor.peek ();
        switch (token.getType ())
        {
            case OPEN_BRACE:
            case STRING:
            case WORD:
                return true;
            case COMMAND:
                // Music and structure commands end a markup
                return !isStructuralCommand (token.getText ());
            default:
                return false;
        }
    }


    private static boolean isStructuralCommand (final String name)
    {
        switch (name)
        {
            case "score":
            case "book":
            case "bookpart":
            case "header":
            case "paper":
            case "layout":
            case "midi":
            case "markup":
            case "markuplist":
            case "version":
            case "new":
            case "context":
            case "relative":
            case "fixed":
            case "tempo":
            case "mark":
            case "bar":
            case "clef":
            case "key":
            case "time":
                return true;
            default:
                return Vocabulary.DYNAMICS.contains (name) || Vocabulary.ARTICULATIONS.contains (name);
        }
    }


    /**
     * Parse a property path like 'Staff.TimeSignature.color'. The old syntax with a quoted Scheme
     * symbol ('Stem #'direction') is accepted as well.
     *
     * @return The source of the path
     * @throws ParseError Missing path
     */
    public String parsePath () throws ParseError
    {
        final int start = this.cursor.getPosition ();
        this.cursor.expect (TokenType.WORD, "a property path");
        while (this.cursor.checkAdjacent (TokenType.DOT) && this.cursor.peek (1).is (TokenType.WORD) && !this.cursor.peek (1).hasSpaceBefore ())
        {
            this.cursor.next ();
            this.cursor.next ();
        }
        while (this.cursor.check (TokenType.SCHEME) && this.cursor.peek ().getText ().startsWith ("#'"))
            this.cursor.next ();
        return this.cursor.getSource (start, this.cursor.getPosition ());
    }


    /**
     * Parse the value of a property assignment.
     *
     * @return The source of the value
     * @throws ParseError Missing value
     */
    public String parseValue () throws ParseError
    {
        final int start = this.cursor.getPosition ();
        final Token token = this.cursor.peek ();
        switch (token.getType ())
        {
            case SCHEME:
            case STRING:
            case NUMBER:
            case REAL:
                this.cursor.next ();
                break;

            case WORD:
                this.parsePath ();
                break;

            case MINUS:
                this.cursor.next ();
                if (!this.cursor.check (TokenType.NUMBER) && !this.cursor.check (TokenType.REAL))
                    throw this.cursor.error ("a number");
                this.cursor.next ();
                break;

            case COMMAND:
                this.cursor.next ();
                if (token.isCommand ("markup"))
                    this.parseMarkupUnit ();
                break;

            default:
                throw this.cursor.error ("a value");
        }
        return this.cursor.getSource (start, this.cursor.getPosition ());
    }
}
