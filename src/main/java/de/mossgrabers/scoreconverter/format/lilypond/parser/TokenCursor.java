// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import de.mossgrabers.scoreconverter.format.lilypond.lexer.Token;
import de.mossgrabers.scoreconverter.format.lilypond.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;


/**
 * Position in a list of tokens. Also collects the warnings of a parse run.
 *
 * @author Jürgen Moßgraber
 */
public class TokenCursor
{
    private final String             source;
    private final List<Token>        tokens;
    private final List<ParseWarning> warnings = new ArrayList<> ();
    private int                      position;


    /**
     * Constructor.
     *
     * @param source The source text the tokens were created from
     * @param tokens The tokens, the last one must be of type EOF
     */
    public TokenCursor (final String source, final List<Token> tokens)
    {
        this.source = source;
        this.tokens = tokens;
    }


    /**
     * Get the current token without consuming it.
     *
     * @return The token
     */
    public Token peek ()
    {
        return this.peek (0);
    }


    /**
     * Look ahead.
     *
     * @param offset The number of tokens to look ahead, 0 is the current token
     * @return The token or the EOF token if the offset is beyond the end
     */
    public Token peek (final int offset)
    {
        final int index = Math.min (this.position + offset, this.tokens.size () - 1);
        return this.tokens.get (index);
    }


    /**
     * Consume the current token.
     *
     * @return The consumed token
     */
    public Token next ()
    {
        final Token token = this.peek ();
        if (!token.is (TokenType.EOF))
            this.position++;
        return token;
    }


    /**
     * Check the type of the current token.
     *
     * @param type The expected type
     * @return True if it matches
     */
    public boolean check (final TokenType type)
    {
        return this.peek ().is (type);
    }


    /**
     * Check if the current token has the given type and is not separated by white space from the
     * previous one.
     *
     * @param type The expected type
     * @return True if it matches
     */
    public boolean checkAdjacent (final TokenType type)
    {
        final Token token = this.peek ();
        return token.is (type) && !token.hasSpaceBefore ();
    }


    /**
     * Consume the current token if it has the given type.
     *
     * @param type The expected type
     * @return True if consumed
     */
    public boolean accept (final TokenType type)
    {
        if (!this.check (type))
            return false;
        this.next ();
        return true;
    }


    /**
     * Consume the current token, which must have the given type.
     *
     * @param type The expected type
     * @param expected Description of the expected construct for the error message
     * @return The consumed token
     * @throws ParseError The token has a different type
     */
    public Token expect (final TokenType type, final String expected) throws ParseError
    {
        if (!this.check (type))
            throw this.error (expected);
        return this.next ();
    }


    /**
     * Create an error at the current token.
     *
     * @param expected Description of the expected construct
     * @return The error
     */
    public ParseError error (final String expected)
    {
        final Token token = this.peek ();
        final String found = token.is (TokenType.EOF) ? "end of input" : "'" + this.getSource (token) + "'";
        return new ParseError ("Unexpected " + found, token.getOffset (), expected);
    }


    public boolean isAtEnd ()
    {
        return this.check (TokenType.EOF);
    }


    public int getPosition ()
    {
        return this.position;
    }


    /**
     * Move back to a previous position.
     *
     * @param newPosition The index of the token
     */
    public void reset (final int newPosition)
    {
        this.position = newPosition;
    }


    /**
     * Get the source text of a token as it was written.
     *
     * @param token The token
     * @return The text
     */
    public String getSource (final Token token)
    {
        return this.source.substring (token.getOffset (), token.getEnd ());
    }


    /**
     * Get the source text of a range of tokens. Runs of white space and comments are replaced by a
     * single blank.
     *
     * @param from The index of the first token
     * @param to The index after the last token
     * @return The text
     */
    public String getSource (final int from, final int to)
    {
        final StringBuilder sb = new StringBuilder ();
        for (int i = from; i < to; i++)
        {
            final Token token = this.tokens.get (i);
            if (i > from && token.hasSpaceBefore ())
                sb.append (' ');
            sb.append (this.getSource (token));
        }
        return sb.toString ();
    }


    /**
     * Add a warning.
     *
     * @param type The type of the warning
     * @param offset The offset in the source
     * @param message The description
     */
    public void warn (final ParseWarning.Type type, final int offset, final String message)
    {
        this.warnings.add (new ParseWarning (type, offset, message));
    }


    public List<ParseWarning> getWarnings ()
    {
        return this.warnings;
    }
}
