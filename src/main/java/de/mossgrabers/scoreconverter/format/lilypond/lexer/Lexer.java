// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.lexer;

import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;

import java.util.ArrayList;
import java.util.List;


/**
 * Splits LilyPond source text into tokens. The lexer does not know about input modes (notes,
 * lyrics, chords, ...), the parser interprets words depending on the mode it is in.
 *
 * @author Jürgen Moßgraber
 */
public class Lexer
{
    private final String source;
    private int          position;
    private boolean      spaceBefore;


    /**
     * Constructor.
     *
     * @param source The text to tokenize
     */
    public Lexer (final String source)
    {
        this.source = source;
    }


    /**
     * Tokenize the whole source. The last token is always of type EOF.
     *
     * @return The tokens
     * @throws ParseError Unterminated string, comment or Scheme expression
     */
    public List<Token> tokenize () throws ParseError
    {
        final List<Token> tokens = new ArrayList<> ();
        this.position = 0;
        this.spaceBefore = true;

        while (true)
        {
            this.skipWhitespaceAndComments ();
            if (this.position >= this.source.length ())
            {
                tokens.add (new Token (TokenType.EOF, "", this.position, this.position, true));
                return tokens;
            }
            tokens.add (this.readToken ());
            this.spaceBefore = false;
        }
    }


    private void skipWhitespaceAndComments () throws ParseError
    {
        while (this.position < this.source.length ())
        {
            final char c = this.source.charAt (this.position);
            if (Character.isWhitespace (c))
            {
                this.position++;
                this.spaceBefore = true;
            }
            else if (c == '%')
            {
                this.spaceBefore = true;
                if (this.peekChar (1) == '{')
                {
                    final int end = this.source.indexOf ("%}", this.position + 2);
                    if (end < 0)
                        throw new ParseError ("Unterminated block comment", this.position, "%}");
                    this.position = end + 2;
                }
                else
                {
                    while (this.position < this.source.length () && this.source.charAt (this.position) != '\n')
                        this.position++;
                }
            }
            else
                return;
        }
    }


    private Token readToken () throws ParseError
    {
        final int start = this.position;
        final char c = this.source.charAt (this.position);

        if (c == '"')
        {
            final String text = this.readString ();
            return this.create (TokenType.STRING, text, start);
        }

        if (c == '#' || c == '$')
        {
            this.position++;
            this.readSchemeDatum (start);
            return this.create (TokenType.SCHEME, this.source.substring (start, this.position), start);
        }

        if (c == '\\')
            return this.readEscaped (start);

        if (Character.isLetter (c))
        {
            this.readWordCharacters ();
            return this.create (TokenType.WORD, this.source.substring (start, this.position), start);
        }

        if (Character.isDigit (c))
        {
            while (Character.isDigit (this.peekChar (0)))
                this.position++;
            if (this.peekChar (0) == '.' && Character.isDigit (this.peekChar (1)))
            {
                this.position++;
                while (Character.isDigit (this.peekChar (0)))
                    this.position++;
                return this.create (TokenType.REAL, this.source.substring (start, this.position), start);
            }
            return this.create (TokenType.NUMBER, this.source.substring (start, this.position), start);
        }

        final char next = this.peekChar (1);
        if (c == '<' && next == '<')
            return this.createSymbol (TokenType.DOUBLE_ANGLE_OPEN, 2);
        if (c == '>' && next == '>')
            return this.createSymbol (TokenType.DOUBLE_ANGLE_CLOSE, 2);
        if (c == '-' && next == '-')
            return this.createSymbol (TokenType.DOUBLE_DASH, 2);
        if (c == '_' && next == '_')
            return this.createSymbol (TokenType.DOUBLE_UNDERSCORE, 2);

        final TokenType type = symbolType (c);
        if (type == null)
            throw new ParseError ("Unexpected character '" + c + "'", start, "a token");
        return this.createSymbol (type, 1);
    }


    private Token readEscaped (final int start) throws ParseError
    {
        final char next = this.peekChar (1);
        this.position += 2;
        switch (next)
        {
            case '\\':
                return this.create (TokenType.DOUBLE_BACKSLASH, "\\\\", start);
            case '(':
                return this.create (TokenType.ESCAPED_OPEN_PAREN, "\\(", start);
            case ')':
                return this.create (TokenType.ESCAPED_CLOSE_PAREN, "\\)", start);
            case '<':
                return this.create (TokenType.ESCAPED_ANGLE_OPEN, "\\<", start);
            case '>':
                return this.create (TokenType.ESCAPED_ANGLE_CLOSE, "\\>", start);
            case '!':
                return this.create (TokenType.ESCAPED_EXCLAMATION, "\\!", start);
            case '+':
                return this.create (TokenType.ESCAPED_PLUS, "\\+", start);
            default:
                break;
        }

        this.position = start + 1;
        if (Character.isDigit (next))
        {
            while (Character.isDigit (this.peekChar (0)))
                this.position++;
            return this.create (TokenType.STRING_NUMBER, this.source.substring (start + 1, this.position), start);
        }
        if (!Character.isLetter (next))
            throw new ParseError ("Unexpected character after backslash", start, "a command name");
        this.readWordCharacters ();
        return this.create (TokenType.COMMAND, this.source.substring (start + 1, this.position), start);
    }


    /**
     * Reads letters. A dash or underscore is part of the word if it is surrounded by letters, e.g.
     * 'break-visibility'.
     */
    private void readWordCharacters ()
    {
        while (this.position < this.source.length ())
        {
            final char c = this.source.charAt (this.position);
            if (Character.isLetter (c))
                this.position++;
            else if ((c == '-' || c == '_') && Character.isLetter (this.peekChar (1)) && this.position > 0 && Character.isLetter (this.source.charAt (this.position - 1)))
                this.position++;
            else
                return;
        }
    }


    private String readString () throws ParseError
    {
        final int start = this.position;
        this.position++;
        final StringBuilder sb = new StringBuilder ();
        while (this.position < this.source.length ())
        {
            final char c = this.source.charAt (this.position);
            if (c == '"')
            {
                this.position++;
                return sb.toString ();
            }
            if (c == '\\' && this.position + 1 < this.source.length ())
            {
                final char escaped = this.source.charAt (this.position + 1);
                if (escaped == 'n')
                    sb.append ('\n');
                else if (escaped == 't')
                    sb.append ('\t');
                else
                    sb.append (escaped);
                this.position += 2;
                continue;
            }
            sb.append (c);
            this.position++;
        }
        throw new ParseError ("Unterminated string", start, "\"");
    }


    private void readSchemeDatum (final int start) throws ParseError
    {
        if (this.position >= this.source.length ())
            throw new ParseError ("Missing Scheme expression", start, "a Scheme expression");

        final char c = this.source.charAt (this.position);
        switch (c)
        {
            case '(':
                this.readSchemeList (start);
                return;

            case '"':
                this.readString ();
                return;

            case '\'':
            case '`':
            case ',':
                this.position++;
                this.readSchemeDatum (start);
                return;

            case '{':
                final int end = this.source.indexOf ("#}", this.position);
                if (end < 0)
                    throw new ParseError ("Unterminated embedded music", start, "#}");
                this.position = end + 2;
                return;

            case '#':
                this.position++;
                if (this.peekChar (0) == '(')
                {
                    // A vector
                    this.readSchemeList (start);
                    return;
                }
                this.readSchemeAtom ();
                return;

            default:
                if (Character.isWhitespace (c))
                    throw new ParseError ("Missing Scheme expression", start, "a Scheme expression");
                this.readSchemeAtom ();
                return;
        }
    }


    private void readSchemeAtom ()
    {
        while (this.position < this.source.length ())
        {
            final char c = this.source.charAt (this.position);
            if (Character.isWhitespace (c) || c == '(' || c == ')' || c == '{' || c == '}' || c == '"')
                return;
            this.position++;
        }
    }


    private void readSchemeList (final int start) throws ParseError
    {
        int depth = 0;
        while (this.position < this.source.length ())
        {
            final char c = this.source.charAt (this.position);
            if (c == '"')
            {
                this.readString ();
                continue;
            }
            if (c == ';')
            {
                while (this.position < this.source.length () && this.source.charAt (this.position) != '\n')
                    this.position++;
                continue;
            }
            if (c == '#' && this.peekChar (1) == '\\')
            {
                // Character literal, e.g. #\( or #\space
                this.position += 3;
                continue;
            }
            this.position++;
            if (c == '(')
                depth++;
            else if (c == ')')
            {
                depth--;
                if (depth == 0)
                    return;
            }
        }
        throw new ParseError ("Unterminated Scheme expression", start, ")");
    }


    private static TokenType symbolType (final char c)
    {
        switch (c)
        {
            case '{':
                return TokenType.OPEN_BRACE;
            case '}':
                return TokenType.CLOSE_BRACE;
            case '<':
                return TokenType.ANGLE_OPEN;
            case '>':
                return TokenType.ANGLE_CLOSE;
            case '(':
                return TokenType.OPEN_PAREN;
            case ')':
                return TokenType.CLOSE_PAREN;
            case '[':
                return TokenType.OPEN_BRACKET;
            case ']':
                return TokenType.CLOSE_BRACKET;
            case '~':
                return TokenType.TILDE;
            case '|':
                return TokenType.PIPE;
            case '\'':
                return TokenType.APOSTROPHE;
            case ',':
                return TokenType.COMMA;
            case '.':
                return TokenType.DOT;
            case '=':
                return TokenType.EQUALS;
            case ':':
                return TokenType.COLON;
            case '/':
                return TokenType.SLASH;
            case '*':
                return TokenType.STAR;
            case '+':
                return TokenType.PLUS;
            case '-':
                return TokenType.MINUS;
            case '^':
                return TokenType.HAT;
            case '_':
                return TokenType.UNDERSCORE;
            case '?':
                return TokenType.QUESTION;
            case '!':
                return TokenType.EXCLAMATION;
            default:
                return null;
        }
    }


    private char peekChar (final int offset)
    {
        final int pos = this.position + offset;
        return pos < this.source.length () ? this.source.charAt (pos) : '\0';
    }


    private Token createSymbol (final TokenType type, final int length)
    {
        final int start = this.position;
        this.position += length;
        return this.create (type, this.source.substring (start, this.position), start);
    }


    private Token create (final TokenType type, final String text, final int start)
    {
        return new Token (type, text, start, this.position, this.spaceBefore);
    }
}
