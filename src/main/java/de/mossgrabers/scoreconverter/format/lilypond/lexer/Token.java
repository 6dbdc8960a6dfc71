// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.lexer;

/**
 * A token of a LilyPond source file.
 *
 * @author Jürgen Moßgraber
 */
public class Token
{
    private final TokenType type;
    private final String    text;
    private final int       offset;
    private final int       end;
    private final boolean   spaceBefore;


    /**
     * Constructor.
     *
     * @param type The type of the token
     * @param text The text of the token
     * @param offset The offset of the first character in the source
     * @param end The offset after the last character in the source
     * @param spaceBefore True if white space or a comment precedes the token
     */
    public Token (final TokenType type, final String text, final int offset, final int end, final boolean spaceBefore)
    {
        this.type = type;
        this.text = text;
        this.offset = offset;
        this.end = end;
        this.spaceBefore = spaceBefore;
    }


    public TokenType getType ()
    {
        return this.type;
    }


    public String getText ()
    {
        return this.text;
    }


    public int getOffset ()
    {
        return this.offset;
    }


    public int getEnd ()
    {
        return this.end;
    }


    /**
     * Check if the token is separated from the previous one.
     *
     * @return True if white space or a comment precedes the token
     */
    public boolean hasSpaceBefore ()
    {
        return this.spaceBefore;
    }


    /**
     * Check the type of the token.
     *
     * @param tokenType The type to compare
     * @return True if the token has the given type
     */
    public boolean is (final TokenType tokenType)
    {
        return this.type == tokenType;
    }


    /**
     * Check if the token is a command with the given name.
     *
     * @param name The name of the command without the backslash
     * @return True if it matches
     */
    public boolean isCommand (final String name)
    {
        return this.type == TokenType.COMMAND && this.text.equals (name);
    }


    /**
     * Check if the token is a word with the given text.
     *
     * @param word The word
     * @return True if it matches
     */
    public boolean isWord (final String word)
    {
        return this.type == TokenType.WORD && this.text.equals (word);
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.type + "(" + this.text + ")@" + this.offset;
    }
}
