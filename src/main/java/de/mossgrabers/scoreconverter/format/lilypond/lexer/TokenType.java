// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.lexer;

/**
 * The kinds of tokens in a LilyPond source file.
 *
 * @author Jürgen Moßgraber
 */
public enum TokenType
{
    /** A plain word, e.g. a note name, a context name or a lyric syllable. */
    WORD,
    /** An escaped word, e.g. \relative. The text does not contain the backslash. */
    COMMAND,
    /** A string number, e.g. \1. The text contains only the digits. */
    STRING_NUMBER,
    /** A quoted string. The text is the unescaped content. */
    STRING,
    /** An unsigned integer. */
    NUMBER,
    /** A real number. */
    REAL,
    /** An embedded Scheme expression, the text includes the leading # or $. */
    SCHEME,

    OPEN_BRACE,
    CLOSE_BRACE,
    DOUBLE_ANGLE_OPEN,
    DOUBLE_ANGLE_CLOSE,
    ANGLE_OPEN,
    ANGLE_CLOSE,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    ESCAPED_OPEN_PAREN,
    ESCAPED_CLOSE_PAREN,
    ESCAPED_ANGLE_OPEN,
    ESCAPED_ANGLE_CLOSE,
    ESCAPED_EXCLAMATION,
    ESCAPED_PLUS,
    DOUBLE_BACKSLASH,
    TILDE,
    PIPE,
    APOSTROPHE,
    COMMA,
    DOT,
    EQUALS,
    COLON,
    SLASH,
    STAR,
    PLUS,
    MINUS,
    HAT,
    UNDERSCORE,
    QUESTION,
    EXCLAMATION,
    DOUBLE_DASH,
    DOUBLE_UNDERSCORE,

    /** End of input. */
    EOF
}
