// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;


/**
 * Tests for the lexer.
 *
 * @author Jürgen Moßgraber
 */
class LexerTest
{
    @Test
    void noteWithOctaveAndDuration () throws ParseError
    {
        final List<Token> tokens = new Lexer ("c'4.").tokenize ();
        assertEquals (List.of (TokenType.WORD, TokenType.APOSTROPHE, TokenType.NUMBER, TokenType.DOT, TokenType.EOF), types (tokens));
        assertTrue (tokens.get (0).hasSpaceBefore ());
        assertFalse (tokens.get (1).hasSpaceBefore ());
        assertFalse (tokens.get (2).hasSpaceBefore ());
        assertEquals (2, tokens.get (2).getOffset ());
    }


    @Test
    void commandsAndEscapedSymbols () throws ParseError
    {
        final List<Token> tokens = new Lexer ("\\relative c\\< \\! \\\\ \\3 \\+").tokenize ();
        assertEquals (List.of (TokenType.COMMAND, TokenType.WORD, TokenType.ESCAPED_ANGLE_OPEN, TokenType.ESCAPED_EXCLAMATION, TokenType.DOUBLE_BACKSLASH, TokenType.STRING_NUMBER, TokenType.ESCAPED_PLUS, TokenType.EOF), types (tokens));
        assertEquals ("relative", tokens.get (0).getText ());
        assertTrue (tokens.get (0).isCommand ("relative"));
        assertEquals ("3", tokens.get (5).getText ());
    }


    @Test
    void stringEscapes () throws ParseError
    {
        final List<Token> tokens = new Lexer ("\"a \\\"b\\\" \\n\"").tokenize ();
        assertEquals (TokenType.STRING, tokens.get (0).getType ());
        assertEquals ("a \"b\" \n", tokens.get (0).getText ());
    }


    @Test
    void numbersAndReals () throws ParseError
    {
        final List<Token> tokens = new Lexer ("132 1.5 4.").tokenize ();
        assertEquals (List.of (TokenType.NUMBER, TokenType.REAL, TokenType.NUMBER, TokenType.DOT, TokenType.EOF), types (tokens));
    }


    @Test
    void schemeExpressions () throws ParseError
    {
        final List<Token> tokens = new Lexer ("#(set-global-staff-size 20) #'((a . \")\")) ##t $x").tokenize ();
        assertEquals (List.of (TokenType.SCHEME, TokenType.SCHEME, TokenType.SCHEME, TokenType.SCHEME, TokenType.EOF), types (tokens));
        assertEquals ("#(set-global-staff-size 20)", tokens.get (0).getText ());
        assertEquals ("#'((a . \")\"))", tokens.get (1).getText ());
        assertEquals ("##t", tokens.get (2).getText ());
        assertEquals ("$x", tokens.get (3).getText ());
    }


    @Test
    void commentsAreSkipped () throws ParseError
    {
        final List<Token> tokens = new Lexer ("c % line comment\n%{ block\ncomment %}d").tokenize ();
        assertEquals (List.of (TokenType.WORD, TokenType.WORD, TokenType.EOF), types (tokens));
        assertEquals ("d", tokens.get (1).getText ());
        assertTrue (tokens.get (1).hasSpaceBefore ());
    }


    @Test
    void doubleSymbols () throws ParseError
    {
        final List<Token> tokens = new Lexer ("<< >> -- __ <c>").tokenize ();
        assertEquals (List.of (TokenType.DOUBLE_ANGLE_OPEN, TokenType.DOUBLE_ANGLE_CLOSE, TokenType.DOUBLE_DASH, TokenType.DOUBLE_UNDERSCORE, TokenType.ANGLE_OPEN, TokenType.WORD, TokenType.ANGLE_CLOSE, TokenType.EOF), types (tokens));
    }


    @Test
    void hyphenatedWords () throws ParseError
    {
        final List<Token> tokens = new Lexer ("\\override Staff.break-visibility").tokenize ();
        assertEquals ("break-visibility", tokens.get (3).getText ());
    }


    @Test
    void unterminatedConstructs ()
    {
        final ParseError string = assertThrows (ParseError.class, () -> new Lexer ("c \"open").tokenize ());
        assertEquals (2, string.getErrorOffset ());
        assertThrows (ParseError.class, () -> new Lexer ("%{ never closed").tokenize ());
        assertThrows (ParseError.class, () -> new Lexer ("#(a (b)").tokenize ());
    }


    private static List<TokenType> types (final List<Token> tokens)
    {
        final List<TokenType> result = new ArrayList<> ();
        for (final Token token: tokens)
            result.add (token.getType ());
        return result;
    }
}
