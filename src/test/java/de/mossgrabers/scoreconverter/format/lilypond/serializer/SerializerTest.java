// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.serializer;

import static org.junit.jupiter.api.Assertions.assertEquals;

import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;


/**
 * Tests for the serializer.
 *
 * @author Jürgen Moßgraber
 */
class SerializerTest
{
    @Test
    void lineLayout () throws ParseError
    {
        assertEquals ("{ c'4. d8-. e\\f }", serializeMusic ("{ c'4. d8-. e\\f }"));
        assertEquals ("<<\n  { c4 }\n  \\\\\n  { e4 }\n>>", serializeMusic ("<<{c4}\\\\{e4}>>"));
    }


    @Test
    void chordModeEvent () throws ParseError
    {
        final Music music = Parser.parseMusic ("c:dim7/f", InputMode.CHORDS);
        assertEquals ("c:dim7/f", new Serializer ().serialize (music));
    }


    @Test
    void tempo () throws ParseError
    {
        assertEquals ("\\tempo \"Vivace\" 4. = 132-144", serializeMusic ("\\tempo \"Vivace\" 4.=132-144"));
    }


    @Test
    void fileWithBlocks () throws ParseError
    {
        final LilyPondFile file = Parser.parse ("\\version \"2.24.0\" \\score { { c4 } }").getFile ();
        assertEquals ("\\version \"2.24.0\"\n\n\\score {\n  { c4 }\n}\n", new Serializer ().serialize (file));
        assertEquals ("\\version \"2.24.0\"\n\n\\score {\n    { c4 }\n}\n", new Serializer (4).serialize (file));
    }


    @Test
    void quoting ()
    {
        assertEquals ("\"a \\\"b\\\" \\\\ c\\n\"", Serializer.quote ("a \"b\" \\ c\n"));
    }


    @ParameterizedTest
    @ValueSource(strings =
    {
        "\\relative c' { c4 d e f | g1 \\bar \"|.\" }",
        "\\new Staff \\with { \\consists \"Ambitus_engraver\" } { \\clef bass \\key g \\major \\time 3/4 c4 }",
        "{ \\repeat volta 2 { c4 d e f } \\alternative { { g2 } { a2 } } }",
        "<< { c4 } \\\\ { e4 } >>",
        "{ \\tuplet 3/2 { c8 d e } \\grace { f16 } g4 \\afterGrace 3/4 a2 { b16 } }",
        "\\chords { c1:m7 g:7 f/+c }",
        "\\new Lyrics \\lyricsto \"melody\" { Hal -- lo __ Welt }",
        "\\drums { bd4 sn <bd hh> }",
        "\\score { \\new Staff { c4 } \\layout { } \\midi { } }",
        "\\header { title = \"Test\" }",
        "\\paper { indent = 2\\cm }",
        "{ \\once \\override Staff.TimeSignature.stencil = ##f c4\\rest r4 R1*3 s2 <c e g>4 q4 }",
        "{ c4( d) e\\( f\\) g[ a] b\\< c\\! d^\\markup \\italic \"dolce\" e_3 f\\2 g:32 }",
        "melody = { c4 d } \\score { \\melody }",
        "\\figures { <6 4\\+>4 <7\\! [5/\\\\]>2 <_ 3+>4 }"
    })
    void roundTrip (final String source) throws ParseError
    {
        final LilyPondFile file = Parser.parse (source).getFile ();
        final String text = new Serializer ().serialize (file);
        assertEquals (file, Parser.parse (text).getFile (), text);
    }


    private static String serializeMusic (final String source) throws ParseError
    {
        return new Serializer ().serialize (Parser.parseMusic (source, InputMode.NOTES));
    }
}
