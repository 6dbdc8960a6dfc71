// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.exports;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.convert.imports.ImportResult;
import de.mossgrabers.scoreconverter.convert.imports.Importer;
import de.mossgrabers.scoreconverter.core.ConversionNote;
import de.mossgrabers.scoreconverter.extension.BookStructure;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.format.lilypond.model.Block;
import de.mossgrabers.scoreconverter.format.lilypond.model.BlockType;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelExpression;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;
import de.mossgrabers.scoreconverter.format.mei.model.Layer;
import de.mossgrabers.scoreconverter.format.mei.model.Mdiv;
import de.mossgrabers.scoreconverter.format.mei.model.Measure;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;
import de.mossgrabers.scoreconverter.format.mei.model.MeiMusic;
import de.mossgrabers.scoreconverter.format.mei.model.Note;
import de.mossgrabers.scoreconverter.format.mei.model.Score;
import de.mossgrabers.scoreconverter.format.mei.model.Section;
import de.mossgrabers.scoreconverter.format.mei.model.Slur;
import de.mossgrabers.scoreconverter.format.mei.model.Staff;
import de.mossgrabers.scoreconverter.format.mei.model.StaffDef;

import org.junit.jupiter.api.Test;

import java.util.List;


/**
 * Tests for the conversion of MEI documents to LilyPond.
 *
 * @author Jürgen Moßgraber
 */
class ExporterTest
{
    @Test
    void voltaRepeatWithAlternatives () throws ParseError
    {
        assertRoundTrip ("\\repeat volta 2 { c4 d e f } \\alternative { { g2 } { a2 } }");
    }


    @Test
    void relativeMusic () throws ParseError
    {
        assertRoundTrip ("\\relative c' { c4 e g c, <c e g>2 e }");
    }


    @Test
    void postEventsAndTempo () throws ParseError
    {
        assertRoundTrip ("{ \\tempo \"Allegro\" 4 = 120 c'4( d'\\f e'2) }");
    }


    @Test
    void scoresWithOutputDefinitions () throws ParseError
    {
        assertRoundTrip ("\\version \"2.24.0\"\n\\header { title = \"Two\" }\n\\score { \\new Staff { c'1 } \\layout { } }\n\\score { << \\new Staff { e'1 } \\new Staff { \\clef bass c1 } >> }");
    }


    @Test
    void nestedRepeatsWithAlternatives () throws ParseError
    {
        assertRoundTrip ("{ \\repeat volta 2 { \\repeat volta 2 { c'4 d' } \\alternative { { e'2 } { f'2 } } g'1 } \\alternative { { a'1 } { b'1 } } }");
    }


    @Test
    void controlEventsInsideTheMusic () throws ParseError
    {
        assertRoundTrip ("{ c'4 \\clef bass \\key f \\major \\time 2/4 d4 \\autoBeamOff e8 f \\autoBeamOn g4 }");
    }


    @Test
    void transposeAndFixed () throws ParseError
    {
        assertRoundTrip ("\\transpose c d { c'4 e' g'2 }");
        assertRoundTrip ("\\fixed c' { c4 e g c' }");
    }


    @Test
    void graceNotesAndTuplets () throws ParseError
    {
        assertRoundTrip ("{ \\tuplet 3/2 { c'8 d' e' } \\grace { f'16 } g'4 \\afterGrace 3/4 a'2 { b'16 } }");
    }


    @Test
    void drumsChordsAndLyrics () throws ParseError
    {
        assertRoundTrip ("\\drums { bd4 sn <bd hh> }");
        assertRoundTrip ("<< \\chords { c1:m7 g1:7 } \\new Staff { c'1 g' } >>");
        assertRoundTrip ("<< \\new Staff \\new Voice = \"melody\" { c'4 d' e'2 } \\new Lyrics \\lyricsto \"melody\" { Hal -- lo Welt } >>");
    }


    @Test
    void figuredBassWithModifications () throws ParseError
    {
        assertRoundTrip ("<< \\new Staff { c'2 d' } \\figures { <6 4\\+>2 <7\\! 5/\\\\>2 } >>");
    }


    @Test
    void tremolo () throws ParseError
    {
        assertRoundTrip ("{ c'4:32 d'2: }");
    }


    @Test
    void voiceSeparatorWithoutStaff () throws ParseError
    {
        assertRoundTrip ("<< { c'4 d' } \\\\ { e4 f } >>");
    }


    @Test
    void recoveredSourceIsKeptAsText () throws ParseError
    {
        for (final String source: List.of ("{ c'4 d' = e' | f' }", "{ c'4 \\tempo 4 = 4. f' }"))
        {
            final LilyPondFile file = Parser.parse (source).getFile ();
            final ImportResult result = new Importer ().importFile (file);
            final Exporter exporter = new Exporter ();
            assertEquals (file, exporter.exportDocument (result.getMei (), result.getStore ()), source);
            assertFalse (exporter.getNotes ().isEmpty (), source);
        }
    }


    @Test
    void malformedEntryIsSkipped () throws ParseError
    {
        final LilyPondFile file = Parser.parse ("{ c'4 d' }").getFile ();
        final ImportResult result = new Importer ().importFile (file);
        final Layer layer = result.getMei ().music.body.mdivs.get (0).score.sections.get (0).measures.get (0).staves.get (0).layers.get (0);
        layer.label = layer.label + "|lilypond:inline,x.1.=r4";

        final Exporter exporter = new Exporter ();
        assertEquals (file, exporter.exportDocument (result.getMei (), result.getStore ()));
        boolean hasNote = false;
        for (final ConversionNote note: exporter.getNotes ())
            hasNote |= note.getMessage ().contains ("x.1.=r4");
        assertTrue (hasNote);
    }


    @Test
    void bookpartsAreRestored () throws ParseError
    {
        final LilyPondFile file = Parser.parse ("\\book {\n  \\bookpart { \\score { { c'4 } } }\n  \\bookpart { \\score { { d'4 } } }\n}").getFile ();
        final ImportResult result = new Importer ().importFile (file);

        final List<Mdiv> mdivs = result.getMei ().music.body.mdivs;
        assertEquals (2, mdivs.size ());
        for (int i = 0; i < mdivs.size (); i++)
        {
            final BookStructure structure = result.getStore ().bookStructure (mdivs.get (i).id).orElseThrow ();
            assertEquals (0, structure.getBookIndex ());
            assertEquals (Integer.valueOf (i), structure.getBookpartIndex ());
            assertEquals (0, structure.getScoreIndex ());
        }

        final LilyPondFile exported = new Exporter ().exportDocument (result.getMei (), result.getStore ());
        assertEquals (1, exported.getItems ().size ());
        final Block book = assertInstanceOf (Block.class, exported.getItems ().get (0));
        assertEquals (BlockType.BOOK, book.getType ());
        assertEquals (2, book.getItems ().size ());
        for (final ToplevelExpression item: book.getItems ())
            assertEquals (BlockType.BOOKPART, assertInstanceOf (Block.class, item).getType ());
        assertEquals (file, exported);
    }


    @Test
    void documentWithoutLabels () throws ParseError
    {
        final Mei mei = new Mei ();
        mei.music = new MeiMusic ();
        final Mdiv mdiv = new Mdiv ();
        mdiv.id = "m1";
        mdiv.score = new Score ();
        mei.music.body.mdivs.add (mdiv);

        final StaffDef staffDef = new StaffDef ();
        staffDef.id = "sd1";
        staffDef.n = Integer.valueOf (1);
        staffDef.lines = Integer.valueOf (5);
        staffDef.clefShape = "G";
        staffDef.clefLine = Integer.valueOf (2);
        mdiv.score.scoreDef.staffGrp.children.add (staffDef);

        final Layer layer = new Layer ();
        layer.n = Integer.valueOf (1);
        layer.children.add (createNote ("n1", "c", "4"));
        layer.children.add (createNote ("n2", "d", "2"));
        final Staff staff = new Staff ();
        staff.n = Integer.valueOf (1);
        staff.layers.add (layer);
        final Measure measure = new Measure ();
        measure.staves.add (staff);
        final Slur slur = new Slur ();
        slur.startid = "#n1";
        slur.endid = "#n2";
        measure.controlEvents.add (slur);
        final Section section = new Section ();
        section.measures.add (measure);
        mdiv.score.sections.add (section);

        final LilyPondFile exported = new Exporter ().exportDocument (mei, new ExtensionStore ());
        assertEquals (Exporter.DEFAULT_VERSION, exported.getVersion ());
        final Block score = assertInstanceOf (Block.class, exported.getItems ().get (0));
        assertEquals (BlockType.SCORE, score.getType ());
        final ToplevelMusic music = assertInstanceOf (ToplevelMusic.class, score.getItems ().get (0));
        assertEquals (Parser.parseMusic ("\\new Staff { \\clef treble c'4( d'2) }", InputMode.NOTES), music.getMusic ());
    }


    @Test
    void divisionWithoutScore () throws ParseError
    {
        final Mei mei = new Mei ();
        mei.music = new MeiMusic ();
        final Mdiv mdiv = new Mdiv ();
        mdiv.id = "empty";
        mei.music.body.mdivs.add (mdiv);

        final Exporter exporter = new Exporter ();
        final LilyPondFile exported = exporter.exportDocument (mei, new ExtensionStore ());
        assertEquals (0, exported.getItems ().size ());
        assertEquals (1, exporter.getNotes ().size ());
        assertEquals ("empty", exporter.getNotes ().get (0).getElementId ());
        assertTrue (new Exporter ().getNotes ().isEmpty ());
    }


    private static Note createNote (final String id, final String pname, final String dur)
    {
        final Note note = new Note ();
        note.id = id;
        note.pname = pname;
        note.oct = Integer.valueOf (4);
        note.dur = dur;
        return note;
    }


    private static void assertRoundTrip (final String source) throws ParseError
    {
        final LilyPondFile file = Parser.parse (source).getFile ();
        final ImportResult result = new Importer ().importFile (file);
        assertEquals (file, new Exporter ().exportDocument (result.getMei (), result.getStore ()));
    }
}
