// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.imports;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.core.ConversionNote;
import de.mossgrabers.scoreconverter.extension.BookStructure;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.extension.ToplevelItems;
import de.mossgrabers.scoreconverter.extension.VariableAssignment;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.NoteEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;
import de.mossgrabers.scoreconverter.format.mei.model.ControlEvent;
import de.mossgrabers.scoreconverter.format.mei.model.Layer;
import de.mossgrabers.scoreconverter.format.mei.model.Mdiv;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;
import de.mossgrabers.scoreconverter.format.mei.model.Note;
import de.mossgrabers.scoreconverter.format.mei.model.Slur;
import de.mossgrabers.scoreconverter.format.mei.model.StaffDef;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;


/**
 * Tests for the conversion of LilyPond files to MEI.
 *
 * @author Jürgen Moßgraber
 */
class ImporterTest
{
    @Test
    void singleStaffWithStaffAttributes () throws ParseError
    {
        final Mei mei = importSource ("\\relative c' { \\clef bass \\key g \\major \\time 3/4 c4( d e2) }").getMei ();

        final List<Mdiv> mdivs = mei.music.body.mdivs;
        assertEquals (1, mdivs.size ());
        assertEquals (Importer.MDIV_PREFIX + "0", mdivs.get (0).id);

        final StaffDef staffDef = assertInstanceOf (StaffDef.class, mdivs.get (0).score.scoreDef.staffGrp.children.get (0));
        assertEquals ("F", staffDef.clefShape);
        assertEquals (Integer.valueOf (4), staffDef.clefLine);
        assertEquals ("1s", staffDef.keySig);
        assertEquals ("3", staffDef.meterCount);
        assertEquals (Integer.valueOf (4), staffDef.meterUnit);

        final Layer layer = mdivs.get (0).score.sections.get (0).measures.get (0).staves.get (0).layers.get (0);
        final List<Note> notes = new ArrayList<> ();
        layer.children.forEach (child -> notes.add (assertInstanceOf (Note.class, child)));
        assertEquals (3, notes.size ());
        assertEquals ("c", notes.get (0).pname);
        assertEquals ("e", notes.get (2).pname);
        for (final Note note: notes)
            assertEquals (Integer.valueOf (4), note.oct);
        assertEquals ("4", notes.get (1).dur);
        assertEquals ("2", notes.get (2).dur);

        final List<ControlEvent> controlEvents = mdivs.get (0).score.sections.get (0).measures.get (0).controlEvents;
        final Slur slur = assertInstanceOf (Slur.class, controlEvents.get (0));
        assertEquals (notes.get (0).id, slur.getStartId ());
        assertEquals (notes.get (2).id, slur.getEndId ());
    }


    @Test
    void booksAreStoredAsStructure () throws ParseError
    {
        final ImportResult result = importSource ("\\book {\n  \\header { title = \"Suite\" }\n  \\score { { c'4 } }\n  \\score { { d'4 } }\n}");
        final List<Mdiv> mdivs = result.getMei ().music.body.mdivs;
        assertEquals (2, mdivs.size ());

        final BookStructure first = result.getStore ().bookStructure (mdivs.get (0).id).orElseThrow ();
        final BookStructure second = result.getStore ().bookStructure (mdivs.get (1).id).orElseThrow ();
        assertEquals (0, first.getBookIndex ());
        assertEquals (0, first.getScoreIndex ());
        assertEquals (1, second.getScoreIndex ());
        assertEquals (1, first.getBookItems ().size ());
        assertEquals (0, first.getBookItems ().get (0).getPosition ());
    }


    @Test
    void assignmentsAreKept () throws ParseError
    {
        final ImportResult result = importSource ("melody = { c'4 d'4 }\n\\score { \\new Staff \\melody }");
        final ExtensionStore store = result.getStore ();
        final List<VariableAssignment> assignments = store.variableAssignments (Importer.MUSIC_ID).orElseThrow ().getAssignments ();
        assertEquals (1, assignments.size ());
        assertEquals ("melody", assignments.get (0).getName ());
        assertEquals (0, assignments.get (0).getPosition ());

        final Layer layer = result.getMei ().music.body.mdivs.get (0).score.sections.get (0).measures.get (0).staves.get (0).layers.get (0);
        assertEquals (2, layer.children.size ());
    }


    @Test
    void fileWithoutMusic () throws ParseError
    {
        final ImportResult result = importSource ("\\version \"2.24.0\"\n\\header { title = \"Nothing\" }");
        assertTrue (result.getMei ().music.body.mdivs.isEmpty ());

        boolean hasNote = false;
        for (final ConversionNote note: result.getNotes ())
            hasNote |= Importer.MUSIC_ID.equals (note.getElementId ());
        assertTrue (hasNote);

        final ToplevelItems items = result.getStore ().toplevelItems (Importer.MUSIC_ID).orElseThrow ();
        assertEquals ("2.24.0", items.getVersion ());
        assertEquals (1, items.getItems ().size ());
        assertEquals ("Nothing", result.getMei ().meiHead.fileDesc.titleStmt.titles.get (0).text);
    }


    @Test
    void idsAreUnique () throws ParseError
    {
        final Mei mei = importSource ("\\score { << \\new Staff { c'4 d' } \\new Staff { e4 f } >> }").getMei ();
        final List<String> ids = new ArrayList<> ();
        mei.music.body.mdivs.get (0).score.sections.get (0).measures.get (0).staves.forEach (staff -> staff.layers.forEach (layer -> layer.children.forEach (child -> ids.add (child.id))));
        assertEquals (4, ids.size ());
        assertEquals (4, ids.stream ().distinct ().count ());
        for (final String id: ids)
            assertNotNull (id);
    }


    @Test
    void alterationWithoutAccidentalIsDropped () throws ParseError
    {
        final NoteEvent parsed = (NoteEvent) Parser.parseMusic ("c'4", InputMode.NOTES);
        final NoteEvent note = new NoteEvent (new Pitch ('c', 0.25, 1), false, parsed.getDuration (), List.of ());
        final LilyPondFile file = new LilyPondFile (null, List.of (new ToplevelMusic (new SequentialMusic (List.of (note)))));
        final ImportResult result = new Importer ().importFile (file);

        final Layer layer = result.getMei ().music.body.mdivs.get (0).score.sections.get (0).measures.get (0).staves.get (0).layers.get (0);
        final Note meiNote = assertInstanceOf (Note.class, layer.children.get (0));
        assertEquals ("c", meiNote.pname);
        assertEquals (Integer.valueOf (4), meiNote.oct);
        assertNull (meiNote.accid);

        boolean hasNote = false;
        for (final ConversionNote conversionNote: result.getNotes ())
            hasNote |= meiNote.id.equals (conversionNote.getElementId ()) && conversionNote.getMessage ().contains ("0.25");
        assertTrue (hasNote);
    }


    private static ImportResult importSource (final String source) throws ParseError
    {
        return new Importer ().importFile (Parser.parse (source).getFile ());
    }
}
