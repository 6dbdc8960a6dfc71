// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.convert.imports.Importer;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;
import de.mossgrabers.scoreconverter.format.mei.model.Layer;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;
import de.mossgrabers.scoreconverter.format.mei.model.MeiMusic;
import de.mossgrabers.scoreconverter.format.mei.model.Note;
import de.mossgrabers.scoreconverter.format.mei.model.Slur;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;


/**
 * Tests for the structural checks of MEI documents.
 *
 * @author Jürgen Moßgraber
 */
class MeiValidatorTest
{
    @Test
    void importedDocumentIsValid () throws ParseError
    {
        final Mei mei = importSource ("\\score { << \\new Staff { c'4( d') } \\new Staff { \\tuplet 3/2 { e8 f g } r4\\f } >> }");
        assertTrue (MeiValidator.check (mei).isEmpty ());
    }


    @Test
    void documentWithoutDivision ()
    {
        final Mei mei = new Mei ();
        mei.music = new MeiMusic ();
        final List<String> problems = MeiValidator.check (mei);
        assertEquals (List.of ("The document contains no musical division."), problems);
        assertThrows (IOException.class, () -> MeiValidator.validate (mei));
    }


    @Test
    void duplicateIdsAndDanglingReferences () throws ParseError
    {
        final Mei mei = importSource ("{ c'4 d' }");
        final Layer layer = mei.music.body.mdivs.get (0).score.sections.get (0).measures.get (0).staves.get (0).layers.get (0);
        layer.children.get (1).id = layer.children.get (0).id;
        final Slur slur = new Slur ();
        slur.startid = "#" + layer.children.get (0).id;
        slur.endid = "#missing";
        mei.music.body.mdivs.get (0).score.sections.get (0).measures.get (0).controlEvents.add (slur);

        final List<String> problems = MeiValidator.check (mei);
        assertEquals (2, problems.size ());
        assertTrue (problems.get (0).startsWith ("Duplicate ID: "));
        assertTrue (problems.get (1).endsWith ("refers to an unknown element: missing"));
    }


    @Test
    void invalidDuration () throws ParseError
    {
        final Mei mei = importSource ("{ c'4 }");
        final Note note = (Note) mei.music.body.mdivs.get (0).score.sections.get (0).measures.get (0).staves.get (0).layers.get (0).children.get (0);
        note.dur = "3";
        assertEquals (1, MeiValidator.check (mei).size ());
    }


    @Test
    void durations ()
    {
        assertTrue (MeiValidator.isValidDuration ("1"));
        assertTrue (MeiValidator.isValidDuration ("128"));
        assertTrue (MeiValidator.isValidDuration ("breve"));
        assertFalse (MeiValidator.isValidDuration ("0"));
        assertFalse (MeiValidator.isValidDuration ("6"));
        assertFalse (MeiValidator.isValidDuration ("quarter"));
    }


    private static Mei importSource (final String source) throws ParseError
    {
        return new Importer ().importFile (Parser.parse (source).getFile ()).getMei ();
    }
}
