// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.convert.exports.Exporter;
import de.mossgrabers.scoreconverter.convert.imports.Importer;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;
import de.mossgrabers.scoreconverter.format.mei.model.Note;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;


/**
 * Tests for reading and writing MEI XML.
 *
 * @author Jürgen Moßgraber
 */
class MeiXmlTest
{
    @Test
    void writesNamespaceAndIds () throws IOException, ParseError
    {
        final Mei mei = new Importer ().importFile (Parser.parse ("{ c'4 }").getFile ()).getMei ();
        final String xml = MeiXml.toXML (mei, true);
        assertTrue (xml.contains ("xmlns=\"http://www.music-encoding.org/ns/mei\""));
        assertTrue (xml.contains ("meiversion=\"" + Importer.MEI_VERSION + "\""));
        assertTrue (xml.contains ("xml:id=\"" + Importer.MUSIC_ID + "\""));
        assertTrue (xml.contains ("pname=\"c\""));
    }


    @Test
    void labelsSurviveTheXml () throws IOException, ParseError
    {
        final LilyPondFile file = Parser.parse ("\\score { \\new Staff \\relative c' { c4( d8 e) <c e g>2 } }").getFile ();
        final Mei mei = new Importer ().importFile (file).getMei ();

        final Mei read = MeiXml.fromXML (toStream (MeiXml.toXML (mei, false)));
        assertEquals (mei.music.body.mdivs.size (), read.music.body.mdivs.size ());

        final LilyPondFile exported = new Exporter ().exportDocument (read, new ExtensionStore ());
        assertEquals (file.getItems ().get (0), exported.getItems ().get (0));
    }


    @Test
    void readsForeignDocument () throws IOException
    {
        final String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" +
                "<mei xmlns=\"http://www.music-encoding.org/ns/mei\" meiversion=\"5.0\">" +
                "<music><body><mdiv xml:id=\"m1\"><score>" +
                "<scoreDef><staffGrp><staffDef n=\"1\" lines=\"5\" clef.shape=\"G\" clef.line=\"2\"/></staffGrp></scoreDef>" +
                "<section><measure n=\"1\"><staff n=\"1\"><layer n=\"1\">" +
                "<note xml:id=\"n1\" pname=\"g\" oct=\"4\" dur=\"4\" accid=\"s\"/>" +
                "</layer></staff></measure></section>" +
                "</score></mdiv></body></music></mei>";
        final Mei mei = MeiXml.fromXML (toStream (xml));
        assertEquals ("5.0", mei.meiversion);
        final Note note = (Note) mei.music.body.mdivs.get (0).score.sections.get (0).measures.get (0).staves.get (0).layers.get (0).children.get (0);
        assertEquals ("n1", note.id);
        assertEquals ("g", note.pname);
        assertEquals (Integer.valueOf (4), note.oct);
        assertEquals ("s", note.accid);
        assertTrue (MeiValidator.check (mei).isEmpty ());
    }


    @Test
    void rejectsBrokenXml ()
    {
        assertThrows (IOException.class, () -> MeiXml.fromXML (toStream ("<mei><music>")));
    }


    private static InputStream toStream (final String text)
    {
        return new ByteArrayInputStream (text.getBytes (StandardCharsets.UTF_8));
    }
}
