// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.exports;

import de.mossgrabers.scoreconverter.core.ConversionNote;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.PostEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.RawMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.MusicParser;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * The state of one export: the extension store which is read and the collected conversion notes.
 *
 * @author Jürgen Moßgraber
 */
class ExportContext
{
    private final ExtensionStore       store;
    private final List<ConversionNote> notes = new ArrayList<> ();


    /**
     * Constructor.
     *
     * @param store The extension store which belongs to the document, may be empty
     */
    ExportContext (final ExtensionStore store)
    {
        this.store = store;
    }


    ExtensionStore getStore ()
    {
        return this.store;
    }


    void addNote (final String elementId, final String message)
    {
        this.notes.add (new ConversionNote (elementId, message));
    }


    /**
     * Parse music which was kept as source text. Text which does not parse on its own, e.g. the
     * remains of a recovered parse error, is kept as raw music.
     *
     * @param elementId The ID of the element which carried the text, might be null
     * @param source The source text
     * @param mode The input mode
     * @return The music
     */
    Music parseMusic (final String elementId, final String source, final InputMode mode)
    {
        if (MusicParser.VOICE_SEPARATOR.equals (source))
            return new RawMusic (source);
        try
        {
            return Parser.parseMusic (source, mode);
        }
        catch (final ParseError ex)
        {
            this.addNote (elementId, "The source '" + source + "' is kept as text: " + ex.getMessage ());
            return new RawMusic (source);
        }
    }


    /**
     * Parse post events which were kept as source text.
     *
     * @param elementId The ID of the event
     * @param source The source text
     * @return The post events, empty if the text could not be parsed
     */
    List<PostEvent> parsePostEvents (final String elementId, final String source)
    {
        try
        {
            return Parser.parsePostEvents (source);
        }
        catch (final ParseError ex)
        {
            this.addNote (elementId, "The post events '" + source + "' are dropped: " + ex.getMessage ());
            return Collections.emptyList ();
        }
    }


    List<ConversionNote> getNotes ()
    {
        return this.notes;
    }
}
