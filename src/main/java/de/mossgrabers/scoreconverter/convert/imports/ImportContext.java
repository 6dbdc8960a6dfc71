// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.imports;

import de.mossgrabers.scoreconverter.core.ConversionNote;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelExpression;
import de.mossgrabers.scoreconverter.format.lilypond.serializer.Serializer;

import java.util.ArrayList;
import java.util.List;


/**
 * The state of one import: the extension store which is filled, the ID counter and the collected
 * conversion notes.
 *
 * @author Jürgen Moßgraber
 */
class ImportContext
{
    private final ExtensionStore       store      = new ExtensionStore ();
    private final List<ConversionNote> notes      = new ArrayList<> ();
    private final Serializer           serializer = new Serializer ();
    private int                        idCounter  = 0;


    /**
     * Create a new unique ID.
     *
     * @param type The type of the element, e.g. 'note'
     * @return The ID
     */
    String createId (final String type)
    {
        this.idCounter++;
        return "ly-" + type + "-" + this.idCounter;
    }


    /**
     * Add a conversion note.
     *
     * @param elementId The ID of the affected element, may be null
     * @param message The description
     */
    void addNote (final String elementId, final String message)
    {
        this.notes.add (new ConversionNote (elementId, message));
    }


    /**
     * Serialize music to LilyPond text.
     *
     * @param music The music
     * @return The text
     */
    String serialize (final Music music)
    {
        return this.serializer.serialize (music);
    }


    /**
     * Serialize a top-level item to LilyPond text.
     *
     * @param expression The item
     * @return The text
     */
    String serialize (final ToplevelExpression expression)
    {
        return this.serializer.serialize (expression);
    }


    Serializer getSerializer ()
    {
        return this.serializer;
    }


    ExtensionStore getStore ()
    {
        return this.store;
    }


    List<ConversionNote> getNotes ()
    {
        return this.notes;
    }
}
