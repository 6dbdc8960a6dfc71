// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.imports;

import de.mossgrabers.scoreconverter.core.ConversionNote;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;

import java.util.Collections;
import java.util.List;


/**
 * The result of an import: the MEI document, the extension store which belongs to it and the
 * notes about everything which could only be approximated.
 *
 * @author Jürgen Moßgraber
 */
public class ImportResult
{
    private final Mei                  mei;
    private final ExtensionStore       store;
    private final List<ConversionNote> notes;


    /**
     * Constructor.
     *
     * @param mei The document
     * @param store The extension store
     * @param notes The conversion notes
     */
    public ImportResult (final Mei mei, final ExtensionStore store, final List<ConversionNote> notes)
    {
        this.mei = mei;
        this.store = store;
        this.notes = Collections.unmodifiableList (notes);
    }


    public Mei getMei ()
    {
        return this.mei;
    }


    public ExtensionStore getStore ()
    {
        return this.store;
    }


    public List<ConversionNote> getNotes ()
    {
        return this.notes;
    }
}
