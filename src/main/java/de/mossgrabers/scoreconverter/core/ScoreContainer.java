// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;


/**
 * A container for all components of one conversion: the document tree, its extension store, the
 * LilyPond file if the source was one and the accumulated conversion notes.
 *
 * @author Jürgen Moßgraber
 */
public class ScoreContainer
{
    private final String               name;
    private final Mei                  mei;
    private final ExtensionStore       store;
    private final LilyPondFile         lilyPondFile;
    private final List<ConversionNote> notes = new ArrayList<> ();


    /**
     * Constructor.
     *
     * @param name The name of the score, the source file name without ending
     * @param mei The document tree
     * @param store The extension store which belongs to the document
     * @param lilyPondFile The parsed source file, null if the source was not a LilyPond file
     */
    public ScoreContainer (final String name, final Mei mei, final ExtensionStore store, final LilyPondFile lilyPondFile)
    {
        this.name = name;
        this.mei = mei;
        this.store = store;
        this.lilyPondFile = lilyPondFile;
    }


    /**
     * Get the name of the score.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Get the document tree.
     *
     * @return The document
     */
    public Mei getMei ()
    {
        return this.mei;
    }


    /**
     * Get the extension store. It is empty if the document was not created by an import.
     *
     * @return The store
     */
    public ExtensionStore getStore ()
    {
        return this.store;
    }


    /**
     * Get the parsed LilyPond file.
     *
     * @return The file if the source was a LilyPond file
     */
    public Optional<LilyPondFile> getLilyPondFile ()
    {
        return Optional.ofNullable (this.lilyPondFile);
    }


    /**
     * Add conversion notes.
     *
     * @param newNotes The notes to add
     */
    public void addNotes (final List<ConversionNote> newNotes)
    {
        this.notes.addAll (newNotes);
    }


    /**
     * Get all conversion notes.
     *
     * @return The notes
     */
    public List<ConversionNote> getNotes ()
    {
        return Collections.unmodifiableList (this.notes);
    }
}
