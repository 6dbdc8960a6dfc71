// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import java.io.File;


/**
 * Base interface for source and destination formats.
 *
 * @author Jürgen Moßgraber
 */
public interface ICoreTask
{
    /**
     * Get the name of the format.
     *
     * @return The name
     */
    String getName ();


    /**
     * Get the file ending (without the dot) of files in this format.
     *
     * @return The ending, e.g. "ly"
     */
    String getFileEnding ();


    /**
     * Check if the file has the ending of this format.
     *
     * @param file The file to test
     * @return True if it matches
     */
    default boolean accepts (final File file)
    {
        return file.getName ().toLowerCase ().endsWith ("." + this.getFileEnding ());
    }
}
