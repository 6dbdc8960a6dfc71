// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;


/**
 * The interface to a score source.
 *
 * @author Jürgen Moßgraber
 */
public interface ISourceFormat extends ICoreTask
{
    /**
     * Read and convert the source file into a document tree.
     *
     * @param sourceFile The source file to load
     * @return The read, parsed and converted score
     * @throws IOException Could not read the file
     * @throws ParseException Could not parse the file
     */
    ScoreContainer read (File sourceFile) throws IOException, ParseException;
}
