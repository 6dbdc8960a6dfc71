// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;


/**
 * The interface to a score destination.
 *
 * @author Jürgen Moßgraber
 */
public interface IDestinationFormat extends ICoreTask
{
    /**
     * Write the destination file.
     *
     * @param score The score to store
     * @param outputPath The path in which to store the output file
     * @return The written file
     * @throws IOException Could not write the file
     * @throws ParseException Stored source text could not be parsed while converting
     */
    File write (ScoreContainer score, File outputPath) throws IOException, ParseException;


    /**
     * Check if the file already exists and therefore needs an overwrite confirmation.
     *
     * @param score The score to store
     * @param outputPath The path in which to store the output file
     * @return True if the file exists
     */
    default boolean needsOverwrite (final ScoreContainer score, final File outputPath)
    {
        return this.getOutputFile (score, outputPath).exists ();
    }


    /**
     * Get the file to which the score is written.
     *
     * @param score The score to store
     * @param outputPath The path in which to store the output file
     * @return The file
     */
    default File getOutputFile (final ScoreContainer score, final File outputPath)
    {
        return new File (outputPath, score.getName () + "." + this.getFileEnding ());
    }
}
