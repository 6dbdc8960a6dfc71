// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import de.mossgrabers.scoreconverter.format.mei.MeiValidator;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;
import java.util.concurrent.Callable;


/**
 * The task to run the actual conversion process.
 *
 * @author Jürgen Moßgraber
 */
public class ConversionTask implements Callable<Boolean>
{
    private final File               sourceFile;
    private final ISourceFormat      sourceFormat;
    private final IDestinationFormat destinationFormat;
    private final INotifier          notifier;
    private final File               outputPath;


    /**
     * Constructor.
     *
     * @param sourceFile The source file to convert
     * @param outputPath The output path in which to write the destination file
     * @param sourceFormat The format of the source file
     * @param destinationFormat The destination format
     * @param notifier Where to log to
     */
    public ConversionTask (final File sourceFile, final File outputPath, final ISourceFormat sourceFormat, final IDestinationFormat destinationFormat, final INotifier notifier)
    {
        this.sourceFile = sourceFile;
        this.outputPath = outputPath;
        this.sourceFormat = sourceFormat;
        this.destinationFormat = destinationFormat;
        this.notifier = notifier;
    }


    /**
     * Run the conversion.
     *
     * @return True if the destination file was written
     */
    @Override
    public Boolean call ()
    {
        boolean success = false;
        try
        {
            // Parse the score file
            this.notifier.log ("IDS_NOTIFY_PARSING_FILE", this.sourceFile.getAbsolutePath ());

            final ScoreContainer score;
            try
            {
                score = this.sourceFormat.read (this.sourceFile);
            }
            catch (final IOException | ParseException ex)
            {
                this.notifier.logError ("IDS_NOTIFY_COULD_NOT_READ", ex);
                return Boolean.FALSE;
            }

            if (this.notifier.isCancelled ())
                return this.finish (false);

            try
            {
                this.notifier.log ("IDS_NOTIFY_VALIDATING_FILE");
                MeiValidator.validate (score.getMei ());
            }
            catch (final IOException ex)
            {
                this.notifier.logError ("IDS_NOTIFY_COULD_NOT_VALIDATE_SCORE", ex);
            }

            if (this.notifier.isCancelled ())
                return this.finish (false);

            // Write output file
            this.notifier.log ("IDS_NOTIFY_WRITING_FILE", this.destinationFormat.getOutputFile (score, this.outputPath).getAbsolutePath ());

            try
            {
                this.destinationFormat.write (score, this.outputPath);
                success = true;
            }
            catch (final IOException | ParseException ex)
            {
                this.notifier.logError ("IDS_NOTIFY_COULD_NOT_WRITE_FILE", ex);
                return Boolean.FALSE;
            }
        }
        catch (final RuntimeException ex)
        {
            this.notifier.logError (ex);
        }

        return this.finish (success);
    }


    private Boolean finish (final boolean success)
    {
        this.notifier.log (this.notifier.isCancelled () ? "IDS_NOTIFY_CANCELED" : "IDS_NOTIFY_CONVERSION_FINISHED");
        return Boolean.valueOf (success);
    }
}
