// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter;

import de.mossgrabers.scoreconverter.core.ConversionTask;
import de.mossgrabers.scoreconverter.core.ConverterConfig;
import de.mossgrabers.scoreconverter.core.IDestinationFormat;
import de.mossgrabers.scoreconverter.core.ISourceFormat;
import de.mossgrabers.scoreconverter.core.LoggingNotifier;
import de.mossgrabers.scoreconverter.format.lilypond.LilyPondDestinationFormat;
import de.mossgrabers.scoreconverter.format.lilypond.LilyPondSourceFormat;
import de.mossgrabers.scoreconverter.format.mei.MeiDestinationFormat;
import de.mossgrabers.scoreconverter.format.mei.MeiSourceFormat;

import java.io.File;
import java.io.IOException;


/**
 * The main class for converting a score file from the command line. A LilyPond file is converted
 * to a MEI file and vice versa. The result is stored in the same directory as the source file.
 *
 * @author Jürgen Moßgraber
 */
public final class ConvertScore
{
    /**
     * Private constructor since this class only has a main function.
     */
    private ConvertScore ()
    {
        // Intentionally empty
    }


    /**
     * The main function.
     *
     * @param args One parameter, the score file to convert
     */
    public static void main (final String [] args)
    {
        final LoggingNotifier notifier = new LoggingNotifier ();
        if (args.length == 0)
        {
            notifier.logError ("IDS_NOTIFY_USAGE");
            System.exit (1);
            return;
        }

        final ConverterConfig config;
        try
        {
            config = new ConverterConfig ();
        }
        catch (final IOException ex)
        {
            notifier.logError ("IDS_NOTIFY_COULD_NOT_LOAD_CONFIG", ex);
            System.exit (1);
            return;
        }

        final File inputFile = new File (args[0]).getAbsoluteFile ();
        final LilyPondSourceFormat lilyPondSource = new LilyPondSourceFormat (notifier, config);
        final ISourceFormat sourceFormat;
        final IDestinationFormat destinationFormat;
        if (lilyPondSource.accepts (inputFile))
        {
            sourceFormat = lilyPondSource;
            destinationFormat = new MeiDestinationFormat (notifier, config);
        }
        else
        {
            sourceFormat = new MeiSourceFormat (notifier, config);
            if (!sourceFormat.accepts (inputFile))
            {
                notifier.logError ("IDS_NOTIFY_UNKNOWN_FORMAT", inputFile.getName ());
                System.exit (1);
                return;
            }
            destinationFormat = new LilyPondDestinationFormat (notifier, config);
        }

        final ConversionTask task = new ConversionTask (inputFile, inputFile.getParentFile (), sourceFormat, destinationFormat, notifier);
        if (!task.call ().booleanValue ())
            System.exit (1);
    }
}
