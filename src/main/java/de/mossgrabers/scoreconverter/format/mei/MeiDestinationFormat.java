// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei;

import de.mossgrabers.scoreconverter.core.AbstractCoreTask;
import de.mossgrabers.scoreconverter.core.ConverterConfig;
import de.mossgrabers.scoreconverter.core.IDestinationFormat;
import de.mossgrabers.scoreconverter.core.INotifier;
import de.mossgrabers.scoreconverter.core.ScoreContainer;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;


/**
 * Writes the MEI document of a score as an XML file.
 *
 * @author Jürgen Moßgraber
 */
public class MeiDestinationFormat extends AbstractCoreTask implements IDestinationFormat
{
    /**
     * Constructor.
     *
     * @param notifier The notifier
     * @param config The configuration
     */
    public MeiDestinationFormat (final INotifier notifier, final ConverterConfig config)
    {
        super ("MEI", "mei", notifier, config);
    }


    /** {@inheritDoc} */
    @Override
    public File write (final ScoreContainer score, final File outputPath) throws IOException
    {
        final File outputFile = this.getOutputFile (score, outputPath);
        Files.writeString (outputFile.toPath (), MeiXml.toXML (score.getMei (), this.config.isXmlFormatted ()), StandardCharsets.UTF_8);
        if (!score.getStore ().isEmpty ())
            this.notifier.log ("IDS_NOTIFY_STORE_NOT_WRITTEN", Integer.toString (score.getStore ().size ()));
        return outputFile;
    }
}
