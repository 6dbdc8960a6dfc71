// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei;

import de.mossgrabers.scoreconverter.core.AbstractCoreTask;
import de.mossgrabers.scoreconverter.core.ConverterConfig;
import de.mossgrabers.scoreconverter.core.INotifier;
import de.mossgrabers.scoreconverter.core.ISourceFormat;
import de.mossgrabers.scoreconverter.core.ScoreContainer;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;


/**
 * Reads a MEI document from an XML file. The extension store of such a score is empty, the export
 * relies on the labels of the elements only.
 *
 * @author Jürgen Moßgraber
 */
public class MeiSourceFormat extends AbstractCoreTask implements ISourceFormat
{
    /**
     * Constructor.
     *
     * @param notifier The notifier
     * @param config The configuration
     */
    public MeiSourceFormat (final INotifier notifier, final ConverterConfig config)
    {
        super ("MEI", "mei", notifier, config);
    }


    /** {@inheritDoc} */
    @Override
    public ScoreContainer read (final File sourceFile) throws IOException
    {
        final Mei mei;
        try (final InputStream in = new FileInputStream (sourceFile))
        {
            mei = MeiXml.fromXML (in);
        }

        final String fileName = sourceFile.getName ();
        final int pos = fileName.lastIndexOf ('.');
        return new ScoreContainer (pos > 0 ? fileName.substring (0, pos) : fileName, mei, new ExtensionStore (), null);
    }
}
