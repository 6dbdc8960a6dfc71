// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond;

import de.mossgrabers.scoreconverter.convert.exports.Exporter;
import de.mossgrabers.scoreconverter.core.AbstractCoreTask;
import de.mossgrabers.scoreconverter.core.ConverterConfig;
import de.mossgrabers.scoreconverter.core.IDestinationFormat;
import de.mossgrabers.scoreconverter.core.INotifier;
import de.mossgrabers.scoreconverter.core.ScoreContainer;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.serializer.Serializer;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.ParseException;


/**
 * Exports the MEI document of a score and writes it as a LilyPond source file.
 *
 * @author Jürgen Moßgraber
 */
public class LilyPondDestinationFormat extends AbstractCoreTask implements IDestinationFormat
{
    /**
     * Constructor.
     *
     * @param notifier The notifier
     * @param config The configuration
     */
    public LilyPondDestinationFormat (final INotifier notifier, final ConverterConfig config)
    {
        super ("LilyPond", "ly", notifier, config);
    }


    /** {@inheritDoc} */
    @Override
    public File write (final ScoreContainer score, final File outputPath) throws IOException, ParseException
    {
        this.notifier.log ("IDS_NOTIFY_CONVERTING");
        final Exporter exporter = new Exporter (this.config.getLilyPondVersion ());
        final LilyPondFile file = exporter.exportDocument (score.getMei (), score.getStore ());
        this.logNotes (exporter.getNotes ());
        score.addNotes (exporter.getNotes ());

        final File outputFile = this.getOutputFile (score, outputPath);
        Files.writeString (outputFile.toPath (), new Serializer (this.config.getSerializerIndent ()).serialize (file), StandardCharsets.UTF_8);
        return outputFile;
    }
}
