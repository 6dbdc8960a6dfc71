// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond;

import de.mossgrabers.scoreconverter.convert.imports.ImportResult;
import de.mossgrabers.scoreconverter.convert.imports.Importer;
import de.mossgrabers.scoreconverter.core.AbstractCoreTask;
import de.mossgrabers.scoreconverter.core.ConverterConfig;
import de.mossgrabers.scoreconverter.core.INotifier;
import de.mossgrabers.scoreconverter.core.ISourceFormat;
import de.mossgrabers.scoreconverter.core.ScoreContainer;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseResult;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseWarning;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;
import de.mossgrabers.scoreconverter.format.lilypond.validator.ValidationError;
import de.mossgrabers.scoreconverter.format.lilypond.validator.Validator;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.ParseException;


/**
 * Reads a LilyPond source file and imports it into a MEI document.
 *
 * @author Jürgen Moßgraber
 */
public class LilyPondSourceFormat extends AbstractCoreTask implements ISourceFormat
{
    /**
     * Constructor.
     *
     * @param notifier The notifier
     * @param config The configuration
     */
    public LilyPondSourceFormat (final INotifier notifier, final ConverterConfig config)
    {
        super ("LilyPond", "ly", notifier, config);
    }


    /** {@inheritDoc} */
    @Override
    public ScoreContainer read (final File sourceFile) throws IOException, ParseException
    {
        final String source = Files.readString (sourceFile.toPath (), StandardCharsets.UTF_8);
        final ParseResult result = Parser.parse (source);
        for (final ParseWarning warning: result.getWarnings ())
            this.notifier.log ("IDS_NOTIFY_PARSE_WARNING", warning.getType ().name (), Integer.toString (warning.getOffset ()), warning.getMessage ());

        for (final ValidationError error: Validator.validate (result.getFile ()))
            this.notifier.logError ("IDS_NOTIFY_STRUCTURE_ERROR", error.getMessage ());

        this.notifier.log ("IDS_NOTIFY_CONVERTING");
        final ImportResult imported = new Importer (this.config.getMeiVersion ()).importFile (result.getFile ());
        this.logNotes (imported.getNotes ());

        final String fileName = sourceFile.getName ();
        final int pos = fileName.lastIndexOf ('.');
        final ScoreContainer score = new ScoreContainer (pos > 0 ? fileName.substring (0, pos) : fileName, imported.getMei (), imported.getStore (), result.getFile ());
        score.addNotes (imported.getNotes ());
        return score;
    }
}
