// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;

import java.util.Collections;
import java.util.List;


/**
 * The result of parsing a file: the syntax tree and the warnings raised on the way.
 *
 * @author Jürgen Moßgraber
 */
public class ParseResult
{
    private final LilyPondFile       file;
    private final List<ParseWarning> warnings;


    /**
     * Constructor.
     *
     * @param file The parsed file
     * @param warnings The warnings
     */
    public ParseResult (final LilyPondFile file, final List<ParseWarning> warnings)
    {
        this.file = file;
        this.warnings = Collections.unmodifiableList (warnings);
    }


    public LilyPondFile getFile ()
    {
        return this.file;
    }


    public List<ParseWarning> getWarnings ()
    {
        return this.warnings;
    }
}
