// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import java.util.List;


/**
 * Base class for source and destination formats.
 *
 * @author Jürgen Moßgraber
 */
public abstract class AbstractCoreTask implements ICoreTask
{
    protected final String          name;
    protected final String          fileEnding;
    protected final INotifier       notifier;
    protected final ConverterConfig config;


    /**
     * Constructor.
     *
     * @param name The name of the format
     * @param fileEnding The file ending without the dot
     * @param notifier Where to report to
     * @param config The configuration
     */
    protected AbstractCoreTask (final String name, final String fileEnding, final INotifier notifier, final ConverterConfig config)
    {
        this.name = name;
        this.fileEnding = fileEnding;
        this.notifier = notifier;
        this.config = config;
    }


    /** {@inheritDoc} */
    @Override
    public String getName ()
    {
        return this.name;
    }


    /** {@inheritDoc} */
    @Override
    public String getFileEnding ()
    {
        return this.fileEnding;
    }


    /**
     * Report all conversion notes.
     *
     * @param notes The notes
     */
    protected void logNotes (final List<ConversionNote> notes)
    {
        for (final ConversionNote note: notes)
            this.notifier.log ("IDS_NOTIFY_CONVERSION_NOTE", note.getElementId (), note.getMessage ());
    }
}
