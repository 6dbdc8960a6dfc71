// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import de.mossgrabers.scoreconverter.utils.Messages;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * A notifier which writes all messages to a java.util.logging logger.
 *
 * @author Jürgen Moßgraber
 */
public class LoggingNotifier implements INotifier
{
    private final Logger        logger;
    private final AtomicBoolean cancelled = new AtomicBoolean (false);


    /**
     * Constructor. Uses the logger of the package.
     */
    public LoggingNotifier ()
    {
        this (Logger.getLogger ("de.mossgrabers.scoreconverter"));
    }


    /**
     * Constructor.
     *
     * @param logger The logger to write to
     */
    public LoggingNotifier (final Logger logger)
    {
        this.logger = logger;
    }


    /** {@inheritDoc} */
    @Override
    public void log (final String messageID, final String... replaceStrings)
    {
        this.logger.info (Messages.getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final String... replaceStrings)
    {
        this.logger.severe (Messages.getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final Throwable throwable)
    {
        this.logger.log (Level.SEVERE, Messages.getMessage (messageID, throwable), throwable);
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final Throwable throwable)
    {
        String message = throwable.getMessage ();
        if (message == null)
            message = throwable.getClass ().getName ();
        this.logger.log (Level.SEVERE, message, throwable);
    }


    /**
     * Request the cancellation of a running conversion.
     */
    public void cancel ()
    {
        this.cancelled.set (true);
    }


    /** {@inheritDoc} */
    @Override
    public boolean isCancelled ()
    {
        return this.cancelled.get ();
    }
}
