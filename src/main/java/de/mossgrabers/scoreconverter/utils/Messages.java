// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.utils;

import java.util.MissingResourceException;
import java.util.ResourceBundle;


/**
 * Access to the texts of the message resource bundle.
 *
 * @author Jürgen Moßgraber
 */
public class Messages
{
    private static final String         BUNDLE_NAME = "de.mossgrabers.scoreconverter.messages";
    private static final ResourceBundle BUNDLE      = ResourceBundle.getBundle (BUNDLE_NAME);


    /**
     * Private constructor since this is a utility class.
     */
    private Messages ()
    {
        // Intentionally empty
    }


    /**
     * Get a message from the resource bundle and replace the place holders %1..%n.
     *
     * @param messageID The ID of the message
     * @param replaceStrings The texts which replace the place holders
     * @return The message, the ID itself if no message is found
     */
    public static String getMessage (final String messageID, final String... replaceStrings)
    {
        String message;
        try
        {
            message = BUNDLE.getString (messageID);
        }
        catch (final MissingResourceException ex)
        {
            message = messageID;
        }

        // Replace from the highest index so that %1 does not match %10
        for (int i = replaceStrings.length; i > 0; i--)
            message = message.replace ("%" + i, replaceStrings[i - 1] == null ? "" : replaceStrings[i - 1]);
        return message;
    }


    /**
     * Get a message from the resource bundle and append the message of the throwable.
     *
     * @param messageID The ID of the message
     * @param throwable The throwable
     * @return The message
     */
    public static String getMessage (final String messageID, final Throwable throwable)
    {
        String text = throwable.getMessage ();
        if (text == null)
            text = throwable.getClass ().getName ();
        return getMessage (messageID, text);
    }
}
