// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import java.io.IOException;


/**
 * Tests for the message texts.
 *
 * @author Jürgen Moßgraber
 */
class MessagesTest
{
    @Test
    void replacesPlaceholders ()
    {
        assertEquals ("Warning MIXED at offset 12: octave marks", Messages.getMessage ("IDS_NOTIFY_PARSE_WARNING", "MIXED", "12", "octave marks"));
        assertEquals ("Note for : text", Messages.getMessage ("IDS_NOTIFY_CONVERSION_NOTE", null, "text"));
    }


    @Test
    void unknownIdIsReturned ()
    {
        assertEquals ("IDS_DOES_NOT_EXIST", Messages.getMessage ("IDS_DOES_NOT_EXIST"));
    }


    @Test
    void throwableMessage ()
    {
        assertEquals ("Could not read the file: gone", Messages.getMessage ("IDS_NOTIFY_COULD_NOT_READ", new IOException ("gone")));
        assertEquals ("Could not read the file: java.io.IOException", Messages.getMessage ("IDS_NOTIFY_COULD_NOT_READ", new IOException ()));
    }
}
