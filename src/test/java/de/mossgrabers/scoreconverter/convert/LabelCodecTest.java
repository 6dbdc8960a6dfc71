// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import java.util.List;


/**
 * Tests for the encoding of labels.
 *
 * @author Jürgen Moßgraber
 */
class LabelCodecTest
{
    @Test
    void encodeEscapesSeparators ()
    {
        final String label = LabelCodec.encode (List.of (LabelSegment.of ("staff", "sep"), LabelSegment.of ("with", "a,b|c%")));
        assertEquals ("lilypond:staff,sep|lilypond:with,a%2Cb%7Cc%25", label);
        assertNull (LabelCodec.encode (List.of ()));
    }


    @Test
    void decodeIgnoresForeignSegments ()
    {
        final List<LabelSegment> segments = LabelCodec.decode ("other:foo,1|lilypond:relative,c'|lilypond:voice");
        assertEquals (List.of (LabelSegment.of ("relative", "c'"), LabelSegment.of ("voice")), segments);
        assertTrue (LabelCodec.decode (null).isEmpty ());
        assertTrue (LabelCodec.decode ("").isEmpty ());
    }


    @Test
    void decodeRevertsEncode ()
    {
        final List<LabelSegment> segments = List.of (LabelSegment.of ("tuplet", "3", "2", "line\nbreak"), LabelSegment.of ("seq"));
        assertEquals (segments, LabelCodec.decode (LabelCodec.encode (segments)));
    }


    @Test
    void unescapeKeepsInvalidSequences ()
    {
        assertEquals ("100%", LabelCodec.unescape ("100%"));
        assertEquals ("%zz,", LabelCodec.unescape ("%zz%2C"));
    }


    @Test
    void findAndOptions ()
    {
        final List<LabelSegment> segments = LabelCodec.decode ("lilypond:repeat,volta,2|lilypond:staff,sep,n=3");
        final LabelSegment staff = LabelCodec.find (segments, "staff").orElseThrow ();
        assertTrue (staff.hasFlag ("sep"));
        assertEquals ("3", staff.getOption ("n"));
        assertNull (staff.getOption ("x"));
        assertEquals ("volta", LabelCodec.find (segments, "repeat").orElseThrow ().getField (0));
        assertNull (LabelCodec.find (segments, "repeat").orElseThrow ().getField (5));
        assertFalse (LabelCodec.find (segments, "grace").isPresent ());
    }
}
