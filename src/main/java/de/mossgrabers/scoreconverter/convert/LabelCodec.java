// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;


/**
 * Encodes and decodes the round trip information which is stored in the label attribute of an
 * element. A label consists of segments separated by '|', each of the form
 * 'lilypond:kind,field,field,...'. The characters '%', '|', ',', carriage return and line feed
 * are percent-escaped in the fields. Segments of other namespaces are ignored when decoding.
 *
 * @author Jürgen Moßgraber
 */
public class LabelCodec
{
    /** The namespace of all segments. */
    public static final String  NAMESPACE        = "lilypond";
    /** Marks an entry of an event list which refers to a control event by its ID. */
    public static final String  REFERENCE_PREFIX = "@";

    private static final String PREFIX           = NAMESPACE + ":";


    /**
     * Private constructor since this is a utility class.
     */
    private LabelCodec ()
    {
        // Intentionally empty
    }


    /**
     * Encode segments.
     *
     * @param segments The segments
     * @return The label or null if there are no segments
     */
    public static String encode (final List<LabelSegment> segments)
    {
        if (segments.isEmpty ())
            return null;
        final StringBuilder sb = new StringBuilder ();
        for (final LabelSegment segment: segments)
        {
            if (sb.length () > 0)
                sb.append ('|');
            sb.append (PREFIX).append (segment.getKind ());
            for (final String field: segment.getFields ())
                sb.append (',').append (escape (field));
        }
        return sb.toString ();
    }


    /**
     * Decode a label.
     *
     * @param label The label, may be null
     * @return The segments of the LilyPond namespace
     */
    public static List<LabelSegment> decode (final String label)
    {
        final List<LabelSegment> segments = new ArrayList<> ();
        if (label == null || label.isEmpty ())
            return segments;

        for (final String part: label.split ("\\|", -1))
        {
            if (!part.startsWith (PREFIX))
                continue;
            final String [] tokens = part.substring (PREFIX.length ()).split (",", -1);
            final List<String> fields = new ArrayList<> ();
            for (int i = 1; i < tokens.length; i++)
                fields.add (unescape (tokens[i]));
            segments.add (new LabelSegment (tokens[0], fields));
        }
        return segments;
    }


    /**
     * Find the first segment of a kind.
     *
     * @param segments The segments to search
     * @param kind The kind
     * @return The segment if present
     */
    public static Optional<LabelSegment> find (final List<LabelSegment> segments, final String kind)
    {
        for (final LabelSegment segment: segments)
        {
            if (segment.getKind ().equals (kind))
                return Optional.of (segment);
        }
        return Optional.empty ();
    }


    /**
     * Escape a field.
     *
     * @param text The text
     * @return The escaped text
     */
    public static String escape (final String text)
    {
        final StringBuilder sb = new StringBuilder (text.length ());
        for (int i = 0; i < text.length (); i++)
        {
            final char c = text.charAt (i);
            switch (c)
            {
                case '%':
                    sb.append ("%25");
                    break;
                case '|':
                    sb.append ("%7C");
                    break;
                case ',':
                    sb.append ("%2C");
                    break;
                case '\n':
                    sb.append ("%0A");
                    break;
                case '\r':
                    sb.append ("%0D");
                    break;
                default:
                    sb.append (c);
                    break;
            }
        }
        return sb.toString ();
    }


    /**
     * Reverts the escaping of a field. Invalid escape sequences are kept as they are.
     *
     * @param text The escaped text
     * @return The original text
     */
    public static String unescape (final String text)
    {
        final StringBuilder sb = new StringBuilder (text.length ());
        int i = 0;
        while (i < text.length ())
        {
            final char c = text.charAt (i);
            if (c == '%' && i + 2 < text.length ())
            {
                final int high = Character.digit (text.charAt (i + 1), 16);
                final int low = Character.digit (text.charAt (i + 2), 16);
                if (high >= 0 && low >= 0)
                {
                    sb.append ((char) (high * 16 + low));
                    i += 3;
                    continue;
                }
            }
            sb.append (c);
            i++;
        }
        return sb.toString ();
    }
}
