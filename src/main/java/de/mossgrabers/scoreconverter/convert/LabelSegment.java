// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;


/**
 * One tag of a label: a kind and a list of positional fields.
 *
 * @author Jürgen Moßgraber
 */
public class LabelSegment
{
    private final String       kind;
    private final List<String> fields;


    /**
     * Constructor.
     *
     * @param kind The kind
     * @param fields The fields
     */
    public LabelSegment (final String kind, final List<String> fields)
    {
        this.kind = kind;
        this.fields = Collections.unmodifiableList (new ArrayList<> (fields));
    }


    /**
     * Create a segment.
     *
     * @param kind The kind
     * @param fields The fields
     * @return The segment
     */
    public static LabelSegment of (final String kind, final String... fields)
    {
        return new LabelSegment (kind, Arrays.asList (fields));
    }


    public String getKind ()
    {
        return this.kind;
    }


    public List<String> getFields ()
    {
        return this.fields;
    }


    /**
     * Get a field.
     *
     * @param index The index of the field
     * @return The field or null if the segment has less fields
     */
    public String getField (final int index)
    {
        return index < this.fields.size () ? this.fields.get (index) : null;
    }


    /**
     * Check if one of the fields equals the given flag.
     *
     * @param flag The flag
     * @return True if present
     */
    public boolean hasFlag (final String flag)
    {
        return this.fields.contains (flag);
    }


    /**
     * Get the value of an option field of the form 'key=value'.
     *
     * @param key The key
     * @return The value or null if not present
     */
    public String getOption (final String key)
    {
        final String prefix = key + "=";
        for (final String field: this.fields)
        {
            if (field.startsWith (prefix))
                return field.substring (prefix.length ());
        }
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public boolean equals (final Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof final LabelSegment other))
            return false;
        return this.kind.equals (other.kind) && this.fields.equals (other.fields);
    }


    /** {@inheritDoc} */
    @Override
    public int hashCode ()
    {
        return Objects.hash (this.kind, this.fields);
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.kind + this.fields;
    }
}
