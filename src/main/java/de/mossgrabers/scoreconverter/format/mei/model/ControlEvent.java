// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlTransient;


/**
 * Base class of the events which are placed in a measure and refer to the events of a layer.
 *
 * @author Jürgen Moßgraber
 */
@XmlTransient
public abstract class ControlEvent extends MeiElement
{
    /** The number of the staff to which the event belongs. */
    @XmlAttribute
    public String staff;

    /** Reference to the first event, e.g. '#ly-note-1'. */
    @XmlAttribute
    public String startid;

    /** Reference to the last event. */
    @XmlAttribute
    public String endid;

    /** The onset as a time stamp, used if there is no start reference. */
    @XmlAttribute
    public Double tstamp;

    /** The placement relative to the staff: above or below. */
    @XmlAttribute
    public String place;


    /**
     * Create a reference to an element.
     *
     * @param id The ID of the element
     * @return The reference
     */
    public static String ref (final String id)
    {
        return id == null ? null : "#" + id;
    }


    /**
     * Get the ID from a reference.
     *
     * @param reference The reference, may be null
     * @return The ID or null
     */
    public static String unref (final String reference)
    {
        if (reference == null)
            return null;
        return reference.startsWith ("#") ? reference.substring (1) : reference;
    }


    /**
     * Get the ID of the first referenced event.
     *
     * @return The ID or null
     */
    public String getStartId ()
    {
        return unref (this.startid);
    }


    /**
     * Get the ID of the last referenced event.
     *
     * @return The ID or null
     */
    public String getEndId ()
    {
        return unref (this.endid);
    }
}
