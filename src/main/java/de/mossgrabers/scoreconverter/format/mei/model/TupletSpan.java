// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;


/**
 * A tuplet which spans the referenced events.
 *
 * @author Jürgen Moßgraber
 */
public class TupletSpan extends ControlEvent
{
    /** The number of notes. */
    @XmlAttribute
    public Integer num;

    /** The number of notes in whose time the notes are played. */
    @XmlAttribute
    public Integer numbase;
}
