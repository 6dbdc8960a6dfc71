// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;


/**
 * The definition of a staff with its initial clef, key and meter.
 *
 * @author Jürgen Moßgraber
 */
public class StaffDef extends MeiElement
{
    /** The number of the staff. */
    @XmlAttribute
    public Integer n;

    /** The number of staff lines. */
    @XmlAttribute
    public Integer lines;

    /** The shape of the clef: G, F, C, perc or TAB. */
    @XmlAttribute(name = "clef.shape")
    public String  clefShape;

    /** The staff line of the clef. */
    @XmlAttribute(name = "clef.line")
    public Integer clefLine;

    /** The octave displacement of the clef. */
    @XmlAttribute(name = "clef.dis")
    public Integer clefDis;

    /** The direction of the octave displacement: above or below. */
    @XmlAttribute(name = "clef.dis.place")
    public String  clefDisPlace;

    /** The key signature, e.g. '0', '2s' or '3f'. */
    @XmlAttribute(name = "key.sig")
    public String  keySig;

    /** The mode of the key, e.g. 'major'. */
    @XmlAttribute(name = "key.mode")
    public String  keyMode;

    /** The numerator of the meter, e.g. '3' or '2+3'. */
    @XmlAttribute(name = "meter.count")
    public String  meterCount;

    /** The denominator of the meter. */
    @XmlAttribute(name = "meter.unit")
    public Integer meterUnit;
}
