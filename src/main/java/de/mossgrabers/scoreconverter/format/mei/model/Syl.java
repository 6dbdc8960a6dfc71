// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlValue;


/**
 * A syllable.
 *
 * @author Jürgen Moßgraber
 */
public class Syl
{
    /** The position in the word: i (initial), m (medial), t (terminal) or s (single). */
    @XmlAttribute
    public String wordpos;

    /** The connector to the next syllable: d (dash) or u (underscore). */
    @XmlAttribute
    public String con;

    /** The text. */
    @XmlValue
    public String text;
}
