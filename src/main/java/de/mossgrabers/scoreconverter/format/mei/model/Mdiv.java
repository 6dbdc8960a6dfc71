// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;


/**
 * A musical division, e.g. a movement or one score of a book.
 *
 * @author Jürgen Moßgraber
 */
public class Mdiv extends MeiElement
{
    /** The number of the division. */
    @XmlAttribute
    public Integer n;

    /** The score. */
    @XmlElement
    public Score   score;
}
