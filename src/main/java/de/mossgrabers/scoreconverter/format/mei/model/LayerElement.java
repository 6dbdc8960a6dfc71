// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlTransient;


/**
 * Base class of the events in a layer.
 *
 * @author Jürgen Moßgraber
 */
@XmlTransient
public abstract class LayerElement extends MeiElement
{
    /** The duration: 1, 2, 4, 8, ... */
    @XmlAttribute
    public String  dur;

    /** The number of augmentation dots. */
    @XmlAttribute
    public Integer dots;
}
