// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

/**
 * The subset of the Music Encoding Initiative (MEI) document model which is produced and consumed
 * by the LilyPond conversion. The classes are bound to XML with Jakarta XML Binding.
 *
 * @author Jürgen Moßgraber
 */
@XmlSchema(namespace = MeiElement.MEI_NAMESPACE, elementFormDefault = XmlNsForm.QUALIFIED, xmlns = @XmlNs(prefix = "", namespaceURI = MeiElement.MEI_NAMESPACE))
@XmlAccessorType(XmlAccessType.FIELD)
package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAccessType;
import jakarta.xml.bind.annotation.XmlAccessorType;
import jakarta.xml.bind.annotation.XmlNs;
import jakarta.xml.bind.annotation.XmlNsForm;
import jakarta.xml.bind.annotation.XmlSchema;
