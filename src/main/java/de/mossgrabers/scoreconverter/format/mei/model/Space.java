// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

/**
 * An invisible rest which only takes time.
 *
 * @author Jürgen Moßgraber
 */
public class Space extends LayerElement
{
    // Only the common attributes
}
