// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

/**
 * A harmony indication, e.g. a chord symbol.
 *
 * @author Jürgen Moßgraber
 */
public class Harm extends TextControlEvent
{
    // Only the common attributes
}
