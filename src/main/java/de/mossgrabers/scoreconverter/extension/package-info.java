// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

/**
 * The extension store: a side table of typed payloads keyed by element IDs which carries the
 * information that has no place in the MEI document.
 *
 * @author Jürgen Moßgraber
 */
package de.mossgrabers.scoreconverter.extension;
