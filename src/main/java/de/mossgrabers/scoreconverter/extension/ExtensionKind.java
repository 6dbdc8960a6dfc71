// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * The kinds of payloads in the extension store. Each kind accepts exactly one payload type.
 *
 * @author Jürgen Moßgraber
 */
public enum ExtensionKind
{
    /** The book / bookpart hierarchy of a score. */
    BOOK_STRUCTURE(BookStructure.class),
    /** The top-level variable assignments. */
    VARIABLE_ASSIGNMENTS(VariableAssignments.class),
    /** A rest at a pitch. */
    PITCHED_REST(PitchedRest.class),
    /** A drum note or chord. */
    DRUM_EVENT(DrumEvent.class),
    /** The exact duration of a multi-measure rest. */
    MREST_DETAIL(MRestDetail.class),
    /** A metronome marking. */
    METRONOME(Metronome.class),
    /** A technical indication. */
    TECHNICAL(Technical.class),
    /** A figured bass event. */
    FIGURED_BASS(FiguredBass.class),
    /** A bar line. */
    BARLINE(Barline.class),
    /** The output definitions and headers of a score. */
    OUTPUT_DEFS(OutputDefs.class),
    /** The top-level items of a file. */
    TOPLEVEL_ITEMS(ToplevelItems.class);


    private final Class<? extends ExtensionPayload> payloadType;


    private ExtensionKind (final Class<? extends ExtensionPayload> payloadType)
    {
        this.payloadType = payloadType;
    }


    /**
     * Get the type of the payloads of this kind.
     *
     * @return The type
     */
    public Class<? extends ExtensionPayload> getPayloadType ()
    {
        return this.payloadType;
    }
}
