// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;


/**
 * Side table which maps the IDs of document elements to typed payloads. The store does not keep
 * references to the elements themselves. There is at most one payload per kind and ID.
 *
 * @author Jürgen Moßgraber
 */
public class ExtensionStore
{
    private final Map<ExtensionKind, Map<String, ExtensionPayload>> payloads = new EnumMap<> (ExtensionKind.class);


    /**
     * Create the key of a bar line.
     *
     * @param measure The number of the measure
     * @param position The position in the measure: left, right or middle
     * @return The key
     */
    public static String barlineKey (final int measure, final String position)
    {
        return "barline:" + measure + ":" + position;
    }


    /**
     * Add a payload. An existing payload of the same kind and ID is replaced.
     *
     * @param kind The kind of the payload
     * @param id The ID of the element to which the payload belongs
     * @param payload The payload
     * @throws IllegalArgumentException The type of the payload does not match the kind
     */
    public void insert (final ExtensionKind kind, final String id, final ExtensionPayload payload)
    {
        if (id == null || id.isEmpty ())
            throw new IllegalArgumentException ("An ID is required to store a payload of kind " + kind + ".");
        if (!kind.getPayloadType ().isInstance (payload))
            throw new IllegalArgumentException ("A payload of kind " + kind + " must be a " + kind.getPayloadType ().getSimpleName () + " but is " + (payload == null ? "null" : payload.getClass ().getSimpleName ()) + ".");
        this.payloads.computeIfAbsent (kind, k -> new LinkedHashMap<> ()).put (id, payload);
    }


    /**
     * Get a payload.
     *
     * @param kind The kind of the payload
     * @param id The ID of the element
     * @return The payload if present
     */
    public Optional<ExtensionPayload> get (final ExtensionKind kind, final String id)
    {
        final Map<String, ExtensionPayload> map = this.payloads.get (kind);
        return map == null || id == null ? Optional.empty () : Optional.ofNullable (map.get (id));
    }


    /**
     * Get the IDs of all payloads of a kind.
     *
     * @param kind The kind
     * @return The IDs in the order of insertion
     */
    public Set<String> getIds (final ExtensionKind kind)
    {
        final Map<String, ExtensionPayload> map = this.payloads.get (kind);
        return map == null ? Collections.emptySet () : Collections.unmodifiableSet (map.keySet ());
    }


    /**
     * Get the number of all payloads.
     *
     * @return The number
     */
    public int size ()
    {
        int size = 0;
        for (final Map<String, ExtensionPayload> map: this.payloads.values ())
            size += map.size ();
        return size;
    }


    /**
     * Check if the store contains no payload.
     *
     * @return True if empty
     */
    public boolean isEmpty ()
    {
        return this.size () == 0;
    }


    public Optional<BookStructure> bookStructure (final String id)
    {
        return this.get (ExtensionKind.BOOK_STRUCTURE, id, BookStructure.class);
    }


    public Optional<VariableAssignments> variableAssignments (final String id)
    {
        return this.get (ExtensionKind.VARIABLE_ASSIGNMENTS, id, VariableAssignments.class);
    }


    public Optional<PitchedRest> pitchedRest (final String id)
    {
        return this.get (ExtensionKind.PITCHED_REST, id, PitchedRest.class);
    }


    public Optional<DrumEvent> drumEvent (final String id)
    {
        return this.get (ExtensionKind.DRUM_EVENT, id, DrumEvent.class);
    }


    public Optional<MRestDetail> mrestDetail (final String id)
    {
        return this.get (ExtensionKind.MREST_DETAIL, id, MRestDetail.class);
    }


    public Optional<Metronome> metronome (final String id)
    {
        return this.get (ExtensionKind.METRONOME, id, Metronome.class);
    }


    public Optional<Technical> technical (final String id)
    {
        return this.get (ExtensionKind.TECHNICAL, id, Technical.class);
    }


    public Optional<FiguredBass> figuredBass (final String id)
    {
        return this.get (ExtensionKind.FIGURED_BASS, id, FiguredBass.class);
    }


    /**
     * Get a bar line.
     *
     * @param key The key, see {@link #barlineKey(int, String)}
     * @return The bar line if present
     */
    public Optional<Barline> barline (final String key)
    {
        return this.get (ExtensionKind.BARLINE, key, Barline.class);
    }


    public Optional<OutputDefs> outputDefs (final String id)
    {
        return this.get (ExtensionKind.OUTPUT_DEFS, id, OutputDefs.class);
    }


    public Optional<ToplevelItems> toplevelItems (final String id)
    {
        return this.get (ExtensionKind.TOPLEVEL_ITEMS, id, ToplevelItems.class);
    }


    private <T extends ExtensionPayload> Optional<T> get (final ExtensionKind kind, final String id, final Class<T> type)
    {
        return this.get (kind, id).map (type::cast);
    }
}
