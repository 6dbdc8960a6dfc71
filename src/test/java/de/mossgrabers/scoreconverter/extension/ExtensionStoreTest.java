// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;


/**
 * Tests for the extension store.
 *
 * @author Jürgen Moßgraber
 */
class ExtensionStoreTest
{
    @Test
    void typedAccessors ()
    {
        final ExtensionStore store = new ExtensionStore ();
        assertTrue (store.isEmpty ());

        store.insert (ExtensionKind.PITCHED_REST, "r1", new PitchedRest ("c'"));
        store.insert (ExtensionKind.TECHNICAL, "t1", new Technical (TechnicalKind.FINGERING, "3"));
        store.insert (ExtensionKind.METRONOME, "m1", Metronome.beatUnit ("Allegro", "4", 120, null));

        assertEquals (3, store.size ());
        assertEquals (Optional.of (new PitchedRest ("c'")), store.pitchedRest ("r1"));
        assertEquals ("3", store.technical ("t1").orElseThrow ().getValue ());
        assertEquals (Metronome.Form.BEAT_UNIT_BPM, store.metronome ("m1").orElseThrow ().getForm ());
        assertFalse (store.drumEvent ("r1").isPresent ());
        assertFalse (store.pitchedRest ("unknown").isPresent ());
    }


    @Test
    void insertReplacesAndKeepsOrder ()
    {
        final ExtensionStore store = new ExtensionStore ();
        store.insert (ExtensionKind.DRUM_EVENT, "b", new DrumEvent ("bd4"));
        store.insert (ExtensionKind.DRUM_EVENT, "a", new DrumEvent ("sn4"));
        store.insert (ExtensionKind.DRUM_EVENT, "b", new DrumEvent ("hh4"));

        assertEquals (2, store.size ());
        assertEquals (List.of ("b", "a"), List.copyOf (store.getIds (ExtensionKind.DRUM_EVENT)));
        assertEquals ("hh4", store.drumEvent ("b").orElseThrow ().getSource ());
        assertTrue (store.getIds (ExtensionKind.BARLINE).isEmpty ());
    }


    @Test
    void insertRejectsWrongPayload ()
    {
        final ExtensionStore store = new ExtensionStore ();
        assertThrows (IllegalArgumentException.class, () -> store.insert (ExtensionKind.BARLINE, "x", new DrumEvent ("bd4")));
        assertThrows (IllegalArgumentException.class, () -> store.insert (ExtensionKind.BARLINE, "", new Barline ("|.")));
        assertThrows (IllegalArgumentException.class, () -> store.insert (ExtensionKind.BARLINE, "x", null));
        assertTrue (store.isEmpty ());
    }


    @Test
    void barlineKeys ()
    {
        final ExtensionStore store = new ExtensionStore ();
        final String key = ExtensionStore.barlineKey (4, "right");
        assertEquals ("barline:4:right", key);
        store.insert (ExtensionKind.BARLINE, key, new Barline ("|."));
        assertEquals ("|.", store.barline (key).orElseThrow ().getGlyph ());
        assertFalse (store.barline (ExtensionStore.barlineKey (4, "left")).isPresent ());
    }
}
