// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;


/**
 * Tests for the conversion between written and absolute pitches.
 *
 * @author Jürgen Moßgraber
 */
class PitchContextTest
{
    private static final Pitch C1 = new Pitch ('c', 0, 1);


    @Test
    void relativeUsesClosestOctave ()
    {
        final PitchContext context = PitchContext.absolute ().enterRelative (C1);
        assertEquals (new Pitch ('c', 0, 1), context.toAbsolute (new Pitch ('c', 0, 0)));
        assertEquals (new Pitch ('e', 0, 1), context.toAbsolute (new Pitch ('e', 0, 0)));
        assertEquals (new Pitch ('g', 0, 1), context.toAbsolute (new Pitch ('g', 0, 0)));
        assertEquals (new Pitch ('c', 0, 2), context.toAbsolute (new Pitch ('c', 0, 0)));
        assertEquals (new Pitch ('b', 0, 0), context.toAbsolute (new Pitch ('b', 0, -1)));
    }


    @Test
    void chordFirstPitchBecomesReference ()
    {
        final PitchContext context = PitchContext.absolute ().enterRelative (C1);
        context.startChord ();
        context.toAbsolute (new Pitch ('c', 0, 0));
        context.toAbsolute (new Pitch ('e', 0, 0));
        assertEquals (new Pitch ('g', 0, 1), context.toAbsolute (new Pitch ('g', 0, 0)));
        context.endChord ();
        assertEquals (new Pitch ('c', 0, 1), context.toAbsolute (new Pitch ('c', 0, 0)));
    }


    @Test
    void toWrittenRevertsToAbsolute ()
    {
        final List<Pitch> written = List.of (new Pitch ('c', 0, 0), new Pitch ('a', 0, 1), new Pitch ('f', 1, 0), new Pitch ('d', 0, -2), new Pitch ('b', -1, 0));

        final PitchContext reading = PitchContext.absolute ().enterRelative (null);
        final List<Pitch> absolute = new ArrayList<> ();
        for (final Pitch pitch: written)
            absolute.add (reading.toAbsolute (pitch));

        final PitchContext writing = PitchContext.absolute ().enterRelative (null);
        final List<Pitch> result = new ArrayList<> ();
        for (final Pitch pitch: absolute)
            result.add (writing.toWritten (pitch));
        assertEquals (written, result);
    }


    @Test
    void fixedAddsOctave ()
    {
        final PitchContext context = PitchContext.absolute ().enterFixed (C1);
        assertEquals (new Pitch ('d', 0, 2), context.toAbsolute (new Pitch ('d', 0, 1)));
        assertEquals (new Pitch ('d', 0, 1), context.toWritten (new Pitch ('d', 0, 2)));
    }


    @Test
    void transposition ()
    {
        final PitchContext identity = PitchContext.absolute ();
        assertTrue (identity.isIdentity ());

        final PitchContext context = identity.enterTranspose (new Pitch ('c', 0, 0), new Pitch ('d', 0, 0));
        assertFalse (context.isIdentity ());
        assertEquals (new Pitch ('f', 1, 1), context.toAbsolute (new Pitch ('e', 0, 1)));
        assertEquals (new Pitch ('e', 0, 1), context.toWritten (new Pitch ('f', 1, 1)));
    }
}
