// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.validator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;

import org.junit.jupiter.api.Test;

import java.util.List;


/**
 * Tests for the structural validator.
 *
 * @author Jürgen Moßgraber
 */
class ValidatorTest
{
    @Test
    void wellFormedFileHasNoErrors () throws ParseError
    {
        final String source = "\\version \"2.24.0\"\n\\score { \\new Staff \\relative c' { \\clef \"treble_8\" \\time 3/4 c4( d e) } \\layout { } }";
        assertTrue (Validator.validate (Parser.parse (source).getFile ()).isEmpty ());
    }


    @Test
    void scoreWithoutMusic () throws ParseError
    {
        final List<ValidationError> errors = Validator.validate (Parser.parse ("\\score { \\layout { } }").getFile ());
        assertEquals (1, errors.size ());
        assertEquals (ValidationError.Type.SCORE_NO_MUSIC, errors.get (0).getType ());
    }


    @Test
    void unmatchedSpanners () throws ParseError
    {
        final List<ValidationError> errors = Validator.validate (Parser.parseMusic ("{ c4( d[ e }", InputMode.NOTES));
        assertEquals (2, errors.size ());
        assertEquals (ValidationError.Type.UNMATCHED_SLUR, errors.get (0).getType ());
        assertEquals ("Unmatched slur: 1 open, 0 close", errors.get (0).getMessage ());
        assertEquals (ValidationError.Type.UNMATCHED_BEAM, errors.get (1).getType ());
    }


    @Test
    void unknownContextAndClef () throws ParseError
    {
        final List<ValidationError> errors = Validator.validate (Parser.parseMusic ("\\new Stave { \\clef \"bogus\" c4 }", InputMode.NOTES));
        assertEquals (2, errors.size ());
        assertEquals (ValidationError.Type.UNKNOWN_CONTEXT_TYPE, errors.get (0).getType ());
        assertEquals (ValidationError.Type.UNKNOWN_CLEF_NAME, errors.get (1).getType ());
    }


    @Test
    void excessiveDots () throws ParseError
    {
        final List<ValidationError> errors = Validator.validate (Parser.parseMusic ("{ c4..... }", InputMode.NOTES));
        assertEquals (1, errors.size ());
        assertEquals (ValidationError.Type.EXCESSIVE_DOTS, errors.get (0).getType ());
    }


    @Test
    void knownClefs ()
    {
        assertTrue (Validator.isKnownClef ("bass"));
        assertTrue (Validator.isKnownClef ("treble_8"));
        assertTrue (Validator.isKnownClef ("G^(15)"));
        assertFalse (Validator.isKnownClef ("bogus"));
    }
}
