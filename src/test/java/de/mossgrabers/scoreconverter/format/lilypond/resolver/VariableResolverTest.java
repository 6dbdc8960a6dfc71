// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.resolver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.format.lilypond.model.Assignment;
import de.mossgrabers.scoreconverter.format.lilypond.model.Block;
import de.mossgrabers.scoreconverter.format.lilypond.model.IdentifierMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.InputMode;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;


/**
 * Tests for the resolution of music variables.
 *
 * @author Jürgen Moßgraber
 */
class VariableResolverTest
{
    @Test
    void referencesInsideScoresAreReplaced () throws ParseError
    {
        final LilyPondFile file = Parser.parse ("melody = { c4 d }\n\\score { \\new Staff \\melody }").getFile ();
        final LilyPondFile resolved = VariableResolver.forFile (file).resolve (file);

        assertTrue (resolved.getItems ().get (0) instanceof Assignment);
        final Block score = (Block) resolved.getItems ().get (1);
        final Music expected = Parser.parseMusic ("\\new Staff { c4 d }", InputMode.NOTES);
        assertEquals (expected, ((ToplevelMusic) score.getItems ().get (0)).getMusic ());
    }


    @Test
    void variablesCanUseEarlierVariables () throws ParseError
    {
        final LilyPondFile file = Parser.parse ("a = { c4 }\nb = { \\a d4 }\nc = \\b").getFile ();
        final Map<String, Music> variables = VariableResolver.buildVariableMap (VariableResolver.collectAssignments (file));

        final Music expected = Parser.parseMusic ("{ { c4 } d4 }", InputMode.NOTES);
        assertEquals (expected, variables.get ("b"));
        assertEquals (expected, variables.get ("c"));
    }


    @Test
    void forwardAndUnknownReferencesAreKept () throws ParseError
    {
        final LilyPondFile file = Parser.parse ("a = { \\b }\nb = { c4 }\n{ \\a \\unknown }").getFile ();
        final VariableResolver resolver = VariableResolver.forFile (file);
        final LilyPondFile resolved = resolver.resolve (file);

        final SequentialMusic music = (SequentialMusic) ((ToplevelMusic) resolved.getItems ().get (2)).getMusic ();
        assertEquals (new SequentialMusic (List.of (new IdentifierMusic ("b"))), music.getItems ().get (0));
        assertEquals (new IdentifierMusic ("unknown"), music.getItems ().get (1));
        assertFalse (resolver.getVariables ().containsKey ("unknown"));
    }
}
