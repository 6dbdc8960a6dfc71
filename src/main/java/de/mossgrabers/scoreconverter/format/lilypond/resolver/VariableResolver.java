// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.resolver;

import de.mossgrabers.scoreconverter.format.lilypond.model.Assignment;
import de.mossgrabers.scoreconverter.format.lilypond.model.AssignmentValue;
import de.mossgrabers.scoreconverter.format.lilypond.model.Block;
import de.mossgrabers.scoreconverter.format.lilypond.model.IdentifierMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.MusicTransformer;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelExpression;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;


/**
 * Replaces references to music variables with their values. Variables must be defined before they
 * are used, forward references are not resolved. Unknown references are kept.
 *
 * @author Jürgen Moßgraber
 */
public class VariableResolver extends MusicTransformer
{
    private final Map<String, Music> variables;


    /**
     * Constructor.
     *
     * @param variables The music values by variable name
     */
    public VariableResolver (final Map<String, Music> variables)
    {
        this.variables = variables;
    }


    /**
     * Create a resolver for the top-level assignments of a file.
     *
     * @param file The file
     * @return The resolver
     */
    public static VariableResolver forFile (final LilyPondFile file)
    {
        return new VariableResolver (buildVariableMap (collectAssignments (file)));
    }


    /**
     * Get all top-level assignments of a file in the order of the source.
     *
     * @param file The file
     * @return The assignments
     */
    public static List<Assignment> collectAssignments (final LilyPondFile file)
    {
        final List<Assignment> assignments = new ArrayList<> ();
        for (final ToplevelExpression item: file.getItems ())
        {
            if (item instanceof Assignment)
                assignments.add ((Assignment) item);
        }
        return assignments;
    }


    /**
     * Build the lookup of music variables in one pass from left to right. References to other
     * variables are resolved with the entries which were built so far.
     *
     * @param assignments The assignments in the order of the source
     * @return The music by variable name
     */
    public static Map<String, Music> buildVariableMap (final List<Assignment> assignments)
    {
        final Map<String, Music> map = new HashMap<> ();
        final VariableResolver resolver = new VariableResolver (map);
        for (final Assignment assignment: assignments)
        {
            final AssignmentValue value = assignment.getValue ();
            switch (value.getKind ())
            {
                case MUSIC:
                    map.put (assignment.getName (), resolver.transform (value.getMusic ()));
                    break;

                case IDENTIFIER:
                    final Music referenced = map.get (value.getText ());
                    if (referenced != null)
                        map.put (assignment.getName (), referenced);
                    break;

                default:
                    // Only music can be referenced from music
                    break;
            }
        }
        return map;
    }


    /**
     * Resolve all music of a file. The assignments are kept unchanged.
     *
     * @param file The file
     * @return The new file
     */
    public LilyPondFile resolve (final LilyPondFile file)
    {
        return new LilyPondFile (file.getVersion (), this.resolveItems (file.getItems ()));
    }


    private List<ToplevelExpression> resolveItems (final List<ToplevelExpression> items)
    {
        final List<ToplevelExpression> result = new ArrayList<> (items.size ());
        for (final ToplevelExpression item: items)
        {
            if (item instanceof ToplevelMusic)
                result.add (new ToplevelMusic (this.transform (((ToplevelMusic) item).getMusic ())));
            else if (item instanceof Block)
            {
                final Block block = (Block) item;
                result.add (new Block (block.getType (), this.resolveItems (block.getItems ())));
            }
            else
                result.add (item);
        }
        return result;
    }


    public Map<String, Music> getVariables ()
    {
        return Collections.unmodifiableMap (this.variables);
    }


    /** {@inheritDoc} */
    @Override
    public Music visitIdentifierMusic (final IdentifierMusic identifierMusic)
    {
        final Music value = this.variables.get (identifierMusic.getName ());
        return value == null ? identifierMusic : value;
    }
}
