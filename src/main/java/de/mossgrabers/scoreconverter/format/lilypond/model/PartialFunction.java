// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A partially applied music function, terminated by \etc.
 *
 * @author Jürgen Moßgraber
 */
public class PartialFunction extends Music
{
    private final String                 name;
    private final List<FunctionArgument> arguments;


    /**
     * Constructor.
     *
     * @param name The name of the function
     * @param arguments The given arguments
     */
    public PartialFunction (final String name, final List<FunctionArgument> arguments)
    {
        this.name = name;
        this.arguments = List.copyOf (arguments);
    }


    public String getName ()
    {
        return this.name;
    }


    public List<FunctionArgument> getArguments ()
    {
        return this.arguments;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitPartialFunction (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.name,
            this.arguments
        };
    }
}
