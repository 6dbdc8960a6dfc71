// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A variable assignment 'name = value'.
 *
 * @author Jürgen Moßgraber
 */
public class Assignment extends ToplevelExpression
{
    private final String          name;
    private final AssignmentValue value;


    /**
     * Constructor.
     *
     * @param name The name of the variable
     * @param value The value
     */
    public Assignment (final String name, final AssignmentValue value)
    {
        this.name = name;
        this.value = value;
    }


    public String getName ()
    {
        return this.name;
    }


    public AssignmentValue getValue ()
    {
        return this.value;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final ToplevelVisitor<R> visitor)
    {
        return visitor.visitAssignment (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.name,
            this.value
        };
    }
}
