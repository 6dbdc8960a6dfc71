// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

import java.util.List;


/**
 * All top-level variable assignments of a file in their original order.
 *
 * @author Jürgen Moßgraber
 */
public class VariableAssignments extends ExtensionPayload
{
    private final List<VariableAssignment> assignments;


    /**
     * Constructor.
     *
     * @param assignments The assignments
     */
    public VariableAssignments (final List<VariableAssignment> assignments)
    {
        this.assignments = List.copyOf (assignments);
    }


    public List<VariableAssignment> getAssignments ()
    {
        return this.assignments;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.assignments
        };
    }
}
