// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * A top-level variable assignment.
 *
 * @author Jürgen Moßgraber
 */
public class VariableAssignment extends ExtensionPayload
{
    private final int    position;
    private final String name;
    private final String value;


    /**
     * Constructor.
     *
     * @param position The index of the assignment in the top-level items of the file
     * @param name The name of the variable
     * @param value The serialized value
     */
    public VariableAssignment (final int position, final String name, final String value)
    {
        this.position = position;
        this.name = name;
        this.value = value;
    }


    public int getPosition ()
    {
        return this.position;
    }


    public String getName ()
    {
        return this.name;
    }


    public String getValue ()
    {
        return this.value;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Integer.valueOf (this.position),
            this.name,
            this.value
        };
    }
}
