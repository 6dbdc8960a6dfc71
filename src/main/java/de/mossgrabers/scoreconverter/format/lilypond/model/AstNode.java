// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.Arrays;


/**
 * Base class of all syntax tree nodes. Nodes are immutable; equality is structural and compares
 * the values returned by {@link #getFields()}.
 *
 * @author Jürgen Moßgraber
 */
public abstract class AstNode
{
    /**
     * Get the values which make up the identity of the node.
     *
     * @return The values, may contain null
     */
    protected abstract Object [] getFields ();


    /** {@inheritDoc} */
    @Override
    public boolean equals (final Object obj)
    {
        if (this == obj)
            return true;
        if (obj == null || this.getClass () != obj.getClass ())
            return false;
        return Arrays.deepEquals (this.getFields (), ((AstNode) obj).getFields ());
    }


    /** {@inheritDoc} */
    @Override
    public int hashCode ()
    {
        return 31 * this.getClass ().hashCode () + Arrays.deepHashCode (this.getFields ());
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.getClass ().getSimpleName () + Arrays.deepToString (this.getFields ());
    }
}
