// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

import java.util.List;


/**
 * The position of a score in the book / bookpart hierarchy. Every score of a book carries the
 * items of its book and bookpart which are not scores, e.g. header and paper blocks.
 *
 * @author Jürgen Moßgraber
 */
public class BookStructure extends ExtensionPayload
{
    private final int                  bookIndex;
    private final int                  bookPosition;
    private final Integer              bookpartIndex;
    private final int                  bookpartPosition;
    private final int                  scoreIndex;
    private final int                  scorePosition;
    private final List<PositionedItem> bookItems;
    private final List<PositionedItem> bookpartItems;


    /**
     * Constructor.
     *
     * @param bookIndex The index of the book in the file
     * @param bookPosition The index of the book in the top-level items of the file
     * @param bookpartIndex The index of the bookpart in the book, null if the score is not in a
     *            bookpart
     * @param bookpartPosition The index of the bookpart in the items of the book
     * @param scoreIndex The index of the score in its book or bookpart
     * @param scorePosition The index of the score in the items of its book or bookpart
     * @param bookItems The serialized items of the book which are neither scores nor bookparts
     * @param bookpartItems The serialized items of the bookpart which are not scores
     */
    public BookStructure (final int bookIndex, final int bookPosition, final Integer bookpartIndex, final int bookpartPosition, final int scoreIndex, final int scorePosition, final List<PositionedItem> bookItems, final List<PositionedItem> bookpartItems)
    {
        this.bookIndex = bookIndex;
        this.bookPosition = bookPosition;
        this.bookpartIndex = bookpartIndex;
        this.bookpartPosition = bookpartPosition;
        this.scoreIndex = scoreIndex;
        this.scorePosition = scorePosition;
        this.bookItems = List.copyOf (bookItems);
        this.bookpartItems = List.copyOf (bookpartItems);
    }


    public int getBookIndex ()
    {
        return this.bookIndex;
    }


    public int getBookPosition ()
    {
        return this.bookPosition;
    }


    public Integer getBookpartIndex ()
    {
        return this.bookpartIndex;
    }


    public int getBookpartPosition ()
    {
        return this.bookpartPosition;
    }


    public int getScoreIndex ()
    {
        return this.scoreIndex;
    }


    public int getScorePosition ()
    {
        return this.scorePosition;
    }


    public List<PositionedItem> getBookItems ()
    {
        return this.bookItems;
    }


    public List<PositionedItem> getBookpartItems ()
    {
        return this.bookpartItems;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Integer.valueOf (this.bookIndex),
            Integer.valueOf (this.bookPosition),
            this.bookpartIndex,
            Integer.valueOf (this.bookpartPosition),
            Integer.valueOf (this.scoreIndex),
            Integer.valueOf (this.scorePosition),
            this.bookItems,
            this.bookpartItems
        };
    }
}
