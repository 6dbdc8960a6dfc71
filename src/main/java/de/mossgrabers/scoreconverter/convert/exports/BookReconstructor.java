// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.exports;

import de.mossgrabers.scoreconverter.convert.LabelCodec;
import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.convert.imports.Importer;
import de.mossgrabers.scoreconverter.extension.BookStructure;
import de.mossgrabers.scoreconverter.extension.ExtensionStore;
import de.mossgrabers.scoreconverter.extension.OutputDefs;
import de.mossgrabers.scoreconverter.extension.PositionedItem;
import de.mossgrabers.scoreconverter.extension.ToplevelItems;
import de.mossgrabers.scoreconverter.extension.VariableAssignment;
import de.mossgrabers.scoreconverter.extension.VariableAssignments;
import de.mossgrabers.scoreconverter.format.lilypond.model.Assignment;
import de.mossgrabers.scoreconverter.format.lilypond.model.AssignmentValue;
import de.mossgrabers.scoreconverter.format.lilypond.model.Block;
import de.mossgrabers.scoreconverter.format.lilypond.model.BlockType;
import de.mossgrabers.scoreconverter.format.lilypond.model.HeaderBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelExpression;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;
import de.mossgrabers.scoreconverter.format.lilypond.parser.ParseError;
import de.mossgrabers.scoreconverter.format.lilypond.parser.Parser;
import de.mossgrabers.scoreconverter.format.mei.model.Mdiv;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;
import de.mossgrabers.scoreconverter.format.mei.model.Title;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;


/**
 * Assembles the top-level items of the LilyPond file: the scores of the divisions, nested in their
 * books and bookparts, together with the stored assignments, headers and output definitions at
 * their original positions.
 *
 * @author Jürgen Moßgraber
 */
class BookReconstructor
{
    /** The items of one book or bookpart by their position. */
    private static class Container
    {
        private final TreeMap<Integer, ToplevelExpression> items = new TreeMap<> ();
        private final TreeMap<Integer, Container>          parts = new TreeMap<> ();
    }


    private final ExportContext context;


    /**
     * Constructor.
     *
     * @param context The export context
     */
    BookReconstructor (final ExportContext context)
    {
        this.context = context;
    }


    /**
     * Create the file.
     *
     * @param mei The document
     * @param music The music of each division by the ID of the division
     * @param defaultVersion The version to write if the document was not created from LilyPond
     * @return The file
     * @throws ParseError Stored source text could not be parsed
     */
    LilyPondFile reconstruct (final Mei mei, final Map<String, Music> music, final String defaultVersion) throws ParseError
    {
        final ExtensionStore store = this.context.getStore ();
        final TreeMap<Integer, ToplevelExpression> items = new TreeMap<> ();

        final Optional<ToplevelItems> toplevelItems = store.toplevelItems (Importer.MUSIC_ID);
        if (toplevelItems.isPresent ())
        {
            for (final PositionedItem item: toplevelItems.get ().getItems ())
                items.put (Integer.valueOf (item.getPosition ()), Parser.parseToplevel (item.getSource ()));
        }
        else
            addTitle (mei, items);

        final Optional<VariableAssignments> assignments = store.variableAssignments (Importer.MUSIC_ID);
        if (assignments.isPresent ())
        {
            for (final VariableAssignment assignment: assignments.get ().getAssignments ())
                items.put (Integer.valueOf (assignment.getPosition ()), new Assignment (assignment.getName (), Parser.parseAssignmentValue (assignment.getValue ())));
        }

        final TreeMap<Integer, Container> books = new TreeMap<> ();
        final List<ToplevelExpression> unplaced = new ArrayList<> ();
        for (final Mdiv mdiv: mei.music.body.mdivs)
        {
            final Music scoreMusic = music.get (mdiv.id);
            if (scoreMusic == null)
                continue;

            final Optional<BookStructure> structure = store.bookStructure (mdiv.id);
            if (structure.isPresent ())
            {
                addToBook (books, structure.get (), this.createScore (mdiv.id, scoreMusic));
                continue;
            }

            final List<LabelSegment> segments = LabelCodec.decode (mdiv.label);
            final Optional<LabelSegment> score = LabelCodec.find (segments, "score");
            final Optional<LabelSegment> toplevelMusic = LabelCodec.find (segments, "music");
            if (score.isPresent ())
                items.put (Integer.valueOf (score.get ().getField (0)), this.createScore (mdiv.id, scoreMusic));
            else if (toplevelMusic.isPresent ())
                items.put (Integer.valueOf (toplevelMusic.get ().getField (0)), new ToplevelMusic (scoreMusic));
            else
                unplaced.add (this.createScore (mdiv.id, scoreMusic));
        }

        for (final Map.Entry<Integer, Container> book: books.entrySet ())
        {
            final Container container = book.getValue ();
            for (final Map.Entry<Integer, Container> part: container.parts.entrySet ())
                container.items.put (part.getKey (), new Block (BlockType.BOOKPART, new ArrayList<> (part.getValue ().items.values ())));
            items.put (book.getKey (), new Block (BlockType.BOOK, new ArrayList<> (container.items.values ())));
        }

        for (final ToplevelExpression score: unplaced)
            items.put (Integer.valueOf (items.isEmpty () ? 0 : items.lastKey ().intValue () + 1), score);

        final String version = toplevelItems.isPresent () ? toplevelItems.get ().getVersion () : defaultVersion;
        return new LilyPondFile (version, new ArrayList<> (items.values ()));
    }


    private static void addToBook (final TreeMap<Integer, Container> books, final BookStructure structure, final Block score) throws ParseError
    {
        final Container book = books.computeIfAbsent (Integer.valueOf (structure.getBookPosition ()), position -> new Container ());
        addItems (book, structure.getBookItems ());

        if (structure.getBookpartIndex () == null)
        {
            book.items.put (Integer.valueOf (structure.getScorePosition ()), score);
            return;
        }

        final Container bookpart = book.parts.computeIfAbsent (Integer.valueOf (structure.getBookpartPosition ()), position -> new Container ());
        addItems (bookpart, structure.getBookpartItems ());
        bookpart.items.put (Integer.valueOf (structure.getScorePosition ()), score);
    }


    private static void addItems (final Container container, final List<PositionedItem> items) throws ParseError
    {
        for (final PositionedItem item: items)
        {
            final Integer position = Integer.valueOf (item.getPosition ());
            if (!container.items.containsKey (position))
                container.items.put (position, Parser.parseToplevel (item.getSource ()));
        }
    }


    /**
     * Create a score block. The stored header and output definitions are placed around the music.
     *
     * @param mdivId The ID of the division
     * @param music The music of the division
     * @return The score block
     * @throws ParseError A stored output definition could not be parsed
     */
    private Block createScore (final String mdivId, final Music music) throws ParseError
    {
        final TreeMap<Integer, ToplevelExpression> items = new TreeMap<> ();
        final Optional<OutputDefs> outputDefs = this.context.getStore ().outputDefs (mdivId);
        int musicPosition = 0;
        if (outputDefs.isPresent ())
        {
            musicPosition = outputDefs.get ().getMusicPosition ();
            for (final PositionedItem item: outputDefs.get ().getItems ())
                items.put (Integer.valueOf (item.getPosition ()), Parser.parseToplevel (item.getSource ()));
        }
        items.put (Integer.valueOf (musicPosition), new ToplevelMusic (music));
        return new Block (BlockType.SCORE, new ArrayList<> (items.values ()));
    }


    private static void addTitle (final Mei mei, final TreeMap<Integer, ToplevelExpression> items)
    {
        if (mei.meiHead == null || mei.meiHead.fileDesc == null || mei.meiHead.fileDesc.titleStmt == null)
            return;
        for (final Title title: mei.meiHead.fileDesc.titleStmt.titles)
        {
            if (title.text != null && !title.text.isBlank ())
            {
                items.put (Integer.valueOf (-1), new HeaderBlock (List.of (new Assignment ("title", AssignmentValue.ofString (title.text.trim ())))));
                return;
            }
        }
    }
}
