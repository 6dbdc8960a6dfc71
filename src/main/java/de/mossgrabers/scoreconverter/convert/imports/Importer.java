// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert.imports;

import de.mossgrabers.scoreconverter.convert.LabelCodec;
import de.mossgrabers.scoreconverter.convert.LabelSegment;
import de.mossgrabers.scoreconverter.extension.BookStructure;
import de.mossgrabers.scoreconverter.extension.ExtensionKind;
import de.mossgrabers.scoreconverter.extension.OutputDefs;
import de.mossgrabers.scoreconverter.extension.PositionedItem;
import de.mossgrabers.scoreconverter.extension.ToplevelItems;
import de.mossgrabers.scoreconverter.extension.VariableAssignment;
import de.mossgrabers.scoreconverter.extension.VariableAssignments;
import de.mossgrabers.scoreconverter.format.lilypond.model.Assignment;
import de.mossgrabers.scoreconverter.format.lilypond.model.Block;
import de.mossgrabers.scoreconverter.format.lilypond.model.BlockType;
import de.mossgrabers.scoreconverter.format.lilypond.model.HeaderBlock;
import de.mossgrabers.scoreconverter.format.lilypond.model.LilyPondFile;
import de.mossgrabers.scoreconverter.format.lilypond.model.Music;
import de.mossgrabers.scoreconverter.format.lilypond.model.SequentialMusic;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelExpression;
import de.mossgrabers.scoreconverter.format.lilypond.model.ToplevelMusic;
import de.mossgrabers.scoreconverter.format.lilypond.resolver.VariableResolver;
import de.mossgrabers.scoreconverter.format.mei.model.Mdiv;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;
import de.mossgrabers.scoreconverter.format.mei.model.MeiHead;
import de.mossgrabers.scoreconverter.format.mei.model.MeiMusic;
import de.mossgrabers.scoreconverter.format.mei.model.Score;
import de.mossgrabers.scoreconverter.format.mei.model.Section;
import de.mossgrabers.scoreconverter.format.mei.model.Title;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * Converts a LilyPond file into a MEI document. Every score becomes a division (mdiv) with one
 * section and one measure. Everything the MEI tree cannot express is stored in the label
 * attributes of the created elements or in the extension store, keyed by the ID of the element.
 *
 * @author Jürgen Moßgraber
 */
public class Importer
{
    /** The ID of the music element which carries the file level data. */
    public static final String MUSIC_ID     = "ly-music";
    /** The prefix of the IDs of the divisions. */
    public static final String MDIV_PREFIX  = "ly-mdiv-";
    /** The MEI version which is written by default. */
    public static final String MEI_VERSION  = "5.0";

    private final String       meiVersion;
    private ImportContext      context;
    private Mei                mei;
    private String             firstScoreTitle;


    /**
     * Constructor.
     */
    public Importer ()
    {
        this (MEI_VERSION);
    }


    /**
     * Constructor.
     *
     * @param meiVersion The MEI version to write into the document
     */
    public Importer (final String meiVersion)
    {
        this.meiVersion = meiVersion;
    }


    /**
     * Convert a file. Variables are resolved before the conversion, the assignments themselves
     * are kept in the extension store.
     *
     * @param file The parsed file
     * @return The document, its extension store and the conversion notes
     */
    public ImportResult importFile (final LilyPondFile file)
    {
        this.context = new ImportContext ();
        this.firstScoreTitle = null;
        this.mei = new Mei ();
        this.mei.meiversion = this.meiVersion;
        this.mei.meiHead = new MeiHead ();
        this.mei.music = new MeiMusic ();
        this.mei.music.id = MUSIC_ID;

        this.storeAssignments (file);

        final LilyPondFile resolved = VariableResolver.forFile (file).resolve (file);
        final List<ToplevelExpression> items = resolved.getItems ();
        final boolean hasScores = containsScore (items);
        final List<PositionedItem> toplevelItems = new ArrayList<> ();
        String title = null;
        int bookIndex = 0;
        for (int position = 0; position < items.size (); position++)
        {
            final ToplevelExpression item = items.get (position);
            if (item instanceof Assignment)
                continue;

            if (item instanceof final Block block && block.getType () == BlockType.SCORE)
            {
                this.addScore (block, List.of (LabelSegment.of ("score", Integer.toString (position))));
                continue;
            }
            if (item instanceof final Block block && block.getType () == BlockType.BOOK && containsScore (block.getItems ()))
            {
                this.addBook (block, bookIndex, position);
                bookIndex++;
                continue;
            }
            if (!hasScores && item instanceof final ToplevelMusic toplevelMusic && this.mei.music.body.mdivs.isEmpty ())
            {
                this.addDivision (toplevelMusic.getMusic (), List.of (LabelSegment.of ("music", Integer.toString (position))));
                continue;
            }

            if (title == null && item instanceof final HeaderBlock header)
                title = header.getText ("title");
            toplevelItems.add (new PositionedItem (position, this.context.serialize (item)));
        }

        this.context.getStore ().insert (ExtensionKind.TOPLEVEL_ITEMS, MUSIC_ID, new ToplevelItems (resolved.getVersion (), items.size (), toplevelItems));

        if (title == null)
            title = this.firstScoreTitle;
        if (title != null)
            this.mei.meiHead.fileDesc.titleStmt.titles.add (new Title (title, null));
        if (this.mei.music.body.mdivs.isEmpty ())
            this.context.addNote (MUSIC_ID, "The file contains no music.");

        return new ImportResult (this.mei, this.context.getStore (), this.context.getNotes ());
    }


    private void storeAssignments (final LilyPondFile file)
    {
        final List<VariableAssignment> assignments = new ArrayList<> ();
        final List<ToplevelExpression> items = file.getItems ();
        for (int position = 0; position < items.size (); position++)
        {
            if (items.get (position) instanceof final Assignment assignment)
                assignments.add (new VariableAssignment (position, assignment.getName (), this.context.getSerializer ().serializeValue (assignment.getValue ())));
        }
        if (!assignments.isEmpty ())
            this.context.getStore ().insert (ExtensionKind.VARIABLE_ASSIGNMENTS, MUSIC_ID, new VariableAssignments (assignments));
    }


    private void addBook (final Block book, final int bookIndex, final int bookPosition)
    {
        final List<PositionedItem> bookItems = new ArrayList<> ();
        final List<Object []> scores = new ArrayList<> ();
        final List<ToplevelExpression> items = book.getItems ();
        int scoreIndex = 0;
        int bookpartIndex = 0;
        for (int position = 0; position < items.size (); position++)
        {
            final ToplevelExpression item = items.get (position);
            if (item instanceof final Block block && block.getType () == BlockType.SCORE)
            {
                final String id = this.addScore (block, Collections.emptyList ());
                scores.add (new Object []
                {
                    id,
                    null,
                    Integer.valueOf (0),
                    Integer.valueOf (scoreIndex),
                    Integer.valueOf (position),
                    Collections.emptyList ()
                });
                scoreIndex++;
            }
            else if (item instanceof final Block block && block.getType () == BlockType.BOOKPART && containsScore (block.getItems ()))
            {
                this.addBookpart (block, bookpartIndex, position, scores);
                bookpartIndex++;
            }
            else
                bookItems.add (new PositionedItem (position, this.context.serialize (item)));
        }

        for (final Object [] score: scores)
        {
            @SuppressWarnings("unchecked")
            final List<PositionedItem> bookpartItems = (List<PositionedItem>) score[5];
            final BookStructure structure = new BookStructure (bookIndex, bookPosition, (Integer) score[1], ((Integer) score[2]).intValue (), ((Integer) score[3]).intValue (), ((Integer) score[4]).intValue (), bookItems, bookpartItems);
            this.context.getStore ().insert (ExtensionKind.BOOK_STRUCTURE, (String) score[0], structure);
        }
    }


    private void addBookpart (final Block bookpart, final int bookpartIndex, final int bookpartPosition, final List<Object []> scores)
    {
        final List<PositionedItem> bookpartItems = new ArrayList<> ();
        final List<ToplevelExpression> items = bookpart.getItems ();
        int scoreIndex = 0;
        for (int position = 0; position < items.size (); position++)
        {
            final ToplevelExpression item = items.get (position);
            if (item instanceof final Block block && block.getType () == BlockType.SCORE)
            {
                final String id = this.addScore (block, Collections.emptyList ());
                scores.add (new Object []
                {
                    id,
                    Integer.valueOf (bookpartIndex),
                    Integer.valueOf (bookpartPosition),
                    Integer.valueOf (scoreIndex),
                    Integer.valueOf (position),
                    bookpartItems
                });
                scoreIndex++;
            }
            else
                bookpartItems.add (new PositionedItem (position, this.context.serialize (item)));
        }
    }


    /**
     * Add a score block as a division. Header and output definitions of the score are stored
     * with their positions.
     *
     * @param score The score block
     * @param segments The label of the division
     * @return The ID of the division
     */
    private String addScore (final Block score, final List<LabelSegment> segments)
    {
        Music music = null;
        int musicPosition = -1;
        final List<PositionedItem> outputDefs = new ArrayList<> ();
        final List<ToplevelExpression> items = score.getItems ();
        for (int position = 0; position < items.size (); position++)
        {
            final ToplevelExpression item = items.get (position);
            if (music == null && item instanceof final ToplevelMusic toplevelMusic)
            {
                music = toplevelMusic.getMusic ();
                musicPosition = position;
                continue;
            }
            if (this.firstScoreTitle == null && item instanceof final HeaderBlock header)
                this.firstScoreTitle = header.getText ("title");
            outputDefs.add (new PositionedItem (position, this.context.serialize (item)));
        }

        if (music == null)
        {
            music = new SequentialMusic (Collections.emptyList ());
            this.context.addNote (null, "A score block without music.");
        }

        final String id = this.addDivision (music, segments);
        if (!outputDefs.isEmpty () || musicPosition != 0)
            this.context.getStore ().insert (ExtensionKind.OUTPUT_DEFS, id, new OutputDefs (musicPosition, outputDefs));
        return id;
    }


    private String addDivision (final Music music, final List<LabelSegment> segments)
    {
        final List<Mdiv> mdivs = this.mei.music.body.mdivs;
        final Mdiv mdiv = new Mdiv ();
        mdiv.id = MDIV_PREFIX + mdivs.size ();
        mdiv.n = Integer.valueOf (mdivs.size () + 1);
        mdiv.label = LabelCodec.encode (segments);
        mdivs.add (mdiv);

        final Score score = new Score ();
        score.id = this.context.createId ("score");
        score.scoreDef.id = this.context.createId ("scoredef");
        mdiv.score = score;

        final StaffAnalyzer analyzer = new StaffAnalyzer (this.context);
        analyzer.analyze (music, score.scoreDef.staffGrp);

        final Section section = new Section ();
        section.id = this.context.createId ("section");
        section.measures.add (analyzer.getMeasure ());
        score.sections.add (section);
        return mdiv.id;
    }


    private static boolean containsScore (final List<ToplevelExpression> items)
    {
        for (final ToplevelExpression item: items)
        {
            if (item instanceof final Block block && (block.getType () == BlockType.SCORE || containsScore (block.getItems ())))
                return true;
        }
        return false;
    }
}
