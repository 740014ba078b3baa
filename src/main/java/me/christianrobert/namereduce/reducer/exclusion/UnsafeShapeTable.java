package me.christianrobert.namereduce.reducer.exclusion;

import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Versioned list of the shapes excluded from simplification for one grammar.
 *
 * <p>The list is consulted, never derived: a newly discovered reducer defect is handled by
 * adding an entry with {@link #withEntry(UnsafeShapeRule)}, which bumps the version.</p>
 *
 * <ul>
 *   <li>C#, version 1: no known unsafe shapes</li>
 *   <li>Visual Basic, version 1: {@link KnownUnsafeShape#EMPTY_ARGUMENT_INVOCATION},
 *       {@link KnownUnsafeShape#OBJECT_CREATION_EXPRESSION}</li>
 * </ul>
 */
public final class UnsafeShapeTable implements UnsafeShapeRule {

    public static final UnsafeShapeTable CSHARP =
            new UnsafeShapeTable(Grammar.CSHARP, 1, Collections.emptyList());

    public static final UnsafeShapeTable VISUAL_BASIC =
            new UnsafeShapeTable(Grammar.VISUAL_BASIC, 1, List.of(
                    KnownUnsafeShape.EMPTY_ARGUMENT_INVOCATION,
                    KnownUnsafeShape.OBJECT_CREATION_EXPRESSION));

    private final Grammar grammar;
    private final int version;
    private final List<UnsafeShapeRule> entries;

    private UnsafeShapeTable(Grammar grammar, int version, List<UnsafeShapeRule> entries) {
        this.grammar = grammar;
        this.version = version;
        this.entries = List.copyOf(entries);
    }

    public static UnsafeShapeTable forGrammar(Grammar grammar) {
        switch (grammar) {
            case CSHARP:
                return CSHARP;
            case VISUAL_BASIC:
                return VISUAL_BASIC;
            default:
                throw new IllegalArgumentException("No unsafe shape table for grammar: " + grammar);
        }
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public int getVersion() {
        return version;
    }

    public List<UnsafeShapeRule> getEntries() {
        return entries;
    }

    /**
     * Returns a copy of this table with one more entry and the next version number.
     */
    public UnsafeShapeTable withEntry(UnsafeShapeRule entry) {
        if (entry == null) {
            throw new IllegalArgumentException("Unsafe shape entry cannot be null");
        }
        List<UnsafeShapeRule> extended = new ArrayList<>(entries);
        extended.add(entry);
        return new UnsafeShapeTable(grammar, version + 1, extended);
    }

    @Override
    public boolean isUnsafeToSimplify(SyntaxNode node) {
        for (UnsafeShapeRule entry : entries) {
            if (entry.isUnsafeToSimplify(node)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "UnsafeShapeTable{" + grammar + " v" + version + ", entries=" + entries.size() + "}";
    }
}
