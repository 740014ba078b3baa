package me.christianrobert.namereduce.expander;

import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.semantic.ResolvedSymbol;
import me.christianrobert.namereduce.syntax.SyntaxNode;

import java.util.List;

/**
 * Expansion policy for C#. Names are case-sensitive.
 */
public class CSharpNameExpander extends AbstractNameExpander {

    public static final CSharpNameExpander INSTANCE = new CSharpNameExpander();

    @Override
    public Grammar getGrammar() {
        return Grammar.CSHARP;
    }

    @Override
    protected boolean isFullyQualified(List<String> writtenSegments, ResolvedSymbol symbol) {
        return writtenSegments.equals(symbol.getSegments());
    }

    @Override
    protected List<String> expandedSegments(SyntaxNode node, ResolvedSymbol symbol) {
        return symbol.getSegments();
    }
}
