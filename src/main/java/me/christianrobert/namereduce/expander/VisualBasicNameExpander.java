package me.christianrobert.namereduce.expander;

import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.semantic.ResolvedSymbol;
import me.christianrobert.namereduce.syntax.SyntaxNode;

import java.util.List;

/**
 * Expansion policy for Visual Basic.
 *
 * <p>Names are compared ignoring case: {@code system.console.writeline} already is fully
 * qualified and is kept as written. Expanded names use the declared casing of the symbol.</p>
 */
public class VisualBasicNameExpander extends AbstractNameExpander {

    public static final VisualBasicNameExpander INSTANCE = new VisualBasicNameExpander();

    @Override
    public Grammar getGrammar() {
        return Grammar.VISUAL_BASIC;
    }

    @Override
    protected boolean isFullyQualified(List<String> writtenSegments, ResolvedSymbol symbol) {
        List<String> qualified = symbol.getSegments();
        if (writtenSegments.size() != qualified.size()) {
            return false;
        }
        for (int i = 0; i < qualified.size(); i++) {
            if (!getGrammar().namesEqual(writtenSegments.get(i), qualified.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected List<String> expandedSegments(SyntaxNode node, ResolvedSymbol symbol) {
        return symbol.getSegments();
    }
}
