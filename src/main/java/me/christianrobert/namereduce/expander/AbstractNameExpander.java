package me.christianrobert.namereduce.expander;

import me.christianrobert.namereduce.context.ReductionException;
import me.christianrobert.namereduce.semantic.ResolvedSymbol;
import me.christianrobert.namereduce.semantic.SemanticModel;
import me.christianrobert.namereduce.syntax.SyntaxFactory;
import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import me.christianrobert.namereduce.syntax.util.NameSyntax;

import java.util.List;
import java.util.Optional;

/**
 * Expansion of dotted names to the fully qualified name of the type or member they bind to.
 *
 * <p>The traversal stops at tokens, import directives and dotted names, so only the
 * outermost dotted name of a chain is considered. Call sites keep their argument lists: only
 * the callee name is replaced. Names that do not bind, names of namespace declarations and
 * names bound to namespaces are left alone, and so is the member name to the right of a
 * non-name target ({@code Color} in {@code GetPen().Color}).</p>
 *
 * <p>Subclasses decide when a written name already is fully qualified and which spelling the
 * expanded name uses.</p>
 */
public abstract class AbstractNameExpander implements SyntaxExpander {

    @Override
    public boolean shouldExpandWithinNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel) {
        return !node.isToken()
                && node.getKind() != SyntaxKind.IMPORT_DIRECTIVE
                && !NameSyntax.isDottedName(node);
    }

    @Override
    public boolean shouldExpandNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel) {
        List<String> segments = NameSyntax.dottedSegments(node);
        if (segments == null || NameSyntax.isDeclarationName(node, tree) || NameSyntax.isRightOfDot(node, tree)) {
            return false;
        }
        Optional<ResolvedSymbol> symbol = semanticModel.getSymbol(node);
        if (!symbol.isPresent() || symbol.get().isNamespace()) {
            return false;
        }
        return !isFullyQualified(segments, symbol.get());
    }

    @Override
    public SyntaxNode expandNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel) {
        ResolvedSymbol symbol = semanticModel.getSymbol(node)
                .orElseThrow(() -> new ReductionException("Name does not resolve: " + node.getText(),
                        tree.getDocumentName(), node.getKind().name()));

        SyntaxKind kind = node.getKind();
        if (kind == SyntaxKind.IDENTIFIER_NAME) {
            kind = NameSyntax.isTypePosition(node, tree) ? SyntaxKind.QUALIFIED_NAME : SyntaxKind.MEMBER_ACCESS;
        }
        return SyntaxFactory.dottedName(kind, expandedSegments(node, symbol))
                .withTrailingTrivia(node.getTrailingTrivia())
                .withAdditionalAnnotations(node.getAnnotations());
    }

    /**
     * Whether the written segments already spell the symbol's fully qualified name.
     */
    protected abstract boolean isFullyQualified(List<String> writtenSegments, ResolvedSymbol symbol);

    /**
     * Segments of the expanded name.
     */
    protected abstract List<String> expandedSegments(SyntaxNode node, ResolvedSymbol symbol);
}
