package me.christianrobert.namereduce.semantic.index;

import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.semantic.Diagnostic;
import me.christianrobert.namereduce.semantic.ResolvedSymbol;
import me.christianrobert.namereduce.semantic.SemanticModel;
import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import me.christianrobert.namereduce.syntax.util.NameSyntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Semantic model backed by a {@link SymbolIndex}.
 *
 * <p>Reports one diagnostic (with the grammar's unresolved-type id) for every import directive
 * naming an unknown namespace and for every name in a type position that does not bind.</p>
 */
public class IndexedSemanticModel implements SemanticModel {

    private final SyntaxTree tree;
    private final NameResolver resolver;
    private final List<Diagnostic> diagnostics;

    public IndexedSemanticModel(SymbolIndex index, SyntaxTree tree) {
        this.tree = tree;
        this.resolver = new NameResolver(index, tree);
        this.diagnostics = Collections.unmodifiableList(computeDiagnostics());
    }

    @Override
    public SyntaxTree getSyntaxTree() {
        return tree;
    }

    public NameResolver getResolver() {
        return resolver;
    }

    @Override
    public Optional<ResolvedSymbol> getSymbol(SyntaxNode node) {
        if (!tree.contains(node) || NameSyntax.isDeclarationName(node, tree) || NameSyntax.isRightOfDot(node, tree)) {
            return Optional.empty();
        }
        return Optional.ofNullable(resolver.resolve(node));
    }

    @Override
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private List<Diagnostic> computeDiagnostics() {
        Grammar grammar = tree.getGrammar();
        String diagnosticId = grammar.getUnresolvedTypeDiagnosticId();
        List<Diagnostic> result = new ArrayList<>();

        for (SyntaxNode node : tree.getRoot().descendantNodes()) {
            if (node.getKind() == SyntaxKind.IMPORT_DIRECTIVE) {
                SyntaxNode name = node.getFirstNameChild();
                if (name != null && resolver.resolveImport(node) == null) {
                    result.add(Diagnostic.error(diagnosticId, tree.getSpan(name), unresolvedMessage(grammar, name)));
                }
            } else if (NameSyntax.isTypePosition(node, tree) && resolver.resolve(node) == null) {
                result.add(Diagnostic.error(diagnosticId, tree.getSpan(node), unresolvedMessage(grammar, node)));
            }
        }
        return result;
    }

    private static String unresolvedMessage(Grammar grammar, SyntaxNode name) {
        if (grammar == Grammar.CSHARP) {
            return "The type or namespace name '" + name.getText()
                    + "' could not be found (are you missing a using directive or an assembly reference?)";
        }
        return "Type '" + name.getText() + "' is not defined.";
    }
}
