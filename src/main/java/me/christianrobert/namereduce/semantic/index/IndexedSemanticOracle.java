package me.christianrobert.namereduce.semantic.index;

import me.christianrobert.namereduce.semantic.Diagnostic;
import me.christianrobert.namereduce.semantic.SemanticModel;
import me.christianrobert.namereduce.semantic.SemanticOracle;
import me.christianrobert.namereduce.semantic.SemanticOracleException;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * {@link SemanticOracle} answering from a {@link SymbolIndex} of the converted project.
 *
 * <p>All work runs on the given executor. A request for a document written in a grammar
 * other than the index's completes exceptionally with a {@link SemanticOracleException}.</p>
 */
public class IndexedSemanticOracle implements SemanticOracle {

    private static final Logger log = LoggerFactory.getLogger(IndexedSemanticOracle.class);

    private final SymbolIndex index;
    private final Executor executor;
    private final MinimalFormReducer reducer;

    public IndexedSemanticOracle(SymbolIndex index) {
        this(index, ForkJoinPool.commonPool());
    }

    public IndexedSemanticOracle(SymbolIndex index, Executor executor) {
        if (index == null) {
            throw new IllegalArgumentException("Symbol index cannot be null");
        }
        this.index = index;
        this.executor = executor;
        this.reducer = new MinimalFormReducer(index);
    }

    public SymbolIndex getIndex() {
        return index;
    }

    @Override
    public CompletableFuture<List<Diagnostic>> getDiagnostics(SyntaxTree tree) {
        return CompletableFuture.supplyAsync(() -> {
            List<Diagnostic> diagnostics = createModel(tree).getDiagnostics();
            log.debug("Found {} diagnostics in {}", diagnostics.size(), tree.getDocumentName());
            return diagnostics;
        }, executor);
    }

    @Override
    public CompletableFuture<SemanticModel> getSemanticModel(SyntaxTree tree) {
        return CompletableFuture.supplyAsync(() -> createModel(tree), executor);
    }

    @Override
    public CompletableFuture<SyntaxTree> reduceToMinimalForm(SyntaxTree markedTree) {
        return CompletableFuture.supplyAsync(() -> {
            checkGrammar(markedTree);
            return reducer.reduce(markedTree);
        }, executor);
    }

    private IndexedSemanticModel createModel(SyntaxTree tree) {
        checkGrammar(tree);
        return new IndexedSemanticModel(index, tree);
    }

    private void checkGrammar(SyntaxTree tree) {
        if (tree.getGrammar() != index.getGrammar()) {
            throw new SemanticOracleException(
                    "Symbol index for " + index.getGrammar().getDisplayName() + " cannot analyze a "
                            + tree.getGrammar().getDisplayName() + " document",
                    tree.getDocumentName(), "grammar mismatch");
        }
    }
}
