package me.christianrobert.namereduce.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.namereduce.config.service.ConfigService;
import me.christianrobert.namereduce.context.ReductionException;
import me.christianrobert.namereduce.context.ReductionResult;
import me.christianrobert.namereduce.context.WarningAnnotations;
import me.christianrobert.namereduce.core.tools.FutureUtils;
import me.christianrobert.namereduce.expander.CSharpNameExpander;
import me.christianrobert.namereduce.expander.FailureIsolatingExpander;
import me.christianrobert.namereduce.expander.SyntaxExpander;
import me.christianrobert.namereduce.expander.VisualBasicNameExpander;
import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.reducer.SelectiveSimplifier;
import me.christianrobert.namereduce.reducer.exclusion.UnsafeShapeRule;
import me.christianrobert.namereduce.reducer.exclusion.UnsafeShapeTable;
import me.christianrobert.namereduce.semantic.SemanticOracle;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import me.christianrobert.namereduce.syntax.util.SyntaxTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Qualified-name pipeline for translated documents.
 *
 * <p>Each document goes through two phases, strictly one after the other:</p>
 * <pre>
 * translated tree → expand (FailureIsolatingExpander) → simplify (SelectiveSimplifier) → reduced tree
 *                        ↑ SyntaxExpander per grammar        ↑ UnsafeShapeRule per grammar
 * </pre>
 *
 * <p>The simplify phase asks the oracle about the expanded tree, never about the input. Both
 * phases record failures as conversion warnings in the tree, so {@link #reduce} always
 * produces a tree for a valid input; its result tells which phase (if any) failed.</p>
 *
 * <p>Phases can be switched off with the {@code reduce.expand-enabled} and
 * {@code reduce.simplify-enabled} configuration keys.</p>
 */
@ApplicationScoped
public class NameReductionService {

    private static final Logger log = LoggerFactory.getLogger(NameReductionService.class);

    @Inject
    ConfigService configService;

    private final FailureIsolatingExpander expander = new FailureIsolatingExpander();

    // Unsafe shapes per grammar, replaceable at runtime
    private final Map<Grammar, UnsafeShapeRule> unsafeShapeRules = new ConcurrentHashMap<>();

    public NameReductionService() {
        for (Grammar grammar : Grammar.values()) {
            unsafeShapeRules.put(grammar, UnsafeShapeTable.forGrammar(grammar));
        }
    }

    // ==================== POLICY SELECTION ====================

    public SyntaxExpander getExpander(Grammar grammar) {
        switch (grammar) {
            case CSHARP:
                return CSharpNameExpander.INSTANCE;
            case VISUAL_BASIC:
                return VisualBasicNameExpander.INSTANCE;
            default:
                throw new IllegalArgumentException("No expander for grammar: " + grammar);
        }
    }

    public UnsafeShapeRule getUnsafeShapeRule(Grammar grammar) {
        return unsafeShapeRules.get(grammar);
    }

    /**
     * Replaces the unsafe-shape rule used when simplifying documents of a grammar.
     */
    public void registerUnsafeShapeRule(Grammar grammar, UnsafeShapeRule rule) {
        if (grammar == null || rule == null) {
            throw new IllegalArgumentException("Grammar and unsafe shape rule are required");
        }
        UnsafeShapeRule previous = unsafeShapeRules.put(grammar, rule);
        log.info("Unsafe shape rule for {} replaced: {} -> {}", grammar.getDisplayName(), previous, rule);
    }

    /**
     * Diagnostic id marking an unresolved type or namespace name, configurable per grammar.
     */
    public String getUnresolvedDiagnosticId(Grammar grammar) {
        String key = grammar == Grammar.CSHARP
                ? ConfigService.CSHARP_UNRESOLVED_DIAGNOSTIC_ID
                : ConfigService.VB_UNRESOLVED_DIAGNOSTIC_ID;
        String configured = configService != null ? configService.getConfigValueAsString(key) : null;
        if (configured == null || configured.trim().isEmpty()) {
            return grammar.getUnresolvedTypeDiagnosticId();
        }
        return configured.trim();
    }

    // ==================== PHASES ====================

    /**
     * Expands names to their fully qualified form using the grammar's expansion policy.
     */
    public CompletableFuture<SyntaxTree> expand(SyntaxTree tree, SemanticOracle oracle) {
        return expander.expand(tree, oracle, getExpander(tree.getGrammar()));
    }

    /**
     * Shortens names to their minimal form, leaving the grammar's unsafe shapes alone.
     */
    public CompletableFuture<SyntaxTree> simplify(SyntaxTree tree, SemanticOracle oracle) {
        Grammar grammar = tree.getGrammar();
        SelectiveSimplifier simplifier = new SelectiveSimplifier(getUnsafeShapeRule(grammar));
        return simplifier.simplify(tree, oracle, getUnresolvedDiagnosticId(grammar));
    }

    // ==================== PIPELINE ====================

    public CompletableFuture<ReductionResult> reduce(SyntaxTree tree, SemanticOracle oracle) {
        return reduce(tree, oracle, false);
    }

    /**
     * Runs expansion and then simplification on one document.
     *
     * @param tree Translated document
     * @param oracle Semantic oracle for the document's grammar
     * @param includeTreeDump Whether to include the formatted reduced tree (for debugging)
     * @return Future that always completes normally
     */
    public CompletableFuture<ReductionResult> reduce(SyntaxTree tree, SemanticOracle oracle, boolean includeTreeDump) {
        if (tree == null) {
            return CompletableFuture.completedFuture(ReductionResult.failure(null, "Syntax tree cannot be null"));
        }
        if (oracle == null) {
            return CompletableFuture.completedFuture(
                    ReductionResult.failure(tree.getDocumentName(), "Semantic oracle cannot be null"));
        }

        boolean expandEnabled = isEnabled(ConfigService.EXPAND_ENABLED);
        boolean simplifyEnabled = isEnabled(ConfigService.SIMPLIFY_ENABLED);
        log.debug("Reducing names in {} ({}, expand={}, simplify={})", tree.getDocumentName(),
                tree.getGrammar().getDisplayName(), expandEnabled, simplifyEnabled);

        int initialWarnings = WarningAnnotations.countWarnings(tree.getRoot());
        CompletableFuture<SyntaxTree> expanded = expandEnabled
                ? expand(tree, oracle)
                : CompletableFuture.completedFuture(tree);

        return expanded.thenCompose(expandedTree -> {
            int expandedWarnings = WarningAnnotations.countWarnings(expandedTree.getRoot());
            boolean expandFailed = expandedWarnings > initialWarnings;
            CompletableFuture<SyntaxTree> simplified = simplifyEnabled
                    ? simplify(expandedTree, oracle)
                    : CompletableFuture.completedFuture(expandedTree);

            return simplified.thenApply(reducedTree -> {
                boolean simplifyFailed = WarningAnnotations.countWarnings(reducedTree.getRoot()) > expandedWarnings;
                if (expandFailed || simplifyFailed) {
                    log.info("Reduced {} with document-level failures (expand failed: {}, simplify failed: {})",
                            tree.getDocumentName(), expandFailed, simplifyFailed);
                }
                if (includeTreeDump) {
                    return ReductionResult.successWithTreeDump(tree, reducedTree, expandFailed, simplifyFailed,
                            SyntaxTreeFormatter.format(reducedTree));
                }
                return ReductionResult.success(tree, reducedTree, expandFailed, simplifyFailed);
            });
        }).exceptionally(error -> {
            Throwable cause = FutureUtils.unwrap(error);
            log.error("Name reduction pipeline failed for {}", tree.getDocumentName(), cause);
            if (cause instanceof ReductionException) {
                return ReductionResult.failure(tree.getDocumentName(), (ReductionException) cause);
            }
            return ReductionResult.failure(tree.getDocumentName(), "Name reduction failed: " + cause);
        });
    }

    private boolean isEnabled(String key) {
        Boolean value = configService != null ? configService.getConfigValueAsBoolean(key) : null;
        return value == null || value;
    }
}
