package me.christianrobert.namereduce.expander;

import me.christianrobert.namereduce.SampleDocuments;
import me.christianrobert.namereduce.context.ConversionWarning;
import me.christianrobert.namereduce.context.WarningAnnotations;
import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.semantic.SemanticModel;
import me.christianrobert.namereduce.semantic.SemanticOracle;
import me.christianrobert.namereduce.semantic.SemanticOracleException;
import me.christianrobert.namereduce.semantic.index.IndexedSemanticOracle;
import me.christianrobert.namereduce.syntax.SyntaxFactory;
import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FailureIsolatingExpanderTest {

    private final SyntaxFactory f = SyntaxFactory.forGrammar(Grammar.CSHARP);

    private FailureIsolatingExpander expander;
    private IndexedSemanticOracle oracle;

    @BeforeEach
    void setUp() {
        expander = new FailureIsolatingExpander();
        oracle = new IndexedSemanticOracle(SampleDocuments.csharpIndex());
    }

    private SyntaxTree fiveCalls() {
        return f.tree("Calls.cs",
                f.importDirective("System"),
                f.expressionStatement(f.invocation(f.memberAccess("Console.Write"), f.literal("\"a\""))),
                f.expressionStatement(f.invocation(f.memberAccess("Console.WriteLine"), f.literal("\"b\""))),
                f.expressionStatement(f.invocation(f.memberAccess("Console.ReadLine"))),
                f.expressionStatement(f.invocation(f.memberAccess("Console.Write"), f.literal("\"c\""))),
                f.expressionStatement(f.invocation(f.memberAccess("Console.WriteLine"), f.literal("\"d\""))));
    }

    // ==================== SUCCESSFUL EXPANSION ====================

    @Test
    void expandsEveryBoundName() {
        SyntaxTree expanded = expander.expand(SampleDocuments.csharpProgram(), oracle, CSharpNameExpander.INSTANCE).join();

        assertEquals("using System;\n"
                + "using System.Text;\n"
                + "namespace App {\n"
                + "class Program {\n"
                + "void Run() {\n"
                + "System.Text.StringBuilder sb = new System.Text.StringBuilder();\n"
                + "System.Console.WriteLine(sb);\n"
                + "}\n"
                + "}\n"
                + "}\n", expanded.getText());
        assertTrue(WarningAnnotations.collect(expanded).isEmpty());
    }

    @Test
    void expandingTwiceChangesNothing() {
        SyntaxTree once = expander.expand(SampleDocuments.csharpProgram(), oracle, CSharpNameExpander.INSTANCE).join();
        SyntaxTree twice = expander.expand(once, oracle, CSharpNameExpander.INSTANCE).join();

        assertEquals(once.getText(), twice.getText());
    }

    // ==================== NODE FAILURES ====================

    @Test
    void failingNodeKeepsItsTextAndOthersExpand() {
        SyntaxExpander failingOnReadLine = new CSharpNameExpander() {
            @Override
            public SyntaxNode expandNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel) {
                if (node.getText().endsWith("ReadLine")) {
                    throw new IllegalStateException("boom");
                }
                return super.expandNode(node, tree, semanticModel);
            }
        };

        SyntaxTree expanded = expander.expand(fiveCalls(), oracle, failingOnReadLine).join();

        assertEquals("using System;\n"
                + "System.Console.Write(\"a\");\n"
                + "System.Console.WriteLine(\"b\");\n"
                + "Console.ReadLine();\n"
                + "System.Console.Write(\"c\");\n"
                + "System.Console.WriteLine(\"d\");\n", expanded.getText());

        List<ConversionWarning> warnings = WarningAnnotations.collect(expanded);
        assertEquals(1, warnings.size());
        ConversionWarning warning = warnings.get(0);
        assertFalse(warning.isDocumentLevel());
        assertEquals(SyntaxKind.MEMBER_ACCESS, warning.getNodeKind());
        assertTrue(warning.getMessage().startsWith("Conversion warning: failed to convert MEMBER_ACCESS"));
        assertTrue(warning.getMessage().contains("boom"));
        assertTrue(warning.getMessage().contains("Source: Console.ReadLine"));
    }

    @Test
    void failingOuterNodeKeepsInnerExpansions() {
        SyntaxExpander failingOnInvocation = new CSharpNameExpander() {
            @Override
            public boolean shouldExpandNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel) {
                return node.getKind() == SyntaxKind.INVOCATION
                        || (node.getKind() == SyntaxKind.MEMBER_ACCESS && super.shouldExpandNode(node, tree, semanticModel));
            }

            @Override
            public SyntaxNode expandNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel) {
                if (node.getKind() == SyntaxKind.INVOCATION) {
                    throw new IllegalStateException("call shape not supported");
                }
                return super.expandNode(node, tree, semanticModel);
            }
        };
        SyntaxTree tree = f.tree("Call.cs", f.importDirective("System"),
                f.expressionStatement(f.invocation(f.memberAccess("Console.Write"), f.literal("\"a\""))));

        SyntaxTree expanded = expander.expand(tree, oracle, failingOnInvocation).join();

        assertEquals("using System;\nSystem.Console.Write(\"a\");\n", expanded.getText());
        List<ConversionWarning> warnings = WarningAnnotations.collect(expanded);
        assertEquals(1, warnings.size());
        assertEquals(SyntaxKind.INVOCATION, warnings.get(0).getNodeKind());
        assertTrue(warnings.get(0).getMessage().contains("Source: Console.Write(\"a\")"));
    }

    @Test
    void missingExpansionIsNodeFailure() {
        SyntaxExpander returningNothing = new CSharpNameExpander() {
            @Override
            public SyntaxNode expandNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel) {
                return null;
            }
        };

        SyntaxTree expanded = expander.expand(fiveCalls(), oracle, returningNothing).join();

        assertEquals(fiveCalls().getText(), expanded.getText());
        List<ConversionWarning> warnings = WarningAnnotations.collect(expanded);
        assertEquals(5, warnings.size());
        assertTrue(warnings.get(0).getMessage().contains("Expansion produced no node"));
    }

    // ==================== DOCUMENT FAILURES ====================

    @Test
    void semanticModelFailureReturnsInputWithDocumentWarning() {
        SemanticOracle failing = mock(SemanticOracle.class);
        when(failing.getSemanticModel(any()))
                .thenReturn(CompletableFuture.failedFuture(new SemanticOracleException("no compilation")));
        SyntaxTree tree = fiveCalls();

        SyntaxTree result = expander.expand(tree, failing, CSharpNameExpander.INSTANCE).join();

        assertEquals(tree.getText(), result.getText());
        assertTrue(result.getRoot().isEquivalentTo(tree.getRoot()));
        List<ConversionWarning> warnings = WarningAnnotations.collect(result);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).isDocumentLevel());
        assertTrue(warnings.get(0).getMessage().startsWith(WarningAnnotations.DOCUMENT_FAILURE_TEXT));
        assertTrue(warnings.get(0).getMessage().contains("no compilation"));
    }

    @Test
    void thrownSemanticModelFailureIsDocumentFailure() {
        SemanticOracle failing = mock(SemanticOracle.class);
        when(failing.getSemanticModel(any())).thenThrow(new IllegalStateException("analyzer crashed"));

        SyntaxTree result = expander.expand(fiveCalls(), failing, CSharpNameExpander.INSTANCE).join();

        assertEquals(1, WarningAnnotations.countWarnings(result.getRoot()));
    }

    @Test
    void nullSemanticModelIsDocumentFailure() {
        SemanticOracle failing = mock(SemanticOracle.class);
        when(failing.getSemanticModel(any())).thenReturn(CompletableFuture.completedFuture(null));

        SyntaxTree result = expander.expand(fiveCalls(), failing, CSharpNameExpander.INSTANCE).join();

        assertEquals(1, WarningAnnotations.countWarnings(result.getRoot()));
        assertTrue(WarningAnnotations.collect(result).get(0).getMessage().contains("Oracle returned no semantic model"));
    }

    @Test
    void selectionFailureDiscardsNodeLevelWork() {
        SyntaxExpander failingSelection = new CSharpNameExpander() {
            @Override
            public boolean shouldExpandNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel) {
                if (node.getText().endsWith("ReadLine")) {
                    throw new IllegalStateException("selection broke");
                }
                return super.shouldExpandNode(node, tree, semanticModel);
            }
        };
        SyntaxTree tree = fiveCalls();

        SyntaxTree result = expander.expand(tree, oracle, failingSelection).join();

        assertEquals(tree.getText(), result.getText());
        List<ConversionWarning> warnings = WarningAnnotations.collect(result);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).isDocumentLevel());
        assertTrue(warnings.get(0).getMessage().contains("selection broke"));
    }

    @Test
    void rejectsMissingArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> expander.expand(null, oracle, CSharpNameExpander.INSTANCE));
        assertThrows(IllegalArgumentException.class,
                () -> expander.expand(fiveCalls(), null, CSharpNameExpander.INSTANCE));
        assertThrows(IllegalArgumentException.class,
                () -> expander.expand(fiveCalls(), oracle, null));
    }
}
