package me.christianrobert.namereduce.semantic.index;

import me.christianrobert.namereduce.SampleDocuments;
import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.semantic.Diagnostic;
import me.christianrobert.namereduce.semantic.SemanticModel;
import me.christianrobert.namereduce.semantic.SemanticOracleException;
import me.christianrobert.namereduce.syntax.SyntaxAnnotation;
import me.christianrobert.namereduce.syntax.SyntaxFactory;
import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class IndexedSemanticOracleTest {

    private final SyntaxFactory csharp = SyntaxFactory.forGrammar(Grammar.CSHARP);
    private final SyntaxFactory vb = SyntaxFactory.forGrammar(Grammar.VISUAL_BASIC);

    // ==================== DIAGNOSTICS ====================

    @Test
    void minimalProgramHasNoDiagnostics() {
        IndexedSemanticOracle oracle = new IndexedSemanticOracle(SampleDocuments.csharpIndex());

        List<Diagnostic> diagnostics = oracle.getDiagnostics(SampleDocuments.csharpProgram()).join();

        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void reportsUnknownImportAndUnresolvedTypeName() {
        IndexedSemanticOracle oracle = new IndexedSemanticOracle(SampleDocuments.csharpIndex());
        SyntaxTree tree = csharp.tree("Legacy.cs",
                csharp.importDirective("System"),
                csharp.importDirective("Legacy.Data"),
                csharp.localDeclaration(csharp.identifierName("Widget"), "w", null));

        List<Diagnostic> diagnostics = oracle.getDiagnostics(tree).join();

        assertEquals(2, diagnostics.size());
        assertEquals("CS0246", diagnostics.get(0).getId());
        assertTrue(diagnostics.get(0).isInSource());
        assertEquals("Legacy.Data", tree.findNode(diagnostics.get(0).getSpan()).getText());
        assertEquals("Widget", tree.findNode(diagnostics.get(1).getSpan()).getText());
        assertTrue(diagnostics.get(1).getMessage().contains("'Widget'"));
    }

    @Test
    void visualBasicDiagnosticsUseVisualBasicId() {
        IndexedSemanticOracle oracle = new IndexedSemanticOracle(SampleDocuments.visualBasicIndex());
        SyntaxTree tree = vb.tree("Legacy.vb", vb.importDirective("Legacy.Data"));

        List<Diagnostic> diagnostics = oracle.getDiagnostics(tree).join();

        assertEquals(1, diagnostics.size());
        assertEquals("BC30002", diagnostics.get(0).getId());
        assertEquals("Type 'Legacy.Data' is not defined.", diagnostics.get(0).getMessage());
    }

    @Test
    void grammarMismatchFailsTheWholeRequest() {
        IndexedSemanticOracle oracle = new IndexedSemanticOracle(SampleDocuments.csharpIndex());

        CompletionException thrown = assertThrows(CompletionException.class,
                () -> oracle.getDiagnostics(SampleDocuments.visualBasicProgram()).join());

        assertTrue(thrown.getCause() instanceof SemanticOracleException);
        assertTrue(thrown.getCause().getMessage().contains("Visual Basic"));
    }

    // ==================== SEMANTIC MODEL ====================

    @Test
    void semanticModelResolvesNamesOfItsSnapshot() {
        IndexedSemanticOracle oracle = new IndexedSemanticOracle(SampleDocuments.csharpIndex());
        SyntaxTree tree = SampleDocuments.csharpProgram();

        SemanticModel model = oracle.getSemanticModel(tree).join();
        SyntaxNode callee = tree.getRoot().descendantNodes().stream()
                .filter(node -> node.getKind() == SyntaxKind.MEMBER_ACCESS)
                .findFirst()
                .orElseThrow();

        assertSame(tree, model.getSyntaxTree());
        assertEquals("System.Console.WriteLine", model.getSymbol(callee).orElseThrow().getQualifiedName());
        assertFalse(model.getSymbol(csharp.memberAccess("Console.WriteLine")).isPresent());
    }

    @Test
    void namespaceDeclarationNamesHaveNoSymbol() {
        IndexedSemanticOracle oracle = new IndexedSemanticOracle(SampleDocuments.csharpIndex());
        SyntaxTree tree = SampleDocuments.csharpProgram();
        SyntaxNode namespaceName = tree.getRoot().getFirstChild(SyntaxKind.NAMESPACE_DECLARATION).getFirstNameChild();

        SemanticModel model = oracle.getSemanticModel(tree).join();

        assertFalse(model.getSymbol(namespaceName).isPresent());
    }

    // ==================== REDUCTION ====================

    @Test
    void reductionShortensOnlyMarkedNamesAndRemovesMarkers() {
        IndexedSemanticOracle oracle = new IndexedSemanticOracle(SampleDocuments.csharpIndex());
        SyntaxNode marked = csharp.expressionStatement(
                        csharp.invocation(csharp.memberAccess("System.Console.WriteLine"), csharp.literal("1")))
                .withAdditionalAnnotations(SyntaxAnnotation.SIMPLIFIER_MARKER);
        SyntaxNode unmarked = csharp.expressionStatement(
                csharp.invocation(csharp.memberAccess("System.Console.WriteLine"), csharp.literal("2")));
        SyntaxTree tree = csharp.tree("A.cs", csharp.importDirective("System"), marked, unmarked);

        SyntaxTree reduced = oracle.reduceToMinimalForm(tree).join();

        assertEquals("using System;\nConsole.WriteLine(1);\nSystem.Console.WriteLine(2);\n", reduced.getText());
        assertTrue(reduced.getRoot().descendantNodesAndSelf().stream()
                .noneMatch(node -> node.hasAnnotations(SyntaxAnnotation.SIMPLIFY_KIND)));
    }

    @Test
    void reductionKeepsWarningsOfShortenedNames() {
        IndexedSemanticOracle oracle = new IndexedSemanticOracle(SampleDocuments.csharpIndex());
        SyntaxNode warned = csharp.memberAccess("System.Console.ReadLine")
                .withAdditionalAnnotations(SyntaxAnnotation.conversionWarning("kept"));
        SyntaxTree tree = csharp.tree("A.cs", csharp.importDirective("System"),
                csharp.expressionStatement(csharp.invocation(warned))
                        .withAdditionalAnnotations(SyntaxAnnotation.SIMPLIFIER_MARKER));

        SyntaxTree reduced = oracle.reduceToMinimalForm(tree).join();
        SyntaxNode shortened = reduced.getRoot().descendantNodes().stream()
                .filter(node -> node.getKind() == SyntaxKind.MEMBER_ACCESS)
                .findFirst()
                .orElseThrow();

        assertEquals("Console.ReadLine", shortened.getText());
        assertTrue(shortened.hasAnnotations(SyntaxAnnotation.CONVERSION_WARNING_KIND));
    }
}
