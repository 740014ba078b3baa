package me.christianrobert.namereduce.context;

import me.christianrobert.namereduce.SampleDocuments;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ReductionResultTest {

    @Test
    void successCollectsWarningsOfReducedTree() {
        SyntaxTree original = SampleDocuments.csharpProgram();
        SyntaxTree warned = WarningAnnotations.withDocumentWarning(original,
                new CompletionException(new IllegalStateException("oracle down")));

        ReductionResult result = ReductionResult.success(original, warned, false, true);

        assertTrue(result.isSuccess());
        assertTrue(result.hasWarnings());
        List<ConversionWarning> warnings = result.getWarnings();
        assertEquals(1, warnings.size());
        assertEquals(WarningAnnotations.DOCUMENT_FAILURE_TEXT + "java.lang.IllegalStateException: oracle down",
                warnings.get(0).getMessage());
        assertEquals("ReductionResult{success=true, document='Program.cs', warnings=1, simplifyFailed=true}",
                result.toString());
    }

    @Test
    void failureFromExceptionUsesDetailedMessage() {
        ReductionException exception = new ReductionException("Batch too large", "A.cs", "reduce.batch.max-documents");

        ReductionResult result = ReductionResult.failure("A.cs", exception);

        assertTrue(result.isFailure());
        assertEquals("Batch too large\nDocument: A.cs\nContext: reduce.batch.max-documents", result.getErrorMessage());
        assertFalse(result.hasWarnings());
        assertNull(result.getReducedTree());
    }

    @Test
    void nodeWarningsAreNotDocumentLevel() {
        SyntaxTree tree = SampleDocuments.csharpProgram();
        SyntaxNode firstImport = tree.getRoot().getChildren().get(0);
        SyntaxNode annotated = tree.getRoot().replaceNodes(List.of(firstImport),
                (original, rewritten) -> WarningAnnotations.withWarning(rewritten, "Conversion warning: test"));

        List<ConversionWarning> warnings = WarningAnnotations.collect(tree.withRoot(annotated));

        assertEquals(1, warnings.size());
        assertFalse(warnings.get(0).isDocumentLevel());
        assertEquals(0, WarningAnnotations.countWarnings(annotated));
    }
}
