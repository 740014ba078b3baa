package me.christianrobert.namereduce.context;

/**
 * Exception thrown while expanding or reducing qualified names.
 * Captures which document and which construct the failure belongs to.
 */
public class ReductionException extends RuntimeException {

    private final String documentName;
    private final String context;

    public ReductionException(String message) {
        super(message);
        this.documentName = null;
        this.context = null;
    }

    public ReductionException(String message, Throwable cause) {
        super(message, cause);
        this.documentName = null;
        this.context = null;
    }

    public ReductionException(String message, String documentName, String context) {
        super(message);
        this.documentName = documentName;
        this.context = context;
    }

    public ReductionException(String message, String documentName, String context, Throwable cause) {
        super(message, cause);
        this.documentName = documentName;
        this.context = context;
    }

    public String getDocumentName() {
        return documentName;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including document and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (documentName != null) {
            sb.append("\nDocument: ").append(documentName);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
