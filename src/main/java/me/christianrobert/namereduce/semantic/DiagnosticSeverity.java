package me.christianrobert.namereduce.semantic;

public enum DiagnosticSeverity {
    HIDDEN,
    INFO,
    WARNING,
    ERROR
}
