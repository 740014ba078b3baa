package me.christianrobert.namereduce.semantic;

public enum SymbolKind {
    NAMESPACE,
    TYPE,
    MEMBER
}
