package dev.lemma.expr;

public enum BinderInfo {
    DEFAULT,
    IMPLICIT,
    STRICT_IMPLICIT,
    INST_IMPLICIT
}
