package org.tricoteuses.amendment.tree;

public enum ActionKind {
    CREATE,
    REPLACE,
    DELETE,
    CREATE_OR_REPLACE
}
