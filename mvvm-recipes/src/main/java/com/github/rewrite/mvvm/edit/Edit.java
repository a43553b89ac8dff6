package com.github.rewrite.mvvm.edit;

import lombok.EqualsAndHashCode;
import lombok.Value;
import org.openrewrite.java.tree.Statement;

import java.util.UUID;

/**
 * One change to a class body. Members are addressed by their tree id so that a plan
 * can be checked against the class it is applied to.
 */
public abstract class Edit {

    private Edit() {
    }

    /**
     * Inserts {@code node} directly before the member {@code beforeId}.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Insert extends Edit {
        UUID beforeId;
        Statement node;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Remove extends Edit {
        UUID id;
    }

    /**
     * Replaces the member {@code id} by {@code node}; the replacement keeps the member's leading whitespace.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Replace extends Edit {
        UUID id;
        Statement node;
    }

    /**
     * Requests an import of {@code fullyQualifiedName}; applied by the visitor, not the class body editor.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class EnsureImport extends Edit {
        String fullyQualifiedName;
    }
}
