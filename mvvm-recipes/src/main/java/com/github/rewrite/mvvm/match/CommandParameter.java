package com.github.rewrite.mvvm.match;

import lombok.Value;
import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.JavaType;
import org.openrewrite.java.tree.TypeTree;

/**
 * A parameter of the command lambda.
 * <p>
 * Explicitly typed parameters keep their {@code typeExpression}. For implicitly typed ones
 * the type is rebuilt from attribution as {@code typeName}, {@code Object} when unresolved.
 */
@Value
public class CommandParameter {

    String name;

    @Nullable
    TypeTree typeExpression;

    String typeName;

    @Nullable
    JavaType type;

    /**
     * Fully qualified name to import for a rebuilt type, null when none is needed.
     */
    @Nullable
    String importType;
}
