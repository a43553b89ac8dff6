package com.github.rewrite.mvvm.match;

import lombok.Value;
import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.TypeTree;

import java.util.List;

/**
 * A bean property whose setter raises change notifications by hand.
 */
@Value
public class NotifiedProperty implements PropertyMatch {

    String propertyName;

    J.MethodDeclaration setter;

    J.@Nullable MethodDeclaration getter;

    /**
     * Field last written by the setter, null when the setter writes none.
     */
    @Nullable
    String backingFieldName;

    /**
     * Other properties announced by the setter, in first-seen order, without duplicates.
     */
    List<String> notifyTargets;

    /**
     * Declared type of the setter parameter.
     */
    @Nullable
    TypeTree propertyType;

    @Override
    public Kind getKind() {
        return Kind.NOTIFIED_PROPERTY;
    }

    @Override
    public J.MethodDeclaration getReportedAccessor() {
        return setter;
    }
}
