package com.github.rewrite.mvvm.match;

import lombok.Value;
import org.openrewrite.java.tree.J;

@Value
public class SimpleCommandProperty implements PropertyMatch {

    String propertyName;

    J.MethodDeclaration getter;

    @Override
    public Kind getKind() {
        return Kind.SIMPLE_COMMAND;
    }

    @Override
    public J.MethodDeclaration getReportedAccessor() {
        return getter;
    }
}
