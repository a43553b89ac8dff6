package com.github.rewrite.mvvm.match;

import lombok.Value;
import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.Expression;
import org.openrewrite.java.tree.J;

import java.util.List;

/**
 * A getter exposing a lazily created {@code DelegateCommand}, with everything
 * recovered from it and from the conventional execute/can-execute methods.
 */
@Value
public class DelegateCommandProperty implements PropertyMatch {

    String propertyName;

    J.MethodDeclaration getter;

    /**
     * Capitalised property name without the trailing {@code Command}, e.g. {@code Save}.
     */
    String strippedName;

    @Nullable
    String backingFieldName;

    /**
     * Parameters of the first lambda in the getter; empty when there is no lambda.
     */
    List<CommandParameter> parameters;

    /**
     * Body of the first lambda, null when there is no lambda or its body is not a single expression
     * (a block lambda qualifies only when it holds exactly one expression statement).
     */
    @Nullable
    Expression commandBody;

    /**
     * Whether the lambda body (or the execute method) produces a {@code CompletionStage}.
     */
    boolean async;

    J.@Nullable MethodDeclaration executeMethod;

    J.@Nullable MethodDeclaration canExecuteMethod;

    /**
     * Member the generated command consults before executing, null when there is no can-execute method.
     */
    @Nullable
    String canExecuteTargetName;

    /**
     * Whether the can-execute method only returns a member and may be deleted.
     */
    boolean canExecuteRemovable;

    @Override
    public Kind getKind() {
        return Kind.DELEGATE_COMMAND;
    }

    @Override
    public J.MethodDeclaration getReportedAccessor() {
        return getter;
    }

    /**
     * Execute/can-execute shape, as opposed to the lambda shape.
     */
    public boolean usesExecuteMethod() {
        return executeMethod != null;
    }

    public boolean isFixable() {
        return executeMethod != null || commandBody != null;
    }

    /**
     * Name of the method annotated with {@code @RelayCommand}, e.g. {@code save} or {@code saveAsync}.
     */
    public String getCommandMethodName() {
        return BeanProperties.decapitalize(strippedName) + (async ? "Async" : "");
    }

    public String getExecuteMethodName() {
        return DelegateCommandExtractor.EXECUTE_PREFIX + strippedName;
    }

    public int getCommandArity() {
        return executeMethod != null ? BeanProperties.parameters(executeMethod).size() : parameters.size();
    }
}
