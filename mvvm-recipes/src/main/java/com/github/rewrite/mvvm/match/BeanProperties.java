package com.github.rewrite.mvvm.match;

import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Java bean naming helpers and accessor lookups on a class body.
 * <p>
 * A bean property {@code name} is declared by {@code getName()}/{@code isName()} and
 * {@code setName(T)}. Only members declared directly in the class body are considered.
 */
public final class BeanProperties {

    public static final String COMMAND_SUFFIX = "Command";

    private BeanProperties() {
    }

    /**
     * Property name for a setter, or null when the method is not a setter with a body.
     */
    public static @Nullable String setterPropertyName(J.MethodDeclaration method) {
        if (method.isConstructor() || method.getBody() == null || isStatic(method)) {
            return null;
        }
        if (parameters(method).size() != 1) {
            return null;
        }
        return accessorSuffix(method.getSimpleName(), "set");
    }

    /**
     * Property name for a getter ({@code getX()} or {@code isX()}), or null.
     */
    public static @Nullable String getterPropertyName(J.MethodDeclaration method) {
        if (method.isConstructor() || isStatic(method) || !parameters(method).isEmpty()) {
            return null;
        }
        TypeTree returnType = method.getReturnTypeExpression();
        if (returnType instanceof J.Primitive &&
            ((J.Primitive) returnType).getType() == JavaType.Primitive.Void) {
            return null;
        }
        String name = accessorSuffix(method.getSimpleName(), "get");
        if (name == null) {
            name = accessorSuffix(method.getSimpleName(), "is");
        }
        return name;
    }

    private static @Nullable String accessorSuffix(String methodName, String prefix) {
        if (methodName.length() <= prefix.length() || !methodName.startsWith(prefix)) {
            return null;
        }
        char first = methodName.charAt(prefix.length());
        if (!Character.isUpperCase(first) && first != '_') {
            return null;
        }
        return decapitalize(methodName.substring(prefix.length()));
    }

    /**
     * Finds the getter of a property in the class body.
     */
    public static J.@Nullable MethodDeclaration findGetter(J.ClassDeclaration classDecl, String propertyName) {
        for (Statement statement : classDecl.getBody().getStatements()) {
            if (statement instanceof J.MethodDeclaration) {
                J.MethodDeclaration method = (J.MethodDeclaration) statement;
                if (propertyName.equals(getterPropertyName(method))) {
                    return method;
                }
            }
        }
        return null;
    }

    /**
     * Finds a method by exact name in the class body.
     */
    public static J.@Nullable MethodDeclaration findMethod(J.ClassDeclaration classDecl, String name) {
        for (Statement statement : classDecl.getBody().getStatements()) {
            if (statement instanceof J.MethodDeclaration &&
                name.equals(((J.MethodDeclaration) statement).getSimpleName())) {
                return (J.MethodDeclaration) statement;
            }
        }
        return null;
    }

    /**
     * Whether the class body declares a method with the given name and parameter count.
     */
    public static boolean declaresMethod(J.ClassDeclaration classDecl, String name, int parameterCount) {
        for (Statement statement : classDecl.getBody().getStatements()) {
            if (statement instanceof J.MethodDeclaration) {
                J.MethodDeclaration method = (J.MethodDeclaration) statement;
                if (name.equals(method.getSimpleName()) && parameters(method).size() == parameterCount) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Finds the field declaration declaring a variable with the given name.
     */
    public static J.@Nullable VariableDeclarations findField(J.ClassDeclaration classDecl, String fieldName) {
        for (Statement statement : classDecl.getBody().getStatements()) {
            if (statement instanceof J.VariableDeclarations) {
                J.VariableDeclarations field = (J.VariableDeclarations) statement;
                for (J.VariableDeclarations.NamedVariable variable : field.getVariables()) {
                    if (fieldName.equals(variable.getSimpleName())) {
                        return field;
                    }
                }
            }
        }
        return null;
    }

    /**
     * Declared parameters of a method, without the {@link J.Empty} placeholder of {@code ()}.
     */
    public static List<J.VariableDeclarations> parameters(J.MethodDeclaration method) {
        List<J.VariableDeclarations> parameters = new ArrayList<>();
        for (Statement parameter : method.getParameters()) {
            if (parameter instanceof J.VariableDeclarations) {
                parameters.add((J.VariableDeclarations) parameter);
            }
        }
        return parameters;
    }

    /**
     * Name of the field denoted by {@code name} or {@code this.name}, otherwise null.
     */
    public static @Nullable String fieldReference(@Nullable Expression expression) {
        Expression e = unwrap(expression);
        if (e instanceof J.Identifier) {
            return ((J.Identifier) e).getSimpleName();
        }
        if (e instanceof J.FieldAccess) {
            J.FieldAccess fieldAccess = (J.FieldAccess) e;
            Expression target = fieldAccess.getTarget();
            if (target instanceof J.Identifier && "this".equals(((J.Identifier) target).getSimpleName())) {
                return fieldAccess.getSimpleName();
            }
        }
        return null;
    }

    /**
     * Strips redundant parentheses.
     */
    public static @Nullable Expression unwrap(@Nullable Expression expression) {
        Expression e = expression;
        while (e instanceof J.Parentheses) {
            Object tree = ((J.Parentheses<?>) e).getTree();
            if (!(tree instanceof Expression)) {
                break;
            }
            e = (Expression) tree;
        }
        return e;
    }

    /**
     * Removes a trailing {@code Command} (case-sensitive) from a capitalized property name.
     */
    public static String stripCommandSuffix(String name) {
        if (name.endsWith(COMMAND_SUFFIX) && name.length() > COMMAND_SUFFIX.length()) {
            return name.substring(0, name.length() - COMMAND_SUFFIX.length());
        }
        return name;
    }

    /**
     * Same rules as {@code java.beans.Introspector#decapitalize}: {@code URL} stays {@code URL}.
     */
    public static String decapitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        if (name.length() > 1 && Character.isUpperCase(name.charAt(1)) && Character.isUpperCase(name.charAt(0))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    public static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static boolean isStatic(J.MethodDeclaration method) {
        return method.hasModifier(J.Modifier.Type.Static);
    }
}
