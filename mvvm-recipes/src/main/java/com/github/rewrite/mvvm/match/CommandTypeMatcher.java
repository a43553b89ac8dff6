package com.github.rewrite.mvvm.match;

import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.JavaType;
import org.openrewrite.java.tree.Statement;
import org.openrewrite.java.tree.TypeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds getters whose attributed return type has a given simple class name,
 * {@code Command} or {@code DelegateCommand}. Getters with an unresolved return type never match.
 */
public class CommandTypeMatcher {

    public static final String SIMPLE_COMMAND = "Command";
    public static final String DELEGATE_COMMAND = "DelegateCommand";

    private final String simpleTypeName;

    public CommandTypeMatcher(String simpleTypeName) {
        this.simpleTypeName = simpleTypeName;
    }

    public List<J.MethodDeclaration> findAll(J.ClassDeclaration classDecl) {
        List<J.MethodDeclaration> getters = new ArrayList<>();
        for (Statement statement : classDecl.getBody().getStatements()) {
            if (statement instanceof J.MethodDeclaration && matches((J.MethodDeclaration) statement)) {
                getters.add((J.MethodDeclaration) statement);
            }
        }
        return getters;
    }

    public boolean matches(J.MethodDeclaration method) {
        if (method.isConstructor() || !BeanProperties.parameters(method).isEmpty()) {
            return false;
        }
        String name = method.getSimpleName();
        if (name.length() <= 3 || !name.startsWith("get")) {
            return false;
        }
        return simpleTypeName.equals(simpleClassName(returnType(method)));
    }

    /**
     * Bean property name of a matching getter.
     */
    public static String propertyName(J.MethodDeclaration getter) {
        return BeanProperties.decapitalize(getter.getSimpleName().substring(3));
    }

    private static @Nullable JavaType returnType(J.MethodDeclaration method) {
        if (method.getMethodType() != null) {
            return method.getMethodType().getReturnType();
        }
        return method.getReturnTypeExpression() != null ? method.getReturnTypeExpression().getType() : null;
    }

    static @Nullable String simpleClassName(@Nullable JavaType type) {
        JavaType.FullyQualified fq = TypeUtils.asFullyQualified(type);
        if (fq == null || fq instanceof JavaType.Unknown) {
            return null;
        }
        String className = fq.getClassName();
        int dot = className.lastIndexOf('.');
        return dot < 0 ? className : className.substring(dot + 1);
    }
}
