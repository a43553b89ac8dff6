package com.github.rewrite.mvvm.match;

import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recognises setters that announce their own changes.
 * <p>
 * Recognised shapes, as top-level statements of the setter body:
 * <pre>
 * onPropertyChanged();                      onPropertyChanged("name");
 * this.onPropertyChanged(this::getName);    setProperty(name, value);   setProperty(this.name, value);
 * </pre>
 * Detection is purely syntactic; no type attribution is needed.
 */
public class NotifiedPropertyMatcher {

    static final String ANNOUNCE_METHOD = "onPropertyChanged";
    static final String COMPARE_AND_ASSIGN_METHOD = "setProperty";

    /**
     * All notified properties of the class body, in declaration order of their setters.
     */
    public List<NotifiedProperty> findAll(J.ClassDeclaration classDecl) {
        List<NotifiedProperty> matches = new ArrayList<>();
        for (Statement statement : classDecl.getBody().getStatements()) {
            if (statement instanceof J.MethodDeclaration) {
                NotifiedProperty match = match(classDecl, (J.MethodDeclaration) statement);
                if (match != null) {
                    matches.add(match);
                }
            }
        }
        return matches;
    }

    /**
     * Matches one method of the class body, null when it is not a notified setter.
     */
    public @Nullable NotifiedProperty match(J.ClassDeclaration classDecl, J.MethodDeclaration setter) {
        String propertyName = BeanProperties.setterPropertyName(setter);
        if (propertyName == null || !isNotifiedSetter(setter)) {
            return null;
        }

        J.VariableDeclarations parameter = BeanProperties.parameters(setter).get(0);
        String parameterName = parameter.getVariables().get(0).getSimpleName();

        String backingField = null;
        Set<String> targets = new LinkedHashSet<>();
        //noinspection ConstantConditions
        for (Statement statement : setter.getBody().getStatements()) {
            if (statement instanceof J.Assignment) {
                J.Assignment assignment = (J.Assignment) statement;
                String field = writtenField(assignment.getVariable(), parameterName);
                if (field != null) {
                    backingField = field;
                }
            } else if (statement instanceof J.MethodInvocation) {
                J.MethodInvocation invocation = (J.MethodInvocation) statement;
                if (isCompareAndAssign(invocation)) {
                    String field = writtenField(invocation.getArguments().get(0), parameterName);
                    if (field != null) {
                        backingField = field;
                    }
                } else if (isAnnounce(invocation) && announcedArguments(invocation).size() == 1) {
                    String target = nameOf(announcedArguments(invocation).get(0));
                    if (target != null && !target.equals(propertyName)) {
                        targets.add(target);
                    }
                }
            }
        }

        return new NotifiedProperty(
            propertyName,
            setter,
            BeanProperties.findGetter(classDecl, propertyName),
            backingField,
            new ArrayList<>(targets),
            parameter.getTypeExpression()
        );
    }

    private static boolean isNotifiedSetter(J.MethodDeclaration setter) {
        if (setter.getBody() == null) {
            return false;
        }
        for (Statement statement : setter.getBody().getStatements()) {
            if (statement instanceof J.MethodInvocation) {
                J.MethodInvocation invocation = (J.MethodInvocation) statement;
                if (isAnnounce(invocation) && announcedArguments(invocation).size() <= 1) {
                    return true;
                }
                if (isCompareAndAssign(invocation)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean isAnnounce(J.MethodInvocation invocation) {
        return ANNOUNCE_METHOD.equals(invocation.getSimpleName()) && isOwnMember(invocation);
    }

    static boolean isCompareAndAssign(J.MethodInvocation invocation) {
        return COMPARE_AND_ASSIGN_METHOD.equals(invocation.getSimpleName()) &&
               isOwnMember(invocation) &&
               announcedArguments(invocation).size() == 2;
    }

    private static boolean isOwnMember(J.MethodInvocation invocation) {
        Expression select = invocation.getSelect();
        return select == null ||
               (select instanceof J.Identifier && "this".equals(((J.Identifier) select).getSimpleName()));
    }

    private static List<Expression> announcedArguments(J.MethodInvocation invocation) {
        List<Expression> arguments = new ArrayList<>();
        for (Expression argument : invocation.getArguments()) {
            if (!(argument instanceof J.Empty)) {
                arguments.add(argument);
            }
        }
        return arguments;
    }

    private static @Nullable String writtenField(Expression target, String parameterName) {
        Expression e = BeanProperties.unwrap(target);
        if (e instanceof J.Identifier && parameterName.equals(((J.Identifier) e).getSimpleName())) {
            // assigning the parameter itself
            return null;
        }
        return BeanProperties.fieldReference(e);
    }

    /**
     * Property named by an announce argument: a string literal or a getter method reference.
     */
    static @Nullable String nameOf(Expression argument) {
        Expression e = BeanProperties.unwrap(argument);
        if (e instanceof J.Literal) {
            Object value = ((J.Literal) e).getValue();
            return value instanceof String && !((String) value).isEmpty() ? (String) value : null;
        }
        if (e instanceof J.MemberReference) {
            String methodName = ((J.MemberReference) e).getReference().getSimpleName();
            for (String prefix : new String[]{"get", "is"}) {
                if (methodName.length() > prefix.length() && methodName.startsWith(prefix) &&
                    Character.isUpperCase(methodName.charAt(prefix.length()))) {
                    return BeanProperties.decapitalize(methodName.substring(prefix.length()));
                }
            }
        }
        return null;
    }
}
