package com.github.rewrite.mvvm.match;

import org.jspecify.annotations.Nullable;
import org.openrewrite.java.JavaIsoVisitor;
import org.openrewrite.java.tree.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recovers the command body, parameters and companion methods of a {@code DelegateCommand} getter.
 * <p>
 * Lazy creation idioms recognised for the backing field:
 * <pre>
 * return saveCommand != null ? saveCommand : (saveCommand = new DelegateCommand(...));
 * return saveCommand == null ? (saveCommand = new DelegateCommand(...)) : saveCommand;
 * if (saveCommand == null) { saveCommand = new DelegateCommand(...); } return saveCommand;
 * </pre>
 */
public class DelegateCommandExtractor {

    public static final String EXECUTE_PREFIX = "execute";
    public static final String CAN_EXECUTE_PREFIX = "canExecute";

    private static final String COMPLETION_STAGE = "java.util.concurrent.CompletionStage";

    public DelegateCommandProperty extract(J.ClassDeclaration classDecl, J.MethodDeclaration getter) {
        String propertyName = CommandTypeMatcher.propertyName(getter);
        String strippedName = BeanProperties.stripCommandSuffix(getter.getSimpleName().substring(3));

        Expression value = firstReturnValue(getter);
        String backingField = value == null ? null : lazilyAssignedField(classDecl, value);

        J.Lambda lambda = firstLambda(getter);
        List<CommandParameter> parameters = lambda == null ? Collections.emptyList() : parameters(lambda);
        Expression body = lambda == null ? null : singleExpressionBody(lambda);

        J.MethodDeclaration execute = BeanProperties.findMethod(classDecl, EXECUTE_PREFIX + strippedName);
        J.MethodDeclaration canExecute = BeanProperties.findMethod(classDecl, CAN_EXECUTE_PREFIX + strippedName);

        boolean async;
        if (execute != null) {
            async = isCompletionStage(execute.getMethodType() == null ? null : execute.getMethodType().getReturnType()) ||
                    (execute.getReturnTypeExpression() != null && isCompletionStage(execute.getReturnTypeExpression().getType()));
            if (backingField == null) {
                backingField = conventionalField(classDecl, propertyName);
            }
        } else {
            async = body != null && isCompletionStage(body.getType());
        }

        String canExecuteTarget = null;
        boolean canExecuteRemovable = false;
        if (canExecute != null) {
            String returned = trivialReturn(canExecute);
            canExecuteRemovable = returned != null;
            canExecuteTarget = returned != null ? returned : canExecute.getSimpleName();
        }

        return new DelegateCommandProperty(
            propertyName,
            getter,
            strippedName,
            backingField,
            parameters,
            body,
            async,
            execute,
            canExecute,
            canExecuteTarget,
            canExecuteRemovable
        );
    }

    private static @Nullable Expression firstReturnValue(J.MethodDeclaration getter) {
        if (getter.getBody() == null) {
            return null;
        }
        J.Return found = new JavaIsoVisitor<List<J.Return>>() {
            @Override
            public J.Return visitReturn(J.Return _return, List<J.Return> returns) {
                returns.add(_return);
                return _return;
            }

            @Override
            public J.Lambda visitLambda(J.Lambda lambda, List<J.Return> returns) {
                return lambda;
            }

            @Override
            public J.NewClass visitNewClass(J.NewClass newClass, List<J.Return> returns) {
                // anonymous class bodies have returns of their own
                return newClass;
            }
        }.reduce(getter.getBody(), new ArrayList<J.Return>()).stream().findFirst().orElse(null);
        return found == null ? null : found.getExpression();
    }

    /**
     * Field that caches the command, or null when the getter creates a new command on every call.
     */
    static @Nullable String lazilyAssignedField(J.ClassDeclaration classDecl, Expression value) {
        Expression e = BeanProperties.unwrap(value);
        if (e instanceof J.Ternary) {
            J.Ternary ternary = (J.Ternary) e;
            String checked = nullCheckedField(ternary.getCondition());
            if (checked != null &&
                (checked.equals(assignedField(ternary.getTruePart())) || checked.equals(assignedField(ternary.getFalsePart())))) {
                return checked;
            }
            return null;
        }
        String assigned = assignedField(e);
        if (assigned != null) {
            return assigned;
        }
        String returned = BeanProperties.fieldReference(e);
        if (returned != null && BeanProperties.findField(classDecl, returned) != null) {
            return returned;
        }
        return null;
    }

    private static @Nullable String nullCheckedField(Expression condition) {
        Expression e = BeanProperties.unwrap(condition);
        if (!(e instanceof J.Binary)) {
            return null;
        }
        J.Binary binary = (J.Binary) e;
        if (binary.getOperator() != J.Binary.Type.Equal && binary.getOperator() != J.Binary.Type.NotEqual) {
            return null;
        }
        if (isNullLiteral(binary.getRight())) {
            return BeanProperties.fieldReference(binary.getLeft());
        }
        if (isNullLiteral(binary.getLeft())) {
            return BeanProperties.fieldReference(binary.getRight());
        }
        return null;
    }

    private static boolean isNullLiteral(Expression expression) {
        Expression e = BeanProperties.unwrap(expression);
        return e instanceof J.Literal && ((J.Literal) e).getValue() == null && "null".equals(((J.Literal) e).getValueSource());
    }

    private static @Nullable String assignedField(Expression expression) {
        Expression e = BeanProperties.unwrap(expression);
        if (e instanceof J.Assignment) {
            return BeanProperties.fieldReference(((J.Assignment) e).getVariable());
        }
        return null;
    }

    private static @Nullable String conventionalField(J.ClassDeclaration classDecl, String propertyName) {
        if (BeanProperties.findField(classDecl, propertyName) != null) {
            return propertyName;
        }
        if (BeanProperties.findField(classDecl, "_" + propertyName) != null) {
            return "_" + propertyName;
        }
        return null;
    }

    private static J.@Nullable Lambda firstLambda(J.MethodDeclaration getter) {
        if (getter.getBody() == null) {
            return null;
        }
        List<J.Lambda> lambdas = new JavaIsoVisitor<List<J.Lambda>>() {
            @Override
            public J.Lambda visitLambda(J.Lambda lambda, List<J.Lambda> found) {
                found.add(lambda);
                return lambda;
            }
        }.reduce(getter.getBody(), new ArrayList<J.Lambda>());
        return lambdas.isEmpty() ? null : lambdas.get(0);
    }

    private static List<CommandParameter> parameters(J.Lambda lambda) {
        List<CommandParameter> parameters = new ArrayList<>();
        for (J parameter : lambda.getParameters().getParameters()) {
            if (parameter instanceof J.VariableDeclarations) {
                J.VariableDeclarations declaration = (J.VariableDeclarations) parameter;
                J.VariableDeclarations.NamedVariable variable = declaration.getVariables().get(0);
                if (declaration.getTypeExpression() != null) {
                    parameters.add(new CommandParameter(variable.getSimpleName(), declaration.getTypeExpression(),
                        declaration.getTypeExpression().toString().trim(), declaration.getTypeExpression().getType(), null));
                } else {
                    parameters.add(implicitParameter(variable.getSimpleName(), variable.getType()));
                }
            } else if (parameter instanceof J.Identifier) {
                J.Identifier identifier = (J.Identifier) parameter;
                parameters.add(implicitParameter(identifier.getSimpleName(), identifier.getType()));
            }
        }
        return parameters;
    }

    private static CommandParameter implicitParameter(String name, @Nullable JavaType type) {
        if (type instanceof JavaType.Primitive && type != JavaType.Primitive.None &&
            type != JavaType.Primitive.Null && type != JavaType.Primitive.Void) {
            return new CommandParameter(name, null, ((JavaType.Primitive) type).getKeyword(), type, null);
        }
        JavaType.FullyQualified fq = TypeUtils.asFullyQualified(type);
        if (fq == null || fq instanceof JavaType.Unknown) {
            return new CommandParameter(name, null, "Object", JavaType.ShallowClass.build("java.lang.Object"), null);
        }
        String fqn = fq.getFullyQualifiedName();
        String importType = "java.lang".equals(fq.getPackageName()) ? null : fqn;
        return new CommandParameter(name, null, fq.getClassName(), fq, importType);
    }

    /**
     * Expression body, or the only statement of a block body when that statement is an expression.
     * A block with more statements yields null so no command logic is dropped.
     */
    private static @Nullable Expression singleExpressionBody(J.Lambda lambda) {
        J body = lambda.getBody();
        if (body instanceof J.Block) {
            List<Statement> statements = ((J.Block) body).getStatements();
            if (statements.size() == 1 && statements.get(0) instanceof Expression) {
                return (Expression) statements.get(0);
            }
            return null;
        }
        return body instanceof Expression ? (Expression) body : null;
    }

    /**
     * Identifier returned by a can-execute method whose body is exactly {@code return x;}.
     */
    static @Nullable String trivialReturn(J.MethodDeclaration method) {
        if (method.getBody() == null || method.getBody().getStatements().size() != 1 ||
            !BeanProperties.parameters(method).isEmpty()) {
            return null;
        }
        Statement only = method.getBody().getStatements().get(0);
        if (!(only instanceof J.Return)) {
            return null;
        }
        Expression returned = BeanProperties.unwrap(((J.Return) only).getExpression());
        return returned instanceof J.Identifier ? ((J.Identifier) returned).getSimpleName() : null;
    }

    static boolean isCompletionStage(@Nullable JavaType type) {
        return type != null && TypeUtils.isAssignableTo(COMPLETION_STAGE, type);
    }
}
