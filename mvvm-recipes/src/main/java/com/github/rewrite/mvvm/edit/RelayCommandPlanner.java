package com.github.rewrite.mvvm.edit;

import com.github.rewrite.mvvm.config.MvvmConfiguration;
import com.github.rewrite.mvvm.match.BeanProperties;
import com.github.rewrite.mvvm.match.CommandParameter;
import com.github.rewrite.mvvm.match.DelegateCommandProperty;
import org.openrewrite.java.tree.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans the replacement of a {@code DelegateCommand} getter by a method annotated with {@code @RelayCommand}.
 * <p>
 * With an {@code executeSave} method the method is renamed to {@code save} and annotated; otherwise a new
 * {@code save} method is built from the body of the command lambda.
 */
public class RelayCommandPlanner {

    public static final String RELAY_COMMAND = "RelayCommand";
    static final String CAN_EXECUTE_ATTRIBUTE = "canExecute";

    private final MvvmConfiguration configuration;

    public RelayCommandPlanner(MvvmConfiguration configuration) {
        this.configuration = configuration;
    }

    public EditPlan plan(J.ClassDeclaration classDecl, DelegateCommandProperty command) {
        if (!command.isFixable()) {
            return EditPlan.declined("no single-statement command lambda and no " + command.getExecuteMethodName() + " method");
        }
        String methodName = command.getCommandMethodName();
        if (BeanProperties.declaresMethod(classDecl, methodName, command.getCommandArity())) {
            return EditPlan.declined("a method '" + methodName + "' with " + command.getCommandArity() +
                                     " parameter(s) already exists");
        }
        String relayCommand = configuration.annotationType(RELAY_COMMAND);
        return command.usesExecuteMethod()
            ? planExecuteMethod(classDecl, command, methodName, relayCommand)
            : planLambda(classDecl, command, methodName, relayCommand);
    }

    private EditPlan planLambda(J.ClassDeclaration classDecl, DelegateCommandProperty command,
                                String methodName, String relayCommand) {
        Expression body = command.getCommandBody();
        Statement statement;
        TypeTree returnType;
        EditPlan.Builder plan = EditPlan.builder();
        if (command.isAsync()) {
            //noinspection ConstantConditions
            statement = LstFactory.returnOf(body);
            returnType = LstFactory.completionStageOfWildcard();
            plan.ensureImport(LstFactory.COMPLETION_STAGE_FQN);
        } else if (body instanceof Statement) {
            statement = (Statement) body;
            returnType = LstFactory.voidType();
        } else {
            return EditPlan.declined("the command lambda body is not a statement");
        }

        List<J.VariableDeclarations> parameters = new ArrayList<>();
        for (CommandParameter parameter : command.getParameters()) {
            TypeTree type = parameter.getTypeExpression() != null ? parameter.getTypeExpression() :
                LstFactory.identifier(Space.EMPTY, parameter.getTypeName(), parameter.getType());
            parameters.add(LstFactory.parameter(parameters.isEmpty() ? Space.EMPTY : Space.format(" "),
                type, parameter.getName()));
            if (parameter.getImportType() != null) {
                plan.ensureImport(parameter.getImportType());
            }
        }

        String indent = ClassBodyEditor.indentOf(classDecl);
        J.MethodDeclaration getter = command.getGetter();
        J.MethodDeclaration method = LstFactory.privateMethod(
            LstFactory.commentsOf(getter),
            LstFactory.annotation(Space.EMPTY, relayCommand, null, null),
            indent,
            returnType,
            methodName,
            parameters,
            statement
        );

        plan.insertBefore(getter.getId(), method)
            .remove(getter.getId());
        removeBackingField(classDecl, command, plan);
        plan.ensureImport(relayCommand);
        return plan.summary("@" + RELAY_COMMAND + " " + methodName + "()").build();
    }

    private EditPlan planExecuteMethod(J.ClassDeclaration classDecl, DelegateCommandProperty command,
                                       String methodName, String relayCommand) {
        J.MethodDeclaration execute = command.getExecuteMethod();
        String indent = ClassBodyEditor.indentOf(classDecl);

        J.Annotation annotation = LstFactory.annotation(Space.EMPTY, relayCommand,
            command.getCanExecuteTargetName() == null ? null : CAN_EXECUTE_ATTRIBUTE,
            command.getCanExecuteTargetName());
        //noinspection ConstantConditions
        J.MethodDeclaration renamed = withLeadingAnnotation(execute, annotation, indent)
            .withName(execute.getName().withSimpleName(methodName));
        if (execute.getMethodType() != null) {
            renamed = renamed.withMethodType(execute.getMethodType().withName(methodName));
        }

        EditPlan.Builder plan = EditPlan.builder()
            .replace(execute.getId(), renamed)
            .remove(command.getGetter().getId());
        removeBackingField(classDecl, command, plan);
        if (command.getCanExecuteMethod() != null && command.isCanExecuteRemovable() &&
            configuration.isRemoveCanExecuteWrappers()) {
            plan.remove(command.getCanExecuteMethod().getId());
        }
        plan.ensureImport(relayCommand);
        String canExecute = command.getCanExecuteTargetName() == null ? "" :
            "(canExecute = \"" + command.getCanExecuteTargetName() + "\")";
        return plan.summary("@" + RELAY_COMMAND + canExecute + " " + methodName + "()").build();
    }

    private static void removeBackingField(J.ClassDeclaration classDecl, DelegateCommandProperty command,
                                           EditPlan.Builder plan) {
        if (command.getBackingFieldName() == null) {
            return;
        }
        J.VariableDeclarations field = BeanProperties.findField(classDecl, command.getBackingFieldName());
        if (field != null) {
            ObservablePropertyPlanner.removeVariable(plan, field, command.getBackingFieldName());
        }
    }

    /**
     * Adds {@code annotation} as the first annotation, on its own line.
     */
    static J.MethodDeclaration withLeadingAnnotation(J.MethodDeclaration method, J.Annotation annotation, String indent) {
        Space newLine = Space.format("\n" + indent);
        List<J.Annotation> annotations = new ArrayList<>();
        annotations.add(annotation.withPrefix(Space.EMPTY));
        J.MethodDeclaration m = method;
        if (!method.getLeadingAnnotations().isEmpty()) {
            List<J.Annotation> existing = method.getLeadingAnnotations();
            annotations.add(existing.get(0).withPrefix(existing.get(0).getPrefix().withWhitespace(newLine.getWhitespace())));
            annotations.addAll(existing.subList(1, existing.size()));
        } else if (!method.getModifiers().isEmpty()) {
            List<J.Modifier> modifiers = new ArrayList<>(method.getModifiers());
            modifiers.set(0, modifiers.get(0).withPrefix(newLine));
            m = m.withModifiers(modifiers);
        } else if (method.getReturnTypeExpression() != null) {
            m = m.withReturnTypeExpression(method.getReturnTypeExpression().withPrefix(newLine));
        }
        return m.withLeadingAnnotations(annotations);
    }
}
