package com.github.rewrite.mvvm.edit;

import org.jspecify.annotations.Nullable;
import org.openrewrite.Tree;
import org.openrewrite.java.tree.*;
import org.openrewrite.marker.Markers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builders for the few tree nodes the planners create from scratch.
 * <p>
 * Nodes are built with the prefix they need relative to their parent; the whitespace in front of a
 * whole member is set by {@link ClassBodyEditor}.
 */
final class LstFactory {

    static final String COMPLETION_STAGE_FQN = "java.util.concurrent.CompletionStage";

    private LstFactory() {
    }

    static J.Identifier identifier(Space prefix, String name, @Nullable JavaType type) {
        return new J.Identifier(Tree.randomId(), prefix, Markers.EMPTY, Collections.emptyList(), name, type, null);
    }

    static J.Literal stringLiteral(Space prefix, String value) {
        return new J.Literal(Tree.randomId(), prefix, Markers.EMPTY, value, "\"" + value + "\"",
            Collections.emptyList(), JavaType.Primitive.String);
    }

    /**
     * {@code @Name}, {@code @Name("value")} or {@code @Name(attribute = "value")}.
     */
    static J.Annotation annotation(Space prefix, String fullyQualifiedName,
                                   @Nullable String attribute, @Nullable String value) {
        String simpleName = fullyQualifiedName.substring(fullyQualifiedName.lastIndexOf('.') + 1);
        J.Identifier name = identifier(Space.EMPTY, simpleName, JavaType.ShallowClass.build(fullyQualifiedName));
        if (value == null) {
            return new J.Annotation(Tree.randomId(), prefix, Markers.EMPTY, name, null);
        }
        Expression argument;
        if (attribute == null) {
            argument = stringLiteral(Space.EMPTY, value);
        } else {
            argument = new J.Assignment(
                Tree.randomId(), Space.EMPTY, Markers.EMPTY,
                identifier(Space.EMPTY, attribute, null),
                new JLeftPadded<>(Space.format(" "), stringLiteral(Space.format(" "), value), Markers.EMPTY),
                null
            );
        }
        return new J.Annotation(Tree.randomId(), prefix, Markers.EMPTY, name,
            JContainer.build(Space.EMPTY, Collections.singletonList(JRightPadded.build(argument)), Markers.EMPTY));
    }

    static J.Modifier privateModifier(Space prefix) {
        return new J.Modifier(Tree.randomId(), prefix, Markers.EMPTY, null, J.Modifier.Type.Private,
            Collections.emptyList());
    }

    /**
     * A single-variable field, e.g. {@code @A @B private T name = init;} with one annotation per line.
     */
    static J.VariableDeclarations field(Space prefix, List<J.Annotation> annotations, String indent,
                                        TypeTree type, String name,
                                        @Nullable JLeftPadded<Expression> initializer) {
        List<J.Annotation> leading = new ArrayList<>();
        for (int i = 0; i < annotations.size(); i++) {
            J.Annotation annotation = annotations.get(i);
            leading.add(annotation.withPrefix(i == 0 ? Space.EMPTY : Space.format("\n" + indent)));
        }
        Space modifierPrefix = leading.isEmpty() ? Space.EMPTY : Space.format("\n" + indent);
        J.VariableDeclarations.NamedVariable variable = new J.VariableDeclarations.NamedVariable(
            Tree.randomId(), Space.format(" "), Markers.EMPTY,
            identifier(Space.EMPTY, name, null),
            Collections.emptyList(),
            initializer,
            null
        );
        return new J.VariableDeclarations(
            Tree.randomId(),
            prefix,
            Markers.EMPTY,
            leading,
            Collections.singletonList(privateModifier(modifierPrefix)),
            type.withPrefix(Space.format(" ")),
            null,
            Collections.emptyList(),
            Collections.singletonList(JRightPadded.build(variable))
        );
    }

    static J.VariableDeclarations parameter(Space prefix, TypeTree type, String name) {
        J.VariableDeclarations.NamedVariable variable = new J.VariableDeclarations.NamedVariable(
            Tree.randomId(), Space.format(" "), Markers.EMPTY,
            identifier(Space.EMPTY, name, null),
            Collections.emptyList(),
            null,
            null
        );
        return new J.VariableDeclarations(
            Tree.randomId(),
            prefix,
            Markers.EMPTY,
            Collections.emptyList(),
            Collections.emptyList(),
            type.withPrefix(Space.EMPTY),
            null,
            Collections.emptyList(),
            Collections.singletonList(JRightPadded.build(variable))
        );
    }

    static TypeTree voidType() {
        return identifier(Space.format(" "), "void", JavaType.Primitive.Void);
    }

    /**
     * {@code CompletionStage<?>}
     */
    static TypeTree completionStageOfWildcard() {
        JavaType.ShallowClass completionStage = JavaType.ShallowClass.build(COMPLETION_STAGE_FQN);
        return new J.ParameterizedType(
            Tree.randomId(), Space.format(" "), Markers.EMPTY,
            identifier(Space.EMPTY, "CompletionStage", completionStage),
            JContainer.build(Space.EMPTY,
                Collections.singletonList(JRightPadded.build((Expression) new J.Wildcard(
                    Tree.randomId(), Space.EMPTY, Markers.EMPTY, null, null))),
                Markers.EMPTY),
            completionStage
        );
    }

    /**
     * A private method with one statement in its body.
     */
    static J.MethodDeclaration privateMethod(Space prefix, J.Annotation annotation, String indent,
                                             TypeTree returnType, String name,
                                             List<J.VariableDeclarations> parameters, Statement statement) {
        List<JRightPadded<Statement>> params = new ArrayList<>();
        for (J.VariableDeclarations parameter : parameters) {
            params.add(JRightPadded.build((Statement) parameter));
        }
        J.Block body = new J.Block(
            Tree.randomId(), Space.format(" "), Markers.EMPTY,
            JRightPadded.build(false),
            Collections.singletonList(JRightPadded.build(statement.withPrefix(Space.format("\n" + indent + indent)))),
            Space.format("\n" + indent)
        );
        return new J.MethodDeclaration(
            Tree.randomId(),
            prefix,
            Markers.EMPTY,
            Collections.singletonList(annotation.withPrefix(Space.EMPTY)),
            Collections.singletonList(privateModifier(Space.format("\n" + indent))),
            null,
            returnType,
            new J.MethodDeclaration.IdentifierWithAnnotations(
                identifier(Space.format(" "), name, null),
                Collections.emptyList()
            ),
            JContainer.build(Space.EMPTY, params, Markers.EMPTY),
            null,
            body,
            null,
            null
        );
    }

    static J.Return returnOf(Expression expression) {
        return new J.Return(Tree.randomId(), Space.EMPTY, Markers.EMPTY, expression.withPrefix(Space.format(" ")));
    }

    /**
     * Comments in front of {@code member}, without its whitespace.
     */
    static Space commentsOf(J member) {
        return Space.build("", member.getPrefix().getComments());
    }

    /**
     * Comments in front of each of {@code members}, in the given order, without their whitespace.
     */
    static Space commentsOf(List<? extends J> members) {
        List<Comment> comments = new ArrayList<>();
        for (J member : members) {
            comments.addAll(member.getPrefix().getComments());
        }
        return Space.build("", comments);
    }
}
