package com.github.rewrite.mvvm.edit;

import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.JRightPadded;
import org.openrewrite.java.tree.Space;
import org.openrewrite.java.tree.Statement;

import java.util.*;
import java.util.function.BooleanSupplier;

/**
 * Applies an {@link EditPlan} to the members of one class body.
 * <p>
 * Whitespace rules: a removed member takes its leading whitespace with it; an inserted member is
 * preceded by one blank line, or by a single newline when it becomes the first member; a kept member
 * that becomes first inherits the whitespace of the original first member, which in turn gets a
 * blank line when it is pushed down. Comments are never dropped
 * from kept or inserted members.
 */
public final class ClassBodyEditor {

    private static final String DEFAULT_INDENT = "    ";

    private ClassBodyEditor() {
    }

    /**
     * @return the edited class, or null when the plan refers to a member that is not in this class body
     */
    public static J.@Nullable ClassDeclaration apply(J.ClassDeclaration classDecl, EditPlan plan) {
        return apply(classDecl, plan, () -> false);
    }

    /**
     * Like {@link #apply(J.ClassDeclaration, EditPlan)}; the class is returned unchanged once
     * {@code cancelled} reports true between two edits.
     */
    public static J.@Nullable ClassDeclaration apply(J.ClassDeclaration classDecl, EditPlan plan, BooleanSupplier cancelled) {
        J.Block body = classDecl.getBody();
        List<JRightPadded<Statement>> members = body.getPadding().getStatements();

        Set<UUID> present = new HashSet<>();
        for (JRightPadded<Statement> member : members) {
            present.add(member.getElement().getId());
        }
        if (!present.containsAll(plan.getReferencedIds())) {
            return null;
        }

        Map<UUID, List<Statement>> inserts = new HashMap<>();
        Set<UUID> removals = new HashSet<>();
        Map<UUID, Statement> replacements = new HashMap<>();
        for (Edit edit : plan.getEdits()) {
            if (cancelled.getAsBoolean()) {
                return classDecl;
            }
            if (edit instanceof Edit.Insert) {
                Edit.Insert insert = (Edit.Insert) edit;
                inserts.computeIfAbsent(insert.getBeforeId(), k -> new ArrayList<>()).add(insert.getNode());
            } else if (edit instanceof Edit.Remove) {
                removals.add(((Edit.Remove) edit).getId());
            } else if (edit instanceof Edit.Replace) {
                Edit.Replace replace = (Edit.Replace) edit;
                replacements.put(replace.getId(), replace.getNode());
            }
        }

        String indent = indentOf(classDecl);
        Space firstMemberPrefix = members.isEmpty() ? Space.EMPTY : members.get(0).getElement().getPrefix();
        Set<UUID> insertedIds = new HashSet<>();

        List<JRightPadded<Statement>> edited = new ArrayList<>();
        for (JRightPadded<Statement> member : members) {
            Statement statement = member.getElement();
            for (Statement node : inserts.getOrDefault(statement.getId(), Collections.emptyList())) {
                Statement spaced = node.withPrefix(node.getPrefix().withWhitespace("\n\n" + indent));
                insertedIds.add(spaced.getId());
                edited.add(JRightPadded.build(spaced));
            }
            if (removals.contains(statement.getId())) {
                continue;
            }
            Statement replacement = replacements.get(statement.getId());
            if (replacement != null) {
                edited.add(member.withElement(replacement.withPrefix(statement.getPrefix())));
            } else {
                edited.add(member);
            }
        }

        if (!edited.isEmpty() && !members.isEmpty()) {
            UUID originalFirst = members.get(0).getElement().getId();
            for (int i = 1; i < edited.size(); i++) {
                Statement displaced = edited.get(i).getElement();
                if (displaced.getId().equals(originalFirst)) {
                    edited.set(i, edited.get(i).withElement(displaced.withPrefix(
                        displaced.getPrefix().withWhitespace("\n\n" + indent))));
                }
            }
            JRightPadded<Statement> first = edited.get(0);
            Statement firstStatement = first.getElement();
            if (insertedIds.contains(firstStatement.getId())) {
                edited.set(0, first.withElement(firstStatement.withPrefix(
                    firstStatement.getPrefix().withWhitespace("\n" + indent))));
            } else if (!firstStatement.getId().equals(originalFirst)) {
                edited.set(0, first.withElement(firstStatement.withPrefix(
                    firstStatement.getPrefix().withWhitespace(firstMemberPrefix.getWhitespace()))));
            }
        }

        return classDecl.withBody(body.getPadding().withStatements(edited));
    }

    /**
     * Indentation of the class members, taken from the first member; four spaces when the body is empty.
     */
    public static String indentOf(J.ClassDeclaration classDecl) {
        for (Statement statement : classDecl.getBody().getStatements()) {
            String whitespace = statement.getPrefix().getWhitespace();
            int newline = whitespace.lastIndexOf('\n');
            if (newline >= 0) {
                return whitespace.substring(newline + 1);
            }
        }
        return DEFAULT_INDENT;
    }
}
