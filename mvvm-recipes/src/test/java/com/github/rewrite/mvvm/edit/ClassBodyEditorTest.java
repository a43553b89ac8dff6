package com.github.rewrite.mvvm.edit;

import com.github.rewrite.mvvm.MvvmStubs;
import org.junit.jupiter.api.Test;
import org.openrewrite.InMemoryExecutionContext;
import org.openrewrite.Tree;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.Statement;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClassBodyEditorTest {

    private static J.CompilationUnit parse(String source) {
        return (J.CompilationUnit) MvvmStubs.parser().build()
            .parse(new InMemoryExecutionContext(), source)
            .findFirst()
            .orElseThrow();
    }

    private static final String SOURCE = """
        package org.example;

        public class Sample {
            private int a;

            // keep me
            private int b;

            private int c;
        }
        """;

    @Test
    void planReferencingForeignMemberIsStale() {
        J.CompilationUnit cu = parse(SOURCE);
        J.ClassDeclaration cd = cu.getClasses().get(0);

        EditPlan plan = EditPlan.builder().remove(Tree.randomId()).build();

        assertThat(ClassBodyEditor.apply(cd, plan)).isNull();
    }

    @Test
    void keptMemberThatBecomesFirstInheritsWhitespace() {
        J.CompilationUnit cu = parse(SOURCE);
        J.ClassDeclaration cd = cu.getClasses().get(0);
        List<Statement> members = cd.getBody().getStatements();

        J.ClassDeclaration edited = ClassBodyEditor.apply(cd,
            EditPlan.builder().remove(members.get(0).getId()).build());

        assertThat(edited).isNotNull();
        assertThat(cu.withClasses(List.of(edited)).printAll()).isEqualTo("""
            package org.example;

            public class Sample {
                // keep me
                private int b;

                private int c;
            }
            """);
    }

    @Test
    void insertedMemberGetsBlankLineAndKeepsComments() {
        J.CompilationUnit cu = parse(SOURCE);
        J.ClassDeclaration cd = cu.getClasses().get(0);
        List<Statement> members = cd.getBody().getStatements();
        Statement moved = members.get(1).withId(Tree.randomId());

        J.ClassDeclaration edited = ClassBodyEditor.apply(cd, EditPlan.builder()
            .remove(members.get(1).getId())
            .insertBefore(members.get(0).getId(), moved)
            .build());

        assertThat(edited).isNotNull();
        assertThat(cu.withClasses(List.of(edited)).printAll()).isEqualTo("""
            package org.example;

            public class Sample {
                // keep me
                private int b;

                private int a;

                private int c;
            }
            """);
    }

    @Test
    void cancellationLeavesClassUnchanged() {
        J.CompilationUnit cu = parse(SOURCE);
        J.ClassDeclaration cd = cu.getClasses().get(0);

        J.ClassDeclaration edited = ClassBodyEditor.apply(cd,
            EditPlan.builder().remove(cd.getBody().getStatements().get(0).getId()).build(), () -> true);

        assertThat(edited).isSameAs(cd);
    }

    @Test
    void indentIsTakenFromTheFirstMember() {
        J.CompilationUnit cu = parse("""
            class Tabs {
              int a;
            }
            """);

        assertThat(ClassBodyEditor.indentOf(cu.getClasses().get(0))).isEqualTo("  ");
        assertThat(ClassBodyEditor.indentOf(parse("class Empty {}").getClasses().get(0))).isEqualTo("    ");
    }
}
