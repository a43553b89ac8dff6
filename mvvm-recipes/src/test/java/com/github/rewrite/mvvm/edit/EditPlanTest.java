package com.github.rewrite.mvvm.edit;

import org.junit.jupiter.api.Test;
import org.openrewrite.Tree;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.Space;
import org.openrewrite.marker.Markers;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EditPlanTest {

    @Test
    void removeAndReplaceOfTheSameMemberIsRejected() {
        UUID id = Tree.randomId();
        EditPlan.Builder builder = EditPlan.builder()
            .remove(id)
            .replace(id, new J.Empty(Tree.randomId(), Space.EMPTY, Markers.EMPTY));

        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("both removed and replaced");
    }

    @Test
    void importsAreDeduplicatedAndKeptInOrder() {
        EditPlan plan = EditPlan.builder()
            .ensureImport("a.B")
            .ensureImport("a.A")
            .ensureImport("a.B")
            .build();

        assertThat(plan.getImports()).containsExactly("a.B", "a.A");
        assertThat(plan.getReferencedIds()).isEmpty();
        assertThat(plan.isDeclined()).isFalse();
    }

    @Test
    void declinedPlanCarriesReasonAndNoEdits() {
        EditPlan plan = EditPlan.declined("no type");

        assertThat(plan.isDeclined()).isTrue();
        assertThat(plan.getDeclineReason()).isEqualTo("no type");
        assertThat(plan.getEdits()).isEmpty();
    }

    @Test
    void builtPlanIsImmutable() {
        EditPlan plan = EditPlan.builder().remove(Tree.randomId()).build();

        assertThatThrownBy(() -> plan.getEdits().add(new Edit.Remove(Tree.randomId())))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
