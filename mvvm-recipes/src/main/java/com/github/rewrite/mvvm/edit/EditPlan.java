package com.github.rewrite.mvvm.edit;

import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.Statement;

import java.util.*;

/**
 * An ordered, immutable list of edits for one property, or the reason no plan could be made.
 */
public final class EditPlan {

    private final List<Edit> edits;

    @Nullable
    private final String declineReason;

    @Nullable
    private final String summary;

    private EditPlan(List<Edit> edits, @Nullable String declineReason, @Nullable String summary) {
        this.edits = edits;
        this.declineReason = declineReason;
        this.summary = summary;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A plan that makes no change and records why.
     */
    public static EditPlan declined(String reason) {
        return new EditPlan(Collections.emptyList(), reason, null);
    }

    public List<Edit> getEdits() {
        return edits;
    }

    public boolean isDeclined() {
        return declineReason != null;
    }

    public @Nullable String getDeclineReason() {
        return declineReason;
    }

    /**
     * Short description of the rewrite, e.g. {@code @ObservableProperty String name}.
     */
    public @Nullable String getSummary() {
        return summary;
    }

    public List<String> getImports() {
        List<String> imports = new ArrayList<>();
        for (Edit edit : edits) {
            if (edit instanceof Edit.EnsureImport) {
                imports.add(((Edit.EnsureImport) edit).getFullyQualifiedName());
            }
        }
        return imports;
    }

    /**
     * Ids of every class member the plan refers to.
     */
    public Set<UUID> getReferencedIds() {
        Set<UUID> ids = new LinkedHashSet<>();
        for (Edit edit : edits) {
            if (edit instanceof Edit.Insert) {
                ids.add(((Edit.Insert) edit).getBeforeId());
            } else if (edit instanceof Edit.Remove) {
                ids.add(((Edit.Remove) edit).getId());
            } else if (edit instanceof Edit.Replace) {
                ids.add(((Edit.Replace) edit).getId());
            }
        }
        return ids;
    }

    public static class Builder {

        private final List<Edit> edits = new ArrayList<>();
        private final Set<String> imports = new LinkedHashSet<>();

        @Nullable
        private String summary;

        private Builder() {
        }

        public Builder insertBefore(UUID beforeId, Statement node) {
            edits.add(new Edit.Insert(beforeId, node));
            return this;
        }

        public Builder remove(UUID id) {
            edits.add(new Edit.Remove(id));
            return this;
        }

        public Builder replace(UUID id, Statement node) {
            edits.add(new Edit.Replace(id, node));
            return this;
        }

        public Builder ensureImport(String fullyQualifiedName) {
            if (imports.add(fullyQualifiedName)) {
                edits.add(new Edit.EnsureImport(fullyQualifiedName));
            }
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        /**
         * @throws IllegalStateException if a member is both removed and replaced, or replaced twice
         */
        public EditPlan build() {
            Set<UUID> removed = new HashSet<>();
            Set<UUID> replaced = new HashSet<>();
            for (Edit edit : edits) {
                if (edit instanceof Edit.Remove) {
                    removed.add(((Edit.Remove) edit).getId());
                } else if (edit instanceof Edit.Replace && !replaced.add(((Edit.Replace) edit).getId())) {
                    throw new IllegalStateException("Member " + ((Edit.Replace) edit).getId() + " is replaced twice");
                }
            }
            for (UUID id : replaced) {
                if (removed.contains(id)) {
                    throw new IllegalStateException("Member " + id + " is both removed and replaced");
                }
            }
            return new EditPlan(Collections.unmodifiableList(new ArrayList<>(edits)), null, summary);
        }
    }
}
