package com.github.rewrite.mvvm.table;

import com.fasterxml.jackson.annotation.JsonIgnoreType;
import lombok.Value;
import org.openrewrite.Column;
import org.openrewrite.DataTable;
import org.openrewrite.Recipe;

/**
 * One row per legacy MVVM finding and per fix attempt.
 */
@JsonIgnoreType
public class MvvmMigrationFindings extends DataTable<MvvmMigrationFindings.Row> {

    public enum Outcome {
        /** The pattern was found; nothing was changed. */
        REPORTED,
        /** The pattern was rewritten. */
        FIXED,
        /** The pattern was found but not enough structure could be recovered to rewrite it. */
        UNFIXABLE,
        /** The planned rewrite referenced members that no longer exist in the current tree. */
        STALE
    }

    public MvvmMigrationFindings(Recipe recipe) {
        super(recipe,
              "Legacy MVVM findings",
              "Legacy MVVM properties and commands that were found or rewritten.");
    }

    @Value
    public static class Row {
        @Column(displayName = "Source path",
                description = "The source file containing the finding.")
        String sourcePath;

        @Column(displayName = "Class",
                description = "Simple name of the class declaring the property.")
        String className;

        @Column(displayName = "Property",
                description = "Name of the legacy property.")
        String propertyName;

        @Column(displayName = "Rule",
                description = "Rule code, e.g. MVVM0001.")
        String rule;

        @Column(displayName = "Severity",
                description = "Severity of the rule.")
        String severity;

        @Column(displayName = "Outcome",
                description = "REPORTED, FIXED, UNFIXABLE or STALE.")
        Outcome outcome;

        @Column(displayName = "Detail",
                description = "Why a fix was not applied, or what the property was rewritten to.")
        String detail;
    }
}
