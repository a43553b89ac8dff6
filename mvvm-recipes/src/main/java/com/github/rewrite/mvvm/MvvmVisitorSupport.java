package com.github.rewrite.mvvm;

import com.github.rewrite.mvvm.config.MvvmConfiguration;
import com.github.rewrite.mvvm.config.MvvmConfigurationLoader;
import com.github.rewrite.mvvm.match.PropertyMatch;
import com.github.rewrite.mvvm.table.MvvmMigrationFindings;
import org.openrewrite.Cursor;
import org.openrewrite.java.tree.J;

import java.util.Iterator;

/**
 * Lookups shared by the MVVM recipe visitors.
 */
final class MvvmVisitorSupport {

    private static final String GENERATED = "Generated";

    private MvvmVisitorSupport() {
    }

    static MvvmConfiguration configuration(J.CompilationUnit cu) {
        return MvvmConfigurationLoader.forSource(cu.getSourcePath());
    }

    /**
     * Generated classes (annotated {@code @Generated} themselves or nested in one, or below a generated
     * source root) are skipped unless the configuration asks for them.
     */
    static boolean shouldAnalyze(Cursor classCursor, J.CompilationUnit cu, MvvmConfiguration configuration) {
        if (configuration.isAnalyzeGeneratedCode()) {
            return true;
        }
        if (configuration.isGeneratedSource(cu.getSourcePath().toString())) {
            return false;
        }
        Iterator<Object> path = classCursor.getPath();
        while (path.hasNext()) {
            Object tree = path.next();
            if (tree instanceof J.ClassDeclaration && isGenerated((J.ClassDeclaration) tree)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isGenerated(J.ClassDeclaration classDecl) {
        for (J.Annotation annotation : classDecl.getLeadingAnnotations()) {
            if (GENERATED.equals(annotation.getSimpleName())) {
                return true;
            }
        }
        return false;
    }

    static MvvmMigrationFindings.Row row(J.CompilationUnit cu, J.ClassDeclaration classDecl, PropertyMatch match,
                                         MvvmMigrationFindings.Outcome outcome, String detail) {
        MvvmRule rule = match.getRule();
        return new MvvmMigrationFindings.Row(
            cu.getSourcePath().toString(),
            classDecl.getSimpleName(),
            match.getPropertyName(),
            rule.getCode(),
            rule.getSeverity().name(),
            outcome,
            detail
        );
    }
}
