package com.github.rewrite.mvvm;

import com.github.rewrite.mvvm.config.MvvmConfiguration;
import com.github.rewrite.mvvm.edit.ClassBodyEditor;
import com.github.rewrite.mvvm.edit.EditPlan;
import com.github.rewrite.mvvm.edit.ObservablePropertyPlanner;
import com.github.rewrite.mvvm.match.NotifiedProperty;
import com.github.rewrite.mvvm.match.NotifiedPropertyMatcher;
import com.github.rewrite.mvvm.table.MvvmMigrationFindings;
import lombok.EqualsAndHashCode;
import lombok.Value;
import org.jspecify.annotations.Nullable;
import org.openrewrite.ExecutionContext;
import org.openrewrite.Recipe;
import org.openrewrite.TreeVisitor;
import org.openrewrite.java.JavaIsoVisitor;
import org.openrewrite.java.tree.J;

import java.util.HashSet;
import java.util.Set;

/**
 * Replaces bean properties whose setter announces its own changes by an {@code @ObservableProperty} field.
 * <p>
 * The setter, the getter and the backing field are removed; properties the setter announces in
 * addition become {@code @NotifyPropertyChangedFor} entries. The generated accessors keep the
 * {@code getX}/{@code setX} names, so callers are not touched.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class MigrateNotifiedPropertyToObservable extends Recipe {

    transient MvvmMigrationFindings findings = new MvvmMigrationFindings(this);

    @Override
    public String getDisplayName() {
        return "Migrate notified setters to @ObservableProperty fields";
    }

    @Override
    public String getDescription() {
        return "Replaces getter/setter pairs whose setter calls onPropertyChanged(..) or setProperty(..) " +
               "by a private field annotated with @ObservableProperty (MVVM0001).";
    }

    @Override
    public TreeVisitor<?, ExecutionContext> getVisitor() {
        return new JavaIsoVisitor<ExecutionContext>() {

            @Override
            public J.ClassDeclaration visitClassDeclaration(J.ClassDeclaration classDecl, ExecutionContext ctx) {
                J.ClassDeclaration cd = super.visitClassDeclaration(classDecl, ctx);
                J.CompilationUnit cu = getCursor().firstEnclosing(J.CompilationUnit.class);
                if (cu == null) {
                    return cd;
                }
                MvvmConfiguration config = MvvmVisitorSupport.configuration(cu);
                if (!config.isEnabled(MvvmRule.NOTIFIED_SETTER) ||
                    !MvvmVisitorSupport.shouldAnalyze(getCursor(), cu, config)) {
                    return cd;
                }

                NotifiedPropertyMatcher matcher = new NotifiedPropertyMatcher();
                ObservablePropertyPlanner planner = new ObservablePropertyPlanner(config);
                Set<String> attempted = new HashSet<>();
                while (!MvvmCancellation.isCancelled(ctx)) {
                    // re-match against the current class, earlier rewrites invalidate older matches
                    NotifiedProperty property = next(matcher, cd, attempted);
                    if (property == null) {
                        break;
                    }
                    attempted.add(property.getPropertyName());

                    EditPlan plan = planner.plan(cd, property);
                    if (plan.isDeclined()) {
                        findings.insertRow(ctx, MvvmVisitorSupport.row(cu, cd, property,
                            MvvmMigrationFindings.Outcome.UNFIXABLE, plan.getDeclineReason()));
                        continue;
                    }
                    J.ClassDeclaration edited = ClassBodyEditor.apply(cd, plan, () -> MvvmCancellation.isCancelled(ctx));
                    if (edited == null) {
                        findings.insertRow(ctx, MvvmVisitorSupport.row(cu, cd, property,
                            MvvmMigrationFindings.Outcome.STALE, "the class changed after the property was matched"));
                        continue;
                    }
                    if (edited == cd) {
                        break;
                    }
                    for (String type : plan.getImports()) {
                        maybeAddImport(type);
                    }
                    findings.insertRow(ctx, MvvmVisitorSupport.row(cu, cd, property,
                        MvvmMigrationFindings.Outcome.FIXED, plan.getSummary()));
                    cd = edited;
                }
                return cd;
            }

            private @Nullable NotifiedProperty next(NotifiedPropertyMatcher matcher, J.ClassDeclaration cd,
                                                    Set<String> attempted) {
                for (NotifiedProperty property : matcher.findAll(cd)) {
                    if (!attempted.contains(property.getPropertyName())) {
                        return property;
                    }
                }
                return null;
            }
        };
    }
}
