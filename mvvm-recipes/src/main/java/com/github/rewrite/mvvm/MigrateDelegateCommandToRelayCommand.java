package com.github.rewrite.mvvm;

import com.github.rewrite.mvvm.config.MvvmConfiguration;
import com.github.rewrite.mvvm.edit.ClassBodyEditor;
import com.github.rewrite.mvvm.edit.EditPlan;
import com.github.rewrite.mvvm.edit.RelayCommandPlanner;
import com.github.rewrite.mvvm.match.CommandTypeMatcher;
import com.github.rewrite.mvvm.match.DelegateCommandExtractor;
import com.github.rewrite.mvvm.match.DelegateCommandProperty;
import com.github.rewrite.mvvm.table.MvvmMigrationFindings;
import lombok.EqualsAndHashCode;
import lombok.Value;
import org.jspecify.annotations.Nullable;
import org.openrewrite.ExecutionContext;
import org.openrewrite.Recipe;
import org.openrewrite.TreeVisitor;
import org.openrewrite.java.JavaIsoVisitor;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.JavaType;
import org.openrewrite.java.tree.TypeUtils;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Replaces {@code DelegateCommand} getters by methods annotated with {@code @RelayCommand}.
 * <p>
 * Lambda shape:
 * <pre>
 * public DelegateCommand getSaveCommand() {               &#64;RelayCommand
 *     return saveCommand != null ? saveCommand      =>    private void save() {
 *         : (saveCommand = new DelegateCommand(() -> store()));     store();
 * }                                                       }
 * </pre>
 * Execute shape: {@code executeSave()} is renamed to {@code save()} and annotated with
 * {@code @RelayCommand(canExecute = "...")}. Call sites of {@code executeSave()} are not updated.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class MigrateDelegateCommandToRelayCommand extends Recipe {

    transient MvvmMigrationFindings findings = new MvvmMigrationFindings(this);

    @Override
    public String getDisplayName() {
        return "Migrate DelegateCommand properties to @RelayCommand methods";
    }

    @Override
    public String getDescription() {
        return "Replaces getters returning a lazily created DelegateCommand by a private method annotated " +
               "with @RelayCommand, built from the command lambda or from the executeX/canExecuteX methods (MVVM0002).";
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
                if (!config.isEnabled(MvvmRule.DELEGATE_COMMAND_TYPE) ||
                    !MvvmVisitorSupport.shouldAnalyze(getCursor(), cu, config)) {
                    return cd;
                }

                CommandTypeMatcher matcher = new CommandTypeMatcher(CommandTypeMatcher.DELEGATE_COMMAND);
                DelegateCommandExtractor extractor = new DelegateCommandExtractor();
                RelayCommandPlanner planner = new RelayCommandPlanner(config);
                Set<String> attempted = new HashSet<>();
                Set<String> legacyTypes = new LinkedHashSet<>();
                while (!MvvmCancellation.isCancelled(ctx)) {
                    J.MethodDeclaration getter = next(matcher, cd, attempted);
                    if (getter == null) {
                        break;
                    }
                    DelegateCommandProperty command = extractor.extract(cd, getter);
                    attempted.add(command.getPropertyName());

                    EditPlan plan = planner.plan(cd, command);
                    if (plan.isDeclined()) {
                        findings.insertRow(ctx, MvvmVisitorSupport.row(cu, cd, command,
                            MvvmMigrationFindings.Outcome.UNFIXABLE, plan.getDeclineReason()));
                        continue;
                    }
                    J.ClassDeclaration edited = ClassBodyEditor.apply(cd, plan, () -> MvvmCancellation.isCancelled(ctx));
                    if (edited == null) {
                        findings.insertRow(ctx, MvvmVisitorSupport.row(cu, cd, command,
                            MvvmMigrationFindings.Outcome.STALE, "the class changed after the command was matched"));
                        continue;
                    }
                    if (edited == cd) {
                        break;
                    }
                    for (String type : plan.getImports()) {
                        maybeAddImport(type);
                    }
                    String legacyType = legacyType(getter);
                    if (legacyType != null) {
                        legacyTypes.add(legacyType);
                    }
                    findings.insertRow(ctx, MvvmVisitorSupport.row(cu, cd, command,
                        MvvmMigrationFindings.Outcome.FIXED, plan.getSummary()));
                    cd = edited;
                }
                for (String legacyType : legacyTypes) {
                    maybeRemoveImport(legacyType);
                }
                return cd;
            }

            private J.@Nullable MethodDeclaration next(CommandTypeMatcher matcher, J.ClassDeclaration cd,
                                                       Set<String> attempted) {
                for (J.MethodDeclaration getter : matcher.findAll(cd)) {
                    if (!attempted.contains(CommandTypeMatcher.propertyName(getter))) {
                        return getter;
                    }
                }
                return null;
            }

            private @Nullable String legacyType(J.MethodDeclaration getter) {
                JavaType returnType = getter.getMethodType() != null ? getter.getMethodType().getReturnType() :
                    getter.getReturnTypeExpression() != null ? getter.getReturnTypeExpression().getType() : null;
                JavaType.FullyQualified fq = TypeUtils.asFullyQualified(returnType);
                return fq == null ? null : fq.getFullyQualifiedName();
            }
        };
    }
}
