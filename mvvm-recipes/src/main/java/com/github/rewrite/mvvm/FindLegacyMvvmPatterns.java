package com.github.rewrite.mvvm;

import com.github.rewrite.mvvm.config.MvvmConfiguration;
import com.github.rewrite.mvvm.match.*;
import com.github.rewrite.mvvm.table.MvvmMigrationFindings;
import lombok.EqualsAndHashCode;
import lombok.Value;
import org.openrewrite.ExecutionContext;
import org.openrewrite.Recipe;
import org.openrewrite.TreeVisitor;
import org.openrewrite.internal.ListUtils;
import org.openrewrite.java.JavaIsoVisitor;
import org.openrewrite.java.tree.J;
import org.openrewrite.marker.SearchResult;

import java.util.*;

/**
 * Reports the legacy MVVM patterns of every class without changing anything.
 * <p>
 * Each finding marks the name of the accessor it was found on:
 * <pre>
 * public void /*~~(MVVM0001 Property 'name' raises change notifications manually; ...)~~>*&#47;setName(String value) {
 * </pre>
 * and adds a row to {@link MvvmMigrationFindings}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class FindLegacyMvvmPatterns extends Recipe {

    transient MvvmMigrationFindings findings = new MvvmMigrationFindings(this);

    @Override
    public String getDisplayName() {
        return "Find legacy MVVM properties and commands";
    }

    @Override
    public String getDescription() {
        return "Marks setters that raise change notifications by hand (MVVM0001), getters exposing a " +
               "DelegateCommand (MVVM0002) and getters exposing a Command (MVVM0003).";
    }

    @Override
    public Set<String> getTags() {
        return new LinkedHashSet<>(Arrays.asList("mvvm", "search"));
    }

    @Override
    public TreeVisitor<?, ExecutionContext> getVisitor() {
        return new JavaIsoVisitor<ExecutionContext>() {

            @Override
            public J.ClassDeclaration visitClassDeclaration(J.ClassDeclaration classDecl, ExecutionContext ctx) {
                J.ClassDeclaration cd = super.visitClassDeclaration(classDecl, ctx);
                J.CompilationUnit cu = getCursor().firstEnclosing(J.CompilationUnit.class);
                if (cu == null || MvvmCancellation.isCancelled(ctx)) {
                    return cd;
                }
                MvvmConfiguration config = MvvmVisitorSupport.configuration(cu);
                if (!MvvmVisitorSupport.shouldAnalyze(getCursor(), cu, config)) {
                    return cd;
                }

                List<PropertyMatch> matches = scan(cd, config, ctx);
                if (matches.isEmpty()) {
                    return cd;
                }

                Map<UUID, String> messages = new HashMap<>();
                for (PropertyMatch match : matches) {
                    String message = match.getRule().message(match.getPropertyName());
                    messages.put(match.getReportedAccessor().getId(), message);
                    findings.insertRow(ctx, MvvmVisitorSupport.row(cu, cd, match,
                        MvvmMigrationFindings.Outcome.REPORTED, message));
                }

                return cd.withBody(cd.getBody().withStatements(ListUtils.map(cd.getBody().getStatements(), statement -> {
                    String message = messages.get(statement.getId());
                    if (message == null || !(statement instanceof J.MethodDeclaration)) {
                        return statement;
                    }
                    J.MethodDeclaration method = (J.MethodDeclaration) statement;
                    return method.withName(SearchResult.found(method.getName(), message));
                })));
            }

            private List<PropertyMatch> scan(J.ClassDeclaration cd, MvvmConfiguration config, ExecutionContext ctx) {
                List<PropertyMatch> matches = new ArrayList<>();
                if (config.isEnabled(MvvmRule.NOTIFIED_SETTER)) {
                    matches.addAll(new NotifiedPropertyMatcher().findAll(cd));
                }
                if (config.isEnabled(MvvmRule.DELEGATE_COMMAND_TYPE) && !MvvmCancellation.isCancelled(ctx)) {
                    DelegateCommandExtractor extractor = new DelegateCommandExtractor();
                    for (J.MethodDeclaration getter : new CommandTypeMatcher(CommandTypeMatcher.DELEGATE_COMMAND).findAll(cd)) {
                        matches.add(extractor.extract(cd, getter));
                    }
                }
                if (config.isEnabled(MvvmRule.SIMPLE_COMMAND_TYPE) && !MvvmCancellation.isCancelled(ctx)) {
                    for (J.MethodDeclaration getter : new CommandTypeMatcher(CommandTypeMatcher.SIMPLE_COMMAND).findAll(cd)) {
                        matches.add(new SimpleCommandProperty(CommandTypeMatcher.propertyName(getter), getter));
                    }
                }
                return matches;
            }
        };
    }
}
