/*
 * Copyright 2021 - 2023 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.rewrite.mvvm.config;

import com.github.rewrite.mvvm.MvvmRule;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Project-specific settings for the legacy MVVM migration.
 * <p>
 * If no project.yaml exists in the project root, defaults are used.
 * <p>
 * Example project.yaml:
 * <pre>
 * sources:
 *   generated:
 *     - target/generated-sources
 *     - build/generated
 *
 * migration:
 *   mvvm:
 *     annotationPackage: com.github.migration.mvvm
 *     analyzeGeneratedCode: false
 *     removeCanExecuteWrappers: true
 *     disabledRules:
 *       - MVVM0003          # rule code or slug (simple-command-type)
 * </pre>
 */
public class MvvmConfiguration {

    private static final Pattern PACKAGE_NAME =
            Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*");

    public static final String DEFAULT_ANNOTATION_PACKAGE = "com.github.migration.mvvm";

    private static final List<String> DEFAULT_GENERATED_SOURCE_ROOTS = List.of(
            "target/generated-sources",
            "target/generated-test-sources",
            "build/generated"
    );

    private final String annotationPackage;
    private final boolean analyzeGeneratedCode;
    private final boolean removeCanExecuteWrappers;
    private final Set<MvvmRule> disabledRules;
    private final List<String> generatedSourceRoots;

    /**
     * Creates a configuration; {@code null} arguments fall back to the defaults.
     *
     * @throws ConfigurationException if the annotation package is not a valid package name
     *                                or every rule is disabled
     */
    public MvvmConfiguration(String annotationPackage,
                             Boolean analyzeGeneratedCode,
                             Boolean removeCanExecuteWrappers,
                             Set<MvvmRule> disabledRules,
                             List<String> generatedSourceRoots) {
        this.annotationPackage = annotationPackage != null ? annotationPackage.trim() : DEFAULT_ANNOTATION_PACKAGE;
        this.analyzeGeneratedCode = analyzeGeneratedCode != null && analyzeGeneratedCode;
        this.removeCanExecuteWrappers = removeCanExecuteWrappers == null || removeCanExecuteWrappers;
        this.disabledRules = disabledRules == null || disabledRules.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(disabledRules));
        this.generatedSourceRoots = generatedSourceRoots != null ? List.copyOf(generatedSourceRoots) : DEFAULT_GENERATED_SOURCE_ROOTS;
        validate();
    }

    /**
     * Returns the defaults used when no project.yaml is present.
     */
    public static MvvmConfiguration defaults() {
        return new MvvmConfiguration(null, null, null, null, null);
    }

    private void validate() {
        if (!PACKAGE_NAME.matcher(annotationPackage).matches()) {
            throw new ConfigurationException(
                    "Invalid migration.mvvm.annotationPackage '" + annotationPackage +
                    "'. Expected a Java package name such as " + DEFAULT_ANNOTATION_PACKAGE);
        }
        if (disabledRules.size() == MvvmRule.values().length) {
            throw new ConfigurationException(
                    "migration.mvvm.disabledRules disables every rule. Remove at least one of " + disabledRules);
        }
    }

    public String getAnnotationPackage() {
        return annotationPackage;
    }

    /**
     * Fully qualified name of a marker annotation in the configured package.
     *
     * @param simpleName e.g. {@code ObservableProperty}
     */
    public String annotationType(String simpleName) {
        return annotationPackage + "." + simpleName;
    }

    public boolean isAnalyzeGeneratedCode() {
        return analyzeGeneratedCode;
    }

    public boolean isRemoveCanExecuteWrappers() {
        return removeCanExecuteWrappers;
    }

    public Set<MvvmRule> getDisabledRules() {
        return disabledRules;
    }

    public boolean isEnabled(MvvmRule rule) {
        return !disabledRules.contains(rule);
    }

    public List<String> getGeneratedSourceRoots() {
        return generatedSourceRoots;
    }

    /**
     * Checks if the given path lies below a generated source root.
     *
     * @param sourcePath the source path to check
     * @return true if the file was produced by a code generator
     */
    public boolean isGeneratedSource(String sourcePath) {
        if (sourcePath == null) {
            return false;
        }
        String normalizedPath = sourcePath.replace('\\', '/');
        for (String root : generatedSourceRoots) {
            if (normalizedPath.startsWith(root + "/") || normalizedPath.contains("/" + root + "/")) {
                return true;
            }
        }
        return false;
    }
}
