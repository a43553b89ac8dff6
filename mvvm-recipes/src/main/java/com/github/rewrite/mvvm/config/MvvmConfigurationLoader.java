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
import org.yaml.snakeyaml.Yaml;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads MvvmConfiguration from project.yaml or returns defaults.
 * <p>
 * The loader uses a static cache to avoid repeated file reads.
 * This is safe because project.yaml doesn't change during a recipe run.
 * <p>
 * Submodules without their own project.yaml inherit the configuration of the closest
 * parent directory that has one, see {@link #loadWithInheritance(Path)}.
 * <p>
 * Usage in a Recipe:
 * <pre>
 * MvvmConfiguration config = MvvmConfigurationLoader.forSource(cu.getSourcePath());
 * if (config.isEnabled(MvvmRule.NOTIFIED_SETTER)) {
 *     // run the matcher
 * }
 * </pre>
 */
public class MvvmConfigurationLoader {

    private static final String PROJECT_YAML = "project.yaml";
    private static final String POM_XML = "pom.xml";
    private static final String BUILD_GRADLE = "build.gradle";
    private static final String BUILD_GRADLE_KTS = "build.gradle.kts";

    // project.yaml does not change during a recipe run
    private static final Map<Path, MvvmConfiguration> CACHE = new ConcurrentHashMap<>();

    private static final Map<Path, MvvmConfiguration> TEST_INJECTIONS = new ConcurrentHashMap<>();

    /**
     * Loads the configuration of the given project root, or defaults when it has no project.yaml.
     * Results are cached per root.
     */
    public static MvvmConfiguration load(Path projectRoot) {
        if (projectRoot == null) {
            return MvvmConfiguration.defaults();
        }
        Path normalizedRoot = projectRoot.toAbsolutePath().normalize();
        MvvmConfiguration testConfig = TEST_INJECTIONS.get(normalizedRoot);
        if (testConfig != null) {
            return testConfig;
        }
        return CACHE.computeIfAbsent(normalizedRoot, MvvmConfigurationLoader::loadFromDisk);
    }

    /**
     * Loads the configuration of a module, falling back to the closest parent project.yaml.
     * <p>
     * A parent only counts when it also holds a build file; the walk stops at the repository
     * root (the directory containing {@code .git}).
     */
    public static MvvmConfiguration loadWithInheritance(Path moduleRoot) {
        if (moduleRoot == null) {
            return MvvmConfiguration.defaults();
        }
        Path normalizedRoot = moduleRoot.toAbsolutePath().normalize();
        MvvmConfiguration testConfig = TEST_INJECTIONS.get(normalizedRoot);
        if (testConfig != null) {
            return testConfig;
        }
        return load(configurationRoot(normalizedRoot));
    }

    static Path configurationRoot(Path moduleRoot) {
        if (Files.exists(moduleRoot.resolve(PROJECT_YAML))) {
            return moduleRoot;
        }
        for (Path current = moduleRoot.getParent(); current != null; current = current.getParent()) {
            if (Files.exists(current.resolve(PROJECT_YAML)) && isValidProjectRoot(current)) {
                return current;
            }
            if (Files.isDirectory(current.resolve(".git"))) {
                break;
            }
        }
        return moduleRoot;
    }

    /**
     * Resolves the configuration that applies to a parsed source file.
     * <p>
     * The closest ancestor directory holding a build file or project.yaml is taken as the
     * module root; relative source paths are resolved against the working directory.
     *
     * @param sourcePath the source path of a compilation unit, may be null
     */
    public static MvvmConfiguration forSource(Path sourcePath) {
        return loadWithInheritance(extractModuleRoot(sourcePath));
    }

    static Path extractModuleRoot(Path sourcePath) {
        if (sourcePath == null) {
            return Paths.get(System.getProperty("user.dir"));
        }
        Path current = sourcePath.toAbsolutePath().getParent();
        while (current != null) {
            if (Files.exists(current.resolve(POM_XML)) ||
                Files.exists(current.resolve(BUILD_GRADLE)) ||
                Files.exists(current.resolve(PROJECT_YAML))) {
                return current;
            }
            current = current.getParent();
        }
        return Paths.get(System.getProperty("user.dir"));
    }

    private static boolean isValidProjectRoot(Path path) {
        return Files.exists(path.resolve(POM_XML)) ||
               Files.exists(path.resolve(BUILD_GRADLE)) ||
               Files.exists(path.resolve(BUILD_GRADLE_KTS)) ||
               Files.exists(path.resolve("settings.gradle")) ||
               Files.exists(path.resolve("settings.gradle.kts"));
    }

    public static void clearCache() {
        CACHE.clear();
    }

    /**
     * Makes {@link #load} and {@link #loadWithInheritance} return {@code config} for this root.
     */
    public static void injectForTest(Path projectRoot, MvvmConfiguration config) {
        TEST_INJECTIONS.put(projectRoot.toAbsolutePath().normalize(), config);
    }

    public static void clearTestInjections() {
        TEST_INJECTIONS.clear();
    }

    private static MvvmConfiguration loadFromDisk(Path projectRoot) {
        Path yamlPath = projectRoot.resolve(PROJECT_YAML);
        if (Files.exists(yamlPath)) {
            return parseYaml(yamlPath);
        }
        if (!isValidProjectRoot(projectRoot)) {
            return MvvmConfiguration.defaults();
        }
        System.err.println("Info: No " + PROJECT_YAML + " found in " + projectRoot +
                ". Using defaults (annotationPackage=" + MvvmConfiguration.DEFAULT_ANNOTATION_PACKAGE + ").");
        return MvvmConfiguration.defaults();
    }

    /**
     * Parses the project.yaml file using SnakeYAML.
     * <p>
     * Unreadable files fall back to defaults with a warning; a readable file with an
     * invalid combination of settings raises {@link ConfigurationException}.
     */
    @SuppressWarnings("unchecked")
    static MvvmConfiguration parseYaml(Path yamlPath) {
        Map<String, Object> root;
        try {
            String content = Files.readString(yamlPath);
            root = new Yaml().load(content);
        } catch (Exception e) {
            System.err.println("Warning: Failed to parse " + yamlPath + ": " + e.getMessage());
            return MvvmConfiguration.defaults();
        }

        if (root == null) {
            return MvvmConfiguration.defaults();
        }

        List<String> generatedSourceRoots = null;
        Object sourcesObj = root.get("sources");
        if (sourcesObj instanceof Map) {
            Map<String, Object> sources = (Map<String, Object>) sourcesObj;
            generatedSourceRoots = extractStringList(sources.get("generated"));
        }

        String annotationPackage = null;
        Boolean analyzeGeneratedCode = null;
        Boolean removeCanExecuteWrappers = null;
        Set<MvvmRule> disabledRules = null;

        Object migrationObj = root.get("migration");
        if (migrationObj instanceof Map) {
            Map<String, Object> migration = (Map<String, Object>) migrationObj;
            Object mvvmObj = migration.get("mvvm");
            if (mvvmObj instanceof Map) {
                Map<String, Object> mvvm = (Map<String, Object>) mvvmObj;
                Object packageObj = mvvm.get("annotationPackage");
                if (packageObj != null) {
                    annotationPackage = packageObj.toString().trim();
                }
                analyzeGeneratedCode = parseBoolean(mvvm.get("analyzeGeneratedCode"));
                removeCanExecuteWrappers = parseBoolean(mvvm.get("removeCanExecuteWrappers"));
                disabledRules = parseRules(extractStringList(mvvm.get("disabledRules")));
            }
        }

        return new MvvmConfiguration(annotationPackage, analyzeGeneratedCode, removeCanExecuteWrappers,
                disabledRules, generatedSourceRoots);
    }

    private static Boolean parseBoolean(Object value) {
        if (value == null) {
            return null;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * Parses rule references; both codes ({@code MVVM0003}) and slugs ({@code simple-command-type}) are accepted.
     */
    private static Set<MvvmRule> parseRules(List<String> values) {
        if (values == null) {
            return null;
        }
        Set<MvvmRule> rules = EnumSet.noneOf(MvvmRule.class);
        for (String value : values) {
            MvvmRule rule = MvvmRule.fromString(value);
            if (rule == null) {
                System.err.println("Warning: Unknown rule '" + value +
                        "' in migration.mvvm.disabledRules. Valid values: " + Arrays.toString(MvvmRule.values()));
            } else {
                rules.add(rule);
            }
        }
        return rules;
    }

    /**
     * Extracts a list of strings from a YAML value (can be a single string or a list).
     */
    @SuppressWarnings("unchecked")
    private static List<String> extractStringList(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result.isEmpty() ? null : result;
        }
        if (value instanceof String) {
            return List.of((String) value);
        }
        return null;
    }
}
