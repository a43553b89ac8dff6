package com.github.rewrite.mvvm;

import com.github.rewrite.mvvm.config.MvvmConfiguration;
import com.github.rewrite.mvvm.config.MvvmConfigurationLoader;
import com.github.rewrite.mvvm.table.MvvmMigrationFindings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openrewrite.DocumentExample;
import org.openrewrite.test.RecipeSpec;
import org.openrewrite.test.RewriteTest;
import org.openrewrite.test.TypeValidation;

import java.nio.file.Paths;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.openrewrite.java.Assertions.java;

class FindLegacyMvvmPatternsTest implements RewriteTest {

    @Override
    public void defaults(RecipeSpec spec) {
        spec.recipe(new FindLegacyMvvmPatterns())
            .typeValidationOptions(TypeValidation.none())
            .parser(MvvmStubs.parser());
    }

    @BeforeEach
    void setUp() {
        MvvmConfigurationLoader.clearCache();
        MvvmConfigurationLoader.clearTestInjections();
    }

    @AfterEach
    void tearDown() {
        MvvmConfigurationLoader.clearCache();
        MvvmConfigurationLoader.clearTestInjections();
    }

    @DocumentExample
    @Test
    void marksEveryLegacyPattern() {
        rewriteRun(
            spec -> spec.dataTable(MvvmMigrationFindings.Row.class, rows -> {
                assertThat(rows)
                    .extracting(MvvmMigrationFindings.Row::getRule)
                    .contains("MVVM0001", "MVVM0002", "MVVM0003");
                assertThat(rows).allSatisfy(row -> {
                    assertThat(row.getOutcome()).isEqualTo(MvvmMigrationFindings.Outcome.REPORTED);
                    assertThat(row.getSeverity()).isEqualTo("ERROR");
                    assertThat(row.getClassName()).isEqualTo("ShellViewModel");
                });
            }),
            java(
                """
                package org.example.mvvm;

                public class ShellViewModel extends ObservableObject {
                    private String title;
                    private Command openCommand;
                    private DelegateCommand closeCommand;

                    public void setTitle(String value) {
                        title = value;
                        onPropertyChanged();
                    }

                    public Command getOpenCommand() {
                        return openCommand;
                    }

                    public DelegateCommand getCloseCommand() {
                        return closeCommand != null ? closeCommand : (closeCommand = new DelegateCommand(() -> close()));
                    }

                    private void close() {
                    }
                }
                """,
                """
                package org.example.mvvm;

                public class ShellViewModel extends ObservableObject {
                    private String title;
                    private Command openCommand;
                    private DelegateCommand closeCommand;

                    public void /*~~(MVVM0001 Property 'title' raises change notifications manually; convert it to an @ObservableProperty field)~~>*/setTitle(String value) {
                        title = value;
                        onPropertyChanged();
                    }

                    public Command /*~~(MVVM0003 Property 'openCommand' exposes a Command; migrate it to a @RelayCommand method manually)~~>*/getOpenCommand() {
                        return openCommand;
                    }

                    public DelegateCommand /*~~(MVVM0002 Property 'closeCommand' exposes a DelegateCommand; convert it to a @RelayCommand method)~~>*/getCloseCommand() {
                        return closeCommand != null ? closeCommand : (closeCommand = new DelegateCommand(() -> close()));
                    }

                    private void close() {
                    }
                }
                """
            )
        );
    }

    @Test
    void nestedViewModelsAreSearched() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class Outer {
                    public static class Inner extends ObservableObject {
                        private int size;

                        public void setSize(int value) {
                            setProperty(size, value);
                        }
                    }
                }
                """,
                """
                package org.example.mvvm;

                public class Outer {
                    public static class Inner extends ObservableObject {
                        private int size;

                        public void /*~~(MVVM0001 Property 'size' raises change notifications manually; convert it to an @ObservableProperty field)~~>*/setSize(int value) {
                            setProperty(size, value);
                        }
                    }
                }
                """
            )
        );
    }

    @Test
    void unresolvedReturnTypeIsNotReported() {
        rewriteRun(
            java(
                """
                package org.example.other;

                public class BrokenViewModel {
                    public Command getOpenCommand() {
                        return null;
                    }
                }
                """
            )
        );
    }

    @Test
    void disabledRulesAreNotReported() {
        MvvmConfigurationLoader.injectForTest(Paths.get(System.getProperty("user.dir")),
            new MvvmConfiguration(null, null, null, EnumSet.of(MvvmRule.SIMPLE_COMMAND_TYPE), null));
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class ShellViewModel {
                    private Command openCommand;

                    public Command getOpenCommand() {
                        return openCommand;
                    }
                }
                """
            )
        );
    }

    @Test
    void generatedCodeIsReportedWhenConfigured() {
        MvvmConfigurationLoader.injectForTest(Paths.get(System.getProperty("user.dir")),
            new MvvmConfiguration(null, true, null, null, null));
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                import javax.annotation.processing.Generated;

                @Generated("mvvm-generator")
                public class GeneratedViewModel {
                    public Command getOpenCommand() {
                        return null;
                    }
                }
                """,
                """
                package org.example.mvvm;

                import javax.annotation.processing.Generated;

                @Generated("mvvm-generator")
                public class GeneratedViewModel {
                    public Command /*~~(MVVM0003 Property 'openCommand' exposes a Command; migrate it to a @RelayCommand method manually)~~>*/getOpenCommand() {
                        return null;
                    }
                }
                """
            )
        );
    }
}
