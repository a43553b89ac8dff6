package com.github.rewrite.mvvm;

import com.github.rewrite.mvvm.config.MvvmConfiguration;
import com.github.rewrite.mvvm.config.MvvmConfigurationLoader;
import com.github.rewrite.mvvm.table.MvvmMigrationFindings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openrewrite.DocumentExample;
import org.openrewrite.InMemoryExecutionContext;
import org.openrewrite.test.RecipeSpec;
import org.openrewrite.test.RewriteTest;
import org.openrewrite.test.TypeValidation;

import java.nio.file.Paths;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.openrewrite.java.Assertions.java;

class MigrateNotifiedPropertyToObservableTest implements RewriteTest {

    @Override
    public void defaults(RecipeSpec spec) {
        spec.recipe(new MigrateNotifiedPropertyToObservable())
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
    void replacesNotifiedPropertyByObservableField() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class PersonViewModel extends ObservableObject {
                    private String name;

                    public String getName() {
                        return name;
                    }

                    public void setName(String value) {
                        name = value;
                        onPropertyChanged();
                    }
                }
                """,
                """
                package org.example.mvvm;

                import com.github.migration.mvvm.ObservableProperty;

                public class PersonViewModel extends ObservableObject {
                    @ObservableProperty
                    private String name;
                }
                """
            )
        );
    }

    @Test
    void announcedPropertiesBecomeNotifyTargetsInFirstSeenOrder() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class PersonViewModel extends ObservableObject {
                    private String firstName = "";

                    /** The first name. */
                    public String getFirstName() {
                        return firstName;
                    }

                    public void setFirstName(String value) {
                        setProperty(this.firstName, value);
                        onPropertyChanged("firstName");
                        onPropertyChanged("fullName");
                        onPropertyChanged(this::getInitials);
                        onPropertyChanged("fullName");
                    }

                    public String getFullName() {
                        return firstName;
                    }

                    public String getInitials() {
                        return "";
                    }
                }
                """,
                source -> source.after(after -> {
                    assertThat(after)
                        .contains("import com.github.migration.mvvm.NotifyPropertyChangedFor;")
                        .contains("import com.github.migration.mvvm.ObservableProperty;")
                        .contains("""
                            public class PersonViewModel extends ObservableObject {
                                /** The first name. */
                                @ObservableProperty
                                @NotifyPropertyChangedFor("fullName")
                                @NotifyPropertyChangedFor("initials")
                                private String firstName = "";

                                public String getFullName() {
                            """)
                        .doesNotContain("@NotifyPropertyChangedFor(\"firstName\")")
                        .doesNotContain("setFirstName")
                        .doesNotContain("getFirstName");
                    return after;
                })
            )
        );
    }

    @Test
    void commentsOfAllRemovedMembersAreKept() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class FormViewModel extends ObservableObject {
                    // display name
                    private String name;

                    public String getName() {
                        return name;
                    }

                    /** Changing the name also revalidates the form. */
                    public void setName(String value) {
                        name = value;
                        onPropertyChanged();
                    }
                }
                """,
                source -> source.after(after -> {
                    assertThat(after)
                        .contains("""
                            public class FormViewModel extends ObservableObject {
                                // display name
                                /** Changing the name also revalidates the form. */
                                @ObservableProperty
                                private String name;
                            }""")
                        .doesNotContain("setName");
                    return after;
                })
            )
        );
    }

    @Test
    void removesOnlyBackingVariableFromSharedDeclaration() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class CounterViewModel extends ObservableObject {
                    private int count, total;

                    public void setCount(int value) {
                        this.count = value;
                        onPropertyChanged("count");
                    }
                }
                """,
                """
                package org.example.mvvm;

                import com.github.migration.mvvm.ObservableProperty;

                public class CounterViewModel extends ObservableObject {
                    private int total;

                    @ObservableProperty
                    private int count;
                }
                """
            )
        );
    }

    @Test
    void lastWrittenFieldIsTheBackingField() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class DocumentViewModel extends ObservableObject {
                    private String draft;
                    private String title = "Untitled";

                    public String getTitle() {
                        return title;
                    }

                    public void setTitle(String value) {
                        draft = value;
                        title = value;
                        onPropertyChanged();
                    }
                }
                """,
                source -> source.after(after -> {
                    assertThat(after)
                        .contains("""
                                private String draft;

                                @ObservableProperty
                                private String title = "Untitled";
                            }""")
                        .doesNotContain("getTitle")
                        .doesNotContain("setTitle");
                    return after;
                })
            )
        );
    }

    @Test
    void rewritesEveryNotifiedPropertyOfTheClass() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class AddressViewModel extends ObservableObject {
                    private String street;
                    private String city;

                    public void setStreet(String value) {
                        street = value;
                        onPropertyChanged("street");
                    }

                    public void setCity(String value) {
                        city = value;
                        this.onPropertyChanged();
                    }
                }
                """,
                """
                package org.example.mvvm;

                import com.github.migration.mvvm.ObservableProperty;

                public class AddressViewModel extends ObservableObject {
                    @ObservableProperty
                    private String street;

                    @ObservableProperty
                    private String city;
                }
                """
            )
        );
    }

    @Test
    void setterWithoutNotificationIsLeftAlone() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class PlainViewModel extends ObservableObject {
                    private String name;

                    public void setName(String value) {
                        name = value;
                    }
                }
                """
            )
        );
    }

    @Test
    void notificationOnAnotherObjectIsNotRecognised() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class ChildViewModel extends ObservableObject {
                    private ObservableObject parent;
                    private String name;

                    public void setName(String value) {
                        name = value;
                        parent.onPropertyChanged();
                    }
                }
                """
            )
        );
    }

    @Test
    void existingFieldWithPropertyNameDeclinesTheFix() {
        rewriteRun(
            spec -> spec.dataTable(MvvmMigrationFindings.Row.class, rows -> {
                assertThat(rows).isNotEmpty().allSatisfy(row -> {
                    assertThat(row.getOutcome()).isEqualTo(MvvmMigrationFindings.Outcome.UNFIXABLE);
                    assertThat(row.getPropertyName()).isEqualTo("name");
                    assertThat(row.getRule()).isEqualTo("MVVM0001");
                    assertThat(row.getDetail()).contains("already exists");
                });
            }),
            java(
                """
                package org.example.mvvm;

                public class ClashViewModel extends ObservableObject {
                    private String name;
                    private String _name;

                    public void setName(String value) {
                        _name = value;
                        onPropertyChanged();
                    }
                }
                """
            )
        );
    }

    @Test
    void disabledRuleLeavesSourceUnchanged() {
        MvvmConfigurationLoader.injectForTest(Paths.get(System.getProperty("user.dir")),
            new MvvmConfiguration(null, null, null, EnumSet.of(MvvmRule.NOTIFIED_SETTER), null));
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                public class PersonViewModel extends ObservableObject {
                    private String name;

                    public void setName(String value) {
                        name = value;
                        onPropertyChanged();
                    }
                }
                """
            )
        );
    }

    @Test
    void generatedClassesAreSkipped() {
        rewriteRun(
            java(
                """
                package org.example.mvvm;

                import javax.annotation.processing.Generated;

                @Generated("mvvm-generator")
                public class GeneratedViewModel extends ObservableObject {
                    private String name;

                    public void setName(String value) {
                        name = value;
                        onPropertyChanged();
                    }
                }
                """
            ),
            java(
                """
                package org.example.mvvm;

                public class SourceGenViewModel extends ObservableObject {
                    private String name;

                    public void setName(String value) {
                        name = value;
                        onPropertyChanged();
                    }
                }
                """,
                spec -> spec.path("target/generated-sources/annotations/org/example/mvvm/SourceGenViewModel.java")
            )
        );
    }

    @Test
    void cancelledRunLeavesSourceUnchanged() {
        InMemoryExecutionContext ctx = new InMemoryExecutionContext(Throwable::printStackTrace);
        MvvmCancellation.install(ctx, () -> true);
        rewriteRun(
            spec -> spec.executionContext(ctx),
            java(
                """
                package org.example.mvvm;

                public class PersonViewModel extends ObservableObject {
                    private String name;

                    public void setName(String value) {
                        name = value;
                        onPropertyChanged();
                    }
                }
                """
            )
        );
    }
}
