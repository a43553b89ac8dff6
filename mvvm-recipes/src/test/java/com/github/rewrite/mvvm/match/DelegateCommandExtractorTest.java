package com.github.rewrite.mvvm.match;

import org.junit.jupiter.api.Test;
import org.openrewrite.java.tree.J;

import static com.github.rewrite.mvvm.match.NotifiedPropertyMatcherTest.parseClass;
import static org.assertj.core.api.Assertions.assertThat;

class DelegateCommandExtractorTest {

    private final CommandTypeMatcher delegateCommands = new CommandTypeMatcher(CommandTypeMatcher.DELEGATE_COMMAND);
    private final DelegateCommandExtractor extractor = new DelegateCommandExtractor();

    @Test
    void lambdaShape() {
        J.ClassDeclaration cd = parseClass("""
            package org.example.mvvm;

            public class EditorViewModel extends ObservableObject {
                private Repository repository;
                private DelegateCommand saveCommand;

                public DelegateCommand getSaveCommand() {
                    return saveCommand != null ? saveCommand : (saveCommand = new DelegateCommand(() -> repository.storeAsync()));
                }
            }
            """);

        J.MethodDeclaration getter = delegateCommands.findAll(cd).get(0);
        DelegateCommandProperty command = extractor.extract(cd, getter);

        assertThat(command.getPropertyName()).isEqualTo("saveCommand");
        assertThat(command.getStrippedName()).isEqualTo("Save");
        assertThat(command.getBackingFieldName()).isEqualTo("saveCommand");
        assertThat(command.getCommandBody()).isNotNull();
        assertThat(command.isAsync()).isTrue();
        assertThat(command.usesExecuteMethod()).isFalse();
        assertThat(command.getCommandMethodName()).isEqualTo("saveAsync");
        assertThat(command.getParameters()).isEmpty();
    }

    @Test
    void executeShapeWithConventionalField() {
        J.ClassDeclaration cd = parseClass("""
            package org.example.mvvm;

            public class EditorViewModel extends ObservableObject {
                private DelegateCommand _deleteCommand;
                private boolean canDelete;

                public DelegateCommand getDeleteCommand() {
                    return new DelegateCommand(this::executeDelete, this::canExecuteDelete);
                }

                public void executeDelete() {
                }

                public boolean canExecuteDelete() {
                    return canDelete;
                }
            }
            """);

        DelegateCommandProperty command = extractor.extract(cd, delegateCommands.findAll(cd).get(0));

        assertThat(command.usesExecuteMethod()).isTrue();
        assertThat(command.isAsync()).isFalse();
        assertThat(command.getBackingFieldName()).isEqualTo("_deleteCommand");
        assertThat(command.getCanExecuteTargetName()).isEqualTo("canDelete");
        assertThat(command.isCanExecuteRemovable()).isTrue();
        assertThat(command.getCommandMethodName()).isEqualTo("delete");
        assertThat(command.isFixable()).isTrue();
    }

    @Test
    void getterWithoutLambdaOrExecuteMethodIsNotFixable() {
        J.ClassDeclaration cd = parseClass("""
            package org.example.mvvm;

            public class EditorViewModel extends ObservableObject {
                public DelegateCommand getStoreCommand() {
                    return new DelegateCommand(this::persist);
                }

                private void persist() {
                }
            }
            """);

        DelegateCommandProperty command = extractor.extract(cd, delegateCommands.findAll(cd).get(0));

        assertThat(command.isFixable()).isFalse();
        assertThat(command.getBackingFieldName()).isNull();
    }

    @Test
    void commandTypeMatchersDoNotOverlap() {
        J.ClassDeclaration cd = parseClass("""
            package org.example.mvvm;

            public class ShellViewModel {
                public Command getOpenCommand() {
                    return null;
                }

                public DelegateCommand getCloseCommand() {
                    return null;
                }

                public DelegateCommand closeCommand() {
                    return null;
                }
            }
            """);

        assertThat(new CommandTypeMatcher(CommandTypeMatcher.SIMPLE_COMMAND).findAll(cd))
            .extracting(J.MethodDeclaration::getSimpleName)
            .containsExactly("getOpenCommand");
        assertThat(delegateCommands.findAll(cd))
            .extracting(J.MethodDeclaration::getSimpleName)
            .containsExactly("getCloseCommand");
    }
}
