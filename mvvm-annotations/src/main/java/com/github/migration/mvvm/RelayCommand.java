package com.github.migration.mvvm;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Generates a command property that relays to the annotated method.
 * <p>
 * A method {@code save()} produces {@code getSaveCommand()}; a method returning a
 * {@link java.util.concurrent.CompletionStage} named {@code saveAsync()} produces an
 * asynchronous command with the same property name.
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.SOURCE)
public @interface RelayCommand {

    /**
     * Name of a boolean field, boolean property or no-arg boolean method that decides
     * whether the command can execute. Empty means always executable.
     */
    String canExecute() default "";

}
