package com.github.migration.mvvm;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field whose accessors and change notification are generated.
 * <p>
 * For a field {@code name} the generator emits {@code getName()} and a {@code setName(..)}
 * that compares, assigns and raises the change notification for {@code "name"}.
 */
@Target({ElementType.FIELD})
@Retention(RetentionPolicy.SOURCE)
public @interface ObservableProperty {
}
