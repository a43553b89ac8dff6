package com.github.migration.mvvm;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Raises an additional change notification for another property whenever the
 * annotated {@link ObservableProperty} field changes.
 */
@Target({ElementType.FIELD})
@Retention(RetentionPolicy.SOURCE)
@Repeatable(NotifyPropertyChangedFor.List.class)
public @interface NotifyPropertyChangedFor {

    /**
     * Name of the dependent property, e.g. {@code "fullName"}.
     */
    String value();

    @Target({ElementType.FIELD})
    @Retention(RetentionPolicy.SOURCE)
    @interface List {
        NotifyPropertyChangedFor[] value();
    }

}
