package com.github.rewrite.mvvm;

import org.openrewrite.ExecutionContext;

import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation of the MVVM recipes.
 * <p>
 * A host puts a {@link BooleanSupplier} under {@link #KEY} in the {@link ExecutionContext}. The recipes poll it
 * between matcher invocations and between the steps of a rewrite; once it returns true the remaining
 * classes and properties are left as they are.
 */
public final class MvvmCancellation {

    public static final String KEY = "com.github.rewrite.mvvm.cancellation";

    private MvvmCancellation() {
    }

    public static void install(ExecutionContext ctx, BooleanSupplier cancelled) {
        ctx.putMessage(KEY, cancelled);
    }

    public static boolean isCancelled(ExecutionContext ctx) {
        BooleanSupplier cancelled = ctx.getMessage(KEY);
        return cancelled != null && cancelled.getAsBoolean();
    }
}
