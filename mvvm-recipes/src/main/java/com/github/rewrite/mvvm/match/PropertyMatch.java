package com.github.rewrite.mvvm.match;

import com.github.rewrite.mvvm.MvvmRule;
import org.openrewrite.java.tree.J;

/**
 * A legacy property recognised by one of the matchers.
 * <p>
 * Matches are snapshots of one class body. They hold references into that tree and
 * must be re-derived once the class has been edited.
 */
public interface PropertyMatch {

    enum Kind {
        NOTIFIED_PROPERTY(MvvmRule.NOTIFIED_SETTER),
        SIMPLE_COMMAND(MvvmRule.SIMPLE_COMMAND_TYPE),
        DELEGATE_COMMAND(MvvmRule.DELEGATE_COMMAND_TYPE);

        private final MvvmRule rule;

        Kind(MvvmRule rule) {
            this.rule = rule;
        }

        public MvvmRule getRule() {
            return rule;
        }
    }

    Kind getKind();

    /**
     * Bean property name, e.g. {@code name} for {@code setName} or {@code saveCommand} for {@code getSaveCommand}.
     */
    String getPropertyName();

    /**
     * The accessor whose name the finding is reported on.
     */
    J.MethodDeclaration getReportedAccessor();

    default MvvmRule getRule() {
        return getKind().getRule();
    }
}
