package com.github.rewrite.mvvm;

/**
 * The legacy MVVM patterns this module reports.
 * <p>
 * Codes and slugs are stable; hosts use them to suppress or filter findings.
 */
public enum MvvmRule {

    NOTIFIED_SETTER(
        "MVVM0001",
        "notified-setter",
        "Naming",
        "Setter raises change notifications manually",
        "Setters that call onPropertyChanged(..) or setProperty(..) should be replaced by an " +
        "@ObservableProperty field so the accessors and notifications are generated.",
        "Property '%s' raises change notifications manually; convert it to an @ObservableProperty field",
        true
    ),

    DELEGATE_COMMAND_TYPE(
        "MVVM0002",
        "delegate-command-type",
        "Refactoring",
        "Property of type DelegateCommand",
        "Lazily created DelegateCommand properties should be replaced by a method annotated with " +
        "@RelayCommand so the command property is generated.",
        "Property '%s' exposes a DelegateCommand; convert it to a @RelayCommand method",
        true
    ),

    SIMPLE_COMMAND_TYPE(
        "MVVM0003",
        "simple-command-type",
        "Refactoring",
        "Property of type Command",
        "Command properties carry no structure a method signature can be derived from. " +
        "Replace them manually with a method annotated with @RelayCommand.",
        "Property '%s' exposes a Command; migrate it to a @RelayCommand method manually",
        false
    );

    /**
     * Severity of a finding. Every rule reports errors.
     */
    public enum Severity {
        ERROR
    }

    private static final String HELP_LINK_PREFIX = "docs/rules/";

    private final String code;
    private final String slug;
    private final String category;
    private final String title;
    private final String description;
    private final String messageFormat;
    private final boolean fixable;

    MvvmRule(String code, String slug, String category, String title, String description,
             String messageFormat, boolean fixable) {
        this.code = code;
        this.slug = slug;
        this.category = category;
        this.title = title;
        this.description = description;
        this.messageFormat = messageFormat;
        this.fixable = fixable;
    }

    public String getCode() {
        return code;
    }

    public String getSlug() {
        return slug;
    }

    public String getCategory() {
        return category;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return Severity.ERROR;
    }

    public boolean isEnabledByDefault() {
        return true;
    }

    /**
     * Whether a recipe in this module can rewrite the finding. {@link #SIMPLE_COMMAND_TYPE} cannot.
     */
    public boolean isFixable() {
        return fixable;
    }

    public String getHelpLink() {
        return HELP_LINK_PREFIX + code + ".md";
    }

    /**
     * Human readable message for one finding, prefixed with the rule code.
     */
    public String message(String propertyName) {
        return code + " " + String.format(messageFormat, propertyName);
    }

    /**
     * Resolves a rule from its code or slug, case-insensitively. Returns null when unknown.
     */
    public static MvvmRule fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (MvvmRule rule : values()) {
            if (rule.code.equalsIgnoreCase(normalized) ||
                rule.slug.equalsIgnoreCase(normalized) ||
                rule.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
                return rule;
            }
        }
        return null;
    }
}
