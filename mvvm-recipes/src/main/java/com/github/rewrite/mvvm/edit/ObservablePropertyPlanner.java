package com.github.rewrite.mvvm.edit;

import com.github.rewrite.mvvm.config.MvvmConfiguration;
import com.github.rewrite.mvvm.match.BeanProperties;
import com.github.rewrite.mvvm.match.NotifiedProperty;
import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans the replacement of a notified setter (and its getter and backing field) by an
 * {@code @ObservableProperty} field:
 * <pre>
 * private String firstName;                         &#64;ObservableProperty
 * public String getFirstName() {...}        =>      &#64;NotifyPropertyChangedFor("fullName")
 * public void setFirstName(String value) {          private String firstName;
 *     firstName = value;
 *     onPropertyChanged();
 *     onPropertyChanged("fullName");
 * }
 * </pre>
 */
public class ObservablePropertyPlanner {

    public static final String OBSERVABLE_PROPERTY = "ObservableProperty";
    public static final String NOTIFY_PROPERTY_CHANGED_FOR = "NotifyPropertyChangedFor";

    private final MvvmConfiguration configuration;

    public ObservablePropertyPlanner(MvvmConfiguration configuration) {
        this.configuration = configuration;
    }

    public EditPlan plan(J.ClassDeclaration classDecl, NotifiedProperty property) {
        TypeTree type = property.getPropertyType();
        if (type == null) {
            return EditPlan.declined("the setter parameter has no declared type");
        }

        String fieldName = property.getPropertyName();
        J.VariableDeclarations backingField = property.getBackingFieldName() == null ? null :
            BeanProperties.findField(classDecl, property.getBackingFieldName());
        J.VariableDeclarations clash = BeanProperties.findField(classDecl, fieldName);
        if (clash != null && clash != backingField) {
            return EditPlan.declined("a field named '" + fieldName + "' already exists and is not the backing field");
        }
        if (backingField != null && backingField.hasModifier(J.Modifier.Type.Static)) {
            return EditPlan.declined("the backing field '" + property.getBackingFieldName() + "' is static");
        }

        J.MethodDeclaration firstAccessor = firstAccessor(classDecl, property);
        String indent = ClassBodyEditor.indentOf(classDecl);
        String observable = configuration.annotationType(OBSERVABLE_PROPERTY);
        String notifyFor = configuration.annotationType(NOTIFY_PROPERTY_CHANGED_FOR);

        List<J.Annotation> annotations = new ArrayList<>();
        annotations.add(LstFactory.annotation(Space.EMPTY, observable, null, null));
        for (String target : property.getNotifyTargets()) {
            annotations.add(LstFactory.annotation(Space.EMPTY, notifyFor, null, target));
        }

        JLeftPadded<Expression> initializer = null;
        if (backingField != null) {
            for (J.VariableDeclarations.NamedVariable variable : backingField.getVariables()) {
                if (variable.getSimpleName().equals(property.getBackingFieldName())) {
                    initializer = variable.getPadding().getInitializer();
                }
            }
        }

        J.VariableDeclarations field = LstFactory.field(LstFactory.commentsOf(removedMembers(classDecl, property, backingField)),
            annotations, indent, type, fieldName, initializer);

        EditPlan.Builder plan = EditPlan.builder()
            .insertBefore(firstAccessor.getId(), field)
            .remove(property.getSetter().getId());
        if (property.getGetter() != null) {
            plan.remove(property.getGetter().getId());
        }
        if (backingField != null) {
            removeVariable(plan, backingField, property.getBackingFieldName());
        }
        plan.ensureImport(observable);
        if (!property.getNotifyTargets().isEmpty()) {
            plan.ensureImport(notifyFor);
        }
        return plan.summary("@" + OBSERVABLE_PROPERTY + " " + type.toString().trim() + " " + fieldName).build();
    }

    /**
     * Getter, setter and wholly removed backing field, in class body order.
     */
    private static List<Statement> removedMembers(J.ClassDeclaration classDecl, NotifiedProperty property,
                                                  J.@Nullable VariableDeclarations backingField) {
        List<Statement> removed = new ArrayList<>();
        for (Statement statement : classDecl.getBody().getStatements()) {
            if (statement == property.getGetter() || statement == property.getSetter() ||
                (statement == backingField && backingField.getVariables().size() == 1)) {
                removed.add(statement);
            }
        }
        return removed;
    }

    private static J.MethodDeclaration firstAccessor(J.ClassDeclaration classDecl, NotifiedProperty property) {
        if (property.getGetter() == null) {
            return property.getSetter();
        }
        for (Statement statement : classDecl.getBody().getStatements()) {
            if (statement == property.getGetter()) {
                return property.getGetter();
            }
            if (statement == property.getSetter()) {
                return property.getSetter();
            }
        }
        return property.getSetter();
    }

    /**
     * Removes the whole declaration, or only the variable when it shares the declaration with others.
     */
    static void removeVariable(EditPlan.Builder plan, J.VariableDeclarations declaration, String variableName) {
        if (declaration.getVariables().size() == 1) {
            plan.remove(declaration.getId());
            return;
        }
        List<JRightPadded<J.VariableDeclarations.NamedVariable>> kept = new ArrayList<>();
        for (JRightPadded<J.VariableDeclarations.NamedVariable> variable : declaration.getPadding().getVariables()) {
            if (!variable.getElement().getSimpleName().equals(variableName)) {
                kept.add(variable);
            }
        }
        J.VariableDeclarations.NamedVariable first = kept.get(0).getElement();
        kept.set(0, kept.get(0).withElement(first.withPrefix(Space.format(" "))));
        JRightPadded<J.VariableDeclarations.NamedVariable> last = kept.get(kept.size() - 1);
        kept.set(kept.size() - 1, last.withAfter(Space.EMPTY));
        plan.replace(declaration.getId(), declaration.getPadding().withVariables(kept));
    }
}
