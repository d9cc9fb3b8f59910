package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.Printer;
import com.jsrefactor.ast.Expression;
import com.jsrefactor.ast.Identifier;
import com.jsrefactor.ast.TemplateElement;
import com.jsrefactor.ast.TemplateLiteral;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.Modification;
import com.jsrefactor.editor.Position;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.NodePath;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Part of a template's text, extracted into a string variable that is
 * interpolated back: {@code `Hello world`} with "world" selected becomes
 * {@code `Hello ${world}`}.
 *
 * @param userSelection    the selected text inside the template
 * @param selected         source text under the user selection
 * @param replacement      printed template with the new substitution
 * @param insertedEscapes  backslashes added before the selection when the
 *                         text moved into template quotes
 */
public record PartialTemplateLiteralOccurrence(
    NodePath path,
    Selection selection,
    String code,
    Variable variable,
    Selection userSelection,
    String selected,
    String replacement,
    int insertedEscapes
) implements Occurrence {
    // Length of "${" inserted before the identifier
    private static final int OPENING_INTERPOLATION_LENGTH = 2;

    /**
     * Builds the occurrence when the user selection is a single-line range
     * inside one of the template's quasis. Computes everything up front and
     * has no side effects, so an empty result costs nothing to discard.
     */
    public static Optional<PartialTemplateLiteralOccurrence> tryCreate(
        NodePath path,
        String code,
        Selection userSelection,
        RefactoringConfig config,
        Printer printer
    ) {
        if (!(path.node() instanceof TemplateLiteral template) || !template.hasLocation()) {
            return Optional.empty();
        }
        Selection selection = Selection.fromNode(template);
        if (selection.isMultiLines() || userSelection.isMultiLines() || userSelection.isEmpty()) {
            return Optional.empty();
        }

        List<TemplateElement> quasis = template.quasis();
        int index = -1;
        for (int i = 0; i < quasis.size(); i++) {
            if (userSelection.isInsideNode(quasis.get(i))) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            return Optional.empty();
        }

        // Split the source text, which may be the body of a string literal
        // and so carry backticks that template quotes must escape.
        TemplateElement quasi = quasis.get(index);
        String text = code.substring(quasi.start(), quasi.end());
        Optional<Parts> parts = Parts.of(text, userSelection, Position.fromAst(quasi.loc().start()));
        if (parts.isEmpty() || splitsEscape(parts.get().before())
            || splitsEscape(parts.get().before() + parts.get().selected())) {
            return Optional.empty();
        }

        Variable variable = Variable.forStringLiteral(parts.get().selected(), null, null, config);
        String before = escapeForTemplate(parts.get().before());
        String after = escapeForTemplate(parts.get().after());

        List<TemplateElement> newQuasis = new ArrayList<>(quasis.subList(0, index));
        newQuasis.add(new TemplateElement(before, false));
        newQuasis.add(new TemplateElement(after, quasi.tail()));
        newQuasis.addAll(quasis.subList(index + 1, quasis.size()));

        List<Expression> newExpressions = new ArrayList<>(template.expressions().subList(0, index));
        newExpressions.add(new Identifier(variable.name()));
        newExpressions.addAll(template.expressions().subList(index, template.expressions().size()));

        String replacement = printer.print(new TemplateLiteral(newExpressions, newQuasis));
        String extractedCode = code.substring(template.start(), template.end());
        return Optional.of(new PartialTemplateLiteralOccurrence(
            path, selection, extractedCode, variable, userSelection, parts.get().selected(), replacement,
            before.length() - parts.get().before().length()));
    }

    // An odd run of trailing backslashes means the selection starts inside an escape
    private static boolean splitsEscape(String before) {
        int backslashes = 0;
        for (int i = before.length() - 1; i >= 0 && before.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    static String escapeForTemplate(String text) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                sb.append(c).append(text.charAt(++i));
            } else if (c == '`' || (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '{')) {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Double-quoted string source for template or string literal text.
     * Existing escapes are kept as written; bare double quotes get escaped.
     */
    static String toStringSource(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                if (i + 1 < text.length()) {
                    sb.append(c).append(text.charAt(++i));
                } else {
                    sb.append("\\\\");
                }
            } else if (c == '"') {
                sb.append("\\\"");
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public Modification modification() {
        return new Modification(replacement, selection);
    }

    @Override
    public Declaration declaration() {
        return new Declaration(variable.name(), toStringSource(selected));
    }

    @Override
    public Position extractedIdPosition() {
        return new Position(
            selection.start().line() + selection.height() + 1,
            userSelection.start().character() + insertedEscapes + OPENING_INTERPOLATION_LENGTH
        );
    }
}
