package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.Printer;
import com.jsrefactor.ast.Literal;
import com.jsrefactor.ast.MemberExpression;
import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.Property;
import com.jsrefactor.ast.TemplateElement;
import com.jsrefactor.ast.TemplateLiteral;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.NodePath;

import java.util.List;
import java.util.Optional;

/**
 * Picks the extraction variant for a selected expression. Rules are tried in
 * order and the first that applies wins: shorthand property, member access,
 * string literal with a sub-selection (retried as a template), partial
 * template text, and finally the generic variant.
 */
public class Occurrences {
    private final RefactoringConfig config;
    private final Printer printer;

    public Occurrences(RefactoringConfig config) {
        this.config = config;
        this.printer = new Printer(config.indentSize());
    }

    /**
     * @param path      the expression to extract
     * @param code      the source the path was parsed from
     * @param selection the user's selection
     */
    public Occurrence classify(NodePath path, String code, Selection selection) {
        Node node = path.node();
        Node parent = path.parentNode();
        Selection nodeSelection = Selection.fromNode(node);
        String extracted = code.substring(node.start(), node.end());

        if (canBeShorthand(path)) {
            Variable variable = Variable.forShorthand(node, parent, config);
            if (variable.valid()) {
                Selection keySelection = Selection.fromNode(((Property) parent).key());
                return new ShorthandOccurrence(path, nodeSelection, extracted, variable, keySelection);
            }
        }

        if (node instanceof MemberExpression member) {
            String parentObject = code.substring(member.object().start(), member.object().end());
            return new MemberExpressionOccurrence(path, nodeSelection, extracted, Variable.forNode(node, parent, config),
                parentObject, member.computed(), config.declarationKeyword(), DestructureStrategy.DESTRUCTURE);
        }

        if (node instanceof Literal literal && literal.value() instanceof String value) {
            if (!selection.isEmpty() && selection.isStrictlyInsideNode(node)) {
                return classify(path.withNode(toTemplateLiteral(literal)), code, selection);
            }
            return new StringLiteralOccurrence(path, nodeSelection, extracted,
                Variable.forStringLiteral(value, node, parent, config));
        }

        if (node instanceof TemplateLiteral && !selection.isEmpty()) {
            Optional<Occurrence> partial = tryClassify(path, code, selection);
            if (partial.isPresent()) {
                return partial.get();
            }
        }

        return new GenericOccurrence(path, nodeSelection, extracted, Variable.forNode(node, parent, config));
    }

    /**
     * The partial template variant, if the selection allows it.
     */
    public Optional<Occurrence> tryClassify(NodePath path, String code, Selection selection) {
        return PartialTemplateLiteralOccurrence.tryCreate(path, code, selection, config, printer)
            .map(occurrence -> occurrence);
    }

    // The value of a non-computed, non-shorthand object literal property
    private static boolean canBeShorthand(NodePath path) {
        return path.parentNode() instanceof Property property
            && "value".equals(path.key())
            && !property.computed()
            && !property.shorthand();
    }

    /**
     * An equivalent template literal at the literal's location. The literal's
     * escapes carry over unchanged; backticks and substitution openers get
     * escaped.
     */
    static TemplateLiteral toTemplateLiteral(Literal literal) {
        String inner = literal.raw().substring(1, literal.raw().length() - 1);
        String raw = inner.replace("`", "\\`").replace("${", "\\${");
        TemplateElement quasi = new TemplateElement(
            literal.start() + 1, literal.end() - 1,
            literal.startLine(), literal.startCol() + 1, literal.endLine(), literal.endCol() - 1,
            new TemplateElement.TemplateElementValue(raw, (String) literal.value()),
            true
        );
        return new TemplateLiteral(
            literal.start(), literal.end(),
            literal.startLine(), literal.startCol(), literal.endLine(), literal.endCol(),
            List.of(), List.of(quasi)
        );
    }
}
