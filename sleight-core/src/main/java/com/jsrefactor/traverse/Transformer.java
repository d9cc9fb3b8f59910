package com.jsrefactor.traverse;

import com.jsrefactor.Parser;
import com.jsrefactor.Printer;
import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Parses code, runs a visitor over it and splices the printed replacements
 * back into the original text. Code outside replaced nodes is kept byte for
 * byte, including comments and formatting. Inside a replacement, nodes that
 * were kept keep their text and the comments around them.
 */
public class Transformer {
    private static final Logger log = LoggerFactory.getLogger(Transformer.class);

    private final Printer printer;

    public Transformer(Printer printer) {
        this.printer = printer;
    }

    /**
     * @throws com.jsrefactor.ParseException if the code does not parse
     */
    public Transformed transform(String code, Visitor visitor) {
        Program program = Parser.parse(code);
        Rewrite rewrite = Traversal.traverse(program, visitor);
        if (rewrite.isEmpty()) {
            return new Transformed(code, false);
        }
        String result = apply(code, rewrite);
        log.debug("Applied {} replacement(s)", rewrite.replacements().size());
        return new Transformed(result, !result.equals(code));
    }

    String apply(String code, Rewrite rewrite) {
        List<Map.Entry<Node, Node>> entries = new ArrayList<>(rewrite.replacements().entrySet());
        entries.sort(Comparator.comparingInt(entry -> entry.getKey().start()));

        for (int i = 0; i < entries.size(); i++) {
            Node original = entries.get(i).getKey();
            if (!original.hasLocation() && !(original instanceof Program)) {
                throw new IllegalStateException("Cannot replace a node without source range: " + original.type());
            }
            if (i > 0 && original.start() < entries.get(i - 1).getKey().end()) {
                throw new IllegalStateException("Overlapping replacements at offset " + original.start());
            }
        }

        StringBuilder result = new StringBuilder(code);
        for (int i = entries.size() - 1; i >= 0; i--) {
            Node original = entries.get(i).getKey();
            result.replace(original.start(), original.end(), printer.print(entries.get(i).getValue(), code, original));
        }
        return result.toString();
    }

    /**
     * Result of a transformation.
     *
     * @param hasCodeChanged false when nothing was replaced or the output is
     *                       identical to the input
     */
    public record Transformed(String code, boolean hasCodeChanged) {
    }
}
