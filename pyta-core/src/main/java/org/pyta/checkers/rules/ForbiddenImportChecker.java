package org.pyta.checkers.rules;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.checkers.CheckContext;
import org.pyta.checkers.NodeChecker;
import org.pyta.lint.Diagnostic;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * E9999: Only modules on the configured allow-list may be imported.
 *
 * Without an allow-list every import is accepted. Relative imports name the package being
 * written and are never reported.
 */
public class ForbiddenImportChecker implements NodeChecker {

    private static final String RULE_ID = "E9999";
    private static final String SYMBOL = "forbidden-import";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public String symbol() {
        return SYMBOL;
    }

    @Override
    public String description() {
        return "Only allowed modules are imported";
    }

    @Override
    public Set<NodeKind> kinds() {
        return EnumSet.of(NodeKind.IMPORT, NodeKind.IMPORT_FROM);
    }

    @Override
    public Stream<Diagnostic> check(SyntaxNode node, CheckContext ctx) {
        return importedModules(node, ctx).stream()
                                         .filter(module -> !ctx.analysis()
                                                               .isImportAllowed(module))
                                         .map(module -> ctx.diagnostic(RULE_ID,
                                                                       SYMBOL,
                                                                       node.span(),
                                                                       "You may not import \"" + module
                                                                       + "\" in this exercise. Use only the "
                                                                       + "modules you were given, or write the "
                                                                       + "code yourself.")
                                                           .withFix("Remove the import of \"" + module + "\""));
    }

    private static List<String> importedModules(SyntaxNode node, CheckContext ctx) {
        if (node.is(NodeKind.IMPORT_FROM)) {
            var relative = node.attribute("level")
                               .filter(level -> !level.equals("0"))
                               .isPresent();
            return relative
                   ? List.of()
                   : node.attribute("module")
                         .map(List::of)
                         .orElse(List.of());
        }
        return ctx.tree()
                  .children(node, "names")
                  .stream()
                  .flatMap(alias -> alias.attribute("name")
                                         .stream())
                  .toList();
    }
}
