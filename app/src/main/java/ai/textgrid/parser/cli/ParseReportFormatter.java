package ai.textgrid.parser.cli;

import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.construct.Construct;
import ai.textgrid.parser.construct.ConstructVisitor;
import ai.textgrid.parser.construct.DomainRegion;
import ai.textgrid.parser.construct.KeyValueConstruct;
import ai.textgrid.parser.construct.KeyValuePair;
import ai.textgrid.parser.construct.ListConstruct;
import ai.textgrid.parser.construct.MatrixConstruct;
import ai.textgrid.parser.construct.TableConstruct;
import ai.textgrid.parser.construct.TreeConstruct;
import ai.textgrid.parser.construct.TreeElement;
import ai.textgrid.parser.engine.ParseDiagnostic;
import ai.textgrid.parser.engine.ParseResult;
import java.util.Locale;
import java.util.Optional;

/**
 * Renders a {@link ParseResult} as an indented plain-text report.
 */
public class ParseReportFormatter {

    private static final String INDENT = "  ";

    public String format(ParseResult result) {
        StringBuilder out = new StringBuilder();
        for (Construct construct : result.constructs()) {
            append(out, construct, 0);
        }
        for (CellCluster cluster : result.unclassified()) {
            out.append("unclassified ").append(cluster.bounds()).append(System.lineSeparator());
        }
        for (ParseDiagnostic diagnostic : result.diagnostics()) {
            out.append("warning: ").append(diagnostic).append(System.lineSeparator());
        }
        return out.toString();
    }

    private void append(StringBuilder out, Construct construct, int depth) {
        out.append(INDENT.repeat(depth))
                .append(construct.type().label())
                .append(' ').append(construct.bounds())
                .append(" [").append(construct.signature().code()).append("] ")
                .append(construct.accept(new Summary()))
                .append(System.lineSeparator());
        if (construct instanceof TreeConstruct tree) {
            for (TreeElement root : tree.roots()) {
                appendElement(out, tree, root, depth + 1);
            }
        }
    }

    private void appendElement(StringBuilder out, TreeConstruct tree, TreeElement element, int depth) {
        out.append(INDENT.repeat(depth))
                .append("- ").append(element.content())
                .append(" (").append(element.role().name().toLowerCase(Locale.ROOT))
                .append(", level ").append(element.level()).append(')');
        Optional<DomainRegion> domain = tree.domainOf(element);
        domain.ifPresent(region -> out.append(" domain ")
                .append(region.range().map(Object::toString).orElse("-"))
                .append(' ').append(region.status().name().toLowerCase(Locale.ROOT)));
        out.append(System.lineSeparator());
        domain.flatMap(DomainRegion::nestedConstruct).ifPresent(nested -> append(out, nested, depth + 2));
        for (TreeElement child : tree.children(element)) {
            appendElement(out, tree, child, depth + 1);
        }
    }

    private static final class Summary implements ConstructVisitor<String> {

        @Override
        public String visitTable(TableConstruct table) {
            return table.entities().size() + " rows x " + table.attributes().size() + " columns";
        }

        @Override
        public String visitMatrix(MatrixConstruct matrix) {
            return matrix.primaryEntities().size() + " x " + matrix.secondaryEntities().size() + " headers";
        }

        @Override
        public String visitKeyValue(KeyValueConstruct keyValue) {
            StringBuilder summary = new StringBuilder(keyValue.orientation().name().toLowerCase(Locale.ROOT));
            keyValue.mainHeader().ifPresent(header -> summary.append(" '").append(header.content()).append('\''));
            summary.append(':');
            for (KeyValuePair pair : keyValue.pairs()) {
                summary.append(' ').append(pair.keyText()).append('=').append(String.join("|", pair.valueTexts()));
            }
            return summary.toString();
        }

        @Override
        public String visitList(ListConstruct list) {
            return list.orientation().name().toLowerCase(Locale.ROOT) + " '" + list.header().content() + "' with "
                    + list.items().size() + " items";
        }

        @Override
        public String visitTree(TreeConstruct tree) {
            return tree.orientation().name().toLowerCase(Locale.ROOT) + ", " + tree.elements().size()
                    + " elements, depth " + tree.maxDepth();
        }
    }
}
