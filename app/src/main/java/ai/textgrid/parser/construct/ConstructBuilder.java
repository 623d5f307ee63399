package ai.textgrid.parser.construct;

import ai.textgrid.parser.classify.Classification;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.surface.GridSurface;
import java.util.Objects;

/**
 * Turns a classified cluster into its construct by dispatching to the per-type builder.
 */
public class ConstructBuilder {

    private final TableBuilder tableBuilder;
    private final MatrixBuilder matrixBuilder;
    private final KeyValueBuilder keyValueBuilder;
    private final ListBuilder listBuilder;
    private final TreeBuilder treeBuilder;

    public ConstructBuilder() {
        this(TreeBuilder.DEFAULT_INDENT_WIDTH);
    }

    public ConstructBuilder(int indentWidth) {
        this(new TableBuilder(), new MatrixBuilder(), new KeyValueBuilder(), new ListBuilder(),
                new TreeBuilder(indentWidth));
    }

    ConstructBuilder(TableBuilder tableBuilder,
                     MatrixBuilder matrixBuilder,
                     KeyValueBuilder keyValueBuilder,
                     ListBuilder listBuilder,
                     TreeBuilder treeBuilder) {
        this.tableBuilder = Objects.requireNonNull(tableBuilder, "tableBuilder");
        this.matrixBuilder = Objects.requireNonNull(matrixBuilder, "matrixBuilder");
        this.keyValueBuilder = Objects.requireNonNull(keyValueBuilder, "keyValueBuilder");
        this.listBuilder = Objects.requireNonNull(listBuilder, "listBuilder");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder");
    }

    public Construct build(CellCluster cluster, GridSurface surface, Classification classification) {
        Objects.requireNonNull(cluster, "cluster");
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(classification, "classification");
        return switch (classification.constructType()) {
            case TABLE -> tableBuilder.build(cluster, surface, classification);
            case MATRIX -> matrixBuilder.build(cluster, surface, classification);
            case KEY_VALUE -> keyValueBuilder.build(cluster, surface, classification);
            case LIST -> listBuilder.build(cluster, surface, classification);
            case TREE -> treeBuilder.build(cluster, surface, classification);
        };
    }
}
