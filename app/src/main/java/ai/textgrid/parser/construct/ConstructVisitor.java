package ai.textgrid.parser.construct;

/**
 * Exhaustive match over the construct variants.
 */
public interface ConstructVisitor<R> {

    R visitTable(TableConstruct table);

    R visitMatrix(MatrixConstruct matrix);

    R visitKeyValue(KeyValueConstruct keyValue);

    R visitList(ListConstruct list);

    R visitTree(TreeConstruct tree);
}
