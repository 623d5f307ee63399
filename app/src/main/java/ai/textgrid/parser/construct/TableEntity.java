package ai.textgrid.parser.construct;

import java.util.List;
import java.util.Objects;

/**
 * One data row of a table, with its cells in column order.
 */
public record TableEntity(int index, int row, List<RoleCell> cells) {

    public TableEntity {
        cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
    }
}
