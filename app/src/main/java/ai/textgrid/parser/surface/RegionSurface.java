package ai.textgrid.parser.surface;

import java.util.Objects;

/**
 * Restricts another surface to a rectangle. Coordinates stay absolute; cells outside the region read as empty.
 */
public final class RegionSurface implements GridSurface {

    private final GridSurface delegate;
    private final CellRange region;

    public RegionSurface(GridSurface delegate, CellRange region) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.region = Objects.requireNonNull(region, "region");
    }

    public CellRange region() {
        return region;
    }

    @Override
    public String getCellContent(int row, int col) {
        if (!region.contains(row, col)) {
            return "";
        }
        return delegate.getCellContent(row, col);
    }

    @Override
    public int rowCount() {
        return delegate.rowCount();
    }

    @Override
    public int columnCount() {
        return delegate.columnCount();
    }

    @Override
    public CellRange bounds() {
        return region;
    }
}
