package ai.textgrid.parser.construct;

import ai.textgrid.parser.surface.CellRange;
import java.util.Objects;
import java.util.Optional;

/**
 * Rectangle owned by a tree parent, with the construct parsed from it, if any.
 */
public record DomainRegion(int parentIndex,
                           Optional<CellRange> range,
                           int filledCells,
                           DomainStatus status,
                           Optional<Construct> nestedConstruct) {

    public DomainRegion {
        Objects.requireNonNull(status, "status");
        range = range == null ? Optional.empty() : range;
        nestedConstruct = nestedConstruct == null ? Optional.empty() : nestedConstruct;
        if (status == DomainStatus.NESTED_CONSTRUCT && nestedConstruct.isEmpty()) {
            throw new IllegalArgumentException("nested construct status requires a construct");
        }
        if (status != DomainStatus.NESTED_CONSTRUCT && nestedConstruct.isPresent()) {
            throw new IllegalArgumentException("construct present but status is " + status);
        }
    }

    public static DomainRegion empty(int parentIndex) {
        return new DomainRegion(parentIndex, Optional.empty(), 0, DomainStatus.EMPTY, Optional.empty());
    }

    public static DomainRegion of(int parentIndex, CellRange range, int filledCells, DomainStatus status) {
        return new DomainRegion(parentIndex, Optional.of(range), filledCells, status, Optional.empty());
    }

    public static DomainRegion nested(int parentIndex, CellRange range, int filledCells, Construct construct) {
        return new DomainRegion(parentIndex, Optional.of(range), filledCells,
                DomainStatus.NESTED_CONSTRUCT, Optional.of(construct));
    }

    public boolean hasNestedConstruct() {
        return nestedConstruct.isPresent();
    }
}
