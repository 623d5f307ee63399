package ai.textgrid.parser.domain;

import ai.textgrid.parser.construct.Construct;
import ai.textgrid.parser.surface.GridSurface;
import java.util.Optional;

/**
 * Runs the detection pipeline over a domain and returns the first construct it yields.
 */
@FunctionalInterface
public interface NestedRegionParser {

    Optional<Construct> parseRegion(GridSurface region, int depth);
}
