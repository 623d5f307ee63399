package ai.textgrid.parser.classify;

import ai.textgrid.parser.cluster.CellCluster;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes classification traces to the log at debug level.
 */
public class LoggingClassificationListener implements ClassificationListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingClassificationListener.class);

    @Override
    public void onClassified(CellCluster cluster, Signature signature, Optional<Classification> classification) {
        if (!LOGGER.isDebugEnabled()) {
            return;
        }
        LOGGER.debug("Cluster {} ({} cells) signature {} [{}] pattern {} -> {}",
                cluster.bounds(), cluster.size(), signature.code(), signature.description(),
                signature.pattern().replace('\n', '/'),
                classification.map(Classification::describe).orElse("no construct"));
    }
}
