package ai.textgrid.parser.cluster;

/**
 * Raised when a cluster handed to the engine breaks the invariants the cluster finder guarantees.
 */
public class MalformedClusterException extends RuntimeException {

    public MalformedClusterException(String message) {
        super(message);
    }
}
