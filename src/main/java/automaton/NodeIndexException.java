package automaton;

/**
 * Thrown when a caller-supplied node index does not name a node of the trie.
 * {@link Kind#INVALID} means the index was never issued by the arena,
 * {@link Kind#INACTIVE} means the slot exists but is currently recycled.
 */
public class NodeIndexException extends IndexOutOfBoundsException {

    public enum Kind {
        INVALID,
        INACTIVE
    }

    private final int index;
    private final Kind kind;

    public NodeIndexException(int index, Kind kind, String message) {
        super(message);
        this.index = index;
        this.kind = kind;
    }

    static NodeIndexException invalid(int index, int numberOfNodes) {
        return new NodeIndexException(index, Kind.INVALID,
                "node index " + index + " out of range, expected a value in [0, " + numberOfNodes + ")");
    }

    static NodeIndexException inactive(int index) {
        return new NodeIndexException(index, Kind.INACTIVE,
                "node index " + index + " is not an active node");
    }

    public int index() {
        return index;
    }

    public Kind kind() {
        return kind;
    }
}
