package automaton;

// Constant-time index checks run before any node field is dereferenced.
final class NodeValidator {

    private final NodeArena arena;

    NodeValidator(NodeArena arena) {
        this.arena = arena;
    }

    void validateNodeIndex(int index) {
        if (index < 0 || index >= arena.size()) {
            throw NodeIndexException.invalid(index, arena.size());
        }
    }

    void validateActiveNodeIndex(int index) {
        validateNodeIndex(index);
        if (!arena.isActive(index)) {
            throw NodeIndexException.inactive(index);
        }
    }
}
