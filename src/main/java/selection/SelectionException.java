package selection;

/**
 * Precondition violation reported by a selector before any work is done.
 */
public class SelectionException extends IllegalArgumentException {

    public enum Kind {
        EMPTY_INPUT,
        RANK_OUT_OF_RANGE
    }

    private final Kind kind;

    public SelectionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
