package selection;

public class RankOutOfRangeException extends SelectionException {

    private final int rank;
    private final int size;

    public RankOutOfRangeException(int rank, int size) {
        super(Kind.RANK_OUT_OF_RANGE, "Rank " + rank + " outside [0, " + (size - 1) + "]");
        this.rank = rank;
        this.size = size;
    }

    public int rank() {
        return rank;
    }

    public int size() {
        return size;
    }
}
