package selection;

public class EmptyInputException extends SelectionException {

    public EmptyInputException() {
        super(Kind.EMPTY_INPUT, "Cannot select from an empty sequence");
    }
}
