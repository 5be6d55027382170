package pubspork.model.exception;

/**
 * Thrown when a raw record carries neither a usable title nor a DOI and so cannot
 * become a publication the engine can match or store.
 */
public class InvalidRecordException extends RuntimeException {

    private static final long serialVersionUID = 4518021964367261705L;

    public InvalidRecordException(String message) {
        super(message);
    }

}
