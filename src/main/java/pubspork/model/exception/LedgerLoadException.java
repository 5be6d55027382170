package pubspork.model.exception;

/**
 * The known pubs ledger exists but could not be parsed as a whole. A run must stop
 * here rather than continue with an empty ledger.
 */
public class LedgerLoadException extends RuntimeException {

    private static final long serialVersionUID = -7125730211568440931L;

    public LedgerLoadException(String message) {
        super(message);
    }

    public LedgerLoadException(String message, Throwable cause) {
        super(message, cause);
    }

}
