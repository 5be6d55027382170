package pubspork.model.exception;

public class AlertReadException extends RuntimeException {

    private static final long serialVersionUID = -3981640127702119518L;

    public AlertReadException(String message, Throwable cause) {
        super(message, cause);
    }

}
