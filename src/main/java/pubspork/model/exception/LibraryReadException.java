package pubspork.model.exception;

public class LibraryReadException extends RuntimeException {

    private static final long serialVersionUID = 2290417316907442256L;

    public LibraryReadException(String message, Throwable cause) {
        super(message, cause);
    }

}
