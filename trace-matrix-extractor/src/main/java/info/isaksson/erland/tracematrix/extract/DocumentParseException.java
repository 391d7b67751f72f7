package info.isaksson.erland.tracematrix.extract;

/** A single document could not be parsed. The scanner skips the document and continues. */
public class DocumentParseException extends Exception {
    private final String path;

    public DocumentParseException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public DocumentParseException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
