package info.isaksson.erland.tracematrix.core;

/** Thrown when the requirement roots yield no definitions at all. */
public class NoRequirementsFoundException extends Exception {
    public NoRequirementsFoundException(String message) {
        super(message);
    }
}
