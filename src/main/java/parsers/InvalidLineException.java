package parsers;

public class InvalidLineException extends ConfigParseException {

    public InvalidLineException(String filename, int lineNumber) {
        super("Unable to parse line " + lineNumber
                + " while parsing file at " + filename, filename, lineNumber);
    }
}
