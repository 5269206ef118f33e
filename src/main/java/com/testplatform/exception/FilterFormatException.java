package com.testplatform.exception;

/**
 * Exception thrown when a test case filter cannot be parsed.
 * Always a caller input error; never retried.
 */
public class FilterFormatException extends TestPlatformException {

    private final FilterFormatError error;

    public FilterFormatException(FilterFormatError error, String filter) {
        super("Incorrect format for TestCaseFilter " + error.getDescription()
                + ". Specify the correct format and try again: '" + filter + "'");
        this.error = error;
    }

    public FilterFormatException(FilterFormatError error, String filter, String detail) {
        super("Incorrect format for TestCaseFilter " + error.getDescription()
                + " (" + detail + "). Specify the correct format and try again: '" + filter + "'");
        this.error = error;
    }

    public FilterFormatError getError() {
        return error;
    }
}
