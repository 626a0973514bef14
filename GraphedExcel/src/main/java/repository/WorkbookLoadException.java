package repository;

import java.io.IOException;

/** The workbook could not be opened or read. Fatal for the run. */
public class WorkbookLoadException extends IOException {

    public WorkbookLoadException(String message) {
        super(message);
    }

    public WorkbookLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
