package com.barvault.dataservice.exception;

/**
 * A bulk-import row failed validation. Row numbers are 1-based with the header as row 1;
 * row 0 refers to the file as a whole.
 */
public class ValidationException extends CatalogException {

    private final int rowNumber;

    public ValidationException(int rowNumber, String message) {
        super("Row " + rowNumber + ": " + message);
        this.rowNumber = rowNumber;
    }

    public int getRowNumber() {
        return rowNumber;
    }
}
