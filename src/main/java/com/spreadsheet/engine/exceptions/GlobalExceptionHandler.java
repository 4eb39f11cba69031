package com.spreadsheet.engine.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches custom exceptions from anywhere in the controllers or services,
 * returning user-friendly error JSON with an HTTP 4xx code instead of 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidCellReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCellReference(InvalidCellReferenceException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_CELL_REFERENCE", ex);
    }

    @ExceptionHandler(InvalidSheetNameException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSheetName(InvalidSheetNameException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_SHEET_NAME", ex);
    }

    @ExceptionHandler(InvalidNamedRangeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidNamedRange(InvalidNamedRangeException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_NAMED_RANGE", ex);
    }

    @ExceptionHandler(InvalidPivotConfigException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPivotConfig(InvalidPivotConfigException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_PIVOT_CONFIG", ex);
    }

    @ExceptionHandler(WorkbookFormatException.class)
    public ResponseEntity<ErrorResponse> handleWorkbookFormat(WorkbookFormatException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_WORKBOOK_FORMAT", ex);
    }

    @ExceptionHandler(WorkbookNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleWorkbookNotFound(WorkbookNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "WORKBOOK_NOT_FOUND", ex);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "SHEET_NOT_FOUND", ex);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for other runtime exceptions not explicitly handled
        log.error("Unhandled error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "SERVER_ERROR", ex);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, RuntimeException ex) {
        if (status.is4xxClientError()) {
            log.debug("{} -> {} {}", code, status.value(), ex.getMessage());
        }
        return new ResponseEntity<>(new ErrorResponse(status.value(), code, ex.getMessage()), status);
    }
}
