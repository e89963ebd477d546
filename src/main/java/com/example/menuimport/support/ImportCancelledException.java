package com.example.menuimport.support;

/**
 * Outcome of a run that was stopped on request, as opposed to one that failed.
 */
public class ImportCancelledException extends ImportProcessingException {

    public ImportCancelledException(String message) {
        super(message);
    }
}
