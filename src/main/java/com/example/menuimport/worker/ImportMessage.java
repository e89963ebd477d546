package com.example.menuimport.worker;

import com.example.menuimport.model.ImportProgress;
import com.example.menuimport.model.ImportResult;

/**
 * Messages a worker emits for one run: zero or more {@link Progress}, then exactly one
 * {@link Complete} or {@link Error}.
 */
public sealed interface ImportMessage {

    String CANCELLED_MESSAGE = "Import cancelled";

    static ImportMessage progress(long processed, long total, String stage) {
        return new Progress(new ImportProgress(processed, total, stage));
    }

    static ImportMessage complete(ImportResult result) {
        return new Complete(result);
    }

    static ImportMessage error(String message) {
        return new Error(message, false);
    }

    static ImportMessage cancelled() {
        return new Error(CANCELLED_MESSAGE, true);
    }

    record Progress(ImportProgress progress) implements ImportMessage {
    }

    record Complete(ImportResult result) implements ImportMessage {
    }

    record Error(String message, boolean cancelled) implements ImportMessage {
    }
}
