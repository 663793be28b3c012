package com.whereq.tessera.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error stored on a FAILED job
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobError {
    private ErrorKind kind;
    private String message;

    public static JobError of(ErrorKind kind, String message) {
        return new JobError(kind, message);
    }
}
