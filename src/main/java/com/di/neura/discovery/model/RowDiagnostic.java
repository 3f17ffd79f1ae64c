package com.di.neura.discovery.model;

import com.di.neura.exception.ErrorCategory;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Structured diagnostic attached to a row-local failure ({@link Status#ERROR}).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Value
@Builder
@Jacksonized
public class RowDiagnostic {

    public static final String BAD_EPISODE_NAME = "bad_episode_name";
    public static final String FINGERPRINT_FAILED = "fingerprint_failed";

    /** Machine-readable reason code. */
    String reason;

    /** Simple class name of the exception, when one was raised. */
    String exception;

    String message;

    /** {@link ErrorCategory} name of the exception. */
    String category;

    public static RowDiagnostic badEpisodeName(String fileName) {
        return RowDiagnostic.builder()
                .reason(BAD_EPISODE_NAME)
                .message("cannot parse episode index from " + fileName)
                .category(ErrorCategory.VALIDATION_ERROR.name())
                .build();
    }

    public static RowDiagnostic fromException(Throwable t) {
        return RowDiagnostic.builder()
                .reason(FINGERPRINT_FAILED)
                .exception(t.getClass().getSimpleName())
                .message(t.getMessage())
                .category(ErrorCategory.categorize(t).name())
                .build();
    }
}
