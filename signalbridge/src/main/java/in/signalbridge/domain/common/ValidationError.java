package in.signalbridge.domain.common;

/**
 * Single validation failure with optional field detail.
 */
public record ValidationError(
    ValidationErrorCode code,
    String field,
    String detail
) {
    public static ValidationError of(ValidationErrorCode code) {
        return new ValidationError(code, null, null);
    }

    public static ValidationError of(ValidationErrorCode code, String field, String detail) {
        return new ValidationError(code, field, detail);
    }

    /**
     * Human-readable message: the code message plus detail when present.
     */
    public String message() {
        return detail == null ? code.getMessage() : code.getMessage() + " (" + detail + ")";
    }
}
