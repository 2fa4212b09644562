package singleflight.config;

/**
 * Utility class for validating group configuration values
 */
public final class GroupConfigValidator {

    private GroupConfigValidator() {}

    /**
     * Validate that a value falls within a specified range
     *
     * @param value The value to validate
     * @param min Minimum allowed value (inclusive)
     * @param max Maximum allowed value (inclusive)
     * @param fieldName Name of the field being validated
     * @throws IllegalArgumentException if value is out of range
     */
    public static void validateRange(long value, long min, long max, String fieldName) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                String.format("%s must be between %d and %d", fieldName, min, max)
            );
        }
    }

    public static void validateNotBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
    }
}
