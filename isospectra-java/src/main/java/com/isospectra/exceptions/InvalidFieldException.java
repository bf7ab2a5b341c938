package com.isospectra.exceptions;

/**
 * Exception thrown when a field cannot be spectrally transformed, for instance because it has
 * fewer than three (spatial) dimensions.
 */
public final class InvalidFieldException extends SpectrumException {

    private final int rank;

    public InvalidFieldException(String message, int rank) {
        super(message);
        this.rank = rank;
    }

    /**
     * Creates the exception raised for a field with too few dimensions.
     *
     * @param rank the number of dimensions the field actually has
     */
    public static InvalidFieldException tooFewDimensions(int rank) {
        return new InvalidFieldException(
            String.format("Field should have at least 3 spatial dimensions, got %d", rank), rank);
    }

    /**
     * The rank of the rejected field
     */
    public int rank() {
        return rank;
    }
}
