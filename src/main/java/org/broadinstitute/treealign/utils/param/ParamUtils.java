package org.broadinstitute.treealign.utils.param;

/**
 * Range checks for numeric parameters.
 *
 * Double.NaN will generally cause a check to fail.  Note that any comparison with a NaN yields false.
 */
public final class ParamUtils {
    private ParamUtils () {}

    /**
     * Checks that the  input is within range and returns the same value or throws an {@link IllegalArgumentException}
     *
     * <p>Note that min can be greater than max, but that will guarantee that an exception is thrown.</p>
     *
     * @param val value to check
     * @param min minimum value for val
     * @param max maximum value for val
     * @param message the text message that would be pass to the exception thrown when val is out of range.
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static double inRange(final double val, final double min, final double max, final String message) {
        if ((val >= min) && (val <= max)){
            return val;
        } else {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks that the input {@code int} value is greater than or equal to zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown when val &lt; 0.
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int isPositiveOrZero(final int val, final String message) {
        if (val < 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * Checks that the input {@code int} value is strictly positive and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown when val &lt;= 0.
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int isPositive(final int val, final String message) {
        if (val <= 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }
}
