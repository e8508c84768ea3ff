package com.plogic.exception;

/**
 * Base exception for text that cannot be turned into a proposition.
 * Carries the offending position and the full input; the message quotes only the part
 * of long input around the position.
 */
public abstract class PropositionParseException extends LogicException {

    private static final int EXCERPT_RADIUS = 32;

    private final String input;
    private final int position;

    protected PropositionParseException(String message, String input, int position) {
        super("Invalid proposition at position " + position + ": " + message
                + " in '" + excerpt(input, position) + "'");
        this.input = input;
        this.position = position;
    }

    /**
     * Shorten input for an error message, keeping the text around a position.
     *
     * @param input    Full input
     * @param position Offending position
     * @return Input as is when short, otherwise a window marked with {@code ...} where cut
     */
    public static String excerpt(String input, int position) {
        if (input.length() <= 2 * EXCERPT_RADIUS) {
            return input;
        }
        int from = Math.max(0, Math.min(position, input.length()) - EXCERPT_RADIUS);
        int to = Math.min(input.length(), from + 2 * EXCERPT_RADIUS);
        return (from > 0 ? "..." : "") + input.substring(from, to) + (to < input.length() ? "..." : "");
    }

    public String getInput() {
        return input;
    }

    public int getPosition() {
        return position;
    }
}
