package kr.crownrpg.chat.api;

/**
 * Argument checks shared by the chat contracts. Failures surface as {@link IllegalArgumentException}.
 */
public final class Preconditions {

    private Preconditions() {
    }

    public static <T> T checkNotNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

    public static String checkNotBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    public static void checkArgument(boolean expression, String message) {
        if (!expression) {
            throw new IllegalArgumentException(message);
        }
    }
}
