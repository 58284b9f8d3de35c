package io.stategraph.core.state;

/// Reserved state keys derived from node ids.
public final class StateKeys {

    public static final String RESULT_SUFFIX = "_result";
    public static final String USER_INPUT_SUFFIX = "_user_input";

    private StateKeys() {}

    /// Key of a node's verbatim output record: `{nodeId}_result`.
    public static String resultKey(String nodeId) {
        return nodeId + RESULT_SUFFIX;
    }

    /// Key of a node's user-input record: `{nodeId}_user_input`.
    public static String userInputKey(String nodeId) {
        return nodeId + USER_INPUT_SUFFIX;
    }
}
