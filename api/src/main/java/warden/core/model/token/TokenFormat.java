package warden.core.model.token;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Token representations supported by the engine.
 *
 * <p>Every token string starts with its format tag, a fixed three character prefix,
 * so the provider for a token is found with a single lookup.
 */
public enum TokenFormat {

    /** Random reference resolved through the token store. */
    OPAQUE("op_", "opaque", false),

    /** RS256 signed payload. */
    SIGNED("js_", "signed", true),

    /** RS256 signed, DEFLATE compressed payload. */
    SIGNED_COMPRESSED("jz_", "signed-compressed", true),

    /** AES-GCM encrypted payload under a rotating symmetric key. */
    ENCRYPTED("fe_", "encrypted", true);

    public static final int TAG_LENGTH = 3;

    private static final Map<String, TokenFormat> BY_TAG =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(TokenFormat::tag, Function.identity()));

    private final String tag;
    private final String configName;
    private final boolean selfDescribing;

    TokenFormat(String tag, String configName, boolean selfDescribing) {
        this.tag = tag;
        this.configName = configName;
        this.selfDescribing = selfDescribing;
    }

    public String tag() {
        return tag;
    }

    public String configName() {
        return configName;
    }

    /**
     * Whether the token embeds its own payload (no server-side lookup).
     */
    public boolean isSelfDescribing() {
        return selfDescribing;
    }

    /**
     * The token with this format's tag removed.
     *
     * @param token a token carrying this format's tag
     * @return the body after the tag
     * @throws IllegalArgumentException if the token does not carry this tag
     */
    public String body(String token) {
        if (token == null || !token.startsWith(tag)) {
            throw new IllegalArgumentException("Token does not carry the " + configName + " tag");
        }
        return token.substring(TAG_LENGTH);
    }

    /**
     * Detect the format of a token string from its tag.
     *
     * @param token the raw token
     * @return the format, or empty if no format claims the tag
     */
    public static Optional<TokenFormat> detect(String token) {
        if (token == null || token.length() <= TAG_LENGTH) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(token.substring(0, TAG_LENGTH)));
    }

    /**
     * Resolve a format from its configuration name.
     *
     * @param name configuration value such as {@code signed-compressed}
     * @return the format
     * @throws IllegalArgumentException if no format has that name
     */
    public static TokenFormat fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(format -> format.configName.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown token format: " + name));
    }
}
