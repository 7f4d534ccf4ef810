package io.agenthub.translate;

import java.util.Optional;

/**
 * Maps principal identifiers between the IM namespace and the channel namespace.
 */
public interface IdentityResolver {

    /**
     * Resolver that knows no identities; every reference passes through verbatim.
     */
    IdentityResolver NONE = new IdentityResolver() {
        @Override
        public Optional<String> toChannelId(String nativeId) {
            return Optional.empty();
        }

        @Override
        public Optional<String> toNativeId(String channelId) {
            return Optional.empty();
        }
    };

    /**
     * @param nativeId IM user id or agent id, without a leading {@code @}
     * @return the channel user id, including its leading {@code @}
     */
    Optional<String> toChannelId(String nativeId);

    /**
     * @param channelId channel user id, e.g. {@code @alice:example.org}
     * @return the IM user id, without a leading {@code @}
     */
    Optional<String> toNativeId(String channelId);
}
