package io.tabsense.capability;

import java.util.Optional;

/**
 * Host-side handle of a browsing context. The hub only stores it and hands it to handlers.
 */
public interface RenderTarget {
    String tabId();

    Optional<String> currentUrl();

    static RenderTarget of(String tabId, String url) {
        return new RenderTarget() {
            @Override
            public String tabId() {
                return tabId;
            }

            @Override
            public Optional<String> currentUrl() {
                return Optional.ofNullable(url);
            }
        };
    }
}
