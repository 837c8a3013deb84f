package com.mediaflow.mediaflow_backend.client;

/**
 * A media parameter of an {@link Operation}: either a URL that already exists, or another operation whose
 * output is used once it has run.
 */
public sealed interface MediaInput permits MediaInput.Url, Operation {

    static MediaInput url(String url) {
        return new Url(url);
    }

    record Url(String url) implements MediaInput {

        public Url {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("Media URL must not be blank");
            }
        }
    }
}
