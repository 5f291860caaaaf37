package me.golemcore.agent.domain.model;

import java.util.Objects;

/**
 * Image attached to an {@link InputMessage}: inline base64 data, a local file
 * path, or a remote URL.
 */
public record ImageInput(Kind kind, String value) {

    public ImageInput {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    public static ImageInput base64(String data) {
        return new ImageInput(Kind.BASE64, data);
    }

    public static ImageInput path(String path) {
        return new ImageInput(Kind.PATH, path);
    }

    public static ImageInput url(String url) {
        return new ImageInput(Kind.URL, url);
    }

    public enum Kind {
        BASE64, PATH, URL
    }
}
