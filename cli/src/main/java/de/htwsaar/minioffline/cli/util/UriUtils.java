package de.htwsaar.minioffline.cli.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

/**
 * URI-Hilfen für die Engine-Basisadresse.
 */
public final class UriUtils {
    private UriUtils() {}

    public static URI ensureTrailingSlash(URI uri) {
        Objects.requireNonNull(uri, "uri");
        String s = uri.toString();
        return URI.create(s.endsWith("/") ? s : s + "/");
    }

    public static Optional<URI> parseHttpUri(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        try {
            URI u = new URI(trimmed);
            String scheme = u.getScheme();
            if (scheme == null) return Optional.empty();
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return Optional.empty();
            return Optional.of(u);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /**
     * Löst einen Engine-Pfad gegen die Basisadresse auf.
     *
     * @param base Basisadresse, z. B. {@code http://localhost:8080}
     * @param path Pfad ohne führenden Slash, z. B. {@code _engine/stats}
     */
    public static URI resolve(URI base, String path) {
        String p = path.startsWith("/") ? path.substring(1) : path;
        return ensureTrailingSlash(base).resolve(p);
    }
}
