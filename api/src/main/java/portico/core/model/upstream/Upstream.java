package portico.core.model.upstream;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import portico.core.model.auth.CredentialSettings;
import portico.core.model.routing.ProxyRule;

/**
 * An upstream HTTP service behind the gateway together with its rule table.
 *
 * @param name        name used in the inbound path ({@code /proxy/{name}/...})
 * @param baseUri     base address requests are forwarded to
 * @param rules       ordered, read-only rule table
 * @param credential  machine credential used to authenticate to this upstream, if any
 * @param scopeEntity entity name used when building data scope predicates
 * @param scopeColumn ownership column used when building data scope predicates
 */
public record Upstream(
        String name,
        URI baseUri,
        List<ProxyRule> rules,
        Optional<CredentialSettings> credential,
        String scopeEntity,
        String scopeColumn) {

    public Upstream {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Upstream name is required");
        }
        if (baseUri == null) {
            throw new IllegalArgumentException("Upstream base URI is required");
        }
        rules = rules == null ? List.of() : List.copyOf(rules);
        if (credential == null) {
            credential = Optional.empty();
        }
        if (scopeEntity == null || scopeEntity.isBlank()) {
            scopeEntity = name;
        }
        if (scopeColumn == null || scopeColumn.isBlank()) {
            scopeColumn = "scope_id";
        }
    }

    /**
     * Resolve a path against this upstream's base URI.
     *
     * @param path     upstream path, with or without a leading slash
     * @param rawQuery raw query string without the leading '?', or null
     * @return the absolute target URI
     */
    public URI resolve(String path, String rawQuery) {
        var base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        var normalized = path == null || path.isEmpty() ? "/" : path;
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        if (rawQuery != null && !rawQuery.isEmpty()) {
            return URI.create(base + normalized + "?" + rawQuery);
        }
        return URI.create(base + normalized);
    }
}
