package portico.core.port.out;

import java.util.List;
import java.util.Map;

import portico.core.model.auth.CallerIdentity;

/**
 * Supplies the identity of the caller. Authentication itself happens in front of the gateway.
 */
public interface CallerIdentityResolver {

    /**
     * Resolve the caller from the inbound request headers.
     *
     * @param headers inbound headers
     * @return the identity, or {@link CallerIdentity#anonymous()} when none was supplied
     */
    CallerIdentity resolve(Map<String, List<String>> headers);
}
