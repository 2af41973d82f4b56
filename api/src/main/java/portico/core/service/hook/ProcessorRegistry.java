package portico.core.service.hook;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import portico.spi.PostProcessor;
import portico.spi.PreProcessor;

/**
 * Registry of request hooks.
 *
 * <p>Discovers {@link PreProcessor} and {@link PostProcessor} beans via CDI and indexes them by
 * {@code name()}. Two hooks of the same kind sharing a name is a startup error.
 */
@ApplicationScoped
public class ProcessorRegistry {

    private static final Logger LOG = Logger.getLogger(ProcessorRegistry.class);

    private final Map<String, PreProcessor> preProcessors;
    private final Map<String, PostProcessor> postProcessors;

    @Inject
    public ProcessorRegistry(Instance<PreProcessor> preProcessors, Instance<PostProcessor> postProcessors) {
        this(preProcessors.stream().toList(), postProcessors.stream().toList());
    }

    public ProcessorRegistry(List<PreProcessor> preProcessors, List<PostProcessor> postProcessors) {
        this.preProcessors = index(preProcessors, PreProcessor::name, "pre-processor");
        this.postProcessors = index(postProcessors, PostProcessor::name, "post-processor");
        LOG.debugf(
                "Registered hooks: pre=%s post=%s", this.preProcessors.keySet(), this.postProcessors.keySet());
    }

    public Optional<PreProcessor> preProcessor(String name) {
        return Optional.ofNullable(preProcessors.get(name));
    }

    public Optional<PostProcessor> postProcessor(String name) {
        return Optional.ofNullable(postProcessors.get(name));
    }

    /**
     * Resolve an ordered list of pre-processor names.
     *
     * @throws IllegalStateException if a name is unknown
     */
    public List<PreProcessor> resolvePre(List<String> names) {
        return names.stream()
                .map(name -> preProcessor(name)
                        .orElseThrow(() -> new IllegalStateException("Unknown pre-processor: " + name)))
                .toList();
    }

    /**
     * Resolve an ordered list of post-processor names.
     *
     * @throws IllegalStateException if a name is unknown
     */
    public List<PostProcessor> resolvePost(List<String> names) {
        return names.stream()
                .map(name -> postProcessor(name)
                        .orElseThrow(() -> new IllegalStateException("Unknown post-processor: " + name)))
                .toList();
    }

    private static <T> Map<String, T> index(
            List<T> hooks, Function<T, String> nameOf, String kind) {
        var indexed = new HashMap<String, T>();
        for (var hook : hooks) {
            var name = nameOf.apply(hook);
            if (indexed.putIfAbsent(name, hook) != null) {
                throw new IllegalStateException("Duplicate %s name: %s".formatted(kind, name));
            }
        }
        return Map.copyOf(indexed);
    }
}
