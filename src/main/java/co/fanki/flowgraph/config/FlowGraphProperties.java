package co.fanki.flowgraph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings of the flow graph analysis, bound from the {@code flowgraph}
 * prefix.
 *
 * <pre>
 * flowgraph:
 *   batch:
 *     parallelism: 4
 *     method-timeout: 10s
 *   projection:
 *     include-operations: true
 * </pre>
 *
 * @param batch the batch settings
 * @param projection the projection settings
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@ConfigurationProperties("flowgraph")
public record FlowGraphProperties(
        @DefaultValue Batch batch,
        @DefaultValue Projection projection) {

    /**
     * Settings of the batch worker pool.
     *
     * @param parallelism the number of members analyzed at once
     * @param methodTimeout the time budget of one member
     */
    public record Batch(
            @DefaultValue("4") int parallelism,
            @DefaultValue("10s") Duration methodTimeout) {

        /** Validates the settings. */
        public Batch {
            if (parallelism < 1) {
                throw new IllegalArgumentException(
                        "flowgraph.batch.parallelism must be >= 1");
            }
            if (methodTimeout == null || methodTimeout.isNegative()
                    || methodTimeout.isZero()) {
                throw new IllegalArgumentException(
                        "flowgraph.batch.method-timeout must be positive");
            }
        }
    }

    /**
     * Settings of the knowledge graph projection.
     *
     * @param includeOperations whether block nodes expand into operation
     *        nodes
     */
    public record Projection(@DefaultValue("true") boolean includeOperations) {
    }

    /**
     * Returns the settings used when nothing is configured.
     *
     * @return the defaults
     */
    public static FlowGraphProperties defaults() {
        return new FlowGraphProperties(
                new Batch(4, Duration.ofSeconds(10)),
                new Projection(true));
    }
}
