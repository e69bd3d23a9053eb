package co.fanki.flowgraph.config;

import co.fanki.flowgraph.flow.domain.ComplexityCalculator;
import co.fanki.flowgraph.flow.domain.FlowGraphIngestor;
import co.fanki.flowgraph.flow.domain.FlowGraphNormalizer;
import co.fanki.flowgraph.flow.domain.MethodFlowPipeline;
import co.fanki.flowgraph.flow.domain.OperationSummarizer;
import co.fanki.flowgraph.flow.domain.ReachabilityAnalyzer;
import co.fanki.flowgraph.knowledge.domain.KnowledgeGraphProjector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the analysis stages and the batch worker pool.
 *
 * <p>The domain stages are plain classes; they become beans here so that
 * the application services receive them through their constructors.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@EnableConfigurationProperties(FlowGraphProperties.class)
public class FlowGraphConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowGraphConfiguration.class);

    /**
     * Creates the pipeline running the analysis stages of one member.
     *
     * @return the pipeline
     */
    @Bean
    public MethodFlowPipeline methodFlowPipeline() {
        return new MethodFlowPipeline(
                new FlowGraphIngestor(),
                new FlowGraphNormalizer(new OperationSummarizer()),
                new ReachabilityAnalyzer(),
                new ComplexityCalculator());
    }

    /**
     * Creates the knowledge graph projector.
     *
     * @return the projector
     */
    @Bean
    public KnowledgeGraphProjector knowledgeGraphProjector() {
        return new KnowledgeGraphProjector();
    }

    /**
     * Creates the fixed pool batch members run on. The pool is shut down
     * with the application context.
     *
     * @param properties the application settings
     * @return the worker pool
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService flowGraphWorkerPool(
            final FlowGraphProperties properties) {
        final int parallelism = properties.batch().parallelism();
        LOG.info("Starting flow graph worker pool with {} threads",
                parallelism);

        final AtomicInteger counter = new AtomicInteger();
        final ThreadFactory threads = runnable -> {
            final Thread thread = new Thread(runnable,
                    "flowgraph-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(parallelism, threads);
    }

}
