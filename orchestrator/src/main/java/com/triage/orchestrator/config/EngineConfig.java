package com.triage.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triage.orchestrator.checkpoint.CheckpointStore;
import com.triage.orchestrator.checkpoint.InMemoryCheckpointStore;
import com.triage.orchestrator.checkpoint.JpaCheckpointStore;
import com.triage.orchestrator.graph.CheckpointCodec;
import com.triage.orchestrator.graph.CompiledGraph;
import com.triage.orchestrator.graph.GraphExecutor;
import com.triage.orchestrator.llm.LanguageModel;
import com.triage.orchestrator.repository.SuspendedRunRepository;
import com.triage.orchestrator.responder.IncidentGraphFactory;
import com.triage.orchestrator.search.SearchClient;
import com.triage.orchestrator.workspace.CodeReader;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Engine wiring: worker pool, executor, checkpoint storage and the compiled
 * incident graph.
 *
 * <pre>
 *   triage.engine.worker-threads       threads available for node calls with a timeout
 *   triage.checkpoint.store            memory | jpa
 *   triage.responder.max-iterations    default research/refine budget per run
 *   triage.responder.refine-threshold  confidence below which a solution is refined
 * </pre>
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService nodeWorkers(@Value("${triage.engine.worker-threads:8}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    public GraphExecutor graphExecutor(ExecutorService nodeWorkers, MeterRegistry meterRegistry) {
        return new GraphExecutor(nodeWorkers, meterRegistry);
    }

    @Bean
    public CheckpointCodec checkpointCodec(ObjectMapper objectMapper) {
        return new CheckpointCodec(objectMapper);
    }

    @Bean
    public CheckpointStore checkpointStore(@Value("${triage.checkpoint.store:jpa}") String store,
                                           SuspendedRunRepository repository,
                                           CheckpointCodec codec) {
        log.info("Using '{}' checkpoint store", store);
        return switch (store) {
            case "memory" -> new InMemoryCheckpointStore();
            case "jpa"    -> new JpaCheckpointStore(repository, codec);
            default       -> throw new IllegalArgumentException(
                    "Unknown triage.checkpoint.store '" + store + "', expected memory or jpa");
        };
    }

    @Bean
    public CompiledGraph incidentGraph(LanguageModel llm, SearchClient search, CodeReader reader,
                                       @Value("${triage.responder.max-iterations:3}") int maxIterations,
                                       @Value("${triage.responder.refine-threshold:0.3}") double refineThreshold) {
        log.info("Compiling incident graph (max iterations {}, refine threshold {})",
                maxIterations, refineThreshold);
        return new IncidentGraphFactory(llm, search, reader).build(maxIterations, refineThreshold);
    }
}
