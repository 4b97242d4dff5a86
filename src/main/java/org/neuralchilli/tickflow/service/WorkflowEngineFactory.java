package org.neuralchilli.tickflow.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.tickflow.catalog.PatternCatalog;
import org.neuralchilli.tickflow.config.EngineConfig;
import org.neuralchilli.tickflow.core.ExpressionEvaluator;
import org.neuralchilli.tickflow.core.ReachabilityService;
import org.neuralchilli.tickflow.core.WorkflowEngine;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.kernel.MultiInstanceManager;
import org.neuralchilli.tickflow.monitoring.EngineMetrics;
import org.neuralchilli.tickflow.monitoring.ProvenanceRecorder;
import org.neuralchilli.tickflow.serializer.GraphFactsSerializer;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates one engine per case, wired to the shared catalog and services.
 */
@ApplicationScoped
public class WorkflowEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngineFactory.class);

    @Inject
    PatternCatalog catalog;

    @Inject
    MultiInstanceManager multiInstanceManager;

    @Inject
    ExpressionEvaluator expressionEvaluator;

    @Inject
    ReachabilityService reachabilityService;

    @Inject
    WorkflowLoaderService loaderService;

    @Inject
    EngineMetrics metrics;

    @Inject
    EngineConfig config;

    @Inject
    GraphFactsSerializer serializer;

    /**
     * A fresh case of a workflow from the repository
     *
     * @throws IllegalArgumentException if no workflow of that name is loaded
     */
    public WorkflowEngine create(String workflowName) {
        Workflow workflow = loaderService.find(workflowName)
                .orElseThrow(() -> new IllegalArgumentException("Workflow not found: " + workflowName));
        return create(workflow);
    }

    public WorkflowEngine create(Workflow workflow) {
        return create(GraphFacts.of(workflow));
    }

    /**
     * An engine resuming from exported facts
     */
    public WorkflowEngine create(GraphFacts facts) {
        WorkflowEngine engine = new WorkflowEngine(
                catalog, multiInstanceManager, expressionEvaluator, reachabilityService, config.maxTicks());
        engine.addListener(metrics);
        if (config.provenance().enabled()) {
            engine.addListener(new ProvenanceRecorder());
        }
        engine.loadTopology(facts);
        log.info("Created engine for '{}' ({} catalog entries, max {} ticks)",
                facts.workflow().name(), catalog.size(), config.maxTicks());
        return engine;
    }

    /**
     * An engine resuming from a JSON export
     *
     * @throws IllegalArgumentException if the document is not valid graph facts
     */
    public WorkflowEngine restore(String json) {
        return create(serializer.fromJson(json));
    }

    public String export(WorkflowEngine engine) {
        return serializer.toJson(engine.snapshotExport());
    }
}
