package org.neuralchilli.tickflow.service;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.tickflow.config.EngineConfig;
import org.neuralchilli.tickflow.config.WorkflowYamlParser;
import org.neuralchilli.tickflow.domain.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Loads workflow definitions from YAML files into an in-memory repository.
 * Scans the configured directory on startup and can load single files later.
 */
@ApplicationScoped
public class WorkflowLoaderService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoaderService.class);

    @Inject
    WorkflowYamlParser yamlParser;

    @Inject
    WorkflowValidatorService validatorService;

    @Inject
    EngineConfig config;

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();

    /**
     * Load all configured workflows on startup
     */
    void onStart(@Observes StartupEvent event) {
        Optional<String> path = config.workflows().path();
        if (path.isEmpty()) {
            log.info("No workflow directory configured (tickflow.workflows.path)");
            return;
        }
        log.info("Loading workflows from: {}", path.get());
        logResults(loadAll(Path.of(path.get())));
    }

    /**
     * Load every workflow file under a directory
     */
    public List<LoadResult> loadAll(Path directory) {
        List<LoadResult> results = new ArrayList<>();

        if (!Files.exists(directory)) {
            log.warn("Workflow directory does not exist: {}", directory);
            return results;
        }

        try (Stream<Path> paths = Files.walk(directory)) {
            paths.filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                    .sorted()
                    .forEach(p -> results.add(load(p)));
        } catch (IOException e) {
            log.error("Error scanning workflow directory: {}", directory, e);
            results.add(LoadResult.failure(directory.toString(), e));
        }

        return results;
    }

    /**
     * Load a single workflow from file
     */
    public LoadResult load(Path path) {
        try {
            log.debug("Loading workflow from: {}", path);

            String yaml = Files.readString(path);
            Workflow workflow = yamlParser.parseWorkflow(yaml);
            List<String> warnings = validatorService.validate(workflow);

            workflows.put(workflow.name(), workflow);

            log.info("✓ Loaded workflow: {} ({} nodes, {} flows)",
                    workflow.name(), workflow.nodes().size(), workflow.flows().size());
            return LoadResult.success(workflow.name(), warnings.size());

        } catch (IOException e) {
            log.error("✗ Failed to read workflow file: {}", path, e);
            return LoadResult.failure(path.getFileName().toString(), e);
        } catch (Exception e) {
            log.error("✗ Failed to load workflow from: {}", path, e);
            return LoadResult.failure(path.getFileName().toString(), e);
        }
    }

    /**
     * Register a workflow built in code, after validation
     */
    public void register(Workflow workflow) {
        validatorService.validate(workflow);
        workflows.put(workflow.name(), workflow);
    }

    public Optional<Workflow> find(String name) {
        return Optional.ofNullable(workflows.get(name));
    }

    public Map<String, Workflow> getWorkflows() {
        return Collections.unmodifiableMap(workflows);
    }

    private void logResults(List<LoadResult> results) {
        long successful = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - successful;

        if (failed > 0) {
            log.warn("Loaded {} workflows: {} successful, {} failed", results.size(), successful, failed);

            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  ✗ {}: {}", r.name(), r.error().orElse("unknown error")));
        } else {
            log.info("Loaded {} workflows: all successful", results.size());
        }
    }
}
