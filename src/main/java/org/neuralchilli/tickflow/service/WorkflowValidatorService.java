package org.neuralchilli.tickflow.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.tickflow.core.ExpressionEvaluator;
import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.JoinBehavior;
import org.neuralchilli.tickflow.domain.JoinType;
import org.neuralchilli.tickflow.domain.MultiInstanceSpec;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeKind;
import org.neuralchilli.tickflow.domain.SplitType;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.store.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Validates workflow definitions beyond what the domain constructors check:
 * joins and splits that cannot work, references to missing nodes or flows,
 * guards that do not compile.
 */
@ApplicationScoped
public class WorkflowValidatorService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowValidatorService.class);

    @Inject
    ExpressionEvaluator expressionEvaluator;

    public WorkflowValidatorService() {
    }

    public WorkflowValidatorService(ExpressionEvaluator expressionEvaluator) {
        this.expressionEvaluator = expressionEvaluator;
    }

    /**
     * Validate a workflow definition
     *
     * @return warnings that do not prevent running the workflow
     * @throws ValidationException if validation fails
     */
    public List<String> validate(Workflow workflow) {
        Topology topology = new Topology(workflow);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        validateJoins(topology, errors, warnings);
        validateSplits(topology, errors);
        validateReferences(workflow, errors);
        validateConditions(workflow, errors, warnings);
        validateExpressions(workflow, errors);

        if (!errors.isEmpty()) {
            throw new ValidationException("Workflow validation failed for '" + workflow.name() + "':\n" +
                    String.join("\n", errors));
        }

        Set<String> cyclic = workflow.nodes().stream()
                .map(Node::id)
                .filter(topology::isOnCycle)
                .collect(Collectors.toCollection(TreeSet::new));
        if (!cyclic.isEmpty()) {
            log.info("Workflow '{}' has cycles through {}; runs are bounded by the tick budget",
                    workflow.name(), cyclic);
        }
        warnings.forEach(w -> log.warn("Workflow '{}': {}", workflow.name(), w));
        return warnings;
    }

    private void validateJoins(Topology topology, List<String> errors, List<String> warnings) {
        for (Node node : topology.nodes()) {
            int predecessors = topology.predecessors(node.id()).size();
            boolean joins = node.join() == JoinType.AND || node.join() == JoinType.OR
                    || node.options().joinBehavior() != JoinBehavior.STANDARD;
            if (joins && predecessors == 0) {
                errors.add("Node '" + node.id() + "' joins but has no incoming flows");
            }

            Integer quorum = node.options().quorum();
            JoinBehavior behavior = node.options().joinBehavior();
            if (quorum != null && behavior != JoinBehavior.THREAD_MERGE && quorum > predecessors) {
                errors.add("Node '" + node.id() + "' needs " + quorum + " arrivals but has only "
                        + predecessors + " incoming flows");
            }

            if (node.options().mutex() != null && joins) {
                warnings.add("Node '" + node.id() + "' combines a join with a mutex; the mutex decides");
            }
        }
    }

    private void validateSplits(Topology topology, List<String> errors) {
        for (Node node : topology.nodes()) {
            List<Flow> out = topology.flowsOut(node.id());
            if (node.split() != SplitType.NONE && out.isEmpty()) {
                errors.add("Node '" + node.id() + "' splits " + node.split() + " but has no outgoing flows");
            }
            if (node.split() == SplitType.NONE && out.size() > 1 && !node.options().deferred()) {
                errors.add("Node '" + node.id() + "' has " + out.size() + " outgoing flows but no split");
            }
            if (node.options().threads() != null && out.size() != 1) {
                errors.add("Node '" + node.id() + "' spawns threads but has " + out.size() + " outgoing flows");
            }
            long defaults = out.stream().filter(Flow::defaultFlow).count();
            if (node.split() == SplitType.XOR && defaults > 1) {
                errors.add("Node '" + node.id() + "' has " + defaults + " default flows");
            }
        }
    }

    private void validateReferences(Workflow workflow, List<String> errors) {
        Set<String> flowKeys = workflow.flows().stream().map(Flow::key).collect(Collectors.toSet());

        for (Node node : workflow.nodes()) {
            for (String target : node.cancellationTargets()) {
                boolean known = target.contains("->") ? flowKeys.contains(target) : workflow.hasNode(target);
                if (!known) {
                    errors.add("Node '" + node.id() + "' cancels '" + target + "' which is not defined in this workflow");
                }
            }
            for (String nested : node.options().nestedNodes()) {
                if (!workflow.hasNode(nested)) {
                    errors.add("Node '" + node.id() + "' nests '" + nested + "' which is not defined in this workflow");
                }
            }
            String milestone = node.options().milestone();
            if (milestone != null && !workflow.hasNode(milestone)) {
                errors.add("Node '" + node.id() + "' waits on milestone '" + milestone
                        + "' which is not defined in this workflow");
            }
        }
    }

    private void validateConditions(Workflow workflow, List<String> errors, List<String> warnings) {
        long inputs = workflow.nodes().stream().filter(n -> n.kind() == NodeKind.INPUT_CONDITION).count();
        if (inputs > 1) {
            errors.add("Workflow has " + inputs + " input conditions");
        }
        if (inputs == 0) {
            warnings.add("No input condition; the case must be seeded with facts");
        }
        if (workflow.outputConditions().isEmpty()) {
            warnings.add("No output condition; deadlocks cannot be detected");
        }
    }

    private void validateExpressions(Workflow workflow, List<String> errors) {
        for (Flow flow : workflow.flows()) {
            String error = expressionEvaluator.getValidationError(flow.predicate());
            if (error != null) {
                errors.add("Flow " + flow.key() + " has an invalid predicate: " + error);
            }
        }
        for (Node node : workflow.nodes()) {
            MultiInstanceSpec spec = node.options().instances();
            if (spec == null || spec.countExpression() == null) {
                continue;
            }
            String error = expressionEvaluator.getValidationError(spec.countExpression());
            if (error != null) {
                errors.add("Node '" + node.id() + "' has an invalid instance count: " + error);
            }
        }
    }
}
