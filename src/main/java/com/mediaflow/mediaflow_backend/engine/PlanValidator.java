package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;
import com.mediaflow.mediaflow_backend.model.plan.JobNode;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural checks on a submitted plan: unique ids, known job types, and dependencies that point
 * backwards in plan order or into the base execution.
 */
@Component
public class PlanValidator {

    /**
     * @param baseJobIds plan ids of completed jobs in the base execution, empty without one
     */
    public void validate(ExecutionPlan plan, Set<String> baseJobIds) {
        if (plan == null || plan.jobs().isEmpty()) {
            throw new InvalidPlanException("Execution plan has no jobs");
        }
        Set<String> seen = new HashSet<>();
        for (JobNode node : plan.jobs()) {
            if (node.id() == null || node.id().isBlank()) {
                throw new InvalidPlanException("Every job needs an id");
            }
            if (node.type() == null) {
                throw new InvalidPlanException("Job " + node.id() + " has no type");
            }
            for (String dep : node.dependsOn()) {
                if (dep.equals(node.id())) {
                    throw new InvalidPlanException("Job " + node.id() + " depends on itself");
                }
                if (!seen.contains(dep) && !baseJobIds.contains(dep)) {
                    throw new InvalidPlanException("Job " + node.id() + " depends on " + dep
                            + ", which is neither an earlier job in the plan nor a completed job of the base execution");
                }
            }
            if (!seen.add(node.id())) {
                throw new InvalidPlanException("Duplicate job id: " + node.id());
            }
        }
    }
}
