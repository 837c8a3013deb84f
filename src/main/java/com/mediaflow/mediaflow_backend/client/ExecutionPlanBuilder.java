package com.mediaflow.mediaflow_backend.client;

import com.mediaflow.mediaflow_backend.model.plan.DependencyToken;
import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;
import com.mediaflow.mediaflow_backend.model.plan.JobNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a sequence of operations into an {@link ExecutionPlan}.
 *
 * <p>Operations nested under one of {@link Operation#NESTED_KEYS} are compiled depth-first into their
 * own jobs ahead of their owner, and the owner's param becomes a dependency token such as
 * {@code _imageJobDependency:job1}. Ids are {@code job1..jobN} in the order jobs appear in the plan, so every
 * dependency points backwards. Not thread-safe; use one builder per plan.
 */
public final class ExecutionPlanBuilder {

    private final List<JobNode> jobs = new ArrayList<>();
    private final MergeAccumulator accumulator = new MergeAccumulator();
    private int counter = 1;

    private ExecutionPlanBuilder() {
    }

    public static ExecutionPlan build(List<Operation> operations) {
        return build(operations, null);
    }

    public static ExecutionPlan build(List<Operation> operations, String baseExecutionId) {
        ExecutionPlanBuilder builder = new ExecutionPlanBuilder();
        for (int i = 0; i < operations.size(); i++) {
            Operation next = i + 1 < operations.size() ? operations.get(i + 1) : null;
            builder.addTopLevel(operations.get(i), next);
        }
        return new ExecutionPlan(builder.jobs, baseExecutionId);
    }

    private void addTopLevel(Operation operation, Operation next) {
        Map<String, Object> params = new LinkedHashMap<>(operation.params());
        List<String> nestedDeps = extractNested(params);
        String id = nextId();
        Set<String> deps = new LinkedHashSet<>(accumulator.accept(id, operation.type(), next != null ? next.type() : null));
        deps.addAll(nestedDeps);
        jobs.add(new JobNode(id, operation.type(), params, List.copyOf(deps), "$" + id));
    }

    private String addNested(Operation operation) {
        Map<String, Object> params = new LinkedHashMap<>(operation.params());
        List<String> deps = extractNested(params);
        String id = nextId();
        jobs.add(new JobNode(id, operation.type(), params, deps, "$" + id));
        return id;
    }

    private List<String> extractNested(Map<String, Object> params) {
        List<String> deps = new ArrayList<>();
        for (String key : Operation.NESTED_KEYS) {
            if (params.get(key) instanceof Operation nested) {
                String nestedId = addNested(nested);
                params.put(key, DependencyToken.format(tokenKind(key, nested), nestedId));
                deps.add(nestedId);
            }
        }
        return deps;
    }

    // a background is whatever media its operation produces
    private static String tokenKind(String key, Operation nested) {
        if (!"background".equals(key)) return key;
        return switch (nested.type()) {
            case GENERATE_IMAGE, REMOVE_IMAGE_BACKGROUND -> "image";
            default -> "video";
        };
    }

    private String nextId() {
        return "job" + counter++;
    }
}
