package com.mediaflow.mediaflow_backend.client;

import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Immutable, ordered list of operations. Sub-pipelines are inlined where they are added. */
public final class Pipeline {

    private final List<Operation> operations;

    private Pipeline(List<Operation> operations) {
        this.operations = List.copyOf(operations);
    }

    public static Pipeline compose(Operation... operations) {
        return new Pipeline(Arrays.asList(operations));
    }

    public static Pipeline compose(Pipeline... pipelines) {
        List<Operation> all = new ArrayList<>();
        for (Pipeline pipeline : pipelines) {
            all.addAll(pipeline.operations);
        }
        return new Pipeline(all);
    }

    public Pipeline then(Operation... more) {
        List<Operation> all = new ArrayList<>(operations);
        all.addAll(Arrays.asList(more));
        return new Pipeline(all);
    }

    public Pipeline then(Pipeline other) {
        return compose(this, other);
    }

    public Pipeline merge() {
        return then(new Operation.Merge());
    }

    public Pipeline merge(String transition) {
        return then(new Operation.Merge(transition, null));
    }

    public Pipeline merge(String transition, double duration) {
        return then(new Operation.Merge(transition, duration));
    }

    public List<Operation> operations() {
        return operations;
    }

    public ExecutionPlan toPlan() {
        return ExecutionPlanBuilder.build(operations);
    }

    public ExecutionPlan toPlan(String baseExecutionId) {
        return ExecutionPlanBuilder.build(operations, baseExecutionId);
    }
}
