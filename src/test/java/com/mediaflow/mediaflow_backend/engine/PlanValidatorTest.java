package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;
import com.mediaflow.mediaflow_backend.model.plan.JobNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanValidatorTest {

    private final PlanValidator validator = new PlanValidator();

    private static JobNode node(String id, String... dependsOn) {
        return new JobNode(id, JobType.GENERATE, Map.of(), List.of(dependsOn), null);
    }

    @Test
    void backwardDependenciesAreAccepted() {
        assertThatCode(() -> validator.validate(new ExecutionPlan(List.of(node("job1"), node("job2"), node("job3", "job1", "job2"))),
                Set.of())).doesNotThrowAnyException();
    }

    @Test
    void completedBaseJobsMayBeReferenced() {
        assertThatCode(() -> validator.validate(new ExecutionPlan(List.of(node("job4", "job2"))), Set.of("job2")))
                .doesNotThrowAnyException();
    }

    @Test
    void emptyPlanIsRejected() {
        assertThatThrownBy(() -> validator.validate(new ExecutionPlan(List.of()), Set.of()))
                .isInstanceOf(InvalidPlanException.class)
                .hasMessage("Execution plan has no jobs");
    }

    @Test
    void forwardDependencyIsRejected() {
        assertThatThrownBy(() -> validator.validate(new ExecutionPlan(List.of(node("job1", "job2"), node("job2"))), Set.of()))
                .isInstanceOf(InvalidPlanException.class)
                .hasMessageStartingWith("Job job1 depends on job2, which is neither");
    }

    @Test
    void duplicateAndSelfReferencesAreRejected() {
        assertThatThrownBy(() -> validator.validate(new ExecutionPlan(List.of(node("job1"), node("job1"))), Set.of()))
                .hasMessage("Duplicate job id: job1");
        assertThatThrownBy(() -> validator.validate(new ExecutionPlan(List.of(node("job1", "job1"))), Set.of()))
                .hasMessage("Job job1 depends on itself");
    }

    @Test
    void missingIdOrTypeIsRejected() {
        assertThatThrownBy(() -> validator.validate(new ExecutionPlan(List.of(new JobNode(" ", JobType.MERGE, null, null, null))), Set.of()))
                .hasMessage("Every job needs an id");
        assertThatThrownBy(() -> validator.validate(new ExecutionPlan(List.of(new JobNode("job1", null, null, null, null))), Set.of()))
                .hasMessage("Job job1 has no type");
    }
}
