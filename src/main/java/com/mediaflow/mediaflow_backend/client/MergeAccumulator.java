package com.mediaflow.mediaflow_backend.client;

import com.mediaflow.mediaflow_backend.model.domain.JobType;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides the implicit dependencies of each top-level job while a pipeline is flattened.
 *
 * <p>Two states. {@link None}: jobs chain linearly onto the previous top-level job. {@link Collecting}: a
 * multi-scene group is open (two consecutive {@code generate} operations start one) and every non-merge job
 * joins it with no implicit dependency. A {@code merge} closes the group, depends on all of its members, and
 * becomes the predecessor of whatever follows.
 */
public final class MergeAccumulator {

    public sealed interface State permits None, Collecting {
    }

    public record None() implements State {
    }

    public record Collecting(List<String> jobIds) implements State {

        public Collecting {
            jobIds = List.copyOf(jobIds);
        }
    }

    private State state = new None();
    private String lastJobId;

    /**
     * Registers the next top-level job and returns the ids it implicitly depends on.
     *
     * @param nextType type of the operation that follows, or null at the end of the pipeline
     */
    public List<String> accept(String jobId, JobType type, JobType nextType) {
        if (type == JobType.MERGE) {
            List<String> deps;
            if (state instanceof Collecting collecting && !collecting.jobIds().isEmpty()) {
                deps = collecting.jobIds();
            } else {
                deps = lastJobId != null ? List.of(lastJobId) : List.of();
            }
            state = new None();
            lastJobId = jobId;
            return deps;
        }
        if (state instanceof Collecting collecting) {
            List<String> ids = new ArrayList<>(collecting.jobIds());
            ids.add(jobId);
            state = new Collecting(ids);
            return List.of();
        }
        if (type == JobType.GENERATE && nextType == JobType.GENERATE) {
            state = new Collecting(List.of(jobId));
            return List.of();
        }
        List<String> deps = lastJobId != null ? List.of(lastJobId) : List.of();
        lastJobId = jobId;
        return deps;
    }

    public State state() {
        return state;
    }

    public String lastJobId() {
        return lastJobId;
    }
}
