package com.adpanel.scheduler;

import com.adpanel.dto.task.JobReport;
import java.util.function.Supplier;

/** One schedulable stage of the pipeline, looked up by name in the scheduling config. */
public interface PipelineJob {

    String name();

    JobReport run();

    /** Whether runs are written to the task run log. Housekeeping jobs opt out. */
    default boolean recordsRuns() {
        return true;
    }

    static PipelineJob of(String name, Supplier<JobReport> body) {
        return of(name, body, true);
    }

    static PipelineJob of(String name, Supplier<JobReport> body, boolean recordsRuns) {
        return new PipelineJob() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public JobReport run() {
                return body.get();
            }

            @Override
            public boolean recordsRuns() {
                return recordsRuns;
            }

            @Override
            public String toString() {
                return "PipelineJob[" + name + "]";
            }
        };
    }
}
