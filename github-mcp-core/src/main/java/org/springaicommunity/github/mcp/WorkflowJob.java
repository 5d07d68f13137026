package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A job of a workflow run, with its steps in execution order.
 */
public record WorkflowJob(@Nullable Long id, @Nullable String name, @Nullable String status,
		@Nullable String conclusion, @Nullable String startedAt, @Nullable String completedAt,
		@Nullable String runnerName, List<String> labels, List<WorkflowStep> steps) {

}
