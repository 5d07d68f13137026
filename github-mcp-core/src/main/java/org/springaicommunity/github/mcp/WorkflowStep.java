package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

/**
 * A step of a workflow job.
 */
public record WorkflowStep(@Nullable String name, @Nullable String status, @Nullable String conclusion,
		@Nullable Integer number, @Nullable String startedAt, @Nullable String completedAt) {

}
