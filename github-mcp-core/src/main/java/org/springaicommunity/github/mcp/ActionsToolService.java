package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.github.mcp.ResponseShaping.CappedList;

import java.util.ArrayList;
import java.util.List;

import static org.springaicommunity.github.mcp.ResponseShaping.capList;

/**
 * GitHub Actions tools: workflow run listing and run details with jobs and steps.
 */
public class ActionsToolService extends BaseToolService {

	public static final String LIST_WORKFLOW_RUNS = "github_list_workflow_runs";

	public static final String GET_WORKFLOW_RUN = "github_get_workflow_run";

	public ActionsToolService(RepositoryResolver repositoryResolver, RestService restService) {
		super(repositoryResolver, restService);
	}

	/**
	 * Workflow runs for the repository or a single workflow, newest first.
	 */
	public ToolResponse listWorkflowRuns(@Nullable String repo, @Nullable String rootPath, @Nullable String workflowId,
			@Nullable String branch, @Nullable String status, @Nullable String event, @Nullable Integer limit) {
		return execute(LIST_WORKFLOW_RUNS, repo, rootPath, r -> {
			int n = ShapingLimits.of(1, 100, 20, limit).effective();
			String workflow = blankToNull(workflowId);
			List<WorkflowRun> fetched = restService.listWorkflowRuns(r, workflow, blankToNull(branch),
					blankToNull(status), blankToNull(event), n);
			List<WorkflowRun> runs = capList(fetched, n).items()
				.stream()
				.map(ActionsToolService::shapeRun)
				.toList();
			return new WorkflowRunsResult(r.toString(), workflow, runs.size(), runs);
		});
	}

	/**
	 * One run, optionally with its jobs. Jobs are capped at {@code maxJobs}; steps share a
	 * budget of {@code maxSteps} across all returned jobs, consumed in job order.
	 */
	public ToolResponse getWorkflowRun(@Nullable Long runId, @Nullable String repo, @Nullable String rootPath,
			@Nullable Boolean includeJobs, @Nullable Integer maxJobs, @Nullable Integer maxSteps) {
		return execute(GET_WORKFLOW_RUN, repo, rootPath, r -> {
			if (runId == null) {
				throw new IllegalArgumentException("runId is required");
			}
			WorkflowRun run = shapeRun(restService.getWorkflowRun(r, runId));
			if (Boolean.FALSE.equals(includeJobs)) {
				return new WorkflowRunResult(r.toString(), run, null);
			}

			int jobLimit = ShapingLimits.of(1, 100, 50, maxJobs).effective();
			int stepBudget = ShapingLimits.of(1, 1000, 200, maxSteps).effective();

			List<WorkflowJob> jobs = restService.listWorkflowJobs(r, runId);
			CappedList<WorkflowJob> cappedJobs = capList(jobs, jobLimit);
			List<WorkflowJob> items = new ArrayList<>(cappedJobs.items().size());
			int stepsReturned = 0;
			int stepsDropped = 0;
			for (WorkflowJob job : cappedJobs.items()) {
				CappedList<WorkflowStep> steps = capList(job.steps(), stepBudget - stepsReturned);
				stepsReturned += steps.items().size();
				stepsDropped += steps.dropped();
				items.add(shapeJob(job, steps.items()));
			}

			JobsSummary summary = new JobsSummary(jobs.size(), items.size(), stepsReturned, stepsDropped,
					cappedJobs.truncated() || stepsDropped > 0, items);
			return new WorkflowRunResult(r.toString(), run, summary);
		});
	}

	private static WorkflowRun shapeRun(WorkflowRun run) {
		return new WorkflowRun(run.id(), title(run.name()), title(run.displayTitle()), run.event(), run.status(),
				run.conclusion(), run.createdAt(), run.updatedAt(), run.runNumber(), title(run.headBranch()),
				run.headSha(), run.htmlUrl(), run.attempt());
	}

	private static WorkflowJob shapeJob(WorkflowJob job, List<WorkflowStep> steps) {
		List<WorkflowStep> shapedSteps = steps.stream()
			.map(s -> new WorkflowStep(title(s.name()), s.status(), s.conclusion(), s.number(), s.startedAt(),
					s.completedAt()))
			.toList();
		return new WorkflowJob(job.id(), title(job.name()), job.status(), job.conclusion(), job.startedAt(),
				job.completedAt(), title(job.runnerName()), names(job.labels()), shapedSteps);
	}

	public record WorkflowRunsResult(String repo, @Nullable String workflowId, int count, List<WorkflowRun> runs)
			implements ToolResponse {

	}

	public record JobsSummary(int jobsCount, int jobsReturned, int stepsReturned, int stepsDropped,
			boolean truncated, List<WorkflowJob> items) {

	}

	/**
	 * @param jobs jobs summary, {@code null} when jobs were not requested
	 */
	public record WorkflowRunResult(String repo, WorkflowRun run, @Nullable JobsSummary jobs)
			implements ToolResponse {

	}

}
