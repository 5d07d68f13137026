package org.springaicommunity.github.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springaicommunity.github.mcp.ActionsToolService.JobsSummary;
import org.springaicommunity.github.mcp.ActionsToolService.WorkflowRunResult;
import org.springaicommunity.github.mcp.ActionsToolService.WorkflowRunsResult;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ActionsToolService Tests")
@ExtendWith(MockitoExtension.class)
class ActionsToolServiceTest {

	private static final RepoIdentifier REPO = new RepoIdentifier("acme", "widgets");

	@Mock
	private RestService restService;

	@TempDir
	Path tempDir;

	private ActionsToolService service;

	@BeforeEach
	void setUp() {
		service = new ActionsToolService(new RepositoryResolver(tempDir), restService);
	}

	private static WorkflowRun run(long id) {
		return new WorkflowRun(id, "CI", "Fix build", "push", "completed", "success", "2024-01-01T00:00:00Z",
				"2024-01-01T00:10:00Z", (int) id, "main", "sha" + id, "https://github.com/acme/widgets/actions/runs/" + id,
				1);
	}

	private static WorkflowJob job(long id, int stepCount) {
		List<WorkflowStep> steps = IntStream.rangeClosed(1, stepCount)
			.mapToObj(i -> new WorkflowStep("step " + i, "completed", "success", i, null, null))
			.toList();
		return new WorkflowJob(id, "job " + id, "completed", "success", null, null, "runner", List.of("ubuntu-latest"),
				steps);
	}

	@Test
	@DisplayName("Should list workflow runs with filters")
	void shouldListWorkflowRuns() {
		when(restService.listWorkflowRuns(REPO, "ci.yml", "main", null, "push", 5)).thenReturn(List.of(run(1), run(2)));

		ToolResponse response = service.listWorkflowRuns("acme/widgets", null, " ci.yml ", "main", "", "push", 5);

		assertThat(response).isInstanceOfSatisfying(WorkflowRunsResult.class, r -> {
			assertThat(r.workflowId()).isEqualTo("ci.yml");
			assertThat(r.count()).isEqualTo(2);
			assertThat(r.runs()).extracting(WorkflowRun::id).containsExactly(1L, 2L);
		});
	}

	@Test
	@DisplayName("Should clamp the run limit")
	void shouldClampRunLimit() {
		when(restService.listWorkflowRuns(eq(REPO), isNull(), isNull(), isNull(), isNull(), eq(100)))
			.thenReturn(List.of());

		ToolResponse response = service.listWorkflowRuns("acme/widgets", null, null, null, null, null, 500);

		assertThat(response).isEqualTo(new WorkflowRunsResult("acme/widgets", null, 0, List.of()));
	}

	@Test
	@DisplayName("Should return a run without jobs when not requested")
	void shouldReturnRunWithoutJobs() {
		when(restService.getWorkflowRun(REPO, 7L)).thenReturn(run(7));

		ToolResponse response = service.getWorkflowRun(7L, "acme/widgets", null, false, null, null);

		assertThat(response).isInstanceOfSatisfying(WorkflowRunResult.class, r -> {
			assertThat(r.run().id()).isEqualTo(7L);
			assertThat(r.jobs()).isNull();
		});
		verify(restService, never()).listWorkflowJobs(any(), anyLong());
	}

	@Test
	@DisplayName("Should share the step budget across jobs")
	void shouldShareStepBudgetAcrossJobs() {
		when(restService.getWorkflowRun(REPO, 7L)).thenReturn(run(7));
		when(restService.listWorkflowJobs(REPO, 7L)).thenReturn(List.of(job(1, 3), job(2, 3), job(3, 3)));

		ToolResponse response = service.getWorkflowRun(7L, "acme/widgets", null, null, 2, 4);

		assertThat(response).isInstanceOfSatisfying(WorkflowRunResult.class, r -> {
			JobsSummary jobs = r.jobs();
			assertThat(jobs).isNotNull();
			assertThat(jobs.jobsCount()).isEqualTo(3);
			assertThat(jobs.jobsReturned()).isEqualTo(2);
			assertThat(jobs.stepsReturned()).isEqualTo(4);
			assertThat(jobs.stepsDropped()).isEqualTo(2);
			assertThat(jobs.truncated()).isTrue();
			assertThat(jobs.items().get(0).steps()).hasSize(3);
			assertThat(jobs.items().get(1).steps()).extracting(WorkflowStep::name).containsExactly("step 1");
		});
	}

	@Test
	@DisplayName("Should not flag truncation when everything fits")
	void shouldNotFlagTruncationWhenEverythingFits() {
		when(restService.getWorkflowRun(REPO, 7L)).thenReturn(run(7));
		when(restService.listWorkflowJobs(REPO, 7L)).thenReturn(List.of(job(1, 2)));

		ToolResponse response = service.getWorkflowRun(7L, "acme/widgets", null, true, null, null);

		assertThat(response).isInstanceOfSatisfying(WorkflowRunResult.class, r -> {
			assertThat(r.jobs()).isNotNull();
			assertThat(r.jobs().truncated()).isFalse();
			assertThat(r.jobs().stepsDropped()).isZero();
		});
	}

	@Test
	@DisplayName("Should truncate oversized run titles when listing")
	void shouldTruncateRunTitlesWhenListing() {
		String longTitle = "t".repeat(200_000);
		WorkflowRun huge = new WorkflowRun(1L, longTitle, longTitle, "push", "completed", "success", null, null, 1,
				"main", "sha1", null, 1);
		when(restService.listWorkflowRuns(REPO, null, null, null, null, 20)).thenReturn(List.of(huge));

		ToolResponse response = service.listWorkflowRuns("acme/widgets", null, null, null, null, null, null);

		assertThat(response).isInstanceOfSatisfying(WorkflowRunsResult.class, r -> {
			WorkflowRun shaped = r.runs().get(0);
			assertThat(shaped.name()).isEqualTo("t".repeat(500) + ResponseShaping.TRUNCATION_MARKER);
			assertThat(shaped.displayTitle()).isEqualTo("t".repeat(500) + ResponseShaping.TRUNCATION_MARKER);
			assertThat(shaped.headBranch()).isEqualTo("main");
		});
	}

	@Test
	@DisplayName("Should truncate run titles and cap job labels when fetching a run")
	void shouldShapeRunAndJobsWhenFetching() {
		String longTitle = "t".repeat(200_000);
		WorkflowRun huge = new WorkflowRun(7L, "CI", longTitle, "push", "completed", "success", null, null, 7, "main",
				"sha7", null, 1);
		List<String> labels = IntStream.range(0, 5_000).mapToObj(i -> "label-" + i).toList();
		WorkflowJob job = new WorkflowJob(1L, longTitle, "completed", "success", null, null, "runner", labels,
				List.of(new WorkflowStep(longTitle, "completed", "success", 1, null, null)));
		when(restService.getWorkflowRun(REPO, 7L)).thenReturn(huge);
		when(restService.listWorkflowJobs(REPO, 7L)).thenReturn(List.of(job));

		ToolResponse response = service.getWorkflowRun(7L, "acme/widgets", null, true, null, null);

		assertThat(response).isInstanceOfSatisfying(WorkflowRunResult.class, r -> {
			assertThat(r.run().name()).isEqualTo("CI");
			assertThat(r.run().displayTitle()).hasSize(500 + ResponseShaping.TRUNCATION_MARKER.length())
				.endsWith(ResponseShaping.TRUNCATION_MARKER);
			assertThat(r.jobs()).isNotNull();
			WorkflowJob shapedJob = r.jobs().items().get(0);
			assertThat(shapedJob.name()).hasSize(500 + ResponseShaping.TRUNCATION_MARKER.length());
			assertThat(shapedJob.labels()).hasSize(100).startsWith("label-0").endsWith("label-99");
			assertThat(shapedJob.steps()).singleElement()
				.satisfies(step -> assertThat(step.name()).endsWith(ResponseShaping.TRUNCATION_MARKER));
		});
	}

	@Test
	@DisplayName("Should require a run id")
	void shouldRequireRunId() {
		assertThat(service.getWorkflowRun(null, "acme/widgets", null, null, null, null))
			.isEqualTo(new ToolError("runId is required", ActionsToolService.GET_WORKFLOW_RUN));
		verifyNoInteractions(restService);
	}

	@Test
	@DisplayName("Should convert transport failures into an error result")
	void shouldConvertTransportFailures() {
		when(restService.getWorkflowRun(REPO, 7L))
			.thenThrow(new GitHubTransportException("HTTP request failed: timed out", new java.io.IOException()));

		assertThat(service.getWorkflowRun(7L, "acme/widgets", null, null, null, null))
			.isEqualTo(new ToolError("HTTP request failed: timed out", ActionsToolService.GET_WORKFLOW_RUN));
	}

}
