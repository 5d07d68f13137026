package org.springaicommunity.github.mcp.server;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.github.mcp.ActionsToolService;
import org.springaicommunity.github.mcp.IssueToolService;
import org.springaicommunity.github.mcp.RepositoryToolService;
import org.springaicommunity.github.mcp.ToolResponse;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * MCP tool surface. Each method delegates to a tool service, which resolves the
 * repository, shapes the result and converts failures into an {@code error} result.
 */
@Component
public class GitHubTools {

	private static final String REPO_DESCRIPTION = "Optional 'owner/repo', GitHub URL or SSH remote";

	private static final String ROOT_PATH_DESCRIPTION = "Optional local path used to infer the repository from its git remote";

	private final RepositoryToolService repositoryTools;

	private final ActionsToolService actionsTools;

	private final IssueToolService issueTools;

	public GitHubTools(RepositoryToolService repositoryTools, ActionsToolService actionsTools,
			IssueToolService issueTools) {
		this.repositoryTools = repositoryTools;
		this.actionsTools = actionsTools;
		this.issueTools = issueTools;
	}

	@Tool(name = RepositoryToolService.REPO_INFO, description = "Get basic repository info.",
			resultConverter = SnakeCaseResultConverter.class)
	public ToolResponse repoInfo(@ToolParam(description = REPO_DESCRIPTION, required = false) @Nullable String repo,
			@ToolParam(description = ROOT_PATH_DESCRIPTION, required = false) @Nullable String rootPath) {
		return repositoryTools.repoInfo(repo, rootPath);
	}

	@Tool(name = RepositoryToolService.GET_FILE,
			description = "Get a text file from a GitHub repo (Contents API). Directories return a listing.",
			resultConverter = SnakeCaseResultConverter.class)
	public ToolResponse getFile(
			@ToolParam(description = "File path in repo (e.g. \"README.md\", \".github/workflows/ci.yml\")") String path,
			@ToolParam(description = REPO_DESCRIPTION, required = false) @Nullable String repo,
			@ToolParam(description = ROOT_PATH_DESCRIPTION, required = false) @Nullable String rootPath,
			@ToolParam(description = "Optional branch/tag/sha", required = false) @Nullable String ref,
			@ToolParam(description = "Max characters of decoded content (default 20000)",
					required = false) @Nullable Integer maxChars) {
		return repositoryTools.getFile(path, repo, rootPath, ref, maxChars);
	}

	@Tool(name = RepositoryToolService.COMPARE_COMMITS,
			description = "Compare commits/branches/tags using the GitHub compare endpoint.",
			resultConverter = SnakeCaseResultConverter.class)
	public ToolResponse compareCommits(@ToolParam(description = "Base ref (e.g. \"main\")") String base,
			@ToolParam(description = "Head ref (e.g. \"feature-branch\")") String head,
			@ToolParam(description = REPO_DESCRIPTION, required = false) @Nullable String repo,
			@ToolParam(description = ROOT_PATH_DESCRIPTION, required = false) @Nullable String rootPath,
			@ToolParam(description = "Max files to include (1..300, default 50)",
					required = false) @Nullable Integer maxFiles,
			@ToolParam(description = "Max patch characters per file (200..10000, default 2000)",
					required = false) @Nullable Integer maxPatchChars) {
		return repositoryTools.compareCommits(base, head, repo, rootPath, maxFiles, maxPatchChars);
	}

	@Tool(name = ActionsToolService.LIST_WORKFLOW_RUNS, description = "List GitHub Actions workflow runs.",
			resultConverter = SnakeCaseResultConverter.class)
	public ToolResponse listWorkflowRuns(
			@ToolParam(description = REPO_DESCRIPTION, required = false) @Nullable String repo,
			@ToolParam(description = ROOT_PATH_DESCRIPTION, required = false) @Nullable String rootPath,
			@ToolParam(description = "Optional workflow file name or id (e.g. \"ci.yml\" or \"123456\")",
					required = false) @Nullable String workflowId,
			@ToolParam(description = "Optional branch filter", required = false) @Nullable String branch,
			@ToolParam(description = "Optional status filter (e.g. \"completed\", \"in_progress\", \"queued\")",
					required = false) @Nullable String status,
			@ToolParam(description = "Optional event filter (e.g. \"push\", \"pull_request\")",
					required = false) @Nullable String event,
			@ToolParam(description = "Max runs (1..100, default 20)", required = false) @Nullable Integer limit) {
		return actionsTools.listWorkflowRuns(repo, rootPath, workflowId, branch, status, event, limit);
	}

	@Tool(name = ActionsToolService.GET_WORKFLOW_RUN,
			description = "Get workflow run details, optionally including a jobs/steps summary.",
			resultConverter = SnakeCaseResultConverter.class)
	public ToolResponse getWorkflowRun(@ToolParam(description = "Workflow run id") Long runId,
			@ToolParam(description = REPO_DESCRIPTION, required = false) @Nullable String repo,
			@ToolParam(description = ROOT_PATH_DESCRIPTION, required = false) @Nullable String rootPath,
			@ToolParam(description = "Include jobs and steps summary (default true)",
					required = false) @Nullable Boolean includeJobs,
			@ToolParam(description = "Cap on jobs returned (1..100, default 50)",
					required = false) @Nullable Integer maxJobs,
			@ToolParam(description = "Cap on total steps returned (1..1000, default 200)",
					required = false) @Nullable Integer maxSteps) {
		return actionsTools.getWorkflowRun(runId, repo, rootPath, includeJobs, maxJobs, maxSteps);
	}

	@Tool(name = IssueToolService.LIST_ISSUES, description = "List issues from a repo (optionally include PRs).",
			resultConverter = SnakeCaseResultConverter.class)
	public ToolResponse listIssues(@ToolParam(description = REPO_DESCRIPTION, required = false) @Nullable String repo,
			@ToolParam(description = ROOT_PATH_DESCRIPTION, required = false) @Nullable String rootPath,
			@ToolParam(description = "open|closed|all (default open)", required = false) @Nullable String state,
			@ToolParam(description = "Comma-separated labels filter", required = false) @Nullable String labels,
			@ToolParam(description = "1..100 (default 20)", required = false) @Nullable Integer limit,
			@ToolParam(description = "If false (default), PRs are filtered out",
					required = false) @Nullable Boolean includePrs,
			@ToolParam(description = "Max characters per body (0..50000, default 4000)",
					required = false) @Nullable Integer maxBodyChars) {
		return issueTools.listIssues(repo, rootPath, state, labels, limit, includePrs, maxBodyChars);
	}

	@Tool(name = IssueToolService.GET_ISSUE, description = "Get a single issue/PR by number, with comments.",
			resultConverter = SnakeCaseResultConverter.class)
	public ToolResponse getIssue(@ToolParam(description = "Issue number") Integer issueNumber,
			@ToolParam(description = REPO_DESCRIPTION, required = false) @Nullable String repo,
			@ToolParam(description = ROOT_PATH_DESCRIPTION, required = false) @Nullable String rootPath,
			@ToolParam(description = "Max comments returned (0..100, default 30)",
					required = false) @Nullable Integer maxComments,
			@ToolParam(description = "Max characters per body (0..50000, default 8000)",
					required = false) @Nullable Integer maxBodyChars) {
		return issueTools.getIssue(issueNumber, repo, rootPath, maxComments, maxBodyChars);
	}

	@Tool(name = RepositoryToolService.LIST_COMMITS, description = "List recent commits.",
			resultConverter = SnakeCaseResultConverter.class)
	public ToolResponse listCommits(@ToolParam(description = REPO_DESCRIPTION, required = false) @Nullable String repo,
			@ToolParam(description = ROOT_PATH_DESCRIPTION, required = false) @Nullable String rootPath,
			@ToolParam(description = "Optional branch name", required = false) @Nullable String branch,
			@ToolParam(description = "1..100 (default 10)", required = false) @Nullable Integer limit) {
		return repositoryTools.listCommits(repo, rootPath, branch, limit);
	}

	@Tool(name = IssueToolService.LIST_PULLS, description = "List pull requests.",
			resultConverter = SnakeCaseResultConverter.class)
	public ToolResponse listPulls(@ToolParam(description = REPO_DESCRIPTION, required = false) @Nullable String repo,
			@ToolParam(description = ROOT_PATH_DESCRIPTION, required = false) @Nullable String rootPath,
			@ToolParam(description = "open|closed|all (default open)", required = false) @Nullable String state,
			@ToolParam(description = "Optional base branch filter", required = false) @Nullable String base,
			@ToolParam(description = "1..100 (default 20)", required = false) @Nullable Integer limit,
			@ToolParam(description = "Max characters per body (0..50000, default 4000)",
					required = false) @Nullable Integer maxBodyChars) {
		return issueTools.listPulls(repo, rootPath, state, base, limit, maxBodyChars);
	}

}
