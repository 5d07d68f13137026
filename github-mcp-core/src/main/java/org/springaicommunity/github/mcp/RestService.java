package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Interface for the read-only GitHub REST API operations used by the tools.
 *
 * <p>
 * Returns strongly-typed records instead of raw JSON to provide type safety and
 * encapsulate the GitHub API response structure. Blank optional filters are omitted from
 * the request.
 */
public interface RestService {

	/**
	 * Get repository metadata.
	 * @param repo the repository
	 * @return repository information
	 */
	RepositoryInfo getRepository(RepoIdentifier repo);

	/**
	 * Get a file or directory through the contents API.
	 * @param repo the repository
	 * @param path path inside the repository, without leading slash
	 * @param ref branch, tag or SHA; default branch when blank
	 * @return a {@link FileContent}, a {@link DirectoryListing} or a {@link ContentEntry}
	 */
	RepositoryContent getContents(RepoIdentifier repo, String path, @Nullable String ref);

	/**
	 * Compare two commits, branches or tags.
	 * @param repo the repository
	 * @param base base ref
	 * @param head head ref
	 * @return comparison including changed files
	 */
	CommitComparison compare(RepoIdentifier repo, String base, String head);

	/**
	 * List workflow runs, newest first.
	 * @param repo the repository
	 * @param workflowId workflow file name or numeric id; all workflows when blank
	 * @param branch branch filter
	 * @param status status filter (e.g. completed, in_progress, queued)
	 * @param event event filter (e.g. push, pull_request)
	 * @param perPage page size (1..100)
	 * @return workflow runs
	 */
	List<WorkflowRun> listWorkflowRuns(RepoIdentifier repo, @Nullable String workflowId, @Nullable String branch,
			@Nullable String status, @Nullable String event, int perPage);

	/**
	 * Get one workflow run.
	 * @param repo the repository
	 * @param runId run id
	 * @return the run
	 */
	WorkflowRun getWorkflowRun(RepoIdentifier repo, long runId);

	/**
	 * List the jobs of a workflow run (first 100).
	 * @param repo the repository
	 * @param runId run id
	 * @return jobs with their steps
	 */
	List<WorkflowJob> listWorkflowJobs(RepoIdentifier repo, long runId);

	/**
	 * List issues (and pull requests) sorted by last update, newest first.
	 * @param repo the repository
	 * @param state open, closed or all
	 * @param labels comma-separated label filter
	 * @param perPage page size (1..100)
	 * @return issues
	 */
	List<Issue> listIssues(RepoIdentifier repo, String state, @Nullable String labels, int perPage);

	/**
	 * Get one issue or pull request by number.
	 * @param repo the repository
	 * @param number issue number
	 * @return the issue
	 */
	Issue getIssue(RepoIdentifier repo, int number);

	/**
	 * List conversation comments of an issue, oldest first.
	 * @param repo the repository
	 * @param number issue number
	 * @param perPage page size (1..100)
	 * @return comments
	 */
	List<IssueComment> listIssueComments(RepoIdentifier repo, int number, int perPage);

	/**
	 * List recent commits.
	 * @param repo the repository
	 * @param branch branch, tag or SHA to start from; default branch when blank
	 * @param perPage page size (1..100)
	 * @return commits, newest first
	 */
	List<CommitSummary> listCommits(RepoIdentifier repo, @Nullable String branch, int perPage);

	/**
	 * List pull requests sorted by last update, newest first.
	 * @param repo the repository
	 * @param state open, closed or all
	 * @param base base branch filter
	 * @param perPage page size (1..100)
	 * @return pull requests
	 */
	List<PullRequest> listPullRequests(RepoIdentifier repo, String state, @Nullable String base, int perPage);

}
