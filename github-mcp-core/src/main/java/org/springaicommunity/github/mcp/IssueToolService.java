package org.springaicommunity.github.mcp;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;
import org.springaicommunity.github.mcp.ResponseShaping.CappedList;
import org.springaicommunity.github.mcp.ResponseShaping.TruncatedText;

import java.util.List;

import static org.springaicommunity.github.mcp.ResponseShaping.capList;
import static org.springaicommunity.github.mcp.ResponseShaping.truncateText;

/**
 * Issue and pull request tools. Bodies are truncated at a caller-adjustable budget and
 * flagged.
 */
public class IssueToolService extends BaseToolService {

	public static final String LIST_ISSUES = "github_list_issues";

	public static final String GET_ISSUE = "github_get_issue";

	public static final String LIST_PULLS = "github_list_pulls";

	public IssueToolService(RepositoryResolver repositoryResolver, RestService restService) {
		super(repositoryResolver, restService);
	}

	/**
	 * Issues sorted by last update. Pull requests are filtered out unless
	 * {@code includePrs} is set; {@code pull_requests_filtered} reports how many.
	 */
	public ToolResponse listIssues(@Nullable String repo, @Nullable String rootPath, @Nullable String state,
			@Nullable String labels, @Nullable Integer limit, @Nullable Boolean includePrs,
			@Nullable Integer maxBodyChars) {
		return execute(LIST_ISSUES, repo, rootPath, r -> {
			String cleanState = state(state);
			int n = ShapingLimits.of(1, 100, 20, limit).effective();
			int bodyBudget = bodyBudget(maxBodyChars, 4000);
			boolean keepPulls = Boolean.TRUE.equals(includePrs);

			List<Issue> fetched = restService.listIssues(r, cleanState, blankToNull(labels), n);
			List<Issue> kept = fetched.stream().filter(issue -> keepPulls || !issue.pullRequest()).toList();
			List<IssueItem> items = capList(kept, n).items()
				.stream()
				.map(issue -> toItem(issue, bodyBudget))
				.toList();
			return new IssuesResult(r.toString(), items.size(), fetched.size() - kept.size(), items);
		});
	}

	/**
	 * A single issue or pull request with its conversation comments.
	 */
	public ToolResponse getIssue(@Nullable Integer issueNumber, @Nullable String repo, @Nullable String rootPath,
			@Nullable Integer maxComments, @Nullable Integer maxBodyChars) {
		return execute(GET_ISSUE, repo, rootPath, r -> {
			if (issueNumber == null) {
				throw new IllegalArgumentException("issueNumber is required");
			}
			int commentLimit = ShapingLimits.of(0, 100, 30, maxComments).effective();
			int bodyBudget = bodyBudget(maxBodyChars, 8000);

			Issue issue = restService.getIssue(r, issueNumber);
			List<IssueComment> fetched = commentLimit == 0 ? List.of()
					: restService.listIssueComments(r, issueNumber, 100);
			CappedList<IssueComment> comments = capList(fetched, commentLimit);
			List<CommentItem> commentItems = comments.items().stream().map(c -> {
				TruncatedText body = truncateText(c.body(), bodyBudget);
				return new CommentItem(c.id(), c.user(), body.text(), body.truncated(), c.createdAt(), c.updatedAt(),
						c.htmlUrl());
			}).toList();

			int total = issue.comments() != null ? issue.comments() : fetched.size();
			TruncatedText body = truncateText(issue.body(), bodyBudget);
			IssueDetails details = new IssueDetails(issue.number(), title(issue.title()), issue.state(),
					issue.pullRequest(), issue.user(), names(issue.labels()), names(issue.assignees()), total,
					commentItems.size(), Math.max(0, total - commentItems.size()), commentItems, issue.createdAt(),
					issue.updatedAt(), issue.htmlUrl(), body.text(), body.truncated());
			return new IssueResult(r.toString(), details);
		});
	}

	/**
	 * Pull requests sorted by last update.
	 */
	public ToolResponse listPulls(@Nullable String repo, @Nullable String rootPath, @Nullable String state,
			@Nullable String base, @Nullable Integer limit, @Nullable Integer maxBodyChars) {
		return execute(LIST_PULLS, repo, rootPath, r -> {
			String cleanState = state(state);
			int n = ShapingLimits.of(1, 100, 20, limit).effective();
			int bodyBudget = bodyBudget(maxBodyChars, 4000);

			List<PullRequest> fetched = restService.listPullRequests(r, cleanState, blankToNull(base), n);
			List<PullItem> items = capList(fetched, n).items().stream().map(pr -> {
				TruncatedText body = truncateText(pr.body(), bodyBudget);
				return new PullItem(pr.number(), title(pr.title()), body.text(), body.truncated(), pr.state(),
						pr.user(), pr.draft(), names(pr.labels()), names(pr.assignees()), pr.comments(), pr.commits(),
						pr.additions(), pr.deletions(), pr.changedFiles(), pr.mergeable(), pr.mergeableState(),
						pr.merged(), title(pr.headBranch()), pr.headSha(), title(pr.baseBranch()), pr.createdAt(),
						pr.updatedAt(), pr.htmlUrl());
			}).toList();
			return new PullsResult(r.toString(), items.size(), items);
		});
	}

	private static int bodyBudget(@Nullable Integer requested, int defaultChars) {
		return ShapingLimits.of(0, 50_000, defaultChars, requested).effective();
	}

	private static IssueItem toItem(Issue issue, int bodyBudget) {
		TruncatedText body = truncateText(issue.body(), bodyBudget);
		return new IssueItem(issue.number(), title(issue.title()), body.text(), body.truncated(), issue.state(),
				issue.pullRequest(), issue.user(), names(issue.labels()), issue.comments(), issue.createdAt(),
				issue.updatedAt(), issue.htmlUrl());
	}

	public record IssueItem(@Nullable Integer number, @Nullable String title, String body, boolean bodyTruncated,
			@Nullable String state, @JsonProperty("is_pr") boolean isPr, @Nullable String user, List<String> labels,
			@Nullable Integer comments, @Nullable String createdAt, @Nullable String updatedAt,
			@Nullable String htmlUrl) {

	}

	public record IssuesResult(String repo, int count, int pullRequestsFiltered, List<IssueItem> items)
			implements ToolResponse {

	}

	public record CommentItem(@Nullable Long id, @Nullable String user, String body, boolean bodyTruncated,
			@Nullable String createdAt, @Nullable String updatedAt, @Nullable String htmlUrl) {

	}

	public record IssueDetails(@Nullable Integer number, @Nullable String title, @Nullable String state,
			@JsonProperty("is_pr") boolean isPr, @Nullable String user, List<String> labels, List<String> assignees,
			int commentsCount, int commentsReturned, int commentsDropped, List<CommentItem> comments,
			@Nullable String createdAt, @Nullable String updatedAt, @Nullable String htmlUrl, String body,
			boolean bodyTruncated) {

	}

	public record IssueResult(String repo, IssueDetails issue) implements ToolResponse {

	}

	public record PullItem(@Nullable Integer number, @Nullable String title, String body, boolean bodyTruncated,
			@Nullable String state, @Nullable String user, @Nullable Boolean draft, List<String> labels,
			List<String> assignees, @Nullable Integer comments, @Nullable Integer commits,
			@Nullable Integer additions, @Nullable Integer deletions, @Nullable Integer changedFiles,
			@Nullable Boolean mergeable, @Nullable String mergeableState, @Nullable Boolean merged,
			@Nullable String headBranch, @Nullable String headSha, @Nullable String baseBranch,
			@Nullable String createdAt, @Nullable String updatedAt, @Nullable String htmlUrl) {

	}

	public record PullsResult(String repo, int count, List<PullItem> pulls) implements ToolResponse {

	}

}
