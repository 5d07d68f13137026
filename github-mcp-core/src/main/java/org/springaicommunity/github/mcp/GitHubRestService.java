package org.springaicommunity.github.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springaicommunity.github.mcp.JsonNodeUtils.array;
import static org.springaicommunity.github.mcp.JsonNodeUtils.bool;
import static org.springaicommunity.github.mcp.JsonNodeUtils.integer;
import static org.springaicommunity.github.mcp.JsonNodeUtils.longValue;
import static org.springaicommunity.github.mcp.JsonNodeUtils.text;
import static org.springaicommunity.github.mcp.JsonNodeUtils.texts;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary;
 * the untyped payload never leaves this class.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public RepositoryInfo getRepository(RepoIdentifier repo) {
		JsonNode node = getJson(repo.apiPath(), Map.of());
		return new RepositoryInfo(text(node, "full_name"), text(node, "description"), text(node, "default_branch"),
				text(node, "language"), text(node, "license", "name"), texts(node.path("topics"), "name"),
				integer(node, "stargazers_count"), integer(node, "forks_count"), integer(node, "open_issues_count"),
				text(node, "html_url"), text(node, "clone_url"), text(node, "updated_at"));
	}

	@Override
	public RepositoryContent getContents(RepoIdentifier repo, String path, @Nullable String ref) {
		Map<String, String> params = new LinkedHashMap<>();
		putIfPresent(params, "ref", ref);
		JsonNode node = getJson(repo.apiPath() + "/contents/" + encodePath(path), params);

		if (node.isArray()) {
			return new DirectoryListing(array(node).stream().map(GitHubRestService::parseContentEntry).toList());
		}
		if (!"file".equals(text(node, "type"))) {
			return parseContentEntry(node);
		}

		String encoding = text(node, "encoding");
		String content = text(node, "content");
		String decoded = null;
		if (encoding != null && encoding.equalsIgnoreCase("base64") && content != null && !content.isEmpty()) {
			decoded = decodeText(Base64.getMimeDecoder().decode(content));
		}
		return new FileContent(text(node, "path"), text(node, "sha"), longValue(node, "size"), decoded,
				text(node, "download_url"), text(node, "html_url"));
	}

	@Override
	public CommitComparison compare(RepoIdentifier repo, String base, String head) {
		JsonNode node = getJson(repo.apiPath() + "/compare/" + encodePath(base) + "..." + encodePath(head),
				Map.of());
		List<ChangedFile> files = array(node, "files").stream()
			.map(f -> new ChangedFile(text(f, "filename"), text(f, "status"), integer(f, "additions"),
					integer(f, "deletions"), integer(f, "changes"), text(f, "patch")))
			.toList();
		return new CommitComparison(text(node, "status"), integer(node, "ahead_by"), integer(node, "behind_by"),
				integer(node, "total_commits"), files, text(node, "html_url"), text(node, "permalink_url"));
	}

	@Override
	public List<WorkflowRun> listWorkflowRuns(RepoIdentifier repo, @Nullable String workflowId, @Nullable String branch,
			@Nullable String status, @Nullable String event, int perPage) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("per_page", String.valueOf(perPage));
		putIfPresent(params, "branch", branch);
		putIfPresent(params, "status", status);
		putIfPresent(params, "event", event);

		String path = isBlank(workflowId) ? repo.apiPath() + "/actions/runs"
				: repo.apiPath() + "/actions/workflows/" + encodeSegment(workflowId.strip()) + "/runs";
		JsonNode node = getJson(path, params);
		List<JsonNode> runs = array(node, "workflow_runs");
		if (runs.isEmpty()) {
			runs = array(node, "runs");
		}
		return runs.stream().map(GitHubRestService::parseWorkflowRun).toList();
	}

	@Override
	public WorkflowRun getWorkflowRun(RepoIdentifier repo, long runId) {
		return parseWorkflowRun(getJson(repo.apiPath() + "/actions/runs/" + runId, Map.of()));
	}

	@Override
	public List<WorkflowJob> listWorkflowJobs(RepoIdentifier repo, long runId) {
		JsonNode node = getJson(repo.apiPath() + "/actions/runs/" + runId + "/jobs", Map.of("per_page", "100"));
		return array(node, "jobs").stream().map(GitHubRestService::parseWorkflowJob).toList();
	}

	@Override
	public List<Issue> listIssues(RepoIdentifier repo, String state, @Nullable String labels, int perPage) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("state", state);
		params.put("per_page", String.valueOf(perPage));
		params.put("sort", "updated");
		params.put("direction", "desc");
		putIfPresent(params, "labels", labels);
		return array(getJson(repo.apiPath() + "/issues", params)).stream().map(GitHubRestService::parseIssue).toList();
	}

	@Override
	public Issue getIssue(RepoIdentifier repo, int number) {
		return parseIssue(getJson(repo.apiPath() + "/issues/" + number, Map.of()));
	}

	@Override
	public List<IssueComment> listIssueComments(RepoIdentifier repo, int number, int perPage) {
		JsonNode node = getJson(repo.apiPath() + "/issues/" + number + "/comments",
				Map.of("per_page", String.valueOf(perPage)));
		return array(node).stream()
			.map(c -> new IssueComment(longValue(c, "id"), text(c, "user", "login"), nonNull(text(c, "body")),
					text(c, "created_at"), text(c, "updated_at"), text(c, "html_url")))
			.toList();
	}

	@Override
	public List<CommitSummary> listCommits(RepoIdentifier repo, @Nullable String branch, int perPage) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("per_page", String.valueOf(perPage));
		putIfPresent(params, "sha", branch);
		return array(getJson(repo.apiPath() + "/commits", params)).stream()
			.map(c -> new CommitSummary(nonNull(text(c, "sha")), nonNull(text(c, "commit", "message")),
					text(c, "commit", "author", "name"), text(c, "commit", "author", "date"), text(c, "html_url")))
			.toList();
	}

	@Override
	public List<PullRequest> listPullRequests(RepoIdentifier repo, String state, @Nullable String base, int perPage) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("state", state);
		params.put("per_page", String.valueOf(perPage));
		params.put("sort", "updated");
		params.put("direction", "desc");
		putIfPresent(params, "base", base);
		return array(getJson(repo.apiPath() + "/pulls", params)).stream()
			.map(GitHubRestService::parsePullRequest)
			.toList();
	}

	// ========== JSON Parsing Methods ==========

	private JsonNode getJson(String path, Map<String, String> params) {
		String response = httpClient.get(path, params);
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			logger.warn("Unparsable response from {}: {}", path, e.getOriginalMessage());
			throw new IllegalStateException("Invalid JSON from GitHub for " + path, e);
		}
	}

	private static ContentEntry parseContentEntry(JsonNode node) {
		return new ContentEntry(text(node, "type"), text(node, "name"), text(node, "path"), text(node, "sha"),
				longValue(node, "size"));
	}

	private static WorkflowRun parseWorkflowRun(JsonNode run) {
		return new WorkflowRun(longValue(run, "id"), text(run, "name"), text(run, "display_title"),
				text(run, "event"), text(run, "status"), text(run, "conclusion"), text(run, "created_at"),
				text(run, "updated_at"), integer(run, "run_number"), text(run, "head_branch"),
				text(run, "head_sha"), text(run, "html_url"), integer(run, "run_attempt"));
	}

	private static WorkflowJob parseWorkflowJob(JsonNode job) {
		List<WorkflowStep> steps = array(job, "steps").stream()
			.map(s -> new WorkflowStep(text(s, "name"), text(s, "status"), text(s, "conclusion"),
					integer(s, "number"), text(s, "started_at"), text(s, "completed_at")))
			.toList();
		return new WorkflowJob(longValue(job, "id"), text(job, "name"), text(job, "status"), text(job, "conclusion"),
				text(job, "started_at"), text(job, "completed_at"), text(job, "runner_name"),
				texts(job.path("labels"), "name"), steps);
	}

	private static Issue parseIssue(JsonNode node) {
		return new Issue(integer(node, "number"), text(node, "title"), nonNull(text(node, "body")),
				text(node, "state"), node.has("pull_request"), text(node, "user", "login"),
				texts(node.path("labels"), "name"), texts(node.path("assignees"), "login"), integer(node, "comments"),
				text(node, "created_at"), text(node, "updated_at"), text(node, "html_url"));
	}

	private static PullRequest parsePullRequest(JsonNode pr) {
		return new PullRequest(integer(pr, "number"), text(pr, "title"), nonNull(text(pr, "body")), text(pr, "state"),
				text(pr, "user", "login"), bool(pr, "draft"), texts(pr.path("labels"), "name"),
				texts(pr.path("assignees"), "login"), integer(pr, "comments"), integer(pr, "commits"),
				integer(pr, "additions"), integer(pr, "deletions"), integer(pr, "changed_files"),
				bool(pr, "mergeable"), text(pr, "mergeable_state"), bool(pr, "merged"), text(pr, "head", "ref"),
				text(pr, "head", "sha"), text(pr, "base", "ref"), text(pr, "created_at"), text(pr, "updated_at"),
				text(pr, "html_url"));
	}

	/**
	 * Decode file bytes as UTF-8, falling back to ISO-8859-1 for content that is not valid
	 * UTF-8.
	 */
	static String decodeText(byte[] bytes) {
		try {
			return StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(bytes))
				.toString();
		}
		catch (CharacterCodingException e) {
			return new String(bytes, StandardCharsets.ISO_8859_1);
		}
	}

	/**
	 * URL-encode each segment of a repository path, keeping the separators.
	 */
	static String encodePath(String path) {
		String[] segments = path.split("/", -1);
		StringBuilder encoded = new StringBuilder();
		for (int i = 0; i < segments.length; i++) {
			if (i > 0) {
				encoded.append('/');
			}
			encoded.append(encodeSegment(segments[i]));
		}
		return encoded.toString();
	}

	private static String encodeSegment(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
	}

	private static void putIfPresent(Map<String, String> params, String name, @Nullable String value) {
		if (!isBlank(value)) {
			params.put(name, value.strip());
		}
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

	private static String nonNull(@Nullable String value) {
		return value != null ? value : "";
	}

}
