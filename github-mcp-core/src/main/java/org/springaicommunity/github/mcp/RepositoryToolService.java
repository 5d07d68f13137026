package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

import org.springaicommunity.github.mcp.ResponseShaping.CappedList;
import org.springaicommunity.github.mcp.ResponseShaping.TruncatedText;

import java.util.ArrayList;
import java.util.List;

import static org.springaicommunity.github.mcp.ResponseShaping.capList;
import static org.springaicommunity.github.mcp.ResponseShaping.truncateText;

/**
 * Repository-level tools: metadata, file contents, comparisons and commit history.
 */
public class RepositoryToolService extends BaseToolService {

	public static final String REPO_INFO = "github_repo_info";

	public static final String GET_FILE = "github_get_file";

	public static final String COMPARE_COMMITS = "github_compare_commits";

	public static final String LIST_COMMITS = "github_list_commits";

	static final int MAX_DESCRIPTION_CHARS = 2000;

	static final int MAX_DIRECTORY_ENTRIES = 1000;

	public RepositoryToolService(RepositoryResolver repositoryResolver, RestService restService) {
		super(repositoryResolver, restService);
	}

	/**
	 * Basic repository metadata.
	 */
	public ToolResponse repoInfo(@Nullable String repo, @Nullable String rootPath) {
		return execute(REPO_INFO, repo, rootPath, r -> {
			RepositoryInfo info = restService.getRepository(r);
			TruncatedText description = info.description() == null ? null
					: truncateText(info.description(), MAX_DESCRIPTION_CHARS);
			return new RepoInfoResult(info.fullName(), description == null ? null : description.text(),
					description != null && description.truncated(), info.defaultBranch(), info.language(),
					title(info.license()), names(info.topics()), info.stars(), info.forks(), info.openIssues(),
					info.htmlUrl(), info.cloneUrl(), info.updatedAt());
		});
	}

	/**
	 * A text file (decoded and truncated at {@code maxChars}) or a directory listing.
	 */
	public ToolResponse getFile(@Nullable String path, @Nullable String repo, @Nullable String rootPath,
			@Nullable String ref, @Nullable Integer maxChars) {
		return execute(GET_FILE, repo, rootPath, r -> {
			String cleanPath = stripLeadingSlashes(require(path, "path"));
			if (cleanPath.isEmpty()) {
				throw new IllegalArgumentException("path is required");
			}
			String cleanRef = blankToNull(ref);
			int budget = ShapingLimits.of(1, 200_000, 20_000, maxChars).effective();

			RepositoryContent content = fetchContents(r, cleanPath, cleanRef);
			if (content instanceof DirectoryListing listing) {
				CappedList<ContentEntry> entries = capList(listing.entries(), MAX_DIRECTORY_ENTRIES);
				return new DirectoryResult(r.toString(), cleanPath, "dir", listing.entries().size(),
						entries.items().size(), entries.dropped(), entries.items());
			}
			if (content instanceof FileContent file) {
				if (file.text() == null) {
					return new LargeFileResult(r.toString(), cleanPath, file.sha(), file.size(),
							"No inline content returned (file may be too large). Use download_url.",
							file.downloadUrl(), file.htmlUrl());
				}
				TruncatedText text = truncateText(file.text(), budget);
				return new FileResult(r.toString(), cleanPath, file.sha(), file.size(), cleanRef, text.truncated(),
						text.text(), file.downloadUrl(), file.htmlUrl());
			}
			ContentEntry entry = (ContentEntry) content;
			return new OtherContentResult(r.toString(), cleanPath, entry.type(), entry.sha(), entry.size());
		});
	}

	/**
	 * Compare two refs, capping the file list and each file's patch.
	 */
	public ToolResponse compareCommits(@Nullable String base, @Nullable String head, @Nullable String repo,
			@Nullable String rootPath, @Nullable Integer maxFiles, @Nullable Integer maxPatchChars) {
		return execute(COMPARE_COMMITS, repo, rootPath, r -> {
			String cleanBase = require(base, "base");
			String cleanHead = require(head, "head");
			int fileLimit = ShapingLimits.of(1, 300, 50, maxFiles).effective();
			int patchBudget = ShapingLimits.of(200, 10_000, 2000, maxPatchChars).effective();

			CommitComparison comparison = restService.compare(r, cleanBase, cleanHead);
			CappedList<ChangedFile> files = capList(comparison.files(), fileLimit);
			List<ComparedFile> out = new ArrayList<>(files.items().size());
			for (ChangedFile file : files.items()) {
				TruncatedText patch = file.patch() == null ? null : truncateText(file.patch(), patchBudget);
				out.add(new ComparedFile(file.filename(), file.status(), file.additions(), file.deletions(),
						file.changes(), patch == null ? null : patch.text(), patch != null && patch.truncated()));
			}
			return new CompareResult(r.toString(), cleanBase, cleanHead, comparison.status(), comparison.aheadBy(),
					comparison.behindBy(), comparison.totalCommits(), comparison.files().size(), out.size(),
					files.dropped(), out, comparison.htmlUrl(), comparison.permalinkUrl());
		});
	}

	/**
	 * Recent commits with the first line of each message.
	 */
	public ToolResponse listCommits(@Nullable String repo, @Nullable String rootPath, @Nullable String branch,
			@Nullable Integer limit) {
		return execute(LIST_COMMITS, repo, rootPath, r -> {
			int n = ShapingLimits.of(1, 100, 10, limit).effective();
			CappedList<CommitSummary> commits = capList(restService.listCommits(r, blankToNull(branch), n), n);
			List<CommitLine> out = commits.items()
				.stream()
				.map(c -> new CommitLine(c.sha(), truncateText(c.subject(), MAX_TITLE_CHARS).text(),
						c.author(), c.date(), c.htmlUrl()))
				.toList();
			return new CommitsResult(r.toString(), out.size(), out);
		});
	}

	private RepositoryContent fetchContents(RepoIdentifier repo, String path, @Nullable String ref) {
		try {
			return restService.getContents(repo, path, ref);
		}
		catch (GitHubApiException e) {
			if (e.isNotFound()) {
				throw new IllegalArgumentException("path '" + path + "' not found in " + repo
						+ (ref != null ? " at ref '" + ref + "'" : ""), e);
			}
			throw e;
		}
	}

	private static String stripLeadingSlashes(String path) {
		int start = 0;
		while (start < path.length() && path.charAt(start) == '/') {
			start++;
		}
		return path.substring(start);
	}

	public record RepoInfoResult(@Nullable String fullName, @Nullable String description,
			boolean descriptionTruncated, @Nullable String defaultBranch, @Nullable String language,
			@Nullable String license, List<String> topics, @Nullable Integer stars, @Nullable Integer forks,
			@Nullable Integer openIssues, @Nullable String htmlUrl, @Nullable String cloneUrl,
			@Nullable String updatedAt) implements ToolResponse {

	}

	public record FileResult(String repo, String path, @Nullable String sha, @Nullable Long size,
			@Nullable String ref, boolean truncated, String text, @Nullable String downloadUrl,
			@Nullable String htmlUrl) implements ToolResponse {

	}

	public record LargeFileResult(String repo, String path, @Nullable String sha, @Nullable Long size, String note,
			@Nullable String downloadUrl, @Nullable String htmlUrl) implements ToolResponse {

	}

	public record DirectoryResult(String repo, String path, String type, int itemsCount, int itemsReturned,
			int itemsDropped, List<ContentEntry> items) implements ToolResponse {

	}

	public record OtherContentResult(String repo, String path, @Nullable String type, @Nullable String sha,
			@Nullable Long size) implements ToolResponse {

	}

	public record ComparedFile(@Nullable String filename, @Nullable String status, @Nullable Integer additions,
			@Nullable Integer deletions, @Nullable Integer changes, @Nullable String patch, boolean patchTruncated) {

	}

	public record CompareResult(String repo, String base, String head, @Nullable String status,
			@Nullable Integer aheadBy, @Nullable Integer behindBy, @Nullable Integer totalCommits, int filesCount,
			int filesReturned, int filesDropped, List<ComparedFile> files, @Nullable String htmlUrl,
			@Nullable String permalinkUrl) implements ToolResponse {

	}

	public record CommitLine(String sha, String message, @Nullable String author, @Nullable String date,
			@Nullable String htmlUrl) {

	}

	public record CommitsResult(String repo, int count, List<CommitLine> commits) implements ToolResponse {

	}

}
