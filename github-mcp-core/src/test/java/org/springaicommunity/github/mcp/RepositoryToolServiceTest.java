package org.springaicommunity.github.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springaicommunity.github.mcp.RepositoryToolService.CommitsResult;
import org.springaicommunity.github.mcp.RepositoryToolService.CompareResult;
import org.springaicommunity.github.mcp.RepositoryToolService.DirectoryResult;
import org.springaicommunity.github.mcp.RepositoryToolService.FileResult;
import org.springaicommunity.github.mcp.RepositoryToolService.LargeFileResult;
import org.springaicommunity.github.mcp.RepositoryToolService.OtherContentResult;
import org.springaicommunity.github.mcp.RepositoryToolService.RepoInfoResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for RepositoryToolService with a mocked RestService. NO real GitHub API calls.
 */
@DisplayName("RepositoryToolService Tests")
@ExtendWith(MockitoExtension.class)
class RepositoryToolServiceTest {

	private static final RepoIdentifier REPO = new RepoIdentifier("acme", "widgets");

	@Mock
	private RestService restService;

	@TempDir
	Path tempDir;

	private RepositoryToolService service;

	@BeforeEach
	void setUp() {
		service = new RepositoryToolService(new RepositoryResolver(tempDir), restService);
	}

	private static RepositoryInfo repositoryInfo(String description) {
		return new RepositoryInfo("acme/widgets", description, "main", "Java", "MIT", List.of("java"), 1, 2, 3,
				"https://github.com/acme/widgets", "https://github.com/acme/widgets.git", "2024-01-01T00:00:00Z");
	}

	@Nested
	@DisplayName("github_repo_info")
	class RepoInfoTest {

		@Test
		@DisplayName("Should return repository metadata")
		void shouldReturnRepositoryMetadata() {
			when(restService.getRepository(REPO)).thenReturn(repositoryInfo("Widgets"));

			ToolResponse response = service.repoInfo("acme/widgets", null);

			assertThat(response).isInstanceOfSatisfying(RepoInfoResult.class, r -> {
				assertThat(r.fullName()).isEqualTo("acme/widgets");
				assertThat(r.description()).isEqualTo("Widgets");
				assertThat(r.descriptionTruncated()).isFalse();
				assertThat(r.defaultBranch()).isEqualTo("main");
			});
		}

		@Test
		@DisplayName("Should truncate very long descriptions")
		void shouldTruncateLongDescriptions() {
			when(restService.getRepository(REPO)).thenReturn(repositoryInfo("d".repeat(5000)));

			ToolResponse response = service.repoInfo("acme/widgets", null);

			assertThat(response).isInstanceOfSatisfying(RepoInfoResult.class, r -> {
				assertThat(r.descriptionTruncated()).isTrue();
				assertThat(r.description()).startsWith("d".repeat(RepositoryToolService.MAX_DESCRIPTION_CHARS))
					.endsWith(ResponseShaping.TRUNCATION_MARKER);
			});
		}

		@Test
		@DisplayName("Should cap topics and truncate the license name")
		void shouldCapTopics() {
			List<String> topics = IntStream.range(0, 5_000).mapToObj(i -> "topic-" + i).toList();
			when(restService.getRepository(REPO)).thenReturn(new RepositoryInfo("acme/widgets", null, "main", null,
					"l".repeat(200_000), topics, null, null, null, null, null, null));

			ToolResponse response = service.repoInfo("acme/widgets", null);

			assertThat(response).isInstanceOfSatisfying(RepoInfoResult.class, r -> {
				assertThat(r.topics()).hasSize(100).startsWith("topic-0").endsWith("topic-99");
				assertThat(r.license()).isEqualTo("l".repeat(500) + ResponseShaping.TRUNCATION_MARKER);
				assertThat(r.description()).isNull();
			});
		}

		@Test
		@DisplayName("Should return an error when the repository cannot be resolved")
		void shouldReturnErrorWhenUnresolved() {
			ToolResponse response = service.repoInfo(null, "/path/that/does/not/exist");

			assertThat(response).isEqualTo(new ToolError(RepositoryResolver.CANNOT_RESOLVE_MESSAGE,
					RepositoryToolService.REPO_INFO));
			verifyNoInteractions(restService);
		}

		@Test
		@DisplayName("Should convert upstream failures into an error result")
		void shouldConvertUpstreamFailures() {
			when(restService.getRepository(REPO)).thenThrow(new GitHubApiException(404, "{\"message\":\"Not Found\"}"));

			ToolResponse response = service.repoInfo("https://github.com/acme/widgets.git", null);

			assertThat(response).isInstanceOfSatisfying(ToolError.class, e -> {
				assertThat(e.tool()).isEqualTo("github_repo_info");
				assertThat(e.error()).startsWith("GitHub API error 404");
			});
		}

	}

	@Nested
	@DisplayName("github_get_file")
	class GetFileTest {

		@Test
		@DisplayName("Should truncate file text at the requested budget")
		void shouldTruncateFileText() {
			when(restService.getContents(REPO, "README.md", "v1"))
				.thenReturn(new FileContent("README.md", "sha1", 10L, "0123456789", "dl", "html"));

			ToolResponse response = service.getFile("/README.md", "acme/widgets", null, "v1", 4);

			assertThat(response).isInstanceOfSatisfying(FileResult.class, r -> {
				assertThat(r.path()).isEqualTo("README.md");
				assertThat(r.ref()).isEqualTo("v1");
				assertThat(r.truncated()).isTrue();
				assertThat(r.text()).isEqualTo("0123" + ResponseShaping.TRUNCATION_MARKER);
			});
		}

		@Test
		@DisplayName("Should clamp the character budget to at least one")
		void shouldClampBudget() {
			when(restService.getContents(REPO, "a.txt", null))
				.thenReturn(new FileContent("a.txt", "s", 3L, "abc", null, null));

			ToolResponse response = service.getFile("a.txt", "acme/widgets", null, " ", 0);

			assertThat(response).isInstanceOfSatisfying(FileResult.class,
					r -> assertThat(r.text()).isEqualTo("a" + ResponseShaping.TRUNCATION_MARKER));
		}

		@Test
		@DisplayName("Should point to the download url when there is no inline content")
		void shouldPointToDownloadUrl() {
			when(restService.getContents(REPO, "big.bin", null))
				.thenReturn(new FileContent("big.bin", "s", 5_000_000L, null, "https://raw.example/big.bin", null));

			ToolResponse response = service.getFile("big.bin", "acme/widgets", null, null, null);

			assertThat(response).isInstanceOfSatisfying(LargeFileResult.class, r -> {
				assertThat(r.downloadUrl()).isEqualTo("https://raw.example/big.bin");
				assertThat(r.note()).contains("download_url");
			});
		}

		@Test
		@DisplayName("Should cap directory listings")
		void shouldCapDirectoryListings() {
			List<ContentEntry> entries = IntStream.range(0, 1005)
				.mapToObj(i -> new ContentEntry("file", "f" + i, "dir/f" + i, "s" + i, 1L))
				.toList();
			when(restService.getContents(REPO, "dir", null)).thenReturn(new DirectoryListing(entries));

			ToolResponse response = service.getFile("dir", "acme/widgets", null, null, null);

			assertThat(response).isInstanceOfSatisfying(DirectoryResult.class, r -> {
				assertThat(r.type()).isEqualTo("dir");
				assertThat(r.itemsCount()).isEqualTo(1005);
				assertThat(r.itemsReturned()).isEqualTo(RepositoryToolService.MAX_DIRECTORY_ENTRIES);
				assertThat(r.itemsDropped()).isEqualTo(5);
				assertThat(r.items().get(0).name()).isEqualTo("f0");
			});
		}

		@Test
		@DisplayName("Should describe symlinks and submodules without content")
		void shouldDescribeOtherContent() {
			when(restService.getContents(REPO, "lib", null))
				.thenReturn(new ContentEntry("submodule", "lib", "lib", "abc", 0L));

			ToolResponse response = service.getFile("lib", "acme/widgets", null, null, null);

			assertThat(response).isInstanceOfSatisfying(OtherContentResult.class,
					r -> assertThat(r.type()).isEqualTo("submodule"));
		}

		@Test
		@DisplayName("Should name the path and ref when the file does not exist")
		void shouldReportMissingPath() {
			when(restService.getContents(REPO, "docs/x.md", "v1"))
				.thenThrow(new GitHubApiException(404, "{\"message\":\"Not Found\"}"));
			when(restService.getContents(REPO, "docs/y.md", null))
				.thenThrow(new GitHubApiException(404, "{\"message\":\"Not Found\"}"));

			assertThat(service.getFile("docs/x.md", "acme/widgets", null, "v1", null)).isEqualTo(new ToolError(
					"path 'docs/x.md' not found in acme/widgets at ref 'v1'", RepositoryToolService.GET_FILE));
			assertThat(service.getFile("docs/y.md", "acme/widgets", null, null, null)).isEqualTo(
					new ToolError("path 'docs/y.md' not found in acme/widgets", RepositoryToolService.GET_FILE));
		}

		@Test
		@DisplayName("Should keep other upstream failures as they are")
		void shouldKeepOtherUpstreamFailures() {
			when(restService.getContents(REPO, "docs/x.md", null)).thenThrow(new GitHubApiException(500, "boom"));

			assertThat(service.getFile("docs/x.md", "acme/widgets", null, null, null))
				.isEqualTo(new ToolError("GitHub API error 500: boom", RepositoryToolService.GET_FILE));
		}

		@Test
		@DisplayName("Should require a path")
		void shouldRequirePath() {
			assertThat(service.getFile("  ", "acme/widgets", null, null, null))
				.isEqualTo(new ToolError("path is required", RepositoryToolService.GET_FILE));
			assertThat(service.getFile("///", "acme/widgets", null, null, null))
				.isEqualTo(new ToolError("path is required", RepositoryToolService.GET_FILE));
			verifyNoInteractions(restService);
		}

	}

	@Nested
	@DisplayName("github_compare_commits")
	class CompareCommitsTest {

		@Test
		@DisplayName("Should cap files and truncate patches")
		void shouldCapFilesAndTruncatePatches() {
			List<ChangedFile> files = new ArrayList<>();
			files.add(new ChangedFile("big.txt", "modified", 500, 0, 500, "+".repeat(5000)));
			files.add(new ChangedFile("image.png", "added", 0, 0, 0, null));
			files.add(new ChangedFile("c.txt", "removed", 0, 1, 1, "-x"));
			when(restService.compare(REPO, "main", "feature"))
				.thenReturn(new CommitComparison("ahead", 3, 0, 3, files, "html", "permalink"));

			ToolResponse response = service.compareCommits("main", "feature", "acme/widgets", null, 2, 10);

			assertThat(response).isInstanceOfSatisfying(CompareResult.class, r -> {
				assertThat(r.filesCount()).isEqualTo(3);
				assertThat(r.filesReturned()).isEqualTo(2);
				assertThat(r.filesDropped()).isEqualTo(1);
				// patch budget is clamped up to 200
				assertThat(r.files().get(0).patch()).isEqualTo("+".repeat(200) + ResponseShaping.TRUNCATION_MARKER);
				assertThat(r.files().get(0).patchTruncated()).isTrue();
				assertThat(r.files().get(1).patch()).isNull();
				assertThat(r.files().get(1).patchTruncated()).isFalse();
			});
		}

		@Test
		@DisplayName("Should require base and head")
		void shouldRequireBaseAndHead() {
			assertThat(service.compareCommits(null, "feature", "acme/widgets", null, null, null))
				.isEqualTo(new ToolError("base is required", RepositoryToolService.COMPARE_COMMITS));
			assertThat(service.compareCommits("main", "", "acme/widgets", null, null, null))
				.isEqualTo(new ToolError("head is required", RepositoryToolService.COMPARE_COMMITS));
		}

	}

	@Nested
	@DisplayName("github_list_commits")
	class ListCommitsTest {

		@Test
		@DisplayName("Should return commit subjects with a clamped limit")
		void shouldReturnCommitSubjects() {
			when(restService.listCommits(eq(REPO), isNull(), eq(100)))
				.thenReturn(List.of(new CommitSummary("abc", "Subject line\n\nBody text", "Jo", "2024-01-01", "url")));

			ToolResponse response = service.listCommits("acme/widgets", null, "", 1000);

			assertThat(response).isInstanceOfSatisfying(CommitsResult.class, r -> {
				assertThat(r.count()).isEqualTo(1);
				assertThat(r.commits().get(0).message()).isEqualTo("Subject line");
			});
		}

		@Test
		@DisplayName("Should default to ten commits")
		void shouldDefaultToTenCommits() {
			when(restService.listCommits(REPO, "dev", 10)).thenReturn(List.of());

			ToolResponse response = service.listCommits("acme/widgets", null, "dev", null);

			assertThat(response).isEqualTo(new CommitsResult("acme/widgets", 0, List.of()));
		}

	}

}
