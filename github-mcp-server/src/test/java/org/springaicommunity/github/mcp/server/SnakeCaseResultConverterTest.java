package org.springaicommunity.github.mcp.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springaicommunity.github.mcp.IssueToolService.IssueItem;
import org.springaicommunity.github.mcp.IssueToolService.IssuesResult;
import org.springaicommunity.github.mcp.ToolError;
import org.springaicommunity.github.mcp.ToolResponse;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SnakeCaseResultConverter Tests")
class SnakeCaseResultConverterTest {

	private final SnakeCaseResultConverter converter = new SnakeCaseResultConverter();

	private final ObjectMapper reader = new ObjectMapper();

	@Test
	@DisplayName("Should render errors with error and tool keys")
	void shouldRenderErrors() throws Exception {
		String json = converter.convert(new ToolError("boom", "github_repo_info"), ToolResponse.class);

		JsonNode node = reader.readTree(json);
		assertThat(node.get("error").asText()).isEqualTo("boom");
		assertThat(node.get("tool").asText()).isEqualTo("github_repo_info");
	}

	@Test
	@DisplayName("Should use snake_case keys for results")
	void shouldUseSnakeCaseKeys() throws Exception {
		IssueItem item = new IssueItem(1, "Bug", "text", false, "open", true, "jo", List.of("bug"), 2, "2024-01-01",
				"2024-01-02", "https://github.com/acme/widgets/issues/1");

		String json = converter.convert(new IssuesResult("acme/widgets", 1, 3, List.of(item)), ToolResponse.class);

		JsonNode node = reader.readTree(json);
		assertThat(node.get("pull_requests_filtered").asInt()).isEqualTo(3);
		JsonNode first = node.get("items").get(0);
		assertThat(first.get("is_pr").asBoolean()).isTrue();
		assertThat(first.get("body_truncated").asBoolean()).isFalse();
		assertThat(first.get("html_url").asText()).isEqualTo("https://github.com/acme/widgets/issues/1");
		assertThat(first.has("isPr")).isFalse();
	}

}
