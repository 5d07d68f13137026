package org.springaicommunity.github.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Null-tolerant field access for GitHub JSON payloads. Missing and JSON {@code null}
 * values both read as {@code null}.
 */
final class JsonNodeUtils {

	private JsonNodeUtils() {
	}

	static JsonNode at(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

	@Nullable
	static String text(JsonNode node, String... path) {
		JsonNode target = at(node, path);
		return target.isMissingNode() || target.isNull() ? null : target.asText();
	}

	@Nullable
	static Integer integer(JsonNode node, String... path) {
		JsonNode target = at(node, path);
		return target.isNumber() ? target.asInt() : null;
	}

	@Nullable
	static Long longValue(JsonNode node, String... path) {
		JsonNode target = at(node, path);
		return target.isNumber() ? target.asLong() : null;
	}

	@Nullable
	static Boolean bool(JsonNode node, String... path) {
		JsonNode target = at(node, path);
		return target.isBoolean() ? target.asBoolean() : null;
	}

	static List<JsonNode> array(JsonNode node, String... path) {
		JsonNode target = at(node, path);
		if (!target.isArray()) {
			return List.of();
		}
		List<JsonNode> result = new ArrayList<>();
		target.forEach(result::add);
		return result;
	}

	/**
	 * Collect {@code field} from each object element of an array, skipping elements that
	 * are not objects or lack the field. Plain string elements are kept as they are.
	 */
	static List<String> texts(JsonNode arrayNode, String field) {
		List<String> result = new ArrayList<>();
		for (JsonNode element : array(arrayNode)) {
			if (element.isTextual()) {
				result.add(element.asText());
			}
			else if (element.isObject()) {
				String value = text(element, field);
				if (value != null) {
					result.add(value);
				}
			}
		}
		return result;
	}

}
