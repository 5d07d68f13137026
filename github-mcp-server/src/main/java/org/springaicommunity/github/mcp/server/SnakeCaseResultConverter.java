package org.springaicommunity.github.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.springaicommunity.github.mcp.ObjectMapperFactory;
import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Serializes tool results with snake_case keys, matching GitHub's own field names.
 */
public class SnakeCaseResultConverter implements ToolCallResultConverter {

	private static final ObjectMapper MAPPER = ObjectMapperFactory.create();

	@Override
	public String convert(@Nullable Object result, @Nullable Type returnType) {
		try {
			return MAPPER.writeValueAsString(result);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Unable to serialize tool result: " + e.getOriginalMessage(), e);
		}
	}

}
