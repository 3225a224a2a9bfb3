package org.springaicommunity.github.activity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for creating a consistently configured {@link ObjectMapper}.
 *
 * <p>
 * The returned mapper understands {@code java.time} types and writes dates as ISO
 * strings. JSON names follow the Java names unless a type maps them with
 * {@code @JsonProperty}, as {@link ReportFooter} does for its snake_case keys.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		return mapper;
	}

}
