package edu.stanford.nlp.mgsem;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Simple wrappers and sane defaults for Jackson.
 */
public final class Json
{
	private Json()
	{
	}

	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
	static
	{
		OBJECT_MAPPER.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
		OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
	}

	public static ObjectMapper getMapper()
	{
		return OBJECT_MAPPER;
	}

	private static ObjectReader getReader()
	{
		return getMapper().reader();
	}

	public static <T> T readValueHard(final Reader r, final Class<T> klass)
	{
		try
		{
			return getReader().forType(klass).readValue(r);
		}
		catch (final IOException e)
		{
			throw new MgsemError("Invalid JSON for " + klass.getSimpleName(), e);
		}
	}
}
