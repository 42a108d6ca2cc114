package edu.stanford.nlp.mgsem;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a model from JSON:
 *
 * <pre>
 * {"entities": ["alice", "bob"],
 *  "events": ["chasing"],
 *  "assignments": {"1": "bob"},
 *  "predicates": {"chase": ["chasing"]},
 *  "relations": {"int": [["chasing", "bob"]], "ext": [["chasing", "alice"]]}}
 * </pre>
 */
public final class ModelReader
{
	private static final Logger LOG = LoggerFactory.getLogger(ModelReader.class);

	static class ModelJson
	{
		@JsonProperty
		List<String> entities;
		@JsonProperty
		List<String> events;
		@JsonProperty
		Map<Integer, String> assignments;
		@JsonProperty
		Map<String, List<String>> predicates;
		@JsonProperty
		Map<String, List<List<String>>> relations;
	}

	private ModelReader()
	{
	}

	public static Model read(final Path path)
	{
		try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8))
		{
			final Model model = read(in);
			LOG.info("Read {} from {}", model, path);
			return model;
		}
		catch (final IOException e)
		{
			throw new MgsemError("Cannot read model " + path, e);
		}
	}

	public static Model read(final Reader in)
	{
		final ModelJson json = Json.readValueHard(in, ModelJson.class);
		final Model.Builder builder = new Model.Builder();
		if (json.entities != null)
			for (final String entity : json.entities)
				builder.entity(entity);
		if (json.events != null)
			for (final String event : json.events)
				builder.event(event);
		if (json.assignments != null)
			for (final Map.Entry<Integer, String> e : json.assignments.entrySet())
				builder.assign(e.getKey(), e.getValue());
		if (json.predicates != null)
			for (final Map.Entry<String, List<String>> e : json.predicates.entrySet())
				builder.predicate(e.getKey(), e.getValue().toArray(new String[0]));
		if (json.relations != null)
			for (final Map.Entry<String, List<List<String>>> e : json.relations.entrySet())
				for (final List<String> pair : e.getValue())
				{
					if (pair.size() != 2)
						throw new MgsemError("Relation " + e.getKey() + " expects [event, entity] pairs, got " + pair);
					builder.relation(e.getKey(), pair.get(0), pair.get(1));
				}
		return builder.createModel();
	}
}
