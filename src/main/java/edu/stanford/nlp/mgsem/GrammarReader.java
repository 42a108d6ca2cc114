package edu.stanford.nlp.mgsem;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a grammar from JSON:
 *
 * <pre>
 * {"startSymbols": ["c"],
 *  "lexicon": [{"token": "some", "features": "+n -d -q", "formula": "(quantifier exists)"}, ...]}
 * </pre>
 *
 * Features use +f (licensor), -f (licensee) and *f (adjunct); formulas use the notation of
 * {@link Formulas#fromString(String)}.
 */
public final class GrammarReader
{
	private static final Logger LOG = LoggerFactory.getLogger(GrammarReader.class);

	static class EntryJson
	{
		@JsonProperty
		String token;
		@JsonProperty
		String features;
		@JsonProperty
		String formula;
	}

	static class GrammarJson
	{
		@JsonProperty
		List<String> startSymbols;
		@JsonProperty
		List<EntryJson> lexicon;
	}

	private GrammarReader()
	{
	}

	public static Grammar read(final Path path)
	{
		try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8))
		{
			final Grammar grammar = read(in);
			LOG.info("Read {} lexical entries from {}", grammar.lexicon.size(), path);
			return grammar;
		}
		catch (final IOException e)
		{
			throw new MgsemError("Cannot read grammar " + path, e);
		}
	}

	public static Grammar read(final Reader in)
	{
		final GrammarJson json = Json.readValueHard(in, GrammarJson.class);
		if (json.startSymbols == null || json.startSymbols.isEmpty())
			throw new MgsemError("Grammar has no start symbols");
		final Grammar.Builder builder = new Grammar.Builder();
		for (final String symbol : json.startSymbols)
			builder.startSymbol(symbol);
		if (json.lexicon != null)
			for (final EntryJson entry : json.lexicon)
			{
				if (entry.token == null || entry.features == null || entry.formula == null)
					throw new MgsemError("Lexical entry needs token, features and formula: " + entry.token);
				builder.add(entry.token, entry.features, entry.formula);
			}
		return builder.createGrammar();
	}
}
