package edu.stanford.nlp.mgsem;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The state of parsing one sentence: the lexical ids that must all be consumed, the agenda of entries still to be
 * combined, and the chart of all entries built so far. Chart entries are never removed.
 */
class ParserState
{
	private static final Logger LOG = LoggerFactory.getLogger(ParserState.class);

	private final Parser parser;
	private final List<String> tokens;

	private final List<Integer> lexicalIds = new ArrayList<>();
	private final Deque<ChartEntry> agenda = new ArrayDeque<>();
	private final NavigableMap<Integer, ChartEntry> chart = new TreeMap<>(); // id => entry
	private final NavigableMap<Integer, ChartEntry> accepting = new TreeMap<>();

	ParserState(final Parser parser_, final List<String> tokens_)
	{
		parser = parser_;
		tokens = tokens_;
	}

	// Put one lexical entry per matching item in the chart: null elements first, then each token in order.
	// Return false if some token matches nothing.
	boolean initialize()
	{
		final List<LexicalItem> items = new ArrayList<>(parser.grammar.lookup(""));
		for (final String token : tokens)
		{
			final List<LexicalItem> matches = parser.grammar.lookup(token);
			if (matches.isEmpty())
				return false;
			items.addAll(matches);
		}
		for (final LexicalItem item : items)
		{
			final ChartEntry entry = new ChartEntry(parser.context.nextId(), Expression.fromLexicalItem(item), Derivation.LEXICAL);
			lexicalIds.add(entry.id);
			addToChart(entry);
		}
		// Newest first
		for (final ChartEntry entry : chart.descendingMap().values())
			agenda.addLast(entry);
		return true;
	}

	void infer()
	{
		while (!agenda.isEmpty() && accepting.isEmpty())
		{
			ChartEntry item = agenda.pollFirst();
			if (parser.verbose(3))
				LOG.info("Agenda ({} left): {}", agenda.size(), item);
			// Keep rewriting the latest result until nothing applies.
			while ((item = derive(item)) != null)
			{
				if (parser.verbose(2))
					LOG.info("{}", item);
				agenda.addFirst(item);
				addToChart(item);
			}
		}
	}

	// First successful combination of |entry| (alone, or with some chart entry, newest first), or null.
	private ChartEntry derive(final ChartEntry entry)
	{
		for (final CombinationFn fn : parser.operators)
			if (fn.arity() == 1)
			{
				final ChartEntry result = ((UnaryCombinationFn) fn).combine(entry, parser.context);
				if (result != null)
					return result;
			}
			else
				for (final ChartEntry other : chart.descendingMap().values())
				{
					final ChartEntry result = ((BinaryCombinationFn) fn).combine(entry, other, parser.context);
					if (result != null)
						return result;
				}
		return null;
	}

	private void addToChart(final ChartEntry entry)
	{
		chart.put(entry.id, entry);
		if (isAccepting(entry))
			accepting.put(entry.id, entry);
	}

	// A single licensee of a start category remains, and every lexical entry of the sentence has been consumed.
	boolean isAccepting(final ChartEntry entry)
	{
		final Expression expr = entry.expression;
		if (expr.features.size() != 1 || !expr.hasOuter(Feature.Kind.licensee))
			return false;
		return parser.grammar.isStartSymbol(expr.outerFeature().category) && entry.retired().containsAll(lexicalIds);
	}

	// Oldest accepting entry, or null.
	ChartEntry getAccepted()
	{
		return accepting.isEmpty() ? null : accepting.firstEntry().getValue();
	}

	int chartSize()
	{
		return chart.size();
	}
}
