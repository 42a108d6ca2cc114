package edu.stanford.nlp.mgsem;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;

/**
 * A grammar is a lexicon plus the start categories: a derivation is complete once a single licensee of a start
 * category remains. Immutable.
 */
public class Grammar
{
	public final ImmutableSet<String> startSymbols;
	public final ImmutableList<LexicalItem> lexicon;
	private final ImmutableListMultimap<String, LexicalItem> byToken;

	public Grammar(final ImmutableSet<String> startSymbols_, final ImmutableList<LexicalItem> lexicon_)
	{
		startSymbols = startSymbols_;
		lexicon = lexicon_;
		final ImmutableListMultimap.Builder<String, LexicalItem> index = ImmutableListMultimap.builder();
		for (final LexicalItem item : lexicon)
			index.put(item.token, item);
		byToken = index.build();
	}

	// All entries whose token is exactly |token|, in lexicon order. lookup("") gives the null elements.
	public ImmutableList<LexicalItem> lookup(final String token)
	{
		return byToken.get(token);
	}

	public boolean isStartSymbol(final String category)
	{
		return startSymbols.contains(category);
	}

	@Override
	public String toString()
	{
		return "Grammar(start=" + startSymbols + ", " + lexicon.size() + " entries)";
	}

	public static class Builder
	{
		private final ImmutableSet.Builder<String> startSymbols = ImmutableSet.builder();
		private final ImmutableList.Builder<LexicalItem> lexicon = ImmutableList.builder();

		public Builder startSymbol(final String category)
		{
			startSymbols.add(category);
			return this;
		}

		public Builder add(final LexicalItem item)
		{
			lexicon.add(item);
			return this;
		}

		// add("some", "+n -d -q", "(quantifier exists)")
		public Builder add(final String token, final String features, final String formula)
		{
			return add(new LexicalItem(token, Feature.listFromString(features), Formulas.fromString(formula)));
		}

		public Grammar createGrammar()
		{
			return new Grammar(startSymbols.build(), lexicon.build());
		}
	}
}
