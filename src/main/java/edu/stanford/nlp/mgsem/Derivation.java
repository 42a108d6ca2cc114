package edu.stanford.nlp.mgsem;

import com.google.common.collect.ImmutableList;

/**
 * How a chart entry came about: inserted from the lexicon, or built by a combination operator from earlier entries.
 * A derived entry records the ids it consumed in its retired set.
 */
public class Derivation
{
	public static final Derivation LEXICAL = new Derivation(null, ImmutableList.of(), RetiredSet.EMPTY);

	public final String operator; // null for lexical entries
	public final ImmutableList<ChartEntry> sources;
	public final RetiredSet retired;

	public Derivation(final String operator_, final ImmutableList<ChartEntry> sources_, final RetiredSet retired_)
	{
		operator = operator_;
		sources = sources_;
		retired = retired_;
	}

	public boolean isLexical()
	{
		return operator == null;
	}

	@Override
	public String toString()
	{
		if (isLexical())
			return "lexical";
		final StringBuilder out = new StringBuilder(operator).append('(');
		for (int i = 0; i < sources.size(); i++)
		{
			if (i > 0)
				out.append(", ");
			out.append(sources.get(i).id);
		}
		return out.append(")").toString();
	}

	@Override
	public boolean equals(final Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof Derivation))
			return false;
		final Derivation that = (Derivation) o;
		if (operator == null ? that.operator != null : !operator.equals(that.operator))
			return false;
		return sources.equals(that.sources) && retired.equals(that.retired);
	}

	@Override
	public int hashCode()
	{
		int hash = operator == null ? 0 : operator.hashCode();
		hash = hash * 31 + sources.hashCode();
		hash = hash * 31 + retired.hashCode();
		return hash;
	}
}
