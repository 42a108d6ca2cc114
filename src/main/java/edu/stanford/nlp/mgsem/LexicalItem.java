package edu.stanford.nlp.mgsem;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * A lexical entry: a token (possibly empty for phonologically null elements), its feature sequence and its meaning.
 */
public class LexicalItem
{
	public final String token;
	public final ImmutableList<Feature> features;
	public final Formula formula;

	public LexicalItem(final String token_, final ImmutableList<Feature> features_, final Formula formula_)
	{
		token = token_;
		features = features_;
		formula = formula_;
	}

	@Override
	public String toString()
	{
		return "[" + token + " :: " + Joiner.on(' ').join(features) + " => " + formula + "]";
	}
}
