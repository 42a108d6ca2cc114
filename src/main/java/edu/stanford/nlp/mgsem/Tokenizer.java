package edu.stanford.nlp.mgsem;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Splits an input string on single spaces. Consecutive spaces yield empty tokens, which match phonologically null
 * lexical entries; there is no trimming, case folding or punctuation handling.
 */
public final class Tokenizer
{
	private static final Splitter SPLITTER = Splitter.on(' ');

	private Tokenizer()
	{
	}

	public static ImmutableList<String> tokenize(final String input)
	{
		return ImmutableList.copyOf(SPLITTER.split(input));
	}
}
