package edu.stanford.nlp.mgsem;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * A syntactic feature driving combination. Licensors (+f) select licensees (-f) of the same category; adjunct
 * features (*f) attach to an expression whose outer feature is -f without being checked. Only the first feature of an
 * expression is ever inspected.
 */
public class Feature
{
	private static final Splitter SPLITTER = Splitter.on(' ').omitEmptyStrings().trimResults();

	public enum Kind
	{
		licensor, licensee, adjunct
	}

	public final Kind kind;
	public final String category;

	public Feature(final Kind kind_, final String category_)
	{
		kind = kind_;
		category = category_;
	}

	public static Feature licensor(final String category)
	{
		return new Feature(Kind.licensor, category);
	}

	public static Feature licensee(final String category)
	{
		return new Feature(Kind.licensee, category);
	}

	public static Feature adjunct(final String category)
	{
		return new Feature(Kind.adjunct, category);
	}

	public boolean is(final Kind kind_, final String category_)
	{
		return kind == kind_ && category.equals(category_);
	}

	// "+d" => licensor d, "-k" => licensee k, "*v" => adjunct v
	public static Feature fromString(final String s)
	{
		if (s.length() < 2)
			throw new MgsemError("Invalid feature: '" + s + "'");
		final String category = s.substring(1);
		switch (s.charAt(0))
		{
			case '+':
				return licensor(category);
			case '-':
				return licensee(category);
			case '*':
				return adjunct(category);
			default:
				throw new MgsemError("Invalid feature: '" + s + "'");
		}
	}

	// Space-separated feature sequence, e.g., "+n -d -q".
	public static ImmutableList<Feature> listFromString(final String s)
	{
		final ImmutableList.Builder<Feature> features = ImmutableList.builder();
		for (final String part : SPLITTER.split(s))
			features.add(fromString(part));
		return features.build();
	}

	@Override
	public String toString()
	{
		switch (kind)
		{
			case licensor:
				return "+" + category;
			case licensee:
				return "-" + category;
			default:
				return "*" + category;
		}
	}

	@Override
	public boolean equals(final Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof Feature))
			return false;
		final Feature that = (Feature) o;
		return kind == that.kind && category.equals(that.category);
	}

	@Override
	public int hashCode()
	{
		return kind.toString().hashCode() * 31 + category.hashCode();
	}
}
