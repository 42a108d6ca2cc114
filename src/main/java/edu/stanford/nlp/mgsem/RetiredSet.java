package edu.stanford.nlp.mgsem;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

/**
 * The ids of the chart entries a derivation has consumed, transitively. Two entries may only combine if neither has
 * consumed the other and their retired sets are disjoint, so every lexical insertion is used at most once along a
 * derivation. Retired sets only grow.
 */
public final class RetiredSet
{
	public static final RetiredSet EMPTY = new RetiredSet(ImmutableSortedSet.of());

	private final ImmutableSortedSet<Integer> ids;

	private RetiredSet(final ImmutableSortedSet<Integer> ids_)
	{
		ids = ids_;
	}

	public boolean contains(final int id)
	{
		return ids.contains(id);
	}

	public boolean containsAll(final Iterable<Integer> others)
	{
		for (final int id : others)
			if (!ids.contains(id))
				return false;
		return true;
	}

	public boolean isDisjoint(final RetiredSet that)
	{
		return Sets.intersection(ids, that.ids).isEmpty();
	}

	public RetiredSet union(final RetiredSet that)
	{
		return new RetiredSet(ImmutableSortedSet.<Integer> naturalOrder().addAll(ids).addAll(that.ids).build());
	}

	public RetiredSet with(final int... newIds)
	{
		final ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.<Integer> naturalOrder().addAll(ids);
		for (final int id : newIds)
			builder.add(id);
		return new RetiredSet(builder.build());
	}

	public int size()
	{
		return ids.size();
	}

	public ImmutableSortedSet<Integer> ids()
	{
		return ids;
	}

	@Override
	public String toString()
	{
		return ids.toString();
	}

	@Override
	public boolean equals(final Object o)
	{
		return o instanceof RetiredSet && ids.equals(((RetiredSet) o).ids);
	}

	@Override
	public int hashCode()
	{
		return ids.hashCode();
	}
}
