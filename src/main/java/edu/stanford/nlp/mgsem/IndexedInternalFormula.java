package edu.stanford.nlp.mgsem;

/**
 * int_i(f): the restrictor of a quantifier, tagged with the (negative) index of the variable the quantifier binds. Only
 * meaningful as the right conjunct of a quantifier.
 */
public class IndexedInternalFormula extends Formula
{
	public final Formula child;
	public final int index;

	public IndexedInternalFormula(final Formula child_, final int index_)
	{
		child = child_;
		index = index_;
	}

	@Override
	public String toString()
	{
		return "int_" + index + "(" + child + ")";
	}

	@Override
	public boolean equals(final Object thatObj)
	{
		if (!(thatObj instanceof IndexedInternalFormula))
			return false;
		final IndexedInternalFormula that = (IndexedInternalFormula) thatObj;
		return index == that.index && child.equals(that.child);
	}

	@Override
	public int computeHashCode()
	{
		int hash = 0x2d4f8a31;
		hash = hash * 0xd3a2646c + index;
		hash = hash * 0xd3a2646c + child.hashCode();
		return hash;
	}
}
