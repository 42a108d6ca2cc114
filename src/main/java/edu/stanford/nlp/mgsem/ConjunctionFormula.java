package edu.stanford.nlp.mgsem;

/**
 * Takes two monadic formulas and returns their conjunction: both must hold of the same value.
 */
public class ConjunctionFormula extends Formula
{
	public final Formula child1;
	public final Formula child2;

	public ConjunctionFormula(final Formula child1_, final Formula child2_)
	{
		child1 = child1_;
		child2 = child2_;
	}

	@Override
	public String toString()
	{
		return child1 + " & " + child2;
	}

	@Override
	public boolean equals(final Object thatObj)
	{
		if (!(thatObj instanceof ConjunctionFormula))
			return false;
		final ConjunctionFormula that = (ConjunctionFormula) thatObj;
		if (!child1.equals(that.child1))
			return false;
		if (!child2.equals(that.child2))
			return false;
		return true;
	}

	@Override
	public int computeHashCode()
	{
		int hash = 0x7ed55d16;
		hash = hash * 0xd3a2646c + child1.hashCode();
		hash = hash * 0xd3a2646c + child2.hashCode();
		return hash;
	}
}
