package edu.stanford.nlp.mgsem;

/**
 * &lt;f&gt; asserts that some event satisfies f (existential event closure).
 */
public class ClosureFormula extends Formula
{
	public final Formula child;

	public ClosureFormula(final Formula child_)
	{
		child = child_;
	}

	@Override
	public String toString()
	{
		return "<" + child + ">";
	}

	@Override
	public boolean equals(final Object thatObj)
	{
		if (!(thatObj instanceof ClosureFormula))
			return false;
		final ClosureFormula that = (ClosureFormula) thatObj;
		if (!child.equals(that.child))
			return false;
		return true;
	}

	@Override
	public int computeHashCode()
	{
		int hash = 0x165667b1;
		hash = hash * 0xd3a2646c + child.hashCode();
		return hash;
	}
}
