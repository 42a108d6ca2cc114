package edu.stanford.nlp.mgsem;

/**
 * A monadic predicate (e.g., chase, girl) or a proper name (e.g., alice). Which of the two is decided by the model at
 * evaluation time.
 */
public class ConstantFormula extends PrimitiveFormula
{
	public final String name;

	public ConstantFormula(final String name_)
	{
		name = name_;
	}

	@Override
	public String toString()
	{
		return name;
	}

	@Override
	public boolean equals(final Object thatObj)
	{
		if (!(thatObj instanceof ConstantFormula))
			return false;
		final ConstantFormula that = (ConstantFormula) thatObj;
		return name.equals(that.name);
	}

	@Override
	public int computeHashCode()
	{
		return name.hashCode();
	}
}
