package edu.stanford.nlp.mgsem;

/**
 * Corresponds to a variable reference. Positive indices are pronouns resolved by the model's assignment; negative
 * indices are bound by a quantifier.
 */
public class VariableFormula extends PrimitiveFormula
{
	public final int index;

	public VariableFormula(final int index_)
	{
		index = index_;
	}

	@Override
	public String toString()
	{
		return "x_" + index;
	}

	@Override
	public boolean equals(final Object thatObj)
	{
		if (!(thatObj instanceof VariableFormula))
			return false;
		final VariableFormula that = (VariableFormula) thatObj;
		return index == that.index;
	}

	@Override
	public int computeHashCode()
	{
		return Integer.hashCode(index) * 0x01000193 + 0x3b;
	}
}
