package edu.stanford.nlp.mgsem;

/**
 * A Formula is a logical form: a conjunction of monadic predicates over events and entities, with theta-role
 * operators, event closure and restricted quantifiers. Formulas are immutable and compared structurally.
 */
public abstract class Formula
{
	// Rendered as c, x_i, int(f), int_i(f), ext(f), f & g, <f>, some, every.
	@Override
	public abstract String toString();

	@Override
	public abstract boolean equals(Object o);

	public abstract int computeHashCode();

	private int hashCode = -1;

	@Override
	public int hashCode()
	{
		if (hashCode == -1)
			hashCode = computeHashCode();
		return hashCode;
	}
}
