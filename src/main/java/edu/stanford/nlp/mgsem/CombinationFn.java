package edu.stanford.nlp.mgsem;

/**
 * A combination operator of the grammar. Operators are partial: when the operands do not have the right shape they
 * return null, which is not an error, and the parser simply tries something else.
 */
public abstract class CombinationFn
{
	public final String name;

	protected CombinationFn(final String name_)
	{
		name = name_;
	}

	public abstract int arity();

	@Override
	public String toString()
	{
		return name;
	}
}
