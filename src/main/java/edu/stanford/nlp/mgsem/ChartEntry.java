package edu.stanford.nlp.mgsem;

/**
 * An item of the chart: a globally unique id, an expression and its derivation.
 */
public class ChartEntry
{
	public final int id;
	public final Expression expression;
	public final Derivation derivation;

	public ChartEntry(final int id_, final Expression expression_, final Derivation derivation_)
	{
		id = id_;
		expression = expression_;
		derivation = derivation_;
	}

	public RetiredSet retired()
	{
		return derivation.retired;
	}

	public Formula formula()
	{
		return expression.formula;
	}

	@Override
	public String toString()
	{
		return id + " " + expression + " <- " + derivation;
	}

	@Override
	public boolean equals(final Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof ChartEntry))
			return false;
		final ChartEntry that = (ChartEntry) o;
		return id == that.id && expression.equals(that.expression) && derivation.equals(that.derivation);
	}

	@Override
	public int hashCode()
	{
		int hash = Integer.hashCode(id);
		hash = hash * 31 + expression.hashCode();
		hash = hash * 31 + derivation.hashCode();
		return hash;
	}
}
