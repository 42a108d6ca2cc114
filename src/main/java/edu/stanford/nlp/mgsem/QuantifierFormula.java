package edu.stanford.nlp.mgsem;

/**
 * Marks a quantificational determiner. It has no value by itself; a conjunction of the form
 * ((quantifier &amp; int_i(restrictor)) &amp; body) is evaluated as restricted quantification over the restrictor.
 */
public class QuantifierFormula extends PrimitiveFormula
{
	public enum Mode
	{
		exists, forall
	}

	public final Mode mode;

	public QuantifierFormula(final Mode mode_)
	{
		mode = mode_;
	}

	public static Mode parseMode(final String mode)
	{
		if ("exists".equals(mode) || "some".equals(mode))
			return Mode.exists;
		if ("forall".equals(mode) || "every".equals(mode))
			return Mode.forall;
		return null;
	}

	@Override
	public String toString()
	{
		return mode == Mode.exists ? "some" : "every";
	}

	@Override
	public boolean equals(final Object thatObj)
	{
		if (!(thatObj instanceof QuantifierFormula))
			return false;
		return mode == ((QuantifierFormula) thatObj).mode;
	}

	@Override
	public int computeHashCode()
	{
		return mode.toString().hashCode(); // Note: don't call hashCode() on mode directly.
	}
}
