package edu.stanford.nlp.mgsem;

/**
 * A discharged complement or specifier, kept until spellout decides word order and meaning. Specifiers carry the
 * placeholder token "_" and contribute only their meaning.
 */
public class Argument
{
	public static final String PLACEHOLDER = "_";

	public final String token;
	public final String category;
	public final Formula formula;

	public Argument(final String token_, final String category_, final Formula formula_)
	{
		token = token_;
		category = category_;
		formula = formula_;
	}

	@Override
	public String toString()
	{
		return token + " " + category + " = " + formula;
	}

	@Override
	public boolean equals(final Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof Argument))
			return false;
		final Argument that = (Argument) o;
		return token.equals(that.token) && category.equals(that.category) && formula.equals(that.formula);
	}

	@Override
	public int hashCode()
	{
		int hash = token.hashCode();
		hash = hash * 31 + category.hashCode();
		hash = hash * 31 + formula.hashCode();
		return hash;
	}
}
