package edu.stanford.nlp.mgsem;

/**
 * Adjunction: an expression whose outer feature is -f takes an adjunct *f as a child. The adjunct keeps its features
 * and is only consumed by spellout.
 */
public class InsertAdjunctFn extends BinaryCombinationFn
{
	public InsertAdjunctFn()
	{
		super("insert_adjunct");
	}

	@Override
	public Expression apply(final Expression expr1, final Expression expr2)
	{
		final Feature outer1 = expr1.outerFeature();
		final Feature outer2 = expr2.outerFeature();
		if (outer1 == null || outer2 == null || !outer1.category.equals(outer2.category))
			return null;
		if (outer1.kind == Feature.Kind.licensee && outer2.kind == Feature.Kind.adjunct)
			return expr1.withChild(expr2);
		if (outer1.kind == Feature.Kind.adjunct && outer2.kind == Feature.Kind.licensee)
			return expr2.withChild(expr1);
		return null;
	}
}
