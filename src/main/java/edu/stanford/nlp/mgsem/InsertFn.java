package edu.stanford.nlp.mgsem;

/**
 * insert: an expression whose outer feature is +f takes an expression whose outer feature is -f as a new child. Both
 * keep their features; the +f/-f pair is checked later by a merge.
 */
public class InsertFn extends BinaryCombinationFn
{
	public InsertFn()
	{
		super("insert");
	}

	@Override
	public Expression apply(final Expression expr1, final Expression expr2)
	{
		final Feature outer1 = expr1.outerFeature();
		final Feature outer2 = expr2.outerFeature();
		if (outer1 == null || outer2 == null || !outer1.category.equals(outer2.category))
			return null;
		if (outer1.kind == Feature.Kind.licensor && outer2.kind == Feature.Kind.licensee)
			return expr1.withChild(expr2);
		if (outer1.kind == Feature.Kind.licensee && outer2.kind == Feature.Kind.licensor)
			return expr2.withChild(expr1);
		return null;
	}
}
