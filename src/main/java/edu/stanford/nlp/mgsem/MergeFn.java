package edu.stanford.nlp.mgsem;

import com.google.common.collect.ImmutableList;

/**
 * Common shape of merge_comp and merge_spec: the host's outer +f is checked against its unique child whose only
 * feature is -f. The child is removed, recorded as an argument, and its own children are handed to the host.
 */
public abstract class MergeFn extends UnaryCombinationFn
{
	protected MergeFn(final String name_)
	{
		super(name_);
	}

	// Kind of host this merge applies to.
	protected abstract Expression.Kind hostKind();

	// Token recorded for the discharged child.
	protected abstract String argumentToken(Expression child);

	@Override
	public Expression apply(final Expression expr)
	{
		if (expr.kind != hostKind() || !expr.hasOuter(Feature.Kind.licensor))
			return null;
		final String category = expr.outerFeature().category;

		Expression licensee = null;
		final ImmutableList.Builder<Expression> rest = ImmutableList.builder();
		for (final Expression child : expr.children)
			if (isFinalLicensee(child, category))
			{
				if (licensee != null)
					return null;
				licensee = child;
			}
			else
				rest.add(child);
		if (licensee == null)
			return null;

		final Argument arg = new Argument(argumentToken(licensee), category, licensee.formula);
		final ImmutableList<Argument> args = ImmutableList.<Argument> builder().add(arg).addAll(expr.args).build();
		final ImmutableList<Expression> children = rest.addAll(licensee.children).build();
		return new Expression(expr.token, Expression.Kind.derived, expr.remainingFeatures(), args, children, expr.formula);
	}

	static boolean isFinalLicensee(final Expression expr, final String category)
	{
		return expr.features.size() == 1 && expr.hasOuter(Feature.Kind.licensee, category);
	}
}
