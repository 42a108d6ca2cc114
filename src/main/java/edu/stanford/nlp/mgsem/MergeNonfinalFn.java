package edu.stanford.nlp.mgsem;

import com.google.common.collect.ImmutableList;

/**
 * merge_nonfinal: the host's outer +f is checked against its only child waiting for -f, which must still have features
 * after -f. The child stays attached (it moves on later) and only loses -f. If the child is quantificational, the
 * argument's meaning is the variable its quantifier binds instead of the quantifier itself, which is how a quantifier
 * takes scope above its base position.
 */
public class MergeNonfinalFn extends UnaryCombinationFn
{
	public MergeNonfinalFn()
	{
		super("merge_nonfinal");
	}

	@Override
	public Expression apply(final Expression expr)
	{
		if (!expr.hasOuter(Feature.Kind.licensor))
			return null;
		final String category = expr.outerFeature().category;

		// Exactly one child may wait for -f, and it must have features left after it.
		int position = -1;
		for (int i = 0; i < expr.children.size(); i++)
			if (expr.children.get(i).hasOuter(Feature.Kind.licensee, category))
			{
				if (position >= 0)
					return null;
				position = i;
			}
		if (position < 0)
			return null;

		final Expression mover = expr.children.get(position);
		if (mover.features.size() < 2)
			return null;
		final Formula meaning = Formulas.isQuantifier(mover.formula) ? new VariableFormula(Formulas.boundIndex(mover.formula)) : mover.formula;

		final ImmutableList.Builder<Expression> children = ImmutableList.builder();
		for (int i = 0; i < expr.children.size(); i++)
			children.add(i == position ? mover.withFeatures(mover.remainingFeatures()) : expr.children.get(i));
		final ImmutableList<Argument> args = ImmutableList.<Argument> builder().add(new Argument(mover.token, category, meaning)).addAll(expr.args).build();
		return new Expression(expr.token, Expression.Kind.derived, expr.remainingFeatures(), args, children.build(), expr.formula);
	}
}
