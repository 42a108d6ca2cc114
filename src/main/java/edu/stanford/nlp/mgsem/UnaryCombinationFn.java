package edu.stanford.nlp.mgsem;

import com.google.common.collect.ImmutableList;

/**
 * An operator rewriting a single expression (merge, spellout).
 */
public abstract class UnaryCombinationFn extends CombinationFn
{
	protected UnaryCombinationFn(final String name_)
	{
		super(name_);
	}

	@Override
	public int arity()
	{
		return 1;
	}

	// Return the rewritten expression, or null if the operator does not apply.
	public abstract Expression apply(Expression expr);

	// Apply to a chart entry; the result retires the operand.
	public ChartEntry combine(final ChartEntry entry, final DerivationContext context)
	{
		final RetiredSet retired = entry.retired();
		if (retired.contains(entry.id))
			return null;
		final Expression result = apply(entry.expression);
		if (result == null)
			return null;
		return new ChartEntry(context.nextId(), result, new Derivation(name, ImmutableList.of(entry), retired.with(entry.id)));
	}
}
