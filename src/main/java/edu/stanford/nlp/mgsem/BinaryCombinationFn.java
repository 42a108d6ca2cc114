package edu.stanford.nlp.mgsem;

import com.google.common.collect.ImmutableList;

/**
 * An operator combining two expressions (insert, adjunction). Operand order does not matter to the operators
 * themselves; the derivation records them in the order given.
 */
public abstract class BinaryCombinationFn extends CombinationFn
{
	protected BinaryCombinationFn(final String name_)
	{
		super(name_);
	}

	@Override
	public int arity()
	{
		return 2;
	}

	// Return the combined expression, or null if the operator does not apply.
	public abstract Expression apply(Expression expr1, Expression expr2);

	// Apply to two chart entries. Entries that have consumed each other, or that share consumed material, never
	// combine.
	public ChartEntry combine(final ChartEntry entry1, final ChartEntry entry2, final DerivationContext context)
	{
		final RetiredSet retired1 = entry1.retired();
		final RetiredSet retired2 = entry2.retired();
		if (!retired1.isDisjoint(retired2))
			return null;
		final RetiredSet retired = retired1.union(retired2);
		if (retired.contains(entry1.id) || retired.contains(entry2.id))
			return null;
		final Expression result = apply(entry1.expression, entry2.expression);
		if (result == null)
			return null;
		return new ChartEntry(context.nextId(), result, new Derivation(name, ImmutableList.of(entry1, entry2), retired.with(entry1.id, entry2.id)));
	}
}
