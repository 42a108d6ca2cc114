package edu.stanford.nlp.mgsem;

/**
 * Values a formula can be checked against: a truth value (the formula as a sentence) or an entity (the formula as a
 * monadic predicate). Events are entities too.
 */
public abstract class Value
{
	@Override
	public abstract boolean equals(Object o);

	@Override
	public abstract int hashCode();
}
