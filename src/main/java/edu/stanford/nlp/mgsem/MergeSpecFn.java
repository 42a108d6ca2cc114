package edu.stanford.nlp.mgsem;

/**
 * merge_spec: a derived head takes its specifier. The specifier is pronounced elsewhere, so only its meaning is kept.
 */
public class MergeSpecFn extends MergeFn
{
	public MergeSpecFn()
	{
		super("merge_spec");
	}

	@Override
	protected Expression.Kind hostKind()
	{
		return Expression.Kind.derived;
	}

	@Override
	protected String argumentToken(final Expression child)
	{
		return Argument.PLACEHOLDER;
	}
}
