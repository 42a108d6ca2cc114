package edu.stanford.nlp.mgsem;

/**
 * merge_comp: a lexical head takes its complement. The complement's string is kept for spellout.
 */
public class MergeCompFn extends MergeFn
{
	public MergeCompFn()
	{
		super("merge_comp");
	}

	@Override
	protected Expression.Kind hostKind()
	{
		return Expression.Kind.lexical;
	}

	@Override
	protected String argumentToken(final Expression child)
	{
		return child.token;
	}
}
