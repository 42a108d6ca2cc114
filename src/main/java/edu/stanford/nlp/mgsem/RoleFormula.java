package edu.stanford.nlp.mgsem;

/**
 * int(f) and ext(f): true of an event whose internal (resp. external) participant satisfies f.
 */
public class RoleFormula extends Formula
{
	public enum Mode
	{
		internal, external
	}

	public final Mode mode;
	public final Formula child;

	public RoleFormula(final Mode mode_, final Formula child_)
	{
		mode = mode_;
		child = child_;
	}

	// Name of the dyadic relation in the model that links events to participants.
	public String relation()
	{
		return mode == Mode.internal ? Model.INTERNAL : Model.EXTERNAL;
	}

	public static Mode parseMode(final String mode)
	{
		if ("int".equals(mode))
			return Mode.internal;
		if ("ext".equals(mode))
			return Mode.external;
		return null;
	}

	@Override
	public String toString()
	{
		return relation() + "(" + child + ")";
	}

	@Override
	public boolean equals(final Object thatObj)
	{
		if (!(thatObj instanceof RoleFormula))
			return false;
		final RoleFormula that = (RoleFormula) thatObj;
		if (mode != that.mode)
			return false;
		if (!child.equals(that.child))
			return false;
		return true;
	}

	@Override
	public int computeHashCode()
	{
		int hash = 0x7ed55d16;
		hash = hash * 0xd3a2646c + mode.toString().hashCode();
		hash = hash * 0xd3a2646c + child.hashCode();
		return hash;
	}
}
