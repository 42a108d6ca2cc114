package edu.stanford.nlp.mgsem;

/**
 * Represents a boolean.
 **/
public class BooleanValue extends Value
{
	public static final BooleanValue TRUE = new BooleanValue(true);
	public static final BooleanValue FALSE = new BooleanValue(false);

	public final boolean value;

	private BooleanValue(final boolean value)
	{
		this.value = value;
	}

	@Override
	public String toString()
	{
		return value ? "True" : "False";
	}

	@Override
	public int hashCode()
	{
		return Boolean.valueOf(value).hashCode();
	}

	@Override
	public boolean equals(final Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		final BooleanValue that = (BooleanValue) o;
		return value == that.value;
	}
}
