package edu.stanford.nlp.mgsem;

/**
 * Represents an individual or an event of the model, by name (e.g., "alice", "carol chasing bob").
 */
public class EntityValue extends Value
{
	public final String name;

	public EntityValue(final String name)
	{
		this.name = name;
	}

	@Override
	public String toString()
	{
		return "Entity(" + name + ")";
	}

	@Override
	public int hashCode()
	{
		return name.hashCode();
	}

	@Override
	public boolean equals(final Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		final EntityValue that = (EntityValue) o;
		return name.equals(that.name);
	}
}
