package edu.stanford.nlp.mgsem;

/**
 * Source of fresh chart-entry ids and fresh (negative) theta indices. Both counters are monotonic and never reset, so
 * ids and bound variables of independent parses sharing a context never collide. Parsers share
 * {@link #getGlobal()} unless given their own.
 */
public class DerivationContext
{
	private static final DerivationContext global = new DerivationContext();

	public static DerivationContext getGlobal()
	{
		return global;
	}

	private int nextId = 0;
	private int nextIndex = 0;

	public int nextId()
	{
		return nextId++;
	}

	// -1, -2, -3, ...
	public int nextIndex()
	{
		return --nextIndex;
	}
}
