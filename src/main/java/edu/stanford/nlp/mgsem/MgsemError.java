package edu.stanford.nlp.mgsem;

/**
 * Raised for invalid configuration: unreadable or malformed grammar and model files, unknown feature notation.
 */
public class MgsemError extends RuntimeException
{
	private static final long serialVersionUID = -2171271967007041814L;

	public MgsemError()
	{
		super();
	}

	public MgsemError(final String message)
	{
		super(message);
	}

	public MgsemError(final Throwable cause)
	{
		super(cause);
	}

	public MgsemError(final String message, final Throwable cause)
	{
		super(message, cause);
	}
}
