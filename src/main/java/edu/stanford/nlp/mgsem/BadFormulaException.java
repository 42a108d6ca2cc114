package edu.stanford.nlp.mgsem;

/**
 * Thrown when a formula does not have a shape that can be evaluated or composed (e.g., an unbound variable, or a
 * quantifier without an indexed restrictor). These are defects of the grammar or of the composition, never an ordinary
 * "no result".
 */
public class BadFormulaException extends RuntimeException
{
	public static final long serialVersionUID = 86586128316354597L;

	public BadFormulaException(final String message)
	{
		super(message);
	}

	public BadFormulaException(final String format, final Object... args)
	{
		super(String.format(format, args));
	}
}
