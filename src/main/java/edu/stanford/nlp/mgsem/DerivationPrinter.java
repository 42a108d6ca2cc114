package edu.stanford.nlp.mgsem;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a derivation as one line per node, children before parents:
 *
 * <pre>
 * e0 = &lt;bob::-d = bob, {}&gt;
 * e1 = &lt;chase::+d +d -v = chase, {}&gt;
 * e2 = insert(e0, e1) = &lt;chase::+d +d -v = chase, {&lt;bob::-d = bob, {}&gt;}&gt;
 * </pre>
 */
public final class DerivationPrinter
{
	private DerivationPrinter()
	{
	}

	public static String print(final ChartEntry entry)
	{
		final List<String> lines = new ArrayList<>();
		traverse(entry, lines);
		return String.join("\n", lines) + "\n";
	}

	// Return the label of |entry|.
	private static String traverse(final ChartEntry entry, final List<String> lines)
	{
		final List<String> labels = new ArrayList<>();
		for (final ChartEntry source : entry.derivation.sources)
			labels.add(traverse(source, lines));
		final String label = "e" + lines.size();
		if (entry.derivation.isLexical())
			lines.add(label + " = " + entry.expression);
		else
			lines.add(label + " = " + entry.derivation.operator + "(" + String.join(", ", labels) + ") = " + entry.expression);
		return label;
	}
}
