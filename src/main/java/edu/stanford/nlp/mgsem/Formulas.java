package edu.stanford.nlp.mgsem;

import java.util.ArrayList;
import java.util.List;

/**
 * Utilities for working with Formulas.
 */
public abstract class Formulas
{
	// A formula is quantificational if a quantifier sits at the bottom of its left conjunct spine,
	// e.g., (some & int_-1(girl)). This is the only way scope is marked.
	public static boolean isQuantifier(final Formula formula)
	{
		Formula current = formula;
		while (current instanceof ConjunctionFormula)
			current = ((ConjunctionFormula) current).child1;
		return current instanceof QuantifierFormula;
	}

	// Index bound by a quantificational formula: the index of the indexed-internal restrictor at the bottom of its
	// right conjunct spine.
	public static int boundIndex(final Formula formula)
	{
		Formula current = formula;
		while (current instanceof ConjunctionFormula)
			current = ((ConjunctionFormula) current).child2;
		if (!(current instanceof IndexedInternalFormula))
			throw new BadFormulaException("Could not insert variable in place of quantifier: %s", formula);
		return ((IndexedInternalFormula) current).index;
	}

	// Right-nested conjunction of |conjuncts| in order; |base| is the innermost right conjunct.
	public static Formula conjoin(final List<Formula> conjuncts, final Formula base)
	{
		Formula result = base;
		for (int i = conjuncts.size() - 1; i >= 0; i--)
			result = new ConjunctionFormula(conjuncts.get(i), result);
		return result;
	}

	// ============================================================
	// Reading formulas
	// ============================================================

	// Examples:
	//   alice
	//   (const "")
	//   (var 1)
	//   (and (quantifier exists) (int_i girl -1))
	//   (closure (and chase (and (int bob) (ext alice))))
	public static Formula fromString(final String s)
	{
		final List<String> tokens = tokenize(s);
		final int[] pos = { 0 };
		final Formula formula = read(tokens, pos, s);
		if (pos[0] != tokens.size())
			throw new BadFormulaException("Trailing input in formula: %s", s);
		return formula;
	}

	private static Formula read(final List<String> tokens, final int[] pos, final String s)
	{
		if (pos[0] >= tokens.size())
			throw new BadFormulaException("Unexpected end of formula: %s", s);
		final String token = tokens.get(pos[0]++);
		if (")".equals(token))
			throw new BadFormulaException("Unexpected ')' in formula: %s", s);
		if (!"(".equals(token))
			return new ConstantFormula(unquote(token));

		final String func = atom(tokens, pos, s);
		final Formula result;
		if ("const".equals(func))
			result = new ConstantFormula(atom(tokens, pos, s));
		else
			if ("var".equals(func))
				result = new VariableFormula(integer(atom(tokens, pos, s), s));
			else
				if ("and".equals(func))
				{
					final List<Formula> conjuncts = new ArrayList<>();
					while (pos[0] < tokens.size() && !")".equals(tokens.get(pos[0])))
						conjuncts.add(read(tokens, pos, s));
					if (conjuncts.size() < 2)
						throw new BadFormulaException("Conjunction needs at least two arguments: %s", s);
					result = conjoin(conjuncts.subList(0, conjuncts.size() - 1), conjuncts.get(conjuncts.size() - 1));
				}
				else
					if ("closure".equals(func))
						result = new ClosureFormula(read(tokens, pos, s));
					else
						if ("int_i".equals(func))
						{
							final Formula child = read(tokens, pos, s);
							result = new IndexedInternalFormula(child, integer(atom(tokens, pos, s), s));
						}
						else
							if ("quantifier".equals(func))
							{
								final String name = atom(tokens, pos, s);
								final QuantifierFormula.Mode mode = QuantifierFormula.parseMode(name);
								if (mode == null)
									throw new BadFormulaException("Unknown quantifier %s in formula: %s", name, s);
								result = new QuantifierFormula(mode);
							}
							else
							{
								final RoleFormula.Mode mode = RoleFormula.parseMode(func);
								if (mode == null)
									throw new BadFormulaException("Unknown operator %s in formula: %s", func, s);
								result = new RoleFormula(mode, read(tokens, pos, s));
							}
		if (pos[0] >= tokens.size() || !")".equals(tokens.get(pos[0])))
			throw new BadFormulaException("Missing ')' in formula: %s", s);
		pos[0]++;
		return result;
	}

	private static String atom(final List<String> tokens, final int[] pos, final String s)
	{
		if (pos[0] >= tokens.size())
			throw new BadFormulaException("Unexpected end of formula: %s", s);
		final String token = tokens.get(pos[0]++);
		if ("(".equals(token) || ")".equals(token))
			throw new BadFormulaException("Expected an atom but got '%s' in formula: %s", token, s);
		return unquote(token);
	}

	private static int integer(final String value, final String s)
	{
		try
		{
			return Integer.parseInt(value);
		}
		catch (final NumberFormatException e)
		{
			throw new BadFormulaException("Expected an integer but got '%s' in formula: %s", value, s);
		}
	}

	private static String unquote(final String token)
	{
		if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\""))
			return token.substring(1, token.length() - 1);
		return token;
	}

	// Parentheses, quoted strings (kept with their quotes) and whitespace-delimited atoms.
	private static List<String> tokenize(final String s)
	{
		final List<String> tokens = new ArrayList<>();
		int i = 0;
		while (i < s.length())
		{
			final char c = s.charAt(i);
			if (Character.isWhitespace(c))
				i++;
			else
				if (c == '(' || c == ')')
				{
					tokens.add(String.valueOf(c));
					i++;
				}
				else
					if (c == '"')
					{
						final int end = s.indexOf('"', i + 1);
						if (end < 0)
							throw new BadFormulaException("Unterminated string in formula: %s", s);
						tokens.add(s.substring(i, end + 1));
						i = end + 1;
					}
					else
					{
						int end = i;
						while (end < s.length() && !Character.isWhitespace(s.charAt(end)) && s.charAt(end) != '(' && s.charAt(end) != ')')
							end++;
						tokens.add(s.substring(i, end));
						i = end;
					}
		}
		return tokens;
	}
}
