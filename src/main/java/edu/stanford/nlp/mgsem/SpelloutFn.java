package edu.stanford.nlp.mgsem;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * spellout: linearizes an expression and composes its meaning from its head and recorded arguments. Adjunct children
 * are pronounced after the expression and their meanings conjoined in front of the base meaning.
 *
 * <pre>
 * clause head, external only      ext                     ext
 * clause head, ext + int          int                     ext &amp; int
 * verbal head, external only      ext head                head &amp; ext(ext)
 * quantifier, one argument        head ext                head &amp; int_i(ext), i fresh
 * other head, one argument        head ext                head &amp; ext
 * verbal head, ext + int          ext head int            head &amp; int(int) &amp; ext(ext)
 * other head, ext + int           ext head int            &lt;head &amp; int&gt;
 * </pre>
 *
 * Note that the two-argument order (ext head int) is the reverse of Hunter (2011), p. 74.
 */
public class SpelloutFn extends UnaryCombinationFn
{
	public static class Options
	{
		// Category of clauses
		public String clauseCategory = "c";
		// Category of verb phrases, whose arguments receive theta roles
		public String verbCategory = "v";
	}

	public static Options opts = new Options();

	private final DerivationContext context;

	public SpelloutFn(final DerivationContext context_)
	{
		super("spellout");
		context = context_;
	}

	@Override
	public Expression apply(final Expression expr)
	{
		final int numArgs = expr.args.size();
		if (numArgs != 1 && numArgs != 2)
			return null;

		final List<Expression> adjuncts = new ArrayList<>();
		final ImmutableList.Builder<Expression> rest = ImmutableList.builder();
		for (final Expression child : expr.children)
			if (child.hasOuter(Feature.Kind.adjunct))
				adjuncts.add(child);
			else
				rest.add(child);
		final List<Formula> adjunctMeanings = new ArrayList<>();
		final List<String> adjunctTokens = new ArrayList<>();
		for (final Expression adjunct : adjuncts)
		{
			adjunctMeanings.add(adjunct.formula);
			adjunctTokens.add(adjunct.token);
		}
		final String adjunctSpellout = adjuncts.isEmpty() ? "" : " " + Joiner.on(' ').join(adjunctTokens);

		final Argument ext = expr.args.get(0);
		final Argument internal = numArgs == 2 ? expr.args.get(1) : null;
		final boolean clause = expr.hasOuter(Feature.Kind.licensee, opts.clauseCategory);
		final boolean verbal = expr.hasOuter(Feature.Kind.licensee, opts.verbCategory);

		final String phonological;
		final Formula meaning;
		if (clause && internal == null)
		{
			phonological = ext.token;
			meaning = Formulas.conjoin(adjunctMeanings, ext.formula);
		}
		else
			if (clause)
			{
				phonological = internal.token;
				meaning = Formulas.conjoin(adjunctMeanings, new ConjunctionFormula(ext.formula, internal.formula));
			}
			else
				if (verbal && internal == null)
				{
					phonological = ext.token + " " + expr.token;
					meaning = Formulas.conjoin(adjunctMeanings, new ConjunctionFormula(expr.formula, new RoleFormula(RoleFormula.Mode.external, ext.formula)));
				}
				else
					if (internal == null)
					{
						if (!expr.hasOuter(Feature.Kind.licensee))
							return null;
						phonological = expr.token + " " + ext.token;
						final Formula argument = Formulas.isQuantifier(expr.formula) ? new IndexedInternalFormula(ext.formula, context.nextIndex()) : ext.formula;
						meaning = Formulas.conjoin(adjunctMeanings, new ConjunctionFormula(expr.formula, argument));
					}
					else
					{
						phonological = ext.token + " " + expr.token + " " + internal.token;
						if (verbal)
						{
							final Formula roles = new ConjunctionFormula(new RoleFormula(RoleFormula.Mode.internal, internal.formula), new RoleFormula(RoleFormula.Mode.external, ext.formula));
							meaning = Formulas.conjoin(adjunctMeanings, new ConjunctionFormula(expr.formula, roles));
						}
						else
							meaning = new ClosureFormula(new ConjunctionFormula(expr.formula, internal.formula));
					}
		return new Expression(phonological + adjunctSpellout, expr.kind, expr.features, ImmutableList.of(), rest.build(), meaning);
	}
}
