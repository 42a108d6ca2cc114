package edu.stanford.nlp.mgsem;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * An expression of the grammar: its phonological string, whether it came straight from the lexicon, its remaining
 * features (only the first is ever inspected), the arguments discharged so far, the expressions inserted into it
 * that still carry unchecked features, and its meaning. Immutable; the with* methods return modified copies.
 */
public class Expression
{
	public enum Kind
	{
		lexical, derived
	}

	public final String token;
	public final Kind kind;
	public final ImmutableList<Feature> features;
	public final ImmutableList<Argument> args;
	public final ImmutableList<Expression> children;
	public final Formula formula;

	private int hashCode = -1;

	public Expression(final String token_, final Kind kind_, final ImmutableList<Feature> features_, final ImmutableList<Argument> args_, final ImmutableList<Expression> children_, final Formula formula_)
	{
		token = token_;
		kind = kind_;
		features = features_;
		args = args_;
		children = children_;
		formula = formula_;
	}

	public static Expression fromLexicalItem(final LexicalItem item)
	{
		return new Expression(item.token, Kind.lexical, item.features, ImmutableList.of(), ImmutableList.of(), item.formula);
	}

	// First feature, or null if all features have been checked.
	public Feature outerFeature()
	{
		return features.isEmpty() ? null : features.get(0);
	}

	public boolean hasOuter(final Feature.Kind featureKind)
	{
		return !features.isEmpty() && features.get(0).kind == featureKind;
	}

	public boolean hasOuter(final Feature.Kind featureKind, final String category)
	{
		return !features.isEmpty() && features.get(0).is(featureKind, category);
	}

	public ImmutableList<Feature> remainingFeatures()
	{
		return features.subList(1, features.size());
	}

	public Expression withFeatures(final ImmutableList<Feature> newFeatures)
	{
		return new Expression(token, kind, newFeatures, args, children, formula);
	}

	public Expression withChildren(final ImmutableList<Expression> newChildren)
	{
		return new Expression(token, kind, features, args, newChildren, formula);
	}

	// Put |child| in front of the existing children.
	public Expression withChild(final Expression child)
	{
		return withChildren(ImmutableList.<Expression> builder().add(child).addAll(children).build());
	}

	@Override
	public String toString()
	{
		final StringBuilder out = new StringBuilder();
		out.append('<').append(token).append(kind == Kind.lexical ? "::" : ":");
		out.append(Joiner.on(' ').join(features)).append(" = ").append(formula);
		if (!args.isEmpty())
			out.append(", ").append(Joiner.on(", ").join(args));
		out.append(", {").append(Joiner.on(", ").join(children)).append("}>");
		return out.toString();
	}

	@Override
	public boolean equals(final Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof Expression))
			return false;
		final Expression that = (Expression) o;
		return kind == that.kind && token.equals(that.token) && features.equals(that.features) && args.equals(that.args) && children.equals(that.children) && formula.equals(that.formula);
	}

	@Override
	public int hashCode()
	{
		if (hashCode == -1)
			hashCode = Objects.hash(token, kind.toString(), features, args, children, formula);
		return hashCode;
	}
}
