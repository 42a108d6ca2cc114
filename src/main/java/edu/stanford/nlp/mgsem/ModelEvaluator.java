package edu.stanford.nlp.mgsem;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a Formula against a Model. A formula is either evaluated as a sentence (against {@link BooleanValue#TRUE} or
 * {@link BooleanValue#FALSE}) or as a monadic predicate of an entity or event (against an {@link EntityValue}).
 * Quantifiers are restricted: ((quantifier &amp; int_i(restrictor)) &amp; body) ranges over the entities satisfying the
 * restrictor only, binding each in turn to index i while the body is evaluated.
 */
public final class ModelEvaluator
{
	public static class Options
	{
		// Log the restrictor set and outcome of every quantifier.
		public int verbose = 0;
	}

	public static Options opts = new Options();

	private static final Logger LOG = LoggerFactory.getLogger(ModelEvaluator.class);

	private ModelEvaluator()
	{
	}

	// Is |formula| true in |model|?
	public static boolean eval(final Model model, final Formula formula)
	{
		return hasValue(BooleanValue.TRUE, model, formula);
	}

	public static boolean hasValue(final Value value, final Model model, final Formula formula)
	{
		if (formula instanceof ConjunctionFormula)
		{
			final ConjunctionFormula conjunction = (ConjunctionFormula) formula;
			// Quantified conjunction: ((quantifier & restrictor) & body)
			if (conjunction.child1 instanceof ConjunctionFormula && ((ConjunctionFormula) conjunction.child1).child1 instanceof QuantifierFormula)
			{
				final ConjunctionFormula head = (ConjunctionFormula) conjunction.child1;
				return quantifier(((QuantifierFormula) head.child1).mode, value, model, head.child2, conjunction.child2);
			}
			return hasValue(value, model, conjunction.child1) && hasValue(value, model, conjunction.child2);
		}
		if (formula instanceof ConstantFormula)
			return lookupConstant(value, model, ((ConstantFormula) formula).name);
		if (formula instanceof ClosureFormula)
			return closure(value, model, ((ClosureFormula) formula).child);
		if (formula instanceof RoleFormula)
		{
			final RoleFormula role = (RoleFormula) formula;
			return role(role.relation(), value, model, role.child);
		}
		if (formula instanceof VariableFormula)
			return variable(value, model, ((VariableFormula) formula).index);
		if (formula instanceof QuantifierFormula)
			return false; // Quantifiers themselves have no value
		if (formula instanceof IndexedInternalFormula)
			throw new BadFormulaException("Indexed internal role outside of a quantifier has no interpretation: %s", formula);
		throw new BadFormulaException("Unknown formula: %s", formula);
	}

	private static boolean quantifier(final QuantifierFormula.Mode mode, final Value value, final Model model, final Formula restrictor, final Formula body)
	{
		if (value instanceof EntityValue)
			throw new BadFormulaException("Individual entities cannot be quantified: %s at %s", restrictor, value);
		if (!((BooleanValue) value).value)
			return !quantifier(mode, BooleanValue.TRUE, model, restrictor, body);
		if (!(restrictor instanceof IndexedInternalFormula))
			throw new BadFormulaException("Quantifiers must be used with indexed theta role assigners: %s", restrictor);

		final IndexedInternalFormula indexed = (IndexedInternalFormula) restrictor;
		final List<String> satisfiers = new ArrayList<>();
		for (final String entity : model.entities)
			if (hasValue(new EntityValue(entity), model, indexed.child))
				satisfiers.add(entity);

		boolean result = mode == QuantifierFormula.Mode.forall;
		for (final String entity : satisfiers)
			if (hasValue(BooleanValue.TRUE, model.withAssignment(indexed.index, entity), body) != result)
			{
				result = !result;
				break;
			}
		if (opts.verbose >= 1)
			LOG.info("{} x_{} in {}: {}", mode, indexed.index, satisfiers, result);
		return result;
	}

	private static boolean lookupConstant(final Value value, final Model model, final String constant)
	{
		if (!(value instanceof EntityValue))
			return false;
		final String name = ((EntityValue) value).name;
		return model.satisfies(constant, name) || model.isEntity(name) && name.equals(constant);
	}

	// <f>: some event satisfies f. Once an event is fixed, closure is the identity.
	private static boolean closure(final Value value, final Model model, final Formula formula)
	{
		if (value instanceof EntityValue)
			return hasValue(value, model, formula);
		if (!((BooleanValue) value).value)
			return !closure(BooleanValue.TRUE, model, formula);
		for (final String event : model.events)
			if (closure(new EntityValue(event), model, formula))
				return true;
		return false;
	}

	// int(f) / ext(f): some participant of the event under |relation| satisfies f.
	private static boolean role(final String relation, final Value value, final Model model, final Formula formula)
	{
		if (value instanceof BooleanValue)
		{
			if (!((BooleanValue) value).value)
				return !role(relation, BooleanValue.TRUE, model, formula);
			for (final String event : model.events)
				if (role(relation, new EntityValue(event), model, formula))
					return true;
			return false;
		}
		final String event = ((EntityValue) value).name;
		for (final String entity : model.entities)
			if (model.related(relation, event, entity) && hasValue(new EntityValue(entity), model, formula))
				return true;
		return false;
	}

	private static boolean variable(final Value value, final Model model, final int index)
	{
		if (!(value instanceof EntityValue))
			throw new BadFormulaException("Variable x_%d can only be checked against an entity, not %s", index, value);
		final String entity = model.assignment(index);
		if (entity == null)
			throw new BadFormulaException("Unbound variable x_%d", index);
		return entity.equals(((EntityValue) value).name);
	}
}
