package edu.stanford.nlp.mgsem;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A finite model of the world: the entities and events that exist, an assignment of pronoun indices to entities, the
 * extensions of monadic predicates, and the two dyadic theta relations (int, ext) linking events to participants. The
 * model is immutable; quantifier evaluation derives extended models with {@link #withAssignment(int, String)}.
 */
public class Model
{
	public static final String INTERNAL = "int";
	public static final String EXTERNAL = "ext";

	public final ImmutableList<String> entities;
	public final ImmutableList<String> events;
	public final ImmutableMap<Integer, String> assignments;
	public final ImmutableSetMultimap<String, String> predicates; // predicate => members
	public final ImmutableMap<String, ImmutableSetMultimap<String, String>> relations; // relation => (event => participants)

	public Model(final ImmutableList<String> entities_, final ImmutableList<String> events_, final ImmutableMap<Integer, String> assignments_, final ImmutableSetMultimap<String, String> predicates_, final ImmutableMap<String, ImmutableSetMultimap<String, String>> relations_)
	{
		entities = entities_;
		events = events_;
		assignments = assignments_;
		predicates = predicates_;
		relations = relations_;
	}

	public Model withAssignment(final int index, final String entity)
	{
		final Map<Integer, String> newAssignments = new LinkedHashMap<>(assignments);
		newAssignments.put(index, entity);
		return new Model(entities, events, ImmutableMap.copyOf(newAssignments), predicates, relations);
	}

	public boolean isEntity(final String name)
	{
		return entities.contains(name);
	}

	// Return the entity assigned to |index|, or null.
	public String assignment(final int index)
	{
		return assignments.get(index);
	}

	public boolean satisfies(final String predicate, final String name)
	{
		return predicates.containsEntry(predicate, name);
	}

	// A relation missing from the model is empty.
	public boolean related(final String relation, final String event, final String entity)
	{
		final ImmutableSetMultimap<String, String> pairs = relations.get(relation);
		return pairs != null && pairs.containsEntry(event, entity);
	}

	@Override
	public String toString()
	{
		return "Model(" + entities.size() + " entities, " + events.size() + " events, " + assignments.size() + " assignments, " + predicates.keySet().size() + " predicates)";
	}

	public static class Builder
	{
		private final Set<String> entities = new LinkedHashSet<>();
		private final Set<String> events = new LinkedHashSet<>();
		private final Map<Integer, String> assignments = new LinkedHashMap<>();
		private final ImmutableSetMultimap.Builder<String, String> predicates = ImmutableSetMultimap.builder();
		private final Map<String, ImmutableSetMultimap.Builder<String, String>> relations = new LinkedHashMap<>();

		public Builder entity(final String... names)
		{
			for (final String name : names)
				entities.add(name);
			return this;
		}

		public Builder event(final String... names)
		{
			for (final String name : names)
				events.add(name);
			return this;
		}

		public Builder assign(final int index, final String entity)
		{
			assignments.put(index, entity);
			return this;
		}

		public Builder predicate(final String predicate, final String... members)
		{
			predicates.putAll(predicate, members);
			return this;
		}

		public Builder relation(final String relation, final String event, final String entity)
		{
			relations.computeIfAbsent(relation, r -> ImmutableSetMultimap.builder()).put(event, entity);
			return this;
		}

		public Model createModel()
		{
			final ImmutableMap.Builder<String, ImmutableSetMultimap<String, String>> builtRelations = ImmutableMap.builder();
			for (final Map.Entry<String, ImmutableSetMultimap.Builder<String, String>> e : relations.entrySet())
				builtRelations.put(e.getKey(), e.getValue().build());
			return new Model(ImmutableList.copyOf(entities), ImmutableList.copyOf(events), ImmutableMap.copyOf(assignments), predicates.build(), builtRelations.build());
		}
	}
}
