package com.obsinity.invoker.urivar;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.invoker.exceptions.AmbiguousConstructionException;
import com.obsinity.invoker.exceptions.InvalidFactoryResultException;
import com.obsinity.invoker.exceptions.InvalidTaggedStrategyException;
import com.obsinity.invoker.exceptions.NoConstructionStrategyException;
import com.obsinity.invoker.exceptions.RejectedValueException;
import com.obsinity.invoker.urivar.ConstructionModel.Candidate;

/**
 * Builds a value object from a raw URI variable by selecting exactly one construction strategy.
 *
 * <ol>
 *   <li>A type annotated with {@code @UriVarFactory} is built by the named method only. A misshapen method fails with
 *       {@link InvalidTaggedStrategyException}, a value the method does not accept with {@link RejectedValueException}.
 *   <li>Otherwise every public single-argument constructor and every public static single-argument factory returning
 *       exactly the type is a candidate if its parameter accepts the value.
 *   <li>One candidate is used; none fails with {@link NoConstructionStrategyException}; two or more fail with
 *       {@link AmbiguousConstructionException}. There is no tie-break.
 * </ol>
 *
 * <p>The produced object must be an instance of exactly the requested type.
 *
 * <h2>Thread-safety</h2>
 *
 * Construction models are cached per type in a concurrent map; concurrent first use recomputes the same model.
 */
public class ValueObjectInstantiator {

	private static final Logger log = LoggerFactory.getLogger(ValueObjectInstantiator.class);

	private final Map<Class<?>, ConstructionModel> models = new ConcurrentHashMap<>();

	public <T> T instantiate(Class<T> type, Object value) {
		ConstructionModel model = models.computeIfAbsent(type, ConstructionModel::introspect);
		if (model.isTagged()) {
			return instantiateTagged(model, type, value);
		}

		List<Candidate> eligible = model.candidates().stream().filter(c -> c.accepts(value)).toList();
		if (eligible.size() == 1) {
			return create(type, eligible.get(0), value);
		}
		if (eligible.isEmpty()) {
			log.debug("INVOKER: no strategy for {} value={} (shape-eligible={})",
					type.getSimpleName(), TypeAcceptance.describe(value), model.candidates().size());
			throw new NoConstructionStrategyException(type);
		}
		throw new AmbiguousConstructionException(type, eligible.stream().map(Candidate::describe).toList());
	}

	private <T> T instantiateTagged(ConstructionModel model, Class<T> type, Object value) {
		if (model.taggedError() != null) {
			throw new InvalidTaggedStrategyException(type, model.taggedMethod(), model.taggedError());
		}
		Candidate tagged = model.tagged();
		if (!tagged.accepts(value)) {
			throw new RejectedValueException(
					"Value " + TypeAcceptance.describe(value) + " not accepted by " + type.getName() + "#"
							+ model.taggedMethod() + "().",
					value);
		}
		return create(type, tagged, value);
	}

	private static <T> T create(Class<T> type, Candidate candidate, Object value) {
		Object produced = candidate.create(value);
		if (!isExactInstance(type, produced)) {
			throw new InvalidFactoryResultException(type, candidate.describe(), produced);
		}
		log.debug("INVOKER: built {} via {}", type.getSimpleName(), candidate.describe());
		return type.cast(produced);
	}

	/** Enum constants with a body are anonymous subclasses; they count as their declaring enum. */
	private static boolean isExactInstance(Class<?> type, Object o) {
		if (o == null) return false;
		if (o.getClass() == type) return true;
		return type.isEnum() && o instanceof Enum<?> e && e.getDeclaringClass() == type;
	}
}
