package org.tensorscript.compiler.frontend.irgen;

import java.util.HashSet;
import java.util.Set;

/**
 * Produces graph value names that are unique within one top-level function, including
 * all of its subgraphs and nested functions.
 */
public final class NameGenerator {

	private final Set<String> used = new HashSet<>();
	private int next = 0;

	/**
	 * Returns the candidate itself if it is still free, otherwise {@code candidate_k} for the
	 * next free counter value. The returned name is marked as used.
	 *
	 * @param candidate The preferred name.
	 * @return A name not returned before.
	 */
	public String generate(String candidate) {
		String result = candidate;
		while (used.contains(result)) {
			result = candidate + "_" + next;
			next++;
		}
		used.add(result);
		return result;
	}

	/**
	 * Marks a name as used without generating it.
	 *
	 * @param name The name to reserve.
	 */
	public void reserve(String name) {
		used.add(name);
	}

	public boolean isUsed(String name) {
		return used.contains(name);
	}
}
