package org.metricshub.noeta.diagnostics;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Noeta
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * "Did you mean" support: ranks known names by Levenshtein distance to a
 * mistyped one.
 */
public final class Suggestions {

	/** Largest edit distance still considered a plausible typo. */
	public static final int MAX_DISTANCE = 3;

	/** Largest number of candidates returned. */
	public static final int MAX_SUGGESTIONS = 3;

	private Suggestions() {}

	/**
	 * Computes the edit distance between two strings with the classic dynamic
	 * programming algorithm, keeping two rows.
	 *
	 * @param s1 first string
	 * @param s2 second string
	 * @return number of single-character insertions, deletions or substitutions
	 */
	public static int levenshtein(String s1, String s2) {
		if (s1.length() < s2.length()) {
			return levenshtein(s2, s1);
		}
		if (s2.isEmpty()) {
			return s1.length();
		}
		int[] previous = new int[s2.length() + 1];
		int[] current = new int[s2.length() + 1];
		for (int j = 0; j <= s2.length(); j++) {
			previous[j] = j;
		}
		for (int i = 0; i < s1.length(); i++) {
			current[0] = i + 1;
			for (int j = 0; j < s2.length(); j++) {
				int insertion = previous[j + 1] + 1;
				int deletion = current[j] + 1;
				int substitution = previous[j] + (s1.charAt(i) == s2.charAt(j) ? 0 : 1);
				current[j + 1] = Math.min(Math.min(insertion, deletion), substitution);
			}
			int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous[s2.length()];
	}

	/**
	 * Returns the known names closest to the attempted one, nearest first. The
	 * comparison ignores case; ties keep the order of {@code available}.
	 *
	 * @param attempted the unknown name
	 * @param available the known names
	 * @return at most {@link #MAX_SUGGESTIONS} names within {@link #MAX_DISTANCE}
	 */
	public static List<String> similar(String attempted, Collection<String> available) {
		List<String> result = new ArrayList<String>();
		if (attempted == null || available == null || available.isEmpty()) {
			return result;
		}
		String needle = attempted.toLowerCase(Locale.ROOT);
		List<Candidate> candidates = new ArrayList<Candidate>();
		for (String name : available) {
			int distance = levenshtein(needle, name.toLowerCase(Locale.ROOT));
			if (distance <= MAX_DISTANCE) {
				candidates.add(new Candidate(name, distance));
			}
		}
		// List.sort is stable
		candidates.sort((a, b) -> Integer.compare(a.distance, b.distance));
		for (int i = 0; i < candidates.size() && i < MAX_SUGGESTIONS; i++) {
			result.add(candidates.get(i).name);
		}
		return result;
	}

	/**
	 * @param attempted the unknown name
	 * @param available the known names
	 * @return the nearest known name, or {@code null} when none is close enough
	 */
	public static String nearest(String attempted, Collection<String> available) {
		List<String> similar = similar(attempted, available);
		return similar.isEmpty() ? null : similar.get(0);
	}

	private static final class Candidate {
		private final String name;
		private final int distance;

		private Candidate(String name, int distance) {
			this.name = name;
			this.distance = distance;
		}
	}
}
