/*-
 * #%L
 * This file is part of ExrView.
 * %%
 * Copyright (C) 2024 ExrView developers
 * %%
 * ExrView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * ExrView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ExrView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package exrview.lib.images;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filter used to choose (and order) the channels of an image by name.
 * <p>
 * A fuzzy selector is a list of terms separated by commas or whitespace. A channel name matches a term
 * if the characters of the term appear in the name in the same order, not necessarily adjacent.
 * Terms containing an upper case letter are matched case-sensitively; all-lowercase terms ignore case.
 * The match rank of a name is the index of the first term it matches, so that channels can be ordered
 * by the term that selected them.
 * <p>
 * A regex selector matches names containing a match for the pattern, and always gives rank 0.
 * An empty selector matches everything with rank 0.
 */
public final class ChannelSelector {

	private static final Logger logger = LoggerFactory.getLogger(ChannelSelector.class);

	/**
	 * Selector that accepts all channels.
	 */
	public static final ChannelSelector NONE = new ChannelSelector("", false);

	/**
	 * Invalid patterns that have already been reported.
	 * The same selector is usually applied to every image that is loaded, so each is reported only once.
	 */
	private static final Set<String> reportedInvalidRegexes = ConcurrentHashMap.newKeySet();

	private final String selector;
	private final boolean isRegex;

	private final List<String> terms;
	private final Pattern pattern;

	private ChannelSelector(String selector, boolean isRegex) {
		this.selector = Objects.requireNonNull(selector, "Selector must not be null - use an empty string instead");
		this.isRegex = isRegex;
		if (isRegex) {
			this.terms = Collections.emptyList();
			this.pattern = compile(selector);
		} else {
			List<String> list = new ArrayList<>();
			for (String term : selector.split("[,\\s]+")) {
				if (!term.isEmpty())
					list.add(term);
			}
			this.terms = Collections.unmodifiableList(list);
			this.pattern = null;
		}
	}

	private static Pattern compile(String regex) {
		if (regex.isEmpty())
			return null;
		try {
			return Pattern.compile(regex);
		} catch (PatternSyntaxException e) {
			if (reportedInvalidRegexes.add(regex))
				logger.warn("Invalid channel regex '{}' will not match any channels: {}", regex, e.getDescription());
			else
				logger.debug("Invalid channel regex '{}' used again", regex);
			return null;
		}
	}

	/**
	 * Create a fuzzy selector.
	 * @param selector
	 * @return
	 */
	public static ChannelSelector fuzzy(String selector) {
		return selector == null || selector.isEmpty() ? NONE : new ChannelSelector(selector, false);
	}

	/**
	 * Create a regex selector.
	 * @param selector
	 * @return
	 */
	public static ChannelSelector regex(String selector) {
		return selector == null || selector.isEmpty() ? NONE : new ChannelSelector(selector, true);
	}

	/**
	 * Create a selector of the requested kind.
	 * @param selector
	 * @param isRegex
	 * @return
	 */
	public static ChannelSelector create(String selector, boolean isRegex) {
		return isRegex ? regex(selector) : fuzzy(selector);
	}

	/**
	 * Get the selector text, as provided when it was created.
	 * @return
	 */
	public String getSelector() {
		return selector;
	}

	public boolean isRegex() {
		return isRegex;
	}

	/**
	 * Returns true if the selector has no text, and therefore matches every channel.
	 * @return
	 */
	public boolean isEmpty() {
		return selector.isEmpty();
	}

	/**
	 * Returns true if the channel name is accepted by this selector.
	 * @param channelName
	 * @return
	 */
	public boolean matches(String channelName) {
		return matchRank(channelName) >= 0;
	}

	/**
	 * Get the rank with which a channel name matches.
	 * @param channelName
	 * @return the rank (lower ranks are ordered first), or -1 if the name does not match
	 */
	public int matchRank(String channelName) {
		if (isRegex) {
			if (selector.isEmpty())
				return 0;
			return pattern != null && pattern.matcher(channelName).find() ? 0 : -1;
		}
		if (terms.isEmpty())
			return 0;
		for (int i = 0; i < terms.size(); i++) {
			if (matchesFuzzy(channelName, terms.get(i)))
				return i;
		}
		return -1;
	}

	/**
	 * Get the selector text with the name of an image part placed first, unless the part name is already
	 * one of its comma-separated entries.
	 * <p>
	 * This keeps the part visible in the name of images loaded from multi-part files.
	 * @param partName
	 * @return
	 */
	public String withPartName(String partName) {
		if (partName == null || partName.isEmpty())
			return selector;
		if (selector.isEmpty())
			return partName;
		for (String existing : selector.split(","))
			if (existing.equals(partName))
				return selector;
		return partName + "," + selector;
	}

	static boolean matchesFuzzy(String text, String term) {
		boolean caseSensitive = !term.equals(term.toLowerCase());
		if (!caseSensitive)
			text = text.toLowerCase();
		int pos = 0;
		for (int i = 0; i < term.length(); i++) {
			pos = text.indexOf(term.charAt(i), pos);
			if (pos < 0)
				return false;
			pos++;
		}
		return true;
	}

	@Override
	public String toString() {
		return selector;
	}

	@Override
	public int hashCode() {
		return Objects.hash(selector, isRegex);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ChannelSelector))
			return false;
		ChannelSelector other = (ChannelSelector)obj;
		return isRegex == other.isRegex && selector.equals(other.selector);
	}

}
