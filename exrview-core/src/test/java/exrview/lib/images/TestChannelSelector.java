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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

@SuppressWarnings("javadoc")
public class TestChannelSelector {

	@Test
	public void test_empty() {
		assertSame(ChannelSelector.NONE, ChannelSelector.fuzzy(""));
		assertSame(ChannelSelector.NONE, ChannelSelector.regex(null));
		assertTrue(ChannelSelector.NONE.isEmpty());
		assertEquals(0, ChannelSelector.NONE.matchRank("anything.at.all"));
	}

	@Test
	public void test_fuzzySubsequence() {
		assertTrue(ChannelSelector.matchesFuzzy("diffuse.R", "dif"));
		assertTrue(ChannelSelector.matchesFuzzy("diffuse.R", "dfR"));
		assertFalse(ChannelSelector.matchesFuzzy("diffuse.R", "rd"));
		// Lower case terms ignore case, others do not
		assertTrue(ChannelSelector.matchesFuzzy("Diffuse.R", "dr"));
		assertFalse(ChannelSelector.matchesFuzzy("diffuse.r", "R"));
	}

	@Test
	public void test_fuzzyRanks() {
		var selector = ChannelSelector.fuzzy("R");
		assertTrue(selector.matches("layer1.R"));
		assertFalse(selector.matches("layer1.G"));
		assertTrue(selector.matches("layer2.R"));

		var multi = ChannelSelector.fuzzy("depth,R");
		assertEquals(0, multi.matchRank("depth.Z"));
		assertEquals(1, multi.matchRank("R"));
		assertEquals(-1, multi.matchRank("G"));

		var spaces = ChannelSelector.fuzzy("B  G");
		assertEquals(0, spaces.matchRank("B"));
		assertEquals(1, spaces.matchRank("G"));
	}

	@Test
	public void test_regex() {
		var selector = ChannelSelector.regex("^layer[12]\\.R$");
		assertTrue(selector.isRegex());
		assertTrue(selector.matches("layer1.R"));
		assertFalse(selector.matches("layer3.R"));
		assertEquals(0, selector.matchRank("layer2.R"));

		// Invalid expressions match nothing
		var invalid = ChannelSelector.regex("[unclosed");
		assertFalse(invalid.matches("[unclosed"));
		assertFalse(invalid.matches("R"));
	}

	@Test
	public void test_invalidRegexReportedOnce() {
		var logger = (Logger)LoggerFactory.getLogger(ChannelSelector.class);
		var appender = new ListAppender<ILoggingEvent>();
		appender.start();
		logger.addAppender(appender);
		try {
			for (int i = 0; i < 3; i++)
				ChannelSelector.regex("(diffuse");
			ChannelSelector.regex("normal[");
			ChannelSelector.regex("^depth\\.Z$");

			long nWarnings = appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
			assertEquals(2, nWarnings);
			assertTrue(appender.list.get(0).getFormattedMessage().contains("'(diffuse'"));
			assertTrue(appender.list.get(1).getFormattedMessage().contains("'normal['"));
		} finally {
			logger.detachAppender(appender);
			appender.stop();
		}
	}

	@Test
	public void test_withPartName() {
		assertEquals("part", ChannelSelector.NONE.withPartName("part"));
		assertEquals("R", ChannelSelector.fuzzy("R").withPartName(""));
		assertEquals("part,R", ChannelSelector.fuzzy("R").withPartName("part"));
		assertEquals("R,part", ChannelSelector.fuzzy("R,part").withPartName("part"));
	}

	@Test
	public void test_equality() {
		assertEquals(ChannelSelector.fuzzy("R,G"), ChannelSelector.create("R,G", false));
		assertFalse(ChannelSelector.fuzzy("R").equals(ChannelSelector.regex("R")));
		assertEquals("R,G", ChannelSelector.fuzzy("R,G").toString());
	}

}
