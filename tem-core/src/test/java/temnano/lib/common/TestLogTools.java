/*-
 * #%L
 * This file is part of TEM Nanocrystals.
 * %%
 * Copyright (C) 2024 TEM Nanocrystals developers
 * %%
 * TEM Nanocrystals is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * TEM Nanocrystals is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with TEM Nanocrystals.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package temnano.lib.common;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

@SuppressWarnings("javadoc")
public class TestLogTools {

	private static final Logger logger = LoggerFactory.getLogger(TestLogTools.class);

	@Test
	public void test_logOnce() {
		assertTrue(LogTools.warnOnce(logger, "First warning"));
		assertFalse(LogTools.warnOnce(logger, "First warning"));
		assertTrue(LogTools.warnOnce(logger, "Second warning"));
		// Same message at another level is logged separately
		assertTrue(LogTools.logOnce(logger, Level.INFO, "First warning"));
	}

}
