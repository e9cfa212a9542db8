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

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Logging helpers.
 * <p>
 * Pipeline stages are re-run whenever a parameter changes, so a warning about the input image
 * would otherwise be repeated on every run.
 */
public class LogTools {

	private static final Map<String, Set<String>> emitted = new ConcurrentHashMap<>();

	private LogTools() {
		throw new AssertionError();
	}

	/**
	 * Emit a message unless the same logger has already emitted it at the same level.
	 *
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was emitted now
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		String key = logger.getName() + "/" + level;
		if (!emitted.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(message))
			return false;
		logger.atLevel(level).log(message);
		return true;
	}

	/**
	 * Emit a warning unless the same logger has already emitted it.
	 *
	 * @param logger
	 * @param message
	 * @return true if the warning was emitted now
	 * @see #logOnce(Logger, Level, String)
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}

}
