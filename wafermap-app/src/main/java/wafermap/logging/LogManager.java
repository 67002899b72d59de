/*-
 * #%L
 * This file is part of WaferMap.
 * %%
 * Copyright (C) 2024 WaferMap developers
 * %%
 * WaferMap is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * WaferMap is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with WaferMap.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package wafermap.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Helper class for managing the root log level with Logback.
 * 
 * @author WaferMap developers
 */
public class LogManager {
	
	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);
	
	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * Log everything
		 */
		ALL,
		/**
		 * Log nothing
		 */
		OFF
	}
	
	private static LogLevel rootLevel = LogLevel.INFO;
	
	// Suppressed default constructor for non-instantiability
	private LogManager() {
		throw new AssertionError();
	}
	
	/**
	 * Set the root log level.
	 * @param level
	 */
	public static synchronized void setRootLogLevel(LogLevel level) {
		rootLevel = level;
		var root = getRootLogger();
		if (root != null)
			root.setLevel(getLevel(level));
		else
			logger.warn("Cannot get root logger - log level {} not applied", level);
	}
	
	/**
	 * Get the root log level, as set by this manager.
	 * This is not guaranteed to match the actual root log level, in case it has been set elsewhere.
	 * @return 
	 */
	public static synchronized LogLevel getRootLogLevel() {
		return rootLevel;
	}
	
	static Level getLevel(LogLevel logLevel) {
		switch(logLevel) {
		case DEBUG:
			return Level.DEBUG;
		case ERROR:
			return Level.ERROR;
		case INFO:
			return Level.INFO;
		case ALL:
			return Level.ALL;
		case OFF:
			return Level.OFF;
		case TRACE:
			return Level.TRACE;
		case WARN:
			return Level.WARN;
		default:
			return Level.INFO;
		}
	}
	
	static ch.qos.logback.classic.Logger getRootLogger() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext)
			return ((LoggerContext)LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
		return null;
	}

}
