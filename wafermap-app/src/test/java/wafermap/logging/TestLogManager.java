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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;
import wafermap.logging.LogManager.LogLevel;

@SuppressWarnings("javadoc")
public class TestLogManager {
	
	@AfterEach
	public void reset() {
		LogManager.setRootLogLevel(LogLevel.INFO);
	}
	
	@Test
	public void test_setRootLogLevel() {
		var root = LogManager.getRootLogger();
		assertNotNull(root);
		LogManager.setRootLogLevel(LogLevel.DEBUG);
		assertEquals(Level.DEBUG, root.getLevel());
		assertEquals(LogLevel.DEBUG, LogManager.getRootLogLevel());
		LogManager.setRootLogLevel(LogLevel.OFF);
		assertEquals(Level.OFF, root.getLevel());
	}
	
	@Test
	public void test_getLevel() {
		for (var level : LogLevel.values())
			assertEquals(level.name(), LogManager.getLevel(level).toString());
	}

}
