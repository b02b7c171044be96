package org.metricshub.noeta.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;

import org.junit.Test;
import org.slf4j.Logger;

public class NoetaLoggerTest {

	@Test
	public void testLoggerAndQuietVerbosity() {
		Logger logger = NoetaLogger.getLogger(NoetaLoggerTest.class);
		assertNotNull(logger);
		assertEquals(NoetaLoggerTest.class.getName(), logger.getName());
		assertEquals("ERROR", System.getProperty(NoetaLogger.VERBOSITY_PROPERTY));
	}
}
