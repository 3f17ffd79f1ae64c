package com.di.neura;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for NeuraDiscoveryApplication.
 */
@DisplayName("NeuraDiscoveryApplication Tests")
class NeuraDiscoveryApplicationTests {

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = NeuraDiscoveryApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}
}
