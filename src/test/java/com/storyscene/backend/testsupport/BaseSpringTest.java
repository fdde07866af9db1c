package com.storyscene.backend.testsupport;

import org.springframework.test.context.ActiveProfiles;

/**
 * Shared base for Spring tests: always the test profile (H2, stub provider, no schedulers).
 */
@ActiveProfiles("test")
public abstract class BaseSpringTest {
}
